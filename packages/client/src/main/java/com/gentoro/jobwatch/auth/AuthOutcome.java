package com.gentoro.jobwatch.auth;

/**
 * Result of one auth step.
 *
 * @param phase phase after the step was handled
 * @param error {@code null} on success
 */
public record AuthOutcome(boolean success, AuthPhase phase, AuthErrorKind error, String message) {

  static AuthOutcome ok(AuthPhase phase) {
    return new AuthOutcome(true, phase, null, null);
  }

  static AuthOutcome failed(AuthPhase phase, AuthErrorKind error, String message) {
    return new AuthOutcome(false, phase, error, message);
  }
}
