package com.gentoro.jobwatch.auth;

@FunctionalInterface
public interface AuthPhaseListener {
  void onPhaseChange(AuthPhase previous, AuthPhase current);
}
