package com.gentoro.jobwatch.transport;

/** Normalized successful answer of an auth step. */
public record AuthResponse(boolean needsCode, boolean needsPassword) {

  public static AuthResponse authenticated() {
    return new AuthResponse(false, false);
  }
}
