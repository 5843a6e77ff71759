package com.gentoro.jobwatch.auth;

/** Step of the interactive login handshake. */
public enum AuthPhase {
  DISCONNECTED,
  /** Credentials submitted, waiting for the backend (including resource-locked retries). */
  CONNECTING,
  AWAITING_CODE,
  AWAITING_PASSWORD,
  CONNECTED
}
