package com.gentoro.jobwatch.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, loggable view of a failure. */
public record ErrorDetails(
    String type,
    String message,
    JobWatchErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
