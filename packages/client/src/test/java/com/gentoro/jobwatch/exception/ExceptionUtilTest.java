package com.gentoro.jobwatch.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  @DisplayName("error details keep the code and context of application exceptions")
  void errorDetails() {
    var ex = new StateException("bad move").withContext("operationId", "op-1");

    ErrorDetails details = ExceptionUtil.toErrorDetails(new CompletionException(ex));

    assertEquals("StateException", details.type());
    assertEquals(JobWatchErrorCode.STATE_ERROR, details.code());
    assertEquals("op-1", details.context().get("operationId"));
    assertEquals(
        JobWatchErrorCode.UNKNOWN,
        ExceptionUtil.toErrorDetails(new IllegalStateException("x")).code());
  }

  @Test
  @DisplayName("the first meaningful message in the cause chain is extracted")
  void extractMessage() {
    var wrapped = new CompletionException(new RuntimeException(null, new IOException("reset")));

    assertEquals("IOException: reset", ExceptionUtil.extractErrorMessage(wrapped));
    assertEquals("Unknown error", ExceptionUtil.extractErrorMessage(null));
    assertEquals(
        "IllegalStateException", ExceptionUtil.extractErrorMessage(new IllegalStateException()));
  }

  @Test
  @DisplayName("compact traces are limited to the requested frames")
  void compactTrace() {
    String trace = ExceptionUtil.formatCompactStackTrace(new RuntimeException("x"), 2);

    assertEquals(2, trace.split(" > ").length);
    assertTrue(trace.startsWith(ExceptionUtilTest.class.getName() + ".compactTrace"));
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null));
  }
}
