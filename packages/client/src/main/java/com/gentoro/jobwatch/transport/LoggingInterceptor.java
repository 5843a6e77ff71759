package com.gentoro.jobwatch.transport;

import java.io.IOException;
import java.util.regex.Pattern;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/**
 * Logs every worker call at debug level and failures at warn level. Secrets in JSON bodies are
 * masked before they reach the log.
 */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.jobwatch.logging.LoggingService.getLogger(LoggingInterceptor.class);

  private static final Pattern SECRET_FIELDS =
      Pattern.compile("(\"(?:password|code|api_hash)\"\\s*:\\s*)\"[^\"]*\"");

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug("-> {} {} {}", request.method(), request.url(), mask(bodyToString(request)));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (java.net.SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsed(startTime));
      throw e;
    } catch (java.net.ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsed(startTime),
          e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsed(startTime),
          e.getMessage());
      throw e;
    }

    if (log.isDebugEnabled()) {
      log.debug(
          "<- {} {} in {} ms", response.code(), response.request().url(), elapsed(startTime));
    }
    if (log.isTraceEnabled()) {
      ResponseBody peeked = response.peekBody(64 * 1024);
      log.trace("Response body: {}", mask(peeked.string()));
    }
    return response;
  }

  static String mask(String body) {
    if (body == null || body.isEmpty()) return "";
    return SECRET_FIELDS.matcher(body).replaceAll("$1\"***\"");
  }

  private static long elapsed(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
