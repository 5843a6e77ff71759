package com.gentoro.jobwatch.transport;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.jobwatch.config.EndpointPaths;
import com.gentoro.jobwatch.config.TransportSettings;
import com.gentoro.jobwatch.exception.ConfigurationException;
import com.gentoro.jobwatch.exception.ExceptionUtil;
import com.gentoro.jobwatch.model.Credentials;
import com.gentoro.jobwatch.model.OperationClass;
import com.gentoro.jobwatch.model.ProgressSnapshot;
import com.gentoro.jobwatch.utility.JacksonUtility;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

/**
 * {@link Transport} over the worker's HTTP/JSON API. Calls are dispatched asynchronously on
 * OkHttp's dispatcher; each returned future completes on an OkHttp thread.
 */
public class HttpTransport implements Transport {
  private static final Logger log =
      com.gentoro.jobwatch.logging.LoggingService.getLogger(HttpTransport.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient client;
  private final HttpUrl baseUrl;
  private final EndpointPaths paths;
  private final ResponseNormalizer normalizer;

  public HttpTransport(TransportSettings settings) {
    this(OkHttpFactory.create(settings), settings, new ResponseNormalizer());
  }

  public HttpTransport(
      OkHttpClient client, TransportSettings settings, ResponseNormalizer normalizer) {
    this.client = client;
    this.baseUrl = HttpUrl.parse(settings.baseUrl());
    if (this.baseUrl == null) {
      throw new ConfigurationException("Invalid transport.base-url: " + settings.baseUrl());
    }
    this.paths = settings.paths();
    this.normalizer = normalizer;
  }

  @Override
  public CompletableFuture<TransportResult<String>> start(
      OperationClass operationClass, StartRequest request) {
    if (!operationClass.isPolled()) {
      throw new IllegalArgumentException("Use connect() for " + operationClass);
    }
    ObjectNode body = JacksonUtility.createObjectNode();
    for (Map.Entry<String, Object> parameter : request.parameters().entrySet()) {
      body.set(parameter.getKey(), JacksonUtility.getJsonMapper().valueToTree(parameter.getValue()));
    }
    ArrayNode items = body.putArray(operationClass.itemsField());
    request.itemPaths().forEach(items::add);
    if (request.requestedId() != null) {
      body.put("process_id", request.requestedId());
    }
    return post(
        paths.startPath(operationClass),
        body,
        responseBody -> normalizer.operationId(responseBody, request.requestedId()));
  }

  @Override
  public CompletableFuture<TransportResult<ProgressSnapshot>> progress(String operationId) {
    Request request = new Request.Builder().url(progressUrl(operationId)).get().build();
    return execute(request, normalizer::progress);
  }

  @Override
  public CompletableFuture<TransportResult<Void>> pause(String operationId) {
    return post(paths.pause(), processBody(operationId), normalizer::ack);
  }

  @Override
  public CompletableFuture<TransportResult<Void>> resume(String operationId) {
    return post(paths.resume(), processBody(operationId), normalizer::ack);
  }

  @Override
  public CompletableFuture<TransportResult<Void>> stop(String operationId) {
    return post(paths.stop(), processBody(operationId), normalizer::ack);
  }

  @Override
  public CompletableFuture<TransportResult<AuthResponse>> connect(Credentials credentials) {
    ObjectNode body = JacksonUtility.createObjectNode();
    body.put("api_id", credentials.apiId());
    body.put("api_hash", credentials.apiHash());
    body.put("phone_number", credentials.phoneNumber());
    body.put("process_id", "connect_" + System.currentTimeMillis());
    return post(paths.connect(), body, normalizer::auth);
  }

  @Override
  public CompletableFuture<TransportResult<AuthResponse>> verifyCode(String code) {
    ObjectNode body = JacksonUtility.createObjectNode();
    body.put("code", code);
    return post(paths.verifyCode(), body, normalizer::auth);
  }

  @Override
  public CompletableFuture<TransportResult<AuthResponse>> verifyPassword(String password) {
    ObjectNode body = JacksonUtility.createObjectNode();
    body.put("password", password);
    return post(paths.verifyPassword(), body, normalizer::auth);
  }

  @Override
  public CompletableFuture<TransportResult<Void>> cleanupSession() {
    return post(paths.cleanupSession(), JacksonUtility.createObjectNode(), normalizer::ack);
  }

  @Override
  public CompletableFuture<TransportResult<Void>> health() {
    Request request = new Request.Builder().url(url(paths.health())).get().build();
    return execute(request, normalizer::ack);
  }

  private static ObjectNode processBody(String operationId) {
    ObjectNode body = JacksonUtility.createObjectNode();
    body.put("process_id", operationId);
    return body;
  }

  /** The id is opaque: it goes in as one encoded path segment. */
  private HttpUrl progressUrl(String operationId) {
    String template = paths.progress();
    int at = template.indexOf(EndpointPaths.ID_PLACEHOLDER);
    if (at < 0) {
      return url(template).newBuilder().addPathSegment(operationId).build();
    }
    HttpUrl.Builder builder =
        url(template.substring(0, at)).newBuilder().addPathSegment(operationId);
    String rest = template.substring(at + EndpointPaths.ID_PLACEHOLDER.length());
    if (rest.startsWith("/")) rest = rest.substring(1);
    if (!rest.isEmpty()) builder.addPathSegments(rest);
    return builder.build();
  }

  private HttpUrl url(String path) {
    HttpUrl resolved = baseUrl.resolve(path);
    if (resolved == null) {
      throw new ConfigurationException("Cannot resolve endpoint path '" + path + "'");
    }
    return resolved;
  }

  private <T> CompletableFuture<TransportResult<T>> post(
      String path, ObjectNode body, Function<String, TransportResult<T>> parser) {
    Request request =
        new Request.Builder()
            .url(url(path))
            .post(RequestBody.create(JacksonUtility.toJson(body), JSON))
            .build();
    return execute(request, parser);
  }

  private <T> CompletableFuture<TransportResult<T>> execute(
      Request request, Function<String, TransportResult<T>> parser) {
    CompletableFuture<TransportResult<T>> future = new CompletableFuture<>();
    Call call = client.newCall(request);
    future.whenComplete(
        (r, t) -> {
          if (future.isCancelled()) call.cancel();
        });
    call.enqueue(
        new Callback() {
          @Override
          public void onFailure(@NotNull Call call, @NotNull IOException e) {
            future.complete(
                TransportResult.failure(
                    TransportError.network(ExceptionUtil.extractErrorMessage(e))));
          }

          @Override
          public void onResponse(@NotNull Call call, @NotNull Response response) {
            try (response) {
              ResponseBody responseBody = response.body();
              String text = responseBody == null ? "" : responseBody.string();
              if (!response.isSuccessful()) {
                String message =
                    normalizer.errorMessage(text, "HTTP " + response.code() + " " + response.message());
                future.complete(
                    TransportResult.failure(
                        new TransportError(
                            TransportError.Kind.HTTP_STATUS, message, response.code())));
                return;
              }
              future.complete(parser.apply(text));
            } catch (IOException e) {
              future.complete(
                  TransportResult.failure(
                      TransportError.network(ExceptionUtil.extractErrorMessage(e))));
            } catch (RuntimeException e) {
              log.error("Unexpected failure handling response of {}", request.url(), e);
              future.complete(
                  TransportResult.failure(
                      TransportError.malformed(ExceptionUtil.extractErrorMessage(e))));
            }
          }
        });
    return future;
  }
}
