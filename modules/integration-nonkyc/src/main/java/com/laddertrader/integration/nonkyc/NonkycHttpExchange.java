package com.laddertrader.integration.nonkyc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Request building and response classification shared by the sync and async clients, so every
 * operation maps failures to the same exception types.
 */
public class NonkycHttpExchange {
  private final ObjectMapper objectMapper;
  private final NonkycApiConfig config;
  private final NonkycRequestSigner signer;
  private final NonceGenerator nonceGenerator;
  private final RetryAfterParser retryAfterParser;

  public NonkycHttpExchange(
      ObjectMapper objectMapper,
      NonkycApiConfig config,
      NonkycRequestSigner signer,
      NonceGenerator nonceGenerator,
      RetryAfterParser retryAfterParser) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.config = Objects.requireNonNull(config, "config is required");
    this.signer = Objects.requireNonNull(signer, "signer is required");
    this.nonceGenerator = Objects.requireNonNull(nonceGenerator, "nonceGenerator is required");
    this.retryAfterParser = Objects.requireNonNull(retryAfterParser, "retryAfterParser is required");
  }

  /** Builds a fresh HTTP request; each attempt gets its own nonce. */
  public HttpRequest build(NonkycRequest request) {
    String url = config.resolve(request.path());
    HttpRequest.Builder builder = HttpRequest.newBuilder().timeout(config.timeout());
    String requestUrl;
    String payload;
    if (request.signed()) {
      SignedRequest signed =
          signer.sign(
              request.method(),
              url,
              request.query(),
              request.body(),
              config.credentials(),
              nonceGenerator.next());
      signed.headers(config.credentials()).forEach(builder::header);
      requestUrl = signed.url();
      payload = signed.body();
    } else {
      String query = NonkycRequestSigner.canonicalQuery(request.query());
      requestUrl = query.isEmpty() ? url : url + "?" + query;
      payload = request.body().isEmpty() ? null : signer.serializeBody(request.body());
    }
    builder.uri(URI.create(requestUrl));
    if ("GET".equals(request.method())) {
      builder.GET();
    } else if (payload == null) {
      builder.method(request.method(), HttpRequest.BodyPublishers.noBody());
    } else {
      builder
          .header(NonkycHeaders.CONTENT_TYPE, NonkycHeaders.JSON)
          .method(request.method(), HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8));
    }
    return builder.build();
  }

  /** Returns the unwrapped payload of a 2xx response or throws the mapped exception. */
  public JsonNode handle(NonkycRequest request, HttpResponse<String> response) {
    int status = response.statusCode();
    String body = response.body() == null ? "" : response.body();
    if (status >= 200 && status < 300) {
      return NonkycResponseParser.unwrap(parseJson(request, body));
    }
    if (status == 401) {
      throw new AuthenticationException(request.operation(), status, body);
    }
    if (status == 429) {
      String header = response.headers().firstValue(NonkycHeaders.RETRY_AFTER).orElse(null);
      throw new RateLimitException(
          request.operation(), body, header, retryAfterParser.parse(header).orElse(null));
    }
    if (status >= 500) {
      throw new TransientApiException(request.operation(), status, body);
    }
    throw new ValidationException(request.operation(), status, body, venueMessage(body));
  }

  /** Maps a failure raised before any response arrived. */
  public NonkycApiException translate(NonkycRequest request, Throwable error) {
    Throwable cause = unwrap(error);
    if (cause instanceof NonkycApiException apiException) {
      return apiException;
    }
    if (cause instanceof IOException) {
      return new TransientApiException(request.operation(), describe(cause), cause);
    }
    if (cause instanceof InterruptedException) {
      Thread.currentThread().interrupt();
      return new TransientApiException(request.operation(), "request interrupted", cause);
    }
    if (cause instanceof RuntimeException runtime) {
      throw runtime;
    }
    throw new IllegalStateException("Unexpected NonKYC client failure", cause);
  }

  private JsonNode parseJson(NonkycRequest request, String body) {
    if (body.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(body);
    } catch (IOException ex) {
      throw new TransientApiException(request.operation(), "unparseable response body", ex);
    }
  }

  private String venueMessage(String body) {
    try {
      String message = NonkycResponseParser.errorMessage(objectMapper.readTree(body));
      return message == null ? compact(body) : message;
    } catch (IOException | RuntimeException ex) {
      return compact(body);
    }
  }

  private static String compact(String body) {
    String compact = body.replaceAll("\\s+", " ").trim();
    return compact.length() <= 300 ? compact : compact.substring(0, 300);
  }

  private static String describe(Throwable error) {
    String message = error.getMessage();
    return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
