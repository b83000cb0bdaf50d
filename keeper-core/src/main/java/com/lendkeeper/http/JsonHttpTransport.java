package com.lendkeeper.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Sends JSON requests and maps the body. Non-2xx responses surface as {@link HttpTransportException}.
 */
@Slf4j
public class JsonHttpTransport {

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RequestRateLimiter rateLimiter;

  public JsonHttpTransport(@NonNull HttpClient httpClient, @NonNull ObjectMapper objectMapper) {
    this(httpClient, objectMapper, RequestRateLimiter.noop());
  }

  public JsonHttpTransport(
      @NonNull HttpClient httpClient,
      @NonNull ObjectMapper objectMapper,
      @NonNull RequestRateLimiter rateLimiter
  ) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.rateLimiter = rateLimiter;
  }

  public ObjectMapper objectMapper() {
    return objectMapper;
  }

  public JsonHttpTransport withRateLimiter(RequestRateLimiter limiter) {
    return new JsonHttpTransport(httpClient, objectMapper, limiter);
  }

  public <T> T sendJson(HttpRequest request, Class<T> type) {
    rateLimiter.acquire();
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new HttpTransportException("%s %s failed: %s".formatted(request.method(), request.uri().getHost(), e), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HttpTransportException("interrupted calling " + request.uri().getHost(), e);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new HttpTransportException(
          "%s %s returned HTTP %d".formatted(request.method(), request.uri().getPath(), status), status);
    }

    String body = response.body();
    try {
      return objectMapper.readValue(body == null || body.isBlank() ? "null" : body, type);
    } catch (IOException e) {
      throw new HttpTransportException("failed parsing response from " + request.uri().getHost(), e);
    }
  }
}
