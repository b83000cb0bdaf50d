package com.lendkeeper.http;

import lombok.NonNull;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

public final class HttpRequestFactory {

  private final URI baseUri;

  public HttpRequestFactory(@NonNull URI baseUri) {
    String raw = baseUri.toString();
    this.baseUri = raw.endsWith("/") ? URI.create(raw.substring(0, raw.length() - 1)) : baseUri;
  }

  public HttpRequest.Builder request(String path, Map<String, String> query) {
    return HttpRequest.newBuilder(uri(path, query));
  }

  public URI uri(String path, Map<String, String> query) {
    StringBuilder sb = new StringBuilder(baseUri.toString());
    if (path != null && !path.isEmpty()) {
      if (!path.startsWith("/")) {
        sb.append('/');
      }
      sb.append(path);
    }
    if (query != null && !query.isEmpty()) {
      StringJoiner joiner = new StringJoiner("&", "?", "");
      query.forEach((k, v) -> {
        if (v != null) {
          joiner.add(encode(k) + "=" + encode(v));
        }
      });
      sb.append(joiner);
    }
    return URI.create(sb.toString());
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
