package com.polybot.finder.polymarket.http;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds GET requests against one base URI with the timeout and headers every Gamma call shares.
 */
public final class HttpRequestFactory {

  private final URI baseUri;
  private final Duration timeout;
  private final String userAgent;

  public HttpRequestFactory(URI baseUri, Duration timeout, String userAgent) {
    this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
  }

  public HttpRequest get(String path, Map<String, String> query) {
    return HttpRequest.newBuilder(buildUri(path, query))
        .GET()
        .timeout(timeout)
        .header("Accept", "application/json")
        .header("User-Agent", userAgent)
        .build();
  }

  URI buildUri(String path, Map<String, String> query) {
    StringBuilder sb = new StringBuilder(baseUri.toString());
    if (sb.length() > 0 && sb.charAt(sb.length() - 1) == '/' && path.startsWith("/")) {
      sb.setLength(sb.length() - 1);
    }
    sb.append(path);

    if (query != null && !query.isEmpty()) {
      sb.append('?');
      sb.append(query.entrySet().stream()
          .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
          .collect(Collectors.joining("&")));
    }
    return URI.create(sb.toString());
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
