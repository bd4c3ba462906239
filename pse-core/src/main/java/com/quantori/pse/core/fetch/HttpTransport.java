package com.quantori.pse.core.fetch;

import com.google.common.util.concurrent.RateLimiter;
import com.quantori.pse.api.TransportException;
import com.quantori.pse.core.configuration.CrawlerProperties;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues GET requests to a vendor site. Every request, whoever sends it, first passes one shared
 * rate limiter so the total request rate stays bounded regardless of the number of workers.
 */
@Slf4j
public class HttpTransport {
  private static final int NOT_FOUND = 404;

  private final HttpClient client;
  private final RateLimiter rateLimiter;
  private final String userAgent;
  private final Duration requestTimeout;

  public HttpTransport(HttpClient client, RateLimiter rateLimiter, String userAgent, Duration requestTimeout) {
    this.client = Objects.requireNonNull(client);
    this.rateLimiter = Objects.requireNonNull(rateLimiter);
    this.userAgent = userAgent;
    this.requestTimeout = requestTimeout;
  }

  public static HttpTransport create(CrawlerProperties properties) {
    HttpClient client = HttpClient.newBuilder()
        .connectTimeout(properties.getConnectTimeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
    return new HttpTransport(client, RateLimiter.create(properties.getRequestsPerSecond()),
        properties.getUserAgent(), properties.getRequestTimeout());
  }

  /**
   * Fetches a page as text. A 404 answer is returned as a page too, vendors render their "not
   * found" message into it.
   */
  public String getText(URI uri) {
    return send(uri, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)).body();
  }

  public byte[] getBytes(URI uri) {
    return send(uri, HttpResponse.BodyHandlers.ofByteArray()).body();
  }

  private <T> HttpResponse<T> send(URI uri, HttpResponse.BodyHandler<T> bodyHandler) {
    HttpRequest request = HttpRequest.newBuilder(uri)
        .timeout(requestTimeout)
        .header("User-Agent", userAgent)
        .GET()
        .build();
    double waited = rateLimiter.acquire();
    if (waited > 0) {
      log.trace("Waited {}s for a request permit", waited);
    }
    HttpResponse<T> response;
    try {
      response = client.send(request, bodyHandler);
    } catch (IOException e) {
      throw new TransportException("GET " + uri + " failed: " + e.getMessage(), e, true);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException("GET " + uri + " was interrupted", e, false);
    }
    int status = response.statusCode();
    log.debug("GET {} -> {}", uri, status);
    if (isSuccessful(status) || status == NOT_FOUND) {
      return response;
    }
    throw TransportException.forStatus(uri.toString(), status, isTransientStatus(status));
  }

  private static boolean isSuccessful(int status) {
    return status >= 200 && status < 300;
  }

  static boolean isTransientStatus(int status) {
    return status == 408 || status == 425 || status == 429 || status >= 500;
  }
}
