package com.quantori.pse.core;

import com.quantori.pse.core.configuration.CrawlerProperties;
import com.quantori.pse.core.configuration.RetryProperties;
import com.quantori.pse.core.configuration.VendorProperties;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

public final class Fixtures {

  private Fixtures() {
  }

  public static byte[] bytes(String name) {
    try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
      if (in == null) {
        throw new IllegalArgumentException("No fixture " + name);
      }
      return in.readAllBytes();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static String text(String name) {
    return new String(bytes(name), StandardCharsets.UTF_8);
  }

  public static Document document(String name, String baseUri) {
    return Jsoup.parse(text(name), baseUri);
  }

  public static VendorProperties addgene(String baseUrl) {
    return VendorProperties.builder()
        .baseUrl(baseUrl)
        .notFoundText("Page Not Found")
        .nameSelector("span.material-name")
        .fieldSelector("li.field")
        .sequenceLinkSelector("a.genbank-file-download[href]")
        .build();
  }

  public static RetryProperties retry(int maxAttempts) {
    return RetryProperties.builder()
        .maxAttempts(maxAttempts)
        .baseDelay(Duration.ofMillis(10))
        .scale(Duration.ofMillis(5))
        .build();
  }

  public static CrawlerProperties crawler(String baseUrl) {
    return CrawlerProperties.builder()
        .systemName("pse-test-system")
        .parallelism(2)
        .requestsPerSecond(1000)
        .throttlingElements(0)
        .throttlingDuration(Duration.ofSeconds(1))
        .stopOnSinkErrors(false)
        .userAgent("Mozilla/5.0")
        .connectTimeout(Duration.ofSeconds(5))
        .requestTimeout(Duration.ofSeconds(5))
        .retry(retry(3))
        .sequenceRetry(retry(2))
        .vendors(Map.of("addgene", addgene(baseUrl)))
        .build();
  }
}
