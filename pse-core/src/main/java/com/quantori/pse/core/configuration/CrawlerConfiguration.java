package com.quantori.pse.core.configuration;

import com.quantori.pse.api.ConfigurationException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/** Reads {@link CrawlerProperties} from the {@code pse} section of a Typesafe config. */
@Slf4j
@UtilityClass
public class CrawlerConfiguration {
  public static final String ROOT = "pse";

  public static CrawlerProperties load() {
    return fromConfig(ConfigFactory.load());
  }

  public static CrawlerProperties fromConfig(Config config) {
    try {
      Config pse = config.getConfig(ROOT);
      Config crawler = pse.getConfig("crawler");
      CrawlerProperties properties = CrawlerProperties.builder()
          .systemName(crawler.getString("system-name"))
          .parallelism(crawler.getInt("parallelism"))
          .requestsPerSecond(crawler.getDouble("requests-per-second"))
          .throttlingElements(crawler.getInt("throttling-elements"))
          .throttlingDuration(crawler.getDuration("throttling-duration"))
          .stopOnSinkErrors(crawler.getBoolean("stop-on-sink-errors"))
          .userAgent(crawler.getString("user-agent"))
          .connectTimeout(crawler.getDuration("connect-timeout"))
          .requestTimeout(crawler.getDuration("request-timeout"))
          .retry(retry(pse.getConfig("retry")))
          .sequenceRetry(retry(pse.getConfig("sequence-retry")))
          .vendors(vendors(pse.getConfig("vendors")))
          .build();
      log.debug("Crawler configuration: {}", properties);
      return properties;
    } catch (ConfigException e) {
      throw new ConfigurationException("Invalid crawler configuration: " + e.getMessage(), e);
    }
  }

  private static RetryProperties retry(Config config) {
    return RetryProperties.builder()
        .maxAttempts(config.getInt("max-attempts"))
        .baseDelay(config.getDuration("base-delay"))
        .scale(config.getDuration("scale"))
        .build();
  }

  private static Map<String, VendorProperties> vendors(Config config) {
    Map<String, VendorProperties> vendors = new LinkedHashMap<>();
    for (String tag : config.root().keySet()) {
      Config vendor = config.getConfig(tag);
      vendors.put(tag, VendorProperties.builder()
          .baseUrl(vendor.getString("base-url"))
          .notFoundText(vendor.getString("not-found-text"))
          .nameSelector(vendor.getString("name-selector"))
          .fieldSelector(vendor.getString("field-selector"))
          .sequenceLinkSelector(vendor.getString("sequence-link-selector"))
          .build());
    }
    return vendors;
  }
}
