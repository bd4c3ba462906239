package com.quantori.pse.core.configuration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasKey;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.quantori.pse.api.ConfigurationException;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class CrawlerConfigurationTest {

  @Test
  void loadsReferenceDefaults() {
    CrawlerProperties properties = CrawlerConfiguration.load();

    assertEquals("pse-test-system", properties.getSystemName());
    assertEquals(4, properties.getParallelism());
    assertEquals("Mozilla/5.0", properties.getUserAgent());
    assertFalse(properties.isStopOnSinkErrors());
    assertEquals(623, properties.getRetry().getMaxAttempts());
    assertEquals(Duration.ofSeconds(60), properties.getRetry().getBaseDelay());
    assertEquals(Duration.ofSeconds(10), properties.getRetry().getScale());
    assertEquals(3, properties.getSequenceRetry().getMaxAttempts());
    assertThat(properties.getVendors(), hasKey("addgene"));
    assertEquals("Page Not Found", properties.getVendors().get("addgene").getNotFoundText());
  }

  @Test
  void overridesTakePrecedence() {
    CrawlerProperties properties = CrawlerConfiguration.fromConfig(
        ConfigFactory.parseString("pse.crawler.parallelism = 8\npse.retry.max-attempts = 5")
            .withFallback(ConfigFactory.load()));

    assertEquals(8, properties.getParallelism());
    assertEquals(5, properties.getRetry().getMaxAttempts());
  }

  @Test
  void invalidValueIsReported() {
    assertThrows(ConfigurationException.class, () -> CrawlerConfiguration.fromConfig(
        ConfigFactory.parseString("pse.crawler.parallelism = many").withFallback(ConfigFactory.load())));
  }
}
