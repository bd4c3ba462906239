package com.quantori.pse.core.configuration;

import java.time.Duration;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

@Builder
@Data
public class CrawlerProperties {
  String systemName;
  int parallelism;
  double requestsPerSecond;
  int throttlingElements;
  Duration throttlingDuration;
  boolean stopOnSinkErrors;
  String userAgent;
  Duration connectTimeout;
  Duration requestTimeout;
  RetryProperties retry;
  RetryProperties sequenceRetry;
  Map<String, VendorProperties> vendors;
}
