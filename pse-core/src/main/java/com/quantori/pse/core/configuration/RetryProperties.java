package com.quantori.pse.core.configuration;

import java.time.Duration;
import lombok.Builder;
import lombok.Data;

@Builder
@Data
public class RetryProperties {
  int maxAttempts;
  Duration baseDelay;
  Duration scale;
}
