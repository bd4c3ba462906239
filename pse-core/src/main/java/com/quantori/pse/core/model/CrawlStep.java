package com.quantori.pse.core.model;

import java.time.Duration;

/**
 * Processing of one identifier together with the settings of the stream stage that runs it. The
 * step must not throw, failures are reported as {@link CrawlOutcome#failed} outcomes.
 */
@FunctionalInterface
public interface CrawlStep {
  int DEFAULT_PARALLELISM = 1;
  int DEFAULT_THROTTLING_ELEMENTS = 0;
  Duration DEFAULT_THROTTLING_DURATION = Duration.ofSeconds(1);

  CrawlOutcome apply(int id);

  default int parallelism() {
    return DEFAULT_PARALLELISM;
  }

  default int throttlingElements() {
    return DEFAULT_THROTTLING_ELEMENTS;
  }

  default Duration throttlingDuration() {
    return DEFAULT_THROTTLING_DURATION;
  }

  /** Whether a rejected write stops the run. */
  default boolean stopOnSinkErrors() {
    return false;
  }
}
