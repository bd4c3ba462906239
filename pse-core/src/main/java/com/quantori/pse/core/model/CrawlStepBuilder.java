package com.quantori.pse.core.model;

import java.time.Duration;
import java.util.function.IntFunction;

public class CrawlStepBuilder {
  private final IntFunction<CrawlOutcome> step;
  private int parallelism = CrawlStep.DEFAULT_PARALLELISM;
  private int throttlingElements = CrawlStep.DEFAULT_THROTTLING_ELEMENTS;
  private Duration throttlingDuration = CrawlStep.DEFAULT_THROTTLING_DURATION;
  private boolean stopOnSinkErrors;

  private CrawlStepBuilder(IntFunction<CrawlOutcome> step) {
    this.step = step;
  }

  public static CrawlStepBuilder builder(IntFunction<CrawlOutcome> step) {
    return new CrawlStepBuilder(step);
  }

  public CrawlStepBuilder withParallelism(int parallelism) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
    }
    this.parallelism = parallelism;
    return this;
  }

  public CrawlStepBuilder withThrottling(int throttlingElements, Duration throttlingDuration) {
    this.throttlingElements = throttlingElements;
    this.throttlingDuration = throttlingDuration;
    return this;
  }

  public CrawlStepBuilder withStopOnSinkErrors(boolean stopOnSinkErrors) {
    this.stopOnSinkErrors = stopOnSinkErrors;
    return this;
  }

  public CrawlStep build() {
    final var that = this;

    return new CrawlStep() {
      @Override
      public CrawlOutcome apply(int id) {
        return step.apply(id);
      }

      @Override
      public int parallelism() {
        return that.parallelism;
      }

      @Override
      public int throttlingElements() {
        return that.throttlingElements;
      }

      @Override
      public Duration throttlingDuration() {
        return that.throttlingDuration;
      }

      @Override
      public boolean stopOnSinkErrors() {
        return that.stopOnSinkErrors;
      }
    };
  }
}
