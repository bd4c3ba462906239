package com.quantori.pse.core.model;

import lombok.Value;

@Value
public class PipelineStatistics {
  public static final PipelineStatistics EMPTY = new PipelineStatistics(0, 0, 0);

  int countOfPersisted;
  int countOfSkipped;
  int countOfFailed;

  public boolean isFailed() {
    return countOfFailed != 0;
  }

  public PipelineStatistics plus(PipelineStatistics other) {
    return new PipelineStatistics(countOfPersisted + other.countOfPersisted,
        countOfSkipped + other.countOfSkipped, countOfFailed + other.countOfFailed);
  }
}
