package com.quantori.pse.core.source;

import akka.stream.UniqueKillSwitch;
import com.quantori.pse.core.model.BatchResult;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/** Handle of a running batch. */
@Slf4j
public class BatchRun {
  private final UniqueKillSwitch killSwitch;
  private final AtomicBoolean cancelled;
  private final CompletionStage<BatchResult> result;

  BatchRun(UniqueKillSwitch killSwitch, AtomicBoolean cancelled, CompletionStage<BatchResult> result) {
    this.killSwitch = killSwitch;
    this.cancelled = cancelled;
    this.result = result;
  }

  /**
   * Stops taking new identifiers. Identifiers already in flight are finished and their records
   * are kept in the result.
   */
  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      log.info("Batch cancelled, draining identifiers in flight");
      killSwitch.shutdown();
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** Completes when the last in-flight identifier is accounted for. Never completes exceptionally. */
  public CompletionStage<BatchResult> result() {
    return result;
  }
}
