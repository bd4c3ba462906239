package com.quantori.pse.core.source;

import akka.Done;
import akka.actor.typed.ActorSystem;
import akka.japi.Pair;
import akka.stream.KillSwitches;
import akka.stream.UniqueKillSwitch;
import akka.stream.javadsl.Keep;
import akka.stream.javadsl.Sink;
import akka.stream.javadsl.Source;
import com.quantori.pse.api.PlasmidWriter;
import com.quantori.pse.api.model.Plasmid;
import com.quantori.pse.core.model.BatchResult;
import com.quantori.pse.core.model.CrawlFailure;
import com.quantori.pse.core.model.CrawlOutcome;
import com.quantori.pse.core.model.CrawlStage;
import com.quantori.pse.core.model.CrawlStep;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a list of identifiers through a crawl step and hands assembled records to a writer.
 *
 * <p>Identifiers are processed concurrently up to the step's parallelism, the writer is called from
 * a single stage in identifier order. Every run gets its own {@link BatchResult}.
 */
@Slf4j
public class BatchLoader {
  private final ActorSystem<?> actorSystem;
  private final Executor executor;

  public BatchLoader(ActorSystem<?> actorSystem, Executor executor) {
    this.actorSystem = actorSystem;
    this.executor = executor;
  }

  public BatchRun load(List<Integer> ids, CrawlStep step, PlasmidWriter writer) {
    final var accumulator = new BatchResult.Accumulator();
    final var cancelled = new AtomicBoolean();
    final var killSwitchRef = new AtomicReference<UniqueKillSwitch>();

    Source<Integer, UniqueKillSwitch> source = Source.from(ids).viaMat(KillSwitches.single(), Keep.right());
    if (step.throttlingElements() > 0 && step.throttlingDuration() != null) {
      source = source.throttle(step.throttlingElements(), step.throttlingDuration());
    }
    Source<CrawlOutcome, UniqueKillSwitch> outcomes = source.mapAsync(step.parallelism(),
        id -> CompletableFuture.supplyAsync(() -> step.apply(id), executor)
            .exceptionally(e -> CrawlOutcome.failed(id, CrawlStage.FETCHING, unwrap(e))));

    Sink<CrawlOutcome, CompletionStage<Done>> sink = Sink.foreach(outcome ->
        consume(outcome, writer, step.stopOnSinkErrors(), accumulator, killSwitchRef));

    Pair<UniqueKillSwitch, CompletionStage<Done>> materialized =
        outcomes.toMat(sink, Keep.both()).run(actorSystem);
    killSwitchRef.set(materialized.first());

    CompletionStage<BatchResult> result = materialized.second()
        .handle((done, error) -> {
          if (error != null) {
            log.error("Batch stream failed", error);
            accumulator.abort(unwrap(error));
          }
          flush(writer, accumulator);
          BatchResult batchResult = accumulator.toResult(cancelled.get());
          if (batchResult.getStatistics().isFailed()) {
            log.warn("Batch of {} identifiers finished with failures: {}", ids.size(), batchResult.getStatistics());
          } else {
            log.info("Batch of {} identifiers finished: {}", ids.size(), batchResult.getStatistics());
          }
          return batchResult;
        });
    return new BatchRun(materialized.first(), cancelled, result);
  }

  private void consume(CrawlOutcome outcome, PlasmidWriter writer, boolean stopOnSinkErrors,
                       BatchResult.Accumulator accumulator, AtomicReference<UniqueKillSwitch> killSwitch) {
    switch (outcome.getStatus()) {
      case SKIPPED -> accumulator.skipped(outcome);
      case FAILED -> accumulator.failed(new CrawlFailure(outcome.getId(), outcome.getStage(),
          outcome.getError().orElse(null)));
      case ASSEMBLED -> persist(outcome.getPlasmid().orElseThrow(), writer, stopOnSinkErrors, accumulator,
          killSwitch);
      default -> throw new IllegalStateException("Unexpected outcome status " + outcome.getStatus());
    }
  }

  private void persist(Plasmid plasmid, PlasmidWriter writer, boolean stopOnSinkErrors,
                       BatchResult.Accumulator accumulator, AtomicReference<UniqueKillSwitch> killSwitch) {
    if (accumulator.isAborted()) {
      log.warn("Plasmid {} is not written, the batch was stopped by a sink error", plasmid.getId());
      accumulator.unpersisted(plasmid, accumulator.getAbortCause());
      return;
    }
    try {
      writer.write(plasmid);
      accumulator.persisted(plasmid);
      log.debug("Plasmid {} {}", plasmid.getId(), CrawlStage.PERSISTED);
    } catch (RuntimeException e) {
      log.error("Could not write plasmid {} '{}'", plasmid.getId(), plasmid.getName(), e);
      accumulator.unpersisted(plasmid, e);
      if (stopOnSinkErrors) {
        accumulator.abort(e);
        UniqueKillSwitch current = killSwitch.get();
        if (current != null) {
          current.shutdown();
        }
      }
    }
  }

  private static void flush(PlasmidWriter writer, BatchResult.Accumulator accumulator) {
    try {
      writer.flush();
    } catch (RuntimeException e) {
      log.error("Could not flush the writer", e);
      accumulator.abort(e);
    }
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
