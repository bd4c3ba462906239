package com.quantori.pse.core.source;

import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.Behaviors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.quantori.pse.api.PlasmidWriter;
import com.quantori.pse.core.configuration.CrawlerConfiguration;
import com.quantori.pse.core.configuration.CrawlerProperties;
import com.quantori.pse.core.extract.FieldExtractor;
import com.quantori.pse.core.fetch.DocumentFetcher;
import com.quantori.pse.core.fetch.HttpTransport;
import com.quantori.pse.core.model.BatchResult;
import com.quantori.pse.core.model.CrawlOutcome;
import com.quantori.pse.core.model.CrawlStep;
import com.quantori.pse.core.model.CrawlStepBuilder;
import com.quantori.pse.core.model.PipelineStatistics;
import com.quantori.pse.core.retry.RetryPolicy;
import com.quantori.pse.core.retry.Sleeper;
import com.quantori.pse.core.sequence.SequenceResolver;
import com.quantori.pse.core.vendor.VendorRegistry;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the crawler. Owns the worker pool and, unless one is passed in, the actor system
 * that runs the batch streams; both are released by {@link #close()}.
 */
@Slf4j
public class PlasmidCrawlService implements AutoCloseable {
  private final CrawlerProperties properties;
  private final ActorSystem<?> actorSystem;
  private final boolean ownsActorSystem;
  private final ExecutorService executor;
  private final VendorRegistry vendors;
  private final PlasmidCrawler crawler;
  private final BatchLoader loader;

  public PlasmidCrawlService() {
    this(CrawlerConfiguration.load());
  }

  public PlasmidCrawlService(CrawlerProperties properties) {
    this(properties, ActorSystem.create(Behaviors.empty(), properties.getSystemName()), true,
        HttpTransport.create(properties), Sleeper.THREAD);
  }

  /** Runs on an actor system owned by the caller. */
  public PlasmidCrawlService(CrawlerProperties properties, ActorSystem<?> actorSystem, Sleeper sleeper) {
    this(properties, actorSystem, false, HttpTransport.create(properties), sleeper);
  }

  PlasmidCrawlService(CrawlerProperties properties, ActorSystem<?> actorSystem, boolean ownsActorSystem,
                      HttpTransport transport, Sleeper sleeper) {
    this.properties = properties;
    this.actorSystem = actorSystem;
    this.ownsActorSystem = ownsActorSystem;
    this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getParallelism()),
        new ThreadFactoryBuilder().setNameFormat("pse-crawler-%d").setDaemon(true).build());
    this.vendors = VendorRegistry.fromProperties(properties.getVendors());
    RetryPolicy retryPolicy = RetryPolicy.of(properties.getRetry(), sleeper);
    this.crawler = new PlasmidCrawler(
        new DocumentFetcher(transport, vendors),
        new FieldExtractor(retryPolicy),
        new SequenceResolver(transport, RetryPolicy.of(properties.getSequenceRetry(), sleeper)),
        retryPolicy);
    this.loader = new BatchLoader(actorSystem, executor);
  }

  public VendorRegistry getVendors() {
    return vendors;
  }

  /** Processes one identifier without persisting it. */
  public CrawlOutcome crawlOne(String vendorTag, int id) {
    return crawler.crawl(vendorTag, id);
  }

  /** Starts a batch and returns at once. */
  public BatchRun start(String vendorTag, List<Integer> ids, PlasmidWriter writer) {
    log.info("Starting batch of {} '{}' identifiers", ids.size(), vendorTag);
    return loader.load(ids, step(vendorTag), writer);
  }

  /** Runs a batch to completion. */
  public BatchResult crawl(String vendorTag, List<Integer> ids, PlasmidWriter writer) {
    return start(vendorTag, ids, writer).result().toCompletableFuture().join();
  }

  /**
   * Walks {@code [firstId, lastIdExclusive)} in consecutive batches of {@code step} identifiers, one
   * batch at a time. Stops early when a batch is aborted by a sink error.
   */
  public PipelineStatistics scan(String vendorTag, int firstId, int lastIdExclusive, int step,
                                 PlasmidWriter writer) {
    if (step < 1) {
      throw new IllegalArgumentException("step must be positive: " + step);
    }
    PipelineStatistics statistics = PipelineStatistics.EMPTY;
    for (int start = firstId; start < lastIdExclusive; start += step) {
      int end = (int) Math.min((long) start + step, lastIdExclusive);
      List<Integer> ids = IntStream.range(start, end).boxed().toList();
      BatchResult result = crawl(vendorTag, ids, writer);
      statistics = statistics.plus(result.getStatistics());
      log.info("Scanned {}..{}: {}, total {}", start, end - 1, result.getStatistics(), statistics);
      if (result.getAbortCause().isPresent()) {
        log.error("Scan stopped at {}", start, result.getAbortCause().get());
        break;
      }
      if (end == lastIdExclusive) {
        break;
      }
    }
    return statistics;
  }

  @Override
  public void close() {
    executor.shutdown();
    if (ownsActorSystem) {
      actorSystem.terminate();
    }
  }

  private CrawlStep step(String vendorTag) {
    return CrawlStepBuilder.builder(id -> crawler.crawl(vendorTag, id))
        .withParallelism(Math.max(1, properties.getParallelism()))
        .withThrottling(properties.getThrottlingElements(), properties.getThrottlingDuration())
        .withStopOnSinkErrors(properties.isStopOnSinkErrors())
        .build();
  }
}
