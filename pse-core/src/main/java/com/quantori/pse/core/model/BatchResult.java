package com.quantori.pse.core.model;

import com.quantori.pse.api.model.Plasmid;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/**
 * Everything one batch run produced. The instance belongs to the run that created it, concurrent or
 * repeated runs never share results.
 */
@Getter
@ToString
public class BatchResult {
  /** Assembled records in identifier order, including the ones the sink rejected. */
  private final List<Plasmid> records;
  /** Records that were assembled but could not be persisted. */
  private final List<Plasmid> unpersisted;
  private final List<CrawlOutcome> skipped;
  private final List<CrawlFailure> failures;
  private final boolean cancelled;
  private final Throwable abortCause;

  public BatchResult(List<Plasmid> records, List<Plasmid> unpersisted, List<CrawlOutcome> skipped,
                     List<CrawlFailure> failures, boolean cancelled, Throwable abortCause) {
    this.records = List.copyOf(records);
    this.unpersisted = List.copyOf(unpersisted);
    this.skipped = List.copyOf(skipped);
    this.failures = List.copyOf(failures);
    this.cancelled = cancelled;
    this.abortCause = abortCause;
  }

  public static BatchResult empty() {
    return new BatchResult(List.of(), List.of(), List.of(), List.of(), false, null);
  }

  public PipelineStatistics getStatistics() {
    return new PipelineStatistics(records.size() - unpersisted.size(), skipped.size(), failures.size());
  }

  /**
   * Records by name. When several identifiers resolve to the same name the one processed last
   * wins.
   */
  public Map<String, Plasmid> byName() {
    Map<String, Plasmid> byName = new LinkedHashMap<>();
    records.forEach(plasmid -> byName.put(plasmid.getName(), plasmid));
    return Collections.unmodifiableMap(byName);
  }

  public Optional<Throwable> getAbortCause() {
    return Optional.ofNullable(abortCause);
  }

  /** Mutable collector fed by the single consumer stage of a run. */
  public static class Accumulator {
    private final List<Plasmid> records = new ArrayList<>();
    private final List<Plasmid> unpersisted = new ArrayList<>();
    private final List<CrawlOutcome> skipped = new ArrayList<>();
    private final List<CrawlFailure> failures = new ArrayList<>();
    private Throwable abortCause;

    public synchronized void persisted(Plasmid plasmid) {
      records.add(plasmid);
    }

    public synchronized void unpersisted(Plasmid plasmid, Throwable error) {
      records.add(plasmid);
      unpersisted.add(plasmid);
      failures.add(new CrawlFailure(plasmid.getId(), CrawlStage.ASSEMBLED, error));
    }

    public synchronized void skipped(CrawlOutcome outcome) {
      skipped.add(outcome);
    }

    public synchronized void failed(CrawlFailure failure) {
      failures.add(failure);
    }

    public synchronized void abort(Throwable cause) {
      if (abortCause == null) {
        abortCause = cause;
      }
    }

    public synchronized boolean isAborted() {
      return abortCause != null;
    }

    public synchronized Throwable getAbortCause() {
      return abortCause;
    }

    public synchronized BatchResult toResult(boolean cancelled) {
      return new BatchResult(records, unpersisted, skipped, failures, cancelled, abortCause);
    }
  }
}
