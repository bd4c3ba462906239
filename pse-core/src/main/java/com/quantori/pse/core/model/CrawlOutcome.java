package com.quantori.pse.core.model;

import com.quantori.pse.api.model.Plasmid;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/** Result of processing one identifier. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CrawlOutcome {
  int id;
  Status status;
  CrawlStage stage;
  Plasmid plasmid;
  SkipReason skipReason;
  Throwable error;

  public static CrawlOutcome assembled(Plasmid plasmid) {
    return new CrawlOutcome(plasmid.getId(), Status.ASSEMBLED, CrawlStage.ASSEMBLED, plasmid, null, null);
  }

  public static CrawlOutcome skipped(int id, SkipReason reason) {
    return new CrawlOutcome(id, Status.SKIPPED, CrawlStage.DISCARDED, null, reason, null);
  }

  public static CrawlOutcome failed(int id, CrawlStage stage, Throwable error) {
    return new CrawlOutcome(id, Status.FAILED, stage, null, null, error);
  }

  public Optional<Plasmid> getPlasmid() {
    return Optional.ofNullable(plasmid);
  }

  public Optional<SkipReason> getSkipReason() {
    return Optional.ofNullable(skipReason);
  }

  public Optional<Throwable> getError() {
    return Optional.ofNullable(error);
  }

  public enum Status {
    ASSEMBLED,
    SKIPPED,
    FAILED
  }
}
