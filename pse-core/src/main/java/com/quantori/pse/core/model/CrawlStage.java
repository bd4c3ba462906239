package com.quantori.pse.core.model;

/**
 * Processing stages of one identifier.
 *
 * <pre>
 * FETCHING -> CHECKING_EXISTENCE -> EXTRACTING -> ASSEMBLED -> PERSISTED
 *                     |
 *                     +-> DISCARDED
 * </pre>
 */
public enum CrawlStage {
  FETCHING,
  CHECKING_EXISTENCE,
  EXTRACTING,
  DISCARDED,
  ASSEMBLED,
  PERSISTED
}
