package com.quantori.pse.core.model;

/**
 * An identifier that could not be processed or persisted.
 *
 * @param id    identifier
 * @param stage stage the failure happened in
 * @param error the failure
 */
public record CrawlFailure(int id, CrawlStage stage, Throwable error) {
}
