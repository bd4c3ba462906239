package com.quantori.pse.core.source;

import com.quantori.pse.api.model.Plasmid;
import com.quantori.pse.api.model.PlasmidAttribute;
import com.quantori.pse.core.extract.FieldExtractor;
import com.quantori.pse.core.extract.SequenceHeader;
import com.quantori.pse.core.fetch.DocumentFetcher;
import com.quantori.pse.core.fetch.PlasmidDocuments;
import com.quantori.pse.core.model.CrawlOutcome;
import com.quantori.pse.core.model.CrawlStage;
import com.quantori.pse.core.model.SkipReason;
import com.quantori.pse.core.retry.RetryPolicy;
import com.quantori.pse.core.sequence.SequenceResolver;
import com.quantori.pse.core.vendor.VendorProfile;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns one identifier into a record or a skip. Never throws: anything that escapes the retry
 * policy becomes a failed outcome of the stage it happened in.
 */
@Slf4j
public class PlasmidCrawler {
  private final DocumentFetcher fetcher;
  private final FieldExtractor extractor;
  private final SequenceResolver sequenceResolver;
  private final RetryPolicy retryPolicy;

  public PlasmidCrawler(DocumentFetcher fetcher, FieldExtractor extractor,
                        SequenceResolver sequenceResolver, RetryPolicy retryPolicy) {
    this.fetcher = fetcher;
    this.extractor = extractor;
    this.sequenceResolver = sequenceResolver;
    this.retryPolicy = retryPolicy;
  }

  public CrawlOutcome crawl(String vendorTag, int id) {
    CrawlStage stage = CrawlStage.FETCHING;
    try {
      Optional<PlasmidDocuments> fetched =
          retryPolicy.execute("fetch of plasmid " + id, () -> fetcher.fetch(vendorTag, id));
      if (fetched.isEmpty()) {
        log.info("Plasmid {} skipped: vendor '{}' is not supported", id, vendorTag);
        return CrawlOutcome.skipped(id, SkipReason.UNSUPPORTED_VENDOR);
      }
      PlasmidDocuments documents = fetched.get();
      VendorProfile profile = documents.getProfile();

      stage = CrawlStage.CHECKING_EXISTENCE;
      if (profile.isNotFound(documents.getDetail())) {
        log.info("Plasmid {} skipped: no such page at {}", id, documents.getDetailUri());
        return CrawlOutcome.skipped(id, SkipReason.NOT_FOUND);
      }

      stage = CrawlStage.EXTRACTING;
      Optional<String> name = extractor.extractName(id, profile, documents.getDetail());
      if (name.isEmpty()) {
        log.info("Plasmid {} skipped: the page has no material name", id);
        return CrawlOutcome.skipped(id, SkipReason.NAME_UNRESOLVED);
      }
      Map<PlasmidAttribute, String> attributes = extractor.extractAttributes(id, profile, documents.getDetail());
      Optional<Integer> size = extractor.extractSize(id, profile, documents.getDetail());
      Optional<String> sequence = retryPolicy.execute("sequence of plasmid " + id,
          () -> sequenceResolver.resolve(id, profile, documents.getSequences()));
      if (size.isEmpty() && sequence.isPresent()) {
        size = sequence.flatMap(SequenceHeader::length);
        size.ifPresent(length -> log.debug("Size of plasmid {} taken from its sequence header: {}", id, length));
      }

      Plasmid plasmid = Plasmid.builder(id, name.get())
          .vendor(profile.tag())
          .vendorUrl(documents.getDetailUri().toString())
          .sizeBasePairs(size.orElse(null))
          .attributes(attributes)
          .sequence(sequence.orElse(null))
          .build();
      log.debug("Plasmid {} assembled: {}", id, plasmid);
      return CrawlOutcome.assembled(plasmid);
    } catch (RuntimeException e) {
      log.warn("Plasmid {} failed while {}: {}", id, stage, e.getMessage(), e);
      return CrawlOutcome.failed(id, stage, e);
    }
  }
}
