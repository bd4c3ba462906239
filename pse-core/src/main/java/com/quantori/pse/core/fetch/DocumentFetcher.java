package com.quantori.pse.core.fetch;

import com.quantori.pse.core.vendor.VendorProfile;
import com.quantori.pse.core.vendor.VendorRegistry;
import java.net.URI;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/** Retrieves and parses the detail page and the sequences page of an identifier. */
@Slf4j
public class DocumentFetcher {
  private final HttpTransport transport;
  private final VendorRegistry vendors;

  public DocumentFetcher(HttpTransport transport, VendorRegistry vendors) {
    this.transport = transport;
    this.vendors = vendors;
  }

  /**
   * Fetches both pages of an identifier.
   *
   * @return empty if no profile is registered for the vendor tag
   */
  public Optional<PlasmidDocuments> fetch(String vendorTag, int id) {
    Optional<VendorProfile> profile = vendors.find(vendorTag);
    if (profile.isEmpty()) {
      log.debug("No vendor profile for '{}', plasmid {} is not fetched", vendorTag, id);
      return Optional.empty();
    }
    return Optional.of(fetch(profile.get(), id));
  }

  public PlasmidDocuments fetch(VendorProfile profile, int id) {
    URI detailUri = profile.detailUri(id);
    URI sequencesUri = profile.sequencesUri(id);
    Document detail = parse(detailUri);
    Document sequences = parse(sequencesUri);
    return new PlasmidDocuments(id, profile, detailUri, detail, sequences);
  }

  private Document parse(URI uri) {
    return Jsoup.parse(transport.getText(uri), uri.toString());
  }
}
