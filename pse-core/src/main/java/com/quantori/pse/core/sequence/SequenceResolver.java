package com.quantori.pse.core.sequence;

import com.quantori.pse.api.TransportException;
import com.quantori.pse.core.fetch.HttpTransport;
import com.quantori.pse.core.retry.RetryPolicy;
import com.quantori.pse.core.vendor.VendorProfile;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;

/**
 * Downloads the annotated sequence file linked from a sequences page.
 *
 * <p>A missing file is a normal outcome, pooled resources have no single sequence. The download
 * gets a few attempts of its own and then the plasmid is assembled without a sequence.
 */
@Slf4j
public class SequenceResolver {
  private static final String NUL = "\u0000";

  private final HttpTransport transport;
  private final RetryPolicy downloadRetryPolicy;

  public SequenceResolver(HttpTransport transport, RetryPolicy downloadRetryPolicy) {
    this.transport = transport;
    this.downloadRetryPolicy = downloadRetryPolicy;
  }

  public Optional<String> resolve(int id, VendorProfile profile, Document sequences) {
    Optional<String> link = profile.sequenceLink(sequences);
    if (link.isEmpty()) {
      log.info("Plasmid {} links no sequence file", id);
      return Optional.empty();
    }
    try {
      URI uri = URI.create(link.get());
      byte[] payload = downloadRetryPolicy.execute(
          "sequence file of plasmid " + id, () -> transport.getBytes(uri));
      return Optional.of(decode(payload));
    } catch (TransportException | IllegalArgumentException e) {
      log.warn("Sequence file of plasmid {} is not available at {}: {}", id, link.get(), e.getMessage());
      return Optional.empty();
    }
  }

  /** Decodes the file as UTF-8. Malformed bytes become U+FFFD, NUL characters are dropped. */
  public static String decode(byte[] payload) {
    return new String(payload, StandardCharsets.UTF_8).replace(NUL, "");
  }
}
