package com.quantori.pse.core.fetch;

import com.quantori.pse.core.vendor.VendorProfile;
import java.net.URI;
import lombok.Value;
import org.jsoup.nodes.Document;

/** The two parsed pages of one identifier. */
@Value
public class PlasmidDocuments {
  int id;
  VendorProfile profile;
  URI detailUri;
  Document detail;
  Document sequences;
}
