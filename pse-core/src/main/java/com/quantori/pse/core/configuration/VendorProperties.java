package com.quantori.pse.core.configuration;

import lombok.Builder;
import lombok.Data;

/** Location and page layout of one vendor. */
@Builder
@Data
public class VendorProperties {
  String baseUrl;
  String notFoundText;
  String nameSelector;
  String fieldSelector;
  String sequenceLinkSelector;
}
