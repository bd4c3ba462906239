package com.quantori.pse.storage.file.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;
import lombok.Data;

@Data
@JsonPropertyOrder({"id", "name", "vendor", "url", "size", "attributes", "sequence"})
public class PlasmidDocument {
  private int id;
  private String name;
  private String vendor;
  private String url;
  private Integer size;
  /** Keyed by column name, absent attributes are {@code null}. */
  private Map<String, String> attributes;
  private String sequence;
}
