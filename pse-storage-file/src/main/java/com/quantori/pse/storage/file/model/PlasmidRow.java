package com.quantori.pse.storage.file.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;

/** One CSV row. Every column is text, an absent value is an empty cell. */
@Data
@JsonPropertyOrder({"id", "name", "size", "backbone", "vector_type", "marker", "resistance", "growth_t",
    "growth_strain", "growth_instructions", "copy_num", "gene_insert", "vendor", "url"})
public class PlasmidRow {
  private String id;
  private String name;
  private String size;
  private String backbone;
  @JsonProperty("vector_type")
  private String vectorType;
  private String marker;
  private String resistance;
  @JsonProperty("growth_t")
  private String growthTemperature;
  @JsonProperty("growth_strain")
  private String growthStrain;
  @JsonProperty("growth_instructions")
  private String growthInstructions;
  @JsonProperty("copy_num")
  private String copyNumber;
  @JsonProperty("gene_insert")
  private String geneInsert;
  private String vendor;
  private String url;
}
