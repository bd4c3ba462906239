package com.quantori.pse.api.model;

import lombok.Getter;

/**
 * Optional text attributes of a plasmid. The column name is the name used by tabular and
 * relational sinks.
 */
@Getter
public enum PlasmidAttribute {
  BACKBONE("backbone"),
  VECTOR_TYPE("vector_type"),
  MARKER("marker"),
  RESISTANCE("resistance"),
  GROWTH_TEMPERATURE("growth_t"),
  GROWTH_STRAIN("growth_strain"),
  GROWTH_INSTRUCTIONS("growth_instructions"),
  COPY_NUMBER("copy_num"),
  GENE_INSERT("gene_insert");

  private final String columnName;

  PlasmidAttribute(String columnName) {
    this.columnName = columnName;
  }
}
