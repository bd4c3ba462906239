package com.quantori.pse.storage.file;

import com.quantori.pse.api.model.Plasmid;
import com.quantori.pse.api.model.PlasmidAttribute;
import com.quantori.pse.storage.file.model.PlasmidDocument;
import com.quantori.pse.storage.file.model.PlasmidRow;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

@UtilityClass
class Mapper {

  static PlasmidRow toRow(Plasmid plasmid) {
    var row = new PlasmidRow();
    row.setId(String.valueOf(plasmid.getId()));
    row.setName(plasmid.getName());
    row.setSize(plasmid.getSizeBasePairs().map(String::valueOf).orElse(""));
    for (PlasmidAttribute attribute : PlasmidAttribute.values()) {
      setAttribute(row, attribute, plasmid.getAttribute(attribute).orElse(""));
    }
    row.setVendor(StringUtils.defaultString(plasmid.getVendor()));
    row.setUrl(StringUtils.defaultString(plasmid.getVendorUrl()));
    return row;
  }

  static Plasmid toPlasmid(PlasmidRow row, String sequence) {
    var builder = Plasmid.builder(Integer.parseInt(row.getId().trim()), row.getName())
        .vendor(StringUtils.trimToNull(row.getVendor()))
        .vendorUrl(StringUtils.trimToNull(row.getUrl()))
        .sequence(sequence);
    if (StringUtils.isNotBlank(row.getSize())) {
      builder.sizeBasePairs(Integer.parseInt(row.getSize().trim()));
    }
    for (PlasmidAttribute attribute : PlasmidAttribute.values()) {
      builder.attribute(attribute, StringUtils.defaultIfEmpty(getAttribute(row, attribute), null));
    }
    return builder.build();
  }

  static PlasmidDocument toDocument(Plasmid plasmid) {
    var document = new PlasmidDocument();
    document.setId(plasmid.getId());
    document.setName(plasmid.getName());
    document.setVendor(plasmid.getVendor());
    document.setUrl(plasmid.getVendorUrl());
    document.setSize(plasmid.getSizeBasePairs().orElse(null));
    Map<String, String> attributes = new LinkedHashMap<>();
    for (PlasmidAttribute attribute : PlasmidAttribute.values()) {
      attributes.put(attribute.getColumnName(), plasmid.getAttribute(attribute).orElse(null));
    }
    document.setAttributes(attributes);
    document.setSequence(plasmid.getSequence().orElse(null));
    return document;
  }

  private static void setAttribute(PlasmidRow row, PlasmidAttribute attribute, String value) {
    switch (attribute) {
      case BACKBONE -> row.setBackbone(value);
      case VECTOR_TYPE -> row.setVectorType(value);
      case MARKER -> row.setMarker(value);
      case RESISTANCE -> row.setResistance(value);
      case GROWTH_TEMPERATURE -> row.setGrowthTemperature(value);
      case GROWTH_STRAIN -> row.setGrowthStrain(value);
      case GROWTH_INSTRUCTIONS -> row.setGrowthInstructions(value);
      case COPY_NUMBER -> row.setCopyNumber(value);
      case GENE_INSERT -> row.setGeneInsert(value);
      default -> throw new IllegalArgumentException("Unknown attribute " + attribute);
    }
  }

  private static String getAttribute(PlasmidRow row, PlasmidAttribute attribute) {
    return switch (attribute) {
      case BACKBONE -> row.getBackbone();
      case VECTOR_TYPE -> row.getVectorType();
      case MARKER -> row.getMarker();
      case RESISTANCE -> row.getResistance();
      case GROWTH_TEMPERATURE -> row.getGrowthTemperature();
      case GROWTH_STRAIN -> row.getGrowthStrain();
      case GROWTH_INSTRUCTIONS -> row.getGrowthInstructions();
      case COPY_NUMBER -> row.getCopyNumber();
      case GENE_INSERT -> row.getGeneInsert();
    };
  }
}
