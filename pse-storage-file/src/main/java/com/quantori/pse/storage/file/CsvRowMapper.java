package com.quantori.pse.storage.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.quantori.pse.storage.file.model.PlasmidRow;
import lombok.experimental.UtilityClass;

/**
 * Reads and writes a {@link PlasmidRow} as a header line followed by one data line.
 */
@UtilityClass
class CsvRowMapper {

  private static final CsvMapper CSV_MAPPER = new CsvMapper();
  private static final CsvSchema ROW_SCHEMA = CSV_MAPPER.schemaFor(PlasmidRow.class).withHeader();
  private static final ObjectWriter ROW_WRITER = CSV_MAPPER.writer(ROW_SCHEMA);
  private static final ObjectReader ROW_READER = CSV_MAPPER.readerFor(PlasmidRow.class).with(ROW_SCHEMA);

  static String toCsvString(PlasmidRow row) throws JsonProcessingException {
    return ROW_WRITER.writeValueAsString(row);
  }

  static PlasmidRow toPlasmidRow(String csv) throws JsonProcessingException {
    return ROW_READER.readValue(csv);
  }
}
