package com.quantori.pse.storage.file;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.quantori.pse.storage.file.model.PlasmidRow;
import org.junit.jupiter.api.Test;

class CsvRowMapperTest {

  @Test
  void writesHeaderAndQuotedRow() throws Exception {
    PlasmidRow row = new PlasmidRow();
    row.setId("42888");
    row.setName("pLenti CMV GFP Puro (658-5)");
    row.setResistance("Ampicillin, 100 μg/mL");

    String csv = CsvRowMapper.toCsvString(row);

    assertEquals(2, csv.strip().split("\n").length);
    assertThat(csv, startsWith("id,name,size,backbone,vector_type,marker,resistance,growth_t,"));
    assertThat(csv, containsString("\"Ampicillin, 100 μg/mL\""));
    assertEquals(row.getResistance(), CsvRowMapper.toPlasmidRow(csv).getResistance());
  }
}
