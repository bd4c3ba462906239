package com.quantori.pse.storage.jdbc;

import static com.quantori.pse.api.model.PlasmidAttribute.BACKBONE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.pse.api.SinkException;
import com.quantori.pse.api.model.Plasmid;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import org.junit.jupiter.api.Test;

class PostgresPlasmidWriterTest extends ContainerizedTest {

  @Test
  void upsertIsIdempotent() throws Exception {
    Plasmid plasmid = Plasmid.builder(42888, "pLenti CMV GFP Puro (658-5)")
        .attribute(BACKBONE, "pLenti CMV Puro DEST")
        .build();

    try (JdbcPlasmidWriter writer = new JdbcPlasmidWriter(connectionFactory(), "plasmids_upsert", WriteMode.UPSERT)) {
      writer.write(plasmid);
      writer.write(plasmid);
      writer.write(Plasmid.builder(42888, "pLenti CMV GFP Puro (658-5)")
          .attribute(BACKBONE, "pLenti CMV Puro")
          .sizeBasePairs(7709)
          .build());
    }

    try (Connection connection = connectionFactory().open();
         Statement statement = connection.createStatement();
         ResultSet rows = statement.executeQuery("SELECT id, size, backbone, marker FROM plasmids_upsert")) {
      assertTrue(rows.next());
      assertEquals(42888, rows.getInt("id"));
      assertEquals(7709, rows.getInt("size"));
      assertEquals("pLenti CMV Puro", rows.getString("backbone"));
      assertNull(rows.getString("marker"));
      assertFalse(rows.next());
    }
  }

  @Test
  void absentSizeIsStoredAsNull() throws Exception {
    try (JdbcPlasmidWriter writer = new JdbcPlasmidWriter(connectionFactory(), "plasmids_null", WriteMode.UPSERT)) {
      writer.write(Plasmid.builder(1, "pUC19").build());
    }

    try (Connection connection = connectionFactory().open();
         Statement statement = connection.createStatement();
         ResultSet rows = statement.executeQuery("SELECT size FROM plasmids_null WHERE id = 1")) {
      assertTrue(rows.next());
      assertNull(rows.getObject("size"));
    }
  }

  @Test
  void insertRejectsRepeatedId() throws SQLException {
    try (JdbcPlasmidWriter writer = new JdbcPlasmidWriter(connectionFactory(), "plasmids_insert", WriteMode.INSERT)) {
      writer.write(Plasmid.builder(1, "pUC19").build());

      SinkException error = assertThrows(SinkException.class, () -> writer.write(Plasmid.builder(1, "pUC19").build()));
      assertTrue(error.getMessage().contains("23505"));
    }
  }
}
