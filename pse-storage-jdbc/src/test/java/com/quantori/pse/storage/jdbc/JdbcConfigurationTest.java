package com.quantori.pse.storage.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.quantori.pse.api.ConfigurationException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

class JdbcConfigurationTest {

  @Test
  void loadsReferenceDefaults() {
    JdbcProperties properties = JdbcConfiguration.fromConfig(ConfigFactory.defaultReference());

    assertEquals("jdbc:postgresql://127.0.0.1:5432/mydb", properties.getUrl());
    assertEquals("addgene_plasmids", properties.getTable());
    assertEquals(WriteMode.UPSERT, properties.getMode());
  }

  @Test
  void unknownModeIsReported() {
    assertThrows(ConfigurationException.class, () -> JdbcConfiguration.fromConfig(
        ConfigFactory.parseString("pse.jdbc.mode = merge").withFallback(ConfigFactory.defaultReference())));
  }
}
