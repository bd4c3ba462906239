package com.quantori.pse.storage.jdbc;

public enum WriteMode {
  /** A second record with the same id is rejected by the primary key. */
  INSERT,
  /** A second record with the same id replaces the first one. */
  UPSERT
}
