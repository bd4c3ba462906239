package com.quantori.pse.storage.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

@FunctionalInterface
public interface ConnectionFactory {

  Connection open() throws SQLException;

  static ConnectionFactory driverManager(JdbcProperties properties) {
    return () -> DriverManager.getConnection(properties.getUrl(), properties.getUser(), properties.getPassword());
  }
}
