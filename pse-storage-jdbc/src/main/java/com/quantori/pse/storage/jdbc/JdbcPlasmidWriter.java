package com.quantori.pse.storage.jdbc;

import com.quantori.pse.api.PlasmidWriter;
import com.quantori.pse.api.SinkException;
import com.quantori.pse.api.model.Plasmid;
import com.quantori.pse.api.model.PlasmidAttribute;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Writes records into one table keyed by plasmid id. The table is created on the first write when
 * it does not exist. Values are always bound as parameters, absent ones as SQL {@code NULL}.
 */
@Slf4j
public class JdbcPlasmidWriter implements PlasmidWriter {
  private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final List<String> COLUMNS = columns();

  private final ConnectionFactory connectionFactory;
  private final String table;
  private final WriteMode mode;
  private Connection connection;
  private PreparedStatement statement;

  public JdbcPlasmidWriter(ConnectionFactory connectionFactory, String table, WriteMode mode) {
    if (StringUtils.isBlank(table) || !TABLE_NAME.matcher(table).matches()) {
      throw new IllegalArgumentException("Invalid table name: '" + table + "'");
    }
    this.connectionFactory = connectionFactory;
    this.table = table;
    this.mode = mode;
  }

  public JdbcPlasmidWriter(JdbcProperties properties) {
    this(ConnectionFactory.driverManager(properties), properties.getTable(), properties.getMode());
  }

  @Override
  public synchronized void write(Plasmid plasmid) {
    try {
      PreparedStatement insert = statement();
      bind(insert, plasmid);
      insert.executeUpdate();
      log.debug("Plasmid {} saved to {}", plasmid.getId(), table);
    } catch (SQLException e) {
      throw new SinkException("Could not save plasmid " + plasmid.getId() + " to " + table, e.getSQLState(), e);
    }
  }

  @Override
  public synchronized void close() {
    if (connection == null) {
      return;
    }
    try {
      connection.close();
    } catch (SQLException e) {
      throw new SinkException("Could not close connection", e.getSQLState(), e);
    } finally {
      connection = null;
      statement = null;
    }
  }

  String createTableSql() {
    return "CREATE TABLE IF NOT EXISTS " + table + " ("
        + "id INTEGER PRIMARY KEY, "
        + "name TEXT NOT NULL, "
        + "size INTEGER, "
        + Arrays.stream(PlasmidAttribute.values()).map(attribute -> attribute.getColumnName() + " TEXT, ")
            .collect(Collectors.joining())
        + "url TEXT, "
        + "sequence TEXT)";
  }

  String insertSql() {
    String sql = "INSERT INTO " + table + " (" + String.join(", ", COLUMNS) + ") VALUES ("
        + COLUMNS.stream().map(column -> "?").collect(Collectors.joining(", ")) + ")";
    if (mode == WriteMode.UPSERT) {
      sql += " ON CONFLICT (id) DO UPDATE SET " + COLUMNS.stream()
          .filter(column -> !column.equals("id"))
          .map(column -> column + " = EXCLUDED." + column)
          .collect(Collectors.joining(", "));
    }
    return sql;
  }

  private PreparedStatement statement() throws SQLException {
    if (statement == null) {
      Connection opened = connectionFactory.open();
      try (Statement ddl = opened.createStatement()) {
        ddl.execute(createTableSql());
        statement = opened.prepareStatement(insertSql());
        connection = opened;
      } catch (SQLException e) {
        opened.close();
        throw e;
      }
      log.info("Writing plasmids to table {} in {} mode", table, mode);
    }
    return statement;
  }

  private static void bind(PreparedStatement insert, Plasmid plasmid) throws SQLException {
    int index = 1;
    insert.setInt(index++, plasmid.getId());
    insert.setString(index++, plasmid.getName());
    if (plasmid.getSizeBasePairs().isPresent()) {
      insert.setInt(index++, plasmid.getSizeBasePairs().get());
    } else {
      insert.setNull(index++, Types.INTEGER);
    }
    for (PlasmidAttribute attribute : PlasmidAttribute.values()) {
      setText(insert, index++, plasmid.getAttribute(attribute).orElse(null));
    }
    setText(insert, index++, plasmid.getVendorUrl());
    setText(insert, index, plasmid.getSequence().orElse(null));
  }

  private static void setText(PreparedStatement insert, int index, String value) throws SQLException {
    if (value == null) {
      insert.setNull(index, Types.VARCHAR);
    } else {
      insert.setString(index, value);
    }
  }

  private static List<String> columns() {
    List<String> columns = new ArrayList<>(List.of("id", "name", "size"));
    Arrays.stream(PlasmidAttribute.values()).map(PlasmidAttribute::getColumnName).forEach(columns::add);
    columns.add("url");
    columns.add("sequence");
    return List.copyOf(columns);
  }
}
