package com.quantori.pse.storage.jdbc;

import com.quantori.pse.api.ConfigurationException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.util.Locale;
import lombok.experimental.UtilityClass;

/** Reads {@link JdbcProperties} from the {@code pse.jdbc} section of a Typesafe config. */
@UtilityClass
public class JdbcConfiguration {
  public static final String PATH = "pse.jdbc";

  public static JdbcProperties load() {
    return fromConfig(ConfigFactory.load());
  }

  public static JdbcProperties fromConfig(Config config) {
    try {
      Config jdbc = config.getConfig(PATH);
      return JdbcProperties.builder()
          .url(jdbc.getString("url"))
          .user(jdbc.getString("user"))
          .password(jdbc.getString("password"))
          .table(jdbc.getString("table"))
          .mode(WriteMode.valueOf(jdbc.getString("mode").toUpperCase(Locale.ROOT)))
          .build();
    } catch (ConfigException | IllegalArgumentException e) {
      throw new ConfigurationException("Invalid JDBC configuration: " + e.getMessage(), e);
    }
  }
}
