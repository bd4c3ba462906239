package com.quantori.pse.storage.jdbc;

import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
public abstract class ContainerizedTest {

  @Container
  public static PostgreSQLContainer<?> postgresql = new PostgreSQLContainer<>("postgres:15-alpine");

  protected static ConnectionFactory connectionFactory() {
    return ConnectionFactory.driverManager(JdbcProperties.builder()
        .url(postgresql.getJdbcUrl())
        .user(postgresql.getUsername())
        .password(postgresql.getPassword())
        .build());
  }
}
