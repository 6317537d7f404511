package com.quantori.nqp.storage.postgres;

import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
public class ContainerizedTest {

  @Container
  public static PostgreSQLContainer<?> postgresql = new PostgreSQLContainer<>("postgres:latest")
      .withInitScript("initdb.sql");

  static PostgresProperties properties(int batchSize) {
    var properties = new PostgresProperties();
    properties.setUrl(postgresql.getJdbcUrl());
    properties.setUser(postgresql.getUsername());
    properties.setPassword(postgresql.getPassword());
    properties.setFetchSize(3);
    properties.setBatchSize(batchSize);
    return properties;
  }
}
