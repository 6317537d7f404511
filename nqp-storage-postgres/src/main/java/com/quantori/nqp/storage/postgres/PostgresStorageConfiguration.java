package com.quantori.nqp.storage.postgres;

import com.quantori.nqp.api.QueryExecutor;
import com.quantori.nqp.api.ResourceDiscovery;
import com.quantori.nqp.api.StorageConfiguration;
import com.quantori.nqp.api.model.SchemaCatalog;
import com.typesafe.config.Config;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.postgresql.ds.PGSimpleDataSource;

@Slf4j
public class PostgresStorageConfiguration implements StorageConfiguration {

  public static final String STORAGE_TYPE = "nqppostgres";
  public static final String CONFIG_PATH = "nqp.storage.postgres";

  private final PostgresSchemaCatalog schemaCatalog;
  private final PostgresQueryExecutor queryExecutor;
  private final PostgresResourceDiscovery resourceDiscovery;

  public PostgresStorageConfiguration(PostgresProperties properties) {
    this(dataSource(properties), properties);
  }

  public PostgresStorageConfiguration(DataSource dataSource, PostgresProperties properties) {
    var renderer = new SqlRenderer();
    schemaCatalog = new PostgresSchemaCatalog();
    queryExecutor = new PostgresQueryExecutor(dataSource, schemaCatalog, renderer, properties);
    resourceDiscovery = new PostgresResourceDiscovery(dataSource, schemaCatalog, renderer);
    log.info("Postgres storage configured, fetch size {}, batch size {}", properties.getFetchSize(),
        properties.getBatchSize());
  }

  /**
   * Maps the {@code nqp.storage.postgres} section onto properties.
   */
  public static PostgresProperties properties(Config config) {
    Config section = config.getConfig(CONFIG_PATH);
    var properties = new PostgresProperties();
    properties.setUrl(section.getString("url"));
    properties.setUser(section.getString("user"));
    if (section.hasPath("password")) {
      properties.setPassword(section.getString("password"));
    }
    properties.setFetchSize(section.getInt("fetch-size"));
    properties.setBatchSize(section.getInt("batch-size"));
    return properties;
  }

  @Override
  public SchemaCatalog getSchemaCatalog() {
    return schemaCatalog;
  }

  @Override
  public QueryExecutor getQueryExecutor() {
    return queryExecutor;
  }

  @Override
  public ResourceDiscovery getResourceDiscovery() {
    return resourceDiscovery;
  }

  @Override
  public String storageType() {
    return STORAGE_TYPE;
  }

  private static DataSource dataSource(PostgresProperties properties) {
    log.info("nqp.storage.postgres.url = {}", properties.getUrl());
    var dataSource = new PGSimpleDataSource();
    dataSource.setUrl(properties.getUrl());
    if (StringUtils.isNotBlank(properties.getUser())) {
      dataSource.setUser(properties.getUser());
    }
    if (StringUtils.isNotBlank(properties.getPassword())) {
      dataSource.setPassword(properties.getPassword());
    }
    return dataSource;
  }
}
