package com.quantori.nqp.api;

import com.quantori.nqp.api.model.SchemaCatalog;

/**
 * Entry point of a storage implementation.
 */
public interface StorageConfiguration {

  SchemaCatalog getSchemaCatalog();

  QueryExecutor getQueryExecutor();

  ResourceDiscovery getResourceDiscovery();

  String storageType();
}
