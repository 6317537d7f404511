package com.quantori.nqp.api;

import com.quantori.nqp.api.model.CompiledQuery;

/**
 * Executes compiled queries against a storage.
 */
public interface QueryExecutor {

  /**
   * Starts the execution of a query. Implementations should not read any row before the first call of
   * {@link RowIterator#next()}, and must fetch rows in chunks rather than loading the full result.
   *
   * @param query compiled query
   * @return lazy row iterator, rows are aligned with {@link CompiledQuery#getColumns()}
   * @throws StorageException in case the query cannot be executed
   */
  RowIterator execute(CompiledQuery query);
}
