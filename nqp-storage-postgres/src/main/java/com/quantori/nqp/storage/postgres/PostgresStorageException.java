package com.quantori.nqp.storage.postgres;

import com.quantori.nqp.api.StorageException;
import java.sql.SQLException;

/**
 * Storage failure of the PostgreSQL backend, carrying the SQL state of the driver exception if there is one.
 */
public class PostgresStorageException extends StorageException {

  public PostgresStorageException(String message) {
    super(message);
  }

  public PostgresStorageException(String message, Throwable cause) {
    super(message, cause instanceof SQLException sqlException ? sqlException.getSQLState() : null, cause);
  }
}
