package com.quantori.nqp.api;

import lombok.Getter;

/**
 * Failure of a storage while executing a compiled query or reading its rows. Thrown lazily from the response body, it
 * ends the request being served.
 */
@Getter
public class StorageException extends RuntimeException {

  /**
   * Code reported by the database driver, e.g. a SQL state. Null if the storage did not report one.
   */
  private final String errorCode;

  public StorageException(String message) {
    this(message, null, null);
  }

  public StorageException(Throwable cause) {
    this(cause.getMessage(), null, cause);
  }

  public StorageException(String message, Throwable cause) {
    this(message, null, cause);
  }

  /**
   * @param message   client facing description
   * @param errorCode driver error code, may be null
   * @param cause     driver exception, may be null
   */
  public StorageException(String message, String errorCode, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }
}
