package com.quantori.nqp.api;

import com.quantori.nqp.api.model.Row;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import javax.validation.constraints.NotNull;

/**
 * Iterator fetches list of rows(batch) on each iteration. Rows keep the order the underlying query imposes.
 */
public interface RowIterator extends Closeable {

  /** Empty iterator returns just empty list. */
  static RowIterator empty() {
    return List::of;
  }

  /**
   * Iterator over a fixed list of rows returned as a single batch.
   */
  static RowIterator of(List<Row> rows) {
    return new RowIterator() {
      private boolean consumed;

      @Override
      public List<Row> next() {
        if (consumed) {
          return List.of();
        }
        consumed = true;
        return rows;
      }
    };
  }

  /**
   * Get next batch of rows. If returned list is empty, then assume the query is exhausted.
   *
   * @return a list of rows or empty list otherwise
   */
  @NotNull
  List<Row> next();

  /**
   * Closes an iterator and releases the database cursor behind it.
   *
   * <p>The default implementation does nothing.
   *
   * @throws IOException In case an iterator cannot be closed, {@code IOException} must be thrown.
   */
  @Override
  default void close() throws IOException {}
}
