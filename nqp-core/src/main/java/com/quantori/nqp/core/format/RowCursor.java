package com.quantori.nqp.core.format;

import com.quantori.nqp.api.RowIterator;
import com.quantori.nqp.api.model.Row;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Flattens the batches of a {@link RowIterator}. The next batch is fetched only when the current one is consumed.
 */
public class RowCursor implements ResultStream<Row> {

  private final RowIterator rowIterator;
  private Iterator<Row> batch = List.<Row>of().iterator();
  private boolean exhausted;

  public RowCursor(RowIterator rowIterator) {
    this.rowIterator = rowIterator;
  }

  @Override
  public boolean hasNext() {
    while (!batch.hasNext() && !exhausted) {
      List<Row> rows = rowIterator.next();
      if (rows.isEmpty()) {
        exhausted = true;
      } else {
        batch = rows.iterator();
      }
    }
    return batch.hasNext();
  }

  @Override
  public Row next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return batch.next();
  }

  @Override
  public void close() throws IOException {
    rowIterator.close();
  }
}
