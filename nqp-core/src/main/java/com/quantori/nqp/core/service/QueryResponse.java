package com.quantori.nqp.core.service;

import com.quantori.nqp.api.model.CompiledQuery;
import com.quantori.nqp.core.format.OutputFormat;
import com.quantori.nqp.core.format.ResultStream;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a request. The body is lazy, closing the response releases the database cursor behind it.
 *
 * <p>Body units are strings for text formats, {@code Map<String, Object>} records for {@link OutputFormat#RAW}. For
 * {@link OutputFormat#QUERY} the body is empty and {@link #getQuery()} holds the compiled query.
 */
@Value
@Builder
public class QueryResponse implements Closeable {
  Status status;
  OutputFormat format;
  List<String> columns;
  CompiledQuery query;
  ResultStream<?> body;
  String message;

  public static QueryResponse clientError(String message) {
    return QueryResponse.builder()
        .status(Status.CLIENT_ERROR)
        .format(OutputFormat.TSV)
        .columns(List.of())
        .message(message)
        .body(ResultStream.of(List.of(message)))
        .build();
  }

  public boolean isOk() {
    return status == Status.OK;
  }

  @Override
  public void close() throws IOException {
    if (body != null) {
      body.close();
    }
  }

  public enum Status {
    OK,
    CLIENT_ERROR
  }
}
