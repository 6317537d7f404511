package com.quantori.nqp.core.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantori.nqp.api.model.Row;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;

/**
 * Encodes rows into output units without buffering: records, tab separated lines or JSON array fragments. Only the
 * first {@code columns.size()} values of a row are encoded.
 */
@UtilityClass
public class ResultFormatter {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public ResultStream<Map<String, Object>> records(List<String> columns, ResultStream<Row> rows) {
    return rows.map(row -> record(columns, row));
  }

  /**
   * One line per row, each ending in a new line, preceded by the column names if requested.
   */
  public ResultStream<String> tsv(List<String> columns, ResultStream<Row> rows, boolean header) {
    ResultStream<String> lines = rows.map(row -> tsvLine(row.values().subList(0, columns.size())));
    if (!header) {
      return lines;
    }
    String headerLine = tsvLine(columns);
    return lines.with(new Iterator<>() {
      private boolean headerSent;

      @Override
      public boolean hasNext() {
        return !headerSent || lines.hasNext();
      }

      @Override
      public String next() {
        if (!headerSent) {
          headerSent = true;
          return headerLine;
        }
        return lines.next();
      }
    });
  }

  /**
   * A JSON array with one object per row, split into fragments: the opening bracket, one fragment per row and the
   * closing bracket.
   */
  public ResultStream<String> json(List<String> columns, ResultStream<Row> rows) {
    WithLast<Row> items = WithLast.of(rows);
    return rows.with(new Iterator<>() {
      private boolean opened;
      private boolean closed;

      @Override
      public boolean hasNext() {
        return !closed;
      }

      @Override
      public String next() {
        if (!opened) {
          opened = true;
          return "[\n";
        }
        if (items.hasNext()) {
          WithLast.Item<Row> item = items.next();
          return toJson(record(columns, item.value())) + (item.last() ? "\n" : ",\n");
        }
        if (closed) {
          throw new NoSuchElementException();
        }
        closed = true;
        return "]";
      }
    });
  }

  public Map<String, Object> record(List<String> columns, Row row) {
    var record = new LinkedHashMap<String, Object>();
    for (int i = 0; i < columns.size(); i++) {
      record.put(columns.get(i), row.get(i));
    }
    return record;
  }

  public String tsvLine(List<?> values) {
    return values.stream().map(ResultFormatter::tsvField).collect(Collectors.joining("\t")) + "\n";
  }

  /**
   * Booleans as {@code 1} or {@code 0}, lists joined by {@code ;}, maps as JSON, nulls empty.
   */
  public String tsvField(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Boolean bool) {
      return bool ? "1" : "0";
    }
    if (value instanceof Collection<?> collection) {
      return collection.stream().map(ResultFormatter::tsvField).collect(Collectors.joining(";"));
    }
    if (value instanceof Map<?, ?>) {
      return toJson(value);
    }
    return String.valueOf(value);
  }

  public String toJson(Object value) {
    try {
      return OBJECT_MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Unable to encode " + value.getClass().getSimpleName(), e);
    }
  }
}
