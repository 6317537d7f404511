package com.quantori.nqp.storage.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.quantori.nqp.api.RowIterator;
import com.quantori.nqp.api.model.ColumnDefinition;
import com.quantori.nqp.api.model.Row;
import java.io.IOException;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads a statement through a server-side cursor. The connection is opened on the first {@link #next()} call, with
 * auto-commit disabled so that the driver honours the fetch size.
 */
@Slf4j
class PostgresRowIterator implements RowIterator {

  private final DataSource dataSource;
  private final SqlStatement statement;
  private final List<ColumnDefinition> columns;
  private final int fetchSize;
  private final int batchSize;

  private Connection connection;
  private PreparedStatement preparedStatement;
  private ResultSet resultSet;
  private boolean exhausted;
  private boolean closed;

  PostgresRowIterator(DataSource dataSource, SqlStatement statement, List<ColumnDefinition> columns,
                      int fetchSize, int batchSize) {
    this.dataSource = dataSource;
    this.statement = statement;
    this.columns = List.copyOf(columns);
    this.fetchSize = fetchSize;
    this.batchSize = batchSize;
  }

  @Override
  public List<Row> next() {
    if (exhausted || closed) {
      return List.of();
    }
    try {
      if (resultSet == null) {
        open();
      }
      var batch = new ArrayList<Row>(batchSize);
      while (batch.size() < batchSize && resultSet.next()) {
        batch.add(read(resultSet));
      }
      if (batch.size() < batchSize) {
        exhausted = true;
      }
      return batch;
    } catch (SQLException e) {
      log.error("Unable to read rows of statement {}", statement.sql(), e);
      throw new PostgresStorageException("Unable to search", e);
    }
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    try (Connection c = connection; PreparedStatement ps = preparedStatement; ResultSet rs = resultSet) {
      if (c != null && !c.getAutoCommit()) {
        c.rollback();
      }
      log.trace("Closed cursor of statement {}", statement.sql());
    } catch (SQLException e) {
      throw new IOException("Unable to close cursor of statement " + statement.sql(), e);
    }
  }

  private void open() throws SQLException {
    log.debug("Executing {} with {}", statement.sql(), statement.parameters());
    connection = dataSource.getConnection();
    connection.setAutoCommit(false);
    connection.setReadOnly(true);
    preparedStatement = connection.prepareStatement(statement.sql(), ResultSet.TYPE_FORWARD_ONLY,
        ResultSet.CONCUR_READ_ONLY);
    preparedStatement.setFetchSize(fetchSize);
    bind(connection, preparedStatement, statement.parameters());
    resultSet = preparedStatement.executeQuery();
  }

  static void bind(Connection connection, PreparedStatement preparedStatement, List<Object> parameters)
      throws SQLException {
    for (int i = 0; i < parameters.size(); i++) {
      Object parameter = parameters.get(i);
      if (parameter instanceof SqlStatement.SqlArray array) {
        preparedStatement.setArray(i + 1, connection.createArrayOf(array.elementType(), array.values().toArray()));
      } else {
        preparedStatement.setObject(i + 1, parameter);
      }
    }
  }

  private Row read(ResultSet resultSet) throws SQLException {
    var values = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      values.add(value(resultSet, i + 1, columns.get(i)));
    }
    return new Row(values);
  }

  static Object value(ResultSet resultSet, int index, ColumnDefinition column) throws SQLException {
    return switch (column.kind()) {
      case ARRAY -> {
        Array array = resultSet.getArray(index);
        if (array == null) {
          yield null;
        }
        yield Arrays.stream((Object[]) array.getArray()).map(value -> value == null ? null : value.toString())
            .toList();
      }
      case BOOLEAN -> {
        boolean value = resultSet.getBoolean(index);
        yield resultSet.wasNull() ? null : value;
      }
      case SCALAR -> switch (column.scalarType()) {
        case INTEGER -> {
          long value = resultSet.getLong(index);
          yield resultSet.wasNull() ? null : (Object) Math.toIntExact(value);
        }
        case JSON -> {
          try {
            yield JsonMapper.fromJson(resultSet.getString(index));
          } catch (JsonProcessingException e) {
            throw new PostgresStorageException("Unable to decode json column " + column.name(), e);
          }
        }
        case STRING -> resultSet.getString(index);
      };
    };
  }
}
