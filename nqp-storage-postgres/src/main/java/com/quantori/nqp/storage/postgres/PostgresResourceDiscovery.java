package com.quantori.nqp.storage.postgres;

import com.quantori.nqp.api.ResourceDiscovery;
import com.quantori.nqp.api.model.Criteria;
import com.quantori.nqp.api.model.EntitySchema;
import com.quantori.nqp.api.model.EntityType;
import com.quantori.nqp.api.model.SchemaCatalog;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Distinct value enumeration for the resource registry, array columns are unnested by the database.
 */
@Slf4j
class PostgresResourceDiscovery implements ResourceDiscovery {

  private final DataSource dataSource;
  private final SchemaCatalog schemaCatalog;
  private final SqlRenderer renderer;

  PostgresResourceDiscovery(DataSource dataSource, SchemaCatalog schemaCatalog, SqlRenderer renderer) {
    this.dataSource = dataSource;
    this.schemaCatalog = schemaCatalog;
    this.renderer = renderer;
  }

  @Override
  public Set<String> distinctValues(EntityType entityType, String column, Criteria filter) {
    var result = new TreeSet<String>();
    query(entityType, List.of(column), filter, resultSet -> result.add(resultSet.getString(1)));
    return result;
  }

  @Override
  public Map<String, Set<String>> coOccurringValues(EntityType entityType, String keyColumn, String valueColumn,
                                                    Criteria filter) {
    var result = new TreeMap<String, Set<String>>();
    query(entityType, List.of(keyColumn, valueColumn), filter, resultSet -> {
      String value = resultSet.getString(2);
      if (value != null) {
        result.computeIfAbsent(resultSet.getString(1), key -> new TreeSet<>()).add(value);
      }
    });
    return result;
  }

  private void query(EntityType entityType, List<String> columns, Criteria filter, RowConsumer consumer) {
    EntitySchema schema = schemaCatalog.schema(entityType);
    SqlStatement statement = renderer.distinct(schema, columns, filter);
    log.debug("Discovering {} of {}: {}", columns, entityType.getTableName(), statement.sql());
    try (Connection connection = dataSource.getConnection();
         PreparedStatement preparedStatement = connection.prepareStatement(statement.sql())) {
      PostgresRowIterator.bind(connection, preparedStatement, statement.parameters());
      try (ResultSet resultSet = preparedStatement.executeQuery()) {
        while (resultSet.next()) {
          if (resultSet.getString(1) != null) {
            consumer.accept(resultSet);
          }
        }
      }
    } catch (SQLException e) {
      log.error("Unable to discover {} of {}", columns, entityType.getTableName(), e);
      throw new PostgresStorageException("Unable to discover resources of " + entityType.getTableName(), e);
    }
  }

  @FunctionalInterface
  private interface RowConsumer {
    void accept(ResultSet resultSet) throws SQLException;
  }
}
