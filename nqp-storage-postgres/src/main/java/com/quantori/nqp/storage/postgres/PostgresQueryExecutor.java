package com.quantori.nqp.storage.postgres;

import com.quantori.nqp.api.QueryExecutor;
import com.quantori.nqp.api.RowIterator;
import com.quantori.nqp.api.model.CompiledQuery;
import com.quantori.nqp.api.model.EntitySchema;
import com.quantori.nqp.api.model.SchemaCatalog;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class PostgresQueryExecutor implements QueryExecutor {

  private final DataSource dataSource;
  private final SchemaCatalog schemaCatalog;
  private final SqlRenderer renderer;
  private final PostgresProperties properties;

  PostgresQueryExecutor(DataSource dataSource, SchemaCatalog schemaCatalog, SqlRenderer renderer,
                        PostgresProperties properties) {
    this.dataSource = dataSource;
    this.schemaCatalog = schemaCatalog;
    this.renderer = renderer;
    this.properties = properties;
  }

  @Override
  public RowIterator execute(CompiledQuery query) {
    EntitySchema schema = schemaCatalog.schema(query.getEntityType());
    SqlStatement statement = renderer.select(query, schema);
    log.debug("Compiled {} query into {}", query.getQueryType(), statement.sql());
    return new PostgresRowIterator(dataSource, statement,
        query.getSelectedColumns().stream().map(schema::requireColumn).toList(),
        properties.getFetchSize(), properties.getBatchSize());
  }
}
