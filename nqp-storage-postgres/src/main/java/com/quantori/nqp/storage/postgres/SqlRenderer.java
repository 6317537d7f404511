package com.quantori.nqp.storage.postgres;

import com.quantori.nqp.api.model.ColumnCriteria;
import com.quantori.nqp.api.model.ColumnDefinition;
import com.quantori.nqp.api.model.CompiledQuery;
import com.quantori.nqp.api.model.ConjunctionCriteria;
import com.quantori.nqp.api.model.Criteria;
import com.quantori.nqp.api.model.EntitySchema;
import com.quantori.nqp.api.model.FieldCriteria;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders compiled queries into parameterized PostgreSQL statements. Identifiers are taken from the schema catalog
 * and quoted, values are always bound as parameters.
 */
public class SqlRenderer {

  static final String TRUE = "TRUE";
  static final String FALSE = "FALSE";

  public SqlStatement select(CompiledQuery query, EntitySchema schema) {
    var parameters = new ArrayList<>();
    var sql = new StringBuilder("SELECT ");
    if (query.isDistinct()) {
      sql.append("DISTINCT ");
    }
    sql.append(query.getSelectedColumns().stream()
            .map(column -> quote(schema.requireColumn(column).name()))
            .collect(Collectors.joining(", ")))
        .append(" FROM ")
        .append(quote(schema.getEntityType().getTableName()));
    if (query.getWhere() != null) {
      sql.append(" WHERE ").append(where(query.getWhere(), schema, parameters));
    }
    if (query.getLimit() != null) {
      sql.append(" LIMIT ?");
      parameters.add(query.getLimit());
    }
    return new SqlStatement(sql.toString(), parameters);
  }

  /**
   * Distinct values of the given columns, array columns unnested.
   */
  public SqlStatement distinct(EntitySchema schema, List<String> columns, Criteria filter) {
    var parameters = new ArrayList<>();
    List<ColumnDefinition> definitions = columns.stream().map(schema::requireColumn).toList();
    var sql = new StringBuilder("SELECT DISTINCT ");
    var projections = new ArrayList<String>();
    for (int i = 0; i < definitions.size(); i++) {
      ColumnDefinition column = definitions.get(i);
      projections.add((column.isArray() ? "unnest(" + quote(column.name()) + ")" : quote(column.name()))
          + " AS v" + i);
    }
    sql.append(String.join(", ", projections))
        .append(" FROM ")
        .append(quote(schema.getEntityType().getTableName()));
    var conditions = new ArrayList<String>();
    definitions.forEach(column -> conditions.add(quote(column.name()) + " IS NOT NULL"));
    if (filter != null) {
      conditions.add(where(filter, schema, parameters));
    }
    sql.append(" WHERE ").append(String.join(" AND ", conditions));
    return new SqlStatement(sql.toString(), parameters);
  }

  String where(Criteria criteria, EntitySchema schema, List<Object> parameters) {
    if (criteria instanceof ConjunctionCriteria conjunctionCriteria) {
      return where(conjunctionCriteria, schema, parameters);
    } else if (criteria instanceof FieldCriteria fieldCriteria) {
      return where(fieldCriteria, schema, parameters);
    } else if (criteria instanceof ColumnCriteria columnCriteria) {
      return where(columnCriteria, schema);
    }
    throw new IllegalArgumentException("Unsupported criteria " + criteria);
  }

  String where(ConjunctionCriteria criteria, EntitySchema schema, List<Object> parameters) {
    List<Criteria> operands = criteria.getCriteriaList() == null ? List.of()
        : criteria.getCriteriaList().stream().filter(Objects::nonNull).toList();
    if (operands.isEmpty()) {
      return TRUE;
    }
    String separator = switch (criteria.getOperator()) {
      case AND -> " AND ";
      case OR -> " OR ";
    };
    var rendered = new ArrayList<String>();
    for (Criteria operand : operands) {
      rendered.add(where(operand, schema, parameters));
    }
    return "(" + String.join(separator, rendered) + ")";
  }

  String where(FieldCriteria criteria, EntitySchema schema, List<Object> parameters) {
    ColumnDefinition column = schema.requireColumn(criteria.getColumn());
    String name = quote(column.name());
    return switch (criteria.getOperator()) {
      case EQUAL -> {
        parameters.add(convert(criteria.getValue(), column));
        yield name + " = ?";
      }
      case IN -> {
        List<?> values = values(criteria.getValue());
        if (values.isEmpty()) {
          yield FALSE;
        }
        values.forEach(value -> parameters.add(convert(value, column)));
        yield name + " IN (" + values.stream().map(value -> "?").collect(Collectors.joining(", ")) + ")";
      }
      case CONTAINS -> {
        parameters.add(convert(criteria.getValue(), column));
        yield "? = ANY(" + name + ")";
      }
      case OVERLAP -> {
        List<Object> elements = values(criteria.getValue()).stream()
            .map(value -> convert(value, column))
            .toList();
        parameters.add(new SqlStatement.SqlArray(elementType(column), elements));
        yield name + " && ?";
      }
      case IS -> name + (Boolean.TRUE.equals(criteria.getValue()) ? " IS TRUE" : " IS FALSE");
    };
  }

  String where(ColumnCriteria criteria, EntitySchema schema) {
    String left = quote(schema.requireColumn(criteria.getLeft()).name());
    String right = quote(schema.requireColumn(criteria.getRight()).name());
    return switch (criteria.getOperator()) {
      case EQUAL -> left + " = " + right;
      case NOT_EQUAL -> left + " <> " + right;
    };
  }

  static String quote(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  private static List<?> values(Object value) {
    if (value instanceof Collection<?> collection) {
      return List.copyOf(collection);
    }
    return value == null ? List.of() : List.of(value);
  }

  private static Object convert(Object value, ColumnDefinition column) {
    if (value == null) {
      return null;
    }
    return switch (column.scalarType()) {
      case INTEGER -> value instanceof Number number ? number.intValue() : Integer.valueOf(value.toString().trim());
      case STRING, JSON -> value instanceof Boolean ? value : value.toString();
    };
  }

  private static String elementType(ColumnDefinition column) {
    return switch (column.scalarType()) {
      case INTEGER -> "integer";
      case STRING, JSON -> "text";
    };
  }
}
