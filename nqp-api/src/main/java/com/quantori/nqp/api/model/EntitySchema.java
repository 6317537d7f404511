package com.quantori.nqp.api.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Ordered columns of one entity table.
 */
@Getter
@ToString
@EqualsAndHashCode
public class EntitySchema {

  /** Surrogate key, never selected. */
  public static final String ID_COLUMN = "id";

  private final EntityType entityType;
  private final List<ColumnDefinition> columns;
  @ToString.Exclude
  @EqualsAndHashCode.Exclude
  private final Map<String, ColumnDefinition> byName;

  public EntitySchema(EntityType entityType, List<ColumnDefinition> columns) {
    this.entityType = entityType;
    this.columns = List.copyOf(columns);
    var index = new LinkedHashMap<String, ColumnDefinition>();
    for (ColumnDefinition column : columns) {
      if (index.put(column.name(), column) != null) {
        throw new IllegalArgumentException("Duplicate column " + column.name() + " in " + entityType);
      }
    }
    this.byName = Map.copyOf(index);
  }

  public Optional<ColumnDefinition> column(String name) {
    return Optional.ofNullable(byName.get(name));
  }

  public ColumnDefinition requireColumn(String name) {
    return column(name).orElseThrow(() -> new IllegalArgumentException(
        String.format("Unknown column %s of %s", name, entityType.getTableName())));
  }

  public boolean hasColumn(String name) {
    return byName.containsKey(name);
  }

  public List<String> columnNames() {
    return columns.stream().map(ColumnDefinition::name).toList();
  }
}
