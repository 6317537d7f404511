package com.quantori.nqp.api.model;

import java.util.Objects;

/**
 * A column of an entity table as seen by the query compiler.
 *
 * @param name       physical column name
 * @param kind       semantic kind used for operator inference
 * @param scalarType value type of scalar elements, for arrays the type of the elements
 */
public record ColumnDefinition(String name, Kind kind, ScalarType scalarType) {

  public ColumnDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    scalarType = Objects.requireNonNullElse(scalarType, ScalarType.STRING);
  }

  public static ColumnDefinition text(String name) {
    return new ColumnDefinition(name, Kind.SCALAR, ScalarType.STRING);
  }

  public static ColumnDefinition integer(String name) {
    return new ColumnDefinition(name, Kind.SCALAR, ScalarType.INTEGER);
  }

  public static ColumnDefinition json(String name) {
    return new ColumnDefinition(name, Kind.SCALAR, ScalarType.JSON);
  }

  public static ColumnDefinition array(String name) {
    return new ColumnDefinition(name, Kind.ARRAY, ScalarType.STRING);
  }

  public static ColumnDefinition bool(String name) {
    return new ColumnDefinition(name, Kind.BOOLEAN, ScalarType.STRING);
  }

  public boolean isArray() {
    return kind == Kind.ARRAY;
  }

  public boolean isBoolean() {
    return kind == Kind.BOOLEAN;
  }

  public enum Kind {
    SCALAR,
    ARRAY,
    BOOLEAN
  }

  public enum ScalarType {
    STRING,
    INTEGER,
    JSON
  }
}
