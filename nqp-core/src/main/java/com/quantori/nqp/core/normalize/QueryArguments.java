package com.quantori.nqp.core.normalize;

import static com.quantori.nqp.core.query.QueryParameterMaps.FORMAT;
import static com.quantori.nqp.core.query.QueryParameterMaps.HEADER;
import static com.quantori.nqp.core.query.QueryParameterMaps.LICENSE;
import static com.quantori.nqp.core.query.QueryParameterMaps.LIMIT;

import com.quantori.nqp.api.model.LicenseTier;
import com.quantori.nqp.api.model.QueryType;
import com.quantori.nqp.core.format.OutputFormat;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Canonical typed request arguments. Values are {@code List<String>} for list arguments, {@link Boolean},
 * {@link Integer} or {@link String} otherwise. Absent and empty arguments have no entry.
 */
@ToString
@EqualsAndHashCode
public class QueryArguments {

  /**
   * Query type, null for meta operations.
   */
  @Getter
  private final QueryType queryType;
  private final Map<String, Object> values;

  public QueryArguments(QueryType queryType, Map<String, Object> values) {
    this.queryType = queryType;
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static QueryArguments of(QueryType queryType, Map<String, Object> values) {
    return new QueryArguments(queryType, values);
  }

  public boolean has(String name) {
    return values.containsKey(name);
  }

  public Object get(String name) {
    return values.get(name);
  }

  public Map<String, Object> asMap() {
    return values;
  }

  @SuppressWarnings("unchecked")
  public List<String> list(String name) {
    Object value = values.get(name);
    if (value == null) {
      return List.of();
    }
    if (value instanceof List<?> list) {
      return (List<String>) list;
    }
    return List.of(String.valueOf(value));
  }

  public Optional<Boolean> bool(String name) {
    return Optional.ofNullable(values.get(name)).map(value -> value instanceof Boolean b ? b
        : Boolean.valueOf(String.valueOf(value)));
  }

  public Optional<Integer> integer(String name) {
    return Optional.ofNullable(values.get(name)).map(value -> value instanceof Integer i ? i
        : Integer.valueOf(String.valueOf(value)));
  }

  public Optional<String> string(String name) {
    return Optional.ofNullable(values.get(name)).map(String::valueOf);
  }

  public Optional<Integer> limit() {
    return integer(LIMIT);
  }

  public Optional<OutputFormat> format() {
    return string(FORMAT).flatMap(OutputFormat::fromName);
  }

  /**
   * Header line requested, true unless explicitly disabled.
   */
  public boolean header() {
    return bool(HEADER).orElse(true);
  }

  public Optional<LicenseTier> license() {
    return string(LICENSE).flatMap(LicenseTier::fromName);
  }

  /**
   * Copy with one argument set, a null value removes the argument.
   */
  public QueryArguments with(String name, Object value) {
    var copy = new LinkedHashMap<>(values);
    if (value == null) {
      copy.remove(name);
    } else {
      copy.put(name, value);
    }
    return new QueryArguments(queryType, copy);
  }
}
