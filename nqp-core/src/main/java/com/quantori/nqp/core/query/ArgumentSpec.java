package com.quantori.nqp.core.query;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A request argument recognised by a query.
 *
 * @param name          canonical argument name
 * @param kind          value coercion applied by the normalizer
 * @param values        closed vocabulary, empty for open arguments
 * @param valueSynonyms alternative spellings accepted for vocabulary values
 */
public record ArgumentSpec(String name, Kind kind, Set<String> values, Map<String, String> valueSynonyms) {

  public ArgumentSpec {
    values = Set.copyOf(values);
    valueSynonyms = Map.copyOf(valueSynonyms);
  }

  public static ArgumentSpec list(String name, String... values) {
    return new ArgumentSpec(name, Kind.LIST, new LinkedHashSet<>(Arrays.asList(values)), Map.of());
  }

  public static ArgumentSpec bool(String name) {
    return new ArgumentSpec(name, Kind.BOOLEAN, Set.of(), Map.of());
  }

  public static ArgumentSpec integer(String name) {
    return new ArgumentSpec(name, Kind.INTEGER, Set.of(), Map.of());
  }

  public static ArgumentSpec string(String name, String... values) {
    return new ArgumentSpec(name, Kind.STRING, new LinkedHashSet<>(Arrays.asList(values)), Map.of());
  }

  public ArgumentSpec withSynonyms(Map<String, String> synonyms) {
    return new ArgumentSpec(name, kind, values, synonyms);
  }

  public ArgumentSpec withValues(Set<String> vocabulary) {
    return new ArgumentSpec(name, kind, vocabulary, valueSynonyms);
  }

  public boolean isClosed() {
    return !values.isEmpty();
  }

  /**
   * Canonical spelling of a value, the value itself when it has no synonym.
   */
  public String canonical(String value) {
    return valueSynonyms.getOrDefault(value, value);
  }

  public boolean accepts(String value) {
    return !isClosed() || values.contains(value) || valueSynonyms.containsKey(value);
  }

  public enum Kind {
    LIST,
    BOOLEAN,
    INTEGER,
    STRING
  }
}
