package com.quantori.nqp.core.normalize;

import static com.quantori.nqp.core.query.QueryParameterMaps.FIELDS;

import com.quantori.nqp.api.model.EntitySchema;
import com.quantori.nqp.api.model.QueryType;
import com.quantori.nqp.api.model.SchemaCatalog;
import com.quantori.nqp.core.query.ArgumentSpec;
import com.quantori.nqp.core.query.FlagGroup;
import com.quantori.nqp.core.query.QueryParameterMaps;
import com.quantori.nqp.core.query.QueryParameters;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Turns loosely typed request arguments into {@link QueryArguments}. Problems are collected over all arguments and
 * reported together.
 */
@Slf4j
public class ArgumentNormalizer {

  static final String FULL_DOWNLOAD_MESSAGE = "Downloading the entire annotations database by the REST API is not "
      + "allowed because of its huge size (>1GB). We recommend to query a set of proteins or a few resources, "
      + "depending on your interest. You can find the list of resources at the `annotations_summary` query.";

  private final QueryParameterMaps parameterMaps;
  private final SchemaCatalog schemaCatalog;
  private final boolean fullDownloadAllowed;

  public ArgumentNormalizer(QueryParameterMaps parameterMaps, SchemaCatalog schemaCatalog,
                            boolean fullDownloadAllowed) {
    this.parameterMaps = parameterMaps;
    this.schemaCatalog = schemaCatalog;
    this.fullDownloadAllowed = fullDownloadAllowed;
  }

  public QueryArguments normalize(QueryType queryType, Map<String, List<String>> rawArguments) {
    return normalize(queryType, rawArguments, Map.of());
  }

  /**
   * Normalizes the arguments of a data query.
   *
   * @param queryType    requested query
   * @param rawArguments argument name to the values as received, repeated arguments keep all values
   * @param vocabularies closed vocabularies known only at runtime, e.g. the discovered resource names
   * @return canonical arguments
   * @throws InvalidArgumentException if any argument or value is not recognised
   */
  public QueryArguments normalize(QueryType queryType, Map<String, List<String>> rawArguments,
                                  Map<String, Set<String>> vocabularies) {
    QueryParameters parameters = parameterMaps.get(queryType);
    QueryArguments arguments = normalize(queryType, argumentSpecs(queryType, vocabularies),
        parameters.getArgumentSynonyms(), rawArguments);

    if (!fullDownloadAllowed && !parameters.getRequiredAnyOf().isEmpty()
        && parameters.getRequiredAnyOf().stream().noneMatch(arguments::has)) {
      throw new InvalidArgumentException(FULL_DOWNLOAD_MESSAGE);
    }
    return arguments;
  }

  /**
   * Normalizes arguments against an explicit list of specs, used by meta operations.
   */
  public QueryArguments normalize(QueryType queryType, List<ArgumentSpec> specs, Map<String, String> synonyms,
                                  Map<String, List<String>> rawArguments) {
    Map<String, ArgumentSpec> byName = specs.stream()
        .collect(Collectors.toMap(ArgumentSpec::name, Function.identity(), (first, second) -> second,
            LinkedHashMap::new));
    var problems = new ArrayList<String>();
    var values = new LinkedHashMap<String, Object>();

    rawArguments.forEach((name, raw) -> {
      String canonicalName = synonyms.getOrDefault(name, name);
      ArgumentSpec spec = byName.get(canonicalName);
      if (spec == null) {
        problems.add(String.format("Unknown argument: `%s`", name));
        return;
      }
      List<String> tokens = tokens(spec, raw);
      if (tokens.isEmpty()) {
        return;
      }
      var unknown = new ArrayList<String>();
      Object value = coerce(spec, tokens, unknown);
      if (!unknown.isEmpty()) {
        problems.add(String.format("Unknown values for argument `%s`: `%s`", name, String.join(", ", unknown)));
      } else if (value instanceof List<?> list && values.get(canonicalName) instanceof List<?> previous) {
        var merged = new LinkedHashSet<Object>(previous);
        merged.addAll(list);
        values.put(canonicalName, List.copyOf(merged));
      } else if (value != null) {
        values.put(canonicalName, value);
      }
    });

    if (!problems.isEmpty()) {
      log.debug("Rejected arguments {}: {}", rawArguments, problems);
      throw new InvalidArgumentException(problems);
    }
    return QueryArguments.of(queryType, values);
  }

  /**
   * Every argument a data query accepts, with the vocabularies valid right now.
   */
  public List<ArgumentSpec> argumentSpecs(QueryType queryType, Map<String, Set<String>> vocabularies) {
    QueryParameters parameters = parameterMaps.get(queryType);
    var specs = new ArrayList<>(QueryParameterMaps.commonArguments());
    parameters.getArguments().forEach(spec -> {
      Set<String> vocabulary = vocabularies.get(spec.name());
      specs.add(vocabulary == null || vocabulary.isEmpty() ? spec : spec.withValues(vocabulary));
    });
    specs.add(new ArgumentSpec(FIELDS, ArgumentSpec.Kind.LIST, fieldNames(parameters),
        parameters.getFieldSynonyms()));
    return specs;
  }

  private Set<String> fieldNames(QueryParameters parameters) {
    var names = new TreeSet<String>(parameters.getFieldColumns().keySet());
    parameters.getFlagGroups().stream()
        .map(FlagGroup::getFieldName)
        .filter(Objects::nonNull)
        .forEach(names::add);
    if (parameters.isOpenFields()) {
      EntitySchema schema = schemaCatalog.schema(parameters.getQueryType().getEntityType());
      schema.columnNames().stream()
          .filter(column -> !EntitySchema.ID_COLUMN.equals(column))
          .forEach(names::add);
    }
    return names;
  }

  private static List<String> tokens(ArgumentSpec spec, List<String> raw) {
    if (raw == null) {
      return List.of();
    }
    if (spec.kind() == ArgumentSpec.Kind.STRING) {
      return raw.stream().filter(StringUtils::isNotBlank).map(String::trim).toList();
    }
    return raw.stream()
        .filter(Objects::nonNull)
        .flatMap(value -> Arrays.stream(StringUtils.split(value, ',')))
        .map(String::trim)
        .filter(StringUtils::isNotEmpty)
        .distinct()
        .toList();
  }

  private static Object coerce(ArgumentSpec spec, List<String> tokens, List<String> unknown) {
    String last = tokens.get(tokens.size() - 1);
    return switch (spec.kind()) {
      case LIST -> {
        var result = new LinkedHashSet<String>();
        tokens.forEach(token -> {
          if (spec.accepts(token)) {
            result.add(spec.canonical(token));
          } else {
            unknown.add(token);
          }
        });
        yield List.copyOf(result);
      }
      case BOOLEAN -> {
        Boolean value = parseBoolean(last);
        if (value == null) {
          unknown.add(last);
        }
        yield value;
      }
      case INTEGER -> {
        if (!NumberUtils.isDigits(last)) {
          unknown.add(last);
          yield null;
        }
        try {
          yield Integer.valueOf(last);
        } catch (NumberFormatException e) {
          unknown.add(last);
          yield null;
        }
      }
      case STRING -> {
        if (!spec.accepts(last) && !spec.accepts(last.toLowerCase(Locale.ROOT))) {
          unknown.add(last);
          yield null;
        }
        yield spec.accepts(last) ? spec.canonical(last) : spec.canonical(last.toLowerCase(Locale.ROOT));
      }
    };
  }

  static Boolean parseBoolean(String value) {
    return switch (value.toLowerCase(Locale.ROOT)) {
      case "1", "true", "yes" -> Boolean.TRUE;
      case "0", "false", "no" -> Boolean.FALSE;
      default -> null;
    };
  }
}
