package com.quantori.nqp.core.query;

import static com.quantori.nqp.core.query.QueryParameterMaps.FIELDS;

import com.quantori.nqp.api.model.ColumnCriteria;
import com.quantori.nqp.api.model.CompiledQuery;
import com.quantori.nqp.api.model.ConjunctionCriteria;
import com.quantori.nqp.api.model.Criteria;
import com.quantori.nqp.api.model.EntitySchema;
import com.quantori.nqp.api.model.FieldCriteria;
import com.quantori.nqp.api.model.LicenseTier;
import com.quantori.nqp.api.model.SchemaCatalog;
import com.quantori.nqp.core.license.LicensePolicy;
import com.quantori.nqp.core.normalize.QueryArguments;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Compiles normalized arguments into a {@link CompiledQuery} following the parameter map of the query type.
 *
 * <p>Predicates are AND'd in a fixed order: partners, where columns, flag groups, boolean filters, pair filter and
 * loop exclusion. The compiler is stateless and safe for concurrent use.
 */
@Slf4j
public class QueryCompiler {

  private final QueryParameterMaps parameterMaps;
  private final SchemaCatalog schemaCatalog;

  public QueryCompiler(QueryParameterMaps parameterMaps, SchemaCatalog schemaCatalog) {
    this.parameterMaps = parameterMaps;
    this.schemaCatalog = schemaCatalog;
  }

  public CompiledQuery compile(QueryArguments arguments) {
    QueryParameters parameters = parameterMaps.get(arguments.getQueryType());
    EntitySchema schema = schemaCatalog.schema(arguments.getQueryType().getEntityType());
    QueryArguments effective = applyDefaults(arguments, parameters);

    List<String> columns = selectColumns(effective, parameters, schema);
    var where = new ArrayList<Criteria>();
    Stream.of(
            partnerClause(effective, parameters, schema),
            whereClause(effective, parameters, schema),
            boolClause(effective, parameters, schema),
            pairClause(effective, parameters, schema),
            loopClause(effective, parameters))
        .filter(Objects::nonNull)
        .forEach(where::add);

    CompiledQuery query = CompiledQuery.builder()
        .queryType(arguments.getQueryType())
        .entityType(schema.getEntityType())
        .columns(columns)
        .auxiliaryColumns(auxiliaryColumns(effective, parameters, columns))
        .distinct(parameters.isDistinct())
        .where(ConjunctionCriteria.of(where, ConjunctionCriteria.Operator.AND))
        .limit(effective.limit().orElse(null))
        .build();
    log.debug("Compiled {} into {}", arguments, query);
    return query;
  }

  /**
   * Adds the declared default values of absent arguments and the default dataset.
   */
  public QueryArguments applyDefaults(QueryArguments arguments, QueryParameters parameters) {
    QueryArguments result = arguments;
    for (Map.Entry<String, List<String>> entry : parameters.getDefaults().entrySet()) {
      if (!result.has(entry.getKey())) {
        result = result.with(entry.getKey(), entry.getValue());
      }
    }
    DatasetDefault datasetDefault = parameters.getDatasetDefault();
    if (datasetDefault != null && datasetDefault.unlessPresent().stream().noneMatch(arguments::has)) {
      result = result.with(datasetDefault.argument(), datasetDefault.values());
    }
    return result;
  }

  /**
   * Output columns in schema order, never the surrogate key.
   */
  public List<String> selectColumns(QueryArguments arguments, QueryParameters parameters, EntitySchema schema) {
    var requested = new LinkedHashSet<>(parameters.getDefaultColumns());
    parameters.getColumnSwitches().forEach((argument, columns) -> {
      if (arguments.bool(argument).orElse(false)) {
        requested.addAll(columns);
      }
    });
    for (String field : arguments.list(FIELDS)) {
      List<String> columns = parameters.getFieldColumns().get(field);
      if (columns != null) {
        requested.addAll(columns);
        continue;
      }
      parameters.flagGroupWithField(field).ifPresentOrElse(
          group -> requested.addAll(flagColumns(group, arguments.list(group.getArgument()))),
          () -> requested.add(field));
    }
    return schema.columnNames().stream()
        .filter(column -> !EntitySchema.ID_COLUMN.equals(column))
        .filter(requested::contains)
        .toList();
  }

  /**
   * Predicates of the plain WHERE arguments.
   */
  public Criteria whereClause(QueryArguments arguments, QueryParameters parameters, EntitySchema schema) {
    var clauses = new ArrayList<Criteria>();
    parameters.getWhereColumns().forEach((argument, group) -> {
      List<String> values = arguments.list(argument);
      if (values.isEmpty()) {
        return;
      }
      List<Criteria> perColumn = group.columns().stream()
          .map(column -> (Criteria) OperatorInference.criteria(schema.requireColumn(column), values))
          .toList();
      boolean conjunctive = values.size() == 1 && group.conjunctiveValues().contains(values.get(0));
      clauses.add(ConjunctionCriteria.of(perColumn,
          conjunctive ? ConjunctionCriteria.Operator.AND : ConjunctionCriteria.Operator.OR));
    });
    return ConjunctionCriteria.of(clauses, ConjunctionCriteria.Operator.AND);
  }

  /**
   * Predicate of a two-sided argument group. One side alone matches that side only, two sides are combined by the
   * requested operator.
   */
  public Criteria partnerClause(QueryArguments arguments, QueryParameters parameters, EntitySchema schema) {
    if (parameters.getPartnerGroup() == null) {
      return null;
    }
    PartnerGroup group = parameters.getPartnerGroup();
    List<String> side = arguments.list(group.getSideArgument());
    List<String> otherSide = arguments.list(group.getOtherSideArgument());
    ConjunctionCriteria.Operator operator = group.getOperatorArgument() == null ? group.getDefaultOperator()
        : arguments.string(group.getOperatorArgument())
            .map(ConjunctionCriteria.Operator::valueOf)
            .orElse(group.getDefaultOperator());

    if (side.isEmpty() && otherSide.isEmpty() && group.getPartnersArgument() != null) {
      side = arguments.list(group.getPartnersArgument());
      otherSide = side;
      operator = ConjunctionCriteria.Operator.OR;
    }

    Criteria sideClause = sideClause(group.getSideColumns(), side, schema);
    Criteria otherSideClause = sideClause(group.getOtherSideColumns(), otherSide, schema);
    if (sideClause != null && otherSideClause != null) {
      return new ConjunctionCriteria(sideClause, otherSideClause, operator);
    }
    return sideClause != null ? sideClause : otherSideClause;
  }

  /**
   * Excludes rows whose two sides are the same unless loops are requested.
   */
  public Criteria loopClause(QueryArguments arguments, QueryParameters parameters) {
    PartnerGroup group = parameters.getPartnerGroup();
    if (group == null || group.getLoopColumn() == null || group.getOtherLoopColumn() == null) {
      return null;
    }
    boolean loops = group.getLoopsArgument() != null && arguments.bool(group.getLoopsArgument()).orElse(false);
    return loops ? null
        : new ColumnCriteria(group.getLoopColumn(), ColumnCriteria.Operator.NOT_EQUAL, group.getOtherLoopColumn());
  }

  /**
   * Predicates of flag groups and boolean filters.
   */
  public Criteria boolClause(QueryArguments arguments, QueryParameters parameters, EntitySchema schema) {
    var clauses = new ArrayList<Criteria>();
    for (FlagGroup group : parameters.getFlagGroups()) {
      var perValue = new ArrayList<Criteria>();
      for (String value : arguments.list(group.getArgument())) {
        Criteria overridden = overrideClause(group.overridesOf(value), arguments, schema);
        if (overridden != null) {
          perValue.add(overridden);
        } else {
          group.columnsOf(value).forEach(column -> perValue.add(FieldCriteria.isTrue(column)));
        }
      }
      if (!perValue.isEmpty()) {
        clauses.add(ConjunctionCriteria.of(perValue, ConjunctionCriteria.Operator.OR));
      }
    }
    parameters.getBooleanFilters().forEach((argument, filter) -> {
      Boolean value = arguments.bool(argument).orElse(filter.defaultValue());
      if (value == null || (!filter.exact() && !value)) {
        return;
      }
      List<Criteria> perColumn = filter.columns().stream()
          .map(column -> (Criteria) OperatorInference.criteria(schema.requireColumn(column), value))
          .toList();
      clauses.add(ConjunctionCriteria.of(perColumn, ConjunctionCriteria.Operator.OR));
    });
    return ConjunctionCriteria.of(clauses, ConjunctionCriteria.Operator.AND);
  }

  Criteria pairClause(QueryArguments arguments, QueryParameters parameters, EntitySchema schema) {
    PairFilter filter = parameters.getPairFilter();
    if (filter == null || !arguments.bool(filter.argument()).orElse(false)) {
      return null;
    }
    var pairs = new ArrayList<Criteria>();
    filter.pairs().forEach((key, values) -> pairs.add(new ConjunctionCriteria(
        OperatorInference.criteria(schema.requireColumn(filter.keyColumn()), key),
        OperatorInference.criteria(schema.requireColumn(filter.valueColumn()), values),
        ConjunctionCriteria.Operator.AND)));
    return ConjunctionCriteria.of(pairs, ConjunctionCriteria.Operator.OR);
  }

  private Criteria overrideClause(List<FlagOverride> overrides, QueryArguments arguments, EntitySchema schema) {
    var triggered = new ArrayList<Criteria>();
    for (FlagOverride override : overrides) {
      List<String> trigger = arguments.has(override.triggerArgument())
          ? arguments.list(override.triggerArgument())
          : override.defaultValues();
      if (trigger.isEmpty()) {
        continue;
      }
      switch (override.kind()) {
        case ARRAY_MEMBERSHIP ->
            triggered.add(OperatorInference.criteria(schema.requireColumn(override.column()), trigger));
        case BOOLEAN_COLUMNS -> triggered.add(ConjunctionCriteria.of(
            trigger.stream()
                .map(override.valueColumns()::get)
                .filter(Objects::nonNull)
                .map(column -> (Criteria) FieldCriteria.isTrue(column))
                .toList(),
            ConjunctionCriteria.Operator.OR));
        default -> throw new IllegalStateException("Unexpected override " + override.kind());
      }
    }
    triggered.removeIf(Objects::isNull);
    return ConjunctionCriteria.of(triggered, ConjunctionCriteria.Operator.AND);
  }

  private static Criteria sideClause(List<String> columns, List<String> values, EntitySchema schema) {
    if (values.isEmpty()) {
      return null;
    }
    return ConjunctionCriteria.of(columns.stream()
            .map(column -> (Criteria) OperatorInference.criteria(schema.requireColumn(column), values))
            .toList(),
        ConjunctionCriteria.Operator.OR);
  }

  private static List<String> flagColumns(FlagGroup group, List<String> values) {
    if (values.isEmpty()) {
      return List.copyOf(group.allColumns());
    }
    Set<String> columns = new LinkedHashSet<>();
    values.forEach(value -> columns.addAll(group.columnsOf(value)));
    return List.copyOf(columns);
  }

  private static List<String> auxiliaryColumns(QueryArguments arguments, QueryParameters parameters,
                                               List<String> columns) {
    LicensePolicy policy = parameters.getLicensePolicy();
    if (policy == null || arguments.license().map(LicenseTier.IGNORE::equals).orElse(false)) {
      return List.of();
    }
    return Stream.of(policy.resourceColumn(), policy.prefixColumn())
        .filter(Objects::nonNull)
        .filter(column -> !columns.contains(column))
        .toList();
  }
}
