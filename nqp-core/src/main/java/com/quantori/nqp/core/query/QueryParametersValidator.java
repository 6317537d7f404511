package com.quantori.nqp.core.query;

import com.quantori.nqp.api.model.ColumnDefinition;
import com.quantori.nqp.api.model.EntitySchema;
import com.quantori.nqp.api.model.SchemaCatalog;
import com.quantori.nqp.core.license.LicensePolicy;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Start-up check of the parameter maps against the schema catalog. Every referenced column has to exist, boolean
 * references have to point to boolean columns.
 */
@Slf4j
public class QueryParametersValidator {

  private QueryParametersValidator() {
  }

  /**
   * @throws IllegalStateException listing every invalid reference
   */
  public static void validate(QueryParameterMaps parameterMaps, SchemaCatalog schemaCatalog) {
    var problems = new ArrayList<String>();
    for (QueryParameters parameters : parameterMaps.all()) {
      EntitySchema schema = schemaCatalog.schema(parameters.getQueryType().getEntityType());
      var check = new Check(parameters.getQueryType().getQueryName(), schema, problems);

      parameters.getDefaultColumns().forEach(check::exists);
      parameters.getFieldColumns().values().forEach(columns -> columns.forEach(check::exists));
      parameters.getColumnSwitches().values().forEach(columns -> columns.forEach(check::exists));
      parameters.getWhereColumns().values().forEach(group -> group.columns().forEach(check::exists));
      parameters.partners().ifPresent(group -> {
        group.getSideColumns().forEach(check::exists);
        group.getOtherSideColumns().forEach(check::exists);
        Optional.ofNullable(group.getLoopColumn()).ifPresent(check::exists);
        Optional.ofNullable(group.getOtherLoopColumn()).ifPresent(check::exists);
      });
      for (FlagGroup group : parameters.getFlagGroups()) {
        group.allColumns().forEach(check::bool);
        group.getOverrides().values().forEach(overrides -> overrides.forEach(override -> {
          switch (override.kind()) {
            case ARRAY_MEMBERSHIP -> check.array(override.column());
            case BOOLEAN_COLUMNS -> override.valueColumns().values().forEach(check::bool);
            default -> problems.add("Unexpected override kind " + override.kind());
          }
        }));
      }
      parameters.getBooleanFilters().values().forEach(filter -> filter.columns().forEach(check::bool));
      Optional.ofNullable(parameters.getPairFilter()).ifPresent(filter -> {
        check.exists(filter.keyColumn());
        check.exists(filter.valueColumn());
      });
      LicensePolicy policy = parameters.getLicensePolicy();
      if (policy != null) {
        check.exists(policy.resourceColumn());
        Optional.ofNullable(policy.prefixColumn()).ifPresent(check::array);
      }
    }
    if (!problems.isEmpty()) {
      throw new IllegalStateException("Invalid query parameter maps: " + String.join("; ", problems));
    }
    log.info("Query parameter maps of {} queries validated", parameterMaps.all().size());
  }

  private record Check(String query, EntitySchema schema, List<String> problems) {

    Optional<ColumnDefinition> exists(String column) {
      Optional<ColumnDefinition> definition = schema.column(column);
      if (definition.isEmpty()) {
        problems.add(String.format("%s refers to unknown column %s", query, column));
      }
      return definition;
    }

    void bool(String column) {
      exists(column).filter(definition -> !definition.isBoolean())
          .ifPresent(definition -> problems.add(String.format("%s expects %s to be boolean", query, column)));
    }

    void array(String column) {
      exists(column).filter(definition -> !definition.isArray())
          .ifPresent(definition -> problems.add(String.format("%s expects %s to be an array", query, column)));
    }
  }
}
