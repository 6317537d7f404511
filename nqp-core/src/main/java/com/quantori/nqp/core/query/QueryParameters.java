package com.quantori.nqp.core.query;

import com.quantori.nqp.api.model.QueryType;
import com.quantori.nqp.core.license.LicensePolicy;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Declarative description of how request arguments of one query type translate into a query. Built once, read only
 * afterwards.
 */
@Value
@Builder
public class QueryParameters {
  @NonNull
  QueryType queryType;
  /**
   * Recognised arguments besides the common ones.
   */
  @Singular("argument")
  List<ArgumentSpec> arguments;
  /**
   * Alternative argument name to canonical argument name.
   */
  @Singular("argumentSynonym")
  Map<String, String> argumentSynonyms;
  @Singular("defaultColumn")
  List<String> defaultColumns;
  /**
   * Requestable field to the columns it expands to.
   */
  @Singular("fieldColumn")
  Map<String, List<String>> fieldColumns;
  /**
   * Alternative field name to canonical field name.
   */
  @Singular("fieldSynonym")
  Map<String, String> fieldSynonyms;
  /**
   * Any column of the table may be requested as a field.
   */
  boolean openFields;
  /**
   * Boolean argument to the columns selected when it is true.
   */
  @Singular("columnSwitch")
  Map<String, List<String>> columnSwitches;
  @Singular("whereColumn")
  Map<String, ColumnGroup> whereColumns;
  PartnerGroup partnerGroup;
  @Singular("flagGroup")
  List<FlagGroup> flagGroups;
  @Singular("booleanFilter")
  Map<String, BooleanFilter> booleanFilters;
  /**
   * Values of list arguments applied when the argument is absent.
   */
  @Singular("defaultValues")
  Map<String, List<String>> defaults;
  DatasetDefault datasetDefault;
  /**
   * At least one of these arguments must be given unless full downloads are allowed.
   */
  @Singular("requiredArgument")
  Set<String> requiredAnyOf;
  PairFilter pairFilter;
  /**
   * Attribution columns for license filtering, null if the query is not filtered.
   */
  LicensePolicy licensePolicy;
  boolean distinct;

  public Optional<PartnerGroup> partners() {
    return Optional.ofNullable(partnerGroup);
  }

  public Optional<ArgumentSpec> argument(String name) {
    return arguments.stream().filter(spec -> spec.name().equals(name)).findFirst();
  }

  public Optional<FlagGroup> flagGroupWithField(String field) {
    return flagGroups.stream().filter(group -> field.equals(group.getFieldName())).findFirst();
  }
}
