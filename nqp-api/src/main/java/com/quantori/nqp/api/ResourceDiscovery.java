package com.quantori.nqp.api;

import com.quantori.nqp.api.model.Criteria;
import com.quantori.nqp.api.model.EntityType;
import java.util.Map;
import java.util.Set;

/**
 * Enumerates resource attribution values of entity tables. Used once per registry build.
 */
public interface ResourceDiscovery {

  /**
   * Distinct values of a column. Array columns are unnested.
   *
   * @param entityType table to look at
   * @param column     column name
   * @param filter     optional restriction, may be null
   * @return distinct non-null values
   */
  Set<String> distinctValues(EntityType entityType, String column, Criteria filter);

  /**
   * Co-occurrence of values of two columns. Array columns are unnested.
   *
   * @param entityType  table to look at
   * @param keyColumn   column providing the keys of the result
   * @param valueColumn column providing the values of the result
   * @param filter      optional restriction, may be null
   * @return mapping of every key value to the distinct values seen in the same rows
   */
  Map<String, Set<String>> coOccurringValues(EntityType entityType, String keyColumn, String valueColumn,
                                             Criteria filter);
}
