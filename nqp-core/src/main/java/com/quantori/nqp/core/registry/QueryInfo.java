package com.quantori.nqp.core.registry;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Participation of a resource in one entity table.
 *
 * @param datasets          dataset flags co-occurring with the resource, interactions only
 * @param genericCategories generic intercell categories of the resource, intercell only
 */
public record QueryInfo(Set<String> datasets, Set<String> genericCategories) {

  public static final QueryInfo EMPTY = new QueryInfo(Set.of(), Set.of());

  public QueryInfo {
    datasets = Collections.unmodifiableSet(new TreeSet<>(datasets));
    genericCategories = Collections.unmodifiableSet(new TreeSet<>(genericCategories));
  }
}
