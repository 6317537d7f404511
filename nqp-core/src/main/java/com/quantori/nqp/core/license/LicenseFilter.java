package com.quantori.nqp.core.license;

import com.quantori.nqp.api.model.LicenseTier;
import com.quantori.nqp.api.model.Row;
import com.quantori.nqp.core.registry.ResourceRegistry;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.apache.commons.lang3.StringUtils;

/**
 * Row-local license filter. Resource attributions not enabled at the requested tier are removed from the row, rows
 * left without any attribution are dropped. Rows are never reordered.
 */
public class LicenseFilter implements Function<Row, Optional<Row>> {

  private final ResourceRegistry registry;
  private final LicenseTier tier;
  private final Set<String> enabled;
  private final LicensePolicy policy;
  private final int resourceIndex;
  private final int prefixIndex;

  private LicenseFilter(ResourceRegistry registry, LicenseTier tier, LicensePolicy policy, List<String> columns) {
    this.registry = registry;
    this.tier = tier;
    this.enabled = policy == null ? Set.of() : registry.enabledResources(tier);
    this.policy = policy;
    this.resourceIndex = policy == null ? -1 : columns.indexOf(policy.resourceColumn());
    this.prefixIndex = policy == null || policy.prefixColumn() == null ? -1 : columns.indexOf(policy.prefixColumn());
  }

  /**
   * Filter of one query.
   *
   * @param registry registry snapshot
   * @param tier     requested tier
   * @param policy   attribution columns, null for unfiltered queries
   * @param columns  columns of the rows passed to the filter
   */
  public static LicenseFilter create(ResourceRegistry registry, LicenseTier tier, LicensePolicy policy,
                                     List<String> columns) {
    if (tier == LicenseTier.IGNORE || policy == null) {
      return new LicenseFilter(registry, LicenseTier.IGNORE, null, columns);
    }
    if (!columns.contains(policy.resourceColumn())) {
      throw new IllegalArgumentException("Resource column " + policy.resourceColumn() + " is not selected");
    }
    return new LicenseFilter(registry, tier, policy, columns);
  }

  public boolean isPassThrough() {
    return tier == LicenseTier.IGNORE || policy == null;
  }

  /**
   * @return the filtered row, empty if the row has to be dropped
   */
  @Override
  public Optional<Row> apply(Row row) {
    if (isPassThrough()) {
      return Optional.of(row);
    }
    Object resources = row.get(resourceIndex);
    if (policy.simple()) {
      return resources != null && enabled.contains(String.valueOf(resources)) ? Optional.of(row) : Optional.empty();
    }
    List<String> kept = keep(asList(resources));
    if (kept.isEmpty()) {
      return Optional.empty();
    }
    Row result = row.with(resourceIndex, kept);
    if (prefixIndex >= 0 && row.get(prefixIndex) != null) {
      Set<String> keptSet = Set.copyOf(kept);
      List<String> prefixed = asList(row.get(prefixIndex)).stream()
          .filter(value -> keptSet.contains(StringUtils.substringBefore(value, ":")))
          .toList();
      result = result.with(prefixIndex, prefixed);
    }
    return Optional.of(result);
  }

  /**
   * Lazily filtered view of a row iterator.
   */
  public Iterator<Row> filter(Iterator<Row> rows) {
    if (isPassThrough()) {
      return rows;
    }
    return new Iterator<>() {
      private Row next;

      @Override
      public boolean hasNext() {
        while (next == null && rows.hasNext()) {
          next = apply(rows.next()).orElse(null);
        }
        return next != null;
      }

      @Override
      public Row next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        Row result = next;
        next = null;
        return result;
      }
    };
  }

  private List<String> keep(List<String> resources) {
    List<String> kept = new ArrayList<>();
    for (String resource : resources) {
      if (enabled.contains(resource)) {
        kept.add(resource);
      }
    }
    boolean removed = true;
    while (removed) {
      Set<String> present = Set.copyOf(kept);
      removed = kept.removeIf(resource -> registry.isComposite(resource)
          && registry.components(resource).stream().noneMatch(present::contains));
    }
    return kept;
  }

  private static List<String> asList(Object value) {
    if (value == null) {
      return List.of();
    }
    if (value instanceof List<?> list) {
      return list.stream().map(String::valueOf).toList();
    }
    return List.of(String.valueOf(value));
  }
}
