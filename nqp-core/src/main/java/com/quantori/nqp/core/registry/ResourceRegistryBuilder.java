package com.quantori.nqp.core.registry;

import com.quantori.nqp.api.ResourceDiscovery;
import com.quantori.nqp.api.model.ColumnDefinition;
import com.quantori.nqp.api.model.EntitySchema;
import com.quantori.nqp.api.model.EntityType;
import com.quantori.nqp.api.model.FieldCriteria;
import com.quantori.nqp.api.model.License;
import com.quantori.nqp.api.model.LicenseCatalog;
import com.quantori.nqp.api.model.LicensePurpose;
import com.quantori.nqp.api.model.QueryType;
import com.quantori.nqp.api.model.SchemaCatalog;
import com.quantori.nqp.core.query.FlagGroup;
import com.quantori.nqp.core.query.QueryParameterMaps;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Discovers the resources of every entity table and resolves their licenses.
 */
@Slf4j
public class ResourceRegistryBuilder {

  /**
   * Columns carrying resource attribution, by priority.
   */
  static final List<String> RESOURCE_COLUMNS = List.of("database", "sources", "source", "category");
  static final String SCOPE_COLUMN = "scope";
  static final String GENERIC_SCOPE = "generic";
  static final String CATEGORY_COLUMN = "category";

  private final SchemaCatalog schemaCatalog;
  private final ResourceDiscovery resourceDiscovery;
  private final LicenseCatalog licenseCatalog;
  private final QueryParameterMaps parameterMaps;

  public ResourceRegistryBuilder(SchemaCatalog schemaCatalog, ResourceDiscovery resourceDiscovery,
                                 LicenseCatalog licenseCatalog, QueryParameterMaps parameterMaps) {
    this.schemaCatalog = schemaCatalog;
    this.resourceDiscovery = resourceDiscovery;
    this.licenseCatalog = licenseCatalog;
    this.parameterMaps = parameterMaps;
  }

  public ResourceRegistry build() {
    log.info("Updating resource information");
    Map<String, Map<EntityType, QueryInfo>> queries = new TreeMap<>();
    for (EntityType entityType : EntityType.values()) {
      EntitySchema schema = schemaCatalog.schema(entityType);
      Optional<String> resourceColumn = resourceColumn(schema);
      if (resourceColumn.isEmpty()) {
        log.warn("No resource column in {}", entityType.getTableName());
        continue;
      }
      String column = resourceColumn.get();
      Map<String, Set<String>> datasets = entityType == EntityType.INTERACTIONS
          ? datasets(entityType, column, schema) : Map.of();
      Map<String, Set<String>> categories = entityType == EntityType.INTERCELL
          ? genericCategories(entityType, column, schema) : Map.of();

      Set<String> resources = resourceDiscovery.distinctValues(entityType, column, null);
      log.info("Found {} resources in {}", resources.size(), entityType.getTableName());
      resources.forEach(resource -> queries.computeIfAbsent(resource, key -> new TreeMap<>())
          .put(entityType, new QueryInfo(datasets.getOrDefault(resource, Set.of()),
              categories.getOrDefault(resource, Set.of()))));
    }

    var entries = new HashMap<String, ResourceEntry.ResourceEntryBuilder>();
    queries.forEach((name, info) -> entries.put(name, ResourceEntry.builder()
        .name(name)
        .license(license(name))
        .queries(info)));
    entries.forEach((name, builder) -> {
      if (builder.build().isComposite()) {
        String suffix = "_" + name;
        entries.keySet().stream()
            .filter(other -> other.endsWith(suffix) && other.length() > suffix.length())
            .forEach(builder::component);
      }
    });
    var registry = new ResourceRegistry(entries.values().stream().map(ResourceEntry.ResourceEntryBuilder::build)
        .toList());
    log.info("Resource registry built with {} resources", registry.entries().size());
    return registry;
  }

  /**
   * License of a resource. Composite, ignored or missing licenses of {@code Prefix_Suffix} names are inherited from
   * the prefix when the prefix has a license of its own.
   */
  License license(String resource) {
    Optional<License> found = licenseCatalog.find(resource);
    boolean inherits = found.map(License::getPurpose)
        .map(purpose -> purpose.isComposite() || purpose == LicensePurpose.IGNORE)
        .orElse(true);
    if (inherits && resource.contains("_")) {
      Optional<License> inherited = licenseCatalog.find(StringUtils.substringBefore(resource, "_"))
          .filter(license -> !license.getPurpose().isComposite() && license.getPurpose() != LicensePurpose.IGNORE);
      if (inherited.isPresent()) {
        return inherited.get();
      }
    }
    return found.orElseGet(() -> {
      log.warn("No license for resource `{}`", resource);
      return License.NO_LICENSE;
    });
  }

  private static Optional<String> resourceColumn(EntitySchema schema) {
    return RESOURCE_COLUMNS.stream().filter(schema::hasColumn).findFirst();
  }

  private Map<String, Set<String>> datasets(EntityType entityType, String column, EntitySchema schema) {
    Map<String, Set<String>> result = new HashMap<>();
    Set<String> flags = parameterMaps.get(QueryType.INTERACTIONS)
        .flagGroupWithField(QueryParameterMaps.DATASETS)
        .map(FlagGroup::allColumns)
        .orElse(Set.of());
    for (String flag : flags) {
      if (schema.column(flag).filter(ColumnDefinition::isBoolean).isEmpty()) {
        continue;
      }
      resourceDiscovery.distinctValues(entityType, column, FieldCriteria.isTrue(flag))
          .forEach(resource -> result.computeIfAbsent(resource, key -> new HashSet<>()).add(flag));
    }
    return result;
  }

  private Map<String, Set<String>> genericCategories(EntityType entityType, String column, EntitySchema schema) {
    if (!schema.hasColumn(SCOPE_COLUMN) || !schema.hasColumn(CATEGORY_COLUMN) || CATEGORY_COLUMN.equals(column)) {
      return Map.of();
    }
    return resourceDiscovery.coOccurringValues(entityType, column, CATEGORY_COLUMN,
        new FieldCriteria(SCOPE_COLUMN, FieldCriteria.Operator.EQUAL, GENERIC_SCOPE));
  }
}
