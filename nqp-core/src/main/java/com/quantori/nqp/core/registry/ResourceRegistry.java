package com.quantori.nqp.core.registry;

import com.quantori.nqp.api.model.EntityType;
import com.quantori.nqp.api.model.LicenseTier;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of the discovered resources with their licenses. Enabled resource sets are computed once per
 * license tier: a plain resource is enabled when the tier permits its license purpose, a composite resource when any
 * of its components is enabled.
 */
public class ResourceRegistry {

  private final Map<String, ResourceEntry> entries;
  private final Map<LicenseTier, Set<String>> enabled;

  public ResourceRegistry(Collection<ResourceEntry> entries) {
    var byName = new TreeMap<String, ResourceEntry>();
    entries.forEach(entry -> byName.put(entry.getName(), entry));
    this.entries = Collections.unmodifiableMap(byName);
    var enabledByTier = new EnumMap<LicenseTier, Set<String>>(LicenseTier.class);
    for (LicenseTier tier : LicenseTier.values()) {
      enabledByTier.put(tier, Collections.unmodifiableSet(closure(tier)));
    }
    this.enabled = enabledByTier;
  }

  public static ResourceRegistry empty() {
    return new ResourceRegistry(List.of());
  }

  public Optional<ResourceEntry> entry(String name) {
    return Optional.ofNullable(entries.get(name));
  }

  /**
   * All entries ordered by name.
   */
  public Collection<ResourceEntry> entries() {
    return entries.values();
  }

  public Set<String> enabledResources(LicenseTier tier) {
    return enabled.get(tier);
  }

  /**
   * Whether the resource is usable at the tier. Unknown resources are enabled only when licensing is ignored.
   */
  public boolean isEnabled(String resource, LicenseTier tier) {
    return tier == LicenseTier.IGNORE || enabled.get(tier).contains(resource);
  }

  public boolean isComposite(String resource) {
    return entry(resource).map(ResourceEntry::isComposite).orElse(false);
  }

  public Set<String> components(String resource) {
    return entry(resource).map(ResourceEntry::getComponents).orElse(Set.of());
  }

  /**
   * Resources appearing in an entity table, sorted.
   */
  public Set<String> resources(EntityType entityType) {
    return entries.values().stream()
        .filter(entry -> entry.getQueries().containsKey(entityType))
        .map(ResourceEntry::getName)
        .collect(Collectors.toCollection(TreeSet::new));
  }

  /**
   * Dataset tags of the interactions table.
   */
  public Set<String> datasets() {
    return resourcesByDataset().keySet();
  }

  /**
   * Interaction dataset to the resources contributing to it, both sorted.
   */
  public Map<String, Set<String>> resourcesByDataset() {
    var result = new TreeMap<String, Set<String>>();
    entries.values().forEach(entry -> entry.getQueries()
        .getOrDefault(EntityType.INTERACTIONS, QueryInfo.EMPTY)
        .datasets()
        .forEach(dataset -> result.computeIfAbsent(dataset, key -> new TreeSet<>()).add(entry.getName())));
    return result;
  }

  private Set<String> closure(LicenseTier tier) {
    if (tier == LicenseTier.IGNORE) {
      return new HashSet<>(entries.keySet());
    }
    var containers = new HashMap<String, Set<String>>();
    entries.values().forEach(entry -> entry.getComponents()
        .forEach(component -> containers.computeIfAbsent(component, key -> new HashSet<>()).add(entry.getName())));

    var result = new HashSet<String>();
    var queue = new ArrayDeque<String>();
    entries.values().stream()
        .filter(entry -> !entry.isComposite() && tier.enables(entry.getLicense().getPurpose()))
        .forEach(entry -> {
          result.add(entry.getName());
          queue.add(entry.getName());
        });
    while (!queue.isEmpty()) {
      for (String composite : containers.getOrDefault(queue.poll(), Set.of())) {
        if (result.add(composite)) {
          queue.add(composite);
        }
      }
    }
    return result;
  }
}
