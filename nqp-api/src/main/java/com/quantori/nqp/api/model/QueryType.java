package com.quantori.nqp.api.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Data queries that can be requested. Summary queries are distinct projections over an entity table.
 */
@Getter
@AllArgsConstructor
public enum QueryType {
  INTERACTIONS("interactions", EntityType.INTERACTIONS),
  ENZSUB("enzsub", EntityType.ENZSUB),
  COMPLEXES("complexes", EntityType.COMPLEXES),
  ANNOTATIONS("annotations", EntityType.ANNOTATIONS),
  INTERCELL("intercell", EntityType.INTERCELL),
  ANNOTATIONS_SUMMARY("annotations_summary", EntityType.ANNOTATIONS),
  INTERCELL_SUMMARY("intercell_summary", EntityType.INTERCELL);

  private static final Map<String, QueryType> SYNONYMS = Map.ofEntries(
      Map.entry("interaction", INTERACTIONS),
      Map.entry("network", INTERACTIONS),
      Map.entry("enz_sub", ENZSUB),
      Map.entry("enz-sub", ENZSUB),
      Map.entry("ptms", ENZSUB),
      Map.entry("ptm", ENZSUB),
      Map.entry("enzyme-substrate", ENZSUB),
      Map.entry("enzyme_substrate", ENZSUB),
      Map.entry("annotation", ANNOTATIONS),
      Map.entry("annot", ANNOTATIONS),
      Map.entry("intercellular", INTERCELL),
      Map.entry("inter_cell", INTERCELL),
      Map.entry("inter-cell", INTERCELL),
      Map.entry("complex", COMPLEXES)
  );

  private final String queryName;
  private final EntityType entityType;

  /**
   * Resolves a query name or one of its synonyms, case-insensitive.
   */
  public static Optional<QueryType> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String key = name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(queryType -> queryType.queryName.equals(key))
        .findFirst()
        .or(() -> Optional.ofNullable(SYNONYMS.get(key)));
  }
}
