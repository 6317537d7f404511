package com.quantori.nqp.core.query;

import java.util.List;
import java.util.Map;

/**
 * Annotation resources and labels served to the Cytoscape app.
 */
final class CytoscapeAttributes {

  static final Map<String, List<String>> PAIRS = Map.ofEntries(
      Map.entry("Zhong2015", List.of("type")),
      Map.entry("MatrixDB", List.of("mainclass")),
      Map.entry("Matrisome", List.of("mainclass", "subclass", "subsubclass")),
      Map.entry("Locate", List.of("location", "cls")),
      Map.entry("Phosphatome", List.of("family", "subfamily")),
      Map.entry("CancerSEA", List.of("state")),
      Map.entry("GO_Intercell", List.of("mainclass")),
      Map.entry("Adhesome", List.of("mainclass")),
      Map.entry("SignaLink3", List.of("pathway")),
      Map.entry("HPA_secretome", List.of("mainclass")),
      Map.entry("OPM", List.of("membrane", "family")),
      Map.entry("KEGG", List.of("pathway")),
      Map.entry("kinase.com", List.of("group", "family", "subfamily")),
      Map.entry("Membranome", List.of("membrane")),
      Map.entry("HGNC", List.of("mainclass")),
      Map.entry("CPAD", List.of("pathway", "effect_on_cancer", "cancer")),
      Map.entry("Signor", List.of("pathway")),
      Map.entry("Ramilowski2015", List.of("mainclass")),
      Map.entry("HPA_subcellular", List.of("location")),
      Map.entry("Surfaceome", List.of("mainclass", "subclasses")),
      Map.entry("IntOGen", List.of("role")),
      Map.entry("HPMR", List.of("role", "mainclass", "subclass", "subsubclass")),
      Map.entry("ComPPI", List.of("location")),
      Map.entry("Exocarta", List.of("vesicle")),
      Map.entry("Vesiclepedia", List.of("vesicle")),
      Map.entry("Ramilowski_location", List.of("location")),
      Map.entry("LRdb", List.of("role", "cell_type")));

  private CytoscapeAttributes() {
  }
}
