package com.quantori.nqp.core.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.quantori.nqp.api.model.ColumnCriteria;
import com.quantori.nqp.api.model.CompiledQuery;
import com.quantori.nqp.api.model.ConjunctionCriteria;
import com.quantori.nqp.api.model.Criteria;
import com.quantori.nqp.api.model.EntitySchema;
import com.quantori.nqp.api.model.EntityType;
import com.quantori.nqp.api.model.FieldCriteria;
import com.quantori.nqp.api.model.QueryType;
import com.quantori.nqp.core.TestSchemaCatalog;
import com.quantori.nqp.core.normalize.ArgumentNormalizer;
import com.quantori.nqp.core.normalize.QueryArguments;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryCompilerTest {

  private final QueryParameterMaps parameterMaps = QueryParameterMaps.defaults();
  private final TestSchemaCatalog schemaCatalog = new TestSchemaCatalog();
  private final ArgumentNormalizer normalizer = new ArgumentNormalizer(parameterMaps, schemaCatalog, false);
  private final QueryCompiler compiler = new QueryCompiler(parameterMaps, schemaCatalog);

  @Test
  void compilesEnzymeSubstratePairs() {
    CompiledQuery query = compile(QueryType.ENZSUB, Map.of(
        "enzymes", List.of("P06239"),
        "substrates", List.of("O14543")));

    Criteria enzyme = new ConjunctionCriteria(
        FieldCriteria.in("enzyme", List.of("P06239")),
        FieldCriteria.in("enzyme_genesymbol", List.of("P06239")),
        ConjunctionCriteria.Operator.OR);
    Criteria substrate = new ConjunctionCriteria(
        FieldCriteria.in("substrate", List.of("O14543")),
        FieldCriteria.in("substrate_genesymbol", List.of("O14543")),
        ConjunctionCriteria.Operator.OR);
    Criteria expected = new ConjunctionCriteria(List.of(
        new ConjunctionCriteria(enzyme, substrate, ConjunctionCriteria.Operator.AND),
        FieldCriteria.in("ncbi_tax_id", List.of("9606")),
        new ColumnCriteria("enzyme", ColumnCriteria.Operator.NOT_EQUAL, "substrate")),
        ConjunctionCriteria.Operator.AND);

    assertEquals(expected, query.getWhere());
    assertEquals(List.of("enzyme", "substrate", "residue_type", "residue_offset", "modification"),
        query.getColumns());
    assertEquals(List.of("sources", "references"), query.getAuxiliaryColumns());
    assertEquals(EntityType.ENZSUB, query.getEntityType());
  }

  @Test
  void combinesSidesByRequestedOperator() {
    Criteria criteria = partnerClause(QueryType.ENZSUB, Map.of(
        "enzymes", List.of("P06239"),
        "substrates", List.of("O14543"),
        "enzyme_substrate", List.of("OR")));

    assertThat(criteria).isInstanceOfSatisfying(ConjunctionCriteria.class,
        c -> assertEquals(ConjunctionCriteria.Operator.OR, c.getOperator()));
  }

  @Test
  void oneSideReferencesOnlyItsColumns() {
    Criteria criteria = partnerClause(QueryType.INTERACTIONS, Map.of("targets", List.of("P00533")));

    assertEquals(new ConjunctionCriteria(
        FieldCriteria.in("target", List.of("P00533")),
        FieldCriteria.in("target_genesymbol", List.of("P00533")),
        ConjunctionCriteria.Operator.OR), criteria);
  }

  @Test
  void partnersFillBothSides() {
    Criteria criteria = partnerClause(QueryType.ENZSUB, Map.of("partners", List.of("P06239")));

    assertThat(criteria).isInstanceOfSatisfying(ConjunctionCriteria.class, c -> {
      assertEquals(ConjunctionCriteria.Operator.OR, c.getOperator());
      assertEquals(2, c.getCriteriaList().size());
    });
  }

  @Test
  void loopsAreKeptOnRequest() {
    QueryArguments arguments = normalize(QueryType.ENZSUB, Map.of("loops", List.of("yes")));

    assertNull(compiler.loopClause(arguments, parameterMaps.get(QueryType.ENZSUB)));
    assertThat(compiler.compile(arguments).getWhere()).isEqualTo(FieldCriteria.in("ncbi_tax_id", List.of("9606")));
  }

  @Test
  void datasetFlagAloneIsABooleanCheck() {
    Criteria criteria = boolClause(QueryType.INTERACTIONS, Map.of("datasets", List.of("collectri")));

    assertEquals(new ConjunctionCriteria(
        FieldCriteria.isTrue("collectri"),
        FieldCriteria.isTrue("is_directed"),
        ConjunctionCriteria.Operator.AND), criteria);
  }

  @Test
  void explicitLevelsOverrideTheDatasetFlag() {
    Criteria criteria = boolClause(QueryType.INTERACTIONS, Map.of(
        "datasets", List.of("dorothea"),
        "dorothea_levels", List.of("A")));

    assertEquals(new ConjunctionCriteria(
        new FieldCriteria("dorothea_level", FieldCriteria.Operator.OVERLAP, List.of("A")),
        FieldCriteria.isTrue("is_directed"),
        ConjunctionCriteria.Operator.AND), criteria);
  }

  @Test
  void levelsDefaultWhenDatasetWithLevelsIsSelected() {
    var raw = new LinkedHashMap<String, List<String>>();
    raw.put("datasets", List.of("omnipath,dorothea"));
    raw.put("dorothea_methods", List.of("curated"));
    raw.put("directed", List.of("0"));

    Criteria criteria = boolClause(QueryType.INTERACTIONS, raw);

    assertEquals(new ConjunctionCriteria(
        FieldCriteria.isTrue("omnipath"),
        new ConjunctionCriteria(
            new FieldCriteria("dorothea_level", FieldCriteria.Operator.OVERLAP, List.of("A", "B")),
            FieldCriteria.isTrue("dorothea_curated"),
            ConjunctionCriteria.Operator.AND),
        ConjunctionCriteria.Operator.OR), criteria);
  }

  @Test
  void defaultDatasetOnlyWithoutNarrowingArguments() {
    QueryArguments plain = compiler.applyDefaults(normalize(QueryType.INTERACTIONS, Map.of()),
        parameterMaps.get(QueryType.INTERACTIONS));
    QueryArguments withTypes = compiler.applyDefaults(
        normalize(QueryType.INTERACTIONS, Map.of("types", List.of("transcriptional"))),
        parameterMaps.get(QueryType.INTERACTIONS));

    assertEquals(List.of("omnipath"), plain.list("datasets"));
    assertEquals(List.of("9606"), plain.list("organisms"));
    assertThat(withTypes.has("datasets")).isFalse();
  }

  @Test
  void proteinEntityTypeMustMatchBothSides() {
    EntitySchema schema = schemaCatalog.schema(EntityType.INTERACTIONS);
    QueryParameters parameters = parameterMaps.get(QueryType.INTERACTIONS);

    Criteria protein = compiler.whereClause(
        normalize(QueryType.INTERACTIONS, Map.of("entity_types", List.of("protein"))), parameters, schema);
    Criteria mixed = compiler.whereClause(
        normalize(QueryType.INTERACTIONS, Map.of("entity_types", List.of("protein,mirna"))), parameters, schema);

    assertThat(protein).isInstanceOfSatisfying(ConjunctionCriteria.class,
        c -> assertEquals(ConjunctionCriteria.Operator.AND, c.getOperator()));
    assertThat(mixed).isInstanceOfSatisfying(ConjunctionCriteria.class,
        c -> assertEquals(ConjunctionCriteria.Operator.OR, c.getOperator()));
  }

  @Test
  void resourcesOverlapTheSourcesArray() {
    EntitySchema schema = schemaCatalog.schema(EntityType.COMPLEXES);
    Criteria criteria = compiler.whereClause(
        normalize(QueryType.COMPLEXES, Map.of("resources", List.of("CORUM"))),
        parameterMaps.get(QueryType.COMPLEXES), schema);

    assertEquals(new FieldCriteria("sources", FieldCriteria.Operator.OVERLAP, List.of("CORUM")), criteria);
  }

  @Test
  void selectsColumnsInSchemaOrder() {
    var raw = new LinkedHashMap<String, List<String>>();
    raw.put("fields", List.of("organism,datasets,references"));
    raw.put("datasets", List.of("omnipath,dorothea"));
    raw.put("genesymbols", List.of("1"));
    raw.put("license", List.of("ignore"));

    CompiledQuery query = compile(QueryType.INTERACTIONS, raw);

    assertEquals(List.of("source", "target", "source_genesymbol", "target_genesymbol", "is_directed",
        "is_stimulation", "is_inhibition", "consensus_direction", "consensus_stimulation", "consensus_inhibition",
        "references", "omnipath", "dorothea", "ncbi_tax_id_source", "ncbi_tax_id_target"), query.getColumns());
    assertThat(query.getColumns()).doesNotContain("id");
    assertThat(query.getAuxiliaryColumns()).isEmpty();
  }

  @Test
  void exactBooleanFiltersOfIntercell() {
    Criteria criteria = boolClause(QueryType.INTERCELL, Map.of(
        "trans", List.of("1"),
        "sec", List.of("0"),
        "causality", List.of("rec")));

    assertThat(criteria).isInstanceOfSatisfying(ConjunctionCriteria.class, c -> assertThat(c.getCriteriaList())
        .containsExactlyInAnyOrder(
            FieldCriteria.isTrue("receiver"),
            FieldCriteria.isTrue("transmitter"),
            new FieldCriteria("secreted", FieldCriteria.Operator.IS, Boolean.FALSE)));
  }

  @Test
  void cytoscapeRestrictsSummaryPairs() {
    CompiledQuery query = compile(QueryType.ANNOTATIONS_SUMMARY, Map.of("cytoscape", List.of("1")));

    assertThat(query.isDistinct()).isTrue();
    assertThat(query.getWhere()).isInstanceOfSatisfying(ConjunctionCriteria.class, c -> {
      assertEquals(ConjunctionCriteria.Operator.OR, c.getOperator());
      assertEquals(CytoscapeAttributes.PAIRS.size(), c.getCriteriaList().size());
    });
  }

  @Test
  void appendsLimit() {
    CompiledQuery query = compile(QueryType.COMPLEXES, Map.of("limit", List.of("10")));

    assertEquals(10, query.getLimit());
    assertNull(query.getWhere());
  }

  private CompiledQuery compile(QueryType queryType, Map<String, List<String>> raw) {
    return compiler.compile(normalize(queryType, raw));
  }

  private QueryArguments normalize(QueryType queryType, Map<String, List<String>> raw) {
    return normalizer.normalize(queryType, raw);
  }

  private Criteria partnerClause(QueryType queryType, Map<String, List<String>> raw) {
    return compiler.partnerClause(normalize(queryType, raw), parameterMaps.get(queryType),
        schemaCatalog.schema(queryType.getEntityType()));
  }

  private Criteria boolClause(QueryType queryType, Map<String, List<String>> raw) {
    QueryParameters parameters = parameterMaps.get(queryType);
    return compiler.boolClause(compiler.applyDefaults(normalize(queryType, raw), parameters), parameters,
        schemaCatalog.schema(queryType.getEntityType()));
  }
}
