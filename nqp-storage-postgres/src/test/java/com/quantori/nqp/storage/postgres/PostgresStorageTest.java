package com.quantori.nqp.storage.postgres;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantori.nqp.api.RowIterator;
import com.quantori.nqp.api.model.CompiledQuery;
import com.quantori.nqp.api.model.EntityType;
import com.quantori.nqp.api.model.FieldCriteria;
import com.quantori.nqp.api.model.QueryType;
import com.quantori.nqp.api.model.Row;
import com.quantori.nqp.core.configuration.NetworkQueryConfiguration;
import com.quantori.nqp.core.registry.ResourceRegistry;
import com.quantori.nqp.core.service.NetworkQueryService;
import com.quantori.nqp.core.service.QueryResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class PostgresStorageTest extends ContainerizedTest {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private static PostgresStorageConfiguration storage;
  private static NetworkQueryService service;

  @BeforeAll
  static void setUp() {
    storage = new PostgresStorageConfiguration(properties(5));
    service = new NetworkQueryConfiguration().networkQueryService(storage);
  }

  @Test
  void limitReturnsExactlyThatManyRows() throws Exception {
    List<Map<String, Object>> records = json(service.request("interactions", Map.of(
        "limit", List.of("10"),
        "license", List.of("ignore"),
        "format", List.of("json"))));

    assertThat(records).hasSize(10);
  }

  @Test
  void readsInBatches() throws Exception {
    CompiledQuery query = CompiledQuery.builder()
        .queryType(QueryType.INTERACTIONS)
        .entityType(EntityType.INTERACTIONS)
        .columns(List.of("source", "target"))
        .build();

    var sizes = new ArrayList<Integer>();
    try (RowIterator rows = storage.getQueryExecutor().execute(query)) {
      List<Row> batch;
      while (!(batch = rows.next()).isEmpty()) {
        sizes.add(batch.size());
      }
      assertThat(rows.next()).isEmpty();
    }

    assertEquals(List.of(5, 5, 2), sizes);
  }

  @Test
  void decodesColumnKinds() throws Exception {
    List<Map<String, Object>> records = json(service.request("interactions", Map.of(
        "sources", List.of("P00533"),
        "targets", List.of("P04626"),
        "fields", List.of("extra_attrs,organism,sources"),
        "license", List.of("ignore"),
        "format", List.of("json"))));

    assertThat(records).singleElement().satisfies(record -> {
      assertEquals(true, record.get("is_directed"));
      assertEquals(Map.of("weight", 0), record.get("extra_attrs"));
      assertEquals(9606, record.get("ncbi_tax_id_source"));
      assertEquals(List.of("SIGNOR", "Reactome"), record.get("sources"));
    });
  }

  @Test
  void commercialLicenseKeepsCommercialResourcesOnly() throws Exception {
    List<Map<String, Object>> records = json(service.request("interactions", Map.of(
        "fields", List.of("sources,references"),
        "license", List.of("commercial"),
        "format", List.of("json"))));

    assertThat(records).hasSize(7).allSatisfy(record -> {
      assertEquals(List.of("Reactome"), record.get("sources"));
      assertThat((List<?>) record.get("references")).allSatisfy(
          reference -> assertThat(reference.toString()).startsWith("Reactome:"));
    });
  }

  @Test
  void excludesLoopsUnlessRequested() throws Exception {
    List<Object> withoutLoops = drain(service.request("enzsub", Map.of("enzymes", List.of("LCK"))));
    List<Object> withLoops = drain(service.request("enzsub", Map.of(
        "enzymes", List.of("LCK"),
        "loops", List.of("1"))));

    assertThat(withoutLoops).hasSize(2);
    assertThat(withLoops).hasSize(3);
    assertEquals("enzyme\tsubstrate\tresidue_type\tresidue_offset\tmodification\n", withoutLoops.get(0));
    assertEquals("P06239\tO14543\tY\t204\tphosphorylation\n", withoutLoops.get(1));
  }

  @Test
  void discoversResources() {
    ResourceRegistry registry = service.getRegistry();

    assertThat(storage.getResourceDiscovery().distinctValues(EntityType.INTERACTIONS, "sources", null))
        .containsExactly("KEGG", "Reactome", "SIGNOR");
    assertThat(storage.getResourceDiscovery().distinctValues(EntityType.INTERACTIONS, "sources",
        FieldCriteria.isTrue("collectri"))).containsExactly("Reactome");
    assertThat(registry.datasets()).containsExactly("collectri", "omnipath");
    assertThat(registry.resources(EntityType.COMPLEXES)).containsExactly("CORUM", "ComplexPortal");
    assertThat(registry.entry("UniProt_location").orElseThrow().getQueries().get(EntityType.INTERCELL)
        .genericCategories()).containsExactly("receptor");
  }

  @Test
  void unreachableDatabaseFailsTheBody() {
    var properties = new PostgresProperties();
    properties.setUrl("jdbc:postgresql://localhost:1/nowhere");
    CompiledQuery query = CompiledQuery.builder()
        .entityType(EntityType.COMPLEXES)
        .columns(List.of("name"))
        .build();

    RowIterator rows = new PostgresStorageConfiguration(properties).getQueryExecutor().execute(query);

    assertThatThrownBy(rows::next)
        .isInstanceOf(PostgresStorageException.class)
        .hasMessage("Unable to search")
        .extracting("errorCode")
        .asString()
        .startsWith("08");
  }

  private static List<Map<String, Object>> json(QueryResponse response) throws Exception {
    assertThat(response.isOk()).as("client error %s", response.getMessage()).isTrue();
    return OBJECT_MAPPER.readValue(String.join("", drain(response).stream().map(String::valueOf).toList()),
        new TypeReference<>() {
        });
  }

  private static List<Object> drain(QueryResponse response) throws Exception {
    var units = new ArrayList<Object>();
    try (response) {
      response.getBody().forEachRemaining(units::add);
    }
    return units;
  }
}
