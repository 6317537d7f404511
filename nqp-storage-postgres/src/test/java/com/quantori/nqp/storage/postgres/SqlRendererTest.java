package com.quantori.nqp.storage.postgres;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.quantori.nqp.api.model.ColumnCriteria;
import com.quantori.nqp.api.model.CompiledQuery;
import com.quantori.nqp.api.model.ConjunctionCriteria;
import com.quantori.nqp.api.model.EntitySchema;
import com.quantori.nqp.api.model.EntityType;
import com.quantori.nqp.api.model.FieldCriteria;
import com.quantori.nqp.api.model.QueryType;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SqlRendererTest {

  private final PostgresSchemaCatalog schemaCatalog = new PostgresSchemaCatalog();
  private final SqlRenderer renderer = new SqlRenderer();

  @Test
  void rendersSelectWithPredicatesAndLimit() {
    CompiledQuery query = CompiledQuery.builder()
        .queryType(QueryType.ENZSUB)
        .entityType(EntityType.ENZSUB)
        .columns(List.of("enzyme", "substrate"))
        .auxiliaryColumns(List.of("sources"))
        .where(new ConjunctionCriteria(List.of(
            new ConjunctionCriteria(
                FieldCriteria.in("enzyme", List.of("P06239")),
                FieldCriteria.in("enzyme_genesymbol", List.of("P06239")),
                ConjunctionCriteria.Operator.OR),
            FieldCriteria.in("ncbi_tax_id", List.of("9606")),
            new ColumnCriteria("enzyme", ColumnCriteria.Operator.NOT_EQUAL, "substrate")),
            ConjunctionCriteria.Operator.AND))
        .limit(10)
        .build();

    SqlStatement statement = renderer.select(query, schema(EntityType.ENZSUB));

    assertEquals("SELECT \"enzyme\", \"substrate\", \"sources\" FROM \"enzsub\" WHERE "
        + "((\"enzyme\" IN (?) OR \"enzyme_genesymbol\" IN (?)) AND \"ncbi_tax_id\" IN (?) "
        + "AND \"enzyme\" <> \"substrate\") LIMIT ?", statement.sql());
    assertEquals(List.of("P06239", "P06239", 9606, 10), statement.parameters());
  }

  @Test
  void rendersDistinctProjectionOfTheWholeTable() {
    CompiledQuery query = CompiledQuery.builder()
        .queryType(QueryType.ANNOTATIONS_SUMMARY)
        .entityType(EntityType.ANNOTATIONS)
        .columns(List.of("source", "label"))
        .distinct(true)
        .build();

    SqlStatement statement = renderer.select(query, schema(EntityType.ANNOTATIONS));

    assertEquals("SELECT DISTINCT \"source\", \"label\" FROM \"annotations\"", statement.sql());
    assertThat(statement.parameters()).isEmpty();
  }

  @Test
  void arrayOperatorsBindArrays() {
    var parameters = new ArrayList<Object>();
    EntitySchema schema = schema(EntityType.INTERACTIONS);

    assertEquals("\"sources\" && ?", renderer.where(
        new FieldCriteria("sources", FieldCriteria.Operator.OVERLAP, List.of("SIGNOR", "KEGG")), schema, parameters));
    assertEquals("? = ANY(\"dorothea_level\")", renderer.where(
        new FieldCriteria("dorothea_level", FieldCriteria.Operator.CONTAINS, "A"), schema, parameters));

    assertEquals(List.of(new SqlStatement.SqlArray("text", List.of("SIGNOR", "KEGG")), "A"), parameters);
  }

  @Test
  void booleansAndEmptyOperands() {
    var parameters = new ArrayList<Object>();
    EntitySchema schema = schema(EntityType.INTERCELL);

    assertEquals("\"secreted\" IS FALSE", renderer.where(
        new FieldCriteria("secreted", FieldCriteria.Operator.IS, Boolean.FALSE), schema, parameters));
    assertEquals("\"receiver\" IS TRUE", renderer.where(FieldCriteria.isTrue("receiver"), schema, parameters));
    assertEquals(SqlRenderer.FALSE, renderer.where(FieldCriteria.in("uniprot", List.of()), schema, parameters));
    assertEquals(SqlRenderer.TRUE, renderer.where(
        new ConjunctionCriteria(List.of(), ConjunctionCriteria.Operator.OR), schema, parameters));
    assertThat(parameters).isEmpty();
  }

  @Test
  void rendersDiscoveryStatements() {
    SqlStatement resources = renderer.distinct(schema(EntityType.INTERACTIONS), List.of("sources"),
        FieldCriteria.isTrue("collectri"));
    SqlStatement categories = renderer.distinct(schema(EntityType.INTERCELL), List.of("database", "category"),
        new FieldCriteria("scope", FieldCriteria.Operator.EQUAL, "generic"));

    assertEquals("SELECT DISTINCT unnest(\"sources\") AS v0 FROM \"interactions\" "
        + "WHERE \"sources\" IS NOT NULL AND \"collectri\" IS TRUE", resources.sql());
    assertEquals("SELECT DISTINCT \"database\" AS v0, \"category\" AS v1 FROM \"intercell\" "
        + "WHERE \"database\" IS NOT NULL AND \"category\" IS NOT NULL AND \"scope\" = ?", categories.sql());
    assertEquals(List.of("generic"), categories.parameters());
  }

  @Test
  void rejectsUnknownColumns() {
    CompiledQuery query = CompiledQuery.builder()
        .entityType(EntityType.COMPLEXES)
        .columns(List.of("name; DROP TABLE complexes"))
        .build();

    assertThatThrownBy(() -> renderer.select(query, schema(EntityType.COMPLEXES)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unknown column");
  }

  private EntitySchema schema(EntityType entityType) {
    return schemaCatalog.schema(entityType);
  }
}
