package com.quantori.nqp.storage.postgres;

import static com.quantori.nqp.api.model.ColumnDefinition.array;
import static com.quantori.nqp.api.model.ColumnDefinition.bool;
import static com.quantori.nqp.api.model.ColumnDefinition.integer;
import static com.quantori.nqp.api.model.ColumnDefinition.json;
import static com.quantori.nqp.api.model.ColumnDefinition.text;

import com.quantori.nqp.api.model.EntitySchema;
import com.quantori.nqp.api.model.EntityType;
import com.quantori.nqp.api.model.SchemaCatalog;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Column layout of the served tables.
 */
public class PostgresSchemaCatalog implements SchemaCatalog {

  private final Map<EntityType, EntitySchema> schemas = new EnumMap<>(EntityType.class);

  public PostgresSchemaCatalog() {
    schemas.put(EntityType.INTERACTIONS, new EntitySchema(EntityType.INTERACTIONS, List.of(
        integer("id"),
        text("source"),
        text("target"),
        text("source_genesymbol"),
        text("target_genesymbol"),
        bool("is_directed"),
        bool("is_stimulation"),
        bool("is_inhibition"),
        bool("consensus_direction"),
        bool("consensus_stimulation"),
        bool("consensus_inhibition"),
        text("type"),
        array("sources"),
        array("references"),
        bool("omnipath"),
        bool("kinaseextra"),
        bool("ligrecextra"),
        bool("pathwayextra"),
        bool("mirnatarget"),
        bool("dorothea"),
        bool("collectri"),
        bool("tf_target"),
        bool("lncrna_mrna"),
        bool("tf_mirna"),
        bool("small_molecule"),
        bool("dorothea_curated"),
        bool("dorothea_chipseq"),
        bool("dorothea_tfbs"),
        bool("dorothea_coexp"),
        array("dorothea_level"),
        integer("curation_effort"),
        json("extra_attrs"),
        json("evidences"),
        integer("ncbi_tax_id_source"),
        integer("ncbi_tax_id_target"),
        text("entity_type_source"),
        text("entity_type_target"))));
    schemas.put(EntityType.ENZSUB, new EntitySchema(EntityType.ENZSUB, List.of(
        integer("id"),
        text("enzyme"),
        text("enzyme_genesymbol"),
        text("substrate"),
        text("substrate_genesymbol"),
        array("isoforms"),
        text("residue_type"),
        integer("residue_offset"),
        text("modification"),
        array("sources"),
        array("references"),
        integer("curation_effort"),
        integer("ncbi_tax_id"))));
    schemas.put(EntityType.COMPLEXES, new EntitySchema(EntityType.COMPLEXES, List.of(
        integer("id"),
        text("name"),
        array("components"),
        array("components_genesymbols"),
        text("stoichiometry"),
        array("sources"),
        array("references"),
        array("identifiers"))));
    schemas.put(EntityType.ANNOTATIONS, new EntitySchema(EntityType.ANNOTATIONS, List.of(
        integer("id"),
        text("uniprot"),
        text("genesymbol"),
        text("entity_type"),
        text("source"),
        text("label"),
        text("value"),
        integer("record_id"))));
    schemas.put(EntityType.INTERCELL, new EntitySchema(EntityType.INTERCELL, List.of(
        integer("id"),
        text("category"),
        text("parent"),
        text("database"),
        text("scope"),
        text("aspect"),
        text("source"),
        text("uniprot"),
        text("genesymbol"),
        text("entity_type"),
        integer("consensus_score"),
        bool("transmitter"),
        bool("receiver"),
        bool("secreted"),
        bool("plasma_membrane_transmembrane"),
        bool("plasma_membrane_peripheral"))));
  }

  @Override
  public EntitySchema schema(EntityType entityType) {
    return schemas.get(entityType);
  }
}
