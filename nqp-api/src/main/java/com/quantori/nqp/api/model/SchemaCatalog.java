package com.quantori.nqp.api.model;

/**
 * Column catalog of the entity tables, the only source of column kinds for operator inference.
 */
public interface SchemaCatalog {

  EntitySchema schema(EntityType entityType);
}
