package com.quantori.nqp.api.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Served entity tables.
 */
@Getter
@AllArgsConstructor
public enum EntityType {
  INTERACTIONS("interactions"),
  ENZSUB("enzsub"),
  COMPLEXES("complexes"),
  ANNOTATIONS("annotations"),
  INTERCELL("intercell");

  private final String tableName;
}
