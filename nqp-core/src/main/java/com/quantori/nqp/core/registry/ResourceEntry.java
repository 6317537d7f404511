package com.quantori.nqp.core.registry;

import com.quantori.nqp.api.model.EntityType;
import com.quantori.nqp.api.model.License;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A resource discovered in the entity tables.
 */
@Value
@Builder
public class ResourceEntry {
  @NonNull
  String name;
  @NonNull
  License license;
  @Singular("query")
  Map<EntityType, QueryInfo> queries;
  /**
   * Component resources, non-empty for composite resources only.
   */
  @Singular("component")
  Set<String> components;

  public boolean isComposite() {
    return license.getPurpose().isComposite();
  }
}
