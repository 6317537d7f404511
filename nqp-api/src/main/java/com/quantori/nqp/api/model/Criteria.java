package com.quantori.nqp.api.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A node of a WHERE predicate tree.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = FieldCriteria.class, name = "field"),
    @JsonSubTypes.Type(value = ColumnCriteria.class, name = "columns"),
    @JsonSubTypes.Type(value = ConjunctionCriteria.class, name = "conjunction")
})
public interface Criteria {
}
