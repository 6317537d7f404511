package com.quantori.nqp.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Storage independent representation of a SELECT statement: projected columns in result order, optional predicate
 * tree and optional row limit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompiledQuery {
  private QueryType queryType;
  private EntityType entityType;
  private List<String> columns;
  /**
   * Columns selected after {@link #columns} for post-processing, e.g. license attribution. Not part of the output.
   */
  @Builder.Default
  private List<String> auxiliaryColumns = List.of();
  private boolean distinct;
  /**
   * Predicate tree, null when the whole table is requested.
   */
  private Criteria where;
  /**
   * Row limit, null when unbounded.
   */
  private Integer limit;

  /**
   * Output columns followed by auxiliary columns, the layout of the selected rows.
   */
  @JsonIgnore
  public List<String> getSelectedColumns() {
    if (auxiliaryColumns == null || auxiliaryColumns.isEmpty()) {
      return columns;
    }
    var selected = new ArrayList<>(columns);
    selected.addAll(auxiliaryColumns);
    return selected;
  }
}
