package com.quantori.nqp.core.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantori.nqp.api.RowIterator;
import com.quantori.nqp.api.model.Row;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResultFormatterTest {

  private static final List<String> COLUMNS = List.of("source", "target", "is_directed", "sources", "extra_attrs");

  private final List<Row> rows = List.of(
      Row.of("P00533", "P04626", true, List.of("SIGNOR", "KEGG"), Map.of("weight", 1), "aux"),
      Row.of("P01106", "P04637", false, List.of(), null, "aux"));

  @Test
  void tsvWithHeader() {
    List<String> lines = drain(ResultFormatter.tsv(COLUMNS, ResultStream.of(rows), true));

    assertThat(lines).containsExactly(
        "source\ttarget\tis_directed\tsources\textra_attrs\n",
        "P00533\tP04626\t1\tSIGNOR;KEGG\t{\"weight\":1}\n",
        "P01106\tP04637\t0\t\t\n");
  }

  @Test
  void tsvWithoutHeaderOfNoRows() {
    assertThat(drain(ResultFormatter.tsv(COLUMNS, ResultStream.empty(), false))).isEmpty();
    assertThat(drain(ResultFormatter.tsv(COLUMNS, ResultStream.empty(), true))).hasSize(1);
  }

  @Test
  void jsonFragmentsFormAnArray() throws Exception {
    List<String> fragments = drain(ResultFormatter.json(COLUMNS, ResultStream.of(rows)));

    assertEquals("[\n", fragments.get(0));
    assertEquals("]", fragments.get(fragments.size() - 1));
    assertThat(fragments.get(1)).endsWith(",\n");
    assertThat(fragments.get(2)).endsWith("}\n");

    List<Map<String, Object>> parsed = new ObjectMapper().readValue(String.join("", fragments),
        new TypeReference<>() {
        });
    assertThat(parsed).hasSize(2);
    assertThat(parsed.get(0)).containsOnlyKeys(COLUMNS).containsEntry("is_directed", true);
    assertThat(parsed.get(1)).containsEntry("extra_attrs", null);
  }

  @Test
  void jsonOfNoRowsIsAnEmptyArray() throws Exception {
    String json = String.join("", drain(ResultFormatter.json(COLUMNS, ResultStream.empty())));

    assertEquals("[\n]", json);
    assertThat(new ObjectMapper().readValue(json, List.class)).isEmpty();
  }

  @Test
  void recordsKeepColumnOrder() {
    List<Map<String, Object>> records = drain(ResultFormatter.records(COLUMNS, ResultStream.of(rows)));

    assertThat(records.get(0).keySet()).containsExactlyElementsOf(COLUMNS);
    assertEquals(List.of("SIGNOR", "KEGG"), records.get(0).get("sources"));
  }

  @Test
  void cursorFetchesBatchesLazilyAndClosesTheIterator() throws Exception {
    RowIterator iterator = mock(RowIterator.class);
    when(iterator.next()).thenReturn(List.of(rows.get(0)), List.of(rows.get(1)), List.of());

    try (RowCursor cursor = new RowCursor(iterator)) {
      assertEquals(rows.get(0), cursor.next());
      verify(iterator, times(1)).next();
      assertEquals(rows.get(1), cursor.next());
      assertThat(cursor.hasNext()).isFalse();
    }
    verify(iterator).close();
  }

  private static <T> List<T> drain(ResultStream<T> stream) {
    var result = new ArrayList<T>();
    stream.forEachRemaining(result::add);
    return result;
  }
}
