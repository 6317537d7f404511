package com.quantori.nqp.core.format;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;

/**
 * Supported output encodings.
 */
@Getter
public enum OutputFormat {
  /** Structured records, for programmatic reuse. */
  RAW("raw"),
  TSV("tsv", "tab", "text", "table"),
  JSON("json"),
  /** The compiled query itself, nothing is executed. */
  QUERY("query");

  private final Set<String> names;

  OutputFormat(String... names) {
    this.names = Set.of(names);
  }

  public static Optional<OutputFormat> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String key = name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(format -> format.names.contains(key)).findFirst();
  }

  public static String[] allNames() {
    return Arrays.stream(values()).flatMap(format -> format.names.stream()).sorted().toArray(String[]::new);
  }
}
