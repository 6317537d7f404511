package com.quantori.nqp.api.model;

import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Usage permitted by the license of a resource. The rank grows with the permissiveness of the license.
 */
@Getter
@AllArgsConstructor
public enum LicensePurpose {
  /** No license known, enabled only when licensing is ignored. */
  NONE(0),
  ACADEMIC(1),
  COMMERCIAL(2),
  /** Licensing does not apply to the resource. */
  IGNORE(2),
  /** Umbrella resource, enabled through its components. */
  COMPOSITE(0);

  private final int rank;

  public static LicensePurpose fromName(String name) {
    String key = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    return switch (key) {
      case "academic", "non_profit", "nonprofit" -> ACADEMIC;
      case "commercial", "for_profit", "forprofit" -> COMMERCIAL;
      case "ignore" -> IGNORE;
      case "composite" -> COMPOSITE;
      case "none", "" -> NONE;
      default -> throw new IllegalArgumentException("Unknown license purpose: " + name);
    };
  }

  public boolean isComposite() {
    return this == COMPOSITE;
  }
}
