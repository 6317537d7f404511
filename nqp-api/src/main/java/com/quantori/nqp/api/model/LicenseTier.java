package com.quantori.nqp.api.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;

/**
 * License tier requested by a client.
 */
@Getter
public enum LicenseTier {
  /** Licensing is not applied at all. */
  IGNORE(0, "ignore"),
  ACADEMIC(1, "academic", "non_profit", "nonprofit"),
  COMMERCIAL(2, "commercial", "for_profit", "forprofit");

  private final int rank;
  private final Set<String> names;

  LicenseTier(int rank, String... names) {
    this.rank = rank;
    this.names = Set.of(names);
  }

  public static Optional<LicenseTier> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String key = name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(tier -> tier.names.contains(key)).findFirst();
  }

  /**
   * Whether a non composite license purpose permits the usage requested by this tier.
   */
  public boolean enables(LicensePurpose purpose) {
    return this == IGNORE || (!purpose.isComposite() && purpose.getRank() >= rank);
  }
}
