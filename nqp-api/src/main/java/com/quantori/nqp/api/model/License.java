package com.quantori.nqp.api.model;

import lombok.Builder;
import lombok.Value;

/**
 * License descriptor of a resource.
 */
@Value
@Builder
public class License {

  /** Sentinel of resources absent from the license catalog. */
  public static final License NO_LICENSE = License.builder()
      .name("No license")
      .fullName("No license")
      .purpose(LicensePurpose.NONE)
      .build();

  String name;
  String fullName;
  LicensePurpose purpose;
}
