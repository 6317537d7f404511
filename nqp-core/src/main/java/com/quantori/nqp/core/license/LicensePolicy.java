package com.quantori.nqp.core.license;

/**
 * Columns of an entity table carrying resource attribution.
 *
 * @param resourceColumn plain resource column, array or scalar
 * @param prefixColumn   prefix-encoded array column ({@code Resource:identifier}), null if there is none
 * @param simple         whole rows are kept or dropped by their scalar resource
 */
public record LicensePolicy(String resourceColumn, String prefixColumn, boolean simple) {

  public static LicensePolicy attribution(String resourceColumn, String prefixColumn) {
    return new LicensePolicy(resourceColumn, prefixColumn, false);
  }

  public static LicensePolicy simple(String resourceColumn) {
    return new LicensePolicy(resourceColumn, null, true);
  }
}
