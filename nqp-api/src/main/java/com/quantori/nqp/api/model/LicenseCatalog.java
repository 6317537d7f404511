package com.quantori.nqp.api.model;

import java.util.Optional;

/**
 * Resource name to license lookup.
 */
public interface LicenseCatalog {

  Optional<License> find(String resource);
}
