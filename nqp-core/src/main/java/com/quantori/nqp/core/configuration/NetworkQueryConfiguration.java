package com.quantori.nqp.core.configuration;

import com.quantori.nqp.api.StorageConfiguration;
import com.quantori.nqp.api.model.LicenseTier;
import com.quantori.nqp.core.format.OutputFormat;
import com.quantori.nqp.core.registry.JsonLicenseCatalog;
import com.quantori.nqp.core.service.NetworkQueryService;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the query service from the {@code nqp.service} configuration section.
 */
@Slf4j
public class NetworkQueryConfiguration {

  public static final String CONFIG_PATH = "nqp.service";

  private final NetworkQueryProperties properties;

  public NetworkQueryConfiguration() {
    this(ConfigFactory.load());
  }

  public NetworkQueryConfiguration(Config config) {
    this.properties = properties(config.getConfig(CONFIG_PATH));
    log.info("nqp.service.default-license = {}", properties.getDefaultLicense());
    log.info("nqp.service.default-format = {}", properties.getDefaultFormat());
    log.info("nqp.service.annotations-full-download = {}", properties.isAnnotationsFullDownload());
    log.info("nqp.service.license-catalog = {}", properties.getLicenseCatalog());
  }

  public NetworkQueryProperties getProperties() {
    return properties;
  }

  public NetworkQueryService networkQueryService(StorageConfiguration storageConfiguration) {
    return new NetworkQueryService(storageConfiguration, JsonLicenseCatalog.load(properties.getLicenseCatalog()),
        properties);
  }

  static NetworkQueryProperties properties(Config config) {
    var result = new NetworkQueryProperties();
    result.setDefaultLicense(config.getString("default-license"));
    result.setDefaultFormat(config.getString("default-format"));
    result.setAnnotationsFullDownload(config.getBoolean("annotations-full-download"));
    result.setLicenseCatalog(config.getString("license-catalog"));
    if (LicenseTier.fromName(result.getDefaultLicense()).isEmpty()) {
      throw new IllegalStateException("Unknown default license " + result.getDefaultLicense());
    }
    if (OutputFormat.fromName(result.getDefaultFormat()).isEmpty()) {
      throw new IllegalStateException("Unknown default format " + result.getDefaultFormat());
    }
    return result;
  }
}
