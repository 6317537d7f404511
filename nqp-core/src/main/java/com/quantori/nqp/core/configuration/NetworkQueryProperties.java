package com.quantori.nqp.core.configuration;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class NetworkQueryProperties {

  /**
   * License tier applied to requests without a {@code license} argument. Defaults to {@code academic}.
   */
  @NotBlank
  private String defaultLicense = "academic";

  /**
   * Allow annotation queries without any protein or resource filter. The whole table is over a gigabyte, so this is
   * disabled by default.
   */
  private boolean annotationsFullDownload;

  /**
   * Classpath resource or file with the license catalog in JSON.
   */
  @NotNull
  private String licenseCatalog = "licenses.json";

  /**
   * Output format of requests without a {@code format} argument.
   */
  @NotBlank
  private String defaultFormat = "tsv";
}
