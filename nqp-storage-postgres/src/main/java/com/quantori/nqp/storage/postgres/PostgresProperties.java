package com.quantori.nqp.storage.postgres;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Positive;
import lombok.Data;

@Data
public class PostgresProperties {

  /**
   * JDBC url of the database, e.g. {@code jdbc:postgresql://localhost:5432/omnipath}.
   */
  @NotBlank
  private String url = "jdbc:postgresql://localhost:5432/omnipath";

  /**
   * Database user.
   */
  private String user = "omnipath";

  /**
   * Database password. If blank then no password is sent.
   */
  private String password;

  /**
   * Rows the driver fetches per round trip of the server-side cursor. Defaults to 1000.
   */
  @Positive
  private int fetchSize = 1000;

  /**
   * Rows returned per batch by the row iterator. Defaults to 500.
   */
  @Positive
  private int batchSize = 500;
}
