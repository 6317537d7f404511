package com.quantori.nqp.core.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.quantori.nqp.api.model.License;
import com.quantori.nqp.api.model.LicensePurpose;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonLicenseCatalogTest {

  @Test
  void loadsFromClasspath() {
    JsonLicenseCatalog catalog = JsonLicenseCatalog.load("test-licenses.json");

    assertEquals(7, catalog.size());
    License signor = catalog.find("SIGNOR").orElseThrow();
    assertEquals(LicensePurpose.ACADEMIC, signor.getPurpose());
    assertEquals("CC BY-SA 4.0", signor.getName());
    assertEquals("Creative Commons Attribution-ShareAlike 4.0 International", signor.getFullName());
    assertEquals("CC BY-SA 4.0", catalog.find("TRRUST").orElseThrow().getFullName());
    assertEquals(LicensePurpose.COMPOSITE, catalog.find("CollecTRI").orElseThrow().getPurpose());
    assertThat(catalog.find("HTRIdb")).isEmpty();
  }

  @Test
  void loadsFromFile(@TempDir Path directory) throws Exception {
    Path file = directory.resolve("licenses.json");
    Files.writeString(file, "{\"BioGRID\": {\"purpose\": \"for_profit\", \"name\": \"MIT\"}}",
        StandardCharsets.UTF_8);

    JsonLicenseCatalog catalog = JsonLicenseCatalog.load(file.toString());

    assertEquals(LicensePurpose.COMMERCIAL, catalog.find("BioGRID").orElseThrow().getPurpose());
    assertEquals("MIT", catalog.find("BioGRID").orElseThrow().getFullName());
  }

  @Test
  void missingCatalogIsFatal() {
    assertThatThrownBy(() -> JsonLicenseCatalog.load("no-such-licenses.json"))
        .isInstanceOf(UncheckedIOException.class)
        .hasMessageContaining("no-such-licenses.json");
  }
}
