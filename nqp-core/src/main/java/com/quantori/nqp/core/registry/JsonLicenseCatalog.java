package com.quantori.nqp.core.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantori.nqp.api.model.License;
import com.quantori.nqp.api.model.LicenseCatalog;
import com.quantori.nqp.api.model.LicensePurpose;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * License catalog read from a JSON object of resource name to {@code {"purpose", "name", "fullName"}}.
 */
@Slf4j
public class JsonLicenseCatalog implements LicenseCatalog {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final Map<String, License> licenses;

  public JsonLicenseCatalog(InputStream json) throws IOException {
    JsonNode root = OBJECT_MAPPER.readTree(json);
    var result = new HashMap<String, License>();
    root.fields().forEachRemaining(field -> {
      JsonNode node = field.getValue();
      result.put(field.getKey(), License.builder()
          .purpose(LicensePurpose.fromName(node.path("purpose").asText("")))
          .name(node.path("name").asText(field.getKey()))
          .fullName(node.path("fullName").asText(node.path("name").asText(field.getKey())))
          .build());
    });
    this.licenses = Collections.unmodifiableMap(result);
  }

  /**
   * Loads the catalog from the classpath, or from the file system if there is no such resource.
   *
   * @param location classpath resource or file path
   */
  public static JsonLicenseCatalog load(String location) {
    try (InputStream resource = JsonLicenseCatalog.class.getClassLoader().getResourceAsStream(location)) {
      if (resource != null) {
        log.info("Loading license catalog from classpath {}", location);
        return new JsonLicenseCatalog(resource);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read license catalog " + location, e);
    }
    try (InputStream file = Files.newInputStream(Path.of(location))) {
      log.info("Loading license catalog from file {}", location);
      return new JsonLicenseCatalog(file);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read license catalog " + location, e);
    }
  }

  @Override
  public Optional<License> find(String resource) {
    return Optional.ofNullable(licenses.get(resource));
  }

  public int size() {
    return licenses.size();
  }
}
