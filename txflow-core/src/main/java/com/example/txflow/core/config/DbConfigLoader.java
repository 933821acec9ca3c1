package com.example.txflow.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Loads {@link DbConfig} from JSON documents keyed by client label.
 *
 * <pre>{@code
 * {
 *   "m0": { "host": "db.internal", "user": "app", "password": "secret", "database": "ledger" },
 *   "reporting": { "jdbcUrl": "jdbc:mysql://replica:3306/ledger", "connectionLimit": 10 }
 * }
 * }</pre>
 */
public final class DbConfigLoader {

  /** Label used when none is given. */
  public static final String DEFAULT_LABEL = "m0";

  private static Supplier<ObjectMapper> mapperSupplier = DbConfigLoader::defaultMapper;

  private DbConfigLoader() {}

  /**
   * Sets the supplier of the {@link ObjectMapper} used for parsing.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /**
   * Parses the config stored under {@code label} in a JSON document.
   *
   * @param json the document
   * @param label top-level key holding the config
   * @return the parsed config
   * @throws IllegalStateException if the document is malformed, the label is missing, or the
   *     values are invalid
   */
  public static DbConfig fromJson(final String json, final String label) {
    try {
      return select(mapperSupplier.get().readTree(json), label);
    } catch (final IOException e) {
      throw new IllegalStateException("Failed to parse DB config", e);
    }
  }

  /**
   * Reads the config stored under {@code label} in a JSON file.
   *
   * @param path file location
   * @param label top-level key holding the config
   * @return the parsed config
   * @throws IllegalStateException if the file cannot be read or parsed
   */
  public static DbConfig fromFile(final Path path, final String label) {
    try (final InputStream in = Files.newInputStream(path)) {
      return select(mapperSupplier.get().readTree(in), label);
    } catch (final IOException e) {
      throw new IllegalStateException("Failed to load DB config from " + path, e);
    }
  }

  /**
   * Reads the config stored under {@code label} in a classpath resource.
   *
   * @param resource resource name, resolved against the context class loader
   * @param label top-level key holding the config
   * @return the parsed config
   * @throws IllegalStateException if the resource is missing or cannot be parsed
   */
  public static DbConfig fromResource(final String resource, final String label) {
    final var loader = Thread.currentThread().getContextClassLoader();
    try (final InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalStateException("DB config resource not found: " + resource);
      return select(mapperSupplier.get().readTree(in), label);
    } catch (final IOException e) {
      throw new IllegalStateException("Failed to load DB config from " + resource, e);
    }
  }

  private static DbConfig select(final JsonNode root, final String label) {
    final var key = label == null ? DEFAULT_LABEL : label;
    final var node = root == null ? null : root.get(key);
    if (node == null || !node.isObject()) {
      throw new IllegalStateException("No DB config for label: " + key);
    }
    try {
      return mapperSupplier.get().treeToValue(node, DbConfig.class);
    } catch (final JsonProcessingException | IllegalArgumentException e) {
      throw new IllegalStateException("Invalid DB config for label: " + key, e);
    }
  }

  private static ObjectMapper defaultMapper() {
    return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }
}
