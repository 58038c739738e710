package io.pitwall.tyre.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads model tuning from YAML, merging a {@code defaults} section with one circuit section.
 *
 * <pre>
 * defaults:
 *   fuelEffect: 0.032
 * monza:
 *   fuelBurnRate: 1.8
 *   mismatchPenalties:
 *     SLICK:
 *       WET: 6.0
 * </pre>
 *
 * <p>Nested mappings are flattened into dotted keys ({@code mismatchPenalties.SLICK.WET}); circuit names match
 * case-insensitively and circuit values replace defaults.</p>
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);
  private static final String DEFAULTS_SECTION = "defaults";

  /** Classpath location of the tuning file shipped with the library. */
  public static final String BUNDLED_RESOURCE = "/tyre-model.yaml";

  private YamlConfigLoader() {}

  /**
   * Reads a YAML file and returns the merged key/value view for a circuit.
   *
   * @param path location of the YAML configuration
   * @param circuit circuit section name; blank selects only the defaults
   * @return flat merged map; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String circuit) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, circuit, path.toString()));
    }
  }

  /**
   * Loads a {@link ModelConfig} for a circuit, falling back to {@link ModelConfig#defaults()} when the file is absent.
   *
   * @param path location of the YAML configuration
   * @param circuit circuit section name; may be blank
   * @return validated model configuration
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure or a value is invalid
   */
  public static ModelConfig loadModelConfig(Path path, String circuit) throws IOException {
    Optional<Map<String, String>> values = load(path, circuit);
    if (values.isEmpty()) {
      log.info("Model config {} not found; using defaults", path);
      return ModelConfig.defaults();
    }
    return ModelConfig.fromMap(values.get());
  }

  /**
   * Loads the bundled {@value #BUNDLED_RESOURCE} tuning for a circuit.
   *
   * @param circuit circuit section name; may be blank
   * @return validated model configuration; defaults when the resource is missing from the classpath
   * @throws IOException when the resource cannot be read
   */
  public static ModelConfig loadBundled(String circuit) throws IOException {
    try (InputStream in = YamlConfigLoader.class.getResourceAsStream(BUNDLED_RESOURCE)) {
      if (in == null) {
        log.warn("Bundled tuning {} missing from classpath; using defaults", BUNDLED_RESOURCE);
        return ModelConfig.defaults();
      }
      Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
      return ModelConfig.fromMap(parse(reader, circuit, BUNDLED_RESOURCE));
    }
  }

  private static Map<String, String> parse(Reader reader, String circuit, String source) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Malformed YAML in " + source, ex);
    }
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> sections = mapping(document, source);
    Map<String, String> merged = new LinkedHashMap<>();
    sectionNamed(sections, DEFAULTS_SECTION)
        .ifPresent(section -> flatten(mapping(section, DEFAULTS_SECTION), "", merged));

    String wanted = circuit == null ? "" : circuit.trim().toLowerCase(Locale.ROOT);
    if (!wanted.isEmpty()) {
      Optional<Object> section = sectionNamed(sections, wanted);
      if (section.isPresent()) {
        flatten(mapping(section.get(), wanted), "", merged);
      } else {
        log.debug("{} has no section for circuit '{}'; defaults only", source, wanted);
      }
    }
    return Map.copyOf(merged);
  }

  private static Optional<Object> sectionNamed(Map<String, Object> sections, String name) {
    return sections.entrySet().stream()
        .filter(entry -> entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name))
        .map(Map.Entry::getValue)
        .filter(Objects::nonNull)
        .findFirst();
  }

  private static Map<String, Object> mapping(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a YAML mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(context + " has a blank or non-string key: " + key);
      }
      map.put(name, value);
    });
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    source.forEach((key, value) -> {
      String path = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?> nested) {
        flatten(mapping(nested, path), path, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("Lists are not supported (key " + path + ")");
      } else {
        target.put(path, value == null ? "" : value.toString());
      }
    });
  }
}
