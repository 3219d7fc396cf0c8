package ca.gc.cra.edgeingest.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Merges defaults, YAML and CLI key/value pairs into the effective configuration.
 * <p><strong>Precedence:</strong> defaults &lt; YAML &lt; CLI. A CLI value overriding a YAML value is reported
 * through {@code warn} so operators notice drift from the checked-in file.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration for {@code mode}.
   *
   * @param mode CLI mode used for validation
   * @param yaml flattened YAML values when a file was supplied
   * @param cli CLI key/value pairs; may be {@code null}
   * @param defaults built-in defaults; may be {@code null}
   * @param warn sink for override warnings; may be {@code null}
   * @return immutable effective configuration
   * @throws IllegalArgumentException if the merged values are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    if ("ingest".equalsIgnoreCase(mode)) {
      String active = trim(effective.get("activePath"));
      if (active.isEmpty()) {
        throw new IllegalArgumentException("activePath is required for " + mode);
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
