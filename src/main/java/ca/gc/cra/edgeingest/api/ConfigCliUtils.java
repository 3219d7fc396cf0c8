package ca.gc.cra.edgeingest.api;

import ca.gc.cra.edgeingest.config.ConfigMerger;
import ca.gc.cra.edgeingest.config.DefaultsForMode;
import ca.gc.cra.edgeingest.config.IngestConfig;
import ca.gc.cra.edgeingest.config.YamlConfigLoader;
import ca.gc.cra.edgeingest.logging.LoggingConfigurator;
import ca.gc.cra.edgeingest.validation.Paths;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the effective ingest configuration shared by {@code run} and {@code inspect}.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);
  static final String MODE = "ingest";

  private ConfigCliUtils() {}

  /**
   * Merges defaults, the optional {@code config=} YAML file and CLI pairs, applies logging and telemetry
   * keys, and builds the validated configuration.
   *
   * @param cli CLI pairs; {@code config} is consumed
   * @return validated configuration
   * @throws NoSuchFileException if {@code config=} names a missing file
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if any value is invalid
   */
  static IngestConfig resolveIngestConfig(Map<String, String> cli) throws IOException {
    Map<String, String> args = new LinkedHashMap<>(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = extractConfigPath(args);
    if (configPath != null) {
      Path path = Paths.parse("config", configPath);
      yaml = YamlConfigLoader.load(path, MODE);
      if (yaml.isEmpty()) {
        throw new NoSuchFileException(path.toString(), null, "configuration file not found");
      }
    }

    Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
        MODE, yaml, args, DefaultsForMode.asFlatMap(MODE), log::warn));
    if (parseBoolean(effective, "verbose", false)) {
      LoggingConfigurator.enableVerboseLogging();
    }
    LoggingConfigurator.applyRootLevel(effective.get("logLevel"));
    TelemetryConfigurator.configureMetrics(effective);
    return IngestConfig.fromMap(effective);
  }

  static String extractConfigPath(Map<String, String> args) {
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim();
    if (!normalized.equalsIgnoreCase("true") && !normalized.equalsIgnoreCase("false")) {
      throw new IllegalArgumentException(key + " must be true or false");
    }
    return Boolean.parseBoolean(normalized);
  }
}
