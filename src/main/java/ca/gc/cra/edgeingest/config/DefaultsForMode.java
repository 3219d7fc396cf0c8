package ca.gc.cra.edgeingest.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Built-in defaults for each CLI mode, expressed as the flattened keys accepted by {@link ConfigMerger}.
 *
 * <p>Derived locations ({@code rotatedDir}, {@code checkpointPath}, {@code metricsPath}) default to blank so that
 * {@link IngestConfig#fromMap(Map)} resolves them from the keys they depend on.</p>
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode}.
   *
   * @param mode CLI mode; {@code ingest} is the only mode with settings of its own
   * @return immutable flattened defaults
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "ingest" -> buildIngestDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("logLevel", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildIngestDefaults() {
    IngestConfig defaults = IngestConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("activePath", defaults.activePath().toString());
    map.put("rotatedDir", "");
    map.put("outputDir", defaults.outputDir().toString());
    map.put("checkpointPath", "");
    map.put("metricsPath", "");
    map.put("eventsPrefix", defaults.eventsPrefix());
    map.put("dlqPrefix", defaults.dlqPrefix());
    map.put("tailSliceMillis", Long.toString(defaults.tailSliceMillis()));
    map.put("checkpointIntervalMillis", Long.toString(defaults.checkpointIntervalMillis()));
    map.put("metricsIntervalMillis", Long.toString(defaults.metricsIntervalMillis()));
    map.put("pollIntervalMillis", Long.toString(defaults.pollIntervalMillis()));
    map.put("readChunkBytes", Integer.toString(defaults.readChunkBytes()));
    map.put("completedLedgerCap", Integer.toString(defaults.completedLedgerCap()));
    return map;
  }
}
