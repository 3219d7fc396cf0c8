package ca.gc.cra.edgeingest.config;

import ca.gc.cra.edgeingest.validation.Numbers;
import ca.gc.cra.edgeingest.validation.Paths;
import ca.gc.cra.edgeingest.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Captures configuration for the ingest loop: file locations, sink naming and loop timing.
 * <p><strong>Why:</strong> Consolidates YAML, CLI and built-in defaults into one validated value so every run is
 * reproducible from its effective configuration.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot} and the ingest use case.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param activePath file the firewall appends to
 * @param rotatedDir directory searched for rotated siblings of {@code activePath}
 * @param outputDir directory receiving event and dead-letter files
 * @param checkpointPath checkpoint document location
 * @param metricsPath metrics summary file
 * @param eventsPrefix file-name prefix of the event sink
 * @param dlqPrefix file-name prefix of the dead-letter sink
 * @param tailSliceMillis maximum time spent following the active file per loop iteration
 * @param checkpointIntervalMillis interval between checkpoint flushes
 * @param metricsIntervalMillis interval between metrics summaries
 * @param pollIntervalMillis sleep when the active file has no new data
 * @param readChunkBytes size of each read from the active file
 * @param completedLedgerCap number of completed rotated files remembered
 * @since 0.1.0
 * @see ca.gc.cra.edgeingest.application.pipeline.IngestUseCase
 */
public record IngestConfig(
    Path activePath,
    Path rotatedDir,
    Path outputDir,
    Path checkpointPath,
    Path metricsPath,
    String eventsPrefix,
    String dlqPrefix,
    long tailSliceMillis,
    long checkpointIntervalMillis,
    long metricsIntervalMillis,
    long pollIntervalMillis,
    int readChunkBytes,
    int completedLedgerCap) {

  static final Path DEFAULT_ACTIVE_PATH = Path.of("/data/fortigate/fortigate.log");
  static final Path DEFAULT_OUTPUT_DIR = Path.of("/data/fortigate/parsed");
  private static final long MAX_INTERVAL_MILLIS = 3_600_000L;

  /**
   * Normalizes paths and enforces ranges.
   *
   * @throws IllegalArgumentException if any value is missing or out of range
   */
  public IngestConfig {
    activePath = requirePath("activePath", activePath);
    rotatedDir = requirePath("rotatedDir", rotatedDir);
    outputDir = requirePath("outputDir", outputDir);
    checkpointPath = requirePath("checkpointPath", checkpointPath);
    metricsPath = requirePath("metricsPath", metricsPath);
    eventsPrefix = Strings.sanitizeFileToken("eventsPrefix", eventsPrefix);
    dlqPrefix = Strings.sanitizeFileToken("dlqPrefix", dlqPrefix);
    if (eventsPrefix.equals(dlqPrefix)) {
      throw new IllegalArgumentException("eventsPrefix and dlqPrefix must differ");
    }
    Numbers.requireRange("tailSliceMillis", tailSliceMillis, 1, MAX_INTERVAL_MILLIS);
    Numbers.requireRange("checkpointIntervalMillis", checkpointIntervalMillis, 1, MAX_INTERVAL_MILLIS);
    Numbers.requireRange("metricsIntervalMillis", metricsIntervalMillis, 1, MAX_INTERVAL_MILLIS);
    Numbers.requireRange("pollIntervalMillis", pollIntervalMillis, 1, 60_000);
    Numbers.requireRange("readChunkBytes", readChunkBytes, 512, 16 * 1024 * 1024);
    Numbers.requireRange("completedLedgerCap", completedLedgerCap, 1, 1_000_000);
    if (activePath.getFileName() == null) {
      throw new IllegalArgumentException("activePath must name a file");
    }
  }

  /**
   * Returns the configuration of the reference deployment.
   *
   * @return default configuration
   */
  public static IngestConfig defaults() {
    return new IngestConfig(
        DEFAULT_ACTIVE_PATH,
        DEFAULT_ACTIVE_PATH.getParent(),
        DEFAULT_OUTPUT_DIR,
        DEFAULT_OUTPUT_DIR.resolve("checkpoint.json"),
        DEFAULT_OUTPUT_DIR.resolve("metrics.jsonl"),
        "events",
        "dlq",
        2_000L,
        2_000L,
        10_000L,
        200L,
        8_192,
        5_000);
  }

  /**
   * Creates a configuration from flattened key/value pairs. Derived locations follow the keys they derive from
   * unless set explicitly: {@code rotatedDir} defaults to the parent of {@code activePath}; {@code checkpointPath}
   * and {@code metricsPath} default to files under {@code outputDir}.
   *
   * @param options key/value pairs such as {@code activePath} or {@code tailSliceMillis}
   * @return populated configuration
   * @throws IllegalArgumentException when values are invalid
   */
  public static IngestConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    IngestConfig defaults = defaults();

    Path active = pathOr(options, "activePath", defaults.activePath());
    Path rotated = pathOr(options, "rotatedDir", active.getParent());
    Path output = pathOr(options, "outputDir", defaults.outputDir());
    Path checkpoint = pathOr(options, "checkpointPath", output.resolve("checkpoint.json"));
    Path metrics = pathOr(options, "metricsPath", output.resolve("metrics.jsonl"));

    return new IngestConfig(
        active,
        rotated,
        output,
        checkpoint,
        metrics,
        stringOr(options, "eventsPrefix", defaults.eventsPrefix()),
        stringOr(options, "dlqPrefix", defaults.dlqPrefix()),
        longOr(options, "tailSliceMillis", defaults.tailSliceMillis()),
        longOr(options, "checkpointIntervalMillis", defaults.checkpointIntervalMillis()),
        longOr(options, "metricsIntervalMillis", defaults.metricsIntervalMillis()),
        longOr(options, "pollIntervalMillis", defaults.pollIntervalMillis()),
        intOr(options, "readChunkBytes", defaults.readChunkBytes()),
        intOr(options, "completedLedgerCap", defaults.completedLedgerCap()));
  }

  /**
   * Builds the pattern matching rotated siblings: {@code <activeFileName>-<YYYYMMDD-HHMMSS>[.gz]}. Group 1
   * captures the timestamp.
   *
   * @return compiled pattern
   */
  public Pattern rotatedNamePattern() {
    String base = Pattern.quote(activePath.getFileName().toString());
    return Pattern.compile("^" + base + "-(\\d{8}-\\d{6})(?:\\.gz)?$");
  }

  private static Path requirePath(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    return path.toAbsolutePath().normalize();
  }

  private static Path pathOr(Map<String, String> options, String key, Path fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Paths.parse(key, raw);
  }

  private static String stringOr(Map<String, String> options, String key, String fallback) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? fallback : raw.trim();
  }

  private static long longOr(Map<String, String> options, String key, long fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseInRange(key, raw, Long.MIN_VALUE, Long.MAX_VALUE);
  }

  private static int intOr(Map<String, String> options, String key, int fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return (int) Numbers.parseInRange(key, raw, Integer.MIN_VALUE, Integer.MAX_VALUE);
  }
}
