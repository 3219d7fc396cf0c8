package ca.gc.cra.edgeingest.config;

import ca.gc.cra.edgeingest.application.pipeline.IngestUseCase;
import ca.gc.cra.edgeingest.application.port.ClockPort;
import ca.gc.cra.edgeingest.application.port.MetricsPort;
import ca.gc.cra.edgeingest.infrastructure.checkpoint.FileCheckpointStore;
import ca.gc.cra.edgeingest.infrastructure.sink.HourlyNdjsonSink;
import ca.gc.cra.edgeingest.infrastructure.sink.NdjsonMetricsSink;
import ca.gc.cra.edgeingest.infrastructure.source.ActiveFileTailer;
import ca.gc.cra.edgeingest.infrastructure.source.RotatedFileCatalog;
import ca.gc.cra.edgeingest.validation.Paths;
import java.time.ZoneId;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the ingest use case to its file-system adapters.
 * <p><strong>Why:</strong> Keeps adapter construction in one place so the application layer only sees ports.</p>
 * <p><strong>Role:</strong> Composition root invoked by the CLI after configuration is validated.</p>
 * <p><strong>Thread-safety:</strong> Construct and use on the startup thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final IngestConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ZoneId zone;

  /**
   * Creates a root.
   *
   * @param config validated configuration
   * @param metrics live metrics mirror
   * @param clock wall clock
   * @param zone zone for hourly sink buckets and the contextual year of envelope dates
   */
  public CompositionRoot(IngestConfig config, MetricsPort metrics, ClockPort clock, ZoneId zone) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  /**
   * Creates the checkpoint store named by the configuration.
   *
   * @return checkpoint store
   */
  public FileCheckpointStore checkpointStore() {
    return new FileCheckpointStore(
        config.checkpointPath(), config.activePath().toString(), config.completedLedgerCap(), clock);
  }

  /**
   * Builds the ingest use case, creating the output directories first.
   *
   * @return use case ready to {@link IngestUseCase#run()}
   * @throws IllegalArgumentException if an output directory cannot be created or written
   */
  public IngestUseCase ingestUseCase() {
    Paths.ensureWritableDir(config.outputDir());
    Paths.ensureWritableDir(config.checkpointPath().getParent());
    Paths.ensureWritableDir(config.metricsPath().getParent());
    return new IngestUseCase(
        config,
        checkpointStore(),
        new RotatedFileCatalog(config.rotatedDir(), config.rotatedNamePattern(), config.readChunkBytes()),
        new ActiveFileTailer(config.activePath(), config.readChunkBytes(), config.pollIntervalMillis()),
        new HourlyNdjsonSink(config.outputDir(), config.eventsPrefix(), clock, zone),
        new HourlyNdjsonSink(config.outputDir(), config.dlqPrefix(), clock, zone),
        new NdjsonMetricsSink(config.metricsPath()),
        clock,
        metrics,
        zone);
  }
}
