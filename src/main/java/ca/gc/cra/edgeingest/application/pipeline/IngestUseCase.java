package ca.gc.cra.edgeingest.application.pipeline;

import ca.gc.cra.edgeingest.application.port.ActiveFilePort;
import ca.gc.cra.edgeingest.application.port.ActiveFileReplacedException;
import ca.gc.cra.edgeingest.application.port.CheckpointException;
import ca.gc.cra.edgeingest.application.port.CheckpointStorePort;
import ca.gc.cra.edgeingest.application.port.ClockPort;
import ca.gc.cra.edgeingest.application.port.DeadLetterSinkPort;
import ca.gc.cra.edgeingest.application.port.EventSinkPort;
import ca.gc.cra.edgeingest.application.port.LineCursor;
import ca.gc.cra.edgeingest.application.port.MetricsPort;
import ca.gc.cra.edgeingest.application.port.MetricsSinkPort;
import ca.gc.cra.edgeingest.application.port.RotatedFileCatalogPort;
import ca.gc.cra.edgeingest.config.IngestConfig;
import ca.gc.cra.edgeingest.domain.checkpoint.ActivePointer;
import ca.gc.cra.edgeingest.domain.checkpoint.CheckpointState;
import ca.gc.cra.edgeingest.domain.event.ParseOutcome;
import ca.gc.cra.edgeingest.domain.file.FileIdentity;
import ca.gc.cra.edgeingest.domain.file.SourceLine;
import ca.gc.cra.edgeingest.domain.parse.FortiGateLineParser;
import ca.gc.cra.edgeingest.domain.util.Utf8;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> The ingest control loop: drains rotated files, follows the active file, flushes the
 * checkpoint and emits metrics summaries.
 * <p><strong>Why:</strong> Every line must be routed exactly once per checkpoint generation; a crash replays at most
 * one checkpoint interval of work.</p>
 * <p><strong>Role:</strong> Application-layer use case; the single owner of the {@link CheckpointState}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drain every rotated file not yet in the completed ledger, oldest first, before touching the active file.</li>
 *   <li>Follow the active file for at most one tail slice per iteration, resetting on rotation or truncation.</li>
 *   <li>Flush the checkpoint and append a metrics summary on their own timers; neither failure is fatal.</li>
 *   <li>On interruption finish the line in flight, flush once more and close the sinks.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; run a single instance on one thread. Stop it by interrupting
 * that thread.</p>
 * <p><strong>Observability:</strong> {@code ingest.lines.in}, {@code ingest.line.bytes},
 * {@code ingest.rotation.detected}, {@code ingest.rotated.completed}, {@code ingest.checkpoint.fail}; the file
 * being read is placed in the MDC under {@code source}.</p>
 *
 * @since 0.1.0
 */
public final class IngestUseCase {
  private static final Logger log = LoggerFactory.getLogger(IngestUseCase.class);
  static final String MDC_SOURCE = "source";

  private final IngestConfig config;
  private final CheckpointStorePort checkpointStore;
  private final RotatedFileCatalogPort catalog;
  private final ActiveFilePort activeFile;
  private final EventSinkPort events;
  private final DeadLetterSinkPort deadLetters;
  private final MetricsSinkPort metricsSink;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ZoneId zone;
  private final EventRouter router;

  private CheckpointState state;
  private MetricsWindow window;
  private long lastFlushMillis;
  private long lastMetricsMillis;

  /**
   * Creates the use case.
   *
   * @param config loop timing and locations
   * @param checkpointStore persisted progress
   * @param catalog rotated file discovery and reading
   * @param activeFile active file follower
   * @param events event sink
   * @param deadLetters dead-letter sink
   * @param metricsSink periodic summary sink
   * @param clock wall clock for timers, ingest timestamps and the contextual year
   * @param metrics live metrics mirror
   * @param zone zone used to derive the contextual year of envelope dates
   */
  public IngestUseCase(
      IngestConfig config,
      CheckpointStorePort checkpointStore,
      RotatedFileCatalogPort catalog,
      ActiveFilePort activeFile,
      EventSinkPort events,
      DeadLetterSinkPort deadLetters,
      MetricsSinkPort metricsSink,
      ClockPort clock,
      MetricsPort metrics,
      ZoneId zone) {
    this.config = Objects.requireNonNull(config, "config");
    this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.activeFile = Objects.requireNonNull(activeFile, "activeFile");
    this.events = Objects.requireNonNull(events, "events");
    this.deadLetters = Objects.requireNonNull(deadLetters, "deadLetters");
    this.metricsSink = Objects.requireNonNull(metricsSink, "metricsSink");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.zone = Objects.requireNonNull(zone, "zone");
    this.router = new EventRouter(events, deadLetters, clock, metrics);
  }

  /**
   * Loads the checkpoint and runs the loop until the current thread is interrupted.
   *
   * @throws CheckpointException if the persisted checkpoint cannot be loaded
   * @throws IOException if the sinks fail to close after the final flush
   */
  public void run() throws IOException {
    open();
    try {
      while (!Thread.currentThread().isInterrupted()) {
        runIteration();
      }
      log.info("Ingest loop interrupted; flushing checkpoint before exit");
    } finally {
      close();
    }
  }

  /**
   * Loads the checkpoint and starts the timers.
   *
   * @throws CheckpointException if the persisted checkpoint cannot be loaded
   */
  void open() throws CheckpointException {
    state = checkpointStore.load();
    long now = clock.nowMillis();
    window = new MetricsWindow(state.counters().snapshot(), now);
    lastFlushMillis = now;
    lastMetricsMillis = now;
    ActivePointer active = state.active();
    log.info("Resuming {} at inode={} offset={} with {} completed rotated files",
        active.path(), active.inode(), active.offset(), state.completedCount());
  }

  /** One loop iteration: rotated drain, one tail slice, then the timers. */
  void runIteration() {
    drainRotatedFiles();
    if (Thread.currentThread().isInterrupted()) {
      return;
    }
    tailActiveSlice();
    maybeFlushAndReport();
  }

  /** Final flush and sink shutdown. */
  void close() throws IOException {
    if (state == null) {
      return;
    }
    // File channels refuse IO on an interrupted thread; clear the flag for the final writes.
    boolean interrupted = Thread.interrupted();
    try {
      FlushOutcome outcome = flushCheckpoint();
      log.info("Final checkpoint flush {}: {}", outcome, state.counters());
      try {
        events.close();
      } finally {
        deadLetters.close();
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  CheckpointState state() {
    return state;
  }

  void drainRotatedFiles() {
    List<Path> rotated;
    try {
      rotated = catalog.listRotatedFiles();
    } catch (NoSuchFileException ex) {
      log.debug("Rotation directory {} does not exist yet", ex.getFile());
      return;
    } catch (IOException ex) {
      log.warn("Unable to list rotated files; retrying next iteration", ex);
      return;
    }

    for (Path path : rotated) {
      if (Thread.currentThread().isInterrupted()) {
        return;
      }
      FileIdentity identity;
      try {
        identity = catalog.statFile(path);
      } catch (NoSuchFileException ex) {
        log.debug("Rotated file {} vanished before it could be read; skipping", path);
        continue;
      } catch (IOException ex) {
        log.warn("Unable to stat rotated file {}; skipping this iteration", path, ex);
        continue;
      }
      if (state.isCompleted(identity)) {
        continue;
      }
      drainRotatedFile(identity);
      maybeFlushAndReport();
    }
  }

  private void drainRotatedFile(FileIdentity identity) {
    String previous = MDC.get(MDC_SOURCE);
    MDC.put(MDC_SOURCE, identity.path());
    long lines = 0;
    try (LineCursor cursor = catalog.readLines(identity)) {
      while (true) {
        if (Thread.currentThread().isInterrupted()) {
          log.info("Interrupted while draining {} after {} lines; not marking completed", identity.path(), lines);
          return;
        }
        Optional<SourceLine> next = cursor.poll();
        if (next.isEmpty()) {
          break;
        }
        ingest(next.get());
        lines++;
      }
      state.markCompleted(identity, clock.nowMillis() / 1000L);
      metrics.increment("ingest.rotated.completed");
      log.info("Drained rotated file {} ({} lines)", identity.path(), lines);
    } catch (NoSuchFileException ex) {
      log.info("Rotated file {} vanished during read after {} lines; not marking completed", identity.path(), lines);
    } catch (IOException ex) {
      settleUnreadableTail(identity, lines, ex);
    } finally {
      restoreMdc(previous);
    }
  }

  /**
   * Settles a rotated file whose read failed part-way. A file still matching the identity it was read
   * under is ledgered with its routed prefix; one that changed since is left for a later pass.
   */
  private void settleUnreadableTail(FileIdentity identity, long lines, IOException cause) {
    FileIdentity now;
    try {
      now = catalog.statFile(Path.of(identity.path()));
    } catch (NoSuchFileException gone) {
      log.info("Rotated file {} vanished after a failed read at {} lines; not marking completed",
          identity.path(), lines);
      return;
    } catch (IOException statFailure) {
      cause.addSuppressed(statFailure);
      now = identity;
    }
    if (!now.dedupKey().equals(identity.dedupKey())) {
      metrics.increment("ingest.rotated.deferred");
      log.warn("Rotated file {} changed while being read ({} lines routed); reading it again once it settles",
          identity.path(), lines, cause);
      return;
    }
    state.markCompleted(identity, clock.nowMillis() / 1000L);
    metrics.increment("ingest.rotated.truncated");
    log.warn("Rotated file {} ends in unreadable data after {} lines; marking it completed",
        identity.path(), lines, cause);
  }

  void tailActiveSlice() {
    long deadline = clock.nowMillis() + config.tailSliceMillis();
    Optional<FileIdentity> current;
    try {
      current = activeFile.currentIdentity();
    } catch (IOException ex) {
      log.warn("Unable to stat active file {}", config.activePath(), ex);
      pause();
      return;
    }
    if (current.isEmpty()) {
      pause();
      return;
    }

    FileIdentity identity = current.get();
    ActivePointer pointer = state.active();
    Long previousInode = pointer.inode();
    if (pointer.adopt(identity.inode())) {
      if (previousInode != null) {
        metrics.increment("ingest.rotation.detected");
        log.info("Active file rotated (inode {} -> {}); following new file from offset 0",
            previousInode, identity.inode());
      }
    } else if (identity.size() < pointer.offset()) {
      log.warn("Active file {} shrank to {} bytes below offset {}; assuming copy-truncate and restarting at 0",
          identity.path(), identity.size(), pointer.offset());
      pointer.restartAfterTruncation();
    }

    String previous = MDC.get(MDC_SOURCE);
    MDC.put(MDC_SOURCE, identity.path());
    try (LineCursor cursor = activeFile.follow(identity, pointer.offset())) {
      while (!Thread.currentThread().isInterrupted() && clock.nowMillis() < deadline) {
        Optional<SourceLine> next = cursor.poll();
        if (next.isPresent()) {
          SourceLine line = next.get();
          ingest(line);
          pointer.advanceTo(line.position().offset());
        } else if (identityChanged(identity, pointer)) {
          break;
        }
      }
    } catch (ActiveFileReplacedException ex) {
      log.debug("{}; re-adopting on the next slice", ex.getMessage());
    } catch (NoSuchFileException ex) {
      log.debug("Active file {} disappeared while opening", config.activePath());
    } catch (IOException ex) {
      log.warn("Failed following active file {}", config.activePath(), ex);
      pause();
    } finally {
      restoreMdc(previous);
    }
  }

  private boolean identityChanged(FileIdentity followed, ActivePointer pointer) {
    try {
      Optional<FileIdentity> now = activeFile.currentIdentity();
      return now.isEmpty()
          || !now.get().samePhysicalFile(followed)
          || now.get().size() < pointer.offset();
    } catch (IOException ex) {
      log.debug("Unable to re-stat active file during tail slice", ex);
      return true;
    }
  }

  private void ingest(SourceLine line) {
    // Counted on the decoded text so a substituted byte contributes what the event output will carry.
    int bytesIn = Utf8.encodedLength(line.text());
    state.counters().recordLineIn(bytesIn);
    metrics.increment("ingest.lines.in");
    metrics.observe("ingest.line.bytes", bytesIn);
    ParseOutcome outcome = FortiGateLineParser.parse(line.text(), contextualYear());
    router.route(outcome, line, state);
  }

  private int contextualYear() {
    return Instant.ofEpochMilli(clock.nowMillis()).atZone(zone).getYear();
  }

  void maybeFlushAndReport() {
    long now = clock.nowMillis();
    if (now - lastFlushMillis >= config.checkpointIntervalMillis()) {
      flushCheckpoint();
      lastFlushMillis = now;
    }
    if (now - lastMetricsMillis >= config.metricsIntervalMillis()) {
      emitMetrics(now);
      lastMetricsMillis = now;
    }
  }

  FlushOutcome flushCheckpoint() {
    try {
      checkpointStore.save(state);
      return FlushOutcome.SAVED;
    } catch (IOException ex) {
      state.counters().recordCheckpointFailure();
      metrics.increment("ingest.checkpoint.fail");
      log.warn("Checkpoint flush failed; keeping in-memory state for the next attempt", ex);
      return FlushOutcome.FAILED;
    }
  }

  private void emitMetrics(long nowMillis) {
    MetricsSnapshot snapshot = window.close(state, nowMillis);
    try {
      metricsSink.append(snapshot);
    } catch (IOException ex) {
      state.counters().recordWriteFailure();
      metrics.increment("ingest.write.fail");
      log.warn("Failed to append metrics summary", ex);
    }
  }

  private void pause() {
    try {
      Thread.sleep(config.pollIntervalMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static void restoreMdc(String previous) {
    if (previous == null) {
      MDC.remove(MDC_SOURCE);
    } else {
      MDC.put(MDC_SOURCE, previous);
    }
  }
}
