package ca.gc.cra.edgeingest.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.edgeingest.application.port.ActiveFilePort;
import ca.gc.cra.edgeingest.application.port.ActiveFileReplacedException;
import ca.gc.cra.edgeingest.application.port.CheckpointException;
import ca.gc.cra.edgeingest.application.port.CheckpointStorePort;
import ca.gc.cra.edgeingest.application.port.DeadLetterSinkPort;
import ca.gc.cra.edgeingest.application.port.EventSinkPort;
import ca.gc.cra.edgeingest.application.port.LineCursor;
import ca.gc.cra.edgeingest.application.port.MetricsSinkPort;
import ca.gc.cra.edgeingest.application.port.RotatedFileCatalogPort;
import ca.gc.cra.edgeingest.config.IngestConfig;
import ca.gc.cra.edgeingest.domain.checkpoint.CheckpointState;
import ca.gc.cra.edgeingest.domain.event.DlqReason;
import ca.gc.cra.edgeingest.domain.event.DlqRecord;
import ca.gc.cra.edgeingest.domain.event.IngestedEvent;
import ca.gc.cra.edgeingest.domain.file.FileIdentity;
import ca.gc.cra.edgeingest.domain.file.SourceLine;
import ca.gc.cra.edgeingest.domain.file.SourcePosition;
import ca.gc.cra.edgeingest.testutil.FortiGateLines;
import ca.gc.cra.edgeingest.testutil.RecordingMetricsPort;
import ca.gc.cra.edgeingest.testutil.SteppingClock;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IngestUseCaseTest {
  private static final String ACTIVE = "/logs/fortigate.log";
  private static final long START = 1_704_423_845_000L;

  private final MemoryCheckpointStore store = new MemoryCheckpointStore();
  private final StubCatalog catalog = new StubCatalog();
  private final StubActiveFile activeFile = new StubActiveFile();
  private final List<IngestedEvent> events = new ArrayList<>();
  private final List<DlqRecord> deadLetters = new ArrayList<>();
  private final List<MetricsSnapshot> summaries = new ArrayList<>();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private SteppingClock clock;
  private IngestUseCase useCase;

  @BeforeEach
  void setUp() {
    clock = new SteppingClock(START, 10L);
    IngestConfig config = IngestConfig.fromMap(Map.of(
        "activePath", ACTIVE,
        "outputDir", "/out",
        "tailSliceMillis", "100",
        "pollIntervalMillis", "1",
        "checkpointIntervalMillis", "60000",
        "metricsIntervalMillis", "60000"));
    useCase = new IngestUseCase(
        config,
        store,
        catalog,
        activeFile,
        events::add,
        deadLetters::add,
        summaries::add,
        clock,
        metrics,
        ZoneOffset.UTC);
  }

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void drainsRotatedFilesOldestFirstAndMarksThemCompleted() throws Exception {
    FileIdentity older = catalog.add("/logs/fortigate.log-20240104-000000", 11L,
        FortiGateLines.traffic(1), FortiGateLines.traffic(2));
    FileIdentity newer = catalog.add("/logs/fortigate.log-20240105-000000", 12L,
        FortiGateLines.traffic(3), FortiGateLines.NO_HEADER);
    useCase.open();

    useCase.drainRotatedFiles();

    assertEquals(List.of(1L, 2L, 3L), events.stream().map(e -> e.event().srcport()).toList());
    assertEquals(DlqReason.SYSLOG_HEADER_PARSE_FAIL, deadLetters.get(0).reason());
    CheckpointState state = useCase.state();
    assertTrue(state.isCompleted(older));
    assertTrue(state.isCompleted(newer));
    assertEquals(4L, state.counters().snapshot().linesIn());
    assertEquals(2, metrics.count("ingest.rotated.completed"));
    assertEquals(4, metrics.observed("ingest.line.bytes").size());

    useCase.drainRotatedFiles();
    assertEquals(3, events.size(), "completed files are never read twice");
  }

  @Test
  void vanishedRotatedFileIsSkippedWithoutCompletion() throws Exception {
    FileIdentity gone = catalog.add("/logs/fortigate.log-20240104-000000", 11L, FortiGateLines.traffic(1));
    catalog.failReadsOf(gone.path());
    useCase.open();

    useCase.drainRotatedFiles();

    assertFalse(useCase.state().isCompleted(gone));
    assertTrue(events.isEmpty());
  }

  @Test
  void rotatedFileWithCorruptTailIsCompletedAfterRoutingReadablePart() throws Exception {
    FileIdentity truncated = catalog.add("/logs/fortigate.log-20240104-000000.gz", 11L,
        FortiGateLines.traffic(1), FortiGateLines.traffic(2), FortiGateLines.traffic(3));
    catalog.failAfter(truncated.path(), 2, () -> {});
    useCase.open();

    useCase.drainRotatedFiles();

    assertEquals(List.of(1L, 2L), events.stream().map(e -> e.event().srcport()).toList());
    assertTrue(useCase.state().isCompleted(truncated));
    assertEquals(1, metrics.count("ingest.rotated.truncated"));
    assertEquals(0, metrics.count("ingest.rotated.completed"));

    useCase.drainRotatedFiles();
    useCase.drainRotatedFiles();
    assertEquals(2, events.size(), "the readable prefix is routed exactly once");
  }

  @Test
  void rotatedFileChangingDuringFailedReadIsDeferredUntilSettled() throws Exception {
    String path = "/logs/fortigate.log-20240104-000000.gz";
    FileIdentity partial = catalog.add(path, 11L, FortiGateLines.traffic(1), FortiGateLines.traffic(2));
    catalog.failAfter(path, 1,
        () -> catalog.add(path, 11L, FortiGateLines.traffic(1), FortiGateLines.traffic(2), FortiGateLines.traffic(3)));
    useCase.open();

    useCase.drainRotatedFiles();

    assertFalse(useCase.state().isCompleted(partial));
    assertEquals(1, metrics.count("ingest.rotated.deferred"));

    useCase.drainRotatedFiles();

    FileIdentity settled = catalog.statFile(Path.of(path));
    assertTrue(useCase.state().isCompleted(settled));
    assertEquals(List.of(1L, 1L, 2L, 3L), events.stream().map(e -> e.event().srcport()).toList());

    useCase.drainRotatedFiles();
    assertEquals(4, events.size());
  }

  @Test
  void missingRotationDirectoryIsTolerated() throws Exception {
    catalog.directoryMissing = true;
    useCase.open();

    useCase.runIteration();

    assertTrue(events.isEmpty());
  }

  @Test
  void tailAdvancesPointerToEndOfLastRoutedLine() throws Exception {
    activeFile.replace(21L, FortiGateLines.TRAFFIC_ACCEPT, FortiGateLines.BINARY);
    useCase.open();

    useCase.tailActiveSlice();

    CheckpointState state = useCase.state();
    assertEquals(21L, state.active().inode());
    assertEquals(activeFile.size(), state.active().offset());
    assertEquals(1, events.size());
    assertEquals(443L, events.get(0).event().dstport());
    assertEquals(DlqReason.NON_TEXT_OR_BINARY, deadLetters.get(0).reason());
    assertEquals(0, metrics.count("ingest.rotation.detected"), "first adoption is not a rotation");
  }

  @Test
  void resumesFromPersistedOffset() throws Exception {
    activeFile.replace(21L, FortiGateLines.traffic(1), FortiGateLines.traffic(2));
    long firstLine = FortiGateLines.traffic(1).getBytes(StandardCharsets.UTF_8).length;
    CheckpointState persisted = CheckpointState.initial(ACTIVE, 0L, 10);
    persisted.active().adopt(21L);
    persisted.active().advanceTo(firstLine);
    store.state = persisted;
    useCase.open();

    useCase.tailActiveSlice();

    assertEquals(List.of(2L), events.stream().map(e -> e.event().srcport()).toList());
  }

  @Test
  void inodeChangeResetsOffsetAndCountsRotation() throws Exception {
    activeFile.replace(21L, FortiGateLines.traffic(1), FortiGateLines.traffic(2));
    useCase.open();
    useCase.tailActiveSlice();

    activeFile.replace(22L, FortiGateLines.traffic(3));
    useCase.tailActiveSlice();

    assertEquals(List.of(1L, 2L, 3L), events.stream().map(e -> e.event().srcport()).toList());
    assertEquals(22L, useCase.state().active().inode());
    assertEquals(activeFile.size(), useCase.state().active().offset());
    assertEquals(1, metrics.count("ingest.rotation.detected"));
  }

  @Test
  void activeFileReplacedBeforeOpenIsReadoptedWithoutMisattribution() throws Exception {
    activeFile.replace(21L, FortiGateLines.traffic(1));
    useCase.open();
    useCase.tailActiveSlice();
    long offsetBefore = useCase.state().active().offset();

    activeFile.replaceOnNextFollow(22L, FortiGateLines.traffic(2), FortiGateLines.traffic(3));
    useCase.tailActiveSlice();

    assertEquals(List.of(1L), events.stream().map(e -> e.event().srcport()).toList());
    assertEquals(21L, useCase.state().active().inode());
    assertEquals(offsetBefore, useCase.state().active().offset());

    useCase.tailActiveSlice();

    assertEquals(List.of(1L, 2L, 3L), events.stream().map(e -> e.event().srcport()).toList());
    assertEquals(22L, useCase.state().active().inode());
    assertEquals(activeFile.size(), useCase.state().active().offset());
  }

  @Test
  void shrinkingFileRestartsFromZero() throws Exception {
    activeFile.replace(21L, FortiGateLines.traffic(1), FortiGateLines.traffic(2));
    useCase.open();
    useCase.tailActiveSlice();

    activeFile.replace(21L, FortiGateLines.traffic(9));
    useCase.tailActiveSlice();

    assertEquals(List.of(1L, 2L, 9L), events.stream().map(e -> e.event().srcport()).toList());
    assertEquals(activeFile.size(), useCase.state().active().offset());
  }

  @Test
  void checkpointFailureIsCountedAndRetried() throws Exception {
    useCase.open();
    store.failSaves = true;

    assertEquals(FlushOutcome.FAILED, useCase.flushCheckpoint());
    assertEquals(1L, useCase.state().counters().snapshot().checkpointFail());
    assertEquals(1, metrics.count("ingest.checkpoint.fail"));

    store.failSaves = false;
    assertEquals(FlushOutcome.SAVED, useCase.flushCheckpoint());
    assertEquals(1, store.saves);
  }

  @Test
  void timersFlushCheckpointAndEmitMetrics() throws Exception {
    activeFile.replace(21L, FortiGateLines.traffic(1));
    useCase.open();
    useCase.tailActiveSlice();

    clock.advance(60_000L);
    useCase.maybeFlushAndReport();

    assertEquals(1, store.saves);
    assertEquals(1, summaries.size());
    assertEquals(1L, summaries.get(0).deltas().eventsOut());
  }

  @Test
  void interruptedRunFlushesAndClosesSinks() throws Exception {
    CloseTrackingSinks sinks = new CloseTrackingSinks();
    IngestUseCase tracked = new IngestUseCase(
        IngestConfig.fromMap(Map.of("activePath", ACTIVE, "outputDir", "/out")),
        store, catalog, activeFile, sinks, sinks.deadLetters(), summaries::add, clock, metrics, ZoneOffset.UTC);

    Thread.currentThread().interrupt();
    tracked.run();

    assertEquals(1, store.saves);
    assertTrue(sinks.eventsClosed);
    assertTrue(sinks.deadLettersClosed);
    assertTrue(Thread.currentThread().isInterrupted(), "interrupt flag is restored after the final flush");
  }

  @Test
  void unreadableCheckpointIsFatal() {
    store.failLoad = true;

    assertThrows(CheckpointException.class, () -> useCase.run());
  }

  private static final class MemoryCheckpointStore implements CheckpointStorePort {
    CheckpointState state = CheckpointState.initial(ACTIVE, 0L, 10);
    boolean failLoad;
    boolean failSaves;
    int saves;

    @Override
    public CheckpointState load() throws CheckpointException {
      if (failLoad) {
        throw new CheckpointException("corrupt");
      }
      return state;
    }

    @Override
    public void save(CheckpointState toSave) throws IOException {
      if (failSaves) {
        throw new IOException("disk full");
      }
      saves++;
    }
  }

  private static final class StubCatalog implements RotatedFileCatalogPort {
    private final Map<Path, FileIdentity> identities = new LinkedHashMap<>();
    private final Map<String, List<String>> contents = new LinkedHashMap<>();
    private final List<String> unreadable = new ArrayList<>();
    private final Map<String, Integer> failAfterLines = new LinkedHashMap<>();
    private final Map<String, Runnable> onFailure = new LinkedHashMap<>();
    boolean directoryMissing;

    FileIdentity add(String path, long inode, String... lines) {
      FileIdentity identity = new FileIdentity(path, inode, totalBytes(List.of(lines)), 1_704_412_800L);
      identities.put(Path.of(path), identity);
      contents.put(path, List.of(lines));
      return identity;
    }

    void failReadsOf(String path) {
      unreadable.add(path);
    }

    /** The next read of {@code path} yields {@code lines} lines, runs {@code action}, then fails. */
    void failAfter(String path, int lines, Runnable action) {
      failAfterLines.put(path, lines);
      onFailure.put(path, action);
    }

    @Override
    public List<Path> listRotatedFiles() throws IOException {
      if (directoryMissing) {
        throw new NoSuchFileException("/logs");
      }
      return List.copyOf(identities.keySet());
    }

    @Override
    public FileIdentity statFile(Path path) {
      return identities.get(path);
    }

    @Override
    public LineCursor readLines(FileIdentity identity) throws IOException {
      if (unreadable.contains(identity.path())) {
        throw new NoSuchFileException(identity.path());
      }
      List<SourceLine> lines = new ArrayList<>();
      long offset = 0;
      for (String text : contents.get(identity.path())) {
        int length = text.getBytes(StandardCharsets.UTF_8).length;
        lines.add(new SourceLine(text, length, SourcePosition.rotated(identity, offset)));
        offset += length;
      }
      Integer limit = failAfterLines.remove(identity.path());
      if (limit == null) {
        return new ListCursor(lines);
      }
      Runnable action = onFailure.remove(identity.path());
      return new FailingCursor(lines.subList(0, limit), action);
    }
  }

  private static final class StubActiveFile implements ActiveFilePort {
    private FileIdentity identity;
    private List<String> lines = List.of();
    private Runnable beforeNextFollow;

    void replace(long inode, String... newLines) {
      lines = List.of(newLines);
      identity = new FileIdentity(ACTIVE, inode, totalBytes(lines), 0L);
    }

    /** Swaps in a new inode after the next identity check but before that follow opens the file. */
    void replaceOnNextFollow(long inode, String... newLines) {
      beforeNextFollow = () -> replace(inode, newLines);
    }

    long size() {
      return identity.size();
    }

    @Override
    public Optional<FileIdentity> currentIdentity() {
      return Optional.ofNullable(identity);
    }

    @Override
    public LineCursor follow(FileIdentity followed, long startOffset) throws IOException {
      if (beforeNextFollow != null) {
        beforeNextFollow.run();
        beforeNextFollow = null;
      }
      if (identity.inode() != followed.inode()) {
        throw new ActiveFileReplacedException(ACTIVE, followed.inode(), identity.inode());
      }
      List<SourceLine> remaining = new ArrayList<>();
      long end = 0;
      for (String text : lines) {
        int length = text.getBytes(StandardCharsets.UTF_8).length;
        end += length;
        if (end > startOffset) {
          remaining.add(new SourceLine(text, length, SourcePosition.active(ACTIVE, followed.inode(), end)));
        }
      }
      return new ListCursor(remaining);
    }
  }

  private static final class ListCursor implements LineCursor {
    private final Iterator<SourceLine> iterator;

    ListCursor(List<SourceLine> lines) {
      this.iterator = lines.iterator();
    }

    @Override
    public Optional<SourceLine> poll() {
      return iterator.hasNext() ? Optional.of(iterator.next()) : Optional.empty();
    }

    @Override
    public void close() {}
  }

  private static final class FailingCursor implements LineCursor {
    private final Iterator<SourceLine> iterator;
    private final Runnable beforeFailing;

    FailingCursor(List<SourceLine> lines, Runnable beforeFailing) {
      this.iterator = lines.iterator();
      this.beforeFailing = beforeFailing;
    }

    @Override
    public Optional<SourceLine> poll() throws IOException {
      if (iterator.hasNext()) {
        return Optional.of(iterator.next());
      }
      beforeFailing.run();
      throw new EOFException("Unexpected end of ZLIB input stream");
    }

    @Override
    public void close() {}
  }

  private static final class CloseTrackingSinks implements EventSinkPort {
    boolean eventsClosed;
    boolean deadLettersClosed;

    @Override
    public void append(IngestedEvent event) {}

    @Override
    public void close() {
      eventsClosed = true;
    }

    DeadLetterSinkPort deadLetters() {
      return new DeadLetterSinkPort() {
        @Override
        public void append(DlqRecord record) {}

        @Override
        public void close() {
          deadLettersClosed = true;
        }
      };
    }
  }

  private static long totalBytes(List<String> lines) {
    long total = 0;
    for (String line : lines) {
      total += line.getBytes(StandardCharsets.UTF_8).length;
    }
    return total;
  }
}
