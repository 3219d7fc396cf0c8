package ca.gc.cra.edgeingest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.edgeingest.domain.checkpoint.CheckpointState;
import ca.gc.cra.edgeingest.domain.file.FileIdentity;
import ca.gc.cra.edgeingest.infrastructure.checkpoint.FileCheckpointStore;
import ca.gc.cra.edgeingest.testutil.SteppingClock;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CheckpointInspectCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private Path active;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    active = tempDir.resolve("fortigate.log");
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCheckpointIsReportedWithoutCreatingIt() {
    ExitCode code = CheckpointInspectCli.run(new String[] {
        "activePath=" + active, "outputDir=" + tempDir});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("No checkpoint at " + tempDir.resolve("checkpoint.json")));
    assertFalse(Files.exists(tempDir.resolve("checkpoint.json")));
  }

  @Test
  void printsPointerCountersAndRecentCompletions() throws Exception {
    Path checkpoint = tempDir.resolve("checkpoint.json");
    FileCheckpointStore store =
        new FileCheckpointStore(checkpoint, active.toString(), 100, SteppingClock.fixed(1_704_423_845_000L));
    CheckpointState state = store.load();
    state.active().adopt(42L);
    state.active().advanceTo(1_024L);
    state.counters().recordLineIn(100);
    state.counters().recordEventOut();
    for (int i = 1; i <= 3; i++) {
      state.markCompleted(new FileIdentity(active + "-2024010" + i + "-000000.gz", i, 10L * i, 0L), i);
    }
    store.save(state);

    ExitCode code = CheckpointInspectCli.run(new String[] {
        "activePath=" + active, "checkpointPath=" + checkpoint, "recent=2"});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("Active inode       : 42"), text);
    assertTrue(text.contains("Active offset      : 1024"), text);
    assertTrue(text.contains("Completed files    : 3"), text);
    assertTrue(text.contains("Events out         : 1"), text);
    assertFalse(text.contains("20240101"), "only the two most recent completions are listed");
    assertTrue(text.contains("20240103"), text);
  }

  @Test
  void corruptCheckpointIsIoError() throws Exception {
    Files.writeString(tempDir.resolve("checkpoint.json"), "{not json");

    ExitCode code = CheckpointInspectCli.run(new String[] {
        "activePath=" + active, "outputDir=" + tempDir});

    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void negativeRecentIsRejected() {
    ExitCode code = CheckpointInspectCli.run(new String[] {"outputDir=" + tempDir, "recent=-1"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: inspect"));
  }
}
