package ca.gc.cra.edgeingest.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.edgeingest.domain.checkpoint.CheckpointState;
import ca.gc.cra.edgeingest.domain.checkpoint.CounterSnapshot;
import ca.gc.cra.edgeingest.domain.checkpoint.Counters;
import org.junit.jupiter.api.Test;

class MetricsWindowTest {

  @Test
  void ratesCoverOnlyTheClosedWindow() {
    CheckpointState state = CheckpointState.initial("/logs/fortigate.log", 100L, 10);
    Counters counters = state.counters();
    counters.recordLineIn(10);
    MetricsWindow window = new MetricsWindow(counters.snapshot(), 0L);

    for (int i = 0; i < 20; i++) {
      counters.recordLineIn(100);
    }
    for (int i = 0; i < 15; i++) {
      counters.recordEventOut();
    }
    for (int i = 0; i < 5; i++) {
      counters.recordDeadLetterOut();
    }
    state.active().adopt(9L);
    state.active().advanceTo(2_000L);

    MetricsSnapshot snapshot = window.close(state, 10_000L);

    assertEquals(10L, snapshot.ts());
    assertEquals(10.0, snapshot.windowSeconds(), 1e-9);
    assertEquals(21L, snapshot.counters().linesIn());
    assertEquals(20L, snapshot.deltas().linesIn());
    assertEquals(2.0, snapshot.linesPerSec(), 1e-9);
    assertEquals(1.5, snapshot.eventsPerSec(), 1e-9);
    assertEquals(0.25, snapshot.dlqRatio(), 1e-9);
    assertEquals(9L, snapshot.active().inode());
    assertEquals(2_000L, snapshot.active().offset());
    assertEquals(100L, snapshot.checkpointUpdatedAt());
  }

  @Test
  void nextWindowStartsWhereThePreviousEnded() {
    CheckpointState state = CheckpointState.initial("/logs/fortigate.log", 0L, 10);
    MetricsWindow window = new MetricsWindow(CounterSnapshot.ZERO, 0L);
    state.counters().recordLineIn(1);
    window.close(state, 1_000L);

    MetricsSnapshot idle = window.close(state, 3_000L);

    assertEquals(CounterSnapshot.ZERO, idle.deltas());
    assertEquals(2.0, idle.windowSeconds(), 1e-9);
    assertEquals(0.0, idle.dlqRatio(), 1e-9);
  }

  @Test
  void zeroLengthWindowDoesNotDivideByZero() {
    CheckpointState state = CheckpointState.initial("/logs/fortigate.log", 0L, 10);
    MetricsWindow window = new MetricsWindow(CounterSnapshot.ZERO, 5_000L);

    MetricsSnapshot snapshot = window.close(state, 5_000L);

    assertEquals(0.001, snapshot.windowSeconds(), 1e-9);
    assertEquals(0.0, snapshot.linesPerSec(), 1e-9);
  }
}
