package ca.gc.cra.edgeingest.domain.checkpoint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class CountersTest {

  @Test
  void deadLetterCountsBothDlqAndParseFailure() {
    Counters counters = new Counters();
    counters.recordLineIn(10);
    counters.recordLineIn(5);
    counters.recordEventOut();
    counters.recordDeadLetterOut();
    counters.recordWriteFailure();
    counters.recordCheckpointFailure();

    assertEquals(new CounterSnapshot(2, 15, 1, 1, 1, 1, 1), counters.snapshot());
  }

  @Test
  void restoredCountersContinueFromSnapshot() {
    Counters counters = new Counters(new CounterSnapshot(10, 100, 8, 2, 2, 0, 0));
    counters.recordEventOut();

    assertEquals(9L, counters.snapshot().eventsOut());
    assertEquals(100L, counters.snapshot().bytesIn());
  }

  @Test
  void snapshotDifferenceGivesDeltas() {
    CounterSnapshot earlier = new CounterSnapshot(1, 10, 1, 0, 0, 0, 0);
    CounterSnapshot later = new CounterSnapshot(4, 40, 2, 2, 2, 1, 0);

    assertEquals(new CounterSnapshot(3, 30, 1, 2, 2, 1, 0), later.minus(earlier));
  }

  @Test
  void rejectsNegativeLineLength() {
    assertThrows(IllegalArgumentException.class, () -> new Counters().recordLineIn(-1));
  }
}
