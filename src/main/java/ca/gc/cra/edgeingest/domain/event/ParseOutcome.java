package ca.gc.cra.edgeingest.domain.event;

import java.util.Objects;

/**
 * Result of parsing one raw line: exactly one of an event or a rejection.
 *
 * @since 0.1.0
 */
public sealed interface ParseOutcome permits ParseOutcome.Parsed, ParseOutcome.Rejected {

  /**
   * Wraps a parsed event.
   *
   * @param event parsed event
   * @return successful outcome
   */
  static ParseOutcome parsed(FirewallEvent event) {
    return new Parsed(event);
  }

  /**
   * Wraps a rejection.
   *
   * @param reason dead-letter reason
   * @return rejected outcome
   */
  static ParseOutcome rejected(DlqReason reason) {
    return new Rejected(reason);
  }

  /**
   * Successful parse, possibly {@link ParseStatus#PARTIAL}.
   *
   * @param event parsed event
   */
  record Parsed(FirewallEvent event) implements ParseOutcome {
    public Parsed {
      Objects.requireNonNull(event, "event");
    }
  }

  /**
   * Line routed to the dead-letter sink.
   *
   * @param reason first rule that failed
   */
  record Rejected(DlqReason reason) implements ParseOutcome {
    public Rejected {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
