package ca.gc.cra.edgeingest.domain.parse;

import ca.gc.cra.edgeingest.domain.event.DlqReason;
import ca.gc.cra.edgeingest.domain.event.EventTimestamp;
import ca.gc.cra.edgeingest.domain.event.FirewallEvent;
import ca.gc.cra.edgeingest.domain.event.ParseOutcome;
import ca.gc.cra.edgeingest.domain.event.ParseStatus;
import ca.gc.cra.edgeingest.domain.util.Hashes;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Turns one raw FortiGate syslog line into a {@link FirewallEvent} or a dead-letter
 * reason.
 * <p><strong>Why:</strong> Keeps the envelope grammar, the key/value grammar and timestamp resolution in one
 * pure function that the router and the {@code parse} tool share.</p>
 * <p><strong>Rules:</strong> evaluated in order, first failure wins:
 * {@link DlqReason#EMPTY_LINE}, {@link DlqReason#NON_TEXT_OR_BINARY},
 * {@link DlqReason#SYSLOG_HEADER_PARSE_FAIL}, {@link DlqReason#INVALID_MONTH},
 * {@link DlqReason#KV_PARSE_EXCEPTION}. An event missing {@code type}, {@code subtype} or {@code action} is
 * emitted as {@link ParseStatus#PARTIAL}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class FortiGateLineParser {
  private FortiGateLineParser() {}

  /**
   * Parses a raw line.
   *
   * @param rawLine line exactly as read, trailing line feed included when present
   * @param contextualYear year assumed for the envelope date
   * @return parsed event or rejection; never {@code null}
   */
  public static ParseOutcome parse(String rawLine, int contextualYear) {
    Objects.requireNonNull(rawLine, "rawLine");
    String line = stripTrailingLineFeeds(rawLine);
    if (line.isEmpty()) {
      return ParseOutcome.rejected(DlqReason.EMPTY_LINE);
    }
    if (TextContent.looksBinary(line)) {
      return ParseOutcome.rejected(DlqReason.NON_TEXT_OR_BINARY);
    }

    SyslogEnvelope envelope = SyslogEnvelope.match(line).orElse(null);
    if (envelope == null) {
      return ParseOutcome.rejected(DlqReason.SYSLOG_HEADER_PARSE_FAIL);
    }
    OptionalInt month = envelope.monthNumber();
    if (month.isEmpty()) {
      return ParseOutcome.rejected(DlqReason.INVALID_MONTH);
    }

    Map<String, String> kv;
    try {
      kv = KeyValueParser.parse(envelope.body());
    } catch (RuntimeException ex) {
      return ParseOutcome.rejected(DlqReason.KV_PARSE_EXCEPTION);
    }

    EventTimestamp eventTs = EventTimestampResolver.resolve(
            kv, contextualYear, month.getAsInt(), envelope.day(), envelope.time())
        .orElse(null);

    String type = kv.get("type");
    String subtype = kv.get("subtype");
    String action = kv.get("action");
    ParseStatus status =
        type == null || subtype == null || action == null ? ParseStatus.PARTIAL : ParseStatus.OK;

    FirewallEvent event = new FirewallEvent(
        Hashes.sha256Prefix128Hex(rawLine),
        envelope.host(),
        eventTs,
        type,
        subtype,
        kv.get("level"),
        kv.get("devname"),
        kv.get("devid"),
        kv.get("vd"),
        action,
        toLong(kv.get("policyid")),
        toLong(kv.get("proto")),
        kv.get("service"),
        kv.get("srcip"),
        toLong(kv.get("srcport")),
        kv.get("srcintf"),
        kv.get("srcintfrole"),
        kv.get("dstip"),
        toLong(kv.get("dstport")),
        kv.get("dstintf"),
        kv.get("dstintfrole"),
        toLong(kv.get("sentbyte")),
        toLong(kv.get("rcvdbyte")),
        toLong(kv.get("sentpkt")),
        toLong(kv.get("rcvdpkt")),
        rawLine,
        status);
    return ParseOutcome.parsed(event);
  }

  static String stripTrailingLineFeeds(String rawLine) {
    int end = rawLine.length();
    while (end > 0 && rawLine.charAt(end - 1) == '\n') {
      end--;
    }
    return rawLine.substring(0, end);
  }

  /** Integer conversion tolerant of absent or non-numeric values; surrounding whitespace is ignored. */
  static Long toLong(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.strip();
    try {
      return Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      return null;
    }
  }
}
