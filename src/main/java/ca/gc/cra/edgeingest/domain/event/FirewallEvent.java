package ca.gc.cra.edgeingest.domain.event;

import java.util.Objects;

/**
 * Typed FortiGate log event produced by a successful parse.
 *
 * <p>String fields are {@code null} when the key was absent; numeric fields are {@code null} when the
 * key was absent or its value was not an integer. Ingestion metadata ({@code ingest_ts}, source position)
 * is attached later by wrapping the event in an {@link IngestedEvent}.</p>
 *
 * @param eventId first 32 hex characters of the SHA-256 of the raw line
 * @param host syslog envelope host
 * @param eventTs resolved event time; {@code null} when no valid date/time could be resolved
 * @param type FortiGate {@code type}
 * @param subtype FortiGate {@code subtype}
 * @param level FortiGate {@code level}
 * @param devname device name
 * @param devid device serial
 * @param vd virtual domain
 * @param action policy action (accept, deny, ...)
 * @param policyid matched policy id
 * @param proto IP protocol number
 * @param service service name
 * @param srcip source address
 * @param srcport source port
 * @param srcintf source interface
 * @param srcintfrole source interface role
 * @param dstip destination address
 * @param dstport destination port
 * @param dstintf destination interface
 * @param dstintfrole destination interface role
 * @param sentbyte bytes sent
 * @param rcvdbyte bytes received
 * @param sentpkt packets sent
 * @param rcvdpkt packets received
 * @param raw raw line exactly as read, trailing line feed included
 * @param parseStatus {@link ParseStatus#OK} or {@link ParseStatus#PARTIAL}
 * @since 0.1.0
 */
public record FirewallEvent(
    String eventId,
    String host,
    EventTimestamp eventTs,
    String type,
    String subtype,
    String level,
    String devname,
    String devid,
    String vd,
    String action,
    Long policyid,
    Long proto,
    String service,
    String srcip,
    Long srcport,
    String srcintf,
    String srcintfrole,
    String dstip,
    Long dstport,
    String dstintf,
    String dstintfrole,
    Long sentbyte,
    Long rcvdbyte,
    Long sentpkt,
    Long rcvdpkt,
    String raw,
    ParseStatus parseStatus) {

  /** Schema version written with every event. */
  public static final int SCHEMA_VERSION = 1;

  public FirewallEvent {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(raw, "raw");
    Objects.requireNonNull(parseStatus, "parseStatus");
  }

  /**
   * Returns the resolved event time as ISO-8601 text.
   *
   * @return ISO-8601 timestamp or {@code null} when unresolved
   */
  public String eventTsIso() {
    return eventTs == null ? null : eventTs.toIsoString();
  }
}
