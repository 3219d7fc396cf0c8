package ca.gc.cra.edgeingest.infrastructure.sink;

import ca.gc.cra.edgeingest.application.pipeline.MetricsSnapshot;
import ca.gc.cra.edgeingest.domain.checkpoint.CounterSnapshot;
import ca.gc.cra.edgeingest.domain.event.DlqReason;
import ca.gc.cra.edgeingest.domain.event.DlqRecord;
import ca.gc.cra.edgeingest.domain.event.FirewallEvent;
import ca.gc.cra.edgeingest.domain.event.IngestedEvent;
import ca.gc.cra.edgeingest.domain.file.SourcePosition;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Serializes sink records as single-line JSON objects with snake_case field names.
 *
 * <p>Events keep every FortiGate field, {@code null} included, so downstream schemas see a stable shape.</p>
 *
 * @since 0.1.0
 */
public final class IngestJsonWriter {
  private static final JsonFactory FACTORY = new JsonFactory();

  private IngestJsonWriter() {}

  /**
   * Encodes an event stamped with ingest metadata.
   *
   * @param ingested event to encode
   * @return UTF-8 JSON without a trailing line feed
   */
  public static byte[] event(IngestedEvent ingested) {
    return write(gen -> {
      gen.writeStartObject();
      writeEventFields(gen, ingested.event());
      gen.writeStringField("ingest_ts", ingested.ingestTs());
      gen.writeFieldName("source");
      writePosition(gen, ingested.source());
      gen.writeEndObject();
    });
  }

  /**
   * Encodes a parsed event without ingest metadata, as printed by the {@code parse} tool.
   *
   * @param event event to encode
   * @return JSON text
   */
  public static String parsedEvent(FirewallEvent event) {
    return new String(write(gen -> {
      gen.writeStartObject();
      writeEventFields(gen, event);
      gen.writeEndObject();
    }), StandardCharsets.UTF_8);
  }

  /**
   * Encodes a parser rejection as printed by the {@code parse} tool.
   *
   * @param reason rejection reason
   * @param raw rejected line
   * @return JSON text
   */
  public static String rejection(DlqReason reason, String raw) {
    return new String(write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("dlq_reason", reason.code());
      gen.writeStringField("raw", raw);
      gen.writeEndObject();
    }), StandardCharsets.UTF_8);
  }

  /**
   * Encodes a dead-letter record.
   *
   * @param record record to encode
   * @return UTF-8 JSON without a trailing line feed
   */
  public static byte[] deadLetter(DlqRecord record) {
    return write(gen -> {
      gen.writeStartObject();
      gen.writeNumberField("schema_version", DlqRecord.SCHEMA_VERSION);
      gen.writeStringField("ingest_ts", record.ingestTs());
      gen.writeStringField("reason", record.reason().code());
      gen.writeFieldName("source");
      writePosition(gen, record.source());
      gen.writeStringField("raw", record.raw());
      gen.writeEndObject();
    });
  }

  /**
   * Encodes a metrics summary.
   *
   * @param snapshot summary to encode
   * @return UTF-8 JSON without a trailing line feed
   */
  public static byte[] metrics(MetricsSnapshot snapshot) {
    return write(gen -> {
      gen.writeStartObject();
      gen.writeNumberField("ts", snapshot.ts());
      gen.writeNumberField("window_sec", round3(snapshot.windowSeconds()));
      gen.writeFieldName("counters");
      writeCounters(gen, snapshot.counters());
      gen.writeFieldName("deltas");
      writeCounters(gen, snapshot.deltas());
      gen.writeNumberField("lines_per_sec", round3(snapshot.linesPerSec()));
      gen.writeNumberField("events_per_sec", round3(snapshot.eventsPerSec()));
      gen.writeNumberField("dlq_ratio", round3(snapshot.dlqRatio()));
      gen.writeObjectFieldStart("active");
      gen.writeStringField("path", snapshot.active().path());
      writeNullableLong(gen, "inode", snapshot.active().inode());
      gen.writeNumberField("offset", snapshot.active().offset());
      gen.writeStringField("last_event_ts_seen", snapshot.active().lastEventTsSeen());
      gen.writeEndObject();
      gen.writeNumberField("completed_files", snapshot.completedFiles());
      gen.writeNumberField("checkpoint_updated_at", snapshot.checkpointUpdatedAt());
      gen.writeEndObject();
    });
  }

  /**
   * Writes the counter block shared by checkpoints and metrics summaries.
   *
   * @param gen open generator positioned where an object value is expected
   * @param counters counters to write
   * @throws IOException if the generator fails
   */
  public static void writeCounters(JsonGenerator gen, CounterSnapshot counters) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("lines_in_total", counters.linesIn());
    gen.writeNumberField("bytes_in_total", counters.bytesIn());
    gen.writeNumberField("events_out_total", counters.eventsOut());
    gen.writeNumberField("dlq_out_total", counters.dlqOut());
    gen.writeNumberField("parse_fail_total", counters.parseFail());
    gen.writeNumberField("write_fail_total", counters.writeFail());
    gen.writeNumberField("checkpoint_fail_total", counters.checkpointFail());
    gen.writeEndObject();
  }

  private static void writeEventFields(JsonGenerator gen, FirewallEvent event) throws IOException {
    gen.writeNumberField("schema_version", FirewallEvent.SCHEMA_VERSION);
    gen.writeStringField("event_id", event.eventId());
    gen.writeStringField("host", event.host());
    gen.writeStringField("event_ts", event.eventTsIso());
    gen.writeStringField("type", event.type());
    gen.writeStringField("subtype", event.subtype());
    gen.writeStringField("level", event.level());
    gen.writeStringField("devname", event.devname());
    gen.writeStringField("devid", event.devid());
    gen.writeStringField("vd", event.vd());
    gen.writeStringField("action", event.action());
    writeNullableLong(gen, "policyid", event.policyid());
    writeNullableLong(gen, "proto", event.proto());
    gen.writeStringField("service", event.service());
    gen.writeStringField("srcip", event.srcip());
    writeNullableLong(gen, "srcport", event.srcport());
    gen.writeStringField("srcintf", event.srcintf());
    gen.writeStringField("srcintfrole", event.srcintfrole());
    gen.writeStringField("dstip", event.dstip());
    writeNullableLong(gen, "dstport", event.dstport());
    gen.writeStringField("dstintf", event.dstintf());
    gen.writeStringField("dstintfrole", event.dstintfrole());
    writeNullableLong(gen, "sentbyte", event.sentbyte());
    writeNullableLong(gen, "rcvdbyte", event.rcvdbyte());
    writeNullableLong(gen, "sentpkt", event.sentpkt());
    writeNullableLong(gen, "rcvdpkt", event.rcvdpkt());
    gen.writeStringField("raw", event.raw());
    gen.writeStringField("parse_status", event.parseStatus().code());
  }

  private static void writePosition(JsonGenerator gen, SourcePosition position) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("path", position.path());
    writeNullableLong(gen, "inode", position.inode());
    writeNullableLong(gen, "offset", position.offset());
    if (position.size() != null) {
      gen.writeNumberField("size", position.size());
    }
    if (position.mtime() != null) {
      gen.writeNumberField("mtime", position.mtime());
    }
    gen.writeEndObject();
  }

  private static void writeNullableLong(JsonGenerator gen, String field, Long value) throws IOException {
    if (value == null) {
      gen.writeNullField(field);
    } else {
      gen.writeNumberField(field, value);
    }
  }

  private static double round3(double value) {
    return Math.round(value * 1000.0) / 1000.0;
  }

  private static byte[] write(GeneratorBody body) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(512);
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      body.write(gen);
    } catch (IOException ex) {
      // Writing to an in-memory buffer only fails on generator misuse.
      throw new UncheckedIOException("Failed to encode JSON record", ex);
    }
    return out.toByteArray();
  }

  @FunctionalInterface
  private interface GeneratorBody {
    void write(JsonGenerator gen) throws IOException;
  }
}
