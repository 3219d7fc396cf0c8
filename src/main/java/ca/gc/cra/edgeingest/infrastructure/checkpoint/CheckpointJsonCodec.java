package ca.gc.cra.edgeingest.infrastructure.checkpoint;

import ca.gc.cra.edgeingest.domain.checkpoint.ActivePointer;
import ca.gc.cra.edgeingest.domain.checkpoint.CheckpointState;
import ca.gc.cra.edgeingest.domain.checkpoint.CompletedFileRecord;
import ca.gc.cra.edgeingest.domain.checkpoint.CounterSnapshot;
import ca.gc.cra.edgeingest.domain.checkpoint.Counters;
import ca.gc.cra.edgeingest.infrastructure.json.JsonSupport;
import ca.gc.cra.edgeingest.infrastructure.sink.IngestJsonWriter;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the checkpoint document.
 *
 * <pre>
 * {"schema_version":1,
 *  "active":{"path":"/data/fortigate/fortigate.log","inode":1234,"offset":5678,"last_event_ts_seen":null},
 *  "completed":[{"key":"p|i|s|m","path":"...","inode":1,"size":2,"mtime":3,"completed_at":4}],
 *  "counters":{"lines_in_total":0,...,"checkpoint_fail_total":0},
 *  "updated_at":1700000000}
 * </pre>
 *
 * <p>Missing fields take their first-run defaults so older documents stay readable.</p>
 *
 * @since 0.1.0
 */
final class CheckpointJsonCodec {
  private static final JsonFactory FACTORY = new JsonFactory();

  private final JsonSupport json;

  CheckpointJsonCodec(JsonSupport json) {
    this.json = json;
  }

  void write(CheckpointState state, OutputStream out) throws IOException {
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeNumberField("schema_version", state.schemaVersion());

      ActivePointer active = state.active();
      gen.writeObjectFieldStart("active");
      gen.writeStringField("path", active.path());
      if (active.inode() == null) {
        gen.writeNullField("inode");
      } else {
        gen.writeNumberField("inode", active.inode());
      }
      gen.writeNumberField("offset", active.offset());
      gen.writeStringField("last_event_ts_seen", active.lastEventTsSeen());
      gen.writeEndObject();

      gen.writeArrayFieldStart("completed");
      for (CompletedFileRecord record : state.completed()) {
        gen.writeStartObject();
        gen.writeStringField("key", record.key());
        gen.writeStringField("path", record.path());
        gen.writeNumberField("inode", record.inode());
        gen.writeNumberField("size", record.size());
        gen.writeNumberField("mtime", record.mtime());
        gen.writeNumberField("completed_at", record.completedAt());
        gen.writeEndObject();
      }
      gen.writeEndArray();

      gen.writeFieldName("counters");
      IngestJsonWriter.writeCounters(gen, state.counters().snapshot());
      gen.writeNumberField("updated_at", state.updatedAt());
      gen.writeEndObject();
    }
  }

  /**
   * Decodes a document.
   *
   * @param document checkpoint JSON
   * @param ledgerCap ledger cap applied while restoring entries
   * @return restored state
   * @throws IllegalArgumentException if the document is malformed
   * @throws UnsupportedSchemaException if the schema version is newer than this release
   */
  CheckpointState read(String document, int ledgerCap) {
    Map<String, Object> root = JsonSupport.asObject(json.parse(document), "checkpoint");
    long schemaVersion = JsonSupport.longOr(root, "schema_version", CheckpointState.SCHEMA_VERSION);
    if (schemaVersion < 1 || schemaVersion > CheckpointState.SCHEMA_VERSION) {
      throw new UnsupportedSchemaException(schemaVersion);
    }

    Map<String, Object> activeNode = JsonSupport.asObject(root.get("active"), "active");
    String path = JsonSupport.optionalString(activeNode, "path");
    if (path == null) {
      throw new IllegalArgumentException("active.path is required");
    }
    ActivePointer active = new ActivePointer(
        path,
        JsonSupport.optionalLong(activeNode, "inode"),
        JsonSupport.longOr(activeNode, "offset", 0L),
        JsonSupport.optionalString(activeNode, "last_event_ts_seen"));

    List<CompletedFileRecord> completed = new ArrayList<>();
    Object completedNode = root.get("completed");
    if (completedNode != null) {
      for (Object item : JsonSupport.asArray(completedNode, "completed")) {
        Map<String, Object> entry = JsonSupport.asObject(item, "completed entry");
        String key = JsonSupport.optionalString(entry, "key");
        String entryPath = JsonSupport.optionalString(entry, "path");
        if (key == null || entryPath == null) {
          throw new IllegalArgumentException("completed entries require key and path");
        }
        completed.add(new CompletedFileRecord(
            key,
            entryPath,
            JsonSupport.longOr(entry, "inode", 0L),
            JsonSupport.longOr(entry, "size", 0L),
            JsonSupport.longOr(entry, "mtime", 0L),
            JsonSupport.longOr(entry, "completed_at", 0L)));
      }
    }

    CounterSnapshot counters = CounterSnapshot.ZERO;
    Object countersNode = root.get("counters");
    if (countersNode != null) {
      Map<String, Object> c = JsonSupport.asObject(countersNode, "counters");
      counters = new CounterSnapshot(
          JsonSupport.longOr(c, "lines_in_total", 0L),
          JsonSupport.longOr(c, "bytes_in_total", 0L),
          JsonSupport.longOr(c, "events_out_total", 0L),
          JsonSupport.longOr(c, "dlq_out_total", 0L),
          JsonSupport.longOr(c, "parse_fail_total", 0L),
          JsonSupport.longOr(c, "write_fail_total", 0L),
          JsonSupport.longOr(c, "checkpoint_fail_total", 0L));
    }

    return new CheckpointState(
        (int) schemaVersion,
        active,
        completed,
        new Counters(counters),
        JsonSupport.longOr(root, "updated_at", 0L),
        ledgerCap);
  }

  /** Raised for documents written by a newer release. */
  static final class UnsupportedSchemaException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    UnsupportedSchemaException(long version) {
      super("unsupported checkpoint schema_version " + version);
    }
  }
}
