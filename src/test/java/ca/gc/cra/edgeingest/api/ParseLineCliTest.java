package ca.gc.cra.edgeingest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.edgeingest.testutil.FortiGateLines;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ParseLineCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void renderPrintsEventJsonForParsedLine() {
    String json = ParseLineCli.render(FortiGateLines.TRAFFIC_ACCEPT, 2024);

    assertTrue(json.startsWith("{\"schema_version\":1"), json);
    assertTrue(json.contains("\"host\":\"fw01\""), json);
    assertTrue(json.contains("\"event_id\":\""), json);
  }

  @Test
  void renderPrintsReasonAndRawForRejectedLine() {
    String json = ParseLineCli.render(FortiGateLines.NO_HEADER, 2024);

    assertEquals("{\"dlq_reason\":\"syslog_header_parse_fail\",\"raw\":\"this is not syslog\\n\"}", json);
  }

  @Test
  void parsesEveryLineOfGzipFile() throws IOException {
    Path file = tempDir.resolve("sample.log.gz");
    try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
      out.write((FortiGateLines.TRAFFIC_ACCEPT + FortiGateLines.BINARY + FortiGateLines.TRAFFIC_DENY)
          .getBytes(StandardCharsets.UTF_8));
    }

    ExitCode code = ParseLineCli.run(new String[] {"file=" + file, "year=2024"});

    assertEquals(ExitCode.SUCCESS, code);
    String[] lines = buffer.toString().split("\\R");
    assertEquals(3, lines.length);
    assertTrue(lines[1].contains("non_text_or_binary"), lines[1]);
    assertTrue(lines[2].contains("\"action\":\"deny\""), lines[2]);
  }

  @Test
  void lineAndFileAreMutuallyExclusive() {
    assertEquals(ExitCode.INVALID_ARGS, ParseLineCli.run(new String[] {"line=x", "file=/tmp/x"}));
    assertEquals(ExitCode.INVALID_ARGS, ParseLineCli.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: parse"));
  }

  @Test
  void missingFileIsIoError() {
    ExitCode code = ParseLineCli.run(new String[] {"file=" + tempDir.resolve("absent.log")});

    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void yearOutOfRangeIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, ParseLineCli.run(new String[] {"line=x", "year=1900"}));
  }
}
