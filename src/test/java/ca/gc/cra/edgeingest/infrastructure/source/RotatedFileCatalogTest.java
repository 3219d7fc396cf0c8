package ca.gc.cra.edgeingest.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.edgeingest.application.port.LineCursor;
import ca.gc.cra.edgeingest.domain.file.FileIdentity;
import ca.gc.cra.edgeingest.domain.file.SourceLine;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RotatedFileCatalogTest {
  private static final Pattern ROTATED = Pattern.compile("^fortigate\\.log-(\\d{8}-\\d{6})(?:\\.gz)?$");

  @TempDir Path tempDir;

  @Test
  void listsMatchingFilesInRotationOrder() throws IOException {
    Files.writeString(tempDir.resolve("fortigate.log"), "active\n");
    Files.writeString(tempDir.resolve("fortigate.log-20240105-000000"), "c\n");
    Files.writeString(tempDir.resolve("fortigate.log-20240103-120000.gz"), "a\n");
    Files.writeString(tempDir.resolve("fortigate.log-20240104-000000"), "b\n");
    Files.writeString(tempDir.resolve("fortigate.log-2024-bad"), "x\n");
    Files.writeString(tempDir.resolve("other.log-20240101-000000"), "x\n");
    Files.createDirectory(tempDir.resolve("fortigate.log-20240101-000000"));

    List<Path> rotated = catalog().listRotatedFiles();

    assertEquals(List.of(
        tempDir.resolve("fortigate.log-20240103-120000.gz"),
        tempDir.resolve("fortigate.log-20240104-000000"),
        tempDir.resolve("fortigate.log-20240105-000000")), rotated);
  }

  @Test
  void missingDirectoryPropagates() {
    RotatedFileCatalog missing = new RotatedFileCatalog(tempDir.resolve("absent"), ROTATED, 512);

    assertThrows(NoSuchFileException.class, missing::listRotatedFiles);
  }

  @Test
  void plainFileReportsLineStartOffsetsAndFinalPartialLine() throws IOException {
    Path file = tempDir.resolve("fortigate.log-20240104-000000");
    Files.writeString(file, "one\ntwo\nthree");
    FileIdentity identity = catalog().statFile(file);

    List<SourceLine> lines = readAll(identity);

    assertEquals(List.of("one\n", "two\n", "three"), lines.stream().map(SourceLine::text).toList());
    assertEquals(List.of(0L, 4L, 8L), lines.stream().map(l -> l.position().offset()).toList());
    assertEquals(List.of(4, 4, 5), lines.stream().map(SourceLine::byteLength).toList());
    assertEquals(13L, lines.get(0).position().size());
  }

  @Test
  void gzipFileIsDecompressedWithoutOffsets() throws IOException {
    Path file = tempDir.resolve("fortigate.log-20240103-120000.gz");
    try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
      out.write("alpha\nbeta\n".getBytes(StandardCharsets.UTF_8));
    }

    List<SourceLine> lines = readAll(catalog().statFile(file));

    assertEquals(List.of("alpha\n", "beta\n"), lines.stream().map(SourceLine::text).toList());
    assertNull(lines.get(0).position().offset());
  }

  @Test
  void invalidGzipHeaderFailsOnOpen() throws IOException {
    Path file = tempDir.resolve("fortigate.log-20240103-120000.gz");
    Files.writeString(file, "not gzip\n");
    FileIdentity identity = catalog().statFile(file);

    assertThrows(IOException.class, () -> catalog().readLines(identity));
  }

  @Test
  void cursorReportsExhaustion() throws IOException {
    Path file = tempDir.resolve("fortigate.log-20240104-000000");
    Files.writeString(file, "only\n");

    try (LineCursor cursor = catalog().readLines(catalog().statFile(file))) {
      assertTrue(cursor.poll().isPresent());
      assertTrue(cursor.poll().isEmpty());
      assertTrue(cursor.isExhausted());
    }
  }

  @Test
  void statCapturesSizeAndInode() throws IOException {
    Path file = tempDir.resolve("fortigate.log-20240104-000000");
    Files.writeString(file, "12345");

    FileIdentity first = FileIdentities.stat(file);
    Files.writeString(file, "1234567890");
    FileIdentity grown = FileIdentities.stat(file);

    assertEquals(5L, first.size());
    assertEquals(10L, grown.size());
    assertTrue(first.samePhysicalFile(grown));
    assertEquals(file.toString(), first.path());
  }

  private RotatedFileCatalog catalog() {
    return new RotatedFileCatalog(tempDir, ROTATED, 512);
  }

  private List<SourceLine> readAll(FileIdentity identity) throws IOException {
    List<SourceLine> lines = new ArrayList<>();
    try (LineCursor cursor = catalog().readLines(identity)) {
      Optional<SourceLine> next;
      while ((next = cursor.poll()).isPresent()) {
        lines.add(next.get());
      }
    }
    return lines;
  }
}
