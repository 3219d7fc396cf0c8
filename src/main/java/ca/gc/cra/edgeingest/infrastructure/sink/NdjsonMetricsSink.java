package ca.gc.cra.edgeingest.infrastructure.sink;

import ca.gc.cra.edgeingest.application.pipeline.MetricsSnapshot;
import ca.gc.cra.edgeingest.application.port.MetricsSinkPort;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Appends one JSON summary per line to a single metrics file.
 *
 * <p>The file is opened and closed for every summary; summaries are written at most every few seconds.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonMetricsSink implements MetricsSinkPort {
  private final Path file;

  /**
   * Creates a sink appending to {@code file}.
   *
   * @param file metrics file; its parent directory must exist
   */
  public NdjsonMetricsSink(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public void append(MetricsSnapshot snapshot) throws IOException {
    byte[] json = IngestJsonWriter.metrics(snapshot);
    try (OutputStream out = Files.newOutputStream(
        file, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
      out.write(json);
      out.write('\n');
    }
  }

  /**
   * Returns the metrics file path.
   *
   * @return target file
   */
  public Path file() {
    return file;
  }
}
