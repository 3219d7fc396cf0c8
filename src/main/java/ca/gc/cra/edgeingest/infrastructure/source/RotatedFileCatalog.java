package ca.gc.cra.edgeingest.infrastructure.source;

import ca.gc.cra.edgeingest.application.port.LineCursor;
import ca.gc.cra.edgeingest.application.port.RotatedFileCatalogPort;
import ca.gc.cra.edgeingest.domain.file.FileIdentity;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> {@link RotatedFileCatalogPort} scanning one directory for rotated siblings of the
 * active file.
 * <p><strong>Why:</strong> Rotated names embed their rotation time as {@code YYYYMMDD-HHMMSS}, which sorts
 * lexicographically in time order regardless of compression suffix.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls.</p>
 *
 * @since 0.1.0
 */
public final class RotatedFileCatalog implements RotatedFileCatalogPort {
  private final Path directory;
  private final Pattern namePattern;
  private final int chunkBytes;

  /**
   * Creates a catalog.
   *
   * @param directory directory holding rotated files
   * @param namePattern file-name pattern whose first group captures the rotation timestamp
   * @param chunkBytes read size for cursors
   */
  public RotatedFileCatalog(Path directory, Pattern namePattern, int chunkBytes) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.namePattern = Objects.requireNonNull(namePattern, "namePattern");
    if (chunkBytes <= 0) {
      throw new IllegalArgumentException("chunkBytes must be positive");
    }
    this.chunkBytes = chunkBytes;
  }

  @Override
  public List<Path> listRotatedFiles() throws IOException {
    List<Candidate> candidates = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
      for (Path entry : entries) {
        Matcher m = namePattern.matcher(entry.getFileName().toString());
        if (m.matches() && Files.isRegularFile(entry)) {
          candidates.add(new Candidate(m.group(1), entry));
        }
      }
    }
    candidates.sort(Comparator.comparing(Candidate::stamp)
        .thenComparing(c -> c.path().getFileName().toString()));
    List<Path> ordered = new ArrayList<>(candidates.size());
    for (Candidate candidate : candidates) {
      ordered.add(candidate.path());
    }
    return ordered;
  }

  @Override
  public FileIdentity statFile(Path path) throws IOException {
    return FileIdentities.stat(path);
  }

  @Override
  public LineCursor readLines(FileIdentity identity) throws IOException {
    return RotatedFileLineCursor.open(identity, chunkBytes);
  }

  private record Candidate(String stamp, Path path) {}
}
