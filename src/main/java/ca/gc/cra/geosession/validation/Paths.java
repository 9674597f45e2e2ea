package ca.gc.cra.geosession.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for raster checkpoint and GDAL scratch directories.
 * <p><strong>Why:</strong> GDAL writes intermediate rasters and its log file into these directories; a
 * missing or read-only target only shows up later as an opaque native error.</p>
 * <p><strong>Role:</strong> Domain support utilities executed before the enabler hands paths to GDAL.</p>
 * <p><strong>Thread-safety:</strong> Stateless; concurrency limited by filesystem semantics.</p>
 * <p><strong>Observability:</strong> Emits no logs; callers surface validation exceptions.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a dangling link is reported as such.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a configured path string.
   *
   * @param name logical setting name for diagnostics
   * @param raw configured value; must be non-blank and free of control characters
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the value is blank, contains control characters, or is malformed
   */
  public static Path parse(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(trimmed).toAbsolutePath().normalize();
    } catch (java.nio.file.InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + trimmed, ex);
    }
  }

  /**
   * Validates a writable directory, optionally creating it and its parents.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory when absent
   * @param allowReuse when {@code false}, existing non-empty directories are rejected
   * @return real path of the directory when it exists afterwards, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is not a writable directory or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing, boolean allowReuse) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    if (Strings.containsControl(path.toString())) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath();
        ensureDirectory(real, allowReuse);
        return real;
      }
      if (!createIfMissing) {
        Path ancestor = nearestExistingAncestor(normalized);
        if (!Files.isWritable(ancestor)) {
          throw new IllegalArgumentException("nearest existing ancestor is not writable: " + ancestor);
        }
        return normalized;
      }
      Files.createDirectories(normalized);
      Path real = normalized.toRealPath();
      ensureDirectory(real, true);
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static void ensureDirectory(Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
    if (!allowReuse) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
        if (entries.iterator().hasNext()) {
          throw new IllegalArgumentException("directory " + dir + " is not empty");
        }
      }
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start.getParent();
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath();
  }
}
