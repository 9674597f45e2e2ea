package ca.gc.cra.geosession.application.gdal;

import ca.gc.cra.geosession.validation.Paths;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Creates, prepares, and removes raster checkpoint directories.
 * <p><strong>Role:</strong> Used by the GDAL enabler for configured checkpoints and by the test harness for
 * the fresh per-session checkpoint it owns.</p>
 * <p><strong>Thread-safety:</strong> Stateless; concurrent use is limited by filesystem semantics.</p>
 *
 * @since 0.1.0
 */
public final class CheckpointDirectories {
  private static final Logger log = LoggerFactory.getLogger(CheckpointDirectories.class);

  private CheckpointDirectories() {}

  /**
   * Creates a new, empty temporary directory.
   *
   * @param prefix directory name prefix, for example {@code mosaic}
   * @return absolute path of the created directory
   * @throws UncheckedIOException if the directory cannot be created
   */
  public static Path createFresh(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    try {
      Path dir = Files.createTempDirectory(prefix).toAbsolutePath();
      log.debug("Created checkpoint directory {}", dir);
      return dir;
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to create checkpoint directory with prefix " + prefix, ex);
    }
  }

  /**
   * Creates the directory if needed and verifies it is writable. Existing content is kept.
   *
   * @param dir checkpoint directory
   * @return real path of the prepared directory
   * @throws IllegalArgumentException if the path cannot be used as a writable directory
   */
  public static Path prepare(Path dir) {
    return Paths.validateWritableDir(dir, true, true);
  }

  /**
   * Deletes a directory tree. A missing directory is a no-op.
   *
   * @param dir directory to delete
   * @throws UncheckedIOException if any entry cannot be deleted
   */
  public static void deleteRecursively(Path dir) {
    Objects.requireNonNull(dir, "dir");
    if (!Files.exists(dir)) {
      return;
    }
    try {
      Files.walkFileTree(dir, new SimpleFileVisitor<>() {
        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
          Files.deleteIfExists(file);
          return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
          if (exc instanceof NoSuchFileException) {
            return FileVisitResult.CONTINUE;
          }
          throw exc;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
          if (exc != null) {
            throw exc;
          }
          Files.deleteIfExists(d);
          return FileVisitResult.CONTINUE;
        }
      });
      log.debug("Deleted checkpoint directory {}", dir);
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to delete checkpoint directory " + dir, ex);
    }
  }
}
