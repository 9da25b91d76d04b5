package ca.gc.cra.cblog.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Checks on the debug log being read and the directory the tables are exported to.
 *
 * <p>Failures are reported as {@link IllegalArgumentException} so the commands treat them like any
 * other bad argument.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * @param path log or pattern file named on the command line
   * @return the file's real path
   * @throws IllegalArgumentException if it does not exist, is not a regular file or is unreadable
   */
  public static Path requireReadableFile(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    Path real;
    try {
      real = path.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to access input file " + path + ": " + ex.getMessage(), ex);
    }
    if (!Files.isRegularFile(real)) {
      throw new IllegalArgumentException("input is not a regular file: " + path);
    }
    if (!Files.isReadable(real)) {
      throw new IllegalArgumentException("input file is not readable: " + path);
    }
    return real;
  }

  /**
   * Validates the export directory of a parse run.
   *
   * <p>An existing directory must be writable and, unless {@code allowOverwrite} is set, empty, so
   * a second run cannot silently replace the tables of a first. A missing directory is created
   * when {@code create} is set; otherwise its nearest existing ancestor must be writable (dry runs).
   * A symbolic link is checked as the link itself.</p>
   *
   * @param dir export directory
   * @param create create the directory and its parents when missing
   * @param allowOverwrite accept a directory that already has entries
   * @return the real path when the directory exists or was created, else the absolute path
   * @throws IllegalArgumentException if any check fails
   */
  public static Path prepareExportDirectory(Path dir, boolean create, boolean allowOverwrite) {
    if (dir == null) {
      throw new IllegalArgumentException("export directory must not be null");
    }
    if (dir.toString().indexOf('\0') >= 0) {
      throw new IllegalArgumentException("export directory must not contain null bytes");
    }
    Path target = dir.toAbsolutePath().normalize();
    try {
      boolean exists = Files.exists(target, LinkOption.NOFOLLOW_LINKS);
      if (!exists && !create) {
        Path ancestor = existingAncestor(target);
        if (!Files.isWritable(ancestor)) {
          throw new IllegalArgumentException("parent directory is not writable: " + ancestor);
        }
        return target;
      }
      if (!exists) {
        Files.createDirectories(target);
      }
      Path real = target.toRealPath(LinkOption.NOFOLLOW_LINKS);
      if (!Files.isDirectory(real, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException("export path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("export directory is not writable: " + real);
      }
      if (!allowOverwrite && hasEntries(real)) {
        throw new IllegalArgumentException(
            "export directory " + real + " is not empty; re-run with --allow-overwrite to replace its tables");
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to prepare export directory " + target + ": " + ex.getMessage(), ex);
    }
  }

  private static boolean hasEntries(Path dir) throws IOException {
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
      return entries.iterator().hasNext();
    }
  }

  private static Path existingAncestor(Path start) throws IOException {
    for (Path current = start; current != null; current = current.getParent()) {
      if (Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
        return current.toRealPath(LinkOption.NOFOLLOW_LINKS);
      }
    }
    throw new IllegalArgumentException("no existing ancestor for " + start);
  }
}
