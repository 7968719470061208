package ca.gc.cra.lookout.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Path validation for CLI inputs and outputs.
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Ensures {@code path} names an existing, readable regular file.
   *
   * @param path candidate file
   * @return canonical path
   * @throws IllegalArgumentException when the file is missing or unreadable
   */
  public static Path requireReadableFile(Path path) {
    Path normalized = normalize(path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("file does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("file is not readable: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve file " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Ensures a file can be created or appended at {@code path}, creating parent directories when asked.
   *
   * @param path output file
   * @param createParents create missing parent directories
   * @return normalized absolute path
   * @throws IllegalArgumentException when the location is not writable
   */
  public static Path validateWritableFile(Path path, boolean createParents) {
    Path normalized = normalize(path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("output path is a directory: " + normalized);
    }
    if (Files.exists(normalized) && !Files.isWritable(normalized)) {
      throw new IllegalArgumentException("output file is not writable: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("path has no parent to validate: " + normalized);
    }
    try {
      if (!Files.exists(parent) && createParents) {
        Files.createDirectories(parent);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create " + parent + ": " + ex.getMessage(), ex);
    }
    if (Files.exists(parent) && !Files.isWritable(parent)) {
      throw new IllegalArgumentException("parent directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0 || Strings.containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }
}
