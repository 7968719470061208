package ca.gc.cra.lookout.util;

import java.nio.file.Path;
import java.util.Optional;

/** Utility helpers for working with {@link Path} instances. */
public final class PathUtils {
  private PathUtils() {}

  /**
   * Returns the last name element of {@code path}.
   *
   * @param path path; may be {@code null}
   * @return file name, or empty for {@code null} and root paths
   */
  public static Optional<String> fileName(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path name = path.getFileName();
    return name == null ? Optional.empty() : Optional.of(name.toString());
  }

  /**
   * Returns the file name without the given extension.
   *
   * @param path path; may be {@code null}
   * @param extension extension including the dot, e.g. {@code .jsonl}
   * @return stem, or the whole name when it does not end with {@code extension}
   */
  public static Optional<String> stem(Path path, String extension) {
    return fileName(path).map(name -> name.endsWith(extension)
        ? name.substring(0, name.length() - extension.length())
        : name);
  }
}
