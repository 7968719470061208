package ca.gc.cra.lookout.application.monitor;

import ca.gc.cra.lookout.util.PathUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Finds session log files on disk.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>List {@code *.jsonl} files of a project directory ordered by creation instant.</li>
 *   <li>Locate a session file by id beneath the log root.</li>
 *   <li>Classify sidecar files by their sub-agent prefix and apply the creation-tolerance window.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent scans.</p>
 * <p><strong>Observability:</strong> Access failures are logged at DEBUG and yield empty results; the next
 * poll tick retries.</p>
 *
 * @since 0.1.0
 */
public final class FileDiscovery {
  private static final Logger log = LoggerFactory.getLogger(FileDiscovery.class);
  /** Extension of session log files. */
  public static final String EXTENSION = ".jsonl";
  private static final int SESSION_SEARCH_DEPTH = 4;

  private final String subAgentPrefix;

  public FileDiscovery(String subAgentPrefix) {
    this.subAgentPrefix = Objects.requireNonNull(subAgentPrefix, "subAgentPrefix");
  }

  /**
   * File found by a scan.
   *
   * @param path absolute file path
   * @param createdAt creation instant used for the tolerance window
   * @param sidecar {@code true} when the name carries the sub-agent prefix
   */
  public record Candidate(Path path, Instant createdAt, boolean sidecar) {}

  /**
   * Lists session log files in {@code directory}.
   *
   * @param directory project directory
   * @return candidates ordered by creation instant then name; empty when the directory is unreadable
   */
  public List<Candidate> scan(Path directory) {
    List<Candidate> candidates = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
      for (Path entry : entries) {
        candidate(entry.toAbsolutePath()).ifPresent(candidates::add);
      }
    } catch (IOException | UncheckedIOException ex) {
      log.debug("Scan of {} failed; retrying next tick: {}", directory, ex.getMessage());
      return List.of();
    }
    candidates.sort(Comparator.comparing(Candidate::createdAt).thenComparing(c -> c.path().toString()));
    return candidates;
  }

  /**
   * Builds a candidate for a single path.
   *
   * @param path file path
   * @return candidate, or empty when the path is not a readable session log file
   */
  public Optional<Candidate> candidate(Path path) {
    if (!PathUtils.fileName(path).map(name -> name.endsWith(EXTENSION)).orElse(false)) {
      return Optional.empty();
    }
    try {
      BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
      if (!attributes.isRegularFile()) {
        return Optional.empty();
      }
      return Optional.of(new Candidate(path, createdAt(attributes), isSidecar(path)));
    } catch (IOException ex) {
      log.debug("Skipping {}: {}", path, ex.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Searches the log root for {@code <sessionId>.jsonl}.
   *
   * @param logRoot root holding project directories
   * @param sessionId session id
   * @return first match, or empty when absent or the root is unreadable
   */
  public Optional<Path> findSessionFile(Path logRoot, String sessionId) {
    if (!Files.isDirectory(logRoot)) {
      return Optional.empty();
    }
    String target = sessionId + EXTENSION;
    try (Stream<Path> walk = Files.walk(logRoot, SESSION_SEARCH_DEPTH)) {
      return walk
          .filter(p -> PathUtils.fileName(p).map(target::equals).orElse(false))
          .filter(Files::isRegularFile)
          .map(Path::toAbsolutePath)
          .findFirst();
    } catch (IOException | UncheckedIOException ex) {
      log.debug("Search for session {} under {} failed; retrying next tick: {}",
          sessionId, logRoot, ex.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Reports whether a file name marks a sub-agent sidecar.
   *
   * @param path file path
   * @return {@code true} when the name starts with the sub-agent prefix
   */
  public boolean isSidecar(Path path) {
    return PathUtils.fileName(path).map(name -> name.startsWith(subAgentPrefix)).orElse(false);
  }

  /**
   * Derives the sub-agent id from a sidecar file name ({@code agent-<id>.jsonl}).
   *
   * @param path file path
   * @return id without prefix and extension
   */
  public String subAgentId(Path path) {
    String stem = PathUtils.stem(path, EXTENSION).orElse("");
    return stem.startsWith(subAgentPrefix) ? stem.substring(subAgentPrefix.length()) : stem;
  }

  /**
   * Applies the creation-tolerance window.
   *
   * @param candidate scanned file
   * @param watchStart instant watching started
   * @param tolerance grace period before {@code watchStart}
   * @return {@code true} when the file was created no earlier than {@code watchStart - tolerance}
   */
  public static boolean createdSince(Candidate candidate, Instant watchStart, Duration tolerance) {
    return !candidate.createdAt().isBefore(watchStart.minus(tolerance));
  }

  /**
   * Earliest of creation and last-modified time.
   *
   * <p>Copied or restored files keep their original modification time while their birth time is reset, so
   * the minimum classifies them as pre-existing.</p>
   */
  private static Instant createdAt(BasicFileAttributes attributes) {
    Instant created = attributes.creationTime().toInstant();
    Instant modified = attributes.lastModifiedTime().toInstant();
    return created.isBefore(modified) ? created : modified;
  }
}
