package ca.gc.cra.lookout.config;

import ca.gc.cra.lookout.domain.tail.MonitorTarget;
import ca.gc.cra.lookout.validation.Numbers;
import ca.gc.cra.lookout.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable settings of the session monitor.
 * <p><strong>Why:</strong> Centralizes the knobs of discovery and tailing so CLI, YAML and tests share one
 * validated view.</p>
 * <p><strong>Role:</strong> Configuration record consumed by {@code SessionMonitor}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param logRoot directory holding one sub-directory per project; defaults to {@code ~/.claude/projects}
 * @param includeExisting read content that existed before watching started
 * @param creationTolerance files created this long before watch start are still adopted
 * @param pollInterval delay between poll ticks
 * @param maxReadBytes upper bound of bytes read per file per tick
 * @param dedupCapacity number of record keys retained for deduplication
 * @param readWorkers reader threads
 * @param watchEnabled register file-system notifications in addition to polling
 * @param subAgentPrefix file-name prefix identifying sub-agent sidecar files
 * @since 0.1.0
 */
public record MonitorConfig(
    Path logRoot,
    boolean includeExisting,
    Duration creationTolerance,
    Duration pollInterval,
    int maxReadBytes,
    int dedupCapacity,
    int readWorkers,
    boolean watchEnabled,
    String subAgentPrefix) {

  /** Default creation-tolerance window in seconds. */
  public static final int DEFAULT_TOLERANCE_SECONDS = 2;
  /** Default poll interval in milliseconds. */
  public static final int DEFAULT_POLL_MILLIS = 100;
  /** Default per-tick read bound. */
  public static final int DEFAULT_MAX_READ_BYTES = 1024 * 1024;
  /** Default dedup capacity. */
  public static final int DEFAULT_DEDUP_CAPACITY = 100_000;
  /** Default sidecar prefix. */
  public static final String DEFAULT_SUB_AGENT_PREFIX = "agent-";

  public MonitorConfig {
    Objects.requireNonNull(logRoot, "logRoot");
    Objects.requireNonNull(creationTolerance, "creationTolerance");
    Objects.requireNonNull(pollInterval, "pollInterval");
    if (creationTolerance.isNegative()) {
      throw new IllegalArgumentException("creationTolerance must not be negative");
    }
    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
    Numbers.requireRange("maxReadBytes", maxReadBytes, 1, Integer.MAX_VALUE - 8);
    Numbers.requireRange("dedupCapacity", dedupCapacity, 1, 10_000_000);
    Numbers.requireRange("readWorkers", readWorkers, 1, 64);
    subAgentPrefix = Strings.requireNonBlank("subAgentPrefix", subAgentPrefix);
  }

  /**
   * Returns defaults rooted at the user's agent log directory.
   *
   * @return default configuration
   */
  public static MonitorConfig defaults() {
    return new MonitorConfig(
        defaultLogRoot(),
        false,
        Duration.ofSeconds(DEFAULT_TOLERANCE_SECONDS),
        Duration.ofMillis(DEFAULT_POLL_MILLIS),
        DEFAULT_MAX_READ_BYTES,
        DEFAULT_DEDUP_CAPACITY,
        2,
        true,
        DEFAULT_SUB_AGENT_PREFIX);
  }

  /**
   * Default log root: {@code ~/.claude/projects}.
   *
   * @return default log root
   */
  public static Path defaultLogRoot() {
    return Path.of(System.getProperty("user.home"), ".claude", "projects");
  }

  /**
   * Builds a configuration from flattened {@code key=value} settings.
   *
   * @param args merged CLI/YAML/default settings
   * @return validated configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static MonitorConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    MonitorConfig defaults = defaults();
    Path logRoot = optional(args.get("logRoot")).map(Path::of).orElse(defaults.logRoot());
    boolean includeExisting = parseBoolean(args.get("includeExisting"), defaults.includeExisting());
    long toleranceSeconds = parseLong(
        "toleranceSeconds", args.get("toleranceSeconds"), DEFAULT_TOLERANCE_SECONDS, 0, 3_600);
    long pollMillis = parseLong("pollMillis", args.get("pollMillis"), DEFAULT_POLL_MILLIS, 1, 60_000);
    long maxReadBytes = parseLong(
        "maxReadBytes", args.get("maxReadBytes"), DEFAULT_MAX_READ_BYTES, 1, 256L * 1024 * 1024);
    long dedupCapacity = parseLong(
        "dedupCapacity", args.get("dedupCapacity"), DEFAULT_DEDUP_CAPACITY, 1, 10_000_000);
    long readWorkers = parseLong("readWorkers", args.get("readWorkers"), defaults.readWorkers(), 1, 64);
    boolean watch = parseBoolean(args.get("watch"), defaults.watchEnabled());
    String prefix = optional(args.get("subAgentPrefix")).orElse(DEFAULT_SUB_AGENT_PREFIX);
    return new MonitorConfig(
        logRoot,
        includeExisting,
        Duration.ofSeconds(toleranceSeconds),
        Duration.ofMillis(pollMillis),
        (int) maxReadBytes,
        (int) dedupCapacity,
        (int) readWorkers,
        watch,
        prefix);
  }

  /**
   * Resolves the watch target from {@code sessionId}, {@code directory} or {@code workingDirectory}, in that
   * order of preference.
   *
   * @param args merged settings
   * @return target, or empty when none was configured
   */
  public static Optional<MonitorTarget> targetFromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Optional<String> sessionId = optional(args.get("sessionId"));
    if (sessionId.isPresent()) {
      return Optional.of(MonitorTarget.sessionId(Strings.requirePrintableAscii("sessionId", sessionId.get(), 128)));
    }
    Optional<String> directory = optional(args.get("directory"));
    if (directory.isPresent()) {
      return Optional.of(MonitorTarget.projectDirectory(Path.of(directory.get())));
    }
    return optional(args.get("workingDirectory"))
        .map(Path::of)
        .map(Path::toAbsolutePath)
        .map(MonitorTarget::workingDirectory);
  }

  /**
   * Returns a copy with a different include-existing flag.
   *
   * @param include new flag
   * @return adjusted configuration
   */
  public MonitorConfig withIncludeExisting(boolean include) {
    return new MonitorConfig(logRoot, include, creationTolerance, pollInterval, maxReadBytes, dedupCapacity,
        readWorkers, watchEnabled, subAgentPrefix);
  }

  /**
   * Returns a copy with a different log root.
   *
   * @param root new log root
   * @return adjusted configuration
   */
  public MonitorConfig withLogRoot(Path root) {
    return new MonitorConfig(root, includeExisting, creationTolerance, pollInterval, maxReadBytes,
        dedupCapacity, readWorkers, watchEnabled, subAgentPrefix);
  }

  private static Optional<String> optional(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException("expected boolean but was: " + value);
    };
  }

  private static long parseLong(String name, String value, long defaultValue, long min, long max) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Numbers.requireRange(name, Long.parseLong(value.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be numeric (was " + value + ")", ex);
    }
  }
}
