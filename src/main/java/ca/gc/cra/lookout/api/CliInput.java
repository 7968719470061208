package ca.gc.cra.lookout.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * CLI arguments split into flags ({@code --help}, {@code --verbose}, {@code --dry-run}) and the remaining
 * positional or {@code key=value} tokens.
 *
 * @since 0.1.0
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] keyValueArgs;
  private final Set<String> flags;

  private CliInput(String[] keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments; may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_FLAGS.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags));
  }

  /**
   * Returns the non-flag tokens.
   *
   * @return copy of the tokens in input order
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks for a flag, case-insensitively.
   *
   * @param flag flag such as {@code --dry-run}
   * @return {@code true} if supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
