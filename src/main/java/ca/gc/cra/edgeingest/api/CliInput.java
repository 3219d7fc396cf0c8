package ca.gc.cra.edgeingest.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into flags ({@code --dry-run}), {@code key=value} pairs and bare words such as
 * the command name.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> keyValueArgs;
  private final List<String> words;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, List<String> words, Set<String> flags) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.words = List.copyOf(words);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Classifies raw arguments. Blank and {@code null} entries are dropped; flags are lower-cased.
   *
   * @param args raw arguments; may be {@code null}
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    List<String> words = new ArrayList<>();
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
        } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
          flags.add(lower);
        } else if (arg.indexOf('=') > 0) {
          kv.add(arg);
        } else {
          words.add(arg);
        }
      }
    }
    return new CliInput(kv, words, flags);
  }

  /**
   * Returns the {@code key=value} arguments in order.
   *
   * @return arguments for {@link CliArgsParser#toMap(String[])}
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  /**
   * Returns bare words in order; the dispatcher reads the command from the first one.
   *
   * @return words that are neither flags nor {@code key=value} pairs
   */
  public List<String> words() {
    return words;
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was supplied.
   *
   * @param flag flag to query, case-insensitive
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns the normalized flags.
   *
   * @return lower-cased flags
   */
  public Set<String> flags() {
    return flags;
  }
}
