package org.lofarimaging.realtime.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line tokens split into switches ({@code --dry-run}) and positional words ({@code observe},
 * {@code station=CS002}). Aliases are folded into one canonical switch name.
 */
public final class CliInput {
  static final String HELP = "--help";
  static final String VERBOSE = "--verbose";
  static final String DRY_RUN = "--dry-run";

  private static final Map<String, String> ALIASES = Map.of(
      "-h", HELP,
      "help", HELP,
      "-v", VERBOSE,
      "--debug", VERBOSE,
      "-n", DRY_RUN);

  private final List<String> words;
  private final Set<String> switches;

  private CliInput(List<String> words, Set<String> switches) {
    this.words = words;
    this.switches = switches;
  }

  /**
   * Splits raw arguments. A token that starts with {@code -} and has no {@code =} is a switch; blank tokens are
   * dropped; everything else stays a positional word in its original order.
   *
   * @param args raw arguments, may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> words = new ArrayList<>();
    Set<String> switches = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String token = raw.trim();
        String lower = token.toLowerCase(Locale.ROOT);
        String canonical = ALIASES.get(lower);
        if (canonical != null) {
          switches.add(canonical);
        } else if (token.startsWith("-") && token.indexOf('=') < 0) {
          switches.add(lower);
        } else {
          words.add(token);
        }
      }
    }
    return new CliInput(List.copyOf(words), Collections.unmodifiableSet(switches));
  }

  /** Positional words, {@code key=value} pairs included, in their original order. */
  public String[] keyValueArgs() {
    return words.toArray(String[]::new);
  }

  /** First positional word lower-cased, used by the dispatcher as the subcommand name. */
  Optional<String> command() {
    return words.isEmpty() ? Optional.empty() : Optional.of(words.get(0).toLowerCase(Locale.ROOT));
  }

  /**
   * Arguments for the subcommand: the positional words after the command, followed by every switch in canonical
   * form.
   */
  String[] subcommandArgs() {
    List<String> forwarded = new ArrayList<>(words.subList(Math.min(1, words.size()), words.size()));
    forwarded.addAll(switches);
    return forwarded.toArray(String[]::new);
  }

  public boolean help() {
    return switches.contains(HELP);
  }

  public boolean verbose() {
    return switches.contains(VERBOSE);
  }

  public boolean dryRun() {
    return switches.contains(DRY_RUN);
  }

  /**
   * Checks whether a switch was given, under its canonical name or an alias.
   *
   * @param name switch such as {@code --dry-run}; case-insensitive
   * @return {@code true} if present
   */
  public boolean hasFlag(String name) {
    if (name == null || name.isBlank()) {
      return false;
    }
    String lower = name.trim().toLowerCase(Locale.ROOT);
    return switches.contains(ALIASES.getOrDefault(lower, lower));
  }

  @Override
  public String toString() {
    return "CliInput" + Arrays.toString(subcommandArgs());
  }
}
