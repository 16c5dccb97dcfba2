package gov.lbl.als.ingest.api;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command arguments split into the flags the ingest commands understand and {@code key=value}
 * settings.
 *
 * <p>Flags are case-insensitive. Dashed tokens that are not a known flag are kept in
 * {@link #unknownFlags()} so the command can warn about them instead of treating them as settings.</p>
 */
public final class CliInput {
  enum Flag {
    HELP,
    VERBOSE,
    DRY_RUN
  }

  private static final Map<String, Flag> ALIASES = Map.of(
      "--help", Flag.HELP,
      "-h", Flag.HELP,
      "help", Flag.HELP,
      "--verbose", Flag.VERBOSE,
      "-v", Flag.VERBOSE,
      "--debug", Flag.VERBOSE,
      "--dry-run", Flag.DRY_RUN,
      "--dryrun", Flag.DRY_RUN);

  private final List<String> settings;
  private final Set<Flag> flags;
  private final Set<String> unknownFlags;

  private CliInput(List<String> settings, Set<Flag> flags, Set<String> unknownFlags) {
    this.settings = List.copyOf(settings);
    this.flags = flags.isEmpty() ? EnumSet.noneOf(Flag.class) : EnumSet.copyOf(flags);
    this.unknownFlags = Set.copyOf(unknownFlags);
  }

  /**
   * Partitions raw arguments. Null and blank entries are dropped; {@code --config=x} style tokens
   * are settings, not flags.
   *
   * @param args raw arguments, may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> settings = new ArrayList<>();
    Set<Flag> flags = EnumSet.noneOf(Flag.class);
    Set<String> unknown = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        Flag flag = ALIASES.get(arg.toLowerCase(Locale.ROOT));
        if (flag != null) {
          flags.add(flag);
        } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
          unknown.add(arg);
        } else {
          settings.add(arg);
        }
      }
    }
    return new CliInput(settings, flags, unknown);
  }

  /** {@code key=value} tokens in command-line order. */
  public String[] keyValueArgs() {
    return settings.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains(Flag.HELP);
  }

  public boolean verbose() {
    return flags.contains(Flag.VERBOSE);
  }

  public boolean dryRun() {
    return flags.contains(Flag.DRY_RUN);
  }

  public Set<String> unknownFlags() {
    return unknownFlags;
  }
}
