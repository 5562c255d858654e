package com.rg.snapshot.retention.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsed command line of {@code snapret}.
 *
 * @param extract  regex locating the timestamp in each line, or null to use the whole line
 * @param pattern  DateTimeFormatter pattern for timestamps, or null for unix seconds
 * @param policy   policy rules, in the order given
 */
public record CommandOptions(
    boolean quiet,
    String extract,
    boolean only,
    String pattern,
    boolean localTime,
    boolean invert,
    boolean why,
    boolean summarize,
    boolean help,
    List<String> policy
) {
  public CommandOptions {
    policy = List.copyOf(Objects.requireNonNull(policy, "policy"));
  }

  /**
   * Parses GNU-style arguments. Options and rules may be interleaved; {@code --} ends options.
   *
   * @throws IllegalArgumentException for unknown options or a missing option value
   */
  public static CommandOptions parse(List<String> args) {
    Objects.requireNonNull(args, "args");
    Builder b = new Builder();
    List<String> rules = new ArrayList<>();

    for (int i = 0; i < args.size(); i++) {
      String arg = args.get(i);
      if (arg.equals("--")) {
        rules.addAll(args.subList(i + 1, args.size()));
        break;
      }
      if (arg.startsWith("--")) {
        String name = arg.substring(2);
        String value = null;
        int eq = name.indexOf('=');
        if (eq >= 0) {
          value = name.substring(eq + 1);
          name = name.substring(0, eq);
        }
        if (takesValue(name)) {
          if (value == null) {
            if (i + 1 >= args.size()) throw new IllegalArgumentException("option --" + name + " requires a value");
            value = args.get(++i);
          }
          b.value(name, value);
        } else {
          if (value != null) throw new IllegalArgumentException("option --" + name + " does not take a value");
          b.flag(name);
        }
      } else if (arg.length() > 1 && arg.startsWith("-")) {
        for (int j = 1; j < arg.length(); j++) {
          String name = longName(arg.charAt(j));
          if (takesValue(name)) {
            String value = arg.substring(j + 1);
            if (value.isEmpty()) {
              if (i + 1 >= args.size()) throw new IllegalArgumentException("option -" + arg.charAt(j) + " requires a value");
              value = args.get(++i);
            }
            b.value(name, value);
            break;
          }
          b.flag(name);
        }
      } else {
        rules.add(arg);
      }
    }
    return b.build(rules);
  }

  private static boolean takesValue(String name) {
    return name.equals("extract") || name.equals("parse");
  }

  private static String longName(char c) {
    return switch (c) {
      case 'q' -> "quiet";
      case 'e' -> "extract";
      case 'o' -> "only";
      case 'p' -> "parse";
      case 'L' -> "local-time";
      case 'v' -> "invert";
      case 'w' -> "why";
      case 's' -> "summarize";
      case 'h' -> "help";
      default -> throw new IllegalArgumentException("unknown shorthand flag '" + c + "'");
    };
  }

  private static final class Builder {
    private boolean quiet;
    private String extract;
    private boolean only;
    private String pattern;
    private boolean localTime;
    private boolean invert;
    private boolean why;
    private boolean summarize;
    private boolean help;

    void flag(String name) {
      switch (name) {
        case "quiet" -> quiet = true;
        case "only" -> only = true;
        case "local-time" -> localTime = true;
        case "invert" -> invert = true;
        case "why" -> why = true;
        case "summarize" -> summarize = true;
        case "help" -> help = true;
        default -> throw new IllegalArgumentException("unknown flag --" + name);
      }
    }

    void value(String name, String value) {
      switch (name) {
        case "extract" -> extract = value;
        case "parse" -> pattern = value;
        default -> throw new IllegalArgumentException("unknown flag --" + name);
      }
    }

    CommandOptions build(List<String> rules) {
      return new CommandOptions(quiet, emptyToNull(extract), only, emptyToNull(pattern),
          localTime, invert, why, summarize, help, rules);
    }

    private static String emptyToNull(String s) {
      return s == null || s.isEmpty() ? null : s;
    }
  }
}
