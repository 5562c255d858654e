package com.rg.snapshot.retention;

import com.rg.snapshot.retention.PolicyParseException.Reason;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class RetentionParsers {
  private RetentionParsers() {}

  private static final Pattern DURATION_PART = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)(ns|us|µs|μs|ms|s|m|h)");

  private static final Map<String, BigDecimal> NANOS_PER_UNIT = Map.of(
      "ns", BigDecimal.ONE,
      "us", BigDecimal.valueOf(1_000L),
      "µs", BigDecimal.valueOf(1_000L),
      "μs", BigDecimal.valueOf(1_000L),
      "ms", BigDecimal.valueOf(1_000_000L),
      "s", BigDecimal.valueOf(1_000_000_000L),
      "m", BigDecimal.valueOf(60_000_000_000L),
      "h", BigDecimal.valueOf(3_600_000_000_000L)
  );

  private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);

  public static RetentionPolicy parsePolicy(List<String> rules) {
    Objects.requireNonNull(rules, "rules");
    return parsePolicy(rules.toArray(new String[0]));
  }

  /**
   * Parses a policy from rules of the form {@code [N@]unit[:X]}.
   *
   * Rules:
   * - N is the snapshot count; omitted means infinite, negative means infinite, zero is rejected
   * - unit is last, secondly, daily, monthly or yearly (any case)
   * - X is the interval, default 1; it must be 1 for last
   * - for secondly, X may also be a duration like 1h30m or PT1H30M (truncated to whole seconds)
   * - each unit:X may appear once
   *
   * Parsing stops at the first bad rule; no partial policy is returned.
   */
  public static RetentionPolicy parsePolicy(String... rules) {
    Objects.requireNonNull(rules, "rules");
    RetentionPolicy policy = new RetentionPolicy();
    for (String rule : rules) {
      parseRule(policy, Objects.requireNonNull(rule, "rule"));
    }
    return policy;
  }

  private static void parseRule(RetentionPolicy policy, String rule) {
    String count = "-1";
    String rest = rule;
    int at = rule.indexOf('@');
    if (at >= 0) {
      count = rule.substring(0, at);
      rest = rule.substring(at + 1);
    }

    int colon = rest.indexOf(':');
    String name = colon >= 0 ? rest.substring(0, colon) : rest;
    String interval = colon >= 0 ? rest.substring(colon + 1) : "1";

    Unit unit = Unit.fromRuleName(name)
        .orElseThrow(() -> new PolicyParseException(rule, Reason.UNKNOWN_UNIT, "unknown unit \"" + name + "\""));

    int n;
    try {
      n = Integer.parseInt(count);
    } catch (NumberFormatException e) {
      throw new PolicyParseException(rule, Reason.BAD_INTEGER, "parse count \"" + count + "\"", e);
    }
    if (n == 0) {
      throw new PolicyParseException(rule, Reason.INVALID_PERIOD, "count must not be zero");
    }

    long x;
    try {
      x = Long.parseLong(interval);
    } catch (NumberFormatException e) {
      if (unit != Unit.SECONDLY) {
        throw new PolicyParseException(rule, Reason.BAD_INTEGER, "parse interval \"" + interval + "\"", e);
      }
      try {
        x = parseSeconds(interval);
      } catch (IllegalArgumentException e2) {
        throw new PolicyParseException(rule, Reason.BAD_INTEGER, "parse interval \"" + interval + "\"", e2);
      }
    }
    if (x < 1) {
      throw new PolicyParseException(rule, Reason.INVALID_PERIOD, "interval must be > 0");
    }
    if (x > Integer.MAX_VALUE) {
      throw new PolicyParseException(rule, Reason.INVALID_PERIOD, "interval " + x + " is too large");
    }
    if (unit == Unit.LAST && x != 1) {
      throw new PolicyParseException(rule, Reason.INVALID_PERIOD, "interval must be 1 for unit last");
    }

    Period period = new Period(unit, (int) x);
    if (policy.get(period) != 0) {
      throw new PolicyParseException(rule, Reason.DUPLICATE_PERIOD, "duplicate " + unit.ruleName() + ":" + x);
    }
    if (!policy.set(period, n)) {
      throw new PolicyParseException(rule, Reason.INVALID_PERIOD, "invalid period " + unit.ruleName() + ":" + x);
    }
  }

  /**
   * Parses a duration into whole seconds, truncating any remainder.
   *
   * Accepts ISO-8601 ({@code PT1H30M}) or the compact form ({@code 1h30m}, {@code 1.5h},
   * {@code 90s}, {@code 1500ms}).
   */
  public static long parseSeconds(String text) {
    Objects.requireNonNull(text, "text");
    String s = text.strip();
    if (s.isEmpty()) throw new IllegalArgumentException("empty duration");

    String upper = s.toUpperCase(Locale.ROOT);
    if (upper.startsWith("P") || upper.startsWith("-P") || upper.startsWith("+P")) {
      try {
        return Duration.parse(upper).getSeconds();
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("invalid duration \"" + text + "\"", e);
      }
    }

    boolean negative = false;
    if (s.startsWith("-") || s.startsWith("+")) {
      negative = s.charAt(0) == '-';
      s = s.substring(1);
    }
    if (s.equals("0")) return 0;

    BigDecimal nanos = BigDecimal.ZERO;
    Matcher m = DURATION_PART.matcher(s);
    int pos = 0;
    while (pos < s.length()) {
      if (!m.find(pos) || m.start() != pos) {
        throw new IllegalArgumentException("invalid duration \"" + text + "\"");
      }
      nanos = nanos.add(new BigDecimal(m.group(1)).multiply(NANOS_PER_UNIT.get(m.group(2))));
      pos = m.end();
    }
    if (pos == 0) throw new IllegalArgumentException("invalid duration \"" + text + "\"");

    BigDecimal seconds = nanos.divide(NANOS_PER_SECOND, 0, RoundingMode.DOWN);
    if (seconds.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) {
      throw new IllegalArgumentException("duration \"" + text + "\" is too large");
    }
    long value = seconds.longValueExact();
    return negative ? -value : value;
  }

  /**
   * Compact rendering of a number of seconds: 90 is "1m30s", 3600 is "1h",
   * 5400 is "1h30m", 3601 is "1h0m1s".
   */
  public static String formatSeconds(long seconds) {
    if (seconds < 0) return "-" + formatSeconds(-seconds);
    long h = seconds / 3600;
    long m = (seconds % 3600) / 60;
    long s = seconds % 60;

    String out;
    if (h > 0) {
      out = h + "h" + m + "m" + s + "s";
    } else if (m > 0) {
      out = m + "m" + s + "s";
    } else {
      out = s + "s";
    }
    if (out.endsWith("m0s")) out = out.substring(0, out.length() - 3) + "m";
    if (out.endsWith("h0m")) out = out.substring(0, out.length() - 3) + "h";
    return out;
  }

  /**
   * Canonical text for a policy. Equivalent policies produce identical text, and the
   * text parses back to an equal policy.
   */
  public static String formatPolicy(RetentionPolicy policy) {
    Objects.requireNonNull(policy, "policy");
    StringBuilder b = new StringBuilder();
    policy.forEach((period, count) -> {
      if (b.length() > 0) b.append(' ');
      if (count > 0) b.append(count).append('@');
      b.append(period.toRule());
    });
    return b.toString();
  }
}
