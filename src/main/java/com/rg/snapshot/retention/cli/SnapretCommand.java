package com.rg.snapshot.retention.cli;

import com.rg.snapshot.retention.Period;
import com.rg.snapshot.retention.RetentionDecision;
import com.rg.snapshot.retention.RetentionEngine;
import com.rg.snapshot.retention.RetentionParsers;
import com.rg.snapshot.retention.RetentionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * {@code snapret [options] policy...}: filters snapshot lines on stdin, printing the ones the
 * policy does not need.
 */
public final class SnapretCommand {
  private static final Logger log = LoggerFactory.getLogger(SnapretCommand.class);

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 2;

  private static final DateTimeFormatter WHY_TIME =
      DateTimeFormatter.ofPattern("EEE yyyy MMM ppd HH:mm:ss", Locale.ENGLISH);

  private SnapretCommand() {}

  public static void main(String[] args) {
    System.exit(run(Arrays.asList(args), System.in, System.out, System.err));
  }

  public static int run(List<String> args, InputStream in, PrintStream out, PrintStream err) {
    CommandOptions options;
    try {
      options = CommandOptions.parse(args);
    } catch (IllegalArgumentException e) {
      err.println("snapret: fatal: " + e.getMessage());
      return EXIT_USAGE;
    }

    if (options.help() || options.policy().isEmpty()) {
      usage(out);
      return options.help() ? EXIT_OK : EXIT_USAGE;
    }

    RetentionPolicy policy;
    try {
      policy = RetentionParsers.parsePolicy(options.policy());
    } catch (IllegalArgumentException e) {
      err.println("snapret: fatal: invalid policy: " + e.getMessage());
      return EXIT_USAGE;
    }

    SnapshotScanner scanner;
    try {
      scanner = new SnapshotScanner(compileExtract(options), compilePattern(options),
          options.localTime() ? ZoneId.systemDefault() : ZoneOffset.UTC,
          options.only(), options.quiet(), err);
    } catch (IllegalArgumentException e) {
      err.println("snapret: fatal: " + e.getMessage());
      return EXIT_USAGE;
    }

    List<ScannedLine> lines;
    try {
      lines = scanner.scan(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));
    } catch (IOException e) {
      log.debug("scan.failed error={}", e.getMessage(), e);
      err.println("snapret: fatal: failed to read stdin: " + e.getMessage());
      return EXIT_USAGE;
    }

    List<ZonedDateTime> snapshots = new ArrayList<>(lines.size());
    List<Integer> snapshotLine = new ArrayList<>(lines.size());
    for (int i = 0; i < lines.size(); i++) {
      if (lines.get(i).valid()) {
        snapshots.add(lines.get(i).time());
        snapshotLine.add(i);
      }
    }

    RetentionDecision decision = RetentionEngine.prune(snapshots, policy);

    // Invalid lines are never discarded, so they pass through only when inverted.
    boolean[] discard = new boolean[lines.size()];
    for (int at = 0; at < snapshots.size(); at++) {
      discard[snapshotLine.get(at)] = !decision.isKept(at);
    }
    for (int i = 0; i < lines.size(); i++) {
      if (discard[i] != options.invert()) out.println(lines.get(i).line());
    }

    if (options.why()) why(err, snapshots, decision);
    if (options.summarize()) summarize(err, policy, decision);
    out.flush();
    err.flush();
    return EXIT_OK;
  }

  private static Pattern compileExtract(CommandOptions options) {
    if (options.extract() == null) return null;
    try {
      return Pattern.compile(options.extract());
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException("--extract regexp is invalid: " + e.getDescription(), e);
    }
  }

  private static DateTimeFormatter compilePattern(CommandOptions options) {
    if (options.pattern() == null) return null;
    try {
      return DateTimeFormatter.ofPattern(options.pattern(), Locale.ENGLISH);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("--parse pattern is invalid: " + e.getMessage(), e);
    }
  }

  private static void why(PrintStream err, List<ZonedDateTime> snapshots, RetentionDecision decision) {
    int n = snapshots.size();
    String index = "%" + digits(n) + "d";
    for (int at = 0; at < n; at++) {
      List<Period> reasons = decision.keep().get(at);
      if (reasons.isEmpty()) continue;
      err.println(String.format("snapret: why: keep [" + index + "/" + index + "] %s :: %s",
          at + 1, n, WHY_TIME.format(snapshots.get(at)),
          reasons.stream().map(Period::toString).collect(Collectors.joining(", "))));
    }
  }

  private static void summarize(PrintStream err, RetentionPolicy policy, RetentionDecision decision) {
    int max = 0;
    for (int count : policy.asMap().values()) max = Math.max(max, count);
    int width = digits(max);

    policy.forEach((period, count) -> {
      int need = decision.need().get(period);
      if (RetentionPolicy.isInfinite(need)) {
        err.println("snapret: summary: (" + "*".repeat(width) + ") " + period);
      } else if (need == 0) {
        err.println(String.format("snapret: summary: (%" + width + "d) %s", count, period));
      } else {
        err.println(String.format("snapret: summary: (%" + width + "d) %s (missing %d)", count, period, need));
      }
    });
    err.println("snapret: summary: pruning " + decision.prunedCount() + "/" + decision.keep().size() + " snapshots");
  }

  static int digits(int n) {
    return n == 0 ? 1 : String.valueOf(Math.abs(n)).length();
  }

  private static void usage(PrintStream out) {
    out.println("usage: snapret [options] policy...");
    out.println();
    out.println("options:");
    out.println("  -e, --extract string     extract the timestamp from each input line using the provided regexp,");
    out.println("                           which must contain up to one capture group");
    out.println("  -h, --help               show this help text");
    out.println("  -v, --invert             output the snapshots to keep instead of the ones to prune");
    out.println("  -L, --local-time         use the default timezone rather than UTC if no timezone is parsed");
    out.println("  -o, --only               only print the part of the line matching the regexp");
    out.println("  -p, --parse string       parse the timestamp using the specified DateTimeFormatter pattern");
    out.println("                           rather than a unix timestamp");
    out.println("  -q, --quiet              do not show warnings about invalid or unmatched input lines");
    out.println("  -s, --summarize          summarize retention policy results to stderr");
    out.println("  -w, --why                explain why each snapshot is being kept to stderr");
    out.println();
    out.println("time pattern examples:");
    out.println("  - EEE MMM dd HH:mm:ss yyyy");
    out.println("  - dd MMM yy HH:mm z");
    out.println("  - yyyy-MM-dd'T'HH:mm:ssXXX");
    out.println("  - yyyy-MM-dd'T'HH:mm:ss");
    out.println();
    out.println("policy: N@unit:X");
    out.println("  - keep the last N snapshots every X units");
    out.println("  - omit the N@ to keep an infinite number of snapshots");
    out.println("  - if :X is omitted, it defaults to :1");
    out.println("  - there may only be one N specified for each unit:X pair");
    out.println();
    out.println("unit:");
    out.println("  last       snapshot count (X must be 1)");
    out.println("  secondly   clock seconds (can also use the format #h#m#s, omitting any zeroed units)");
    out.println("  daily      calendar days");
    out.println("  monthly    calendar months");
    out.println("  yearly     calendar years");
    out.println();
    out.println("notes:");
    out.println("  - output lines consist of filtered input lines");
    out.println("  - input is read from stdin, and should consist of unix timestamps (or more if --extract and/or --parse are set)");
    out.println("  - invalid/unmatched input lines are ignored, or passed through if --invert is set");
    out.println("    (and a warning is printed unless --quiet is set)");
    out.println("  - snapshots are ordered by their UTC time");
    out.println("  - timezones only affect the exact point at which calendar days/months/years are split");
  }
}
