package com.rg.snapshot.retention.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads snapshot times from lines of text.
 *
 * Without a formatter each timestamp is unix seconds. With one, times that carry no zone or
 * offset are placed in the default zone. Lines that cannot be read are kept with a null time
 * and a warning is printed unless quiet.
 */
public final class SnapshotScanner {
  private static final Logger log = LoggerFactory.getLogger(SnapshotScanner.class);

  private final Pattern extract;
  private final DateTimeFormatter formatter;
  private final ZoneId zone;
  private final boolean only;
  private final boolean quiet;
  private final PrintStream warnings;

  public SnapshotScanner(Pattern extract, DateTimeFormatter formatter, ZoneId zone,
                         boolean only, boolean quiet, PrintStream warnings) {
    if (extract != null && extract.matcher("").groupCount() > 1) {
      throw new IllegalArgumentException("must contain up to one capture group");
    }
    this.extract = extract;
    this.formatter = formatter;
    this.zone = Objects.requireNonNull(zone, "zone");
    this.only = only;
    this.quiet = quiet;
    this.warnings = Objects.requireNonNull(warnings, "warnings");
  }

  /** Reads to end of stream, skipping empty lines. */
  public List<ScannedLine> scan(BufferedReader reader) throws IOException {
    List<ScannedLine> out = new ArrayList<>();
    String line;
    while ((line = reader.readLine()) != null) {
      if (line.isEmpty()) continue;
      out.add(scanLine(line));
    }
    return out;
  }

  ScannedLine scanLine(String line) {
    String ts;
    if (extract == null) {
      ts = line.strip();
    } else {
      Matcher m = extract.matcher(line);
      if (!m.find()) {
        warn("line does not match --extract regexp: \"" + line + "\"");
        return new ScannedLine(line, null);
      }
      if (only) line = m.group();
      ts = m.group(m.groupCount());
      if (ts == null) {
        warn("--extract capture group did not participate in match: \"" + line + "\"");
        return new ScannedLine(line, null);
      }
    }
    return new ScannedLine(line, parseTime(ts));
  }

  private ZonedDateTime parseTime(String ts) {
    if (formatter == null) {
      try {
        return Instant.ofEpochSecond(Long.parseLong(ts)).atZone(zone);
      } catch (NumberFormatException | DateTimeException e) {
        warn("failed to parse unix timestamp \"" + ts + "\": " + e.getMessage());
        return null;
      }
    }
    try {
      TemporalAccessor parsed = formatter.parseBest(ts, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
      if (parsed instanceof ZonedDateTime z) return z;
      if (parsed instanceof LocalDateTime l) return l.atZone(zone);
      return ((LocalDate) parsed).atStartOfDay(zone);
    } catch (DateTimeException e) {
      warn("failed to parse timestamp \"" + ts + "\": " + e.getMessage());
      return null;
    }
  }

  private void warn(String message) {
    log.debug("scan.skipped reason={}", message);
    if (!quiet) warnings.println("snapret: warning: " + message);
  }
}
