package com.rg.snapshot.retention.cli;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapretCommandTest {

  // 2024-01-01T12:00:00Z (a Monday) and the following four days at noon
  private static final String JAN1 = "1704110400";
  private static final String JAN2 = "1704196800";
  private static final String JAN3 = "1704283200";
  private static final String JAN4 = "1704369600";
  private static final String JAN5 = "1704456000";

  private record Result(int status, List<String> out, List<String> err) {}

  private static Result run(String stdin, String... args) {
    var out = new ByteArrayOutputStream();
    var err = new ByteArrayOutputStream();
    int status = SnapretCommand.run(List.of(args),
        new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8));
    return new Result(status,
        out.toString(StandardCharsets.UTF_8).lines().toList(),
        err.toString(StandardCharsets.UTF_8).lines().toList());
  }

  private static String lines(String... lines) {
    return String.join("\n", lines) + "\n";
  }

  @Test
  void printsUsageWithoutPolicy() {
    var r = run("");
    assertEquals(2, r.status());
    assertTrue(r.out().get(0).startsWith("usage: snapret"));
  }

  @Test
  void helpExitsCleanly() {
    var r = run("", "--help", "daily");
    assertEquals(0, r.status());
    assertTrue(r.out().contains("policy: N@unit:X"));
  }

  @Test
  void invalidPolicyIsFatal() {
    var r = run(lines(JAN1), "daily", "daily");
    assertEquals(2, r.status());
    assertEquals(List.of("snapret: fatal: invalid policy: rule \"daily\": duplicate daily:1"), r.err());
    assertTrue(r.out().isEmpty());
  }

  @Test
  void hugeYearlyIntervalStillPrunes() {
    var r = run(lines(JAN5, JAN1), "yearly:2000000000");
    assertEquals(0, r.status());
    assertEquals(List.of(JAN1), r.out());
  }

  @Test
  void unreadableInputIsOneFatalLine() {
    InputStream broken = new InputStream() {
      @Override
      public int read() throws IOException {
        throw new IOException("device gone");
      }
    };
    var err = new ByteArrayOutputStream();
    int status = SnapretCommand.run(List.of("daily"), broken,
        new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8));

    assertEquals(2, status);
    assertEquals(List.of("snapret: fatal: failed to read stdin: device gone"),
        err.toString(StandardCharsets.UTF_8).lines().toList());
  }

  @Test
  void printsSnapshotsToPrune() {
    var r = run(lines(JAN3, JAN1, "", JAN5, JAN2, JAN4), "2@daily");

    assertEquals(0, r.status());
    assertEquals(List.of(JAN3, JAN1, JAN2), r.out());
    assertTrue(r.err().isEmpty());
  }

  @Test
  void invertPrintsSnapshotsToKeepAndInvalidLines() {
    var r = run(lines(JAN1, "garbage", JAN2, JAN5), "-v", "2@daily");

    assertEquals(0, r.status());
    assertEquals(List.of("garbage", JAN2, JAN5), r.out());
    assertEquals(1, r.err().size());
    assertTrue(r.err().get(0).startsWith("snapret: warning: failed to parse unix timestamp \"garbage\""));
  }

  @Test
  void quietSuppressesWarnings() {
    var r = run(lines(JAN1, "garbage", JAN2), "-q", "1@last");

    assertEquals(List.of(JAN1), r.out());
    assertTrue(r.err().isEmpty());
  }

  @Test
  void extractsAndParsesTimestamps() {
    var input = lines(
        "vol/backup-2024-01-01T12:00:00.tar keep",
        "vol/backup-2024-01-03T12:00:00.tar keep",
        "unrelated line",
        "vol/backup-2024-01-02T12:00:00.tar keep");

    var r = run(input, "-e", "backup-(\\S+)\\.tar", "-p", "yyyy-MM-dd'T'HH:mm:ss", "-o", "1@last");

    assertEquals(List.of("backup-2024-01-01T12:00:00.tar", "backup-2024-01-02T12:00:00.tar"), r.out());
    assertEquals(List.of("snapret: warning: line does not match --extract regexp: \"unrelated line\""), r.err());
  }

  @Test
  void parsedOffsetsAreHonored() {
    var input = lines("2024-01-01T23:30:00-05:00", "2024-01-01T22:00:00-05:00");

    var r = run(input, "-p", "yyyy-MM-dd'T'HH:mm:ssXXX", "daily");

    // both fall on January 1st in their own offset even though the first is January 2nd in UTC
    assertEquals(List.of("2024-01-01T22:00:00-05:00"), r.out());
  }

  @Test
  void rejectsRegexWithTwoGroups() {
    var r = run(lines(JAN1), "-e", "(a)(b)", "daily");
    assertEquals(2, r.status());
    assertEquals(List.of("snapret: fatal: must contain up to one capture group"), r.err());
  }

  @Test
  void rejectsInvalidRegexAndPattern() {
    var regex = run(lines(JAN1), "-e", "(", "daily");
    assertEquals(2, regex.status());
    assertTrue(regex.err().get(0).startsWith("snapret: fatal: --extract regexp is invalid"));

    var pattern = run(lines(JAN1), "-p", "yyyy-{", "daily");
    assertEquals(2, pattern.status());
    assertTrue(pattern.err().get(0).startsWith("snapret: fatal: --parse pattern is invalid"));
  }

  @Test
  void explainsAndSummarizes() {
    var r = run(lines(JAN4, JAN5), "-w", "-s", "1@last", "3@daily", "yearly");

    assertEquals(0, r.status());
    assertTrue(r.out().isEmpty());
    assertEquals(List.of(
        "snapret: why: keep [1/2] Thu 2024 Jan  4 12:00:00 :: every day",
        "snapret: why: keep [2/2] Fri 2024 Jan  5 12:00:00 :: last, every day, every year",
        "snapret: summary: (1) last",
        "snapret: summary: (3) every day (missing 1)",
        "snapret: summary: (*) every year",
        "snapret: summary: pruning 0/2 snapshots"
    ), r.err());
  }

  @Test
  void digitsOfCounts() {
    assertEquals(1, SnapretCommand.digits(0));
    assertEquals(1, SnapretCommand.digits(9));
    assertEquals(3, SnapretCommand.digits(120));
  }
}
