package com.rg.snapshot.retention.cli;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandOptionsTest {

  @Test
  void parsesShortLongAndCombinedFlags() {
    var o = CommandOptions.parse(List.of("-qv", "--why", "7@daily", "-s", "yearly"));

    assertTrue(o.quiet());
    assertTrue(o.invert());
    assertTrue(o.why());
    assertTrue(o.summarize());
    assertFalse(o.only());
    assertFalse(o.localTime());
    assertEquals(List.of("7@daily", "yearly"), o.policy());
  }

  @Test
  void parsesOptionValues() {
    var o = CommandOptions.parse(List.of("-e", "snap-(\\d+)", "--parse=yyyyMMdd", "-L", "last"));
    assertEquals("snap-(\\d+)", o.extract());
    assertEquals("yyyyMMdd", o.pattern());
    assertTrue(o.localTime());

    var attached = CommandOptions.parse(List.of("-oe(\\d+)", "--extract", "x(\\d)", "last"));
    assertTrue(attached.only());
    assertEquals("x(\\d)", attached.extract());
  }

  @Test
  void doubleDashEndsOptions() {
    var o = CommandOptions.parse(List.of("-q", "--", "-1@daily", "-v"));
    assertTrue(o.quiet());
    assertFalse(o.invert());
    assertEquals(List.of("-1@daily", "-v"), o.policy());
  }

  @Test
  void rejectsUnknownOrIncompleteOptions() {
    assertThrows(IllegalArgumentException.class, () -> CommandOptions.parse(List.of("-x", "daily")));
    assertThrows(IllegalArgumentException.class, () -> CommandOptions.parse(List.of("--bogus", "daily")));
    assertThrows(IllegalArgumentException.class, () -> CommandOptions.parse(List.of("daily", "-e")));
    assertThrows(IllegalArgumentException.class, () -> CommandOptions.parse(List.of("--why=yes", "daily")));
  }

  @Test
  void emptyValuesMeanUnset() {
    var o = CommandOptions.parse(List.of("--extract=", "-p", "", "daily"));
    assertNull(o.extract());
    assertNull(o.pattern());
    assertFalse(o.help());
  }
}
