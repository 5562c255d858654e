package com.rg.snapshot.retention;

import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Granularity of a retention period.
 *
 * Declaration order is the canonical sort order for periods and must not change.
 */
public enum Unit {
  /** Snapshot count, independent of time. */
  LAST,
  /** Wall-clock seconds. */
  SECONDLY,
  /** Calendar days. */
  DAILY,
  /** Calendar months. */
  MONTHLY,
  /** Calendar years. */
  YEARLY;

  public static boolean isValid(Unit unit) {
    return unit != null;
  }

  /** Lowercase keyword used in rule text. */
  public String ruleName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<Unit> fromRuleName(String name) {
    if (name == null) return Optional.empty();
    for (Unit u : values()) {
      if (u.ruleName().equalsIgnoreCase(name)) return Optional.of(u);
    }
    return Optional.empty();
  }

  /**
   * True if both times fall into the same bucket of this unit.
   *
   * Calendar units compare the local date in whatever zone the times already carry;
   * SECONDLY compares the UTC epoch second.
   */
  public boolean sameBucket(ZonedDateTime a, ZonedDateTime b) {
    return switch (this) {
      case LAST -> a.toInstant().equals(b.toInstant());
      case SECONDLY -> a.toEpochSecond() == b.toEpochSecond();
      case DAILY -> a.toLocalDate().equals(b.toLocalDate());
      case MONTHLY -> a.getYear() == b.getYear() && a.getMonthValue() == b.getMonthValue();
      case YEARLY -> a.getYear() == b.getYear();
    };
  }
}
