package com.rg.snapshot.retention;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.Optional;

/**
 * One retained snapshot every {@code interval} units.
 *
 * A period may be constructed un-normalized; {@link #normalize()} validates it and
 * forces the interval of {@link Unit#LAST} to 1. Every period stored in a
 * {@link RetentionPolicy} is normalized.
 */
public record Period(Unit unit, int interval) implements Comparable<Period> {

  private static final Comparator<Period> ORDER =
      Comparator.comparing(Period::unit).thenComparingInt(Period::interval);

  /** Creates a normalized period, failing on invalid input. */
  public static Period of(Unit unit, int interval) {
    return new Period(unit, interval).normalize()
        .orElseThrow(() -> new IllegalArgumentException("invalid period " + unit + ":" + interval));
  }

  public Optional<Period> normalize() {
    if (!Unit.isValid(unit)) return Optional.empty();
    if (unit == Unit.LAST) {
      return Optional.of(interval == 1 ? this : new Period(Unit.LAST, 1));
    }
    if (interval <= 0) return Optional.empty();
    return Optional.of(this);
  }

  public boolean isValid() {
    return normalize().isPresent();
  }

  /**
   * The time one interval before {@code t}.
   *
   * Calendar units use calendar arithmetic in the zone of {@code t}, so subtracting a
   * month from the 31st lands on the last day of the previous month. For LAST the
   * result is just before {@code t} and has no calendar meaning.
   *
   * Results before the earliest supported date saturate to {@link LocalDateTime#MIN} in
   * the zone of {@code t}.
   */
  public ZonedDateTime previous(ZonedDateTime t) {
    try {
      return switch (unit) {
        case LAST -> t.minusNanos(1);
        case SECONDLY -> t.minusSeconds(interval);
        case DAILY -> t.minusDays(interval);
        case MONTHLY -> t.minusMonths(interval);
        case YEARLY -> t.minusYears(interval);
      };
    } catch (DateTimeException | ArithmeticException e) {
      return ZonedDateTime.of(LocalDateTime.MIN, t.getZone());
    }
  }

  @Override
  public int compareTo(Period other) {
    return ORDER.compare(this, other);
  }

  /** The {@code unit[:X]} part of a rule. */
  public String toRule() {
    StringBuilder b = new StringBuilder(unit.ruleName());
    if (unit != Unit.LAST && interval != 1) {
      b.append(':');
      if (unit == Unit.SECONDLY && interval >= 60) {
        b.append(RetentionParsers.formatSeconds(interval));
      } else {
        b.append(interval);
      }
    }
    return b.toString();
  }

  /** Human-readable form, e.g. "every 2 months". Stable for a given period. */
  @Override
  public String toString() {
    if (!isValid()) return "invalid period " + unit + ":" + interval;
    return switch (unit) {
      case LAST -> "last";
      case SECONDLY -> "every " + (interval == 1 ? "second" : RetentionParsers.formatSeconds(interval));
      case DAILY -> every("day");
      case MONTHLY -> every("month");
      case YEARLY -> every("year");
    };
  }

  private String every(String noun) {
    return interval == 1 ? "every " + noun : "every " + interval + " " + noun + "s";
  }
}
