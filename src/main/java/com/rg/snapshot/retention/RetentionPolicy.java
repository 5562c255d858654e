package com.rg.snapshot.retention;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.regex.Pattern;

/**
 * Snapshot retention policy: how many snapshots to keep for each period.
 *
 * Counts are positive, or {@link #INFINITE} to keep an unbounded number. A count of
 * zero is never stored. Periods are always normalized and iterate in {@link Period}
 * order, so two equivalent policies render and prune identically.
 *
 * Not thread-safe; give each concurrent caller its own {@link #copy()}.
 */
public final class RetentionPolicy {

  /** Count meaning "keep every snapshot this period selects". */
  public static final int INFINITE = -1;

  // \s also matches no-break and other Unicode spaces
  private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private final NavigableMap<Period, Integer> counts;

  public RetentionPolicy() {
    this.counts = new TreeMap<>();
  }

  private RetentionPolicy(NavigableMap<Period, Integer> counts) {
    this.counts = new TreeMap<>(counts);
  }

  /** Parses whitespace-separated rules, e.g. {@code "3@last 7@daily yearly"}. */
  public static RetentionPolicy parse(String text) {
    Objects.requireNonNull(text, "text");
    List<String> rules = new ArrayList<>();
    for (String rule : WHITESPACE.split(text)) {
      if (!rule.isEmpty()) rules.add(rule);
    }
    if (rules.isEmpty()) return new RetentionPolicy();
    return RetentionParsers.parsePolicy(rules);
  }

  /**
   * Sets the count for a period, replacing any existing count.
   * A negative count becomes {@link #INFINITE}; zero removes the period.
   *
   * @return false (and no change) if the period is invalid
   */
  public boolean set(Period period, int count) {
    if (period == null) return false;
    var normalized = period.normalize();
    if (normalized.isEmpty()) return false;
    if (count == 0) {
      counts.remove(normalized.get());
    } else {
      counts.put(normalized.get(), count < 0 ? INFINITE : count);
    }
    return true;
  }

  /**
   * Like {@link #set(Period, int)}, but for periods known to be valid and unused.
   *
   * @throws IllegalStateException if the period already has a count
   * @throws IllegalArgumentException if the period is invalid
   */
  public RetentionPolicy mustSet(Unit unit, int interval, int count) {
    Period period = new Period(unit, interval);
    if (get(period) != 0) {
      throw new IllegalStateException("duplicate period " + period);
    }
    if (!set(period, count)) {
      throw new IllegalArgumentException("invalid period " + unit + ":" + interval);
    }
    return this;
  }

  /** The count for a period, or 0 if unset or invalid. */
  public int get(Period period) {
    if (period == null) return 0;
    return period.normalize().map(p -> counts.getOrDefault(p, 0)).orElse(0);
  }

  /** Visits every period in canonical order. The visitor must not modify this policy. */
  public void forEach(BiConsumer<Period, Integer> visitor) {
    Objects.requireNonNull(visitor, "visitor");
    for (Map.Entry<Period, Integer> e : counts.entrySet()) {
      visitor.accept(e.getKey(), e.getValue());
    }
  }

  /** Periods in canonical order. */
  public List<Period> periods() {
    return List.copyOf(counts.keySet());
  }

  public Map<Period, Integer> asMap() {
    return Collections.unmodifiableMap(counts);
  }

  public int size() {
    return counts.size();
  }

  public boolean isEmpty() {
    return counts.isEmpty();
  }

  /** Independent copy; changes to either side are not visible to the other. */
  public RetentionPolicy copy() {
    return new RetentionPolicy(counts);
  }

  /** Canonical rule text, accepted by {@link #parse(String)}. */
  public String toText() {
    return RetentionParsers.formatPolicy(this);
  }

  public static boolean isInfinite(int count) {
    return count < 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RetentionPolicy other)) return false;
    return counts.equals(other.counts);
  }

  @Override
  public int hashCode() {
    return counts.hashCode();
  }

  /** Human-readable form, e.g. "last (3), every day (7), every year (inf)". */
  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    forEach((period, count) -> {
      if (b.length() > 0) b.append(", ");
      b.append(period).append(" (").append(isInfinite(count) ? "inf" : String.valueOf(count)).append(')');
    });
    return b.toString();
  }
}
