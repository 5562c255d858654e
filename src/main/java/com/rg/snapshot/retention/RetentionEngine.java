package com.rg.snapshot.retention;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Decides which snapshots a retention policy requires.
 *
 * Rules:
 *  1) Snapshots are walked from newest to oldest; identical instants keep input order.
 *  2) LAST keeps the N newest snapshots.
 *  3) Other periods keep the newest snapshot of a bucket, then wait until a snapshot is at
 *     least one interval older than the one they kept (or falls into the bucket that is one
 *     interval older) before keeping the next one.
 *  4) Periods sharing a unit never keep two different snapshots from the same bucket, so at
 *     most one snapshot per calendar day/month/year (or second) is kept for that unit.
 *
 * Notes:
 *  - Calendar buckets use the zone each snapshot carries. Ordering uses the instant only.
 *  - The engine never touches storage; callers delete what {@link RetentionDecision#keep()} leaves empty.
 *  - With several intervals for one unit, pruning incrementally (run, delete, add more, run again)
 *    can discard a snapshot that the longer interval would have wanted later.
 */
public final class RetentionEngine {
  private static final Logger log = LoggerFactory.getLogger(RetentionEngine.class);

  private RetentionEngine() {}

  /** Prunes instants, placing them in {@code zone} for calendar buckets. */
  public static RetentionDecision prune(List<Instant> snapshots, RetentionPolicy policy, ZoneId zone) {
    Objects.requireNonNull(snapshots, "snapshots");
    Objects.requireNonNull(zone, "zone");
    List<ZonedDateTime> zoned = new ArrayList<>(snapshots.size());
    for (Instant t : snapshots) {
      zoned.add(Objects.requireNonNull(t, "snapshot").atZone(zone));
    }
    return prune(zoned, policy);
  }

  public static RetentionDecision pruneUtc(List<Instant> snapshots, RetentionPolicy policy) {
    return prune(snapshots, policy, ZoneOffset.UTC);
  }

  public static RetentionDecision prune(List<ZonedDateTime> snapshots, RetentionPolicy policy) {
    Objects.requireNonNull(snapshots, "snapshots");
    Objects.requireNonNull(policy, "policy");

    int n = snapshots.size();
    if (n == 0) {
      return new RetentionDecision(List.of(), policy.copy());
    }
    for (ZonedDateTime t : snapshots) Objects.requireNonNull(t, "snapshot");

    // Working copy of the counts; the policy itself is only read.
    List<Period> periods = policy.periods();
    Map<Period, Integer> remaining = new TreeMap<>(policy.asMap());

    List<List<Period>> keep = new ArrayList<>(n);
    for (int i = 0; i < n; i++) keep.add(new ArrayList<>());

    // Newest first
    List<Integer> order = new ArrayList<>(n);
    for (int i = 0; i < n; i++) order.add(i);
    order.sort(Comparator.comparing((Integer i) -> snapshots.get(i).toInstant()).reversed()
        .thenComparing(Comparator.naturalOrder()));

    Map<Period, ZonedDateTime> lastAccepted = new HashMap<>();
    Map<Unit, Integer> lastRetained = new EnumMap<>(Unit.class);

    for (int idx : order) {
      ZonedDateTime at = snapshots.get(idx);
      for (Period period : periods) {
        int count = remaining.get(period);
        if (count == 0) continue;

        if (period.unit() != Unit.LAST && !claim(period, idx, at, snapshots, lastAccepted, lastRetained)) {
          continue;
        }
        keep.get(idx).add(period);
        if (count > 0) remaining.put(period, count - 1);
      }
    }

    RetentionPolicy need = new RetentionPolicy();
    remaining.forEach(need::set);

    if (log.isDebugEnabled()) {
      long kept = keep.stream().filter(reasons -> !reasons.isEmpty()).count();
      log.debug("prune.completed snapshots={} kept={} policy=[{}] need=[{}]", n, kept, policy, need);
    }
    return new RetentionDecision(keep, need);
  }

  /**
   * Whether a time-based period takes the snapshot at {@code at}, recording it if so.
   */
  private static boolean claim(Period period,
                               int idx,
                               ZonedDateTime at,
                               List<ZonedDateTime> snapshots,
                               Map<Period, ZonedDateTime> lastAccepted,   // per period: last snapshot it kept
                               Map<Unit, Integer> lastRetained) {         // per unit: index of last snapshot kept by any period
    Unit unit = period.unit();

    // 1) Not due yet: still inside the interval after the last kept snapshot
    ZonedDateTime last = lastAccepted.get(period);
    if (last != null) {
      ZonedDateTime due = period.previous(last);
      if (due.isBefore(at) && !unit.sameBucket(due, at)) {
        return false;
      }
    }

    // 2) Another period of this unit already kept a different snapshot from this bucket
    Integer other = lastRetained.get(unit);
    if (other != null && other != idx && unit.sameBucket(snapshots.get(other), at)) {
      return false;
    }

    lastAccepted.put(period, at);
    lastRetained.put(unit, idx);
    return true;
  }
}
