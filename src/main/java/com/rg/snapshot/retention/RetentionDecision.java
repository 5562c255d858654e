package com.rg.snapshot.retention;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a prune.
 *
 * @param keep one entry per input snapshot, in input order: the periods that require the
 *             snapshot, sorted; empty if it may be discarded
 * @param need additional snapshots each period still wants; periods already satisfied are
 *             absent (count 0), unbounded periods stay {@link RetentionPolicy#INFINITE}
 */
public record RetentionDecision(
    List<List<Period>> keep,
    RetentionPolicy need
) {
  public RetentionDecision {
    Objects.requireNonNull(keep, "keep");
    Objects.requireNonNull(need, "need");
    keep = keep.stream().map(List::copyOf).toList();
  }

  public boolean isKept(int index) {
    return !keep.get(index).isEmpty();
  }

  public int keptCount() {
    return (int) keep.stream().filter(reasons -> !reasons.isEmpty()).count();
  }

  public int prunedCount() {
    return keep.size() - keptCount();
  }

  /** Number of snapshots retained because of the given period. */
  public int keptFor(Period period) {
    return (int) keep.stream().filter(reasons -> reasons.contains(period)).count();
  }
}
