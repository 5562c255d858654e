package com.rg.snapshot.retention;

import java.time.Duration;
import java.util.Objects;

/**
 * Fluent builder for RetentionPolicy.
 *
 * Each unit:interval may be added once; adding it again is a programming error.
 * Use {@link RetentionPolicy#INFINITE} as the count to keep an unbounded number.
 */
public final class RetentionPolicyBuilder {

  private final RetentionPolicy policy = new RetentionPolicy();

  private RetentionPolicyBuilder() {}

  public static RetentionPolicyBuilder builder() {
    return new RetentionPolicyBuilder();
  }

  /** Keep the {@code count} newest snapshots. */
  public RetentionPolicyBuilder last(int count) {
    return keep(Unit.LAST, 1, count);
  }

  /** Keep one snapshot every {@code every} (whole seconds), {@code count} times. */
  public RetentionPolicyBuilder secondly(Duration every, int count) {
    Objects.requireNonNull(every, "every");
    long seconds = every.getSeconds();
    if (seconds < 1 || seconds > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("secondly interval must be between 1s and " + Integer.MAX_VALUE + "s");
    }
    return keep(Unit.SECONDLY, (int) seconds, count);
  }

  public RetentionPolicyBuilder daily(int count) {
    return keep(Unit.DAILY, 1, count);
  }

  public RetentionPolicyBuilder monthly(int count) {
    return keep(Unit.MONTHLY, 1, count);
  }

  public RetentionPolicyBuilder yearly(int count) {
    return keep(Unit.YEARLY, 1, count);
  }

  public RetentionPolicyBuilder keep(Unit unit, int interval, int count) {
    if (count == 0) throw new IllegalArgumentException("count must not be zero");
    policy.mustSet(unit, interval, count);
    return this;
  }

  /** Adds rules in text form, e.g. {@code "7@daily"}. */
  public RetentionPolicyBuilder rules(String... rules) {
    RetentionPolicy parsed = RetentionParsers.parsePolicy(rules);
    for (Period period : parsed.periods()) {
      if (policy.get(period) != 0) {
        throw new PolicyParseException(period.toRule(), PolicyParseException.Reason.DUPLICATE_PERIOD,
            "duplicate " + period.toRule());
      }
    }
    parsed.forEach(policy::set);
    return this;
  }

  public RetentionPolicy build() {
    return policy.copy();
  }
}
