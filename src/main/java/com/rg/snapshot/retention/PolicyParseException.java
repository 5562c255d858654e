package com.rg.snapshot.retention;

/**
 * A retention rule could not be parsed.
 */
public class PolicyParseException extends IllegalArgumentException {

  public enum Reason { UNKNOWN_UNIT, BAD_INTEGER, DUPLICATE_PERIOD, INVALID_PERIOD }

  private final String rule;
  private final Reason reason;

  public PolicyParseException(String rule, Reason reason, String message) {
    this(rule, reason, message, null);
  }

  public PolicyParseException(String rule, Reason reason, String message, Throwable cause) {
    super("rule \"" + rule + "\": " + message, cause);
    this.rule = rule;
    this.reason = reason;
  }

  /** The rule text as given. */
  public String rule() {
    return rule;
  }

  public Reason reason() {
    return reason;
  }
}
