package com.rg.snapshot.retention.cli;

import java.time.ZonedDateTime;

/**
 * An input line and the snapshot time read from it, or null if none could be read.
 */
public record ScannedLine(String line, ZonedDateTime time) {

  public boolean valid() {
    return time != null;
  }
}
