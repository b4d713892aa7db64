package com.scholary.testsuite.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle state of a test suite job.
 *
 * <p>{@code RUNNING} is the only non-terminal state. Nothing leaves a terminal state.
 */
public enum JobStatus {
  RUNNING,
  COMPLETED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this != RUNNING;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
