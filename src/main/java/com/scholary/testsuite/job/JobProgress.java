package com.scholary.testsuite.job;

/**
 * Attempted items out of the suite size.
 *
 * <p>{@code total} is fixed when the job is created; {@code current} only grows and never passes
 * it.
 */
public record JobProgress(int current, int total) {

  public JobProgress {
    if (total < 0) {
      throw new IllegalArgumentException("total must not be negative: " + total);
    }
    if (current < 0 || current > total) {
      throw new IllegalArgumentException(
          String.format("current must be within [0, %d]: %d", total, current));
    }
  }

  public static JobProgress of(int total) {
    return new JobProgress(0, total);
  }

  /** Counts one more attempted item, saturating at {@code total}. */
  public JobProgress advance() {
    return current >= total ? this : new JobProgress(current + 1, total);
  }
}
