package com.scholary.testsuite.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Snapshot of one run of a test suite against one trained model.
 *
 * <p>Values are immutable: every transition returns a new snapshot, and {@link JobRepository}
 * swaps it in atomically. Transitions requested on a terminal job return the job unchanged, which
 * keeps terminal states final no matter which writer arrives late.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestSuiteJob(
    String id,
    String styleId,
    String suiteId,
    JobStatus status,
    JobProgress progress,
    Instant startedAt,
    Instant completedAt,
    String error,
    String resultId) {

  public static TestSuiteJob start(
      String id, String styleId, String suiteId, int total, String resultId, Instant startedAt) {
    return new TestSuiteJob(
        id,
        styleId,
        suiteId,
        JobStatus.RUNNING,
        JobProgress.of(total),
        startedAt,
        null,
        null,
        resultId);
  }

  @JsonIgnore
  public boolean isRunning() {
    return status == JobStatus.RUNNING;
  }

  public TestSuiteJob advanceProgress() {
    if (!isRunning()) {
      return this;
    }
    return new TestSuiteJob(
        id, styleId, suiteId, status, progress.advance(), startedAt, null, null, resultId);
  }

  public TestSuiteJob complete(Instant at) {
    return terminate(JobStatus.COMPLETED, at, null);
  }

  public TestSuiteJob fail(Instant at, String message) {
    return terminate(JobStatus.FAILED, at, message == null ? "Unknown error" : message);
  }

  public TestSuiteJob cancel(Instant at) {
    return terminate(JobStatus.CANCELLED, at, null);
  }

  private TestSuiteJob terminate(JobStatus target, Instant at, String message) {
    if (!isRunning()) {
      return this;
    }
    return new TestSuiteJob(
        id, styleId, suiteId, target, progress, startedAt, at, message, resultId);
  }
}
