package com.scholary.testsuite.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of test suite jobs, keyed by job id.
 *
 * <p>Backed by a Caffeine cache with a per-entry expiry: running jobs never expire, finished jobs
 * are evicted once they have not been updated for the retention period. Jobs do not survive a
 * restart.
 *
 * <p>All transitions go through {@link #mutate}, which runs atomically per key. Readers get
 * immutable snapshots and never block the writer.
 */
@Repository
public class JobRepository {

  private static final DateTimeFormatter RESULT_ID_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

  private final Cache<String, TestSuiteJob> cache;

  @Autowired
  public JobRepository(@Value("${testsuite.jobs.retentionMinutes}") int retentionMinutes) {
    this(Duration.ofMinutes(retentionMinutes), Ticker.systemTicker());
  }

  JobRepository(Duration retention, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder().expireAfter(new TerminalJobExpiry(retention)).ticker(ticker).build();
  }

  /**
   * Register a new running job.
   *
   * @param styleId style the suite is run for
   * @param suiteId suite being run
   * @param total number of work items in the suite
   * @return the registered job
   */
  public TestSuiteJob create(String styleId, String suiteId, int total) {
    Instant now = Instant.now();
    String suffix = UUID.randomUUID().toString().substring(0, 8);
    String jobId = String.format("test-%d-%s", now.toEpochMilli(), suffix);
    // one result directory per job, even for jobs of the same suite started together
    String resultId = suiteId + "_" + RESULT_ID_FORMAT.format(now) + "_" + suffix;

    TestSuiteJob job = TestSuiteJob.start(jobId, styleId, suiteId, total, resultId, now);
    cache.put(jobId, job);
    return job;
  }

  public Optional<TestSuiteJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  /**
   * Apply a transition to a job atomically.
   *
   * @param jobId the job to update
   * @param transition maps the current snapshot to the next one
   * @return the snapshot after the transition, or empty if the job is unknown
   */
  public Optional<TestSuiteJob> mutate(String jobId, UnaryOperator<TestSuiteJob> transition) {
    return Optional.ofNullable(
        cache.asMap().computeIfPresent(jobId, (id, current) -> transition.apply(current)));
  }

  long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  /** Keeps running jobs forever and starts the retention clock once a job finishes. */
  private static final class TerminalJobExpiry implements Expiry<String, TestSuiteJob> {

    private final long retentionNanos;

    TerminalJobExpiry(Duration retention) {
      this.retentionNanos = retention.toNanos();
    }

    @Override
    public long expireAfterCreate(String key, TestSuiteJob job, long currentTime) {
      return durationFor(job);
    }

    @Override
    public long expireAfterUpdate(
        String key, TestSuiteJob job, long currentTime, long currentDuration) {
      return durationFor(job);
    }

    @Override
    public long expireAfterRead(
        String key, TestSuiteJob job, long currentTime, long currentDuration) {
      return currentDuration;
    }

    private long durationFor(TestSuiteJob job) {
      return job.isRunning() ? Long.MAX_VALUE : retentionNanos;
    }
  }
}
