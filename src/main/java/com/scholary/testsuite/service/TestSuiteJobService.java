package com.scholary.testsuite.service;

import com.scholary.testsuite.api.StartJobRequest;
import com.scholary.testsuite.event.JobEventChannel;
import com.scholary.testsuite.job.JobNotFoundException;
import com.scholary.testsuite.job.JobRepository;
import com.scholary.testsuite.job.TestSuiteJob;
import com.scholary.testsuite.scheduler.BatchScheduler;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for test suite jobs: start, inspect and cancel.
 *
 * <p>Every started job gets a supervised handle on the job executor. The handle is dropped as soon
 * as the run settles; the job record itself stays in the {@link JobRepository}.
 */
@Service
public class TestSuiteJobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TestSuiteJobService.class);

  private final JobRepository jobRepository;
  private final JobEventChannel eventChannel;
  private final BatchScheduler scheduler;
  private final Executor jobExecutor;
  private final Map<String, CompletableFuture<Void>> running = new ConcurrentHashMap<>();

  public TestSuiteJobService(
      JobRepository jobRepository,
      JobEventChannel eventChannel,
      BatchScheduler scheduler,
      @Qualifier("jobExecutor") Executor jobExecutor) {
    this.jobRepository = jobRepository;
    this.eventChannel = eventChannel;
    this.scheduler = scheduler;
    this.jobExecutor = jobExecutor;
  }

  /**
   * Register a job for the request and start running it in the background.
   *
   * @return the job as registered, still running
   * @throws JobSchedulingException if the job executor refuses the run; the job is marked failed
   */
  public TestSuiteJob start(StartJobRequest request) {
    TestSuiteJob job =
        jobRepository.create(
            request.styleId(), request.suiteId(), request.suite().prompts().size());
    String jobId = job.id();
    LOGGER.info(
        "Created test suite job {}: style={}, suite={}, prompts={}",
        jobId,
        request.styleId(),
        request.suiteId(),
        job.progress().total());

    CompletableFuture<Void> handle;
    try {
      handle = CompletableFuture.runAsync(() -> scheduler.run(jobId, request), jobExecutor);
    } catch (RejectedExecutionException e) {
      LOGGER.error("Job executor rejected job {}", jobId, e);
      transition(jobId, current -> current.fail(Instant.now(), "Job queue is full"));
      throw new JobSchedulingException("Too many test suite jobs queued, try again later", e);
    }

    running.put(jobId, handle);
    handle.whenComplete((ignored, error) -> running.remove(jobId, handle));
    return job;
  }

  /**
   * Current snapshot of a job.
   *
   * @throws JobNotFoundException if the id is unknown or has expired
   */
  public TestSuiteJob get(String jobId) {
    return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  /**
   * Ask a running job to stop after its current batch. A finished job is returned unchanged.
   *
   * @throws JobNotFoundException if the id is unknown or has expired
   */
  public TestSuiteJob cancel(String jobId) {
    TestSuiteJob job =
        transition(jobId, current -> current.cancel(Instant.now()))
            .orElseThrow(() -> new JobNotFoundException(jobId));
    LOGGER.info("Cancel requested for job {}: status={}", jobId, job.status().wireName());
    return job;
  }

  /** Handle of a job's background run, present only while the run has not settled. */
  public Optional<CompletableFuture<Void>> handle(String jobId) {
    return Optional.ofNullable(running.get(jobId));
  }

  public int activeJobCount() {
    return running.size();
  }

  private Optional<TestSuiteJob> transition(String jobId, UnaryOperator<TestSuiteJob> change) {
    AtomicBoolean changed = new AtomicBoolean();
    Optional<TestSuiteJob> result =
        jobRepository.mutate(
            jobId,
            current -> {
              TestSuiteJob next = change.apply(current);
              changed.set(next != current);
              return next;
            });
    if (changed.get()) {
      result.ifPresent(updated -> eventChannel.publish(jobId, updated));
    }
    return result;
  }
}
