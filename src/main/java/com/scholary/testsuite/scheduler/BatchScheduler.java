package com.scholary.testsuite.scheduler;

import com.scholary.testsuite.api.StartJobRequest;
import com.scholary.testsuite.config.TestSuiteProperties;
import com.scholary.testsuite.event.JobEventChannel;
import com.scholary.testsuite.job.JobRepository;
import com.scholary.testsuite.job.TestSuiteJob;
import com.scholary.testsuite.logging.StructuredLogger;
import com.scholary.testsuite.storage.GenerationResult;
import com.scholary.testsuite.storage.ResultBundle;
import com.scholary.testsuite.storage.ResultLocation;
import com.scholary.testsuite.storage.ResultStore;
import com.scholary.testsuite.suite.TestPrompt;
import com.scholary.testsuite.suite.TestSuite;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives one test suite job from its first batch to a terminal state.
 *
 * <p>Prompts are processed in consecutive batches. Items of a batch run concurrently and fail
 * independently; the next batch starts only after every item of the current one has settled and
 * the bundle has been saved. Results keep prompt order regardless of completion order.
 *
 * <p>Cancellation is checked between batches. Items already in flight are left to finish, but once
 * the job is cancelled its record is frozen: their outcomes neither advance progress nor get
 * persisted.
 *
 * <p>Each item gets its own deadline, counted from when a worker picks it up. A worker still busy at
 * the deadline is interrupted so the pool does not fill up with abandoned calls.
 *
 * <p>Any exception outside the per-item boundary fails the job. An {@link Error} fails the job and
 * is rethrown.
 */
@Service
public class BatchScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchScheduler.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobRepository jobRepository;
  private final JobEventChannel eventChannel;
  private final TestImageGenerator imageGenerator;
  private final ResultStore resultStore;
  private final Executor generationExecutor;
  private final int batchSize;
  private final Duration itemTimeout;

  public BatchScheduler(
      JobRepository jobRepository,
      JobEventChannel eventChannel,
      TestImageGenerator imageGenerator,
      ResultStore resultStore,
      @Qualifier("generationExecutor") Executor generationExecutor,
      TestSuiteProperties properties) {
    this.jobRepository = jobRepository;
    this.eventChannel = eventChannel;
    this.imageGenerator = imageGenerator;
    this.resultStore = resultStore;
    this.generationExecutor = generationExecutor;
    this.batchSize = properties.batchSize();
    this.itemTimeout = Duration.ofSeconds(properties.itemTimeoutSeconds());
  }

  /**
   * Run every batch of a job.
   *
   * @param jobId a job registered in the job store, still running
   * @param request the request the job was created from
   */
  public void run(String jobId, StartJobRequest request) {
    TestSuiteJob job = jobRepository.findById(jobId).orElse(null);
    if (job == null) {
      LOGGER.warn("Job {} vanished before it started", jobId);
      return;
    }

    StructuredLogger.setJobContext(jobId, request.styleId(), request.suiteId());
    List<TestPrompt> prompts = request.suite().prompts();
    List<GenerationResult> images = new ArrayList<>();

    try {
      ResultLocation location =
          new ResultLocation(request.styleId(), request.trainedModel().id(), job.resultId());
      LOGGER.info("Starting job {} with {} prompts", jobId, prompts.size());

      for (int start = 0; start < prompts.size(); start += batchSize) {
        if (!isRunning(jobId)) {
          LOGGER.info("Job {} cancelled at prompt {}", jobId, start);
          return;
        }

        List<TestPrompt> batch = prompts.subList(start, Math.min(start + batchSize, prompts.size()));
        structuredLogger.logBatchStarted(jobId, start / batchSize + 1, batch.size(), start);

        List<CompletableFuture<GenerationResult>> outcomes = new ArrayList<>(batch.size());
        for (TestPrompt prompt : batch) {
          outcomes.add(dispatch(prompt, request, location));
        }
        CompletableFuture.allOf(outcomes.toArray(new CompletableFuture<?>[0]))
            .handle((ignored, error) -> null)
            .join();

        for (int i = 0; i < batch.size(); i++) {
          collect(batch.get(i), outcomes.get(i), images);
          advanceProgress(jobId);
        }

        if (!isRunning(jobId)) {
          LOGGER.info("Job {} cancelled during batch; results of this batch are not saved", jobId);
          return;
        }
        resultStore.saveBundle(location, bundle(request, images));
        jobRepository
            .findById(jobId)
            .ifPresent(
                current ->
                    structuredLogger.logJobProgress(
                        jobId,
                        current.progress().current(),
                        current.progress().total(),
                        images.size()));
      }

      if (!isRunning(jobId)) {
        LOGGER.info("Job {} cancelled before completion", jobId);
        return;
      }
      resultStore.saveBundle(location, bundle(request, images));
      finish(jobId, current -> current.complete(Instant.now()), images.size());

    } catch (Exception e) {
      LOGGER.error("Job {} failed", jobId, e);
      finish(jobId, current -> current.fail(Instant.now(), messageOf(e)), images.size());
    } catch (Error e) {
      LOGGER.error("Job {} aborted by {}", jobId, e.getClass().getName(), e);
      finish(jobId, current -> current.fail(Instant.now(), messageOf(e)), images.size());
      throw e;
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private CompletableFuture<GenerationResult> dispatch(
      TestPrompt prompt, StartJobRequest request, ResultLocation location) {
    GenerationTask task =
        new GenerationTask(() -> imageGenerator.generate(prompt, request, location));
    try {
      generationExecutor.execute(task);
    } catch (RejectedExecutionException e) {
      task.outcome.completeExceptionally(e);
    }
    return task.outcome;
  }

  private void collect(
      TestPrompt prompt,
      CompletableFuture<GenerationResult> outcome,
      List<GenerationResult> images) {
    try {
      GenerationResult result = outcome.join();
      images.add(result);
      structuredLogger.logItemSucceeded(prompt.id(), result.seed(), result.imageUrl());
    } catch (CompletionException | CancellationException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      structuredLogger.logItemFailed(prompt.id(), cause);
    }
  }

  private void advanceProgress(String jobId) {
    jobRepository
        .mutate(jobId, TestSuiteJob::advanceProgress)
        .filter(TestSuiteJob::isRunning)
        .ifPresent(updated -> eventChannel.publish(jobId, updated));
  }

  private void finish(String jobId, UnaryOperator<TestSuiteJob> transition, int images) {
    AtomicBoolean changed = new AtomicBoolean();
    jobRepository
        .mutate(
            jobId,
            current -> {
              TestSuiteJob next = transition.apply(current);
              changed.set(next != current);
              return next;
            })
        .filter(updated -> changed.get())
        .ifPresent(
            updated -> {
              structuredLogger.logJobFinished(
                  jobId,
                  updated.status().wireName(),
                  updated.progress().current(),
                  updated.progress().total(),
                  images);
              eventChannel.publish(jobId, updated);
            });
  }

  private boolean isRunning(String jobId) {
    return jobRepository.findById(jobId).map(TestSuiteJob::isRunning).orElse(false);
  }

  private static ResultBundle bundle(StartJobRequest request, List<GenerationResult> images) {
    TestSuite suite = request.suite();
    return new ResultBundle(
        suite.id(),
        suite.name(),
        request.styleId(),
        request.settings().styleName(),
        request.trainedModel().id(),
        request.trainedModel().name(),
        Instant.now(),
        request.settings().snapshot(),
        images);
  }

  /** One generation call, interrupted if it outlives its deadline. */
  private final class GenerationTask implements Runnable {

    private final Supplier<GenerationResult> call;
    private final CompletableFuture<GenerationResult> outcome = new CompletableFuture<>();

    // guarded by this; set only while the call runs
    private Thread worker;

    GenerationTask(Supplier<GenerationResult> call) {
      this.call = call;
      outcome.whenComplete(
          (result, error) -> {
            if (error instanceof TimeoutException) {
              interruptWorker();
            }
          });
    }

    @Override
    public void run() {
      synchronized (this) {
        if (outcome.isDone()) {
          return;
        }
        worker = Thread.currentThread();
      }
      outcome.orTimeout(itemTimeout.toMillis(), TimeUnit.MILLISECONDS);
      try {
        outcome.complete(call.get());
      } catch (Throwable e) {
        outcome.completeExceptionally(e);
      } finally {
        synchronized (this) {
          worker = null;
          // a late interrupt must not leak into the next task on this thread
          Thread.interrupted();
        }
      }
    }

    private synchronized void interruptWorker() {
      if (worker != null) {
        worker.interrupt();
      }
    }
  }

  private static String messageOf(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
  }
}
