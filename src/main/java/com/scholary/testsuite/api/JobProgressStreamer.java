package com.scholary.testsuite.api;

import com.scholary.testsuite.config.TestSuiteProperties;
import com.scholary.testsuite.event.JobEventChannel;
import com.scholary.testsuite.job.JobNotFoundException;
import com.scholary.testsuite.job.JobRepository;
import com.scholary.testsuite.job.TestSuiteJob;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Opens Server-Sent Event streams of job snapshots.
 *
 * <p>A stream starts with the job's current snapshot, then forwards every published snapshot in
 * order, and is closed by the server right after a terminal snapshot. A client disconnect or a
 * failed write releases the subscription.
 */
@Component
public class JobProgressStreamer {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobProgressStreamer.class);

  private final JobRepository jobRepository;
  private final JobEventChannel eventChannel;
  private final long timeoutMs;

  public JobProgressStreamer(
      JobRepository jobRepository, JobEventChannel eventChannel, TestSuiteProperties properties) {
    this.jobRepository = jobRepository;
    this.eventChannel = eventChannel;
    this.timeoutMs = Duration.ofMinutes(properties.stream().timeoutMinutes()).toMillis();
  }

  /**
   * Open a progress stream for a job.
   *
   * @throws JobNotFoundException if the job is unknown; no stream is opened
   */
  public SseEmitter open(String jobId) {
    if (jobRepository.findById(jobId).isEmpty()) {
      throw new JobNotFoundException(jobId);
    }
    SseEmitter emitter = createEmitter(timeoutMs);
    new ProgressStream(jobId, emitter).start();
    return emitter;
  }

  /** Zero means the stream never times out. */
  protected SseEmitter createEmitter(long timeoutMs) {
    return new SseEmitter(timeoutMs);
  }

  private final class ProgressStream {

    private final String jobId;
    private final SseEmitter emitter;
    private volatile JobEventChannel.Subscription subscription;
    private TestSuiteJob lastSent;
    private boolean closed;

    private ProgressStream(String jobId, SseEmitter emitter) {
      this.jobId = jobId;
      this.emitter = emitter;
    }

    private void start() {
      emitter.onCompletion(this::release);
      emitter.onTimeout(
          () -> {
            LOGGER.debug("Progress stream for job {} timed out", jobId);
            close();
          });
      emitter.onError(error -> release());

      synchronized (this) {
        // Subscribe before reading so no snapshot falls between the read and the subscription.
        subscription = eventChannel.subscribe(jobId, this::push);
        TestSuiteJob current = jobRepository.findById(jobId).orElse(null);
        if (current == null) {
          close();
          return;
        }
        push(current);
      }
    }

    private synchronized void push(TestSuiteJob job) {
      if (closed || isStale(job)) {
        return;
      }
      try {
        emitter.send(SseEmitter.event().data(job, MediaType.APPLICATION_JSON));
        lastSent = job;
      } catch (IOException e) {
        LOGGER.debug("Progress stream for job {} lost its client: {}", jobId, e.getMessage());
        closed = true;
        release();
        emitter.completeWithError(e);
        return;
      }
      if (!job.isRunning()) {
        close();
      }
    }

    /** A snapshot published before the initial read can arrive after it. */
    private boolean isStale(TestSuiteJob job) {
      if (lastSent == null) {
        return false;
      }
      return job.isRunning() && job.progress().current() < lastSent.progress().current();
    }

    private synchronized void close() {
      if (closed) {
        return;
      }
      closed = true;
      release();
      emitter.complete();
    }

    private void release() {
      JobEventChannel.Subscription current = subscription;
      if (current != null) {
        current.unsubscribe();
      }
    }
  }
}
