package com.scholary.testsuite.event;

import com.scholary.testsuite.job.TestSuiteJob;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-job publish/subscribe registry for job snapshots.
 *
 * <p>Delivery is synchronous on the publisher's thread, in registration order. Nothing is buffered:
 * a subscriber only sees snapshots published after it subscribed, so observers that need the
 * current state must read it from the job store themselves.
 *
 * <p>Handlers are removed only through the {@link Subscription} returned by {@link #subscribe}.
 */
@Component
public class JobEventChannel {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobEventChannel.class);

  private final Map<String, List<Listener>> listeners = new ConcurrentHashMap<>();

  /**
   * Deliver a snapshot to every current subscriber of the job.
   *
   * <p>A failing handler is logged and skipped; it never reaches the publisher.
   */
  public void publish(String jobId, TestSuiteJob job) {
    List<Listener> current = listeners.get(jobId);
    if (current == null) {
      return;
    }
    for (Listener listener : current) {
      try {
        listener.handler.accept(job);
      } catch (RuntimeException e) {
        LOGGER.warn("Subscriber of job {} failed to handle update: {}", jobId, e.getMessage(), e);
      }
    }
  }

  /**
   * Register a handler for a job's snapshots.
   *
   * @return the subscription; call {@link Subscription#unsubscribe()} to stop receiving updates
   */
  public Subscription subscribe(String jobId, Consumer<TestSuiteJob> handler) {
    Listener listener = new Listener(handler);
    listeners.compute(
        jobId,
        (id, existing) -> {
          List<Listener> list = existing != null ? existing : new CopyOnWriteArrayList<>();
          list.add(listener);
          return list;
        });
    return new Subscription(jobId, listener);
  }

  public int subscriberCount(String jobId) {
    List<Listener> current = listeners.get(jobId);
    return current == null ? 0 : current.size();
  }

  private void remove(String jobId, Listener listener) {
    listeners.computeIfPresent(
        jobId,
        (id, list) -> {
          list.remove(listener);
          return list.isEmpty() ? null : list;
        });
  }

  private static final class Listener {
    private final Consumer<TestSuiteJob> handler;

    private Listener(Consumer<TestSuiteJob> handler) {
      this.handler = handler;
    }
  }

  /** Handle for one registered handler. Unsubscribing more than once is a no-op. */
  public final class Subscription {

    private final String jobId;
    private final Listener listener;
    private final AtomicBoolean active = new AtomicBoolean(true);

    private Subscription(String jobId, Listener listener) {
      this.jobId = jobId;
      this.listener = listener;
    }

    public void unsubscribe() {
      if (active.compareAndSet(true, false)) {
        remove(jobId, listener);
      }
    }

    public boolean isActive() {
      return active.get();
    }
  }
}
