package com.scholary.testsuite.event;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.testsuite.job.TestSuiteJob;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class JobEventChannelTest {

  private final JobEventChannel channel = new JobEventChannel();
  private final TestSuiteJob job =
      TestSuiteJob.start("job-1", "style-1", "suite-1", 2, "suite-1_r", Instant.now());

  @Test
  void publish_deliversInRegistrationOrder() {
    List<String> calls = new ArrayList<>();
    channel.subscribe("job-1", j -> calls.add("first"));
    channel.subscribe("job-1", j -> calls.add("second"));

    channel.publish("job-1", job);

    assertThat(calls).containsExactly("first", "second");
  }

  @Test
  void publish_onlyReachesSubscribersOfThatJob() {
    List<TestSuiteJob> received = new ArrayList<>();
    channel.subscribe("job-2", received::add);

    channel.publish("job-1", job);

    assertThat(received).isEmpty();
  }

  @Test
  void publish_isNotBuffered() {
    channel.publish("job-1", job);
    List<TestSuiteJob> received = new ArrayList<>();

    channel.subscribe("job-1", received::add);

    assertThat(received).isEmpty();
  }

  @Test
  void failingHandler_doesNotStopOthers() {
    List<TestSuiteJob> received = new ArrayList<>();
    channel.subscribe(
        "job-1",
        j -> {
          throw new IllegalStateException("client gone");
        });
    channel.subscribe("job-1", received::add);

    channel.publish("job-1", job);

    assertThat(received).containsExactly(job);
  }

  @Test
  void unsubscribe_stopsDeliveryAndIsIdempotent() {
    List<TestSuiteJob> received = new ArrayList<>();
    JobEventChannel.Subscription subscription = channel.subscribe("job-1", received::add);

    subscription.unsubscribe();
    subscription.unsubscribe();
    channel.publish("job-1", job);

    assertThat(received).isEmpty();
    assertThat(subscription.isActive()).isFalse();
    assertThat(channel.subscriberCount("job-1")).isZero();
  }

  @Test
  void unsubscribe_leavesOtherSubscribers() {
    JobEventChannel.Subscription first = channel.subscribe("job-1", j -> {});
    channel.subscribe("job-1", j -> {});

    first.unsubscribe();

    assertThat(channel.subscriberCount("job-1")).isEqualTo(1);
  }
}
