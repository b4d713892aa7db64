package com.scholary.testsuite.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for test suite jobs.
 *
 * <p>{@code batchSize} is how many items of one job are generated at the same time. The executor
 * sizes bound how many jobs run and how many generation calls are in flight across all jobs.
 */
@ConfigurationProperties(prefix = "testsuite")
@Validated
public record TestSuiteProperties(
    @Positive int batchSize,
    @Positive int itemTimeoutSeconds,
    @Positive int jobExecutorThreads,
    @Positive int jobExecutorQueueSize,
    @Positive int generationExecutorThreads,
    @NotNull @Valid JobsProperties jobs,
    @NotNull @Valid StreamProperties stream) {

  /** Finished jobs are dropped from memory this long after their last update. */
  public record JobsProperties(@Positive int retentionMinutes) {}

  /** Progress streams are closed by the server after this long; 0 disables the timeout. */
  public record StreamProperties(@PositiveOrZero int timeoutMinutes) {}
}
