package com.scholary.testsuite.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts event fields into the MDC for the duration of one log call, so they show up
 * as queryable fields in the JSON log pipeline. Job context is set once per scheduler run.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log batch dispatch. */
  public void logBatchStarted(String jobId, int batchIndex, int batchSize, int firstItem) {
    try {
      MDC.put("event_type", "batch_started");
      MDC.put("batch_index", String.valueOf(batchIndex));
      MDC.put("batch_size", String.valueOf(batchSize));

      logger.info(
          "Batch started: jobId={}, batch={}, items={}, firstItem={}",
          jobId,
          batchIndex,
          batchSize,
          firstItem);
    } finally {
      clearEventFields();
    }
  }

  /** Log a generated and stored image. */
  public void logItemSucceeded(String promptId, long seed, String imageUrl) {
    try {
      MDC.put("event_type", "item_succeeded");
      MDC.put("prompt_id", promptId);
      MDC.put("seed", String.valueOf(seed));

      logger.info("Generated {}: seed={}, image={}", promptId, seed, imageUrl);
    } finally {
      clearEventFields();
    }
  }

  /** Log an item that produced no image. The job carries on. */
  public void logItemFailed(String promptId, Throwable error) {
    try {
      MDC.put("event_type", "item_failed");
      MDC.put("prompt_id", promptId);
      MDC.put("errorType", error.getClass().getSimpleName());

      logger.warn("Failed {}: {}", promptId, error.getMessage(), error);
    } finally {
      clearEventFields();
    }
  }

  /** Log a generation call retry. */
  public void logGenerationRetry(
      String promptId, String operation, int attempt, int maxRetries, long backoffMs, String error) {
    try {
      MDC.put("event_type", "generation_retry");
      MDC.put("prompt_id", promptId);
      MDC.put("operation", operation);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));

      logger.warn(
          "Generation retry: prompt={}, operation={}, attempt={}/{}, backoff={}ms, error={}",
          promptId,
          operation,
          attempt,
          maxRetries,
          backoffMs,
          error);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress. */
  public void logJobProgress(String jobId, int current, int total, int images) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("itemsProcessed", String.valueOf(current));
      MDC.put("totalItems", String.valueOf(total));
      MDC.put("images", String.valueOf(images));

      logger.info("Job progress: jobId={}, items={}/{}, images={}", jobId, current, total, images);
    } finally {
      clearEventFields();
    }
  }

  /** Log the terminal state of a job. */
  public void logJobFinished(String jobId, String status, int current, int total, int images) {
    try {
      MDC.put("event_type", "job_finished");
      MDC.put("status", status);
      MDC.put("itemsProcessed", String.valueOf(current));
      MDC.put("totalItems", String.valueOf(total));
      MDC.put("images", String.valueOf(images));

      logger.info(
          "Job finished: jobId={}, status={}, items={}/{}, images={}",
          jobId,
          status,
          current,
          total,
          images);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String styleId, String suiteId) {
    MDC.put("jobId", jobId);
    MDC.put("styleId", styleId);
    MDC.put("suiteId", suiteId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("styleId");
    MDC.remove("suiteId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("batch_index");
    MDC.remove("batch_size");
    MDC.remove("prompt_id");
    MDC.remove("seed");
    MDC.remove("errorType");
    MDC.remove("operation");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
    MDC.remove("itemsProcessed");
    MDC.remove("totalItems");
    MDC.remove("images");
    MDC.remove("status");
  }
}
