package com.scholary.testsuite.generation;

/**
 * Exception thrown when generating or materializing an image fails.
 *
 * <p>Covers transport errors that outlived the retries, non-retryable HTTP statuses, and responses
 * that carry no image reference.
 */
public class GenerationException extends RuntimeException {

  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
