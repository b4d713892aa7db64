package com.scholary.testsuite.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Unchecked: the SDK already retries transient failures, so what reaches the caller is usually
 * a configuration or permission problem.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
