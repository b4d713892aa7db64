package com.scholary.testsuite.storage;

/** Thrown when a result bundle or image cannot be written or read. */
public class ResultStoreException extends RuntimeException {

  public ResultStoreException(String message) {
    super(message);
  }

  public ResultStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
