package com.scholary.testsuite.storage;

/** Thrown when a requested result bundle does not exist. */
public class ResultNotFoundException extends ResultStoreException {

  public ResultNotFoundException(String styleId, String resultId) {
    super(String.format("Test result not found: styleId=%s, resultId=%s", styleId, resultId));
  }
}
