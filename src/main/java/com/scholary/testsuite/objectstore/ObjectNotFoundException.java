package com.scholary.testsuite.objectstore;

/** The requested object does not exist. */
public class ObjectNotFoundException extends ObjectStoreException {

  public ObjectNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
