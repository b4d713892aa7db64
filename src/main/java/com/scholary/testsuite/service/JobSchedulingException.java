package com.scholary.testsuite.service;

/** Thrown when a new job cannot be handed to the job executor. */
public class JobSchedulingException extends RuntimeException {

  public JobSchedulingException(String message, Throwable cause) {
    super(message, cause);
  }
}
