package com.scholary.testsuite.api;

/** Returned when a job has been created and handed to the scheduler. */
public record JobStartedResponse(String jobId, String status) {

  public static JobStartedResponse started(String jobId) {
    return new JobStartedResponse(jobId, "started");
  }
}
