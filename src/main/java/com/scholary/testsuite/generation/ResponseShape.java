package com.scholary.testsuite.generation;

import com.fasterxml.jackson.core.JsonPointer;

/**
 * Known places an image reference can appear in a generation response, in decoding priority.
 *
 * <p>The generator wraps its output differently depending on the worker version and on whether
 * the job ran synchronously. Each location holds either a URL string or an object with a
 * {@code url} field.
 */
public enum ResponseShape {
  JOB_RESULTS("/output/job_results/images/0"),
  NESTED_OUTPUT("/output/output/images/0"),
  OUTPUT_IMAGES("/output/images/0"),
  MESSAGE_IMAGES("/output/message/images/0"),
  SINGLE_IMAGE("/output/image");

  private final JsonPointer pointer;

  ResponseShape(String pointer) {
    this.pointer = JsonPointer.compile(pointer);
  }

  public JsonPointer pointer() {
    return pointer;
  }
}
