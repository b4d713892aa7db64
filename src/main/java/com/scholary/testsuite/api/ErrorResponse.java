package com.scholary.testsuite.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Error body returned by every failing endpoint. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String details) {

  public static ErrorResponse of(String error) {
    return new ErrorResponse(error, null);
  }
}
