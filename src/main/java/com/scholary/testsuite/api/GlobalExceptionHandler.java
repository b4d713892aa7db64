package com.scholary.testsuite.api;

import com.scholary.testsuite.job.JobNotFoundException;
import com.scholary.testsuite.service.JobSchedulingException;
import com.scholary.testsuite.storage.ResultNotFoundException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps exceptions thrown by the controllers to {@link ErrorResponse} bodies. */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    String details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
            .collect(Collectors.joining(", "));
    LOGGER.warn("Rejected invalid request: {}", details);
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("Invalid request", "Validation failed: " + details));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Rejected unreadable request body: {}", ex.getMessage());
    return ResponseEntity.badRequest()
        .body(
            new ErrorResponse(
                "Malformed request body", "The request body is missing or could not be parsed"));
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    LOGGER.warn("Rejected request without parameter {}", ex.getParameterName());
    return ResponseEntity.badRequest()
        .body(
            new ErrorResponse(
                "Missing required parameter",
                String.format("Required parameter '%s' is missing", ex.getParameterName())));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    LOGGER.warn("Rejected request: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request", ex.getMessage()));
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleJobNotFound(JobNotFoundException ex) {
    LOGGER.debug("Unknown job {}", ex.getJobId());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(ex.getMessage()));
  }

  @ExceptionHandler(ResultNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleResultNotFound(ResultNotFoundException ex) {
    LOGGER.debug(ex.getMessage());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(ex.getMessage()));
  }

  @ExceptionHandler(JobSchedulingException.class)
  public ResponseEntity<ErrorResponse> handleScheduling(JobSchedulingException ex) {
    LOGGER.error("Could not schedule job: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ErrorResponse.of(ex.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
    LOGGER.error("Unexpected error handling request", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse("Internal server error", ex.getClass().getSimpleName()));
  }
}
