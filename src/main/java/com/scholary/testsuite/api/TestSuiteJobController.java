package com.scholary.testsuite.api;

import com.scholary.testsuite.job.TestSuiteJob;
import com.scholary.testsuite.service.TestSuiteJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API for test suite jobs.
 *
 * <p>Jobs run in the background: start returns the job id immediately, and clients either poll
 * the job or follow its progress stream.
 */
@RestController
@RequestMapping("/api/test-suite")
@Tag(name = "Test Suites", description = "Run test suites against trained models")
public class TestSuiteJobController {

  private final TestSuiteJobService jobService;
  private final JobProgressStreamer progressStreamer;

  public TestSuiteJobController(
      TestSuiteJobService jobService, JobProgressStreamer progressStreamer) {
    this.jobService = jobService;
    this.progressStreamer = progressStreamer;
  }

  @PostMapping("/start")
  @Operation(
      summary = "Start a test suite job",
      description = "Validate the request, register a job and start generating in the background")
  public ResponseEntity<JobStartedResponse> start(@Valid @RequestBody StartJobRequest request) {
    TestSuiteJob job = jobService.start(request);
    return ResponseEntity.accepted().body(JobStartedResponse.started(job.id()));
  }

  @GetMapping("/job/{id}")
  @Operation(summary = "Get job status", description = "Current snapshot of a test suite job")
  public TestSuiteJob getJob(@PathVariable("id") String id) {
    return jobService.get(id);
  }

  @PostMapping("/job/{id}/cancel")
  @Operation(
      summary = "Cancel a job",
      description =
          "Stop a running job after its current batch. Finished jobs are returned unchanged.")
  public TestSuiteJob cancel(@PathVariable("id") String id) {
    return jobService.cancel(id);
  }

  @GetMapping("/job/{id}/progress")
  @Operation(
      summary = "Stream job progress",
      description =
          "Server-Sent Events: the current snapshot, then every update until the job finishes")
  public SseEmitter progress(@PathVariable("id") String id) {
    return progressStreamer.open(id);
  }
}
