package com.scholary.testsuite.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.testsuite.TestFixtures;
import com.scholary.testsuite.job.JobNotFoundException;
import com.scholary.testsuite.job.TestSuiteJob;
import com.scholary.testsuite.service.JobSchedulingException;
import com.scholary.testsuite.service.TestSuiteJobService;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@WebMvcTest(TestSuiteJobController.class)
class TestSuiteJobControllerTest {

  private static final Instant STARTED = Instant.parse("2024-05-01T10:00:00Z");

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;

  @MockBean private TestSuiteJobService jobService;
  @MockBean private JobProgressStreamer progressStreamer;

  private final TestSuiteJob job =
      TestSuiteJob.start("test-1-abcd1234", "style-1", "suite-1", 2, "suite-1_r1", STARTED);

  @Test
  void start_returnsAcceptedWithJobId() throws Exception {
    when(jobService.start(any())).thenReturn(job);

    mockMvc
        .perform(
            post("/api/test-suite/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(TestFixtures.request(2))))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("test-1-abcd1234"))
        .andExpect(jsonPath("$.status").value("started"));
  }

  @Test
  void start_missingStyleId_isRejectedBeforeAnyJobExists() throws Exception {
    ObjectNode body = objectMapper.valueToTree(TestFixtures.request(2));
    body.remove("styleId");

    mockMvc
        .perform(
            post("/api/test-suite/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body.toString()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid request"))
        .andExpect(jsonPath("$.details").value(containsString("styleId")));

    verify(jobService, never()).start(any());
  }

  @Test
  void start_styleIdWithSeparator_isRejectedBeforeAnyJobExists() throws Exception {
    ObjectNode body = objectMapper.valueToTree(TestFixtures.request(2));
    body.put("styleId", "a/b");

    mockMvc
        .perform(
            post("/api/test-suite/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body.toString()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid request"))
        .andExpect(jsonPath("$.details").value(containsString("must be a single path segment")));

    verify(jobService, never()).start(any());
  }

  @Test
  void start_promptWithoutText_isRejected() throws Exception {
    ObjectNode body = objectMapper.valueToTree(TestFixtures.request(2));
    ((ObjectNode) body.at("/suite/prompts/1")).remove("prompt");

    mockMvc
        .perform(
            post("/api/test-suite/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body.toString()))
        .andExpect(status().isBadRequest());

    verify(jobService, never()).start(any());
  }

  @Test
  void start_lockedSeedWithoutValue_isRejected() throws Exception {
    ObjectNode body = objectMapper.valueToTree(TestFixtures.request(2));
    ((ObjectNode) body.get("settings")).put("seedLocked", true).remove("seed");

    mockMvc
        .perform(
            post("/api/test-suite/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body.toString()))
        .andExpect(status().isBadRequest());

    verify(jobService, never()).start(any());
  }

  @Test
  void start_malformedJson_isRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/test-suite/start").contentType(MediaType.APPLICATION_JSON).content("{oops"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Malformed request body"));
  }

  @Test
  void start_executorSaturated_isServiceUnavailable() throws Exception {
    when(jobService.start(any()))
        .thenThrow(
            new JobSchedulingException(
                "Too many test suite jobs queued, try again later",
                new RejectedExecutionException()));

    mockMvc
        .perform(
            post("/api/test-suite/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(TestFixtures.request(1))))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.error").value("Too many test suite jobs queued, try again later"));
  }

  @Test
  void getJob_returnsSnapshot() throws Exception {
    when(jobService.get("test-1-abcd1234")).thenReturn(job.advanceProgress());

    mockMvc
        .perform(get("/api/test-suite/job/test-1-abcd1234"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value("test-1-abcd1234"))
        .andExpect(jsonPath("$.status").value("running"))
        .andExpect(jsonPath("$.progress.current").value(1))
        .andExpect(jsonPath("$.progress.total").value(2))
        .andExpect(jsonPath("$.startedAt").value("2024-05-01T10:00:00Z"))
        .andExpect(jsonPath("$.resultId").value("suite-1_r1"));
  }

  @Test
  void getJob_unknown_isNotFound() throws Exception {
    when(jobService.get("nope")).thenThrow(new JobNotFoundException("nope"));

    mockMvc
        .perform(get("/api/test-suite/job/nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Job not found: nope"));
  }

  @Test
  void cancel_returnsSnapshot() throws Exception {
    when(jobService.cancel("test-1-abcd1234")).thenReturn(job.cancel(STARTED.plusSeconds(5)));

    mockMvc
        .perform(post("/api/test-suite/job/test-1-abcd1234/cancel"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("cancelled"))
        .andExpect(jsonPath("$.completedAt").value("2024-05-01T10:00:05Z"));
  }

  @Test
  void progress_streamsSnapshotsAsServerSentEvents() throws Exception {
    SseEmitter emitter = new SseEmitter(0L);
    when(progressStreamer.open("test-1-abcd1234")).thenReturn(emitter);

    MvcResult result =
        mockMvc
            .perform(get("/api/test-suite/job/test-1-abcd1234/progress"))
            .andExpect(request().asyncStarted())
            .andReturn();

    emitter.send(SseEmitter.event().data(job, MediaType.APPLICATION_JSON));
    emitter.complete();

    assertThat(result.getResponse().getContentType()).startsWith("text/event-stream");
    assertThat(result.getResponse().getContentAsString())
        .startsWith("data:{")
        .contains("\"id\":\"test-1-abcd1234\"")
        .contains("\"status\":\"running\"");
  }

  @Test
  void progress_unknownJob_isNotFound() throws Exception {
    when(progressStreamer.open("nope")).thenThrow(new JobNotFoundException("nope"));

    mockMvc
        .perform(get("/api/test-suite/job/nope/progress"))
        .andExpect(status().isNotFound())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON));
  }
}
