package com.scholary.testsuite.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.testsuite.TestFixtures;
import com.scholary.testsuite.storage.GenerationResult;
import com.scholary.testsuite.storage.ResultBundle;
import com.scholary.testsuite.storage.ResultNotFoundException;
import com.scholary.testsuite.storage.ResultStore;
import com.scholary.testsuite.storage.ResultStoreException;
import com.scholary.testsuite.storage.StoredResult;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(TestResultController.class)
class TestResultControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private ResultStore resultStore;

  private static ResultBundle bundle(String timestamp) {
    GenerationResult image =
        new GenerationResult(
            "p1",
            "a fox",
            "animals",
            null,
            "/resources/style_images/style-1/test_results/r1/p1.jpg",
            "a fox",
            "",
            "",
            42L,
            Instant.parse(timestamp));
    return new ResultBundle(
        "suite-1",
        "Portraits",
        "style-1",
        "Watercolor",
        "model-1",
        "Watercolor v1",
        Instant.parse(timestamp),
        TestFixtures.settings().snapshot(),
        List.of(image));
  }

  @Test
  void listResults_flattensBundleNextToId() throws Exception {
    when(resultStore.listResults("style-1"))
        .thenReturn(
            List.of(
                new StoredResult("r2", bundle("2024-05-02T10:00:00Z")),
                new StoredResult("r1", bundle("2024-05-01T10:00:00Z"))));

    mockMvc
        .perform(get("/api/list-test-results/style-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.results.length()").value(2))
        .andExpect(jsonPath("$.results[0].id").value("r2"))
        .andExpect(jsonPath("$.results[0].suiteId").value("suite-1"))
        .andExpect(jsonPath("$.results[0].timestamp").value("2024-05-02T10:00:00Z"))
        .andExpect(jsonPath("$.results[0].images[0].seed").value(42))
        .andExpect(jsonPath("$.results[1].id").value("r1"));
  }

  @Test
  void listResults_noneStored_isEmptyList() throws Exception {
    when(resultStore.listResults("style-2")).thenReturn(List.of());

    mockMvc
        .perform(get("/api/list-test-results/style-2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.results").isEmpty());
  }

  @Test
  void loadResult_returnsBundle() throws Exception {
    when(resultStore.loadResult("style-1", "r1")).thenReturn(bundle("2024-05-01T10:00:00Z"));

    mockMvc
        .perform(get("/api/load-test-result").param("styleId", "style-1").param("resultId", "r1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.modelName").value("Watercolor v1"))
        .andExpect(jsonPath("$.settings.samplerName").value("euler"))
        .andExpect(jsonPath("$.images[0].promptId").value("p1"));
  }

  @Test
  void loadResult_missingParameter_isBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/load-test-result").param("styleId", "style-1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Missing required parameter"));
  }

  @Test
  void loadResult_unknown_isNotFound() throws Exception {
    when(resultStore.loadResult("style-1", "nope"))
        .thenThrow(new ResultNotFoundException("style-1", "nope"));

    mockMvc
        .perform(get("/api/load-test-result").param("styleId", "style-1").param("resultId", "nope"))
        .andExpect(status().isNotFound());
  }

  @Test
  void loadResult_invalidSegment_isBadRequest() throws Exception {
    when(resultStore.loadResult("style-1", ".."))
        .thenThrow(new IllegalArgumentException("resultId is not a valid path segment: .."));

    mockMvc
        .perform(get("/api/load-test-result").param("styleId", "style-1").param("resultId", ".."))
        .andExpect(status().isBadRequest());
  }

  @Test
  void storageFailure_isInternalError() throws Exception {
    when(resultStore.listResults("style-1")).thenThrow(new ResultStoreException("disk gone"));

    mockMvc
        .perform(get("/api/list-test-results/style-1"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("Internal server error"));
  }
}
