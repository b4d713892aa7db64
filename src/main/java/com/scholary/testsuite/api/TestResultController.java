package com.scholary.testsuite.api;

import com.scholary.testsuite.storage.ResultBundle;
import com.scholary.testsuite.storage.ResultStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Read access to persisted test suite results. */
@RestController
@RequestMapping("/api")
@Tag(name = "Test Results", description = "Browse stored test suite results")
public class TestResultController {

  private final ResultStore resultStore;

  public TestResultController(ResultStore resultStore) {
    this.resultStore = resultStore;
  }

  @GetMapping("/list-test-results/{styleId}")
  @Operation(summary = "List results of a style", description = "Stored results, newest first")
  public TestResultsResponse listResults(@PathVariable("styleId") String styleId) {
    return new TestResultsResponse(resultStore.listResults(styleId));
  }

  @GetMapping("/load-test-result")
  @Operation(summary = "Load one result", description = "The stored bundle of a single result")
  public ResultBundle loadResult(
      @RequestParam("styleId") String styleId, @RequestParam("resultId") String resultId) {
    return resultStore.loadResult(styleId, resultId);
  }
}
