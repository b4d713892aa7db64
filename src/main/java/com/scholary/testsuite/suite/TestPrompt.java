package com.scholary.testsuite.suite;

import com.scholary.testsuite.storage.ResultLocation;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * One work item of a test suite.
 *
 * <p>Category and description are not sent to the generator; they are echoed into the result for
 * display. The id names the image file, so it must be a single path segment.
 */
public record TestPrompt(
    @NotBlank
        @Pattern(regexp = ResultLocation.SEGMENT_PATTERN, message = "must be a single path segment")
        String id,
    @NotBlank String prompt,
    String category,
    String description) {}
