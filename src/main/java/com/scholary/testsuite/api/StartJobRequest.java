package com.scholary.testsuite.api;

import com.scholary.testsuite.storage.ResultLocation;
import com.scholary.testsuite.suite.GenerationSettings;
import com.scholary.testsuite.suite.TestSuite;
import com.scholary.testsuite.suite.TrainedModel;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Request to run a test suite against a trained model.
 *
 * <p>Validated before any job exists; a request that fails validation creates nothing.
 */
public record StartJobRequest(
    @NotBlank
        @Pattern(regexp = ResultLocation.SEGMENT_PATTERN, message = "must be a single path segment")
        String styleId,
    @NotBlank
        @Pattern(regexp = ResultLocation.SEGMENT_PATTERN, message = "must be a single path segment")
        String suiteId,
    @NotNull @Valid TestSuite suite,
    @NotNull @Valid GenerationSettings settings,
    @NotNull @Valid TrainedModel trainedModel) {}
