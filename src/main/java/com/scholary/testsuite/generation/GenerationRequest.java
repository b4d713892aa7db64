package com.scholary.testsuite.generation;

import com.scholary.testsuite.suite.GenerationSettings;
import com.scholary.testsuite.suite.TrainedModel;

/**
 * Everything the generator needs for one image.
 *
 * @param promptId work item the image belongs to, for logging
 * @param prompt fully composed prompt (front pad, item prompt, back pad)
 * @param seed resolved seed
 * @param styleId style the result is filed under
 * @param settings sampler, steps, guidance, resolution and adapter weight
 * @param model adapter to apply
 */
public record GenerationRequest(
    String promptId,
    String prompt,
    long seed,
    String styleId,
    GenerationSettings settings,
    TrainedModel model) {}
