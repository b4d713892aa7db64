package com.scholary.testsuite.generation;

import com.scholary.testsuite.storage.ResultLocation;

/**
 * Remote image generation.
 *
 * <p>Implementations own transport concerns (timeouts, retries, response decoding). Callers see
 * either a reference or a {@link GenerationException}.
 */
public interface GenerationClient {

  /**
   * Generate one image.
   *
   * @return the generator's reference to the image (usually a URL)
   * @throws GenerationException if generation fails or the response has no image reference
   */
  String generate(GenerationRequest request);

  /**
   * Copy a generated image into result storage.
   *
   * @param location the result the image belongs to
   * @param promptId the work item the image was generated for
   * @param imageReference the reference returned by {@link #generate}
   * @return the stable local reference to store in the result
   * @throws GenerationException if the image cannot be fetched
   */
  String materialize(ResultLocation location, String promptId, String imageReference);
}
