package com.scholary.testsuite.scheduler;

import com.scholary.testsuite.api.StartJobRequest;
import com.scholary.testsuite.generation.GenerationClient;
import com.scholary.testsuite.generation.GenerationRequest;
import com.scholary.testsuite.storage.GenerationResult;
import com.scholary.testsuite.storage.ResultLocation;
import com.scholary.testsuite.suite.GenerationSettings;
import com.scholary.testsuite.suite.TestPrompt;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs one work item: resolves the seed, composes the prompt, generates the image and copies it
 * into result storage.
 */
@Component
public class TestImageGenerator {

  static final int RANDOM_SEED_BOUND = 1_000_000;

  private final GenerationClient generationClient;
  private final LongSupplier seedSource;

  @Autowired
  public TestImageGenerator(GenerationClient generationClient) {
    this(generationClient, () -> ThreadLocalRandom.current().nextInt(RANDOM_SEED_BOUND));
  }

  TestImageGenerator(GenerationClient generationClient, LongSupplier seedSource) {
    this.generationClient = generationClient;
    this.seedSource = seedSource;
  }

  /**
   * Generate and store the image for one prompt.
   *
   * @throws RuntimeException any failure of the generate or materialize step
   */
  public GenerationResult generate(
      TestPrompt prompt, StartJobRequest request, ResultLocation location) {
    GenerationSettings settings = request.settings();
    long seed = resolveSeed(settings);
    String fullPrompt = composePrompt(settings.frontpad(), prompt.prompt(), settings.backpad());

    String imageUrl =
        generationClient.generate(
            new GenerationRequest(
                prompt.id(),
                fullPrompt,
                seed,
                request.styleId(),
                settings,
                request.trainedModel()));
    String localUrl = generationClient.materialize(location, prompt.id(), imageUrl);

    return new GenerationResult(
        prompt.id(),
        prompt.prompt(),
        prompt.category(),
        prompt.description(),
        localUrl,
        fullPrompt,
        settings.frontpad(),
        settings.backpad(),
        seed,
        Instant.now());
  }

  long resolveSeed(GenerationSettings settings) {
    return settings.seedLocked() ? settings.seed() : seedSource.getAsLong();
  }

  static String composePrompt(String frontpad, String prompt, String backpad) {
    return (frontpad + " " + prompt + " " + backpad).trim();
  }
}
