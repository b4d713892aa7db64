package com.scholary.testsuite.suite;

import jakarta.validation.constraints.NotBlank;

/**
 * Reference to a fine-tuned adapter (LoRA) produced by a training run.
 *
 * <p>The adapter is opaque to this service: only its download URL is forwarded to the generator.
 */
public record TrainedModel(@NotBlank String id, String name, @NotBlank String loraUrl) {

  /** File name the generator uses to cache the adapter, derived from the URL. */
  public String loraFilename() {
    int slash = loraUrl.lastIndexOf('/');
    String name = slash >= 0 ? loraUrl.substring(slash + 1) : loraUrl;
    return name.isEmpty() ? "trained_model.safetensors" : name;
  }
}
