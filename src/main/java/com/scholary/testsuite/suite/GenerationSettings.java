package com.scholary.testsuite.suite;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Generation parameters shared by every item of a job.
 *
 * <p>Optional numeric fields fall back to the generator's usual defaults. The seed is only
 * required when it is locked; otherwise each item draws its own.
 */
public record GenerationSettings(
    String styleId,
    String styleName,
    @NotNull @Positive Integer steps,
    Double cfg,
    Double denoise,
    Double guidance,
    @NotNull @Positive Integer width,
    @NotNull @Positive Integer height,
    @NotBlank String samplerName,
    @NotBlank String schedulerName,
    Double loraWeight,
    Long seed,
    Boolean seedLocked,
    String frontpad,
    String backpad) {

  public GenerationSettings {
    if (cfg == null) {
      cfg = 1.0;
    }
    if (denoise == null) {
      denoise = 1.0;
    }
    if (guidance == null) {
      guidance = 3.5;
    }
    if (loraWeight == null) {
      loraWeight = 1.0;
    }
    if (seedLocked == null) {
      seedLocked = false;
    }
    if (frontpad == null) {
      frontpad = "";
    }
    if (backpad == null) {
      backpad = "";
    }
  }

  @JsonIgnore
  @AssertTrue(message = "seed is required when seedLocked is true")
  public boolean isSeedResolvable() {
    return !seedLocked || seed != null;
  }

  /** The subset of settings recorded alongside every result bundle. */
  public SettingsSnapshot snapshot() {
    return new SettingsSnapshot(
        steps,
        cfg,
        denoise,
        guidance,
        width,
        height,
        samplerName,
        schedulerName,
        loraWeight,
        seed);
  }

  public record SettingsSnapshot(
      Integer steps,
      Double cfg,
      Double denoise,
      Double guidance,
      Integer width,
      Integer height,
      String samplerName,
      String schedulerName,
      Double loraWeight,
      Long seed) {}
}
