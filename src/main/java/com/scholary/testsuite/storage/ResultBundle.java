package com.scholary.testsuite.storage;

import com.scholary.testsuite.suite.GenerationSettings.SettingsSnapshot;
import java.time.Instant;
import java.util.List;

/**
 * Cumulative output of a job, persisted as {@code result.json}.
 *
 * <p>Rewritten after every batch, so a stored bundle may be incomplete while its job is running.
 */
public record ResultBundle(
    String suiteId,
    String suiteName,
    String styleId,
    String styleName,
    String modelId,
    String modelName,
    Instant timestamp,
    SettingsSnapshot settings,
    List<GenerationResult> images) {

  public ResultBundle {
    images = images == null ? List.of() : List.copyOf(images);
  }
}
