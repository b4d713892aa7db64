package com.scholary.testsuite.storage;

import java.time.Instant;

/**
 * Output of one successful work item.
 *
 * <p>{@code imageUrl} is the materialized local reference, not the generator's remote URL.
 */
public record GenerationResult(
    String promptId,
    String prompt,
    String category,
    String description,
    String imageUrl,
    String fullPrompt,
    String frontpad,
    String backpad,
    long seed,
    Instant generatedAt) {}
