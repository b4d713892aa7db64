package com.scholary.testsuite.generation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the image generation client.
 *
 * <p>Timeouts are in seconds, backoff in milliseconds. {@code maxRetries} is the total number of
 * attempts per call. {@code localSourceRoot} is where non-URL image references returned by the
 * generator are resolved.
 */
@ConfigurationProperties(prefix = "generation")
@Validated
public record GenerationProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Positive long initialBackoffMs,
    @Positive long maxBackoffMs,
    @NotBlank String workflowTemplate,
    @NotBlank String baseModelName,
    @NotBlank String localSourceRoot) {}
