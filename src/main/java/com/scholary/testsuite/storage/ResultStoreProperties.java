package com.scholary.testsuite.storage;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for result persistence.
 *
 * <p>{@code backend} selects the filesystem store (default) or the S3 store. {@code rootDir} and
 * {@code publicPrefix} apply to the filesystem store, {@code s3Prefix} to the S3 store.
 */
@ConfigurationProperties(prefix = "results")
@Validated
public record ResultStoreProperties(
    @NotBlank String backend,
    @NotBlank String rootDir,
    @NotBlank String publicPrefix,
    String s3Prefix) {}
