package com.scholary.testsuite.config;

import com.scholary.testsuite.generation.GenerationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the generation client.
 *
 * <p>Enables the GenerationProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(GenerationProperties.class)
public class GenerationConfig {}
