package com.scholary.testsuite.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.testsuite.objectstore.ObjectStoreClient;
import com.scholary.testsuite.objectstore.ObjectStoreProperties;
import com.scholary.testsuite.objectstore.S3ObjectStoreClient;
import com.scholary.testsuite.storage.FileSystemResultStore;
import com.scholary.testsuite.storage.ResultStore;
import com.scholary.testsuite.storage.ResultStoreProperties;
import com.scholary.testsuite.storage.S3ResultStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for result persistence.
 *
 * <p>{@code results.backend=filesystem} (the default) keeps results under a local directory;
 * {@code results.backend=s3} stores them in a bucket and binds the objectstore.* properties.
 */
@Configuration
@EnableConfigurationProperties(ResultStoreProperties.class)
public class ResultStoreConfig {

  @Bean
  @ConditionalOnProperty(name = "results.backend", havingValue = "filesystem", matchIfMissing = true)
  public ResultStore fileSystemResultStore(
      ResultStoreProperties properties, ObjectMapper objectMapper) {
    return new FileSystemResultStore(properties, objectMapper);
  }

  @Configuration
  @ConditionalOnProperty(name = "results.backend", havingValue = "s3")
  @EnableConfigurationProperties(ObjectStoreProperties.class)
  static class S3Backend {

    @Bean(destroyMethod = "close")
    public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
      return new S3ObjectStoreClient(properties);
    }

    @Bean
    public ResultStore s3ResultStore(
        ObjectStoreClient objectStoreClient,
        ObjectStoreProperties objectStoreProperties,
        ResultStoreProperties properties,
        ObjectMapper objectMapper) {
      return new S3ResultStore(
          objectStoreClient, objectMapper, objectStoreProperties.bucket(), properties.s3Prefix());
    }
  }
}
