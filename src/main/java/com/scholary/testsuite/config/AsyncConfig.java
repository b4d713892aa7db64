package com.scholary.testsuite.config;

import com.scholary.testsuite.logging.MdcTaskDecorator;
import java.util.concurrent.Executor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for background job execution.
 *
 * <p>Two bounded pools: one thread per running job drives its batches, and a shared pool runs the
 * individual generation calls. Generation tasks inherit the job's MDC context.
 */
@Configuration
@EnableConfigurationProperties(TestSuiteProperties.class)
public class AsyncConfig {

  @Bean(name = "jobExecutor")
  public Executor jobExecutor(TestSuiteProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.jobExecutorThreads());
    executor.setMaxPoolSize(properties.jobExecutorThreads());
    executor.setQueueCapacity(properties.jobExecutorQueueSize());
    executor.setThreadNamePrefix("testsuite-job-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "generationExecutor")
  public Executor generationExecutor(TestSuiteProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.generationExecutorThreads());
    executor.setMaxPoolSize(properties.generationExecutorThreads());
    executor.setThreadNamePrefix("testsuite-gen-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }
}
