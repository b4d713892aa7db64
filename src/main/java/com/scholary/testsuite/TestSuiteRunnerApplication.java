package com.scholary.testsuite;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Runs adapter test suites as background jobs and streams their progress. */
@SpringBootApplication
public class TestSuiteRunnerApplication {

  public static void main(String[] args) {
    SpringApplication.run(TestSuiteRunnerApplication.class, args);
  }
}
