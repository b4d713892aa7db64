package com.scholary.testsuite.suite;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/** An ordered list of prompts run against one trained model. */
public record TestSuite(
    @NotBlank String id, String name, @NotNull List<@Valid @NotNull TestPrompt> prompts) {

  public TestSuite {
    prompts = prompts == null ? null : List.copyOf(prompts);
  }
}
