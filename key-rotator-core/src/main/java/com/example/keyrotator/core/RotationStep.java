package com.example.keyrotator.core;

import java.util.Arrays;
import java.util.Optional;

/** The four rotation steps, in the order the orchestrator invokes them. */
public enum RotationStep {
  CREATE_SECRET("createSecret", "create"),
  SET_SECRET("setSecret", "set"),
  TEST_SECRET("testSecret", "test"),
  FINISH_SECRET("finishSecret", "finish");

  private final String value;
  private final String alias;

  RotationStep(final String value, final String alias) {
    this.value = value;
    this.alias = alias;
  }

  /**
   * @return the value the orchestrator sends, e.g. {@code createSecret}
   */
  public String value() {
    return value;
  }

  /**
   * Resolves a step from its wire value or short alias. Matching is case-sensitive.
   *
   * @param step value such as {@code testSecret} or {@code test}
   * @return the step, empty if the value is not recognised
   */
  public static Optional<RotationStep> fromValue(final String step) {
    return Arrays.stream(values())
        .filter(s -> s.value.equals(step) || s.alias.equals(step))
        .findFirst();
  }
}
