package com.codeheadsystems.bulwark.access.policy;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A programmatic condition. Not serializable; register it from code.
 */
public final class CustomCondition implements Condition {

  private final String name;
  private final Predicate<EvaluationContext> predicate;

  /**
   * Instantiates a new Custom condition.
   *
   * @param name      a name for logs
   * @param predicate the predicate
   */
  public CustomCondition(String name, Predicate<EvaluationContext> predicate) {
    this.name = Objects.requireNonNull(name, "name");
    this.predicate = Objects.requireNonNull(predicate, "predicate");
  }

  public String name() {
    return name;
  }

  @Override
  public boolean test(EvaluationContext context) {
    return predicate.test(context);
  }

  @Override
  public String toString() {
    return "CustomCondition{" + name + "}";
  }
}
