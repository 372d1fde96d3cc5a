package com.codeheadsystems.bulwark.access.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Holds when the evaluation time is within {@code [start, end]}, both inclusive.
 *
 * @param start epoch millis
 * @param end   epoch millis
 */
public record TimeRangeCondition(@JsonProperty("start") long start,
                                 @JsonProperty("end") long end) implements Condition {

  /**
   * Instantiates a new Time range condition.
   */
  public TimeRangeCondition {
    if (end < start) {
      throw new IllegalArgumentException("end must not be before start");
    }
  }

  @Override
  public boolean test(EvaluationContext context) {
    return context.timestamp() >= start && context.timestamp() <= end;
  }
}
