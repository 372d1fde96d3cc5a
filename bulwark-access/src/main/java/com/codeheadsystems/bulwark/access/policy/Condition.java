package com.codeheadsystems.bulwark.access.policy;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A predicate over the evaluation context. Serialized with a {@code type} tag.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TimeRangeCondition.class, name = "time_range"),
    @JsonSubTypes.Type(value = IpRangeCondition.class, name = "ip_range"),
    @JsonSubTypes.Type(value = AttributeMatchCondition.class, name = "attribute_match")
})
public interface Condition {

  /**
   * Evaluates the condition.
   *
   * @param context the context
   * @return true if the condition holds
   * @throws RuntimeException if the condition cannot be evaluated; callers deny
   */
  boolean test(EvaluationContext context);
}
