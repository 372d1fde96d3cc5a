package com.codeheadsystems.bulwark.access.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Holds when an attribute equals the expected value.
 *
 * @param name   the attribute name
 * @param value  the expected value
 * @param source where to read the attribute; request context by default
 */
public record AttributeMatchCondition(@JsonProperty("name") String name,
                                      @JsonProperty("value") String value,
                                      @JsonProperty("source") Source source) implements Condition {

  /**
   * Attribute source.
   */
  public enum Source {
    @JsonProperty("context")
    CONTEXT,
    @JsonProperty("subject")
    SUBJECT
  }

  /**
   * Instantiates a new Attribute match condition.
   */
  public AttributeMatchCondition {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Missing required field: name");
    }
    source = source == null ? Source.CONTEXT : source;
  }

  @Override
  public boolean test(EvaluationContext context) {
    Map<String, String> attributes = source == Source.SUBJECT
        ? context.subjectAttributes()
        : context.requestAttributes();
    String actual = attributes.get(name);
    return actual != null && actual.equals(value);
  }
}
