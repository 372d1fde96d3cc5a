package com.codeheadsystems.bulwark.access.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Set;

/**
 * A runtime policy granting actions on every resource matching a pattern.
 *
 * @param id              the id
 * @param name            the name
 * @param description     the description
 * @param resourcePattern glob, or {@code regex:} followed by a regular expression
 * @param allowedActions  the granted actions
 * @param conditions      conditions that must all hold
 * @param priority        higher priorities are listed first among matches
 * @param active          inactive policies are skipped
 */
public record DynamicPolicy(@JsonProperty("id") String id,
                            @JsonProperty("name") String name,
                            @JsonProperty("description") String description,
                            @JsonProperty("resourcePattern") String resourcePattern,
                            @JsonProperty("allowedActions") Set<String> allowedActions,
                            @JsonProperty("conditions") List<Condition> conditions,
                            @JsonProperty("priority") int priority,
                            @JsonProperty("active") boolean active) {

  /**
   * Instantiates a new Dynamic policy. The resource pattern is validated eagerly.
   */
  public DynamicPolicy {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Missing required field: id");
    }
    ResourcePattern.compile(resourcePattern);
    name = name == null ? id : name;
    description = description == null ? "" : description;
    allowedActions = allowedActions == null ? Set.of() : Set.copyOf(allowedActions);
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
  }
}
