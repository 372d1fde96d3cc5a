package com.codeheadsystems.bulwark.access.model;

import com.codeheadsystems.bulwark.access.policy.Condition;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Set;

/**
 * A static grant: a set of actions on exactly one resource, optionally conditional.
 *
 * @param id          the id
 * @param name        the name
 * @param description the description
 * @param resource    the resource, matched by equality
 * @param actions     the granted actions
 * @param conditions  conditions that must all hold
 * @param active      inactive permissions grant nothing
 */
public record Permission(@JsonProperty("id") String id,
                         @JsonProperty("name") String name,
                         @JsonProperty("description") String description,
                         @JsonProperty("resource") String resource,
                         @JsonProperty("actions") Set<String> actions,
                         @JsonProperty("conditions") List<Condition> conditions,
                         @JsonProperty("active") boolean active) {

  /**
   * Instantiates a new Permission.
   */
  public Permission {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Missing required field: id");
    }
    if (resource == null || resource.isBlank()) {
      throw new IllegalArgumentException("Missing required field: resource");
    }
    name = name == null ? id : name;
    description = description == null ? "" : description;
    actions = actions == null ? Set.of() : Set.copyOf(actions);
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
  }

  /**
   * Unconditional, active permission.
   *
   * @param id       the id
   * @param resource the resource
   * @param actions  the actions
   * @return the permission
   */
  public static Permission of(String id, String resource, String... actions) {
    return new Permission(id, id, "", resource, Set.of(actions), List.of(), true);
  }
}
