package com.codeheadsystems.bulwark.access.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Set;

/**
 * A named set of permissions.
 *
 * @param id          the id
 * @param name        the name
 * @param description the description
 * @param permissions permission ids
 * @param active      inactive roles grant nothing
 */
public record Role(@JsonProperty("id") String id,
                   @JsonProperty("name") String name,
                   @JsonProperty("description") String description,
                   @JsonProperty("permissions") Set<String> permissions,
                   @JsonProperty("active") boolean active) {

  /**
   * Instantiates a new Role.
   */
  public Role {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Missing required field: id");
    }
    name = name == null ? id : name;
    description = description == null ? "" : description;
    permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
  }

  public Role withActive(boolean enabled) {
    return new Role(id, name, description, permissions, enabled);
  }
}
