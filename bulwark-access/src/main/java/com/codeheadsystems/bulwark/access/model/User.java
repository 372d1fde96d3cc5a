package com.codeheadsystems.bulwark.access.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * A registered subject. Static grants are its direct permissions plus those of its active roles.
 *
 * @param id                the id, used as the subject in checks
 * @param username          the username
 * @param email             the email
 * @param roles             role ids
 * @param directPermissions permission ids granted directly
 * @param active            disabled users are always denied
 * @param createdAt         creation time, epoch millis
 * @param attributes        subject attributes for {@code attribute_match} conditions
 */
public record User(@JsonProperty("id") String id,
                   @JsonProperty("username") String username,
                   @JsonProperty("email") String email,
                   @JsonProperty("roles") Set<String> roles,
                   @JsonProperty("directPermissions") Set<String> directPermissions,
                   @JsonProperty("active") boolean active,
                   @JsonProperty("createdAt") long createdAt,
                   @JsonProperty("attributes") Map<String, String> attributes) {

  /**
   * Instantiates a new User.
   */
  public User {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Missing required field: id");
    }
    username = username == null ? id : username;
    email = email == null ? "" : email;
    roles = roles == null ? Set.of() : Set.copyOf(roles);
    directPermissions = directPermissions == null ? Set.of() : Set.copyOf(directPermissions);
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public User withRole(String roleId) {
    Set<String> updated = new HashSet<>(roles);
    updated.add(roleId);
    return new User(id, username, email, updated, directPermissions, active, createdAt, attributes);
  }

  public User withoutRole(String roleId) {
    Set<String> updated = new HashSet<>(roles);
    updated.remove(roleId);
    return new User(id, username, email, updated, directPermissions, active, createdAt, attributes);
  }

  public User withDirectPermission(String permissionId) {
    Set<String> updated = new HashSet<>(directPermissions);
    updated.add(permissionId);
    return new User(id, username, email, roles, updated, active, createdAt, attributes);
  }

  public User withActive(boolean enabled) {
    return new User(id, username, email, roles, directPermissions, enabled, createdAt, attributes);
  }
}
