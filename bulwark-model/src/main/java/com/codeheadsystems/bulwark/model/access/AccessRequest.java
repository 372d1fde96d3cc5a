package com.codeheadsystems.bulwark.model.access;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * An authorization request carried inside a secure packet.
 *
 * @param sessionToken bearer token identifying the caller's session
 * @param resource     the resource being accessed
 * @param action       the action, e.g. {@code read}
 * @param clientIp     the caller's address, used by IP conditions
 * @param attributes   additional evaluation context
 */
public record AccessRequest(
    @JsonProperty("sessionToken") String sessionToken,
    @JsonProperty("resource") String resource,
    @JsonProperty("action") String action,
    @JsonProperty("clientIP") String clientIp,
    @JsonProperty("attributes") Map<String, String> attributes) {

  /**
   * Instantiates a new Access request.
   */
  public AccessRequest {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  /**
   * Checks required fields.
   *
   * @return this request
   * @throws IllegalArgumentException if a required field is missing
   */
  public AccessRequest validate() {
    require(sessionToken, "sessionToken");
    require(resource, "resource");
    require(action, "action");
    return this;
  }

  private static void require(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + field);
    }
  }
}
