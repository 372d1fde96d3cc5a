package com.codeheadsystems.bulwark.model.access;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The answer to an {@link AccessRequest}.
 *
 * @param granted         whether access is allowed
 * @param reason          short explanation, safe to show to the caller
 * @param matchedPolicies ids of the grants and policies that allowed access
 */
public record AccessResponse(
    @JsonProperty("granted") boolean granted,
    @JsonProperty("reason") String reason,
    @JsonProperty("matchedPolicies") List<String> matchedPolicies) {

  /**
   * Instantiates a new Access response.
   */
  public AccessResponse {
    matchedPolicies = matchedPolicies == null ? List.of() : List.copyOf(matchedPolicies);
  }

  /**
   * A denial with no matched policies.
   *
   * @param reason the reason
   * @return the access response
   */
  public static AccessResponse denied(String reason) {
    return new AccessResponse(false, reason, List.of());
  }
}
