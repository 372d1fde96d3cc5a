package com.codeheadsystems.bulwark.access.model;

import java.util.List;

/**
 * Outcome of a permission check. A denial is a normal outcome, not an error.
 *
 * @param granted         whether access is granted
 * @param reason          human readable reason
 * @param matchedPolicies ids of the grants and policies that matched
 * @param fromCache       whether the decision came from the permission cache
 */
public record PermissionCheck(boolean granted, String reason, List<String> matchedPolicies, boolean fromCache) {

  /**
   * Instantiates a new Permission check.
   */
  public PermissionCheck {
    matchedPolicies = matchedPolicies == null ? List.of() : List.copyOf(matchedPolicies);
  }

  public static PermissionCheck denied(String reason) {
    return new PermissionCheck(false, reason, List.of(), false);
  }
}
