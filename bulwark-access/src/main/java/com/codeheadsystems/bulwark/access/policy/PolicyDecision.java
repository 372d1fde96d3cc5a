package com.codeheadsystems.bulwark.access.policy;

import java.util.List;

/**
 * The engine's answer.
 *
 * @param granted         whether any grant or policy matched
 * @param reason          human readable reason
 * @param matchedPolicies  {@code static:<id>} for static grants, then dynamic ids by descending priority
 * @param contextDependent a conditional grant or policy took part, so the answer may differ per request
 */
public record PolicyDecision(boolean granted, String reason, List<String> matchedPolicies,
                             boolean contextDependent) {

  /**
   * Instantiates a new Policy decision.
   */
  public PolicyDecision {
    matchedPolicies = matchedPolicies == null ? List.of() : List.copyOf(matchedPolicies);
  }
}
