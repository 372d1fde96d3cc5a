package com.codeheadsystems.bulwark.access.policy;

import com.codeheadsystems.bulwark.access.model.Permission;
import com.codeheadsystems.bulwark.common.SecurityErrorCode;
import com.codeheadsystems.bulwark.common.SecurityResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates static grants and dynamic policies.
 * <p>
 * The decision is the permissive union: access is granted when any static grant or any
 * dynamic policy matches. A deny-overrides model would change only {@link #evaluate}.
 * Policies live in an immutable list that writers replace; each evaluation reads a single
 * snapshot. Resource patterns are compiled once, when a policy is added.
 */
public class PolicyEngine {

  private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

  public static final String STATIC_PREFIX = "static:";

  private static final Comparator<CompiledPolicy> BY_PRIORITY =
      Comparator.comparingInt((CompiledPolicy c) -> c.policy().priority()).reversed();

  private final Object writeLock = new Object();
  private volatile List<CompiledPolicy> policies = List.of();

  /**
   * Adds a policy, replacing any policy with the same id.
   *
   * @param policy the policy
   */
  public void addDynamicPolicy(DynamicPolicy policy) {
    CompiledPolicy compiled = new CompiledPolicy(policy, ResourcePattern.compile(policy.resourcePattern()));
    synchronized (writeLock) {
      List<CompiledPolicy> updated = new ArrayList<>(policies);
      updated.removeIf(c -> c.policy().id().equals(policy.id()));
      updated.add(compiled);
      updated.sort(BY_PRIORITY);
      policies = List.copyOf(updated);
    }
    log.info("Added dynamic policy {} ({})", policy.id(), policy.resourcePattern());
  }

  /**
   * Removes a policy.
   *
   * @param policyId the policy id
   * @return true if it existed
   */
  public boolean removeDynamicPolicy(String policyId) {
    synchronized (writeLock) {
      List<CompiledPolicy> updated = new ArrayList<>(policies);
      boolean removed = updated.removeIf(c -> c.policy().id().equals(policyId));
      if (removed) {
        policies = List.copyOf(updated);
        log.info("Removed dynamic policy {}", policyId);
      }
      return removed;
    }
  }

  public List<DynamicPolicy> dynamicPolicies() {
    return policies.stream().map(CompiledPolicy::policy).toList();
  }

  public Optional<DynamicPolicy> dynamicPolicy(String policyId) {
    return policies.stream().map(CompiledPolicy::policy).filter(p -> p.id().equals(policyId)).findFirst();
  }

  /**
   * Evaluates a request.
   *
   * @param subject      the subject
   * @param resource     the resource
   * @param action       the action
   * @param context      the context
   * @param staticGrants the subject's static grants
   * @return the decision, or {@code POLICY_EVALUATION_ERROR} if a condition could not be evaluated.
   *     The decision is marked context dependent when any candidate grant or policy carried conditions.
   */
  public SecurityResult<PolicyDecision> evaluate(String subject,
                                                 String resource,
                                                 String action,
                                                 EvaluationContext context,
                                                 Collection<Permission> staticGrants) {
    List<CompiledPolicy> snapshot = policies;
    List<String> matched = new ArrayList<>();
    boolean contextDependent = false;
    try {
      for (Permission grant : staticGrants) {
        if (grant.active()
            && grant.resource().equals(resource)
            && grant.actions().contains(action)) {
          contextDependent |= !grant.conditions().isEmpty();
          if (allHold(grant.conditions(), context)) {
            matched.add(STATIC_PREFIX + grant.id());
          }
        }
      }
      for (CompiledPolicy compiled : snapshot) {
        DynamicPolicy policy = compiled.policy();
        if (policy.active()
            && policy.allowedActions().contains(action)
            && compiled.pattern().matcher(resource).matches()) {
          contextDependent |= !policy.conditions().isEmpty();
          if (allHold(policy.conditions(), context)) {
            matched.add(policy.id());
          }
        }
      }
    } catch (RuntimeException e) {
      log.warn("Policy evaluation failed for {} {} on {}: {}", subject, action, resource, e.getMessage());
      return SecurityResult.failure(SecurityErrorCode.POLICY_EVALUATION_ERROR,
          "Condition could not be evaluated: " + e.getMessage());
    }
    if (matched.isEmpty()) {
      return SecurityResult.success(
          new PolicyDecision(false, "No grant or policy allows " + action, List.of(), contextDependent));
    }
    return SecurityResult.success(
        new PolicyDecision(true, "Allowed by " + String.join(", ", matched), matched, contextDependent));
  }

  private static boolean allHold(List<Condition> conditions, EvaluationContext context) {
    for (Condition condition : conditions) {
      if (!condition.test(context)) {
        return false;
      }
    }
    return true;
  }

  private record CompiledPolicy(DynamicPolicy policy, Pattern pattern) {
  }
}
