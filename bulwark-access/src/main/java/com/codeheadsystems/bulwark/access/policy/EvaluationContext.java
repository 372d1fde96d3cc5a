package com.codeheadsystems.bulwark.access.policy;

import java.util.Map;

/**
 * Everything conditions may look at.
 *
 * @param subject           the subject
 * @param subjectAttributes the subject's attributes
 * @param requestAttributes the request context
 * @param timestamp         evaluation time, epoch millis
 */
public record EvaluationContext(String subject,
                                Map<String, String> subjectAttributes,
                                Map<String, String> requestAttributes,
                                long timestamp) {

  /**
   * Request context key holding the caller's address.
   */
  public static final String CLIENT_IP = "clientIP";

  /**
   * Instantiates a new Evaluation context.
   */
  public EvaluationContext {
    subjectAttributes = subjectAttributes == null ? Map.of() : Map.copyOf(subjectAttributes);
    requestAttributes = requestAttributes == null ? Map.of() : Map.copyOf(requestAttributes);
  }

  public String clientIp() {
    return requestAttributes.get(CLIENT_IP);
  }
}
