package com.codeheadsystems.bulwark.common.audit;

/**
 * Side channel for failures inside the audit logger itself. Audit failures never reach the
 * caller of the operation being audited; they are handed here instead.
 */
@FunctionalInterface
public interface AuditFailureHandler {

  /**
   * Called when an audit entry could not be recorded.
   *
   * @param eventType the event that was being recorded
   * @param subject   the subject of the event
   * @param cause     the failure
   */
  void onAuditFailure(AuditEventType eventType, String subject, RuntimeException cause);
}
