package com.codeheadsystems.bulwark.common.audit;

/**
 * Filter for {@link AuditLogger#getLogs(AuditQuery, int)}. Null fields match everything.
 *
 * @param subject   exact subject
 * @param resource  exact resource
 * @param eventType event type
 * @param fromMs    inclusive lower bound on the timestamp
 * @param toMs      inclusive upper bound on the timestamp
 */
public record AuditQuery(String subject, String resource, AuditEventType eventType, Long fromMs, Long toMs) {

  private static final AuditQuery ALL = new AuditQuery(null, null, null, null, null);

  /**
   * Matches every entry.
   *
   * @return the audit query
   */
  public static AuditQuery all() {
    return ALL;
  }

  /**
   * For subject audit query.
   *
   * @param subject the subject
   * @return the audit query
   */
  public static AuditQuery forSubject(String subject) {
    return new AuditQuery(subject, null, null, null, null);
  }

  public AuditQuery withResource(String resource) {
    return new AuditQuery(subject, resource, eventType, fromMs, toMs);
  }

  public AuditQuery withEventType(AuditEventType eventType) {
    return new AuditQuery(subject, resource, eventType, fromMs, toMs);
  }

  public AuditQuery between(Long fromMs, Long toMs) {
    return new AuditQuery(subject, resource, eventType, fromMs, toMs);
  }

  /**
   * Matches boolean.
   *
   * @param entry the entry
   * @return the boolean
   */
  public boolean matches(AuditLogEntry entry) {
    return (subject == null || subject.equals(entry.subject()))
        && (resource == null || resource.equals(entry.resource()))
        && (eventType == null || eventType == entry.eventType())
        && (fromMs == null || entry.timestamp() >= fromMs)
        && (toMs == null || entry.timestamp() <= toMs);
  }
}
