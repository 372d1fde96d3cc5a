package com.codeheadsystems.bulwark.common.audit;

import java.util.Map;
import java.util.Objects;

/**
 * An immutable audit trail record.
 *
 * @param id        unique, monotonically assigned entry id
 * @param eventType the event type
 * @param subject   the acting subject (user id or client id)
 * @param resource  the resource or peer the event concerns
 * @param outcome   the outcome
 * @param timestamp epoch milliseconds from the logger's clock
 * @param details   free-form context, never key material
 */
public record AuditLogEntry(String id,
                            AuditEventType eventType,
                            String subject,
                            String resource,
                            AuditOutcome outcome,
                            long timestamp,
                            Map<String, String> details) {

  /**
   * Instantiates a new Audit log entry.
   */
  public AuditLogEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(outcome, "outcome");
    subject = subject == null ? "" : subject;
    resource = resource == null ? "" : resource;
    details = details == null ? Map.of() : Map.copyOf(details);
  }
}
