package com.codeheadsystems.bulwark.common.audit;

import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link AuditFailureHandler}: logs at error level and counts failures.
 */
public class LoggingAuditFailureHandler implements AuditFailureHandler {

  private static final Logger log = LoggerFactory.getLogger(LoggingAuditFailureHandler.class);

  private final AtomicLong failures = new AtomicLong();

  @Override
  public void onAuditFailure(AuditEventType eventType, String subject, RuntimeException cause) {
    failures.incrementAndGet();
    log.error("Failed to record audit event {} for subject={}", eventType, subject, cause);
  }

  /**
   * Number of audit failures seen so far.
   *
   * @return the count
   */
  public long failureCount() {
    return failures.get();
  }
}
