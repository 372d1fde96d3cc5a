package com.codeheadsystems.bulwark.common.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;

import com.codeheadsystems.bulwark.common.MutableClock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type Audit logger test.
 */
@ExtendWith(MockitoExtension.class)
class AuditLoggerTest {

  @Mock private AuditFailureHandler failureHandler;

  private MutableClock clock;
  private AuditLogger auditLogger;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(1_000_000L);
    auditLogger = new AuditLogger(clock, 3, failureHandler);
  }

  @Test
  void log_beyondBound_dropsOldestFirst() {
    for (int i = 1; i <= 5; i++) {
      auditLogger.log(AuditEventType.PERMISSION_CHECK, "user" + i, "doc", AuditOutcome.ATTEMPT);
    }

    List<AuditLogEntry> logs = auditLogger.getLogs(AuditQuery.all(), 10);
    assertThat(auditLogger.size()).isEqualTo(3);
    assertThat(logs).extracting(AuditLogEntry::subject).containsExactly("user3", "user4", "user5");
  }

  @Test
  void getLogs_filtersAndKeepsMostRecent() {
    auditLogger = new AuditLogger(clock, 100, failureHandler);
    auditLogger.log(AuditEventType.PERMISSION_DECISION, "alice", "doc", AuditOutcome.GRANTED);
    clock.advance(Duration.ofSeconds(1));
    auditLogger.log(AuditEventType.PERMISSION_DECISION, "bob", "doc", AuditOutcome.DENIED);
    clock.advance(Duration.ofSeconds(1));
    auditLogger.log(AuditEventType.PERMISSION_DECISION, "alice", "report", AuditOutcome.DENIED);
    clock.advance(Duration.ofSeconds(1));
    auditLogger.log(AuditEventType.SESSION_CREATED, "alice", "", AuditOutcome.SUCCESS);

    assertThat(auditLogger.getLogs(AuditQuery.forSubject("alice"), 2))
        .extracting(AuditLogEntry::resource)
        .containsExactly("report", "");
    assertThat(auditLogger.getLogs(AuditQuery.all().withResource("doc"), 10)).hasSize(2);
    assertThat(auditLogger.getLogs(AuditQuery.all().withEventType(AuditEventType.SESSION_CREATED), 10))
        .singleElement()
        .extracting(AuditLogEntry::outcome)
        .isEqualTo(AuditOutcome.SUCCESS);
    assertThat(auditLogger.getLogs(AuditQuery.all().between(1_001_000L, 1_002_000L), 10)).hasSize(2);
    assertThat(auditLogger.getLogs(AuditQuery.all(), 0)).isEmpty();
  }

  @Test
  void log_recordsClockTimeAndDetails() {
    auditLogger.log(AuditEventType.KEY_ROTATED, "client-1", "", AuditOutcome.SUCCESS, Map.of("version", "2"));

    AuditLogEntry entry = auditLogger.getLogs(AuditQuery.all(), 1).get(0);
    assertThat(entry.timestamp()).isEqualTo(1_000_000L);
    assertThat(entry.details()).containsEntry("version", "2");
    assertThat(entry.id()).startsWith("audit-");
  }

  @Test
  void cleanupOldLogs_removesOnlyEntriesPastRetention() {
    auditLogger = new AuditLogger(clock, 100, failureHandler);
    auditLogger.log(AuditEventType.ENCRYPTION, "c", "", AuditOutcome.SUCCESS);
    clock.advance(Duration.ofDays(2));
    auditLogger.log(AuditEventType.ENCRYPTION, "c", "", AuditOutcome.SUCCESS);

    assertThat(auditLogger.cleanupOldLogs(Duration.ofDays(1))).isEqualTo(1);
    assertThat(auditLogger.size()).isEqualTo(1);
  }

  @Test
  void log_failureGoesToSideChannelAndNeverThrows() {
    // a null event type cannot form an entry
    assertThatCode(() -> auditLogger.log(null, "user", "doc", AuditOutcome.ATTEMPT))
        .doesNotThrowAnyException();

    verify(failureHandler).onAuditFailure(isNull(), eq("user"), any(NullPointerException.class));
    assertThat(auditLogger.size()).isZero();
  }

  @Test
  void log_throwingFailureHandler_isContained() {
    AuditLogger withBadHandler = new AuditLogger(clock, 3, (type, subject, cause) -> {
      throw new IllegalStateException("handler down");
    });

    assertThatCode(() -> withBadHandler.log(null, "user", "doc", AuditOutcome.ATTEMPT))
        .doesNotThrowAnyException();
  }

  @Test
  void loggingFailureHandler_countsFailures() {
    LoggingAuditFailureHandler handler = new LoggingAuditFailureHandler();
    new AuditLogger(clock, 3, handler).log(null, "user", "doc", AuditOutcome.ATTEMPT);
    assertThat(handler.failureCount()).isEqualTo(1);
  }
}
