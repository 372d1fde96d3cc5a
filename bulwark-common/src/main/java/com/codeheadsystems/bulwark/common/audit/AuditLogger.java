package com.codeheadsystems.bulwark.common.audit;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, FIFO-bounded audit trail.
 * <p>
 * When the number of entries exceeds {@code maxEntries} the oldest entry is dropped. Every
 * entry is also written to the SLF4J logger {@value #AUDIT_LOGGER_NAME} so deployments can
 * route the trail to durable storage through their logging configuration.
 * <p>
 * {@link #log} never throws. A failure while recording is reported to the configured
 * {@link AuditFailureHandler}.
 * <p>
 * Thread-safe: appends take the write lock, queries take the read lock.
 */
public class AuditLogger {

  /** Name of the SLF4J logger that mirrors the audit trail. */
  public static final String AUDIT_LOGGER_NAME = "bulwark.audit";
  /** Default bound on retained entries. */
  public static final int DEFAULT_MAX_ENTRIES = 100_000;

  private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
  private static final Logger auditLog = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

  private final Clock clock;
  private final int maxEntries;
  private final AuditFailureHandler failureHandler;
  private final Deque<AuditLogEntry> entries = new ArrayDeque<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final AtomicLong sequence = new AtomicLong();

  /**
   * Instantiates a new Audit logger with default bounds and failure handling.
   *
   * @param clock the clock
   */
  public AuditLogger(Clock clock) {
    this(clock, DEFAULT_MAX_ENTRIES, new LoggingAuditFailureHandler());
  }

  /**
   * Instantiates a new Audit logger.
   *
   * @param clock          the clock
   * @param maxEntries     the maximum number of retained entries
   * @param failureHandler the failure handler
   */
  public AuditLogger(Clock clock, int maxEntries, AuditFailureHandler failureHandler) {
    if (maxEntries < 1) {
      throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
    }
    this.clock = clock;
    this.maxEntries = maxEntries;
    this.failureHandler = failureHandler;
  }

  /**
   * Records an event without details.
   *
   * @param eventType the event type
   * @param subject   the subject
   * @param resource  the resource
   * @param outcome   the outcome
   */
  public void log(AuditEventType eventType, String subject, String resource, AuditOutcome outcome) {
    log(eventType, subject, resource, outcome, Map.of());
  }

  /**
   * Records an event. Never throws.
   *
   * @param eventType the event type
   * @param subject   the subject
   * @param resource  the resource
   * @param outcome   the outcome
   * @param details   the details
   */
  public void log(AuditEventType eventType, String subject, String resource, AuditOutcome outcome,
                  Map<String, String> details) {
    try {
      AuditLogEntry entry = new AuditLogEntry(
          "audit-" + sequence.incrementAndGet(), eventType, subject, resource, outcome, clock.millis(), details);
      lock.writeLock().lock();
      try {
        entries.addLast(entry);
        while (entries.size() > maxEntries) {
          entries.removeFirst();
        }
      } finally {
        lock.writeLock().unlock();
      }
      auditLog.info("{} subject={} resource={} outcome={} details={}",
          entry.eventType(), entry.subject(), entry.resource(), entry.outcome(), entry.details());
    } catch (RuntimeException e) {
      reportFailure(eventType, subject, e);
    }
  }

  private void reportFailure(AuditEventType eventType, String subject, RuntimeException cause) {
    try {
      failureHandler.onAuditFailure(eventType, subject, cause);
    } catch (RuntimeException handlerFailure) {
      log.error("Audit failure handler threw while reporting {}", eventType, handlerFailure);
    }
  }

  /**
   * Returns the most recent {@code limit} entries matching the query, oldest first.
   *
   * @param query the query
   * @param limit the maximum number of entries returned
   * @return the matching entries
   */
  public List<AuditLogEntry> getLogs(AuditQuery query, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<AuditLogEntry> matched = new ArrayList<>();
    lock.readLock().lock();
    try {
      for (AuditLogEntry entry : entries) {
        if (query.matches(entry)) {
          matched.add(entry);
        }
      }
    } finally {
      lock.readLock().unlock();
    }
    int from = Math.max(0, matched.size() - limit);
    return List.copyOf(matched.subList(from, matched.size()));
  }

  /**
   * Removes entries older than the retention period.
   *
   * @param retention how long entries are kept
   * @return the number of entries removed
   */
  public int cleanupOldLogs(Duration retention) {
    long cutoff = clock.millis() - retention.toMillis();
    int removed = 0;
    lock.writeLock().lock();
    try {
      Iterator<AuditLogEntry> it = entries.iterator();
      while (it.hasNext()) {
        if (it.next().timestamp() < cutoff) {
          it.remove();
          removed++;
        }
      }
    } finally {
      lock.writeLock().unlock();
    }
    if (removed > 0) {
      log.debug("Removed {} audit entries older than {}", removed, retention);
    }
    return removed;
  }

  /**
   * Current number of retained entries.
   *
   * @return the size
   */
  public int size() {
    lock.readLock().lock();
    try {
      return entries.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  public int maxEntries() {
    return maxEntries;
  }

  /**
   * Drops all entries.
   */
  public void clear() {
    lock.writeLock().lock();
    try {
      entries.clear();
    } finally {
      lock.writeLock().unlock();
    }
  }
}
