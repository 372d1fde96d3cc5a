package com.codeheadsystems.bulwark.access.session;

import com.codeheadsystems.bulwark.common.RandomProvider;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory session registry with a sliding idle timeout.
 * <p>
 * Sessions are looked up lock-free. Creation and sweeping synchronize on the manager so the
 * subject index stays in step with the session map. Terminated sessions are kept, inactive,
 * until the next sweep.
 */
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofMinutes(30);
  public static final Duration DEFAULT_MAX_LIFETIME = Duration.ofHours(24);

  private final ConcurrentHashMap<String, UserSession> sessions = new ConcurrentHashMap<>();
  // Reverse index: subject → session ids, kept in sync with sessions.
  private final ConcurrentHashMap<String, Set<String>> subjectToSessionIds = new ConcurrentHashMap<>();

  private final Clock clock;
  private final RandomProvider randomProvider;
  private final long timeoutMs;
  private final long maxLifetimeMs;

  /**
   * Instantiates a new Session manager.
   *
   * @param clock          the clock
   * @param randomProvider source of session ids
   * @param timeout        the idle timeout
   * @param maxLifetime    the absolute lifetime
   */
  public SessionManager(Clock clock, RandomProvider randomProvider, Duration timeout, Duration maxLifetime) {
    if (timeout.isNegative() || timeout.isZero() || maxLifetime.isNegative() || maxLifetime.isZero()) {
      throw new IllegalArgumentException("Session timeouts must be positive");
    }
    this.clock = clock;
    this.randomProvider = randomProvider;
    this.timeoutMs = timeout.toMillis();
    this.maxLifetimeMs = maxLifetime.toMillis();
  }

  /**
   * Opens a session.
   *
   * @param subject       the subject
   * @param clientContext the client context
   * @return the session id
   */
  public synchronized String createSession(String subject, ClientContext clientContext) {
    if (subject == null || subject.isBlank()) {
      throw new IllegalArgumentException("Missing required argument: subject");
    }
    long now = clock.millis();
    String sessionId = "session_" + randomProvider.randomHex(16);
    sessions.put(sessionId, new UserSession(sessionId, subject, now, now,
        clientContext == null ? ClientContext.UNKNOWN : clientContext, true));
    subjectToSessionIds.computeIfAbsent(subject, k -> ConcurrentHashMap.newKeySet()).add(sessionId);
    log.debug("Created session {} for {}", sessionId, subject);
    return sessionId;
  }

  /**
   * Whether the subject has at least one valid session.
   *
   * @param subject the subject
   * @return true if any session is valid
   */
  public boolean isValid(String subject) {
    Set<String> ids = subjectToSessionIds.get(subject);
    if (ids == null) {
      return false;
    }
    long now = clock.millis();
    return ids.stream()
        .map(sessions::get)
        .anyMatch(session -> session != null && session.isValidAt(now, timeoutMs, maxLifetimeMs));
  }

  public boolean isSessionValid(String sessionId) {
    UserSession session = sessions.get(sessionId);
    return session != null && session.isValidAt(clock.millis(), timeoutMs, maxLifetimeMs);
  }

  /**
   * Extends a valid session's idle window. Expired or terminated sessions are not revived.
   *
   * @param sessionId the session id
   * @return true if the session was valid and touched
   */
  public boolean touch(String sessionId) {
    long now = clock.millis();
    boolean[] touched = new boolean[1];
    sessions.computeIfPresent(sessionId, (id, session) -> {
      if (!session.isValidAt(now, timeoutMs, maxLifetimeMs)) {
        return session;
      }
      touched[0] = true;
      return session.touchedAt(now);
    });
    return touched[0];
  }

  /**
   * Marks a session inactive.
   *
   * @param sessionId the session id
   * @return true if an active session was terminated
   */
  public boolean terminate(String sessionId) {
    boolean[] terminated = new boolean[1];
    sessions.computeIfPresent(sessionId, (id, session) -> {
      terminated[0] = session.active();
      return session.terminated();
    });
    if (terminated[0]) {
      log.debug("Terminated session {}", sessionId);
    }
    return terminated[0];
  }

  /**
   * Marks every session of the subject inactive.
   *
   * @param subject the subject
   * @return the number of sessions terminated
   */
  public int terminateAllForSubject(String subject) {
    Set<String> ids = subjectToSessionIds.get(subject);
    if (ids == null) {
      return 0;
    }
    int count = 0;
    for (String id : ids) {
      if (terminate(id)) {
        count++;
      }
    }
    return count;
  }

  /**
   * Physically removes sessions that are terminated or idle for at least the timeout, or
   * past their maximum lifetime.
   *
   * @return the number of sessions removed
   */
  public synchronized int sweepExpired() {
    long now = clock.millis();
    int removed = 0;
    for (UserSession session : List.copyOf(sessions.values())) {
      if (!session.isValidAt(now, timeoutMs, maxLifetimeMs)) {
        sessions.remove(session.sessionId());
        Set<String> ids = subjectToSessionIds.get(session.subject());
        if (ids != null) {
          ids.remove(session.sessionId());
          if (ids.isEmpty()) {
            subjectToSessionIds.remove(session.subject());
          }
        }
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("Swept {} expired session(s)", removed);
    }
    return removed;
  }

  public Optional<UserSession> getSession(String sessionId) {
    return Optional.ofNullable(sessions.get(sessionId));
  }

  /**
   * The subject's valid sessions.
   *
   * @param subject the subject
   * @return the sessions
   */
  public List<UserSession> activeSessions(String subject) {
    Set<String> ids = subjectToSessionIds.get(subject);
    if (ids == null) {
      return List.of();
    }
    long now = clock.millis();
    return ids.stream()
        .map(sessions::get)
        .filter(session -> session != null && session.isValidAt(now, timeoutMs, maxLifetimeMs))
        .toList();
  }

  public int size() {
    return sessions.size();
  }

  public synchronized void clear() {
    sessions.clear();
    subjectToSessionIds.clear();
  }
}
