package com.codeheadsystems.bulwark.access.session;

/**
 * An authenticated session. Valid while active, idle for less than the session timeout and
 * younger than the maximum lifetime.
 *
 * @param sessionId     the session id
 * @param subject       the subject
 * @param createdAt     the creation time, epoch millis
 * @param lastAccessAt  the last access time, epoch millis
 * @param clientContext the client context
 * @param active        false once terminated
 */
public record UserSession(String sessionId,
                          String subject,
                          long createdAt,
                          long lastAccessAt,
                          ClientContext clientContext,
                          boolean active) {

  public boolean isValidAt(long now, long timeoutMs, long maxLifetimeMs) {
    return active && now - lastAccessAt < timeoutMs && now - createdAt < maxLifetimeMs;
  }

  UserSession touchedAt(long now) {
    return new UserSession(sessionId, subject, createdAt, now, clientContext, active);
  }

  UserSession terminated() {
    return new UserSession(sessionId, subject, createdAt, lastAccessAt, clientContext, false);
  }
}
