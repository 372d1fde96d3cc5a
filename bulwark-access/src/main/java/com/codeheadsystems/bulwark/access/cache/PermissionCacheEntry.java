package com.codeheadsystems.bulwark.access.cache;

/**
 * A cached decision.
 *
 * @param subject   the subject
 * @param resource  the resource
 * @param action    the action
 * @param granted   the decision
 * @param createdAt when the decision was made, epoch millis
 * @param ttlMs     time to live
 */
public record PermissionCacheEntry(String subject,
                                   String resource,
                                   String action,
                                   boolean granted,
                                   long createdAt,
                                   long ttlMs) {

  /**
   * Visible while {@code now - createdAt < ttl}.
   *
   * @param now the current time
   * @return true if the entry may still be served
   */
  public boolean isVisibleAt(long now) {
    return now - createdAt < ttlMs;
  }
}
