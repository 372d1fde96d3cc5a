package com.codeheadsystems.bulwark.access.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for the permission system.
 *
 * @param cacheTimeout          how long a decision is served from cache
 * @param sessionTimeout        idle timeout of sessions
 * @param maxSessionLifetime    absolute lifetime of sessions
 * @param auditLogRetention     how long audit entries are kept
 * @param cleanupInterval       period of the background cleanup
 * @param maxCacheSize          cache capacity
 * @param maxAuditEntries       audit log capacity
 * @param enableAuditLog        whether checks are audited
 * @param enablePermissionCache whether decisions are cached
 */
public record PermissionConfig(Duration cacheTimeout,
                               Duration sessionTimeout,
                               Duration maxSessionLifetime,
                               Duration auditLogRetention,
                               Duration cleanupInterval,
                               int maxCacheSize,
                               int maxAuditEntries,
                               boolean enableAuditLog,
                               boolean enablePermissionCache) {

  /**
   * Instantiates a new Permission config.
   */
  public PermissionConfig {
    requirePositive(cacheTimeout, "cacheTimeout");
    requirePositive(sessionTimeout, "sessionTimeout");
    requirePositive(maxSessionLifetime, "maxSessionLifetime");
    requirePositive(auditLogRetention, "auditLogRetention");
    requirePositive(cleanupInterval, "cleanupInterval");
    if (maxCacheSize <= 0 || maxAuditEntries <= 0) {
      throw new IllegalArgumentException("Capacities must be positive");
    }
  }

  /**
   * Defaults: 5 minute cache, 30 minute idle sessions living at most 24 hours, 30 day audit
   * retention, hourly cleanup, 10 000 cached decisions, 100 000 audit entries.
   *
   * @return the permission config
   */
  public static PermissionConfig defaults() {
    return new PermissionConfig(Duration.ofMinutes(5), Duration.ofMinutes(30), Duration.ofHours(24),
        Duration.ofDays(30), Duration.ofHours(1), 10_000, 100_000, true, true);
  }

  public PermissionConfig withCacheTimeout(Duration timeout) {
    return new PermissionConfig(timeout, sessionTimeout, maxSessionLifetime, auditLogRetention, cleanupInterval,
        maxCacheSize, maxAuditEntries, enableAuditLog, enablePermissionCache);
  }

  public PermissionConfig withSessionTimeout(Duration timeout) {
    return new PermissionConfig(cacheTimeout, timeout, maxSessionLifetime, auditLogRetention, cleanupInterval,
        maxCacheSize, maxAuditEntries, enableAuditLog, enablePermissionCache);
  }

  public PermissionConfig withMaxCacheSize(int size) {
    return new PermissionConfig(cacheTimeout, sessionTimeout, maxSessionLifetime, auditLogRetention, cleanupInterval,
        size, maxAuditEntries, enableAuditLog, enablePermissionCache);
  }

  public PermissionConfig withPermissionCache(boolean enabled) {
    return new PermissionConfig(cacheTimeout, sessionTimeout, maxSessionLifetime, auditLogRetention, cleanupInterval,
        maxCacheSize, maxAuditEntries, enableAuditLog, enabled);
  }

  private static void requirePositive(Duration duration, String name) {
    Objects.requireNonNull(duration, name);
    if (duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
