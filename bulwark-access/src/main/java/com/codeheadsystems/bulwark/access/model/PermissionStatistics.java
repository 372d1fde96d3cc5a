package com.codeheadsystems.bulwark.access.model;

import com.codeheadsystems.bulwark.access.cache.CacheStats;

/**
 * Point-in-time view of the permission system.
 *
 * @param totalUsers        the total users
 * @param activeUsers       the active users
 * @param totalRoles        the total roles
 * @param activeRoles       the active roles
 * @param totalPermissions  the total permissions
 * @param activePermissions the active permissions
 * @param totalChecks       checks that reached a decision
 * @param grantedChecks     granted decisions
 * @param deniedChecks      denied decisions
 * @param cacheHitRate      cache hits over total checks
 * @param cleanupRuns       completed cleanup passes
 * @param cache             the cache stats
 */
public record PermissionStatistics(int totalUsers,
                                   int activeUsers,
                                   int totalRoles,
                                   int activeRoles,
                                   int totalPermissions,
                                   int activePermissions,
                                   long totalChecks,
                                   long grantedChecks,
                                   long deniedChecks,
                                   double cacheHitRate,
                                   long cleanupRuns,
                                   CacheStats cache) {
}
