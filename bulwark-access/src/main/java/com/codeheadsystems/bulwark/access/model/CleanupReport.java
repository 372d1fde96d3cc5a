package com.codeheadsystems.bulwark.access.model;

/**
 * What one cleanup pass removed.
 *
 * @param sessions     expired sessions
 * @param cacheEntries expired cached decisions
 * @param auditEntries audit entries past retention
 */
public record CleanupReport(int sessions, int cacheEntries, int auditEntries) {
}
