package com.codeheadsystems.bulwark.access.cache;

/**
 * Cache counters.
 *
 * @param totalEntries   the total entries
 * @param expiredEntries entries past their ttl but not yet cleaned up
 * @param activeEntries  the active entries
 * @param hits           the hits
 * @param misses         the misses
 */
public record CacheStats(int totalEntries, int expiredEntries, int activeEntries, long hits, long misses) {

  public double hitRate() {
    long lookups = hits + misses;
    return lookups == 0 ? 0.0 : (double) hits / lookups;
  }
}
