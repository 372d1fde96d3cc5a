package com.codeheadsystems.bulwark.access.cache;

import java.time.Clock;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded cache of permission decisions keyed by (subject, resource, action).
 * <p>
 * Reads are lock-free. Writers synchronize on the cache so that the capacity check and
 * eviction of the oldest entry happen together. Expiry is checked on read; expired entries
 * stay until {@link #cleanupExpired()} or eviction removes them.
 */
public class PermissionCache {

  private static final Logger log = LoggerFactory.getLogger(PermissionCache.class);

  public static final int DEFAULT_MAX_ENTRIES = 10_000;

  private record Key(String subject, String resource, String action) {
  }

  private final ConcurrentHashMap<Key, PermissionCacheEntry> entries = new ConcurrentHashMap<>();
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final Clock clock;
  private final int maxEntries;

  /**
   * Instantiates a new Permission cache.
   *
   * @param clock      the clock
   * @param maxEntries the capacity
   */
  public PermissionCache(Clock clock, int maxEntries) {
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("maxEntries must be positive");
    }
    this.clock = clock;
    this.maxEntries = maxEntries;
  }

  /**
   * The cached decision, if present and not expired.
   *
   * @param subject  the subject
   * @param resource the resource
   * @param action   the action
   * @return the decision
   */
  public Optional<Boolean> get(String subject, String resource, String action) {
    PermissionCacheEntry entry = entries.get(new Key(subject, resource, action));
    if (entry == null || !entry.isVisibleAt(clock.millis())) {
      misses.incrementAndGet();
      return Optional.empty();
    }
    hits.incrementAndGet();
    return Optional.of(entry.granted());
  }

  /**
   * Stores a decision. At capacity, a new key first evicts the entry with the smallest
   * {@code createdAt}.
   *
   * @param entry the entry
   */
  public synchronized void put(PermissionCacheEntry entry) {
    Key key = new Key(entry.subject(), entry.resource(), entry.action());
    if (!entries.containsKey(key) && entries.size() >= maxEntries) {
      entries.entrySet().stream()
          .min(Comparator.comparingLong(e -> e.getValue().createdAt()))
          .map(Map.Entry::getKey)
          .ifPresent(entries::remove);
    }
    entries.put(key, entry);
  }

  /**
   * Drops every entry for the subject.
   *
   * @param subject the subject
   * @return the number of entries removed
   */
  public synchronized int invalidateSubject(String subject) {
    int before = entries.size();
    entries.keySet().removeIf(key -> key.subject().equals(subject));
    int removed = before - entries.size();
    log.debug("Invalidated {} cached decision(s) for {}", removed, subject);
    return removed;
  }

  /**
   * Removes expired entries.
   *
   * @return the number removed
   */
  public synchronized int cleanupExpired() {
    long now = clock.millis();
    int before = entries.size();
    entries.values().removeIf(entry -> !entry.isVisibleAt(now));
    return before - entries.size();
  }

  public synchronized void clear() {
    entries.clear();
  }

  public int size() {
    return entries.size();
  }

  public int maxEntries() {
    return maxEntries;
  }

  /**
   * Current counters.
   *
   * @return the cache stats
   */
  public CacheStats stats() {
    long now = clock.millis();
    int total = 0;
    int expired = 0;
    for (PermissionCacheEntry entry : entries.values()) {
      total++;
      if (!entry.isVisibleAt(now)) {
        expired++;
      }
    }
    return new CacheStats(total, expired, total - expired, hits.get(), misses.get());
  }
}
