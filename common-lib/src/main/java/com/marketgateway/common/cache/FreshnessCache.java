package com.marketgateway.common.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory TTL cache with a second, wider window for serving stale values.
 *
 * <p>Each entry is fresh until {@code expireAt} and usable as a fallback until
 * {@code staleDeadline = expireAt + maxStaleWindow}. Staleness is evaluated lazily on
 * read; reads never delete. {@link #evictExpired()} can be called periodically to drop
 * entries that are past their stale deadline and bound memory.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. Writers for a given key are expected to
 * be serialized upstream (by the request coalescer); readers are unrestricted.
 */
public class FreshnessCache<V> {

    private static final Logger log = LoggerFactory.getLogger(FreshnessCache.class);

    private final ConcurrentHashMap<String, CacheEntry<V>> store = new ConcurrentHashMap<>();
    private final Duration maxStaleWindow;
    private final Clock clock;

    public FreshnessCache(Duration maxStaleWindow, Clock clock) {
        if (maxStaleWindow.isNegative()) {
            throw new IllegalArgumentException("maxStaleWindow must be non-negative");
        }
        this.maxStaleWindow = maxStaleWindow;
        this.clock = clock;
    }

    /** Stores {@code value} as fresh for {@code ttl}, replacing any previous entry. */
    public void set(String key, V value, Duration ttl) {
        Instant now = clock.instant();
        Instant expireAt = now.plus(ttl);
        store.put(key, new CacheEntry<>(value, now, expireAt, expireAt.plus(maxStaleWindow)));
    }

    /** Returns the value only while it is fresh. */
    public Optional<V> get(String key) {
        CacheEntry<V> entry = store.get(key);
        if (entry == null || !entry.isFresh(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    /**
     * Returns the value if fresh, or tagged stale if it expired less than {@code maxStale} ago.
     */
    public Optional<CacheLookup<V>> getWithStale(String key, Duration maxStale) {
        CacheEntry<V> entry = store.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (entry.isFresh(now)) {
            return Optional.of(new CacheLookup<>(entry.value(), false, entry.fetchedAt()));
        }
        if (now.isBefore(entry.expireAt().plus(maxStale))) {
            return Optional.of(new CacheLookup<>(entry.value(), true, entry.fetchedAt()));
        }
        return Optional.empty();
    }

    /** Raw entry regardless of expiry. */
    public Optional<CacheEntry<V>> getEntry(String key) {
        return Optional.ofNullable(store.get(key));
    }

    public boolean has(String key) {
        return get(key).isPresent();
    }

    public void delete(String key) {
        store.remove(key);
    }

    public void clear() {
        store.clear();
    }

    /** Number of entries, expired ones included. */
    public int size() {
        return store.size();
    }

    public Duration getMaxStaleWindow() {
        return maxStaleWindow;
    }

    /**
     * Removes entries whose stale deadline has passed.
     *
     * @return number of removed entries
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, CacheEntry<V>> slot : store.entrySet()) {
            if (!now.isBefore(slot.getValue().staleDeadline())) {
                // remove(key, value) so a concurrent refresh is never dropped
                if (store.remove(slot.getKey(), slot.getValue())) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("CACHE_EVICT removed={} remaining={}", removed, store.size());
        }
        return removed;
    }
}
