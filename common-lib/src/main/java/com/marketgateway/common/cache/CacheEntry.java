package com.marketgateway.common.cache;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable cache slot. Replaced wholesale on refresh, never mutated.
 *
 * <p>Invariant: {@code fetchedAt <= expireAt <= staleDeadline}.
 */
public record CacheEntry<V>(
    V value,
    Instant fetchedAt,
    Instant expireAt,
    Instant staleDeadline
) {
    public CacheEntry {
        Objects.requireNonNull(value, "value");
        if (expireAt.isBefore(fetchedAt) || staleDeadline.isBefore(expireAt)) {
            throw new IllegalArgumentException(
                "Cache entry timestamps out of order: fetchedAt=" + fetchedAt
                    + " expireAt=" + expireAt + " staleDeadline=" + staleDeadline);
        }
    }

    public boolean isFresh(Instant now) {
        return now.isBefore(expireAt);
    }
}
