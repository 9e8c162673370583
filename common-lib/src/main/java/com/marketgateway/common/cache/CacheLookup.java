package com.marketgateway.common.cache;

import java.time.Instant;

/** Result of a stale-aware read: the value, whether it is past its TTL, and when it was fetched. */
public record CacheLookup<V>(V value, boolean stale, Instant fetchedAt) {}
