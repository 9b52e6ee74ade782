package com.edushield.access.freshness;

import java.time.Duration;

/**
 * Freshness of one resource at the moment it was accessed.
 *
 * @param status           refreshed (TTL elapsed, timer reset) or cached
 * @param ttlSeconds       the resource's configured TTL
 * @param remainingSeconds seconds until the next refresh, with sub-second precision;
 *                         equals {@code ttlSeconds} only right after a refresh
 */
public record TtlStatus(FreshnessState status, long ttlSeconds, double remainingSeconds) {

    public static TtlStatus refreshed(long ttlSeconds) {
        return new TtlStatus(FreshnessState.REFRESHED, ttlSeconds, ttlSeconds);
    }

    public static TtlStatus cached(long ttlSeconds, double remainingSeconds) {
        return new TtlStatus(FreshnessState.CACHED, ttlSeconds, remainingSeconds);
    }

    /** A cached status whose remaining time is given as a duration. */
    public static TtlStatus cached(long ttlSeconds, Duration remaining) {
        return cached(ttlSeconds, remaining.toNanos() / 1_000_000_000.0);
    }
}
