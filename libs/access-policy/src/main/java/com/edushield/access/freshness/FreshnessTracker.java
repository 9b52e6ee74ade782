package com.edushield.access.freshness;

import com.edushield.access.ResourceDescriptor;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks when each resource was last refreshed and reports whether an access falls inside
 * the resource's TTL.
 * <p>
 * Purely advisory: the result is attached to audit entries and never gates access. The
 * last-refresh map is shared by all requests; each access reads and updates its entry in
 * one atomic {@link ConcurrentMap#compute} so concurrent requests never both refresh the
 * same window.
 */
public final class FreshnessTracker {

    private final ConcurrentMap<String, Instant> lastRefresh = new ConcurrentHashMap<>();
    private final Clock clock;

    public FreshnessTracker() {
        this(Clock.systemUTC());
    }

    public FreshnessTracker(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    /**
     * Records an access to a resource.
     * <p>
     * If the resource was never refreshed, or more than its TTL has elapsed since, the
     * timer is reset and the status is {@code refreshed}. Otherwise the status is
     * {@code cached} with the remaining time at the clock's full precision, so two
     * cached accesses at different instants never report the same remaining time.
     *
     * @param descriptor the resource being accessed
     * @return the freshness status of this access
     */
    public TtlStatus access(ResourceDescriptor descriptor) {
        String resourceId = descriptor.resourceId();
        long ttlSeconds = descriptor.ttlSeconds();
        Duration ttl = Duration.ofSeconds(ttlSeconds);
        Instant now = clock.instant();

        AtomicReference<TtlStatus> status = new AtomicReference<>();
        lastRefresh.compute(resourceId, (id, last) -> {
            Duration elapsed = last == null ? null : Duration.between(last, now);
            if (elapsed == null || elapsed.compareTo(ttl) > 0) {
                status.set(TtlStatus.refreshed(ttlSeconds));
                return now;
            }
            status.set(TtlStatus.cached(ttlSeconds, ttl.minus(elapsed)));
            return last;
        });
        return status.get();
    }

    /**
     * Records an access to each resource, keeping the given order.
     */
    public Map<String, TtlStatus> accessAll(Collection<ResourceDescriptor> descriptors) {
        Map<String, TtlStatus> statuses = new LinkedHashMap<>();
        for (ResourceDescriptor descriptor : descriptors) {
            statuses.put(descriptor.resourceId(), access(descriptor));
        }
        return statuses;
    }

    /** When the resource was last refreshed, if ever. */
    public Optional<Instant> lastRefresh(String resourceId) {
        return Optional.ofNullable(lastRefresh.get(resourceId));
    }

    /** Forgets all refresh times. */
    public void reset() {
        lastRefresh.clear();
    }
}
