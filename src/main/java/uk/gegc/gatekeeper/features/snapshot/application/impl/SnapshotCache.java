package uk.gegc.gatekeeper.features.snapshot.application.impl;

import uk.gegc.gatekeeper.features.snapshot.domain.AccessSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded TTL cache of built snapshots keyed by subject and organization.
 *
 * <p>Every invalidation bumps a generation counter. A snapshot is only stored
 * if no invalidation happened while it was being built, so a build that raced
 * with a grant or revoke never outlives it.
 */
public class SnapshotCache {

    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();

    public SnapshotCache(Duration ttl, int maxEntries, Clock clock) {
        this.ttl = ttl == null ? Duration.ZERO : ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return !ttl.isZero() && !ttl.isNegative();
    }

    public long generation() {
        return generation.get();
    }

    public Optional<AccessSnapshot> get(String subjectId, String organizationId) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        Key key = new Key(subjectId, organizationId);
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.snapshot());
    }

    /**
     * Stores a snapshot built while the cache was at {@code buildGeneration}.
     *
     * @return {@code true} if the snapshot was kept
     */
    public boolean put(AccessSnapshot snapshot, long buildGeneration) {
        if (!isEnabled() || generation.get() != buildGeneration) {
            return false;
        }
        if (entries.size() >= maxEntries) {
            evictExpired();
            if (entries.size() >= maxEntries) {
                return false;
            }
        }

        Key key = new Key(snapshot.subjectId(), snapshot.organizationId());
        Entry entry = new Entry(snapshot, clock.instant().plus(ttl));
        entries.put(key, entry);

        // An invalidation may have slipped in between the check above and the put.
        if (generation.get() != buildGeneration) {
            entries.remove(key, entry);
            return false;
        }
        return true;
    }

    public void invalidate(String subjectId) {
        generation.incrementAndGet();
        entries.keySet().removeIf(key -> key.subjectId().equals(subjectId));
    }

    public void invalidateAll() {
        generation.incrementAndGet();
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private void evictExpired() {
        Instant now = clock.instant();
        entries.values().removeIf(entry -> !now.isBefore(entry.expiresAt()));
    }

    private record Key(String subjectId, String organizationId) {
    }

    private record Entry(AccessSnapshot snapshot, Instant expiresAt) {
    }
}
