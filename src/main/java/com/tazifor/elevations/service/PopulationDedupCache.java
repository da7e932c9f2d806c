package com.tazifor.elevations.service;

import com.tazifor.elevations.geo.model.CellId;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * PopulationDedupCache - remembers which cells were recently sent for population
 *
 * THE PROBLEM:
 * A cell missing from the store stays missing until the backfill job finishes,
 * which takes minutes. Every request for it in the meantime would trigger the
 * job again.
 *
 * THE SOLUTION:
 * Record each cell when population is requested and skip it until its entry
 * is older than the TTL. Expiry is evaluated lazily on lookup against the
 * injected clock; no background thread is needed. {@link #purgeExpired()}
 * only reclaims memory.
 *
 * CAPACITY:
 * Entries are kept in insertion order (a refresh moves a cell to the end), so
 * when the cache is over capacity the oldest entries are evicted first.
 *
 * CONCURRENCY:
 * All access goes through one lock. Callers doing read-then-write across
 * {@link #membersStillPending} and {@link #markPending} may race at the TTL
 * boundary and trigger one duplicate population.
 */
@Slf4j
public class PopulationDedupCache {

    private final Clock clock;
    private final Duration ttl;
    private final int maxEntries;

    private final Object lock = new Object();
    private final LinkedHashMap<CellId, Instant> entries = new LinkedHashMap<>();

    public PopulationDedupCache(Clock clock, Duration ttl, int maxEntries) {
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must not be negative, got: " + ttl);
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Cache capacity must be positive, got: " + maxEntries);
        }
        this.clock = clock;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
    }

    /**
     * Returns the candidates that were marked pending less than one TTL ago.
     * Expired entries met on the way are dropped.
     */
    public Set<CellId> membersStillPending(Collection<CellId> candidates) {
        Instant now = clock.instant();
        Set<CellId> pending = new LinkedHashSet<>();
        synchronized (lock) {
            for (CellId cell : candidates) {
                Instant insertedAt = entries.get(cell);
                if (insertedAt == null) {
                    continue;
                }
                if (isExpired(insertedAt, now)) {
                    entries.remove(cell);
                } else {
                    pending.add(cell);
                }
            }
        }
        return pending;
    }

    /**
     * Inserts or refreshes an entry for each cell, stamped with the current time.
     */
    public void markPending(Collection<CellId> cells) {
        Instant now = clock.instant();
        int evicted = 0;
        synchronized (lock) {
            for (CellId cell : cells) {
                // remove first so a refreshed cell moves to the young end
                entries.remove(cell);
                entries.put(cell, now);
            }
            Iterator<Map.Entry<CellId, Instant>> oldest = entries.entrySet().iterator();
            while (entries.size() > maxEntries && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
                evicted++;
            }
        }
        if (evicted > 0) {
            log.warn("Population cache over capacity ({}), evicted {} oldest entries", maxEntries, evicted);
        }
    }

    /**
     * An entry stamped at {@code insertedAt} is expired once a full TTL has elapsed.
     */
    public boolean isExpired(Instant insertedAt, Instant now) {
        return !now.isBefore(insertedAt.plus(ttl));
    }

    /**
     * Drops every expired entry.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        synchronized (lock) {
            Iterator<Map.Entry<CellId, Instant>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                if (isExpired(it.next().getValue(), now)) {
                    it.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public Duration ttl() { return ttl; }
}
