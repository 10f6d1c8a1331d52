package io.syncstore.cache;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Rate limiter for idempotent upserts: remembers when each key was last written and
 * suppresses writes that recur within a granularity window.
 * <p>
 * No locking: two racing callers may both be told to write; the upsert is
 * idempotent.
 *
 * @param <K> key identifying the upserted row
 */
@Slf4j
public final class CoalescingUpsertCache<K> {
    private final String name;
    private final int maxEntries;
    private final ConcurrentHashMap<K, Long> lastWritten = new ConcurrentHashMap<>();

    public CoalescingUpsertCache(final String name, final int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1: " + maxEntries);
        }
        this.name = name;
        this.maxEntries = maxEntries;
    }

    /**
     * @return true if the caller should perform the write; {@code now} is then
     * recorded for {@code key}
     */
    public boolean shouldWrite(final K key, final long now, final long granularityMs) {
        final Long last = lastWritten.get(key);
        if (last != null && now - last < granularityMs) {
            return false;
        }
        lastWritten.put(key, now);
        if (lastWritten.size() > maxEntries) {
            prune(now, granularityMs);
        }
        return true;
    }

    /**
     * Drops entries whose window has passed; they no longer suppress anything.
     */
    private void prune(final long now, final long granularityMs) {
        final int before = lastWritten.size();
        lastWritten.values().removeIf(ts -> now - ts >= granularityMs);
        log.debug("{} pruned {} expired entries", name, before - lastWritten.size());
    }

    public int size() {
        return lastWritten.size();
    }

    public String name() {
        return name;
    }
}
