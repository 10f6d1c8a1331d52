package io.syncstore.cache;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded record of the latest stream position at which each entity changed.
 * <p>
 * The cache has complete knowledge of every change after its watermark. A known
 * change after the queried position is always reported; an absent entry only
 * proves "unchanged" when the queried position is at or after the watermark,
 * otherwise the answer is {@link ChangeStatus#UNKNOWN} and the caller goes to the
 * database. When the entity count exceeds the limit the lowest positions are
 * evicted and the watermark moves up to the lowest position still held; it never
 * moves back.
 *
 * @param <K> opaque entity key (room id, user id, ...)
 */
@Slf4j
public final class StreamChangeCache<K> {
    private final String name;
    private final int maxSize;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<K, Long> entityToPosition = new HashMap<>();
    private final TreeMap<Long, Set<K>> positionToEntities = new TreeMap<>();

    private volatile long watermark;

    public StreamChangeCache(final String name, final long currentPosition, final int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1: " + maxSize);
        }
        this.name = name;
        this.maxSize = maxSize;
        this.watermark = currentPosition;
    }

    public String name() {
        return name;
    }

    public long watermark() {
        return watermark;
    }

    public int maxSize() {
        return maxSize;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entityToPosition.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public ChangeStatus entityHasChangedSince(final K entity, final long since) {
        lock.readLock().lock();
        try {
            final Long latest = entityToPosition.get(entity);
            if (latest != null && latest > since) {
                return ChangeStatus.CHANGED;
            }
            return since >= watermark ? ChangeStatus.UNCHANGED : ChangeStatus.UNKNOWN;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Every entity changed after {@code since}, in position order, or empty when
     * {@code since} predates the watermark and the database has to be asked.
     */
    public Optional<Set<K>> allEntitiesChangedSince(final long since) {
        lock.readLock().lock();
        try {
            if (since < watermark) {
                return Optional.empty();
            }
            final Set<K> changed = new LinkedHashSet<>();
            for (final Set<K> bucket : positionToEntities.tailMap(since, false).values()) {
                changed.addAll(bucket);
            }
            return Optional.of(Collections.unmodifiableSet(changed));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Narrows {@code entities} to those that may have changed after {@code since}.
     * Returns all of them when the cache cannot tell.
     */
    public Set<K> entitiesChangedSince(final Collection<K> entities, final long since) {
        lock.readLock().lock();
        try {
            if (since < watermark) {
                return new LinkedHashSet<>(entities);
            }
            final Set<K> changed = new LinkedHashSet<>();
            for (final K entity : entities) {
                final Long latest = entityToPosition.get(entity);
                if (latest != null && latest > since) {
                    changed.add(entity);
                }
            }
            return changed;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Latest known change position for the entity, or the watermark if none is held.
     */
    public long maxPositionFor(final K entity) {
        lock.readLock().lock();
        try {
            final Long latest = entityToPosition.get(entity);
            return latest != null ? latest : watermark;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Records that {@code entity} changed at {@code position}. Must be called after
     * the change committed. Positions at or below the watermark are already covered
     * by the "unknown" answer and are dropped.
     */
    public void recordChange(final K entity, final long position) {
        lock.writeLock().lock();
        try {
            if (position <= watermark) {
                return;
            }
            put(entity, position);
            evictOverflow();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the contents with a bootstrap snapshot. {@code minPosition} becomes the
     * watermark; callers pass the stream's max token when the snapshot is empty.
     */
    public void prefill(final Map<K, Long> snapshot, final long minPosition) {
        lock.writeLock().lock();
        try {
            entityToPosition.clear();
            positionToEntities.clear();
            watermark = minPosition;
            for (final Map.Entry<K, Long> e : snapshot.entrySet()) {
                if (e.getValue() >= minPosition) {
                    put(e.getKey(), e.getValue());
                }
            }
            evictOverflow();
            log.info("Prefilled {} with {} entities, watermark {}", name, entityToPosition.size(), watermark);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void put(final K entity, final long position) {
        final Long previous = entityToPosition.get(entity);
        if (previous != null) {
            if (previous >= position) {
                return;
            }
            final Set<K> bucket = positionToEntities.get(previous);
            bucket.remove(entity);
            if (bucket.isEmpty()) {
                positionToEntities.remove(previous);
            }
        }
        entityToPosition.put(entity, position);
        positionToEntities.computeIfAbsent(position, p -> new LinkedHashSet<>()).add(entity);
    }

    private void evictOverflow() {
        while (entityToPosition.size() > maxSize) {
            final Map.Entry<Long, Set<K>> oldest = positionToEntities.pollFirstEntry();
            for (final K entity : oldest.getValue()) {
                entityToPosition.remove(entity);
            }
            final long candidate = positionToEntities.isEmpty() ? oldest.getKey() : positionToEntities.firstKey();
            if (candidate > watermark) {
                log.debug("{} evicted position {}, watermark {} -> {}", name, oldest.getKey(), watermark, candidate);
                watermark = candidate;
            }
        }
    }

    @Override
    public String toString() {
        return "StreamChangeCache[" + name + ", watermark=" + watermark + ", maxSize=" + maxSize + "]";
    }
}
