package io.syncstore.id;

import io.syncstore.core.sequence.Sequence;
import io.syncstore.storage.db.Transaction;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Allocates positions for an ordered stream whose writes may commit out of order.
 * <p>
 * Two tokens are exposed:
 * <ul>
 *   <li>{@link #maxToken()} - the highest position ever handed out;</li>
 *   <li>{@link #currentToken()} - the highest position P such that every position
 *   &lt;= P has been committed or released. Readers may treat everything up to it as
 *   fully written.</li>
 * </ul>
 * Tickets are reserved under a short lock so that the outstanding set stays in
 * allocation order; the first outstanding ticket therefore bounds the current token.
 * The lock is never held across database work.
 */
public final class StreamIdAllocator {
    private final IdAllocator ids;
    private final ReentrantLock lock = new ReentrantLock();

    /* Insertion order == position order, as tickets are added under the lock. */
    private final Set<AllocationTicket> outstanding = new LinkedHashSet<>();
    private final Sequence current;

    public StreamIdAllocator(final String name, final long currentMax) {
        this.ids = new IdAllocator(name, currentMax);
        this.current = new Sequence(currentMax);
    }

    public static StreamIdAllocator load(final Transaction txn, final String table, final String column) {
        final IdAllocator loaded = IdAllocator.load(txn, table, column);
        return new StreamIdAllocator(loaded.getName(), loaded.currentMax());
    }

    public String name() {
        return ids.getName();
    }

    public AllocationTicket reserveOne() {
        return reserveMany(1);
    }

    /**
     * Reserves {@code count} contiguous positions as a single ticket.
     */
    public AllocationTicket reserveMany(final int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1: " + count);
        }
        lock.lock();
        try {
            final long last = ids.reserveMany(count);
            final AllocationTicket ticket = new AllocationTicket(this, last - count + 1, last);
            outstanding.add(ticket);
            return ticket;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolves a ticket once its transaction has committed or aborted. Must be called
     * exactly once per ticket; an aborted ticket simply leaves a permanent gap.
     *
     * @throws IllegalArgumentException if the ticket belongs to another allocator
     * @throws IllegalStateException    if the ticket was already released
     */
    public void markDone(final AllocationTicket ticket) {
        if (ticket.owner() != this) {
            throw new IllegalArgumentException(ticket + " was not reserved from " + name());
        }
        if (!ticket.claimRelease()) {
            throw new IllegalStateException(ticket + " was already released");
        }
        release(ticket);
    }

    void release(final AllocationTicket ticket) {
        lock.lock();
        try {
            outstanding.remove(ticket);
            current.set(computeCurrent());
        } finally {
            lock.unlock();
        }
    }

    private long computeCurrent() {
        final Iterator<AllocationTicket> it = outstanding.iterator();
        return it.hasNext() ? it.next().firstPosition() - 1 : ids.currentMax();
    }

    /**
     * Non-blocking read of the highest fully resolved position.
     */
    public long currentToken() {
        return current.get();
    }

    /**
     * Highest position ever reserved, including in-flight ones. Not safe for
     * deciding what readers may see.
     */
    public long maxToken() {
        return ids.currentMax();
    }

    public int outstandingCount() {
        lock.lock();
        try {
            return outstanding.size();
        } finally {
            lock.unlock();
        }
    }
}
