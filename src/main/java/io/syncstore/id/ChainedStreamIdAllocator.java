package io.syncstore.id;

import io.syncstore.storage.db.Transaction;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stream allocator whose positions are tied to a parent stream: every reservation
 * records the parent's current token at that moment, so a consumer of the derived
 * stream is never told about parent progress the parent itself does not advertise.
 */
public final class ChainedStreamIdAllocator {
    private final StreamIdAllocator own;
    private final StreamIdAllocator parent;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<ChainedTicket> outstanding = new LinkedHashSet<>();

    /* Guarded by lock. */
    private long resolvedParentMax;
    /* When nothing is outstanding, the parent half is resolvedParentMax, not the parent's live token. */
    private volatile ChainedToken current;

    public ChainedStreamIdAllocator(final StreamIdAllocator own, final StreamIdAllocator parent) {
        this.own = own;
        this.parent = parent;
        this.resolvedParentMax = parent.currentToken();
        this.current = new ChainedToken(own.currentToken(), resolvedParentMax);
    }

    public static ChainedStreamIdAllocator load(final Transaction txn,
                                                final String table,
                                                final String column,
                                                final StreamIdAllocator parent) {
        return new ChainedStreamIdAllocator(StreamIdAllocator.load(txn, table, column), parent);
    }

    public String name() {
        return own.name();
    }

    public ChainedTicket reserveOne() {
        lock.lock();
        try {
            // Parent token is read under our lock so successive tickets never see it go backwards.
            final long parentToken = parent.currentToken();
            final ChainedTicket ticket = new ChainedTicket(this, own.reserveOne(), parentToken);
            outstanding.add(ticket);
            return ticket;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws IllegalArgumentException if the ticket belongs to another allocator
     * @throws IllegalStateException    if the ticket was already released
     */
    public void markDone(final ChainedTicket ticket) {
        if (ticket.owner() != this) {
            throw new IllegalArgumentException(ticket + " was not reserved from " + name());
        }
        if (!ticket.inner().claimRelease()) {
            throw new IllegalStateException(ticket + " was already released");
        }
        release(ticket);
    }

    void release(final ChainedTicket ticket) {
        lock.lock();
        try {
            ticket.inner().owner().release(ticket.inner());
            outstanding.remove(ticket);
            resolvedParentMax = Math.max(resolvedParentMax, ticket.parentPosition());

            final Iterator<ChainedTicket> it = outstanding.iterator();
            if (it.hasNext()) {
                final ChainedTicket first = it.next();
                current = new ChainedToken(first.position() - 1, first.parentPosition());
            } else {
                current = new ChainedToken(own.currentToken(), resolvedParentMax);
            }
        } finally {
            lock.unlock();
        }
    }

    public ChainedToken currentToken() {
        return current;
    }

    public long maxToken() {
        return own.maxToken();
    }
}
