package io.syncstore.id;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.LongStream;

/**
 * Block of contiguous positions {@code [firstPosition .. position]} reserved from a
 * {@link StreamIdAllocator}. Excluded from the allocator's current token until
 * released.
 */
public final class AllocationTicket implements StreamTicket {
    private final StreamIdAllocator owner;
    private final long firstPosition;
    private final long lastPosition;
    private final AtomicBoolean released = new AtomicBoolean();

    AllocationTicket(final StreamIdAllocator owner, final long firstPosition, final long lastPosition) {
        this.owner = owner;
        this.firstPosition = firstPosition;
        this.lastPosition = lastPosition;
    }

    public long firstPosition() {
        return firstPosition;
    }

    @Override
    public long position() {
        return lastPosition;
    }

    public int count() {
        return (int) (lastPosition - firstPosition + 1);
    }

    public LongStream positions() {
        return LongStream.rangeClosed(firstPosition, lastPosition);
    }

    @Override
    public boolean isReleased() {
        return released.get();
    }

    StreamIdAllocator owner() {
        return owner;
    }

    /**
     * Flips the ticket to released; false if somebody got there first.
     */
    boolean claimRelease() {
        return released.compareAndSet(false, true);
    }

    @Override
    public void close() {
        if (claimRelease()) {
            owner.release(this);
        }
    }

    @Override
    public String toString() {
        return firstPosition == lastPosition
                ? "AllocationTicket[" + lastPosition + "]"
                : "AllocationTicket[" + firstPosition + ".." + lastPosition + "]";
    }
}
