package io.syncstore.id;

/**
 * A derived-stream position paired with the parent token observed when it was
 * reserved.
 */
public final class ChainedTicket implements StreamTicket {
    private final ChainedStreamIdAllocator owner;
    private final AllocationTicket inner;
    private final long parentPosition;

    ChainedTicket(final ChainedStreamIdAllocator owner, final AllocationTicket inner, final long parentPosition) {
        this.owner = owner;
        this.inner = inner;
        this.parentPosition = parentPosition;
    }

    @Override
    public long position() {
        return inner.position();
    }

    public long parentPosition() {
        return parentPosition;
    }

    public ChainedToken token() {
        return new ChainedToken(position(), parentPosition);
    }

    @Override
    public boolean isReleased() {
        return inner.isReleased();
    }

    ChainedStreamIdAllocator owner() {
        return owner;
    }

    AllocationTicket inner() {
        return inner;
    }

    @Override
    public void close() {
        if (inner.claimRelease()) {
            owner.release(this);
        }
    }

    @Override
    public String toString() {
        return "ChainedTicket[" + position() + " @ parent " + parentPosition + "]";
    }
}
