package io.syncstore.id;

/**
 * A reserved stream position owned by one transaction. Closing the ticket
 * releases it; closing twice is a no-op.
 */
public interface StreamTicket extends AutoCloseable {

    /**
     * Highest position covered by this ticket.
     */
    long position();

    boolean isReleased();

    @Override
    void close();
}
