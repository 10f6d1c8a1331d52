package io.syncstore.storage;

import io.syncstore.cache.StreamChangeCache;
import io.syncstore.id.StreamTicket;
import io.syncstore.storage.db.Database;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Runs writes against one stream in the order the sync layer relies on:
 * reserve a position, write and commit, publish the change to the stream's
 * change cache, then release the ticket. The current token only moves past the
 * position once the cache already reports the change.
 * <p>
 * A failed write still releases its ticket, so the current token keeps moving; the
 * position is skipped for good and never reaches the cache.
 *
 * @param <T> ticket type of the underlying allocator
 */
@Slf4j
public final class StreamWriter<T extends StreamTicket> {
    private final String name;
    private final Database database;
    private final Supplier<T> reserve;
    private final StreamChangeCache<String> changes;

    /**
     * @param changes cache to notify after commit, or null for streams without one
     */
    public StreamWriter(final String name,
                        final Database database,
                        final Supplier<T> reserve,
                        final StreamChangeCache<String> changes) {
        this.name = name;
        this.database = database;
        this.reserve = reserve;
        this.changes = changes;
    }

    /**
     * @param entity key to mark as changed once committed; null to skip the cache
     */
    public <R> R write(final String desc, final String entity, final StreamInteraction<T, R> interaction) {
        final T ticket = reserve.get();
        boolean committed = false;
        try {
            final R result = database.runInteraction(desc, txn -> interaction.apply(txn, ticket));
            committed = true;
            if (changes != null && entity != null) {
                changes.recordChange(entity, ticket.position());
            }
            return result;
        } finally {
            ticket.close();
            if (!committed) {
                log.debug("Released position {} of {} after failed {}", ticket.position(), name, desc);
            }
        }
    }

    public String name() {
        return name;
    }
}
