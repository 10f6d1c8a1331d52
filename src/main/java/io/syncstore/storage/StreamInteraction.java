package io.syncstore.storage;

import io.syncstore.id.StreamTicket;
import io.syncstore.storage.db.Transaction;

import java.sql.SQLException;

/**
 * Transactional write that stores rows at the position carried by its ticket.
 */
@FunctionalInterface
public interface StreamInteraction<T extends StreamTicket, R> {
    R apply(Transaction txn, T ticket) throws SQLException;
}
