package io.syncstore.storage.db;

import java.sql.SQLException;

/**
 * Work executed inside a single database transaction.
 */
@FunctionalInterface
public interface TxnFunction<T> {
    T apply(Transaction txn) throws SQLException;
}
