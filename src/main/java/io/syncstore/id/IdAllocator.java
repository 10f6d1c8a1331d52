package io.syncstore.id;

import io.syncstore.core.sequence.Sequence;
import io.syncstore.storage.db.SqlIdentifiers;
import io.syncstore.storage.db.Transaction;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Hands out unique, strictly increasing ids for a table column.
 * <p>
 * The only database access is the {@code MAX(column)} read done by {@link #load};
 * after that every reservation is a CAS on an in-memory cursor. Whether the row
 * carrying a reserved id is ever committed is the caller's business.
 */
@Slf4j
public final class IdAllocator {

    /**
     * Position reported for a table with no rows; the first id handed out is 0.
     */
    public static final long EMPTY = -1L;

    @Getter
    private final String name;
    private final Sequence cursor;

    public IdAllocator(final String name, final long currentMax) {
        this.name = name;
        this.cursor = new Sequence(currentMax);
    }

    /**
     * Builds an allocator that continues after the highest value already stored in
     * {@code table.column}.
     */
    public static IdAllocator load(final Transaction txn, final String table, final String column) {
        SqlIdentifiers.require(table);
        SqlIdentifiers.require(column);

        final Long stored = txn.queryForObject("SELECT MAX(" + column + ") FROM " + table, Long.class);
        final long max = stored == null ? EMPTY : stored;

        log.debug("Loaded id allocator {}.{} at {}", table, column, max);
        return new IdAllocator(table + "." + column, max);
    }

    public long reserve() {
        return cursor.incrementAndGet();
    }

    /**
     * Reserves {@code count} consecutive ids in one step.
     *
     * @return the highest id of the block {@code [last - count + 1 .. last]}
     */
    public long reserveMany(final int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1: " + count);
        }
        return cursor.addAndGet(count);
    }

    public long currentMax() {
        return cursor.get();
    }
}
