package io.syncstore.cache.prefill;

import io.syncstore.storage.db.SqlIdentifiers;
import io.syncstore.storage.db.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Reads the recent tail of a stream table so a change cache starts warm.
 * <p>
 * Only rows within {@code window} positions below the upper bound are scanned; how
 * many entities come back does not matter since the cache enforces its own size
 * limit. Failures propagate: a cache without a trustworthy watermark must not serve.
 */
@Slf4j
public final class CachePrefill {
    private final long window;

    public CachePrefill(final long window) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.window = window;
    }

    public PrefillResult run(final Transaction txn,
                             final String table,
                             final String entityColumn,
                             final String streamColumn,
                             final long upperBound) {
        SqlIdentifiers.require(table);
        SqlIdentifiers.require(entityColumn);
        SqlIdentifiers.require(streamColumn);

        final String sql = "SELECT " + entityColumn + ", MAX(" + streamColumn + ")"
                + " FROM " + table
                + " WHERE " + streamColumn + " > ?"
                + " GROUP BY " + entityColumn;

        final Map<String, Long> latest = new HashMap<>();
        txn.query(sql, rs -> latest.put(rs.getString(1), rs.getLong(2)), upperBound - window);

        final long min = latest.values().stream().mapToLong(Long::longValue).min().orElse(upperBound);

        log.info("Prefill of {}.{} below {} found {} entities, min position {}",
                table, entityColumn, upperBound, latest.size(), min);
        return new PrefillResult(latest, min);
    }
}
