package io.syncstore.storage.db;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Statement helpers bound to the transaction of one {@link Database#runInteraction}.
 * Commit and rollback belong to the interaction, not to callers.
 */
public final class Transaction {
    private final JdbcTemplate jdbc;

    Transaction(final JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public <T> List<T> query(final String sql, final RowMapper<T> mapper, final Object... params) {
        return jdbc.query(sql, mapper, params);
    }

    public void query(final String sql, final RowCallbackHandler handler, final Object... params) {
        jdbc.query(sql, handler, params);
    }

    /**
     * Single-value query such as an aggregate. Null when the value is SQL NULL.
     */
    public <T> T queryForObject(final String sql, final Class<T> type, final Object... params) {
        return jdbc.queryForObject(sql, type, params);
    }

    public int update(final String sql, final Object... params) {
        return jdbc.update(sql, params);
    }

    /**
     * Updates the row matching {@code keyValues}, inserting it when none matched.
     * Takes no table lock: without a unique constraint a racing writer may insert a
     * duplicate, which callers of this method accept.
     *
     * @return true if a new row was inserted
     */
    public boolean upsert(final String table,
                          final Map<String, ?> keyValues,
                          final Map<String, ?> values) {
        SqlIdentifiers.require(table);
        if (keyValues.isEmpty()) {
            throw new IllegalArgumentException("upsert into " + table + " needs at least one key column");
        }

        final List<Object> whereParams = new ArrayList<>();
        final StringJoiner where = new StringJoiner(" AND ");
        for (final Map.Entry<String, ?> e : keyValues.entrySet()) {
            SqlIdentifiers.require(e.getKey());
            if (e.getValue() == null) {
                where.add(e.getKey() + " IS NULL");
            } else {
                where.add(e.getKey() + " = ?");
                whereParams.add(e.getValue());
            }
        }

        final int matched;
        if (values.isEmpty()) {
            matched = jdbc.queryForList("SELECT 1 FROM " + table + " WHERE " + where,
                    Integer.class, whereParams.toArray()).size();
        } else {
            final StringJoiner set = new StringJoiner(", ");
            final List<Object> params = new ArrayList<>();
            for (final Map.Entry<String, ?> e : values.entrySet()) {
                set.add(SqlIdentifiers.require(e.getKey()) + " = ?");
                params.add(e.getValue());
            }
            params.addAll(whereParams);
            matched = jdbc.update("UPDATE " + table + " SET " + set + " WHERE " + where, params.toArray());
        }
        if (matched > 0) {
            return false;
        }

        final StringJoiner cols = new StringJoiner(", ");
        final StringJoiner marks = new StringJoiner(", ");
        final List<Object> insertParams = new ArrayList<>();
        for (final Map<String, ?> part : List.of(keyValues, values)) {
            for (final Map.Entry<String, ?> e : part.entrySet()) {
                cols.add(e.getKey());
                marks.add("?");
                insertParams.add(e.getValue());
            }
        }
        jdbc.update("INSERT INTO " + table + " (" + cols + ") VALUES (" + marks + ")", insertParams.toArray());
        return true;
    }
}
