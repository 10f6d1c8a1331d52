package io.syncstore.storage;

/**
 * Ordered streams and the table/column their positions are stored in.
 */
public enum StreamTable {
    EVENTS("events", "stream_ordering"),
    RECEIPTS("receipts_linearized", "stream_id"),
    ACCOUNT_DATA("account_data_max_stream_id", "stream_id"),
    PRESENCE("presence_stream", "stream_id"),
    PUSH_RULES("push_rules_stream", "stream_id");

    private final String table;
    private final String column;

    StreamTable(final String table, final String column) {
        this.table = table;
        this.column = column;
    }

    public String table() {
        return table;
    }

    public String column() {
        return column;
    }
}
