package io.syncstore.storage.model;

import java.util.Locale;

public enum PresenceState {
    ONLINE,
    UNAVAILABLE,
    OFFLINE;

    /**
     * Value as stored in {@code presence_stream.state}.
     */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PresenceState fromDb(final String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
