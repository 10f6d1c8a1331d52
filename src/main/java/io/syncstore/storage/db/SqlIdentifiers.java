package io.syncstore.storage.db;

import java.util.regex.Pattern;

/**
 * Guards table and column names that have to be spliced into SQL text.
 */
public final class SqlIdentifiers {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SqlIdentifiers() {
        // Prevent instantiation
    }

    public static String require(final String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Not a plain SQL identifier: " + identifier);
        }
        return identifier;
    }
}
