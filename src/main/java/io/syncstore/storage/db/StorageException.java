package io.syncstore.storage.db;

/**
 * Unchecked wrapper for database failures, tagged with the interaction that raised it.
 */
public class StorageException extends RuntimeException {

    public StorageException(final String message) {
        super(message);
    }

    public StorageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
