package io.syncstore.cache;

/**
 * Answer to "did this entity change after position P?".
 */
public enum ChangeStatus {
    CHANGED,
    UNCHANGED,
    /**
     * P predates the cache's watermark; only the database can answer.
     */
    UNKNOWN;

    public boolean mustQueryDatabase() {
        return this == UNKNOWN;
    }

    /**
     * Conservative reading for callers that cannot fall back: unknown counts as changed.
     */
    public boolean mayHaveChanged() {
        return this != UNCHANGED;
    }
}
