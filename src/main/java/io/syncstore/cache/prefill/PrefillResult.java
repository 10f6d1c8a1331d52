package io.syncstore.cache.prefill;

import io.syncstore.cache.StreamChangeCache;

import java.util.Map;

/**
 * @param latest      entity -> highest position within the prefill window
 * @param minPosition smallest value of {@code latest}, or the upper bound when it is empty
 */
public record PrefillResult(Map<String, Long> latest, long minPosition) {
    public PrefillResult {
        latest = Map.copyOf(latest);
    }

    public boolean isEmpty() {
        return latest.isEmpty();
    }

    public <C extends StreamChangeCache<String>> C seed(final C cache) {
        cache.prefill(latest, minPosition);
        return cache;
    }
}
