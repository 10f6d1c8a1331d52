package io.syncstore.config.impl;

import lombok.Getter;
import lombok.ToString;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Immutable config holder loaded from syncstore.yaml
 */
@Getter
@ToString(exclude = "databasePassword")
public final class StoreConfig {

    public static final int DEFAULT_CHANGE_CACHE_SIZE = 10_000;
    public static final double DEFAULT_CACHE_SIZE_FACTOR = 0.1;
    public static final long DEFAULT_PREFILL_WINDOW = 100_000L;
    public static final int DEFAULT_CLIENT_IP_CACHE_SIZE = 50_000;

    /* 120 seconds; smaller values mean more upserts even for read-only requests. */
    public static final long DEFAULT_LAST_SEEN_GRANULARITY_MS = 120L * 1000L;

    private String databaseUrl;
    private String databaseUsername;
    private String databasePassword;
    private int databaseMaxPoolSize;
    private boolean migrate;

    private int changeCacheSize;
    private double cacheSizeFactor;
    private long prefillWindow;
    private int clientIpCacheSize;

    private long lastSeenGranularityMs;

    public static StoreConfig load(final Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    public static StoreConfig load(final InputStream in, final String source) throws IOException {
        final Map<String, Object> m;
        try {
            m = new Yaml().load(in);
        } catch (final YAMLException e) {
            throw new IOException("Malformed configuration " + source, e);
        }
        if (m == null) {
            throw new IOException("Empty configuration " + source);
        }
        return fromMap(m);
    }

    @SuppressWarnings("unchecked")
    public static StoreConfig fromMap(final Map<String, Object> m) {
        final Map<String, Object> db = (Map<String, Object>) m.getOrDefault("database", Map.of());
        final Map<String, Object> cache = (Map<String, Object>) m.getOrDefault("cache", Map.of());
        final Map<String, Object> clientIp = (Map<String, Object>) m.getOrDefault("clientIp", Map.of());

        final StoreConfig cfg = new StoreConfig();

        cfg.databaseUrl         = (String)  db.get("url");
        cfg.databaseUsername    = (String)  db.getOrDefault("username", "SA");
        cfg.databasePassword    = (String)  db.getOrDefault("password", "");
        cfg.databaseMaxPoolSize = ((Number) db.getOrDefault("maxPoolSize", 8)).intValue();
        cfg.migrate             = (Boolean) db.getOrDefault("migrate", Boolean.TRUE);

        cfg.changeCacheSize   = ((Number) cache.getOrDefault("changeCacheSize", DEFAULT_CHANGE_CACHE_SIZE)).intValue();
        cfg.cacheSizeFactor   = ((Number) cache.getOrDefault("sizeFactor", DEFAULT_CACHE_SIZE_FACTOR)).doubleValue();
        cfg.prefillWindow     = ((Number) cache.getOrDefault("prefillWindow", DEFAULT_PREFILL_WINDOW)).longValue();
        cfg.clientIpCacheSize = ((Number) cache.getOrDefault("clientIpCacheSize", DEFAULT_CLIENT_IP_CACHE_SIZE)).intValue();

        cfg.lastSeenGranularityMs = ((Number) clientIp.getOrDefault(
                "lastSeenGranularityMs", DEFAULT_LAST_SEEN_GRANULARITY_MS)).longValue();

        if (cfg.databaseUrl == null || cfg.databaseUrl.isBlank()) {
            throw new IllegalArgumentException("database.url is required");
        }
        if (cfg.prefillWindow <= 0) {
            throw new IllegalArgumentException("cache.prefillWindow must be positive: " + cfg.prefillWindow);
        }
        return cfg;
    }

    /**
     * Entry limit for each stream change cache once the size factor is applied.
     */
    public int effectiveChangeCacheSize() {
        return Math.max(1, (int) (changeCacheSize * cacheSizeFactor));
    }
}
