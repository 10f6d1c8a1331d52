package io.syncstore.config.type;

import io.syncstore.config.impl.StoreConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;

public final class ConfigLoader {
    public static final String DEFAULT_RESOURCE = "syncstore.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads store configuration from a YAML file by delegating to {@link StoreConfig#load(Path)}.
     * <p>
     * Expected structure:
     * <pre>
     * database:
     *   url: jdbc:hsqldb:file:data/syncstore
     *   username: SA
     *   password: ""
     *   maxPoolSize: 8
     *   migrate: true
     * cache:
     *   changeCacheSize: 10000
     *   sizeFactor: 0.1
     *   prefillWindow: 100000
     *   clientIpCacheSize: 50000
     * clientIp:
     *   lastSeenGranularityMs: 120000
     * </pre>
     *
     * @param path the path to the YAML configuration file
     * @return a populated {@link StoreConfig} instance
     * @throws IOException if the file cannot be read or parsed
     */
    public static StoreConfig load(final String path) throws IOException {
        return StoreConfig.load(Paths.get(path));
    }

    /**
     * Loads the {@code syncstore.yaml} bundled on the classpath.
     */
    public static StoreConfig loadDefault() throws IOException {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("No " + DEFAULT_RESOURCE + " on the classpath");
            }
            return StoreConfig.load(in, "classpath:" + DEFAULT_RESOURCE);
        }
    }
}
