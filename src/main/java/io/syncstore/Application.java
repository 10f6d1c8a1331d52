package io.syncstore;

import io.syncstore.config.impl.StoreConfig;
import io.syncstore.config.type.ConfigLoader;
import io.syncstore.storage.SyncStore;
import io.syncstore.storage.db.Database;
import io.syncstore.storage.db.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Opens the database, bootstraps the storage core and keeps it alive until the
 * process is stopped.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        /* Explicit path wins; otherwise the bundled syncstore.yaml */
        final StoreConfig cfg = args.length > 0
                ? ConfigLoader.load(args[0])
                : ConfigLoader.loadDefault();
        log.info("Loaded configuration {}", cfg);

        final Database database;
        final SyncStore store;
        try {
            database = Database.open(cfg);
        } catch (final StorageException e) {
            log.error("Cannot open database, refusing to start", e);
            System.exit(1);
            return;
        }

        try {
            store = SyncStore.bootstrap(database, cfg, Clock.systemUTC());
        } catch (final StorageException e) {
            log.error("Storage bootstrap failed, refusing to start without trustworthy stream positions", e);
            database.close();
            System.exit(1);
            return;
        }

        log.info("Events stream at {} (max {}), {} rooms in {}",
                store.getEventStreamIds().currentToken(),
                store.getEventStreamIds().maxToken(),
                store.getEventsStreamCache().size(),
                store.getEventsStreamCache().name());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down storage");
            database.close();
        }, "syncstore-shutdown"));

        Thread.currentThread().join();
    }
}
