package io.syncstore.storage;

import io.syncstore.cache.ChangeStatus;
import io.syncstore.cache.StreamChangeCache;
import io.syncstore.config.impl.StoreConfig;
import io.syncstore.id.AllocationTicket;
import io.syncstore.id.ChainedToken;
import io.syncstore.id.StreamIdAllocator;
import io.syncstore.id.StreamTicket;
import io.syncstore.storage.db.Database;
import io.syncstore.storage.db.StorageException;
import io.syncstore.storage.db.TestDatabases;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class StreamWriterTest {

    private static final long NOW = 1_700_000_000_000L;

    @Test
    void committedWriteAdvancesTokenAndCache() {
        final StoreConfig cfg = TestDatabases.config();
        try (final Database db = Database.open(cfg)) {
            final SyncStore store = SyncStore.bootstrap(db, cfg, new MutableClock(NOW));

            final long pos = store.getEventsWriter().write("persist_event", "room1", (txn, ticket) -> {
                txn.update("INSERT INTO events (stream_ordering, event_id, room_id) VALUES (?, ?, ?)",
                        ticket.position(), "$e1", "room1");
                return ticket.position();
            });

            assertEquals(0L, pos);
            assertEquals(0L, store.getEventStreamIds().currentToken());
            assertEquals(0, store.getEventStreamIds().outstandingCount());
            assertEquals(ChangeStatus.CHANGED, store.getEventsStreamCache().entityHasChangedSince("room1", -1L));
            assertEquals(ChangeStatus.UNCHANGED, store.getEventsStreamCache().entityHasChangedSince("room2", -1L));
        }
    }

    @Test
    void failedWriteReleasesTicketWithoutTouchingCache() {
        final StoreConfig cfg = TestDatabases.config();
        try (final Database db = Database.open(cfg)) {
            final SyncStore store = SyncStore.bootstrap(db, cfg, new MutableClock(NOW));

            assertThrows(StorageException.class, () -> store.getEventsWriter().write("persist_event", "room1",
                    (txn, ticket) -> {
                        throw new SQLException("constraint violated");
                    }));

            assertEquals(0, store.getEventStreamIds().outstandingCount());
            assertEquals(0L, store.getEventStreamIds().currentToken());
            assertEquals(ChangeStatus.UNCHANGED, store.getEventsStreamCache().entityHasChangedSince("room1", -1L));

            // The aborted position is skipped for good.
            final long next = store.getEventsWriter().write("persist_event", "room1", (txn, ticket) -> ticket.position());
            assertEquals(1L, next);
            assertEquals(1L, store.getEventStreamIds().currentToken());
        }
    }

    @Test
    void receiptsWriterHasNoCache() {
        final StoreConfig cfg = TestDatabases.config();
        try (final Database db = Database.open(cfg)) {
            final SyncStore store = SyncStore.bootstrap(db, cfg, new MutableClock(NOW));

            final int rows = store.getReceiptsWriter().write("insert_receipt", "room1", (txn, ticket) ->
                    txn.update("INSERT INTO receipts_linearized (stream_id, room_id, receipt_type, user_id, event_id)"
                            + " VALUES (?, ?, ?, ?, ?)", ticket.position(), "room1", "m.read", "@a:example.org", "$e"));

            assertEquals(1, rows);
            assertEquals(0L, store.getReceiptsStreamIds().currentToken());
        }
    }

    @Test
    void pushRulesWriterCarriesEventsPosition() {
        final StoreConfig cfg = TestDatabases.config();
        try (final Database db = Database.open(cfg)) {
            final SyncStore store = SyncStore.bootstrap(db, cfg, new MutableClock(NOW));

            store.getEventsWriter().write("persist_event", "room1", (txn, ticket) -> ticket.position());
            store.getEventsWriter().write("persist_event", "room1", (txn, ticket) -> ticket.position());

            final ChainedToken token = store.getPushRulesWriter().write("add_push_rule", "@a:example.org",
                    (txn, ticket) -> {
                        txn.update("INSERT INTO push_rules_stream (stream_id, event_stream_ordering, user_id, rule_id, op)"
                                        + " VALUES (?, ?, ?, ?, ?)",
                                ticket.position(), ticket.parentPosition(), "@a:example.org", "rule", "ADD");
                        return ticket.token();
                    });

            assertEquals(new ChainedToken(0L, 1L), token);
            assertEquals(new ChainedToken(0L, 1L), store.getPushRulesStreamIds().currentToken());
            assertEquals(ChangeStatus.CHANGED,
                    store.getPushRulesStreamCache().entityHasChangedSince("@a:example.org", -1L));
        }
    }

    @Test
    void cacheReportsChangeBeforeTokenAdvances() {
        try (final Database db = TestDatabases.migrated()) {
            final StreamIdAllocator ids = new StreamIdAllocator("events", -1L);
            final StreamChangeCache<String> cache = new StreamChangeCache<>("events", -1L, 10);
            final List<String> seenOnRelease = new ArrayList<>();

            final StreamWriter<ObservedTicket> writer = new StreamWriter<>("events", db,
                    () -> new ObservedTicket(ids.reserveOne(), () -> seenOnRelease.add(
                            "token=" + ids.currentToken() + " " + cache.entityHasChangedSince("room1", -1L))),
                    cache);

            writer.write("persist_event", "room1", (txn, ticket) -> ticket.position());

            assertEquals(List.of("token=0 CHANGED"), seenOnRelease);
        }
    }

    /* Runs a check right after the wrapped ticket has been released. */
    private static final class ObservedTicket implements StreamTicket {
        private final AllocationTicket inner;
        private final Runnable afterRelease;

        ObservedTicket(final AllocationTicket inner, final Runnable afterRelease) {
            this.inner = inner;
            this.afterRelease = afterRelease;
        }

        @Override
        public long position() {
            return inner.position();
        }

        @Override
        public boolean isReleased() {
            return inner.isReleased();
        }

        @Override
        public void close() {
            inner.close();
            afterRelease.run();
        }
    }
}
