package io.syncstore.storage;

import io.syncstore.cache.CoalescingUpsertCache;
import io.syncstore.cache.StreamChangeCache;
import io.syncstore.cache.prefill.CachePrefill;
import io.syncstore.config.impl.StoreConfig;
import io.syncstore.id.AllocationTicket;
import io.syncstore.id.ChainedStreamIdAllocator;
import io.syncstore.id.ChainedTicket;
import io.syncstore.id.IdAllocator;
import io.syncstore.id.StreamIdAllocator;
import io.syncstore.storage.db.Database;
import io.syncstore.storage.db.Transaction;
import io.syncstore.storage.model.ClientIpKey;
import io.syncstore.storage.model.PresenceState;
import io.syncstore.storage.model.UserIpRecord;
import io.syncstore.storage.model.UserPresenceState;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Storage facade: one instance of every stream allocator, id allocator and change
 * cache, built once from the database at startup and handed to the per-domain
 * stores that need them.
 */
@Slf4j
@Getter
public final class SyncStore {
    private static final long DAY_MS = 24L * 60L * 60L * 1000L;

    private static final RowMapper<UserPresenceState> PRESENCE_MAPPER = (rs, rowNum) -> new UserPresenceState(
            rs.getString("user_id"),
            PresenceState.fromDb(rs.getString("state")),
            rs.getLong("last_active_ts"),
            rs.getLong("last_federation_update_ts"),
            rs.getLong("last_user_sync_ts"),
            rs.getString("status_msg"),
            rs.getBoolean("currently_active"));

    private static final RowMapper<UserIpRecord> USER_IP_MAPPER = (rs, rowNum) -> new UserIpRecord(
            rs.getString("access_token"),
            rs.getString("ip"),
            rs.getString("user_agent"),
            rs.getLong("last_seen"));

    @Getter(AccessLevel.NONE)
    private final Database database;
    @Getter(AccessLevel.NONE)
    private final Clock clock;
    @Getter(AccessLevel.NONE)
    private final long lastSeenGranularityMs;
    @Getter(AccessLevel.NONE)
    private final AtomicReference<List<UserPresenceState>> presenceOnStartup;

    /* Lowest event ordering; backfilled events are numbered downwards from -1. */
    private final long minStreamToken;

    private final StreamIdAllocator eventStreamIds;
    private final StreamIdAllocator receiptsStreamIds;
    private final StreamIdAllocator accountDataStreamIds;
    private final StreamIdAllocator presenceStreamIds;
    private final ChainedStreamIdAllocator pushRulesStreamIds;

    private final IdAllocator transactionIds;
    private final IdAllocator stateGroupIds;
    private final IdAllocator accessTokenIds;
    private final IdAllocator refreshTokenIds;
    private final IdAllocator pusherIds;
    private final IdAllocator pushRuleIds;
    private final IdAllocator pushRulesEnableIds;

    private final StreamChangeCache<String> eventsStreamCache;
    private final StreamChangeCache<String> membershipStreamCache;
    private final StreamChangeCache<String> accountDataStreamCache;
    private final StreamChangeCache<String> presenceStreamCache;
    private final StreamChangeCache<String> pushRulesStreamCache;

    private final CoalescingUpsertCache<ClientIpKey> clientIpLastSeen;

    private final StreamWriter<AllocationTicket> eventsWriter;
    private final StreamWriter<AllocationTicket> receiptsWriter;
    private final StreamWriter<AllocationTicket> accountDataWriter;
    private final StreamWriter<AllocationTicket> presenceWriter;
    private final StreamWriter<ChainedTicket> pushRulesWriter;

    private SyncStore(final Database database, final StoreConfig cfg, final Clock clock, final Transaction txn) {
        this.database = database;
        this.clock = clock;
        this.lastSeenGranularityMs = cfg.getLastSeenGranularityMs();

        this.minStreamToken = loadMinStreamToken(txn);

        this.eventStreamIds = load(txn, StreamTable.EVENTS);
        this.receiptsStreamIds = load(txn, StreamTable.RECEIPTS);
        this.accountDataStreamIds = load(txn, StreamTable.ACCOUNT_DATA);
        this.presenceStreamIds = load(txn, StreamTable.PRESENCE);
        this.pushRulesStreamIds = ChainedStreamIdAllocator.load(txn,
                StreamTable.PUSH_RULES.table(), StreamTable.PUSH_RULES.column(), eventStreamIds);

        this.transactionIds = IdAllocator.load(txn, "sent_transactions", "id");
        this.stateGroupIds = IdAllocator.load(txn, "state_groups", "id");
        this.accessTokenIds = IdAllocator.load(txn, "access_tokens", "id");
        this.refreshTokenIds = IdAllocator.load(txn, "refresh_tokens", "id");
        this.pusherIds = IdAllocator.load(txn, "pushers", "id");
        this.pushRuleIds = IdAllocator.load(txn, "push_rules", "id");
        this.pushRulesEnableIds = IdAllocator.load(txn, "push_rules_enable", "id");

        final int cacheSize = cfg.effectiveChangeCacheSize();
        final CachePrefill prefill = new CachePrefill(cfg.getPrefillWindow());

        final long eventsMax = eventStreamIds.maxToken();
        this.eventsStreamCache = prefill
                .run(txn, StreamTable.EVENTS.table(), "room_id", StreamTable.EVENTS.column(), eventsMax)
                .seed(new StreamChangeCache<>("EventsRoomStreamChangeCache", eventsMax, cacheSize));

        this.membershipStreamCache = new StreamChangeCache<>("MembershipStreamChangeCache", eventsMax, cacheSize);

        this.accountDataStreamCache = new StreamChangeCache<>(
                "AccountDataAndTagsChangeCache", accountDataStreamIds.maxToken(), cacheSize);

        this.presenceOnStartup = new AtomicReference<>(loadActivePresence(txn));

        final long presenceMax = presenceStreamIds.maxToken();
        this.presenceStreamCache = prefill
                .run(txn, StreamTable.PRESENCE.table(), "user_id", StreamTable.PRESENCE.column(), presenceMax)
                .seed(new StreamChangeCache<>("PresenceStreamChangeCache", presenceMax, cacheSize));

        final long pushRulesMax = pushRulesStreamIds.maxToken();
        this.pushRulesStreamCache = prefill
                .run(txn, StreamTable.PUSH_RULES.table(), "user_id", StreamTable.PUSH_RULES.column(), pushRulesMax)
                .seed(new StreamChangeCache<>("PushRulesStreamChangeCache", pushRulesMax, cacheSize));

        this.clientIpLastSeen = new CoalescingUpsertCache<>("client_ip_last_seen", cfg.getClientIpCacheSize());

        this.eventsWriter = new StreamWriter<>("events", database, eventStreamIds::reserveOne, eventsStreamCache);
        this.receiptsWriter = new StreamWriter<>("receipts", database, receiptsStreamIds::reserveOne, null);
        this.accountDataWriter = new StreamWriter<>("account_data", database,
                accountDataStreamIds::reserveOne, accountDataStreamCache);
        this.presenceWriter = new StreamWriter<>("presence", database,
                presenceStreamIds::reserveOne, presenceStreamCache);
        this.pushRulesWriter = new StreamWriter<>("push_rules", database,
                pushRulesStreamIds::reserveOne, pushRulesStreamCache);
    }

    /**
     * Reads allocator floors, prefills the change caches and snapshots active
     * presence in a single startup transaction.
     *
     * @throws io.syncstore.storage.db.StorageException if the database cannot be read;
     *                                                  the store must not start without it
     */
    public static SyncStore bootstrap(final Database database, final StoreConfig cfg, final Clock clock) {
        final SyncStore store = database.runInteraction("bootstrap_storage",
                txn -> new SyncStore(database, cfg, clock, txn));
        log.info("Storage ready: events={} receipts={} account_data={} presence={} push_rules={} min_stream={}",
                store.eventStreamIds.currentToken(),
                store.receiptsStreamIds.currentToken(),
                store.accountDataStreamIds.currentToken(),
                store.presenceStreamIds.currentToken(),
                store.pushRulesStreamIds.currentToken(),
                store.minStreamToken);
        return store;
    }

    private static StreamIdAllocator load(final Transaction txn, final StreamTable stream) {
        return StreamIdAllocator.load(txn, stream.table(), stream.column());
    }

    private static long loadMinStreamToken(final Transaction txn) {
        final Long stored = txn.queryForObject("SELECT MIN(stream_ordering) FROM events", Long.class);
        final long min = stored == null || stored == 0L ? -1L : stored;
        return Math.min(min, -1L);
    }

    private static List<UserPresenceState> loadActivePresence(final Transaction txn) {
        return txn.query(
                "SELECT user_id, state, last_active_ts, last_federation_update_ts,"
                        + " last_user_sync_ts, status_msg, currently_active FROM presence_stream"
                        + " WHERE state <> ?",
                PRESENCE_MAPPER,
                PresenceState.OFFLINE.dbValue());
    }

    /**
     * Hands out the presence snapshot taken at startup. Only the first caller gets it.
     */
    public List<UserPresenceState> takePresenceStartupInfo() {
        final List<UserPresenceState> taken = presenceOnStartup.getAndSet(null);
        return taken != null ? taken : List.of();
    }

    /**
     * Records that a client was seen, at most once per granularity window per
     * (user, token, ip).
     *
     * @return true if {@code user_ips} was written
     */
    public boolean insertClientIp(final String userId,
                                  final String accessToken,
                                  final String ip,
                                  final String userAgent) {
        final long now = clock.millis();
        if (!clientIpLastSeen.shouldWrite(new ClientIpKey(userId, accessToken, ip), now, lastSeenGranularityMs)) {
            return false;
        }

        final Map<String, Object> keys = new LinkedHashMap<>();
        keys.put("user_id", userId);
        keys.put("access_token", accessToken);
        keys.put("ip", ip);
        keys.put("user_agent", userAgent);

        database.runInteraction("insert_client_ip",
                txn -> txn.upsert("user_ips", keys, Map.of("last_seen", now)));
        return true;
    }

    /**
     * Users seen in the last 24 hours.
     */
    public long countDailyUsers() {
        final long since = clock.millis() - DAY_MS;
        final Long users = database.runInteraction("count_users", txn -> txn.queryForObject(
                "SELECT COUNT(DISTINCT user_id) FROM user_ips WHERE last_seen > ?", Long.class, since));
        return users == null ? 0L : users;
    }

    public List<UserIpRecord> getUserIpAndAgents(final String userId) {
        return database.runInteraction("get_user_ip_and_agents", txn -> txn.query(
                "SELECT access_token, ip, user_agent, last_seen FROM user_ips WHERE user_id = ?",
                USER_IP_MAPPER,
                userId));
    }

    /**
     * True when every registered user name ends in {@code :domain}.
     */
    public static boolean areAllUsersOnDomain(final Transaction txn, final String domain) {
        final Long outside = txn.queryForObject(
                "SELECT COUNT(*) FROM users WHERE name NOT LIKE ?", Long.class, "%:" + domain);
        return outside != null && outside == 0L;
    }
}
