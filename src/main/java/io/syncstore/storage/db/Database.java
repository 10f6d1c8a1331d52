package io.syncstore.storage.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.syncstore.config.impl.StoreConfig;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Shared database handle. Each {@link #runInteraction} borrows a pooled connection
 * for exactly one transaction through a {@link TransactionTemplate}, which also
 * restores the connection's autocommit state afterwards.
 */
@Slf4j
public final class Database implements AutoCloseable {
    private final DataSource dataSource;
    private final boolean ownsDataSource;
    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    public Database(final DataSource dataSource) {
        this(dataSource, false);
    }

    private Database(final DataSource dataSource, final boolean ownsDataSource) {
        this.dataSource = dataSource;
        this.ownsDataSource = ownsDataSource;
        this.jdbc = new JdbcTemplate(dataSource);
        this.tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    /**
     * Opens a pooled database from configuration, running schema migrations when
     * {@code database.migrate} is set.
     */
    public static Database open(final StoreConfig cfg) {
        final HikariConfig hc = new HikariConfig();
        hc.setPoolName("syncstore");
        hc.setJdbcUrl(cfg.getDatabaseUrl());
        hc.setUsername(cfg.getDatabaseUsername());
        hc.setPassword(cfg.getDatabasePassword());
        hc.setMaximumPoolSize(cfg.getDatabaseMaxPoolSize());
        hc.setMinimumIdle(1);
        hc.setAutoCommit(true);
        hc.setConnectionTimeout(5_000);
        hc.setValidationTimeout(5_000);

        final HikariDataSource ds;
        try {
            ds = new HikariDataSource(hc);
        } catch (final RuntimeException e) {
            throw new StorageException("Failed to open database " + cfg.getDatabaseUrl(), e);
        }

        final Database db = new Database(ds, true);
        if (cfg.isMigrate()) {
            try {
                db.migrate();
            } catch (final RuntimeException e) {
                ds.close();
                throw e;
            }
        }
        log.info("Opened database {} (pool size {})", cfg.getDatabaseUrl(), cfg.getDatabaseMaxPoolSize());
        return db;
    }

    public void migrate() {
        try {
            Flyway.configure()
                    .dataSource(dataSource)
                    .locations("classpath:db/migration/syncstore")
                    .load()
                    .migrate();
        } catch (final RuntimeException e) {
            throw new StorageException("Schema migration failed", e);
        }
    }

    /**
     * Runs {@code fn} in its own transaction: commit on success, rollback and rethrow
     * on any failure. JDBC and transaction errors surface as {@link StorageException}
     * naming {@code desc}; other runtime exceptions propagate as thrown.
     */
    public <T> T runInteraction(final String desc, final TxnFunction<T> fn) {
        final long start = System.nanoTime();
        try {
            return tx.execute(status -> {
                try {
                    return fn.apply(new Transaction(jdbc));
                } catch (final SQLException e) {
                    throw new StorageException(desc + " failed", e);
                }
            });
        } catch (final DataAccessException | TransactionException e) {
            throw new StorageException(desc + " failed", e);
        } finally {
            if (log.isDebugEnabled()) {
                log.debug("[TXN END] {} took {} us", desc, (System.nanoTime() - start) / 1_000L);
            }
        }
    }

    @Override
    public void close() {
        if (ownsDataSource && dataSource instanceof HikariDataSource hds) {
            hds.close();
        }
    }
}
