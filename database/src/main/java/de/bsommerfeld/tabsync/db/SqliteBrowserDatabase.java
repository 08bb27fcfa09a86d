package de.bsommerfeld.tabsync.db;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tabsync.core.config.StorageConfig;
import de.bsommerfeld.tabsync.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * SQLite-backed {@link BrowserDatabase}.
 *
 * <p>
 * The schema is applied from {@code schema.sql} on construction; every DDL
 * statement uses {@code IF NOT EXISTS}, so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per unit of work and closed right
 * after. SQLite serializes writes at the file level anyway, so pooling buys
 * nothing. A fresh connection also starts with a last inserted row id of
 * {@code 0}, which the insert checks in {@link SqlRemoteClientsAndTabs} rely
 * on.
 *
 * <h3>Threading</h3>
 * <ul>
 * <li><strong>Writes</strong> ({@link #transaction}, {@link #run}) go to a
 * single-thread executor: one writer at a time.</li>
 * <li><strong>Reads</strong> ({@link #runQuery}, {@link #withConnection})
 * go to a small fixed pool. With WAL enabled they never wait for the
 * writer.</li>
 * </ul>
 */
@Singleton
public class SqliteBrowserDatabase implements BrowserDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteBrowserDatabase.class);

    private final String dbUrl;
    private final StorageConfig config;
    private final SyncStorageObserver observer;
    private final ExecutorService writeExecutor;
    private final ExecutorService readExecutor;

    @Inject
    public SqliteBrowserDatabase(StorageConfig config, SyncStorageObserver observer) {
        this(StorageUtils.resolveDatabasePath(StorageUtils.APP_NAME, config), config, observer);
    }

    public SqliteBrowserDatabase(Path databaseFile, StorageConfig config, SyncStorageObserver observer) {
        this.config = config;
        this.observer = observer;

        Path parent = databaseFile.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create database directory " + parent, e);
        }
        this.dbUrl = "jdbc:sqlite:" + databaseFile.toAbsolutePath();

        this.writeExecutor = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("tabsync-db-writer").setDaemon(true).build());
        this.readExecutor = Executors.newFixedThreadPool(Math.max(1, config.getReaderThreads()),
                new ThreadFactoryBuilder().setNameFormat("tabsync-db-reader-%d").setDaemon(true).build());

        initialize();
    }

    Connection getConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(dbUrl);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA busy_timeout = " + config.getBusyTimeoutMillis());
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    private void initialize() {
        LOG.info("Initializing Database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            if (config.isWalEnabled()) {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("PRAGMA journal_mode = WAL");
                }
            }
            applySchema(conn);
        } catch (SQLException e) {
            throw new IllegalStateException("Database initialization failed", e);
        }
    }

    /**
     * Applies every statement of {@code schema.sql} in one transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        List<String> statements = SqlLoader.loadScript("schema.sql");
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
            conn.commit();
            LOG.info("Database schema applied ({} statements).", statements.size());
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    // =====================================================================
    // BrowserDatabase
    // =====================================================================

    @Override
    public CompletableFuture<Void> run(String sql, Object... args) {
        return transaction(conn -> {
            conn.executeChange(sql, args);
            return null;
        });
    }

    @Override
    public <T> CompletableFuture<List<T>> runQuery(String sql, RowDecoder<T> decoder, Object... args) {
        return withConnection(conn -> conn.executeQuery(sql, decoder, args));
    }

    @Override
    public <T> CompletableFuture<T> transaction(ConnectionWork<T> work) {
        return submit(writeExecutor, () -> {
            try (Connection conn = getConnection()) {
                conn.setAutoCommit(false);
                try {
                    T result = work.apply(wrap(conn));
                    conn.commit();
                    return result;
                } catch (SQLException | RuntimeException e) {
                    try {
                        conn.rollback();
                    } catch (SQLException rollbackFailure) {
                        e.addSuppressed(rollbackFailure);
                    }
                    observer.onTransactionFailed(e);
                    throw e;
                }
            }
        });
    }

    @Override
    public <T> CompletableFuture<T> withConnection(ConnectionWork<T> work) {
        return submit(readExecutor, () -> {
            try (Connection conn = getConnection()) {
                return work.apply(wrap(conn));
            }
        });
    }

    /**
     * Drains queued work (up to 30s per executor), then shuts both
     * executors down. Work submitted afterwards fails with
     * {@link RejectedExecutionException}.
     */
    public void shutdown() {
        LOG.info("Shutting down SqliteBrowserDatabase...");
        awaitShutdown(writeExecutor, "writer");
        awaitShutdown(readExecutor, "reader");
    }

    private void awaitShutdown(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                LOG.warn("Database {} executor forced to shut down (timed out).", name);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private DatabaseConnection wrap(Connection conn) {
        return new DatabaseConnection(conn, config.getDecodeFailurePolicy(), observer);
    }

    private static <T> CompletableFuture<T> submit(ExecutorService executor, SqlTask<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    future.complete(task.call());
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                    if (t instanceof Error)
                        throw (Error) t;
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    @FunctionalInterface
    private interface SqlTask<T> {
        T call() throws SQLException;
    }
}
