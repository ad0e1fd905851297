package de.bsommerfeld.feedscout.db;

import com.google.inject.Singleton;
import de.bsommerfeld.feedscout.core.domain.SourceEntity;
import de.bsommerfeld.feedscout.core.util.StorageUtils;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * SQLite-backed {@link DedupStore} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every startup; every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. SQLite serializes writes at the file level, and a run issues one
 * bulk read followed by small single-row inserts, so pooling buys nothing.
 *
 * <h3>Idempotent inserts</h3>
 * {@code insert-dedup-entry.sql} is an {@code INSERT OR IGNORE} against the
 * {@code UNIQUE (source_entity, item_id)} constraint. The update count tells
 * whether a row was actually written.
 */
@Singleton
public class SqlDedupStore implements DedupStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDedupStore.class);
    private final String dbUrl;

    @Inject
    public SqlDedupStore() {
        this(StorageUtils.getDedupDatabaseFile());
    }

    public SqlDedupStore(Path databaseFile) {
        Path parent = databaseFile.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (Exception e) {
            LOG.error("Failed to create database directory {}", parent, e);
        }
        this.dbUrl = "jdbc:sqlite:" + databaseFile.toAbsolutePath();
        initialize();
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    private void initialize() {
        LOG.info("Initializing dedup store at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new IllegalStateException("Dedup store initialization failed", e);
        }
    }

    /**
     * Applies the DDL from {@code schema.sql}, one statement at a time, in a
     * single transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql");
                Statement stmt = conn.createStatement()) {

            if (schemaStream == null) {
                throw new SQLException("schema.sql not found in classpath");
            }

            String schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            conn.setAutoCommit(false);
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (sql.trim().isEmpty())
                    continue;
                stmt.execute(sql.trim());
            }
            conn.commit();
            LOG.debug("Dedup schema applied.");
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } catch (Exception e) {
            conn.rollback();
            throw new SQLException("Schema application failed", e);
        }
    }

    @Override
    public Set<String> load(SourceEntity source) {
        Set<String> known = new HashSet<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-known-items"))) {
            ps.setString(1, source.key());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    known.add(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            LOG.error("Failed to load known items for {}", source, e);
            return new HashSet<>();
        }
        LOG.debug("[DB] Loaded {} known items for {}", known.size(), source);
        return known;
    }

    @Override
    public boolean insertIfAbsent(SourceEntity source, String itemId, Instant firstSeenAt) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-dedup-entry"))) {
            ps.setString(1, source.key());
            ps.setString(2, itemId);
            ps.setLong(3, firstSeenAt.toEpochMilli());
            boolean written = ps.executeUpdate() > 0;
            if (!written) {
                LOG.debug("[DB] {} already known for {}", itemId, source);
            }
            return written;
        } catch (SQLException e) {
            LOG.error("Failed to persist {} for {}; it may be re-discovered next run", itemId, source, e);
            return false;
        }
    }

    @Override
    public int count(SourceEntity source) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-known-items"))) {
            ps.setString(1, source.key());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            LOG.error("Failed to count known items for {}", source, e);
            return 0;
        }
    }
}
