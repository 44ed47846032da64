package de.bsommerfeld.swiftview.db;

import com.google.common.collect.Lists;
import de.bsommerfeld.swiftview.core.config.ReadPolicy;
import de.bsommerfeld.swiftview.core.domain.CacheRow;
import de.bsommerfeld.swiftview.core.domain.FileStat;
import de.bsommerfeld.swiftview.core.domain.TargetSize;
import de.bsommerfeld.swiftview.db.migration.MigrationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * The per-folder persistent thumbnail cache: one SQLite file, one
 * {@code thumbnails} table keyed by normalized path.
 *
 * <p>
 * Every statement goes through the store's {@link StoreOperator}. Writes are
 * asynchronous and serialized; reads take an explicit {@link ReadPolicy} at
 * each call site. All SQL lives in {@code sql/*.sql}.
 *
 * <p>
 * Instances come from {@link ThumbnailStores#open}, which has already
 * migrated the file to the latest schema.
 */
public class ThumbnailStore implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ThumbnailStore.class);

    private final StoreOperator operator;
    private final boolean created;
    private final MigrationReport migration;

    ThumbnailStore(StoreOperator operator, boolean created, MigrationReport migration) {
        this.operator = operator;
        this.created = created;
        this.migration = migration;
    }

    public Path file() {
        return operator.file();
    }

    /** Whether the file did not exist before this store was opened. */
    public boolean isNew() {
        return created;
    }

    public MigrationReport migration() {
        return migration;
    }

    public StoreOperator operator() {
        return operator;
    }

    // =====================================================================
    // Reads
    // =====================================================================

    public CompletableFuture<Optional<CacheRow>> probe(String path, ReadPolicy policy) {
        return operator.read(policy, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-row"))) {
                ps.setString(1, path);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(CacheRowMapper.map(rs)) : Optional.empty();
                }
            }
        });
    }

    /**
     * Bulk validity check for an opened folder. Paths are looked up in
     * chunks of {@code scanChunkSize} with one {@code IN (...)} query each.
     *
     * <p>
     * The stream is lazy and blocks the consuming thread once per chunk, so
     * consume it off any UI-adjacent thread. Results come in input order.
     *
     * @throws StoreException from the terminal operation if a chunk query
     *                        fails
     */
    public Stream<ScanResult> scanExisting(List<FileStat> stats, TargetSize thumbSize, ReadPolicy policy) {
        if (stats.isEmpty())
            return Stream.empty();
        return Lists.partition(stats, operator.settings().scanChunkSize()).stream()
                .flatMap(chunk -> scanChunk(chunk, thumbSize, policy).stream());
    }

    private List<ScanResult> scanChunk(List<FileStat> chunk, TargetSize thumbSize, ReadPolicy policy) {
        List<String> keys = chunk.stream().map(FileStat::path).toList();
        Map<String, CacheRow> rows = StoreOperator.await(operator.read(policy, conn -> selectRows(conn, keys)));

        List<ScanResult> results = new ArrayList<>(chunk.size());
        for (FileStat stat : chunk) {
            CacheRow row = rows.get(stat.path());
            if (row instanceof CacheRow.Populated populated && populated.isValidFor(stat, thumbSize)) {
                results.add(new ScanResult.Valid(populated));
            } else {
                boolean metaCurrent = row instanceof CacheRow.MetaOnly && row.isValidFor(stat, thumbSize);
                results.add(new ScanResult.Missing(stat, metaCurrent));
            }
        }
        return results;
    }

    private static Map<String, CacheRow> selectRows(Connection conn, List<String> keys) throws SQLException {
        String placeholders = String.join(",", Collections.nCopies(keys.size(), "?"));
        String sql = String.format(SqlLoader.load("select-rows-for-paths"), placeholders);

        Map<String, CacheRow> rows = new HashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < keys.size(); i++)
                ps.setString(i + 1, keys.get(i));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    CacheRow row = CacheRowMapper.map(rs);
                    rows.put(row.path(), row);
                }
            }
        }
        return rows;
    }

    public CompletableFuture<Integer> rowCount() {
        return operator.scheduleRead(conn -> {
            try (Statement st = conn.createStatement();
                    ResultSet rs = st.executeQuery(SqlLoader.load("count-rows"))) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    /** Current schema version, read through the operator. */
    public int schemaVersion() {
        return operator.readSync(conn -> {
            try (Statement st = conn.createStatement();
                    ResultSet rs = st.executeQuery("PRAGMA user_version")) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    // =====================================================================
    // Writes
    // =====================================================================

    /** Replaces the row for {@code row.path()}. Rows are never merged. */
    public CompletableFuture<Void> upsert(CacheRow row) {
        return operator.scheduleWrite(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-row"))) {
                CacheRowMapper.bind(ps, row);
                ps.executeUpdate();
            }
            return null;
        });
    }

    /** Replaces all given rows in one transaction. */
    public CompletableFuture<Void> upsertMany(Collection<? extends CacheRow> rows) {
        if (rows.isEmpty())
            return CompletableFuture.completedFuture(null);
        List<CacheRow> copy = List.copyOf(rows);
        return operator.scheduleWrite(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-row"))) {
                for (CacheRow row : copy) {
                    CacheRowMapper.bind(ps, row);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            if (copy.size() > 1)
                LOG.debug("Upserted {} rows into {}", copy.size(), operator.file().getFileName());
            return null;
        });
    }

    /**
     * Writes metadata-only rows for files that have no thumbnail yet, all in
     * one transaction.
     */
    public CompletableFuture<Void> upsertMeta(Collection<FileStat> stats, TargetSize thumbSize) {
        long now = System.currentTimeMillis();
        return upsertMany(stats.stream().map(s -> CacheRow.metaOnly(s, thumbSize, now)).toList());
    }

    /**
     * Turns the row into a metadata-only row. Used when a stored thumbnail
     * turned out to be undecodable.
     */
    public CompletableFuture<Void> clearThumbnail(String path) {
        return executeUpdate("clear-thumbnail", path).thenApply(n -> null);
    }

    public CompletableFuture<Void> delete(String path) {
        return executeUpdate("delete-row", path).thenApply(n -> null);
    }

    /** Removes every row. Returns the number of rows removed. */
    public CompletableFuture<Integer> deleteAll() {
        return operator.scheduleWrite(conn -> {
            try (Statement st = conn.createStatement()) {
                return st.executeUpdate(SqlLoader.load("delete-all"));
            }
        });
    }

    /**
     * Deletes rows whose path is not in {@code keep}, e.g. files removed from
     * the folder since the last visit. Returns the number of rows removed.
     */
    public CompletableFuture<Integer> retainOnly(Set<String> keep) {
        Set<String> retained = Set.copyOf(keep);
        return operator.scheduleWrite(conn -> {
            List<String> stale = new ArrayList<>();
            try (Statement st = conn.createStatement();
                    ResultSet rs = st.executeQuery(SqlLoader.load("select-all-paths"))) {
                while (rs.next()) {
                    String path = rs.getString(1);
                    if (!retained.contains(path))
                        stale.add(path);
                }
            }
            if (stale.isEmpty())
                return 0;
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-row"))) {
                for (String path : stale) {
                    ps.setString(1, path);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            LOG.debug("Removed {} stale rows from {}", stale.size(), operator.file().getFileName());
            return stale.size();
        });
    }

    private CompletableFuture<Integer> executeUpdate(String sqlName, String path) {
        return operator.scheduleWrite(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
                ps.setString(1, path);
                return ps.executeUpdate();
            }
        });
    }

    /** Drains pending writes and releases the operator's threads. */
    @Override
    public void close() {
        operator.close();
    }

    @Override
    public String toString() {
        return "ThumbnailStore[" + operator.file() + "]";
    }
}
