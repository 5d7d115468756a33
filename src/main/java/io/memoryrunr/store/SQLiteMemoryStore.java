package io.memoryrunr.store;

import io.memoryrunr.error.PipelineException;
import io.memoryrunr.model.AgeCategory;
import io.memoryrunr.model.Association;
import io.memoryrunr.model.AssociationKind;
import io.memoryrunr.model.ClusterCentroid;
import io.memoryrunr.model.ConsolidatedMemory;
import io.memoryrunr.model.ConsolidationState;
import io.memoryrunr.model.Episode;
import io.memoryrunr.model.EpisodeState;
import io.memoryrunr.model.ItemStage;
import io.memoryrunr.model.MemoryItem;
import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.model.SemanticNode;
import io.memoryrunr.model.SourceMemory;
import io.memoryrunr.model.WatermarkRecord;
import io.memoryrunr.support.ContentHashes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * SQLite-backed durable store for every pipeline stage.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code raw_memories}: upstream feed, its rowid is the arrival sequence</li>
 *   <li>{@code memory_items}, {@code episodes}, {@code consolidated_memories}, {@code associations},
 *       {@code semantic_nodes}, {@code cluster_centroids}: stage outputs</li>
 *   <li>{@code access_events}: retrieval log behind the 7-day access frequency</li>
 *   <li>{@code watermarks}, {@code run_locks}, {@code quarantine}: pipeline bookkeeping</li>
 * </ul>
 *
 * <p>All timestamps are stored as epoch milliseconds. Strength columns carry CHECK constraints so a
 * value outside [0,1] fails its write and gets quarantined instead of being persisted.</p>
 */
public class SQLiteMemoryStore implements MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteMemoryStore.class);
    private static final int IN_CHUNK = 500;

    private final DataSource dataSource;
    private final Clock clock;

    public SQLiteMemoryStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        try (Connection connection = dataSource.getConnection()) {
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
            }
            createSchema(connection);
            log.info("SQLiteMemoryStore schema ready");
        } catch (SQLException e) {
            log.error("Failed to initialize SQLite memory store", e);
            throw new PipelineException("Memory store initialization failed", e);
        }
    }

    private void createSchema(Connection connection) throws SQLException {
        try (var stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS raw_memories (
                    id TEXT PRIMARY KEY,
                    content_ref TEXT NOT NULL,
                    created_at INTEGER NOT NULL,
                    metadata TEXT NOT NULL DEFAULT '{}',
                    content_hash TEXT NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_raw_created ON raw_memories(created_at)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS memory_items (
                    id TEXT PRIMARY KEY,
                    content_ref TEXT NOT NULL,
                    content TEXT,
                    created_at INTEGER NOT NULL,
                    salience REAL NOT NULL CHECK (salience BETWEEN 0 AND 1),
                    importance REAL NOT NULL CHECK (importance BETWEEN 0 AND 1),
                    sentiment REAL NOT NULL CHECK (sentiment BETWEEN -1 AND 1),
                    stage TEXT NOT NULL CHECK (stage IN ('ACTIVE', 'PENDING', 'EPISODIC', 'DISCARDED')),
                    strength REAL NOT NULL CHECK (strength BETWEEN 0 AND 1),
                    co_activation_count INTEGER NOT NULL DEFAULT 0,
                    admitted_at INTEGER,
                    arrival_seq INTEGER NOT NULL,
                    episode_id TEXT,
                    source_hash TEXT,
                    content_hash TEXT NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_items_stage ON memory_items(stage, admitted_at)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS episodes (
                    id TEXT PRIMARY KEY,
                    category TEXT NOT NULL,
                    topics TEXT NOT NULL DEFAULT '[]',
                    window_start INTEGER NOT NULL,
                    window_end INTEGER NOT NULL,
                    item_ids TEXT NOT NULL,
                    recency_factor REAL NOT NULL CHECK (recency_factor BETWEEN 0 AND 1),
                    emotional_salience REAL NOT NULL CHECK (emotional_salience BETWEEN 0 AND 1),
                    stm_strength REAL NOT NULL CHECK (stm_strength BETWEEN 0 AND 1),
                    hebbian_potential INTEGER NOT NULL DEFAULT 0,
                    co_activated_with TEXT NOT NULL DEFAULT '[]',
                    ready_for_consolidation INTEGER NOT NULL DEFAULT 0,
                    strength REAL NOT NULL CHECK (strength BETWEEN 0 AND 1),
                    state TEXT NOT NULL CHECK (state IN ('PENDING', 'REPLAYING', 'STRENGTHENED', 'WEAKENED',
                                                         'CONSOLIDATED_TO_LTM', 'DISCARDED')),
                    claimed_at INTEGER,
                    content_hash TEXT NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_episodes_state ON episodes(state, window_end)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_episodes_window ON episodes(window_end)");

            // Terminal episode states never revert
            stmt.execute("""
                CREATE TRIGGER IF NOT EXISTS episodes_terminal BEFORE UPDATE OF state ON episodes
                WHEN old.state IN ('CONSOLIDATED_TO_LTM', 'DISCARDED') AND new.state <> old.state
                BEGIN
                    SELECT RAISE(ABORT, 'episode state is terminal');
                END
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS consolidated_memories (
                    id TEXT PRIMARY KEY,
                    episode_id TEXT NOT NULL UNIQUE,
                    category TEXT NOT NULL,
                    semantic_category TEXT NOT NULL,
                    profile TEXT NOT NULL,
                    consolidated_strength REAL NOT NULL CHECK (consolidated_strength BETWEEN 0 AND 1),
                    created_at INTEGER NOT NULL,
                    consolidated_at INTEGER NOT NULL,
                    content_hash TEXT NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS associations (
                    id TEXT PRIMARY KEY,
                    source_id TEXT NOT NULL,
                    target_id TEXT NOT NULL,
                    weight REAL NOT NULL CHECK (weight BETWEEN 0 AND 1),
                    kind TEXT NOT NULL CHECK (kind IN ('REPLAY', 'CREATIVE')),
                    content_hash TEXT NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_assoc_source ON associations(source_id)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS semantic_nodes (
                    id TEXT PRIMARY KEY,
                    semantic_category TEXT NOT NULL,
                    cluster_id INTEGER NOT NULL CHECK (cluster_id >= 0),
                    consolidated_strength REAL NOT NULL CHECK (consolidated_strength BETWEEN 0 AND 1),
                    competition_rank INTEGER NOT NULL CHECK (competition_rank >= 1),
                    access_frequency INTEGER NOT NULL DEFAULT 0,
                    homeostatic_scale REAL NOT NULL DEFAULT 1 CHECK (homeostatic_scale > 0),
                    retrieval_strength REAL NOT NULL CHECK (retrieval_strength BETWEEN 0 AND 1),
                    age_category TEXT NOT NULL,
                    consolidation_state TEXT NOT NULL,
                    created_at INTEGER NOT NULL,
                    evaluated_at INTEGER NOT NULL,
                    content_hash TEXT NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_nodes_cluster ON semantic_nodes(cluster_id)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS cluster_centroids (
                    id TEXT PRIMARY KEY,
                    cluster_id INTEGER NOT NULL UNIQUE,
                    category TEXT NOT NULL,
                    vector TEXT NOT NULL,
                    member_count INTEGER NOT NULL,
                    content_hash TEXT NOT NULL
                )
                """);

            // Tombstones of nodes removed by homeostasis, so their memories are not placed again
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS pruned_nodes (
                    id TEXT PRIMARY KEY,
                    cluster_id INTEGER NOT NULL,
                    retrieval_strength REAL NOT NULL,
                    pruned_at INTEGER NOT NULL,
                    content_hash TEXT NOT NULL
                )
                """);

            // A pruned node stays pruned, whichever stage writes it afterwards
            stmt.execute("""
                CREATE TRIGGER IF NOT EXISTS semantic_nodes_pruned BEFORE INSERT ON semantic_nodes
                WHEN EXISTS (SELECT 1 FROM pruned_nodes p WHERE p.id = new.id)
                BEGIN
                    SELECT RAISE(IGNORE);
                END
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS access_events (
                    node_id TEXT NOT NULL,
                    accessed_at INTEGER NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_access_time ON access_events(accessed_at)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS watermarks (
                    stage TEXT PRIMARY KEY,
                    last_processed INTEGER NOT NULL,
                    content_hash TEXT NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS run_locks (
                    stage TEXT PRIMARY KEY,
                    holder TEXT NOT NULL,
                    acquired_at INTEGER NOT NULL,
                    expires_at INTEGER NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS quarantine (
                    stage TEXT NOT NULL,
                    record_id TEXT NOT NULL,
                    reason TEXT,
                    consecutive_runs INTEGER NOT NULL DEFAULT 1,
                    dead_lettered INTEGER NOT NULL DEFAULT 0,
                    updated_at INTEGER NOT NULL,
                    PRIMARY KEY (stage, record_id)
                )
                """);
        }
    }

    // ── Transactions and watermarks ─────────────────────────────────────────

    @Override
    public StoreTransaction beginTransaction() {
        try {
            return new SQLiteStoreTransaction(dataSource.getConnection());
        } catch (SQLException e) {
            throw SqlErrors.translate(e, "Acquiring a store connection");
        }
    }

    @Override
    public WatermarkRecord getWatermark(MemoryStage stage) {
        String sql = "SELECT last_processed, content_hash FROM watermarks WHERE stage = ?";
        return query("Reading watermark of " + stage, sql, ps -> ps.setString(1, stage.name()), rs -> rs.next()
                ? new WatermarkRecord(stage, Instant.ofEpochMilli(rs.getLong(1)), rs.getString(2))
                : WatermarkRecord.initial(stage));
    }

    @Override
    public void setWatermark(MemoryStage stage, Instant lastProcessed, String contentHash) {
        try (StoreTransaction tx = beginTransaction()) {
            tx.setWatermark(stage, lastProcessed, contentHash);
            tx.commit();
        }
    }

    @Override
    public Map<String, String> findStoredHashes(TableMapping<?> table, Collection<String> ids) {
        Map<String, String> hashes = new HashMap<>();
        for (List<String> chunk : chunks(ids)) {
            String sql = "SELECT id, content_hash FROM " + table.table() + " WHERE id IN (" + placeholders(chunk.size()) + ")";
            query("Reading hashes of " + table.table(), sql, ps -> bindStrings(ps, 1, chunk), rs -> {
                while (rs.next()) {
                    hashes.put(rs.getString(1), rs.getString(2));
                }
                return null;
            });
        }
        return hashes;
    }

    // ── Run locks ───────────────────────────────────────────────────────────

    @Override
    public boolean acquireRunLock(MemoryStage stage, String holder, Duration ttl) {
        long now = clock.millis();
        String sql = """
            INSERT INTO run_locks (stage, holder, acquired_at, expires_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT(stage) DO UPDATE SET
                holder = excluded.holder,
                acquired_at = excluded.acquired_at,
                expires_at = excluded.expires_at
            WHERE run_locks.expires_at < excluded.acquired_at
            """;
        int changed = update("Acquiring run lock of " + stage, sql, ps -> {
            ps.setString(1, stage.name());
            ps.setString(2, holder);
            ps.setLong(3, now);
            ps.setLong(4, now + ttl.toMillis());
        });
        if (changed == 1) {
            log.debug("Run lock of {} taken by {}", stage, holder);
        }
        return changed == 1;
    }

    @Override
    public void releaseRunLock(MemoryStage stage, String holder) {
        update("Releasing run lock of " + stage, "DELETE FROM run_locks WHERE stage = ? AND holder = ?", ps -> {
            ps.setString(1, stage.name());
            ps.setString(2, holder);
        });
    }

    // ── Memory source ───────────────────────────────────────────────────────

    @Override
    public void appendSource(SourceMemory source) {
        String hash = source.contentHash() != null && !source.contentHash().isBlank()
                ? source.contentHash()
                : ContentHashes.of(source.contentRef() + "|" + source.createdAt().toEpochMilli() + "|"
                        + ContentHashes.ofMap(source.metadata()));
        String sql = """
            INSERT INTO raw_memories (id, content_ref, created_at, metadata, content_hash)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                content_ref = excluded.content_ref,
                metadata = excluded.metadata,
                content_hash = excluded.content_hash
            WHERE raw_memories.content_hash <> excluded.content_hash
            """;
        update("Appending source " + source.id(), sql, ps -> {
            ps.setString(1, source.id());
            ps.setString(2, source.contentRef());
            ps.setLong(3, source.createdAt().toEpochMilli());
            ps.setString(4, JsonColumns.write(source.metadata()));
            ps.setString(5, hash);
        });
    }

    @Override
    public List<SourceMemory> findSourcesForAttention(Instant watermark, Instant windowStart, int limit) {
        String sql = """
            SELECT r.id, r.content_ref, r.created_at, r.metadata, r.content_hash
            FROM raw_memories r
            LEFT JOIN memory_items m ON m.id = r.id
            WHERE r.created_at >= ?
              AND (r.created_at > ?
                   OR m.id IS NULL
                   OR (m.source_hash <> r.content_hash AND m.stage IN ('ACTIVE', 'PENDING')))
              AND r.id NOT IN (SELECT record_id FROM quarantine WHERE stage = 'ATTENTION' AND dead_lettered = 1)
            ORDER BY r.created_at, r.rowid
            LIMIT ?
            """;
        return query("Reading attention candidates", sql, ps -> {
            ps.setLong(1, windowStart.toEpochMilli());
            ps.setLong(2, watermark.toEpochMilli());
            ps.setInt(3, limit);
        }, rs -> {
            List<SourceMemory> sources = new ArrayList<>();
            while (rs.next()) {
                String id = rs.getString("id");
                sources.add(new SourceMemory(
                        id,
                        rs.getString("content_ref"),
                        Instant.ofEpochMilli(rs.getLong("created_at")),
                        JsonColumns.readMap(id, rs.getString("metadata")),
                        rs.getString("content_hash")));
            }
            return sources;
        });
    }

    @Override
    public Map<String, Long> findArrivalSequences(Collection<String> ids) {
        Map<String, Long> sequences = new HashMap<>();
        for (List<String> chunk : chunks(ids)) {
            String sql = "SELECT id, rowid FROM raw_memories WHERE id IN (" + placeholders(chunk.size()) + ")";
            query("Reading arrival sequences", sql, ps -> bindStrings(ps, 1, chunk), rs -> {
                while (rs.next()) {
                    sequences.put(rs.getString(1), rs.getLong(2));
                }
                return null;
            });
        }
        return sequences;
    }

    // ── Items and episodes ──────────────────────────────────────────────────

    @Override
    public List<MemoryItem> findItemsByStage(ItemStage stage, int limit) {
        String sql = "SELECT * FROM memory_items WHERE stage = ? ORDER BY created_at, arrival_seq LIMIT ?";
        return query("Reading " + stage + " items", sql, ps -> {
            ps.setString(1, stage.name());
            ps.setInt(2, limit);
        }, this::toItems);
    }

    @Override
    public List<MemoryItem> findUnboundItems(int limit) {
        String sql = """
            SELECT * FROM memory_items
            WHERE stage = 'ACTIVE' AND episode_id IS NULL
              AND id NOT IN (SELECT record_id FROM quarantine WHERE stage = 'EPISODE' AND dead_lettered = 1)
            ORDER BY admitted_at, created_at, arrival_seq
            LIMIT ?
            """;
        return query("Reading unbound items", sql, ps -> ps.setInt(1, limit), this::toItems);
    }

    @Override
    public Optional<MemoryItem> findItem(String id) {
        return query("Reading item " + id, "SELECT * FROM memory_items WHERE id = ?",
                ps -> ps.setString(1, id), rs -> toItems(rs).stream().findFirst());
    }

    @Override
    public List<Episode> findEpisodesEndingAfter(Instant since) {
        String sql = "SELECT * FROM episodes WHERE window_end >= ? ORDER BY window_start, id";
        return query("Reading recent episodes", sql, ps -> ps.setLong(1, since.toEpochMilli()), this::toEpisodes);
    }

    @Override
    public Optional<Episode> findEpisode(String id) {
        return query("Reading episode " + id, "SELECT * FROM episodes WHERE id = ?",
                ps -> ps.setString(1, id), rs -> toEpisodes(rs).stream().findFirst());
    }

    @Override
    public List<Episode> claimEpisodesForReplay(int limit, Instant now, Instant staleClaimBefore) {
        String candidates = """
            SELECT id FROM episodes
            WHERE ((state IN ('PENDING', 'STRENGTHENED', 'WEAKENED') AND ready_for_consolidation = 1)
                   OR (state = 'REPLAYING' AND claimed_at < ?))
              AND id NOT IN (SELECT record_id FROM quarantine WHERE stage = 'CONSOLIDATION' AND dead_lettered = 1)
            ORDER BY window_end, id
            LIMIT ?
            """;
        // A claimed row never matches an outcome hash, so an unchanged outcome is still written.
        String claim = """
            UPDATE episodes SET state = 'REPLAYING', claimed_at = ?, content_hash = 'claimed'
            WHERE id = ?
              AND ((state IN ('PENDING', 'STRENGTHENED', 'WEAKENED') AND ready_for_consolidation = 1)
                   OR (state = 'REPLAYING' AND claimed_at < ?))
            """;
        List<String> claimed = new ArrayList<>();
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try {
                List<String> ids = new ArrayList<>();
                try (PreparedStatement ps = connection.prepareStatement(candidates)) {
                    ps.setLong(1, staleClaimBefore.toEpochMilli());
                    ps.setInt(2, limit);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            ids.add(rs.getString(1));
                        }
                    }
                }
                try (PreparedStatement ps = connection.prepareStatement(claim)) {
                    for (String id : ids) {
                        ps.setLong(1, now.toEpochMilli());
                        ps.setString(2, id);
                        ps.setLong(3, staleClaimBefore.toEpochMilli());
                        if (ps.executeUpdate() == 1) {
                            claimed.add(id);
                        }
                    }
                }
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw SqlErrors.translate(e, "Claiming episodes for replay");
        }
        List<Episode> episodes = new ArrayList<>();
        for (String id : claimed) {
            findEpisode(id).ifPresent(episodes::add);
        }
        log.debug("Claimed {} episodes for replay", episodes.size());
        return episodes;
    }

    @Override
    public List<Association> findAssociations(String episodeId) {
        String sql = "SELECT * FROM associations WHERE source_id = ? OR target_id = ? ORDER BY id";
        return query("Reading associations of " + episodeId, sql, ps -> {
            ps.setString(1, episodeId);
            ps.setString(2, episodeId);
        }, rs -> {
            List<Association> associations = new ArrayList<>();
            while (rs.next()) {
                associations.add(new Association(
                        rs.getString("source_id"),
                        rs.getString("target_id"),
                        rs.getDouble("weight"),
                        AssociationKind.valueOf(rs.getString("kind"))));
            }
            return associations;
        });
    }

    // ── Long-term memory ────────────────────────────────────────────────────

    @Override
    public Optional<ConsolidatedMemory> findConsolidated(String id) {
        return query("Reading consolidated memory " + id, "SELECT * FROM consolidated_memories WHERE id = ?",
                ps -> ps.setString(1, id), rs -> toConsolidated(rs).stream().findFirst());
    }

    @Override
    public List<ConsolidatedMemory> findUnplacedConsolidated(int limit) {
        String sql = """
            SELECT c.* FROM consolidated_memories c
            LEFT JOIN semantic_nodes n ON n.id = c.id
            WHERE n.id IS NULL
              AND c.id NOT IN (SELECT id FROM pruned_nodes)
              AND c.id NOT IN (SELECT record_id FROM quarantine WHERE stage = 'SEMANTIC' AND dead_lettered = 1)
            ORDER BY c.consolidated_at, c.id
            LIMIT ?
            """;
        return query("Reading unplaced consolidated memories", sql, ps -> ps.setInt(1, limit), this::toConsolidated);
    }

    @Override
    public List<SemanticNode> findNodes() {
        return query("Reading semantic nodes", "SELECT * FROM semantic_nodes ORDER BY cluster_id, id",
                ps -> { }, this::toNodes);
    }

    @Override
    public List<SemanticNode> findNodesInClusters(Set<Integer> clusterIds) {
        if (clusterIds.isEmpty()) {
            return List.of();
        }
        List<SemanticNode> nodes = new ArrayList<>();
        List<String> ids = clusterIds.stream().sorted().map(String::valueOf).toList();
        for (List<String> chunk : chunks(ids)) {
            String sql = "SELECT * FROM semantic_nodes WHERE cluster_id IN (" + placeholders(chunk.size()) + ") ORDER BY cluster_id, id";
            nodes.addAll(query("Reading cluster members", sql, ps -> {
                for (int i = 0; i < chunk.size(); i++) {
                    ps.setInt(i + 1, Integer.parseInt(chunk.get(i)));
                }
            }, this::toNodes));
        }
        return nodes;
    }

    @Override
    public Optional<SemanticNode> findNode(String id) {
        return query("Reading semantic node " + id, "SELECT * FROM semantic_nodes WHERE id = ?",
                ps -> ps.setString(1, id), rs -> toNodes(rs).stream().findFirst());
    }

    @Override
    public Map<Integer, ClusterCentroid> findCentroids() {
        return query("Reading cluster centroids", "SELECT * FROM cluster_centroids ORDER BY cluster_id", ps -> { }, rs -> {
            Map<Integer, ClusterCentroid> centroids = new LinkedHashMap<>();
            while (rs.next()) {
                int clusterId = rs.getInt("cluster_id");
                centroids.put(clusterId, new ClusterCentroid(
                        clusterId,
                        rs.getString("category"),
                        JsonColumns.readVector(rs.getString("id"), rs.getString("vector")),
                        rs.getInt("member_count")));
            }
            return centroids;
        });
    }

    @Override
    public void recordAccess(String nodeId, Instant at) {
        update("Recording access of " + nodeId, "INSERT INTO access_events (node_id, accessed_at) VALUES (?, ?)", ps -> {
            ps.setString(1, nodeId);
            ps.setLong(2, at.toEpochMilli());
        });
    }

    @Override
    public Map<String, Integer> countAccessesSince(Instant since) {
        String sql = "SELECT node_id, COUNT(*) FROM access_events WHERE accessed_at >= ? GROUP BY node_id";
        return query("Counting accesses", sql, ps -> ps.setLong(1, since.toEpochMilli()), rs -> {
            Map<String, Integer> counts = new HashMap<>();
            while (rs.next()) {
                counts.put(rs.getString(1), rs.getInt(2));
            }
            return counts;
        });
    }

    // ── Quarantine ──────────────────────────────────────────────────────────

    @Override
    public QuarantineEntry recordQuarantine(MemoryStage stage, String recordId, String reason, Instant at) {
        String sql = """
            INSERT INTO quarantine (stage, record_id, reason, consecutive_runs, dead_lettered, updated_at)
            VALUES (?, ?, ?, 1, 0, ?)
            ON CONFLICT(stage, record_id) DO UPDATE SET
                reason = excluded.reason,
                consecutive_runs = quarantine.consecutive_runs + 1,
                updated_at = excluded.updated_at
            """;
        update("Quarantining " + recordId, sql, ps -> {
            ps.setString(1, stage.name());
            ps.setString(2, recordId);
            ps.setString(3, reason);
            ps.setLong(4, at.toEpochMilli());
        });
        return findQuarantineEntry(stage, recordId)
                .orElseThrow(() -> new PipelineException("Quarantine entry of " + recordId + " vanished"));
    }

    @Override
    public void markDeadLettered(MemoryStage stage, String recordId) {
        update("Dead-lettering " + recordId, "UPDATE quarantine SET dead_lettered = 1 WHERE stage = ? AND record_id = ?", ps -> {
            ps.setString(1, stage.name());
            ps.setString(2, recordId);
        });
    }

    @Override
    public void clearQuarantine(MemoryStage stage, Collection<String> recordIds) {
        for (List<String> chunk : chunks(recordIds)) {
            String sql = "DELETE FROM quarantine WHERE stage = ? AND dead_lettered = 0 AND record_id IN ("
                    + placeholders(chunk.size()) + ")";
            update("Clearing quarantine of " + stage, sql, ps -> {
                ps.setString(1, stage.name());
                bindStrings(ps, 2, chunk);
            });
        }
    }

    @Override
    public List<QuarantineEntry> findQuarantined(MemoryStage stage) {
        String sql = "SELECT * FROM quarantine WHERE stage = ? ORDER BY record_id";
        return query("Reading quarantine of " + stage, sql, ps -> ps.setString(1, stage.name()), this::toQuarantine);
    }

    @Override
    public Set<String> findDeadLettered(MemoryStage stage) {
        String sql = "SELECT record_id FROM quarantine WHERE stage = ? AND dead_lettered = 1";
        return query("Reading dead letters of " + stage, sql, ps -> ps.setString(1, stage.name()), rs -> {
            Set<String> ids = new HashSet<>();
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
            return ids;
        });
    }

    private Optional<QuarantineEntry> findQuarantineEntry(MemoryStage stage, String recordId) {
        String sql = "SELECT * FROM quarantine WHERE stage = ? AND record_id = ?";
        return query("Reading quarantine entry " + recordId, sql, ps -> {
            ps.setString(1, stage.name());
            ps.setString(2, recordId);
        }, rs -> toQuarantine(rs).stream().findFirst());
    }

    // ── Housekeeping ────────────────────────────────────────────────────────

    @Override
    public int count(TableMapping<?> table) {
        return query("Counting " + table.table(), "SELECT COUNT(*) FROM " + table.table(), ps -> { },
                rs -> rs.next() ? rs.getInt(1) : 0);
    }

    @Override
    public boolean healthCheck() {
        try (Connection connection = dataSource.getConnection();
             var stmt = connection.createStatement();
             var rs = stmt.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return false;
        }
    }

    // ── JDBC plumbing ───────────────────────────────────────────────────────

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    @FunctionalInterface
    private interface Extractor<R> {
        R extract(ResultSet rs) throws SQLException;
    }

    private <R> R query(String action, String sql, Binder binder, Extractor<R> extractor) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return extractor.extract(rs);
            }
        } catch (SQLException e) {
            throw SqlErrors.translate(e, action);
        }
    }

    private int update(String action, String sql, Binder binder) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw SqlErrors.translate(e, action);
        }
    }

    private static List<List<String>> chunks(Collection<String> ids) {
        List<String> all = new ArrayList<>(ids);
        List<List<String>> chunks = new ArrayList<>();
        for (int i = 0; i < all.size(); i += IN_CHUNK) {
            chunks.add(all.subList(i, Math.min(all.size(), i + IN_CHUNK)));
        }
        return chunks;
    }

    private static String placeholders(int n) {
        return String.join(", ", Collections.nCopies(n, "?"));
    }

    private static void bindStrings(PreparedStatement ps, int offset, List<String> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) {
            ps.setString(offset + i, values.get(i));
        }
    }

    private static Instant instantOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private List<MemoryItem> toItems(ResultSet rs) throws SQLException {
        List<MemoryItem> items = new ArrayList<>();
        while (rs.next()) {
            items.add(new MemoryItem(
                    rs.getString("id"),
                    rs.getString("content_ref"),
                    rs.getString("content"),
                    Instant.ofEpochMilli(rs.getLong("created_at")),
                    rs.getDouble("salience"),
                    rs.getDouble("importance"),
                    rs.getDouble("sentiment"),
                    ItemStage.valueOf(rs.getString("stage")),
                    rs.getDouble("strength"),
                    rs.getInt("co_activation_count"),
                    instantOrNull(rs, "admitted_at"),
                    rs.getLong("arrival_seq"),
                    rs.getString("episode_id"),
                    rs.getString("source_hash")));
        }
        return items;
    }

    private List<Episode> toEpisodes(ResultSet rs) throws SQLException {
        List<Episode> episodes = new ArrayList<>();
        while (rs.next()) {
            String id = rs.getString("id");
            episodes.add(new Episode(
                    id,
                    rs.getString("category"),
                    JsonColumns.readList(id, rs.getString("topics")),
                    Instant.ofEpochMilli(rs.getLong("window_start")),
                    Instant.ofEpochMilli(rs.getLong("window_end")),
                    JsonColumns.readList(id, rs.getString("item_ids")),
                    rs.getDouble("recency_factor"),
                    rs.getDouble("emotional_salience"),
                    rs.getDouble("stm_strength"),
                    rs.getInt("hebbian_potential"),
                    JsonColumns.readList(id, rs.getString("co_activated_with")),
                    rs.getInt("ready_for_consolidation") == 1,
                    rs.getDouble("strength"),
                    EpisodeState.valueOf(rs.getString("state")),
                    instantOrNull(rs, "claimed_at")));
        }
        return episodes;
    }

    private List<ConsolidatedMemory> toConsolidated(ResultSet rs) throws SQLException {
        List<ConsolidatedMemory> memories = new ArrayList<>();
        while (rs.next()) {
            memories.add(new ConsolidatedMemory(
                    rs.getString("id"),
                    rs.getString("episode_id"),
                    rs.getString("category"),
                    rs.getString("semantic_category"),
                    rs.getString("profile"),
                    rs.getDouble("consolidated_strength"),
                    Instant.ofEpochMilli(rs.getLong("created_at")),
                    Instant.ofEpochMilli(rs.getLong("consolidated_at"))));
        }
        return memories;
    }

    private List<SemanticNode> toNodes(ResultSet rs) throws SQLException {
        List<SemanticNode> nodes = new ArrayList<>();
        while (rs.next()) {
            nodes.add(new SemanticNode(
                    rs.getString("id"),
                    rs.getString("semantic_category"),
                    rs.getInt("cluster_id"),
                    rs.getDouble("consolidated_strength"),
                    rs.getInt("competition_rank"),
                    rs.getInt("access_frequency"),
                    rs.getDouble("homeostatic_scale"),
                    rs.getDouble("retrieval_strength"),
                    AgeCategory.valueOf(rs.getString("age_category")),
                    ConsolidationState.valueOf(rs.getString("consolidation_state")),
                    Instant.ofEpochMilli(rs.getLong("created_at")),
                    Instant.ofEpochMilli(rs.getLong("evaluated_at"))));
        }
        return nodes;
    }

    private List<QuarantineEntry> toQuarantine(ResultSet rs) throws SQLException {
        List<QuarantineEntry> entries = new ArrayList<>();
        while (rs.next()) {
            entries.add(new QuarantineEntry(
                    MemoryStage.valueOf(rs.getString("stage")),
                    rs.getString("record_id"),
                    rs.getString("reason"),
                    rs.getInt("consecutive_runs"),
                    rs.getInt("dead_lettered") == 1,
                    Instant.ofEpochMilli(rs.getLong("updated_at"))));
        }
        return entries;
    }
}
