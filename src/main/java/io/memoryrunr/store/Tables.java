package io.memoryrunr.store;

import io.memoryrunr.model.Association;
import io.memoryrunr.model.ClusterCentroid;
import io.memoryrunr.model.ConsolidatedMemory;
import io.memoryrunr.model.Episode;
import io.memoryrunr.model.MemoryItem;
import io.memoryrunr.model.PrunedNode;
import io.memoryrunr.model.SemanticNode;
import io.memoryrunr.support.ContentHashes;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Arrays;

/**
 * Upsert definitions of every stage output table.
 *
 * <p>All upserts skip rows whose stored {@code content_hash} already matches, so replaying a batch
 * leaves the store untouched. Tables written by more than one stage have one mapping per writer, each
 * guarded by the row state it expects, so stages running concurrently can never overwrite each
 * other's transitions.</p>
 */
public final class Tables {

    private Tables() {
    }

    /**
     * Attention output: only touches working-memory items that no episode has claimed yet, so a
     * slow attention cycle cannot undo a binding made while it was running.
     */
    public static final TableMapping<MemoryItem> MEMORY_ITEMS = new ItemMapping("""
            INSERT INTO memory_items (id, content_ref, content, created_at, salience, importance, sentiment,
                                      stage, strength, co_activation_count, admitted_at, arrival_seq,
                                      episode_id, source_hash, content_hash)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                content_ref = excluded.content_ref,
                content = excluded.content,
                salience = excluded.salience,
                importance = excluded.importance,
                sentiment = excluded.sentiment,
                stage = excluded.stage,
                strength = excluded.strength,
                co_activation_count = excluded.co_activation_count,
                admitted_at = excluded.admitted_at,
                episode_id = excluded.episode_id,
                source_hash = excluded.source_hash,
                content_hash = excluded.content_hash
            WHERE memory_items.stage IN ('ACTIVE', 'PENDING')
              AND memory_items.episode_id IS NULL
              AND memory_items.content_hash <> excluded.content_hash
            """);

    /**
     * Short-term binding of items to their episode. Lands only when the stored episode lists the
     * item, so an extension rejected because the episode was claimed in the meantime leaves the item
     * unbound for the next run.
     */
    public static final TableMapping<MemoryItem> ITEM_BINDINGS = new ItemMapping("""
            INSERT INTO memory_items (id, content_ref, content, created_at, salience, importance, sentiment,
                                      stage, strength, co_activation_count, admitted_at, arrival_seq,
                                      episode_id, source_hash, content_hash)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                stage = excluded.stage,
                strength = excluded.strength,
                co_activation_count = excluded.co_activation_count,
                episode_id = excluded.episode_id,
                content_hash = excluded.content_hash
            WHERE (memory_items.episode_id IS NULL OR memory_items.episode_id = excluded.episode_id)
              AND EXISTS (SELECT 1 FROM episodes e, json_each(e.item_ids) j
                          WHERE e.id = excluded.episode_id AND j.value = excluded.id)
              AND memory_items.content_hash <> excluded.content_hash
            """);

    /** Short-term output: only touches episodes that are still PENDING. */
    public static final TableMapping<Episode> EPISODES = new EpisodeMapping("""
            INSERT INTO episodes (id, category, topics, window_start, window_end, item_ids, recency_factor,
                                  emotional_salience, stm_strength, hebbian_potential, co_activated_with,
                                  ready_for_consolidation, strength, state, claimed_at, content_hash)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                topics = excluded.topics,
                window_start = excluded.window_start,
                window_end = excluded.window_end,
                item_ids = excluded.item_ids,
                recency_factor = excluded.recency_factor,
                emotional_salience = excluded.emotional_salience,
                stm_strength = excluded.stm_strength,
                hebbian_potential = excluded.hebbian_potential,
                co_activated_with = excluded.co_activated_with,
                ready_for_consolidation = excluded.ready_for_consolidation,
                strength = excluded.strength,
                content_hash = excluded.content_hash
            WHERE episodes.state = 'PENDING' AND episodes.content_hash <> excluded.content_hash
            """);

    /** Consolidation output: only completes episodes claimed for replay. */
    public static final TableMapping<Episode> EPISODE_OUTCOMES = new EpisodeMapping("""
            INSERT INTO episodes (id, category, topics, window_start, window_end, item_ids, recency_factor,
                                  emotional_salience, stm_strength, hebbian_potential, co_activated_with,
                                  ready_for_consolidation, strength, state, claimed_at, content_hash)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                strength = excluded.strength,
                state = excluded.state,
                claimed_at = excluded.claimed_at,
                content_hash = excluded.content_hash
            WHERE episodes.state = 'REPLAYING' AND episodes.content_hash <> excluded.content_hash
            """);

    public static final TableMapping<ConsolidatedMemory> CONSOLIDATED_MEMORIES = new TableMapping<>() {
        @Override
        public String table() {
            return "consolidated_memories";
        }

        @Override
        public String upsertSql() {
            // Derived once: an existing row is never rewritten.
            return """
                INSERT INTO consolidated_memories (id, episode_id, category, semantic_category, profile,
                                                   consolidated_strength, created_at, consolidated_at, content_hash)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(id) DO NOTHING
                """;
        }

        @Override
        public void bind(PreparedStatement ps, ConsolidatedMemory memory, String hash) throws SQLException {
            ps.setString(1, memory.id());
            ps.setString(2, memory.episodeId());
            ps.setString(3, memory.category());
            ps.setString(4, memory.semanticCategory());
            ps.setString(5, memory.profile());
            ps.setDouble(6, memory.consolidatedStrength());
            ps.setLong(7, memory.createdAt().toEpochMilli());
            ps.setLong(8, memory.consolidatedAt().toEpochMilli());
            ps.setString(9, hash);
        }

        @Override
        public String idOf(ConsolidatedMemory memory) {
            return memory.id();
        }
    };

    public static final TableMapping<Association> ASSOCIATIONS = new TableMapping<>() {
        @Override
        public String table() {
            return "associations";
        }

        @Override
        public String upsertSql() {
            return """
                INSERT INTO associations (id, source_id, target_id, weight, kind, content_hash)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT(id) DO UPDATE SET
                    weight = excluded.weight,
                    kind = excluded.kind,
                    content_hash = excluded.content_hash
                WHERE associations.content_hash <> excluded.content_hash
                """;
        }

        @Override
        public void bind(PreparedStatement ps, Association association, String hash) throws SQLException {
            ps.setString(1, association.key());
            ps.setString(2, association.sourceId());
            ps.setString(3, association.targetId());
            ps.setDouble(4, association.weight());
            ps.setString(5, association.kind().name());
            ps.setString(6, hash);
        }

        @Override
        public String idOf(Association association) {
            return association.key();
        }
    };

    /**
     * Semantic output. Skips nodes whose homeostatic scale moved since they were read, because their
     * retrieval strength was computed from the old scale; the next evaluation of the cluster catches up.
     */
    public static final TableMapping<SemanticNode> SEMANTIC_NODES = new NodeMapping("""
            INSERT INTO semantic_nodes (id, semantic_category, cluster_id, consolidated_strength, competition_rank,
                                        access_frequency, homeostatic_scale, retrieval_strength, age_category,
                                        consolidation_state, created_at, evaluated_at, content_hash)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                cluster_id = excluded.cluster_id,
                consolidated_strength = excluded.consolidated_strength,
                competition_rank = excluded.competition_rank,
                access_frequency = excluded.access_frequency,
                retrieval_strength = excluded.retrieval_strength,
                age_category = excluded.age_category,
                consolidation_state = excluded.consolidation_state,
                evaluated_at = excluded.evaluated_at,
                content_hash = excluded.content_hash
            WHERE semantic_nodes.homeostatic_scale = excluded.homeostatic_scale
              AND semantic_nodes.content_hash <> excluded.content_hash
            """);

    /**
     * Homeostasis output: rescales a node only while its cluster, rank and access count are the
     * ones the scale was computed from.
     */
    public static final TableMapping<SemanticNode> HOMEOSTATIC_SCALES = new NodeMapping("""
            INSERT INTO semantic_nodes (id, semantic_category, cluster_id, consolidated_strength, competition_rank,
                                        access_frequency, homeostatic_scale, retrieval_strength, age_category,
                                        consolidation_state, created_at, evaluated_at, content_hash)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                homeostatic_scale = excluded.homeostatic_scale,
                retrieval_strength = excluded.retrieval_strength,
                age_category = excluded.age_category,
                evaluated_at = excluded.evaluated_at,
                content_hash = excluded.content_hash
            WHERE semantic_nodes.cluster_id = excluded.cluster_id
              AND semantic_nodes.competition_rank = excluded.competition_rank
              AND semantic_nodes.access_frequency = excluded.access_frequency
              AND semantic_nodes.content_hash <> excluded.content_hash
            """);

    public static final TableMapping<ClusterCentroid> CLUSTER_CENTROIDS = new TableMapping<>() {
        @Override
        public String table() {
            return "cluster_centroids";
        }

        @Override
        public String upsertSql() {
            return """
                INSERT INTO cluster_centroids (id, cluster_id, category, vector, member_count, content_hash)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT(id) DO UPDATE SET
                    category = excluded.category,
                    vector = excluded.vector,
                    member_count = excluded.member_count,
                    content_hash = excluded.content_hash
                WHERE cluster_centroids.content_hash <> excluded.content_hash
                """;
        }

        @Override
        public void bind(PreparedStatement ps, ClusterCentroid centroid, String hash) throws SQLException {
            ps.setString(1, idOf(centroid));
            ps.setInt(2, centroid.clusterId());
            ps.setString(3, centroid.category());
            ps.setString(4, JsonColumns.write(centroid.vector()));
            ps.setInt(5, centroid.memberCount());
            ps.setString(6, hash);
        }

        @Override
        public String idOf(ClusterCentroid centroid) {
            return String.valueOf(centroid.clusterId());
        }

        @Override
        public String hash(ClusterCentroid centroid) {
            return ContentHashes.of(centroid.clusterId() + "|" + centroid.category() + "|"
                    + Arrays.toString(centroid.vector()) + "|" + centroid.memberCount());
        }
    };

    public static final TableMapping<PrunedNode> PRUNED_NODES = new TableMapping<>() {
        @Override
        public String table() {
            return "pruned_nodes";
        }

        @Override
        public String upsertSql() {
            return """
                INSERT INTO pruned_nodes (id, cluster_id, retrieval_strength, pruned_at, content_hash)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT(id) DO NOTHING
                """;
        }

        @Override
        public void bind(PreparedStatement ps, PrunedNode node, String hash) throws SQLException {
            ps.setString(1, node.id());
            ps.setInt(2, node.clusterId());
            ps.setDouble(3, node.retrievalStrength());
            ps.setLong(4, node.prunedAt().toEpochMilli());
            ps.setString(5, hash);
        }

        @Override
        public String idOf(PrunedNode node) {
            return node.id();
        }
    };

    private static final class ItemMapping implements TableMapping<MemoryItem> {

        private final String sql;

        private ItemMapping(String sql) {
            this.sql = sql;
        }

        @Override
        public String table() {
            return "memory_items";
        }

        @Override
        public String upsertSql() {
            return sql;
        }

        @Override
        public void bind(PreparedStatement ps, MemoryItem item, String hash) throws SQLException {
            ps.setString(1, item.id());
            ps.setString(2, item.contentRef());
            ps.setString(3, item.content());
            ps.setLong(4, item.createdAt().toEpochMilli());
            ps.setDouble(5, item.salience());
            ps.setDouble(6, item.importance());
            ps.setDouble(7, item.sentiment());
            ps.setString(8, item.stage().name());
            ps.setDouble(9, item.strength());
            ps.setInt(10, item.coActivationCount());
            setInstant(ps, 11, item.admittedAt());
            ps.setLong(12, item.arrivalSeq());
            ps.setString(13, item.episodeId());
            ps.setString(14, item.sourceHash());
            ps.setString(15, hash);
        }

        @Override
        public String idOf(MemoryItem item) {
            return item.id();
        }
    }

    private static final class NodeMapping implements TableMapping<SemanticNode> {

        private final String sql;

        private NodeMapping(String sql) {
            this.sql = sql;
        }

        @Override
        public String table() {
            return "semantic_nodes";
        }

        @Override
        public String upsertSql() {
            return sql;
        }

        @Override
        public void bind(PreparedStatement ps, SemanticNode node, String hash) throws SQLException {
            ps.setString(1, node.id());
            ps.setString(2, node.semanticCategory());
            ps.setInt(3, node.clusterId());
            ps.setDouble(4, node.consolidatedStrength());
            ps.setInt(5, node.competitionRank());
            ps.setInt(6, node.accessFrequency());
            ps.setDouble(7, node.homeostaticScale());
            ps.setDouble(8, node.retrievalStrength());
            ps.setString(9, node.ageCategory().name());
            ps.setString(10, node.consolidationState().name());
            ps.setLong(11, node.createdAt().toEpochMilli());
            ps.setLong(12, node.evaluatedAt().toEpochMilli());
            ps.setString(13, hash);
        }

        @Override
        public String idOf(SemanticNode node) {
            return node.id();
        }
    }

    private static final class EpisodeMapping implements TableMapping<Episode> {

        private final String sql;

        private EpisodeMapping(String sql) {
            this.sql = sql;
        }

        @Override
        public String table() {
            return "episodes";
        }

        @Override
        public String upsertSql() {
            return sql;
        }

        @Override
        public void bind(PreparedStatement ps, Episode episode, String hash) throws SQLException {
            ps.setString(1, episode.id());
            ps.setString(2, episode.category());
            ps.setString(3, JsonColumns.write(episode.topics()));
            ps.setLong(4, episode.windowStart().toEpochMilli());
            ps.setLong(5, episode.windowEnd().toEpochMilli());
            ps.setString(6, JsonColumns.write(episode.itemIds()));
            ps.setDouble(7, episode.recencyFactor());
            ps.setDouble(8, episode.emotionalSalience());
            ps.setDouble(9, episode.stmStrength());
            ps.setInt(10, episode.hebbianPotential());
            ps.setString(11, JsonColumns.write(episode.coActivatedWith()));
            ps.setInt(12, episode.readyForConsolidation() ? 1 : 0);
            ps.setDouble(13, episode.strength());
            ps.setString(14, episode.state().name());
            setInstant(ps, 15, episode.claimedAt());
            ps.setString(16, hash);
        }

        @Override
        public String idOf(Episode episode) {
            return episode.id();
        }
    }

    static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value.toEpochMilli());
        }
    }
}
