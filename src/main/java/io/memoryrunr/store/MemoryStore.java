package io.memoryrunr.store;

import io.memoryrunr.model.Association;
import io.memoryrunr.model.ClusterCentroid;
import io.memoryrunr.model.ConsolidatedMemory;
import io.memoryrunr.model.Episode;
import io.memoryrunr.model.ItemStage;
import io.memoryrunr.model.MemoryItem;
import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.model.SemanticNode;
import io.memoryrunr.model.SourceMemory;
import io.memoryrunr.model.WatermarkRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The durable store shared by all stages. It is the only shared mutable resource of the pipeline;
 * stages never talk to each other through memory.
 */
public interface MemoryStore {

    // ── Transactions and watermarks ─────────────────────────────────────────

    StoreTransaction beginTransaction();

    WatermarkRecord getWatermark(MemoryStage stage);

    void setWatermark(MemoryStage stage, Instant lastProcessed, String contentHash);

    /** Stored content hashes of the given ids in {@code table}; missing ids are absent from the map. */
    Map<String, String> findStoredHashes(TableMapping<?> table, Collection<String> ids);

    // ── Run locks ───────────────────────────────────────────────────────────

    /**
     * Takes the advisory run lock of a stage. An expired lock is taken over.
     *
     * @return true if {@code holder} now owns the lock
     */
    boolean acquireRunLock(MemoryStage stage, String holder, Duration ttl);

    void releaseRunLock(MemoryStage stage, String holder);

    // ── Memory source ───────────────────────────────────────────────────────

    /** Appends (or corrects) an upstream record. */
    void appendSource(SourceMemory source);

    /**
     * Source records for an attention cycle: inside the sliding window and either newer than the
     * watermark, never turned into an item, or corrected since their item was derived.
     */
    List<SourceMemory> findSourcesForAttention(Instant watermark, Instant windowStart, int limit);

    /** Arrival order of source records, assigned by the store. */
    Map<String, Long> findArrivalSequences(Collection<String> ids);

    // ── Items and episodes ──────────────────────────────────────────────────

    List<MemoryItem> findItemsByStage(ItemStage stage, int limit);

    /**
     * Active items not bound to an episode, earliest admission first. Includes items behind the
     * short-term watermark whose binding was rejected or whose enrichment failed, but not dead letters.
     */
    List<MemoryItem> findUnboundItems(int limit);

    Optional<MemoryItem> findItem(String id);

    /** Episodes whose newest item is at or after {@code since}, any state. */
    List<Episode> findEpisodesEndingAfter(Instant since);

    Optional<Episode> findEpisode(String id);

    /**
     * Claims up to {@code limit} ready episodes for replay by moving them to REPLAYING with a
     * compare-and-set on their state. Claims older than {@code staleClaimBefore} are reclaimed.
     */
    List<Episode> claimEpisodesForReplay(int limit, Instant now, Instant staleClaimBefore);

    List<Association> findAssociations(String episodeId);

    // ── Long-term memory ────────────────────────────────────────────────────

    Optional<ConsolidatedMemory> findConsolidated(String id);

    /** Consolidated memories without a semantic node, oldest promotion first. */
    List<ConsolidatedMemory> findUnplacedConsolidated(int limit);

    List<SemanticNode> findNodes();

    List<SemanticNode> findNodesInClusters(Set<Integer> clusterIds);

    Optional<SemanticNode> findNode(String id);

    Map<Integer, ClusterCentroid> findCentroids();

    void recordAccess(String nodeId, Instant at);

    /** Access counts per node id since {@code since}. */
    Map<String, Integer> countAccessesSince(Instant since);

    // ── Quarantine ──────────────────────────────────────────────────────────

    /**
     * Records a quarantine for a record. Quarantining the same record again increments its
     * consecutive-run counter.
     *
     * @return the updated entry
     */
    QuarantineEntry recordQuarantine(MemoryStage stage, String recordId, String reason, Instant at);

    void markDeadLettered(MemoryStage stage, String recordId);

    /** Forgets quarantine history of records that went through successfully. */
    void clearQuarantine(MemoryStage stage, Collection<String> recordIds);

    List<QuarantineEntry> findQuarantined(MemoryStage stage);

    Set<String> findDeadLettered(MemoryStage stage);

    // ── Housekeeping ────────────────────────────────────────────────────────

    int count(TableMapping<?> table);

    boolean healthCheck();
}
