package io.memoryrunr.semantic;

import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.error.DataIntegrityException;
import io.memoryrunr.model.AgeCategory;
import io.memoryrunr.model.ClusterCentroid;
import io.memoryrunr.model.ConsolidatedMemory;
import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.model.SemanticNode;
import io.memoryrunr.pipeline.RunContext;
import io.memoryrunr.pipeline.StageProcessor;
import io.memoryrunr.pipeline.StageReport;
import io.memoryrunr.store.MemoryStore;
import io.memoryrunr.store.Tables;
import io.memoryrunr.writeback.IncrementalWriteback;
import io.memoryrunr.writeback.PendingWrite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Long-term memory stage. Places new consolidated memories into clusters and re-evaluates every
 * cluster whose members changed, were accessed, or aged into a new bucket. Existing nodes keep
 * their cluster until {@link #recluster} runs.
 */
public class SemanticStage implements StageProcessor {

    private static final Logger log = LoggerFactory.getLogger(SemanticStage.class);

    private final MemoryStore store;
    private final SemanticNetworkBuilder builder;
    private final IncrementalWriteback writeback;
    private final PipelineProperties.Semantic properties;

    public SemanticStage(MemoryStore store, SemanticNetworkBuilder builder, IncrementalWriteback writeback,
                         PipelineProperties.Semantic properties) {
        this.store = store;
        this.builder = builder;
        this.writeback = writeback;
        this.properties = properties;
    }

    @Override
    public MemoryStage stage() {
        return MemoryStage.SEMANTIC;
    }

    @Override
    public StageReport process(RunContext context) {
        Instant now = context.startedAt();
        List<ConsolidatedMemory> unplaced = store.findUnplacedConsolidated(properties.batchSize());
        Map<Integer, ClusterCentroid> centroids = new TreeMap<>(store.findCentroids());
        SemanticNetworkBuilder.Placement placement = builder.place(unplaced, centroids, now);

        Map<String, Integer> accesses = store.countAccessesSince(accessWindowStart(now));
        List<SemanticNode> existing = store.findNodes();

        Set<Integer> affected = new TreeSet<>();
        placement.nodes().forEach(n -> affected.add(n.clusterId()));
        for (SemanticNode node : existing) {
            boolean accessed = accesses.getOrDefault(node.id(), 0) != node.accessFrequency();
            boolean aged = AgeCategory.of(ageSeconds(node, now)) != node.ageCategory();
            if (accessed || aged) {
                affected.add(node.clusterId());
            }
        }
        if (affected.isEmpty()) {
            log.debug("Semantic network unchanged");
            return StageReport.empty();
        }

        List<SemanticNode> members = new ArrayList<>(placement.nodes());
        existing.stream().filter(n -> affected.contains(n.clusterId())).forEach(members::add);
        List<SemanticNode> evaluated = builder.evaluate(members, accesses, now);
        log.info("Placed {} memories, re-evaluated {} nodes in {} clusters",
                placement.nodes().size(), evaluated.size(), affected.size());

        List<PendingWrite<?>> writes = new ArrayList<>();
        for (ClusterCentroid centroid : placement.centroids()) {
            writes.add(PendingWrite.upsert(Tables.CLUSTER_CENTROIDS, centroid, now));
        }
        for (SemanticNode node : evaluated) {
            writes.add(PendingWrite.upsert(Tables.SEMANTIC_NODES, node, now));
        }
        return writeback.write(MemoryStage.SEMANTIC, writes, context).toReport();
    }

    /**
     * Reassigns every node to a cluster from scratch and replaces all centroids.
     */
    public StageReport recluster(RunContext context) {
        Instant now = context.startedAt();
        List<SemanticNode> nodes = store.findNodes();
        Map<String, ConsolidatedMemory> memories = new HashMap<>();
        for (SemanticNode node : nodes) {
            store.findConsolidated(node.id()).ifPresent(m -> memories.put(m.id(), m));
        }
        SemanticNetworkBuilder.Placement placement = builder.recluster(nodes, memories, now);
        List<SemanticNode> evaluated = builder.evaluate(placement.nodes(), store.countAccessesSince(accessWindowStart(now)), now);

        Set<String> kept = new HashSet<>();
        placement.centroids().forEach(c -> kept.add(Tables.CLUSTER_CENTROIDS.idOf(c)));
        List<PendingWrite<?>> writes = new ArrayList<>();
        for (ClusterCentroid old : store.findCentroids().values()) {
            String id = Tables.CLUSTER_CENTROIDS.idOf(old);
            if (!kept.contains(id)) {
                writes.add(PendingWrite.delete(Tables.CLUSTER_CENTROIDS, id, now));
            }
        }
        for (ClusterCentroid centroid : placement.centroids()) {
            writes.add(PendingWrite.upsert(Tables.CLUSTER_CENTROIDS, centroid, now));
        }
        for (SemanticNode node : evaluated) {
            writes.add(PendingWrite.upsert(Tables.SEMANTIC_NODES, node, now));
        }
        log.info("Re-clustered {} nodes into {} centroids", nodes.size(), placement.centroids().size());
        return writeback.write(MemoryStage.SEMANTIC, writes, context).toReport();
    }

    /**
     * Records a retrieval of a node. The next evaluation folds it into the node's access frequency.
     */
    public void recordAccess(String nodeId, Instant at) {
        if (store.findNode(nodeId).isEmpty()) {
            throw new DataIntegrityException(nodeId, "unknown semantic node " + nodeId);
        }
        store.recordAccess(nodeId, at);
    }

    private Instant accessWindowStart(Instant now) {
        return now.minus(Duration.ofDays(properties.accessWindowDays()));
    }

    private static long ageSeconds(SemanticNode node, Instant now) {
        return Math.max(0, now.getEpochSecond() - node.createdAt().getEpochSecond());
    }
}
