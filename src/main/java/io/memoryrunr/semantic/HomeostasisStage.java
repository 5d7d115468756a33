package io.memoryrunr.semantic;

import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.model.PrunedNode;
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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Weekly homeostatic rescaling and pruning of the semantic network.
 */
public class HomeostasisStage implements StageProcessor {

    private static final Logger log = LoggerFactory.getLogger(HomeostasisStage.class);

    private final MemoryStore store;
    private final HomeostaticRescaler rescaler;
    private final IncrementalWriteback writeback;

    public HomeostasisStage(MemoryStore store, HomeostaticRescaler rescaler, IncrementalWriteback writeback) {
        this.store = store;
        this.rescaler = rescaler;
        this.writeback = writeback;
    }

    @Override
    public MemoryStage stage() {
        return MemoryStage.HOMEOSTASIS;
    }

    @Override
    public StageReport process(RunContext context) {
        Instant now = context.startedAt();
        List<SemanticNode> nodes = store.findNodes();
        if (nodes.isEmpty()) {
            return StageReport.empty();
        }
        HomeostaticRescaler.Result result = rescaler.rescale(nodes, now);

        List<PendingWrite<?>> writes = new ArrayList<>();
        for (SemanticNode node : result.kept()) {
            writes.add(PendingWrite.upsert(Tables.HOMEOSTATIC_SCALES, node, now));
        }
        for (SemanticNode node : result.pruned()) {
            writes.add(PendingWrite.upsert(Tables.PRUNED_NODES, PrunedNode.of(node, now), now));
            writes.add(PendingWrite.delete(Tables.SEMANTIC_NODES, node.id(), now));
        }
        log.info("Homeostasis rescaled {} nodes and pruned {}", result.kept().size(), result.pruned().size());
        return writeback.write(MemoryStage.HOMEOSTASIS, writes, context).toReport();
    }
}
