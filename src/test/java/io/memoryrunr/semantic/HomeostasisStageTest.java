package io.memoryrunr.semantic;

import com.zaxxer.hikari.HikariDataSource;
import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.embedding.EmbeddingProvider;
import io.memoryrunr.model.AgeCategory;
import io.memoryrunr.model.ConsolidatedMemory;
import io.memoryrunr.model.ConsolidationState;
import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.model.SemanticNode;
import io.memoryrunr.observability.PipelineObserver;
import io.memoryrunr.pipeline.RunContext;
import io.memoryrunr.pipeline.StageReport;
import io.memoryrunr.store.SQLiteMemoryStore;
import io.memoryrunr.store.StoreTransaction;
import io.memoryrunr.store.Tables;
import io.memoryrunr.support.MutableClock;
import io.memoryrunr.support.TestStores;
import io.memoryrunr.writeback.IncrementalWriteback;
import io.memoryrunr.writeback.QuarantineService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HomeostasisStageTest {

    private static final Instant NOW = Instant.parse("2025-06-01T03:00:00Z");
    private static final Instant LONG_AGO = NOW.minus(Duration.ofDays(100));

    @TempDir
    Path tempDir;

    private HikariDataSource dataSource;
    private SQLiteMemoryStore store;
    private IncrementalWriteback writeback;
    private PipelineProperties.Semantic properties;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        dataSource = TestStores.dataSource(tempDir);
        store = TestStores.store(dataSource, clock);
        PipelineObserver observer = mock(PipelineObserver.class);
        writeback = new IncrementalWriteback(store, new QuarantineService(store, observer, 3, clock), observer, 100, 10);
        properties = PipelineProperties.defaults().semantic();
    }

    @AfterEach
    void tearDown() {
        dataSource.close();
    }

    @Test
    void shouldRescaleAndPruneWeakRemoteNodes() {
        saveMemories(memory("cm-strong", 1.0), memory("cm-weak", 0.01));
        saveNodes(node("cm-strong", 1.0, 1, 1.0), node("cm-weak", 0.0, 1000, 0.001));

        StageReport report = new HomeostasisStage(store, new HomeostaticRescaler(properties), writeback)
                .process(RunContext.start(MemoryStage.HOMEOSTASIS, NOW));

        assertEquals(0, report.quarantined());
        assertTrue(store.findNode("cm-weak").isEmpty());
        SemanticNode strong = store.findNode("cm-strong").orElseThrow();
        assertEquals(1.0 / 0.5005, strong.homeostaticScale(), 1e-9);
        assertEquals(1, store.count(Tables.PRUNED_NODES));
    }

    @Test
    void shouldNotPlacePrunedMemoryAgain() {
        saveMemories(memory("cm-strong", 1.0), memory("cm-weak", 0.01));
        saveNodes(node("cm-strong", 1.0, 1, 1.0), node("cm-weak", 0.0, 1000, 0.001));
        new HomeostasisStage(store, new HomeostaticRescaler(properties), writeback)
                .process(RunContext.start(MemoryStage.HOMEOSTASIS, NOW));

        SemanticStage semantic = new SemanticStage(store, new SemanticNetworkBuilder(
                new ClusterAssigner(properties.clusterCount(), properties.newClusterSimilarity()),
                EmbeddingProvider.NONE, properties), writeback, properties);
        semantic.process(RunContext.start(MemoryStage.SEMANTIC, NOW.plusSeconds(60)));

        assertTrue(store.findNode("cm-weak").isEmpty());
        assertTrue(store.findUnplacedConsolidated(10).isEmpty());
    }

    @Test
    void shouldDoNothingWithoutNodes() {
        StageReport report = new HomeostasisStage(store, new HomeostaticRescaler(properties), writeback)
                .process(RunContext.start(MemoryStage.HOMEOSTASIS, NOW));

        assertEquals(StageReport.empty(), report);
    }

    @Test
    void shouldNotUndoReclusterCommittedWhileRescaling() {
        saveMemories(memory("cm-a", 1.0), memory("cm-b", 1.0));
        saveNodes(node("cm-a", 1.0, 1, 1.0), node("cm-b", 1.0, 2, 0.8));
        SQLiteMemoryStore racing = spy(store);
        doAnswer(invocation -> {
            Object snapshot = invocation.callRealMethod();
            saveNodes(inCluster(store.findNode("cm-a").orElseThrow(), 3));
            return snapshot;
        }).when(racing).findNodes();

        new HomeostasisStage(racing, new HomeostaticRescaler(properties), writeback)
                .process(RunContext.start(MemoryStage.HOMEOSTASIS, NOW));

        SemanticNode moved = store.findNode("cm-a").orElseThrow();
        assertEquals(3, moved.clusterId());
        assertEquals(1.0, moved.homeostaticScale(), 1e-9);
    }

    @Test
    void shouldNotBringBackPrunedNode() {
        saveMemories(memory("cm-strong", 1.0), memory("cm-weak", 0.01));
        SemanticNode weak = node("cm-weak", 0.0, 1000, 0.001);
        saveNodes(node("cm-strong", 1.0, 1, 1.0), weak);
        new HomeostasisStage(store, new HomeostaticRescaler(properties), writeback)
                .process(RunContext.start(MemoryStage.HOMEOSTASIS, NOW));

        try (StoreTransaction tx = store.beginTransaction()) {
            assertEquals(0, tx.upsertBatch(Tables.SEMANTIC_NODES, List.of(weak)));
            tx.commit();
        }

        assertTrue(store.findNode("cm-weak").isEmpty());
    }

    @Test
    void shouldKeepRescaledNodeWhenEvaluatedFromOlderScale() {
        saveMemories(memory("cm-strong", 1.0), memory("cm-weak", 0.01));
        SemanticNode stale = node("cm-strong", 1.0, 1, 1.0);
        saveNodes(stale, node("cm-weak", 0.0, 1000, 0.001));
        new HomeostasisStage(store, new HomeostaticRescaler(properties), writeback)
                .process(RunContext.start(MemoryStage.HOMEOSTASIS, NOW));

        saveNodes(inCluster(stale, 4));

        SemanticNode stored = store.findNode("cm-strong").orElseThrow();
        assertEquals(7, stored.clusterId());
        assertEquals(1.0 / 0.5005, stored.homeostaticScale(), 1e-9);
    }

    private void saveMemories(ConsolidatedMemory... memories) {
        try (StoreTransaction tx = store.beginTransaction()) {
            tx.upsertBatch(Tables.CONSOLIDATED_MEMORIES, List.of(memories));
            tx.commit();
        }
    }

    private void saveNodes(SemanticNode... nodes) {
        try (StoreTransaction tx = store.beginTransaction()) {
            tx.upsertBatch(Tables.SEMANTIC_NODES, List.of(nodes));
            tx.commit();
        }
    }

    private static ConsolidatedMemory memory(String id, double strength) {
        return new ConsolidatedMemory(id, id.replace("cm-", "ep-"), "Operations and Maintenance", "technical_procedures",
                "profile", strength, LONG_AGO, LONG_AGO);
    }

    private static SemanticNode inCluster(SemanticNode node, int clusterId) {
        return new SemanticNode(node.id(), node.semanticCategory(), clusterId, node.consolidatedStrength(),
                node.competitionRank(), node.accessFrequency(), node.homeostaticScale(), node.retrievalStrength(),
                node.ageCategory(), node.consolidationState(), node.createdAt(), NOW);
    }

    private static SemanticNode node(String id, double strength, int rank, double retrieval) {
        return new SemanticNode(id, "technical_procedures", 7, strength, rank, 0, 1.0, retrieval,
                AgeCategory.REMOTE, ConsolidationState.EPISODIC, LONG_AGO, NOW.minus(Duration.ofDays(7)));
    }
}
