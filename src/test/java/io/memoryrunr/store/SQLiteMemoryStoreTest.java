package io.memoryrunr.store;

import com.zaxxer.hikari.HikariDataSource;
import io.memoryrunr.error.DataIntegrityException;
import io.memoryrunr.model.Episode;
import io.memoryrunr.model.EpisodeState;
import io.memoryrunr.model.ItemStage;
import io.memoryrunr.model.MemoryItem;
import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.model.SourceMemory;
import io.memoryrunr.support.MutableClock;
import io.memoryrunr.support.TestStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteMemoryStoreTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private HikariDataSource dataSource;
    private MutableClock clock;
    private SQLiteMemoryStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        dataSource = TestStores.dataSource(tempDir);
        store = TestStores.store(dataSource, clock);
    }

    @AfterEach
    void tearDown() {
        dataSource.close();
    }

    @Test
    void shouldBeIdempotentOnInit() {
        store.init();
        assertTrue(store.healthCheck());
        assertEquals(0, store.count(Tables.MEMORY_ITEMS));
    }

    @Test
    void shouldRejectSecondHolderUntilLockExpires() {
        Duration ttl = Duration.ofMinutes(5);
        assertTrue(store.acquireRunLock(MemoryStage.EPISODE, "worker-a", ttl));
        assertFalse(store.acquireRunLock(MemoryStage.EPISODE, "worker-b", ttl));
        assertTrue(store.acquireRunLock(MemoryStage.ATTENTION, "worker-b", ttl));

        clock.advance(ttl.plusSeconds(1));
        assertTrue(store.acquireRunLock(MemoryStage.EPISODE, "worker-b", ttl));
        assertFalse(store.acquireRunLock(MemoryStage.EPISODE, "worker-a", ttl));
    }

    @Test
    void shouldOnlyReleaseLockForItsHolder() {
        Duration ttl = Duration.ofMinutes(5);
        store.acquireRunLock(MemoryStage.SEMANTIC, "worker-a", ttl);

        store.releaseRunLock(MemoryStage.SEMANTIC, "worker-b");
        assertFalse(store.acquireRunLock(MemoryStage.SEMANTIC, "worker-b", ttl));

        store.releaseRunLock(MemoryStage.SEMANTIC, "worker-a");
        assertTrue(store.acquireRunLock(MemoryStage.SEMANTIC, "worker-b", ttl));
    }

    @Test
    void shouldNeverMoveWatermarkBackwards() {
        store.setWatermark(MemoryStage.ATTENTION, T0, "h1");
        store.setWatermark(MemoryStage.ATTENTION, T0.minusSeconds(10), "h0");

        assertEquals(T0, store.getWatermark(MemoryStage.ATTENTION).lastProcessedTimestamp());
        assertEquals("h1", store.getWatermark(MemoryStage.ATTENTION).contentHash());
        assertEquals(Instant.EPOCH, store.getWatermark(MemoryStage.EPISODE).lastProcessedTimestamp());
    }

    @Test
    void shouldRollBackUncommittedTransaction() {
        try (StoreTransaction tx = store.beginTransaction()) {
            tx.upsertBatch(Tables.MEMORY_ITEMS, List.of(TestStores.item("a", T0, 0.5, 1)));
            tx.setWatermark(MemoryStage.ATTENTION, T0, "hash");
        }
        assertEquals(0, store.count(Tables.MEMORY_ITEMS));
        assertEquals(Instant.EPOCH, store.getWatermark(MemoryStage.ATTENTION).lastProcessedTimestamp());
    }

    @Test
    void shouldSkipIdenticalUpsert() {
        MemoryItem item = TestStores.item("a", T0, 0.5, 1);
        try (StoreTransaction tx = store.beginTransaction()) {
            assertEquals(1, tx.upsertBatch(Tables.MEMORY_ITEMS, List.of(item)));
            assertEquals(0, tx.upsertBatch(Tables.MEMORY_ITEMS, List.of(item)));
            assertEquals(1, tx.upsertBatch(Tables.MEMORY_ITEMS, List.of(item.withStage(ItemStage.ACTIVE))));
            tx.commit();
        }
        assertEquals(ItemStage.ACTIVE, store.findItem("a").orElseThrow().stage());
    }

    @Test
    void shouldReportOutOfRangeStrengthAsIntegrityViolation() {
        try (StoreTransaction tx = store.beginTransaction()) {
            assertThrows(DataIntegrityException.class,
                    () -> tx.upsertBatch(Tables.MEMORY_ITEMS, List.of(TestStores.item("bad", T0, 1.2, 1))));
        }
    }

    @Test
    void shouldKeepTerminalEpisodeState() throws SQLException {
        Episode discarded = TestStores.episode("ep-1", "work", T0, 0.05, EpisodeState.DISCARDED, true);
        upsert(Tables.EPISODES, discarded);

        upsert(Tables.EPISODES, TestStores.episode("ep-1", "work", T0, 0.7, EpisodeState.PENDING, true));
        assertEquals(EpisodeState.DISCARDED, store.findEpisode("ep-1").orElseThrow().state());

        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement("UPDATE episodes SET state = 'PENDING' WHERE id = ?")) {
            ps.setString(1, "ep-1");
            SQLException e = assertThrows(SQLException.class, ps::executeUpdate);
            assertTrue(SqlErrors.isConstraintViolation(e));
        }
        assertEquals(EpisodeState.DISCARDED, store.findEpisode("ep-1").orElseThrow().state());
    }

    @Test
    void shouldClaimReadyEpisodesOnce() {
        upsert(Tables.EPISODES, TestStores.episode("ep-ready", "work", T0, 0.6, EpisodeState.PENDING, true));
        upsert(Tables.EPISODES, TestStores.episode("ep-idle", "work", T0, 0.6, EpisodeState.PENDING, false));

        List<Episode> claimed = store.claimEpisodesForReplay(10, T0, T0.minusSeconds(600));
        assertEquals(1, claimed.size());
        assertEquals("ep-ready", claimed.get(0).id());
        assertEquals(EpisodeState.REPLAYING, claimed.get(0).state());
        assertEquals(T0, claimed.get(0).claimedAt());

        assertTrue(store.claimEpisodesForReplay(10, T0.plusSeconds(1), T0.minusSeconds(600)).isEmpty());
    }

    @Test
    void shouldReclaimStaleReplayClaim() {
        upsert(Tables.EPISODES, TestStores.episode("ep-ready", "work", T0, 0.6, EpisodeState.PENDING, true));
        store.claimEpisodesForReplay(10, T0, T0.minusSeconds(600));

        Instant later = T0.plusSeconds(900);
        List<Episode> reclaimed = store.claimEpisodesForReplay(10, later, later.minusSeconds(600));

        assertEquals(1, reclaimed.size());
        assertEquals(later, reclaimed.get(0).claimedAt());
    }

    @Test
    void shouldOnlyApplyOutcomeToClaimedEpisode() {
        Episode pending = TestStores.episode("ep-1", "work", T0, 0.6, EpisodeState.PENDING, true);
        upsert(Tables.EPISODES, pending);
        Episode outcome = pending.transitionTo(EpisodeState.REPLAYING, T0)
                .transitionTo(EpisodeState.STRENGTHENED, T0).withStrength(0.7);

        upsert(Tables.EPISODE_OUTCOMES, outcome);
        assertEquals(EpisodeState.PENDING, store.findEpisode("ep-1").orElseThrow().state());

        store.claimEpisodesForReplay(10, T0, T0.minusSeconds(600));
        upsert(Tables.EPISODE_OUTCOMES, outcome);
        Episode stored = store.findEpisode("ep-1").orElseThrow();
        assertEquals(EpisodeState.STRENGTHENED, stored.state());
        assertEquals(0.7, stored.strength(), 1e-9);
        assertNull(stored.claimedAt());
    }

    @Test
    void shouldOfferCorrectedSourceAgain() {
        SourceMemory source = new SourceMemory("m-1", "ref", T0, Map.of("salience", 0.4), null);
        store.appendSource(source);
        List<SourceMemory> first = store.findSourcesForAttention(Instant.EPOCH, T0.minusSeconds(60), 10);
        assertEquals(1, first.size());

        MemoryItem item = TestStores.item("m-1", T0, 0.4, 1);
        item = new MemoryItem(item.id(), item.contentRef(), item.content(), item.createdAt(), item.salience(),
                item.importance(), item.sentiment(), ItemStage.ACTIVE, 0.0, 0, T0, 1, null, first.get(0).contentHash());
        upsert(Tables.MEMORY_ITEMS, item);
        assertTrue(store.findSourcesForAttention(T0, T0.minusSeconds(60), 10).isEmpty());

        store.appendSource(new SourceMemory("m-1", "ref", T0, Map.of("salience", 0.9), null));
        List<SourceMemory> corrected = store.findSourcesForAttention(T0, T0.minusSeconds(60), 10);
        assertEquals(1, corrected.size());
        assertEquals(0.9, corrected.get(0).metadataDouble("salience", 0), 1e-9);
    }

    @Test
    void shouldCountConsecutiveQuarantinesUntilCleared() {
        store.recordQuarantine(MemoryStage.EPISODE, "item-1", "bad", T0);
        QuarantineEntry second = store.recordQuarantine(MemoryStage.EPISODE, "item-1", "still bad", T0);
        assertEquals(2, second.consecutiveRuns());
        assertEquals("still bad", second.reason());

        store.clearQuarantine(MemoryStage.EPISODE, List.of("item-1"));
        assertTrue(store.findQuarantined(MemoryStage.EPISODE).isEmpty());

        store.recordQuarantine(MemoryStage.EPISODE, "item-2", "bad", T0);
        store.markDeadLettered(MemoryStage.EPISODE, "item-2");
        store.clearQuarantine(MemoryStage.EPISODE, List.of("item-2"));
        assertEquals(Set.of("item-2"), store.findDeadLettered(MemoryStage.EPISODE));
    }

    @Test
    void shouldCountAccessesInsideWindow() {
        store.recordAccess("node-1", T0.minus(Duration.ofDays(8)));
        store.recordAccess("node-1", T0.minus(Duration.ofDays(1)));
        store.recordAccess("node-1", T0);
        store.recordAccess("node-2", T0);

        Map<String, Integer> counts = store.countAccessesSince(T0.minus(Duration.ofDays(7)));

        assertEquals(2, counts.get("node-1"));
        assertEquals(1, counts.get("node-2"));
    }

    private <T> void upsert(TableMapping<T> table, T record) {
        try (StoreTransaction tx = store.beginTransaction()) {
            tx.upsertBatch(table, List.of(record));
            tx.commit();
        }
    }
}
