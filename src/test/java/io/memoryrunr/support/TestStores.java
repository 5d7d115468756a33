package io.memoryrunr.support;

import com.zaxxer.hikari.HikariDataSource;
import io.memoryrunr.config.StoreConfig;
import io.memoryrunr.model.Episode;
import io.memoryrunr.model.EpisodeState;
import io.memoryrunr.model.ItemStage;
import io.memoryrunr.model.MemoryItem;
import io.memoryrunr.store.SQLiteMemoryStore;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * File-backed SQLite stores for tests.
 */
public final class TestStores {

    private TestStores() {
    }

    public static HikariDataSource dataSource(Path dir) {
        return StoreConfig.pooledDataSource("jdbc:sqlite:" + dir.resolve("memory.db"), 4, 5_000);
    }

    public static SQLiteMemoryStore store(HikariDataSource dataSource, Clock clock) {
        SQLiteMemoryStore store = new SQLiteMemoryStore(dataSource, clock);
        store.init();
        return store;
    }

    public static MemoryItem item(String id, Instant createdAt, double salience, long arrivalSeq) {
        return new MemoryItem(id, "ref-" + id, "content of " + id, createdAt, salience, 0.5, 0.0,
                ItemStage.PENDING, 0.0, 0, null, arrivalSeq, null, "source-" + id);
    }

    public static Episode episode(String id, String category, Instant windowEnd, double strength,
                                  EpisodeState state, boolean ready) {
        return new Episode(id, category, List.of("topic-" + category), windowEnd.minusSeconds(60), windowEnd,
                List.of(id + "-item"), 1.0, 0.8, strength, ready ? 3 : 0, List.of(), ready, strength, state, null);
    }
}
