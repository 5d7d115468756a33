package io.memoryrunr.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.memoryrunr.store.MemoryStore;
import io.memoryrunr.store.SQLiteMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Durable store configuration. One bounded SQLite pool backs both the memory store and
 * JobRunr's job storage; the jobrunr-spring-boot-3-starter picks the DataSource up automatically.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);
    private static final int BUSY_TIMEOUT_MILLIS = 5000;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public DataSource dataSource(PipelineProperties properties) {
        PipelineProperties.Writeback writeback = properties.writeback();
        HikariDataSource ds = pooledDataSource(writeback.databaseUrl(), writeback.poolSize(),
                writeback.connectionTimeoutMillis());
        log.info("Memory store DataSource configured: {} (pool size {})", writeback.databaseUrl(), writeback.poolSize());
        return ds;
    }

    @Bean
    public MemoryStore memoryStore(DataSource dataSource, Clock clock) {
        return new SQLiteMemoryStore(dataSource, clock);
    }

    /**
     * Builds the bounded pool. A caller that finds every connection busy blocks for up to
     * {@code connectionTimeoutMillis} and then fails with {@code SQLTransientConnectionException}.
     */
    public static HikariDataSource pooledDataSource(String url, int poolSize, long connectionTimeoutMillis) {
        createParentDirectory(url);

        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        SQLiteDataSource sqliteDataSource = new SQLiteDataSource(sqlite);
        sqliteDataSource.setUrl(url);

        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("memory-store");
        hikari.setDataSource(sqliteDataSource);
        hikari.setMaximumPoolSize(poolSize);
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(connectionTimeoutMillis);
        return new HikariDataSource(hikari);
    }

    private static void createParentDirectory(String url) {
        String prefix = "jdbc:sqlite:";
        if (!url.startsWith(prefix) || url.contains(":memory:") || url.startsWith(prefix + "file:")) {
            return;
        }
        Path parent = Path.of(url.substring(prefix.length())).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create store directory " + parent, e);
        }
    }
}
