package io.memoryrunr.consolidation;

import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.error.InvariantViolationException;
import io.memoryrunr.model.Association;
import io.memoryrunr.model.Episode;
import io.memoryrunr.model.EpisodeState;
import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.pipeline.RunContext;
import io.memoryrunr.pipeline.StageProcessor;
import io.memoryrunr.pipeline.StageReport;
import io.memoryrunr.store.MemoryStore;
import io.memoryrunr.store.Tables;
import io.memoryrunr.writeback.IncrementalWriteback;
import io.memoryrunr.writeback.PendingWrite;
import io.memoryrunr.writeback.QuarantineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Consolidation stage: claims ready episodes, replays them and persists edges, long-term memories and
 * episode outcomes.
 *
 * <p>For each episode the replay edges and the derived memory are written before the outcome, at the
 * same timestamp. A run that dies in between leaves the episode REPLAYING; it is claimed again once
 * the claim is older than the run-lock TTL, and the derived memory is never written twice.</p>
 */
public class ConsolidationStage implements StageProcessor {

    private static final Logger log = LoggerFactory.getLogger(ConsolidationStage.class);

    private final MemoryStore store;
    private final ConsolidationEngine engine;
    private final IncrementalWriteback writeback;
    private final QuarantineService quarantine;
    private final PipelineProperties.Consolidation properties;
    private final Duration claimTtl;

    public ConsolidationStage(MemoryStore store, ConsolidationEngine engine, IncrementalWriteback writeback,
                              QuarantineService quarantine, PipelineProperties.Consolidation properties,
                              Duration claimTtl) {
        this.store = store;
        this.engine = engine;
        this.writeback = writeback;
        this.quarantine = quarantine;
        this.properties = properties;
        this.claimTtl = claimTtl;
    }

    @Override
    public MemoryStage stage() {
        return MemoryStage.CONSOLIDATION;
    }

    @Override
    public StageReport process(RunContext context) {
        Instant now = context.startedAt();
        List<Episode> claimed = new ArrayList<>(
                store.claimEpisodesForReplay(properties.batchSize(), now, now.minus(claimTtl)));
        if (claimed.isEmpty()) {
            log.debug("No episodes ready for replay");
            return StageReport.empty();
        }
        claimed.sort(Comparator.comparing(Episode::windowEnd).thenComparing(Episode::id));

        Instant earliest = claimed.get(0).windowStart();
        Map<String, Episode> pool = new LinkedHashMap<>();
        for (Episode episode : store.findEpisodesEndingAfter(
                earliest.minus(Duration.ofSeconds(properties.replayAdjacencySeconds())))) {
            pool.put(episode.id(), episode);
        }
        for (Episode episode : claimed) {
            pool.put(episode.id(), episode);
        }

        Set<Association> known = new LinkedHashSet<>();
        for (Episode episode : claimed) {
            known.addAll(store.findAssociations(episode.id()));
        }
        AssociationGraph graph = AssociationGraph.of(known);

        List<PendingWrite<?>> writes = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int quarantined = 0;
        int promoted = 0;
        for (Episode episode : claimed) {
            try {
                ReplayOutcome outcome = engine.replay(episode, new ArrayList<>(pool.values()), graph, now);
                Instant ts = episode.windowEnd();
                for (Association association : outcome.associations()) {
                    writes.add(PendingWrite.upsert(Tables.ASSOCIATIONS, association, ts));
                }
                if (outcome.promoted().isPresent()) {
                    writes.add(PendingWrite.upsert(Tables.CONSOLIDATED_MEMORIES, outcome.promoted().get(), ts));
                    promoted++;
                }
                writes.add(PendingWrite.upsert(Tables.EPISODE_OUTCOMES, outcome.episode(), ts));
                pool.put(episode.id(), outcome.episode());
            } catch (InvariantViolationException e) {
                quarantine.quarantine(MemoryStage.CONSOLIDATION, episode.id(), e.getMessage());
                errors.add(episode.id() + ": " + e.getMessage());
                quarantined++;
            }
        }

        List<Episode> live = pool.values().stream()
                .filter(e -> e.state() != EpisodeState.DISCARDED)
                .toList();
        Instant newest = claimed.get(claimed.size() - 1).windowEnd();
        for (Association association : engine.creativeAssociations(live, graph, context.cycle())) {
            writes.add(PendingWrite.upsert(Tables.ASSOCIATIONS, association, newest));
        }

        log.info("Replayed {} episodes: {} promoted to long-term memory, {} quarantined",
                claimed.size() - quarantined, promoted, quarantined);
        StageReport written = writeback.write(MemoryStage.CONSOLIDATION, writes, context).toReport();
        return written.plus(new StageReport(0, quarantined, errors, false));
    }
}
