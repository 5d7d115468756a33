package io.memoryrunr.episode;

import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.model.Episode;
import io.memoryrunr.model.EpisodeState;
import io.memoryrunr.model.MemoryItem;
import io.memoryrunr.support.ContentHashes;
import io.memoryrunr.support.UnitInterval;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;

/**
 * Groups admitted items into episodes and computes the short-term memory fields of each episode.
 *
 * <p>Items are consumed in creation order. An item joins the open episode of its category when it is
 * within the co-activation window of that episode, otherwise it opens a new one. Episodes that are
 * still pending can be extended by later runs.</p>
 */
public class EpisodeBuilder {

    private final PipelineProperties.Episode properties;

    public EpisodeBuilder(PipelineProperties.Episode properties) {
        this.properties = properties;
    }

    // ── Formulas ────────────────────────────────────────────────────────────

    /** {@code exp(-age / decay)}, age measured from the newest item. */
    public static double recencyFactor(double ageSeconds, double decayConstantSeconds) {
        return Math.exp(-Math.max(0.0, ageSeconds) / decayConstantSeconds);
    }

    /** Per-item emotional input: {@code sentimentWeight*|sentiment| + importanceWeight*importance}. */
    public static double emotionalInput(double sentiment, double importance, double sentimentWeight, double importanceWeight) {
        return sentimentWeight * Math.abs(sentiment) + importanceWeight * importance;
    }

    public static int hebbianPotential(int coActivations, int cap) {
        return Math.min(coActivations, cap);
    }

    public static boolean isReadyForConsolidation(int hebbianPotential, double emotionalSalience,
                                                  int requiredCoActivations, double salienceThreshold) {
        return hebbianPotential >= requiredCoActivations && emotionalSalience > salienceThreshold;
    }

    // ── Grouping ────────────────────────────────────────────────────────────

    /**
     * @param items        admitted items with their features, oldest first
     * @param recent       stored episodes near the items in time, any state
     * @param boundItems   lookup of items already bound to an extended episode
     * @param now          evaluation time of recency
     */
    public EpisodeBatch build(List<EnrichedItem> items, List<Episode> recent,
                              Function<String, Optional<MemoryItem>> boundItems, Instant now) {
        Duration coActivationWindow = Duration.ofSeconds(properties.coActivationWindowSeconds());

        Map<String, Draft> open = new HashMap<>();
        for (Episode episode : recent) {
            if (episode.state() != EpisodeState.PENDING) {
                continue;
            }
            Draft current = open.get(episode.category());
            if (current == null || episode.windowEnd().isAfter(current.windowEnd)) {
                open.put(episode.category(), Draft.from(episode));
            }
        }

        Map<String, Draft> touched = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        for (EnrichedItem enriched : items) {
            MemoryItem item = enriched.item();
            if (item.episodeId() != null || !seen.add(item.id())) {
                continue;
            }
            Draft draft = open.get(enriched.category());
            if (draft == null || !draft.accepts(item.createdAt(), coActivationWindow)) {
                draft = Draft.start(episodeId(enriched.category(), item.id()), enriched.category());
                open.put(enriched.category(), draft);
            }
            draft.add(enriched, emotionalInput(enriched.features().sentiment(), enriched.features().importance(),
                    properties.sentimentWeight(), properties.importanceWeight()));
            touched.put(draft.id, draft);
        }

        Map<String, Episode> othersById = new LinkedHashMap<>();
        for (Episode episode : recent) {
            if (!touched.containsKey(episode.id())) {
                othersById.put(episode.id(), episode);
            }
        }
        Map<String, Set<String>> grownCoActivation = linkCoActivations(touched.values(), othersById.values());

        List<Episode> episodes = new ArrayList<>();
        List<MemoryItem> boundOut = new ArrayList<>();
        for (Draft draft : touched.values()) {
            Episode episode = draft.toEpisode(now, properties);
            episodes.add(episode);
            int coActivation = episode.itemIds().size() - 1;
            for (MemoryItem item : draft.newItems) {
                boundOut.add(item.boundTo(episode.id(), episode.stmStrength(), coActivation));
            }
            for (String previous : draft.previousItems) {
                boundItems.apply(previous).ifPresent(item ->
                        boundOut.add(item.boundTo(episode.id(), episode.stmStrength(), coActivation)));
            }
        }

        List<Episode> coActivated = new ArrayList<>();
        grownCoActivation.forEach((id, added) -> {
            Episode other = othersById.get(id);
            coActivated.add(withCoActivations(other, added));
        });
        return new EpisodeBatch(episodes, coActivated, boundOut);
    }

    /**
     * Adds every same-category pair within the hebbian window to each draft's co-activation set.
     *
     * @return ids of pending non-draft episodes that gained co-activations, with the ids they gained
     */
    private Map<String, Set<String>> linkCoActivations(Collection<Draft> drafts, Collection<Episode> others) {
        Duration window = Duration.ofSeconds(properties.hebbianWindowSeconds());
        Map<String, Set<String>> grown = new LinkedHashMap<>();
        List<Draft> draftList = new ArrayList<>(drafts);
        for (int i = 0; i < draftList.size(); i++) {
            Draft draft = draftList.get(i);
            for (int j = i + 1; j < draftList.size(); j++) {
                Draft other = draftList.get(j);
                if (other.category.equals(draft.category)
                        && overlaps(draft.windowStart, draft.windowEnd, other.windowStart, other.windowEnd, window)) {
                    draft.coActivated.add(other.id);
                    other.coActivated.add(draft.id);
                }
            }
            for (Episode other : others) {
                if (other.category().equals(draft.category)
                        && overlaps(draft.windowStart, draft.windowEnd, other.windowStart(), other.windowEnd(), window)) {
                    draft.coActivated.add(other.id());
                    if (other.state() == EpisodeState.PENDING && !other.coActivatedWith().contains(draft.id)) {
                        grown.computeIfAbsent(other.id(), k -> new LinkedHashSet<>()).add(draft.id);
                    }
                }
            }
        }
        return grown;
    }

    private Episode withCoActivations(Episode episode, Set<String> added) {
        LinkedHashSet<String> all = new LinkedHashSet<>(episode.coActivatedWith());
        all.addAll(added);
        int hebbian = hebbianPotential(all.size(), properties.hebbianCap());
        boolean ready = isReadyForConsolidation(hebbian, episode.emotionalSalience(),
                properties.readinessCoActivations(), properties.readinessSalience());
        return new Episode(episode.id(), episode.category(), episode.topics(), episode.windowStart(),
                episode.windowEnd(), episode.itemIds(), episode.recencyFactor(), episode.emotionalSalience(),
                episode.stmStrength(), hebbian, new ArrayList<>(all), ready, episode.strength(), episode.state(),
                episode.claimedAt());
    }

    private static boolean overlaps(Instant startA, Instant endA, Instant startB, Instant endB, Duration window) {
        return !endB.isBefore(startA.minus(window)) && !startB.isAfter(endA.plus(window));
    }

    /** Stable id: the same first item of a category always opens the same episode. */
    static String episodeId(String category, String firstItemId) {
        return "ep-" + ContentHashes.of(category + "|" + firstItemId).substring(0, 16);
    }

    private static final class Draft {
        private final String id;
        private final String category;
        private final LinkedHashSet<String> topics = new LinkedHashSet<>();
        private final LinkedHashSet<String> itemIds = new LinkedHashSet<>();
        private final LinkedHashSet<String> coActivated = new LinkedHashSet<>();
        private final List<String> previousItems = new ArrayList<>();
        private final List<MemoryItem> newItems = new ArrayList<>();
        private Instant windowStart;
        private Instant windowEnd;
        private double salienceSum;
        private int salienceCount;

        private Draft(String id, String category) {
            this.id = id;
            this.category = category;
        }

        static Draft start(String id, String category) {
            return new Draft(id, category);
        }

        static Draft from(Episode episode) {
            Draft draft = new Draft(episode.id(), episode.category());
            draft.topics.addAll(episode.topics());
            draft.itemIds.addAll(episode.itemIds());
            draft.previousItems.addAll(episode.itemIds());
            draft.coActivated.addAll(episode.coActivatedWith());
            draft.windowStart = episode.windowStart();
            draft.windowEnd = episode.windowEnd();
            draft.salienceSum = episode.emotionalSalience() * episode.itemIds().size();
            draft.salienceCount = episode.itemIds().size();
            return draft;
        }

        boolean accepts(Instant createdAt, Duration window) {
            return !createdAt.isAfter(windowEnd.plus(window)) && !createdAt.isBefore(windowStart.minus(window));
        }

        void add(EnrichedItem enriched, double emotionalInput) {
            MemoryItem item = enriched.item();
            if (!itemIds.add(item.id())) {
                return;
            }
            newItems.add(item);
            topics.addAll(enriched.features().topics());
            salienceSum += emotionalInput;
            salienceCount++;
            if (windowStart == null || item.createdAt().isBefore(windowStart)) {
                windowStart = item.createdAt();
            }
            if (windowEnd == null || item.createdAt().isAfter(windowEnd)) {
                windowEnd = item.createdAt();
            }
        }

        Episode toEpisode(Instant now, PipelineProperties.Episode properties) {
            double ageSeconds = Duration.between(windowEnd, now).toMillis() / 1000.0;
            double recency = recencyFactor(ageSeconds, properties.decayConstantSeconds());
            double salience = UnitInterval.enforce(salienceSum / salienceCount, "emotional_salience", id);
            double stm = UnitInterval.clamp(recency * salience);
            int hebbian = hebbianPotential(coActivated.size(), properties.hebbianCap());
            boolean ready = isReadyForConsolidation(hebbian, salience,
                    properties.readinessCoActivations(), properties.readinessSalience());
            return new Episode(id, category, new ArrayList<>(topics), windowStart, windowEnd, new ArrayList<>(itemIds),
                    recency, salience, stm, hebbian, new ArrayList<>(coActivated), ready, stm,
                    EpisodeState.PENDING, null);
        }
    }
}
