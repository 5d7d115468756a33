package io.memoryrunr.consolidation;

import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.error.InvariantViolationException;
import io.memoryrunr.model.Association;
import io.memoryrunr.model.AssociationKind;
import io.memoryrunr.model.ConsolidatedMemory;
import io.memoryrunr.model.Episode;
import io.memoryrunr.model.EpisodeState;
import io.memoryrunr.support.UnitInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Hippocampal replay of claimed episodes.
 *
 * <ol>
 *   <li>Related episodes (same category or adjacent in time) are scored for similarity.</li>
 *   <li>The Hebbian rule strengthens the episode and each replay edge.</li>
 *   <li>Competitive forgetting pushes weak traces down and strong traces up.</li>
 *   <li>The episode moves to STRENGTHENED or WEAKENED, then on to long-term memory or the discard pile
 *       when it crosses a threshold.</li>
 * </ol>
 */
public class ConsolidationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConsolidationEngine.class);

    private final HebbianRule hebbianRule;
    private final CompetitiveForgetting forgetting;
    private final SimilarityScorer similarity;
    private final AssociationSamplingStrategy sampling;
    private final PipelineProperties.Consolidation properties;
    private final int hebbianCap;

    public ConsolidationEngine(HebbianRule hebbianRule, CompetitiveForgetting forgetting, SimilarityScorer similarity,
                               AssociationSamplingStrategy sampling, PipelineProperties.Consolidation properties,
                               int hebbianCap) {
        this.hebbianRule = hebbianRule;
        this.forgetting = forgetting;
        this.similarity = similarity;
        this.sampling = sampling;
        this.properties = properties;
        this.hebbianCap = hebbianCap;
    }

    /**
     * Replays a claimed episode against the pool of stored episodes.
     *
     * @throws InvariantViolationException if the episode is not REPLAYING
     */
    public ReplayOutcome replay(Episode episode, List<Episode> pool, AssociationGraph graph, Instant now) {
        if (episode.state() != EpisodeState.REPLAYING) {
            throw new InvariantViolationException(
                    "Episode %s must be REPLAYING to be replayed, was %s".formatted(episode.id(), episode.state()));
        }

        List<Partner> partners = relatedEpisodes(episode, pool);
        double pre = UnitInterval.clamp((double) episode.hebbianPotential() / hebbianCap);
        double post = partners.stream()
                .mapToDouble(p -> p.similarity() * p.episode().strength())
                .max()
                .orElse(0.0);

        List<Association> associations = new ArrayList<>();
        for (Partner partner : partners) {
            Episode other = partner.episode();
            double old = graph.edge(episode.id(), other.id()).map(Association::weight).orElse(partner.similarity());
            Association edge = new Association(episode.id(), other.id(),
                    hebbianRule.apply(old, pre, other.strength()), AssociationKind.REPLAY);
            graph.put(edge);
            associations.add(edge);
        }

        double previous = episode.strength();
        double strengthened = hebbianRule.apply(previous, pre, post);
        double strength = forgetting.apply(strengthened);

        EpisodeState replayed = strength >= previous ? EpisodeState.STRENGTHENED : EpisodeState.WEAKENED;
        Episode outcome = episode.withStrength(strength).transitionTo(replayed, now);

        Optional<ConsolidatedMemory> promoted = Optional.empty();
        if (strength > properties.consolidationThreshold()) {
            outcome = outcome.transitionTo(EpisodeState.CONSOLIDATED_TO_LTM, now);
            promoted = Optional.of(toMemory(outcome, now));
        } else if (strength < properties.discardThreshold()) {
            outcome = outcome.transitionTo(EpisodeState.DISCARDED, now);
        }

        log.debug("Replayed {}: {} partners, strength {} -> {}, {}",
                episode.id(), partners.size(), previous, strength, outcome.state());
        return new ReplayOutcome(outcome, associations, promoted);
    }

    /**
     * Adds CREATIVE edges between sampled pairs of unrelated episodes. Pairs already connected keep
     * their existing edge.
     */
    public List<Association> creativeAssociations(List<Episode> episodes, AssociationGraph graph, long cycle) {
        List<Association> created = new ArrayList<>();
        for (EpisodePair pair : sampling.sample(episodes, properties.creativePairs(), cycle)) {
            if (graph.connected(pair.left().id(), pair.right().id())) {
                continue;
            }
            Optional<Double> score = similarity.score(pair.left(), pair.right());
            if (score.isEmpty()) {
                continue;
            }
            Association edge = new Association(pair.left().id(), pair.right().id(), score.get(), AssociationKind.CREATIVE);
            graph.put(edge);
            created.add(edge);
        }
        return created;
    }

    private List<Partner> relatedEpisodes(Episode episode, List<Episode> pool) {
        Duration adjacency = Duration.ofSeconds(properties.replayAdjacencySeconds());
        List<Partner> partners = new ArrayList<>();
        for (Episode other : pool) {
            if (other.id().equals(episode.id()) || other.state() == EpisodeState.DISCARDED) {
                continue;
            }
            boolean sameCategory = other.category().equals(episode.category());
            boolean adjacent = Duration.between(other.windowEnd(), episode.windowEnd()).abs().compareTo(adjacency) <= 0;
            if (!sameCategory && !adjacent) {
                continue;
            }
            Optional<Double> score = similarity.score(episode, other);
            score.ifPresent(s -> partners.add(new Partner(other, s)));
        }
        return partners;
    }

    private static ConsolidatedMemory toMemory(Episode episode, Instant now) {
        return new ConsolidatedMemory(
                ConsolidatedMemory.idFor(episode.id()),
                episode.id(),
                episode.category(),
                CorticalCategories.of(episode.category()),
                episode.profile(),
                episode.strength(),
                episode.windowEnd(),
                now);
    }

    private record Partner(Episode episode, double similarity) {
    }
}
