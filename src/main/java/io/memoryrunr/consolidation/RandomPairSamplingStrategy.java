package io.memoryrunr.consolidation;

import io.memoryrunr.model.Episode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Uniformly samples pairs of episodes from different categories without replacement. The generator
 * is seeded from the configured seed and the cycle, so a cycle always draws the same pairs.
 */
public class RandomPairSamplingStrategy implements AssociationSamplingStrategy {

    private final long seed;

    public RandomPairSamplingStrategy(long seed) {
        this.seed = seed;
    }

    @Override
    public List<EpisodePair> sample(List<Episode> episodes, int count, long cycle) {
        if (count <= 0 || episodes.size() < 2) {
            return List.of();
        }
        List<Episode> sorted = new ArrayList<>(episodes);
        sorted.sort(Comparator.comparing(Episode::id));

        List<EpisodePair> candidates = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            for (int j = i + 1; j < sorted.size(); j++) {
                if (!sorted.get(i).category().equals(sorted.get(j).category())) {
                    candidates.add(new EpisodePair(sorted.get(i), sorted.get(j)));
                }
            }
        }

        Random random = new Random(seed ^ cycle);
        List<EpisodePair> picked = new ArrayList<>();
        while (picked.size() < count && !candidates.isEmpty()) {
            picked.add(candidates.remove(random.nextInt(candidates.size())));
        }
        return picked;
    }
}
