package io.memoryrunr.consolidation;

import io.memoryrunr.model.Episode;
import io.memoryrunr.model.EpisodeState;
import io.memoryrunr.support.TestStores;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RandomPairSamplingStrategyTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private final List<Episode> episodes = List.of(
            episode("ep-a", "work"),
            episode("ep-b", "work"),
            episode("ep-c", "home"),
            episode("ep-d", "health"));

    @Test
    void shouldOnlyPairDifferentCategories() {
        List<EpisodePair> pairs = new RandomPairSamplingStrategy(7).sample(episodes, 10, 1);

        assertEquals(5, pairs.size());
        assertTrue(pairs.stream().noneMatch(p -> p.left().category().equals(p.right().category())));
    }

    @Test
    void shouldSampleWithoutReplacement() {
        List<EpisodePair> pairs = new RandomPairSamplingStrategy(7).sample(episodes, 3, 1);

        Set<String> keys = new HashSet<>();
        for (EpisodePair pair : pairs) {
            assertTrue(keys.add(pair.left().id() + "|" + pair.right().id()));
        }
        assertEquals(3, keys.size());
    }

    @Test
    void shouldDrawSamePairsForSameCycle() {
        RandomPairSamplingStrategy strategy = new RandomPairSamplingStrategy(7);

        List<Episode> reversed = new ArrayList<>(episodes);
        Collections.reverse(reversed);

        assertEquals(strategy.sample(episodes, 2, 42), strategy.sample(reversed, 2, 42));
    }

    @Test
    void shouldReturnNothingForTooFewEpisodes() {
        RandomPairSamplingStrategy strategy = new RandomPairSamplingStrategy(7);

        assertTrue(strategy.sample(List.of(episode("ep-a", "work")), 3, 1).isEmpty());
        assertTrue(strategy.sample(episodes, 0, 1).isEmpty());
    }

    private static Episode episode(String id, String category) {
        return TestStores.episode(id, category, T0, 0.5, EpisodeState.PENDING, true);
    }
}
