package io.memoryrunr.enrichment;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleBasedEnrichmentProviderTest {

    private final RuleBasedEnrichmentProvider provider = new RuleBasedEnrichmentProvider();

    @Test
    void shouldPickFirstMatchingGoal() {
        Features features = enrich("Prepare the launch presentation for the client");

        assertEquals("Product Launch Strategy", features.category());
    }

    @Test
    void shouldFallBackToGeneralCategory() {
        assertEquals(RuleBasedEnrichmentProvider.GENERAL_CATEGORY, enrich("Bought groceries").category());
        assertEquals(RuleBasedEnrichmentProvider.GENERAL_CATEGORY, provider.enrich(
                new EnrichmentRequest(null, 0.0, 0.5)).value().orElseThrow().category());
    }

    @Test
    void shouldExtractTopicsAndEntities() {
        Features features = enrich("Budget review with Alice at the Lisbon office");

        assertEquals(List.of("budget", "review"), features.topics());
        assertEquals(List.of("Alice", "Lisbon"), features.entities());
        assertEquals("workplace", features.spatialContext());
    }

    @Test
    void shouldBoostImportanceOfUrgentContent() {
        Features features = provider.enrich(new EnrichmentRequest("Urgent fix for the broken pipeline", 0.0, 0.5))
                .value().orElseThrow();

        assertEquals(0.8, features.importance(), 1e-9);
    }

    @Test
    void shouldDeriveSentimentOnlyWhenNoneSupplied() {
        assertEquals(1.0, enrich("Release completed, great success").sentiment(), 1e-9);
        assertEquals(-0.4, provider.enrich(new EnrichmentRequest("Release completed", -0.4, 0.5))
                .value().orElseThrow().sentiment(), 1e-9);
    }

    @Test
    void shouldScoreSimilarityAsTokenOverlap() {
        assertEquals(1.0, provider.similarity("budget review", "review budget").value().orElseThrow(), 1e-9);
        assertEquals(1.0 / 3, provider.similarity("budget review", "budget meeting").value().orElseThrow(), 1e-9);
        assertEquals(0.0, provider.similarity("", "").value().orElseThrow(), 1e-9);
    }

    private Features enrich(String text) {
        return provider.enrich(new EnrichmentRequest(text, 0.0, 0.5)).value().orElseThrow();
    }
}
