package io.memoryrunr.attention;

import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.model.ItemStage;
import io.memoryrunr.model.MemoryItem;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Capacity-bounded working memory. Candidates compete on
 * {@code recencyWeight * exp(-age / attentionDecay) + salienceWeight * salience}; the top C win.
 *
 * <p>Pure and deterministic: the same candidates, time and cycle always give the same result.</p>
 */
public class AttentionGate {

    private final CapacityPolicy capacityPolicy;
    private final double recencyWeight;
    private final double salienceWeight;
    private final double attentionDecaySeconds;

    public AttentionGate(CapacityPolicy capacityPolicy, PipelineProperties.Attention properties) {
        this(capacityPolicy, properties.recencyWeight(), properties.salienceWeight(), properties.attentionDecaySeconds());
    }

    public AttentionGate(CapacityPolicy capacityPolicy, double recencyWeight, double salienceWeight,
                         double attentionDecaySeconds) {
        this.capacityPolicy = capacityPolicy;
        this.recencyWeight = recencyWeight;
        this.salienceWeight = salienceWeight;
        this.attentionDecaySeconds = attentionDecaySeconds;
    }

    public double score(MemoryItem item, Instant now) {
        double ageSeconds = Math.max(0, Duration.between(item.createdAt(), now).toMillis() / 1000.0);
        return recencyWeight * Math.exp(-ageSeconds / attentionDecaySeconds) + salienceWeight * item.salience();
    }

    public AdmissionResult admit(List<MemoryItem> candidates, Instant now, long cycle) {
        int capacity = capacityPolicy.capacityFor(cycle);
        if (candidates.isEmpty()) {
            return new AdmissionResult(capacity, List.of(), List.of());
        }

        List<Scored> scored = new ArrayList<>(candidates.size());
        for (MemoryItem item : candidates) {
            scored.add(new Scored(item, score(item, now)));
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed()
                .thenComparingLong(s -> s.item().arrivalSeq()));

        List<MemoryItem> admitted = new ArrayList<>();
        List<MemoryItem> evicted = new ArrayList<>();
        for (int i = 0; i < scored.size(); i++) {
            MemoryItem item = scored.get(i).item();
            if (i < capacity) {
                // Items already in the active set keep their original admission time.
                admitted.add(item.stage() == ItemStage.ACTIVE ? item : item.admitted(now));
            } else {
                evicted.add(item.withStage(ItemStage.PENDING));
            }
        }
        return new AdmissionResult(capacity, admitted, evicted);
    }

    private record Scored(MemoryItem item, double score) {
    }
}
