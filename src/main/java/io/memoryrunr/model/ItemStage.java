package io.memoryrunr.model;

/**
 * Where a {@link MemoryItem} currently lives.
 *
 * <ul>
 *   <li>{@code ACTIVE} - admitted into the working-memory active set.</li>
 *   <li>{@code PENDING} - evicted by the attention gate, eligible for re-admission.</li>
 *   <li>{@code EPISODIC} - bound to an episode.</li>
 *   <li>{@code DISCARDED} - decayed out of the sliding window without being admitted.</li>
 * </ul>
 */
public enum ItemStage {
    ACTIVE,
    PENDING,
    EPISODIC,
    DISCARDED
}
