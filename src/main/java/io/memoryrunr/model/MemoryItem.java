package io.memoryrunr.model;

import java.time.Instant;

/**
 * A short-lived memory item flowing through working and short-term memory.
 *
 * @param id                stable identifier, equal to the source memory id
 * @param contentRef        opaque content reference
 * @param content           optional text used for enrichment (may be null)
 * @param createdAt         creation time of the source memory
 * @param salience          externally supplied salience in [0,1]
 * @param importance        importance in [0,1]
 * @param sentiment         sentiment in [-1,1]
 * @param stage             current stage
 * @param strength          strength in [0,1]
 * @param coActivationCount number of items co-active with this one in its episode
 * @param admittedAt        last admission into the active set, null if never admitted
 * @param arrivalSeq        arrival order, used to break admission ties
 * @param episodeId         owning episode, null until grouped
 * @param sourceHash        content hash of the source memory this item was derived from
 */
public record MemoryItem(
        String id,
        String contentRef,
        String content,
        Instant createdAt,
        double salience,
        double importance,
        double sentiment,
        ItemStage stage,
        double strength,
        int coActivationCount,
        Instant admittedAt,
        long arrivalSeq,
        String episodeId,
        String sourceHash
) {

    public MemoryItem withStage(ItemStage stage) {
        return new MemoryItem(id, contentRef, content, createdAt, salience, importance, sentiment,
                stage, strength, coActivationCount, admittedAt, arrivalSeq, episodeId, sourceHash);
    }

    public MemoryItem admitted(Instant at) {
        return new MemoryItem(id, contentRef, content, createdAt, salience, importance, sentiment,
                ItemStage.ACTIVE, strength, coActivationCount, at, arrivalSeq, episodeId, sourceHash);
    }

    public MemoryItem boundTo(String episodeId, double strength, int coActivationCount) {
        return new MemoryItem(id, contentRef, content, createdAt, salience, importance, sentiment,
                ItemStage.EPISODIC, strength, coActivationCount, admittedAt, arrivalSeq, episodeId, sourceHash);
    }

    /** Text handed to the enrichment collaborator. */
    public String enrichmentText() {
        return content != null && !content.isBlank() ? content : contentRef;
    }
}
