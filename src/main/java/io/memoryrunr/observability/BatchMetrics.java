package io.memoryrunr.observability;

import io.memoryrunr.model.MemoryStage;

import java.time.Duration;

/**
 * Counts and timing of one write-back batch.
 *
 * @param stage       owning stage
 * @param batchSize   batch size in effect
 * @param processed   records in the batch
 * @param succeeded   records committed
 * @param failed      records quarantined
 * @param elapsed     time spent on the batch, including retries at smaller sizes
 */
public record BatchMetrics(MemoryStage stage, int batchSize, int processed, int succeeded, int failed, Duration elapsed) {
}
