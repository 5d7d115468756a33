package io.memoryrunr.writeback;

import io.memoryrunr.pipeline.StageReport;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one write-back pass.
 *
 * @param committed      records committed
 * @param skipped        records already stored with the same hash at or before the watermark
 * @param quarantined    records rejected by a store constraint
 * @param batches        transactions committed
 * @param finalBatchSize batch size in effect at the end of the pass
 * @param errors         quarantine reasons
 * @param cancelled      whether the pass stopped early at a batch boundary
 * @param elapsed        wall time of the pass
 */
public record WritebackResult(
        int committed,
        int skipped,
        int quarantined,
        int batches,
        int finalBatchSize,
        List<String> errors,
        boolean cancelled,
        Duration elapsed
) {
    public WritebackResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public StageReport toReport() {
        return new StageReport(committed + skipped, quarantined, errors, cancelled);
    }
}
