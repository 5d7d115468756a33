package io.memoryrunr.pipeline;

import java.util.ArrayList;
import java.util.List;

/**
 * What a stage processor did during one run.
 *
 * @param processed   records written or confirmed unchanged
 * @param quarantined records set aside
 * @param errors      messages of quarantined or degraded records
 * @param cancelled   whether the run stopped at a batch boundary because it was cancelled
 */
public record StageReport(int processed, int quarantined, List<String> errors, boolean cancelled) {

    public StageReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static StageReport empty() {
        return new StageReport(0, 0, List.of(), false);
    }

    public static StageReport cancelledReport() {
        return new StageReport(0, 0, List.of(), true);
    }

    public StageReport plus(StageReport other) {
        List<String> merged = new ArrayList<>(errors);
        merged.addAll(other.errors);
        return new StageReport(processed + other.processed, quarantined + other.quarantined, merged,
                cancelled || other.cancelled);
    }
}
