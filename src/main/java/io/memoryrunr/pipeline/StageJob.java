package io.memoryrunr.pipeline;

import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.semantic.SemanticStage;
import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JobRunr entry points. Arguments are plain strings so that serialized jobs survive enum changes.
 */
public class StageJob {

    private static final Logger log = LoggerFactory.getLogger(StageJob.class);

    private final StageRunner runner;
    private final SemanticStage semanticStage;

    public StageJob(StageRunner runner, SemanticStage semanticStage) {
        this.runner = runner;
        this.semanticStage = semanticStage;
    }

    @Job(name = "Memory stage: %0", retries = 0)
    public void run(String stage) {
        report(runner.run(MemoryStage.fromString(stage)));
    }

    @Job(name = "Semantic re-cluster", retries = 0)
    public void recluster() {
        report(runner.run(MemoryStage.SEMANTIC, semanticStage::recluster));
    }

    private static void report(JobRunResult result) {
        if (result.status() == RunStatus.FAILED) {
            log.warn("Stage {} failed: {}", result.stage(), result.errors());
        }
    }
}
