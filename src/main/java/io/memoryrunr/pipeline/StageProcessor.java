package io.memoryrunr.pipeline;

import io.memoryrunr.model.MemoryStage;

/**
 * One pipeline stage. Implementations read their input from the store, compute, and persist their
 * output through the incremental write-back. They never call each other.
 */
public interface StageProcessor {

    MemoryStage stage();

    StageReport process(RunContext context);
}
