package io.memoryrunr.pipeline;

import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.model.MemoryStage;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registers one JobRunr recurring job per stage once the application is ready.
 * JobRunr decides when each stage runs; the run lock keeps overlapping runs apart.
 */
public class PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);
    static final String JOB_PREFIX = "memory-stage-";

    private final JobScheduler jobScheduler;
    private final StageJob stageJob;
    private final PipelineProperties.Schedule schedule;

    public PipelineScheduler(JobScheduler jobScheduler, StageJob stageJob, PipelineProperties.Schedule schedule) {
        this.jobScheduler = jobScheduler;
        this.stageJob = stageJob;
        this.schedule = schedule;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void registerRecurringJobs() {
        if (!schedule.enabled()) {
            log.info("Stage scheduling disabled");
            return;
        }
        crons().forEach((stage, cron) -> {
            String name = stage.name();
            jobScheduler.scheduleRecurrently(jobId(stage), cron, () -> stageJob.run(name));
            log.info("Scheduled stage {} with cron '{}'", stage, cron);
        });
    }

    /**
     * Enqueues a stage for immediate execution, in addition to its schedule.
     */
    public void triggerNow(MemoryStage stage) {
        String name = stage.name();
        log.info("Triggering stage {} immediately", stage);
        jobScheduler.enqueue(() -> stageJob.run(name));
    }

    /** Enqueues an explicit re-cluster of the semantic network. */
    public void triggerRecluster() {
        log.info("Triggering semantic re-cluster");
        jobScheduler.enqueue(() -> stageJob.recluster());
    }

    Map<MemoryStage, String> crons() {
        Map<MemoryStage, String> crons = new EnumMap<>(MemoryStage.class);
        crons.put(MemoryStage.ATTENTION, schedule.attentionCron());
        crons.put(MemoryStage.EPISODE, schedule.episodeCron());
        crons.put(MemoryStage.CONSOLIDATION, schedule.consolidationCron());
        crons.put(MemoryStage.SEMANTIC, schedule.semanticCron());
        crons.put(MemoryStage.HOMEOSTASIS, schedule.homeostasisCron());
        return crons;
    }

    static String jobId(MemoryStage stage) {
        return JOB_PREFIX + stage.name().toLowerCase();
    }
}
