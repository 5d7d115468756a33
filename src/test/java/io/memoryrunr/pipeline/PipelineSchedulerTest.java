package io.memoryrunr.pipeline;

import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.model.MemoryStage;
import org.jobrunr.jobs.lambdas.JobLambda;
import org.jobrunr.scheduling.JobScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PipelineSchedulerTest {

    private JobScheduler jobScheduler;
    private StageJob stageJob;

    @BeforeEach
    void setUp() {
        jobScheduler = mock(JobScheduler.class);
        stageJob = mock(StageJob.class);
    }

    @Test
    void shouldRegisterOneRecurringJobPerStage() {
        PipelineScheduler scheduler = new PipelineScheduler(jobScheduler, stageJob,
                new PipelineProperties.Schedule(true, null, null, "*/10 * * * *", null, null));

        scheduler.registerRecurringJobs();

        verify(jobScheduler).scheduleRecurrently(eq("memory-stage-attention"), eq("* * * * *"), any(JobLambda.class));
        verify(jobScheduler).scheduleRecurrently(eq("memory-stage-episode"), eq("*/5 * * * *"), any(JobLambda.class));
        verify(jobScheduler).scheduleRecurrently(eq("memory-stage-consolidation"), eq("*/10 * * * *"), any(JobLambda.class));
        verify(jobScheduler).scheduleRecurrently(eq("memory-stage-semantic"), eq("0 * * * *"), any(JobLambda.class));
        verify(jobScheduler).scheduleRecurrently(eq("memory-stage-homeostasis"), eq("0 3 * * 0"), any(JobLambda.class));
    }

    @Test
    void shouldRegisterNothingWhenDisabled() {
        PipelineScheduler scheduler = new PipelineScheduler(jobScheduler, stageJob,
                new PipelineProperties.Schedule(false, null, null, null, null, null));

        scheduler.registerRecurringJobs();

        verifyNoInteractions(jobScheduler);
    }

    @Test
    void shouldEnqueueImmediateRuns() {
        PipelineScheduler scheduler = new PipelineScheduler(jobScheduler, stageJob,
                new PipelineProperties.Schedule(null, null, null, null, null, null));

        scheduler.triggerNow(MemoryStage.EPISODE);
        scheduler.triggerRecluster();

        verify(jobScheduler, times(2)).enqueue(any(JobLambda.class));
    }

    @Test
    void shouldCoverEveryStage() {
        PipelineScheduler scheduler = new PipelineScheduler(jobScheduler, stageJob,
                new PipelineProperties.Schedule(null, null, null, null, null, null));

        Map<MemoryStage, String> crons = scheduler.crons();

        assertEquals(MemoryStage.values().length, crons.size());
        assertEquals("memory-stage-consolidation", PipelineScheduler.jobId(MemoryStage.CONSOLIDATION));
    }
}
