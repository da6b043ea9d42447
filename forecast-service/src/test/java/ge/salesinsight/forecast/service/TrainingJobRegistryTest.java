package ge.salesinsight.forecast.service;

import ge.salesinsight.common.dto.forecast.ForecastResultDto;
import ge.salesinsight.common.dto.forecast.TrainingJobDto;
import ge.salesinsight.common.dto.forecast.TrainingJobDto.JobStatus;
import ge.salesinsight.common.exception.DuplicateResourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class TrainingJobRegistryTest {

    private static final String JOB_ID = "sales.xlsx";

    private TrainingJobRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TrainingJobRegistry();
        ReflectionTestUtils.setField(registry, "retentionMinutes", 120);
    }

    @Test
    void create_ShouldStartPendingAtZero() {
        TrainingJobDto job = registry.create(JOB_ID);

        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals(0, job.getProgress());
        assertFalse(job.isComplete());
        assertNull(job.getError());
    }

    @Test
    void updateProgress_ShouldNeverDecrease() {
        registry.create(JOB_ID);
        registry.markRunning(JOB_ID);

        registry.updateProgress(JOB_ID, 40);
        registry.updateProgress(JOB_ID, 25);
        assertEquals(40, registry.get(JOB_ID).orElseThrow().getProgress());

        registry.updateProgress(JOB_ID, 150);
        assertEquals(100, registry.get(JOB_ID).orElseThrow().getProgress());
    }

    @Test
    void complete_ShouldForceProgressTo100AndFreeze() {
        registry.create(JOB_ID);
        registry.markRunning(JOB_ID);
        registry.updateProgress(JOB_ID, 50);

        registry.complete(JOB_ID, ForecastResultDto.builder().rowCount(22).build());
        registry.fail(JOB_ID, "late failure", null);
        registry.updateProgress(JOB_ID, 10);

        TrainingJobDto job = registry.get(JOB_ID).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertTrue(job.isComplete());
        assertEquals(100, job.getProgress());
        assertNull(job.getError());
        assertEquals(22, job.getResult().getRowCount());
    }

    @Test
    void fail_ShouldKeepLastProgress() {
        registry.create(JOB_ID);
        registry.markRunning(JOB_ID);
        registry.updateProgress(JOB_ID, 67);

        registry.fail(JOB_ID, "Forecast model failed for group [a / b]: degenerate", "trace");

        TrainingJobDto job = registry.get(JOB_ID).orElseThrow();
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertTrue(job.isComplete());
        assertEquals(67, job.getProgress());
        assertTrue(job.getError().contains("a / b"));
        assertEquals("trace", job.getErrorDetails());
    }

    @Test
    void create_WhileRunning_ShouldBeRejected() {
        registry.create(JOB_ID);
        registry.markRunning(JOB_ID);

        DuplicateResourceException ex = assertThrows(DuplicateResourceException.class,
                () -> registry.create(JOB_ID));
        assertEquals(HttpStatus.CONFLICT, ex.getStatus());
    }

    @Test
    void create_AfterCompletion_ShouldReplaceJob() {
        registry.create(JOB_ID);
        registry.complete(JOB_ID, ForecastResultDto.builder().build());

        TrainingJobDto restarted = registry.create(JOB_ID);

        assertEquals(JobStatus.PENDING, restarted.getStatus());
        assertEquals(0, restarted.getProgress());
        assertFalse(registry.get(JOB_ID).orElseThrow().isComplete());
    }

    @Test
    void updates_ForUnknownJob_ShouldBeIgnored() {
        registry.updateProgress("missing.xlsx", 50);
        registry.fail("missing.xlsx", "boom", null);

        assertTrue(registry.get("missing.xlsx").isEmpty());
    }

    @Test
    void evictFinishedBefore_ShouldKeepRunningJobs() {
        registry.create("done.xlsx");
        registry.complete("done.xlsx", ForecastResultDto.builder().build());
        registry.create("running.xlsx");
        registry.markRunning("running.xlsx");

        int removed = registry.evictFinishedBefore(LocalDateTime.now().plusMinutes(1));

        assertEquals(1, removed);
        assertTrue(registry.get("done.xlsx").isEmpty());
        assertTrue(registry.get("running.xlsx").isPresent());
    }
}
