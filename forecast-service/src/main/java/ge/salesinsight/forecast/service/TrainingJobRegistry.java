package ge.salesinsight.forecast.service;

import ge.salesinsight.common.dto.forecast.ForecastResultDto;
import ge.salesinsight.common.dto.forecast.TrainingJobDto;
import ge.salesinsight.common.dto.forecast.TrainingJobDto.JobStatus;
import ge.salesinsight.common.exception.DuplicateResourceException;
import ge.salesinsight.forecast.model.TrainingJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-wide registry of forecasting jobs, keyed by dataset id.
 *
 * Each job has a single writer (its worker) and any number of pollers. All
 * writes go through {@link ConcurrentHashMap#compute} and replace the whole
 * snapshot, which gives pollers these guarantees:
 * - progress never goes down within one run
 * - once {@code complete} is true the snapshot is frozen until the job is restarted
 *
 * In-memory only; jobs do not survive a restart.
 */
@Slf4j
@Component
public class TrainingJobRegistry {

    private final Map<String, TrainingJob> jobs = new ConcurrentHashMap<>();

    @Value("${forecast.jobs.retention-minutes:120}")
    private int retentionMinutes;

    /**
     * Register a new job. A finished job with the same id is overwritten.
     *
     * @throws DuplicateResourceException if a job with this id is still running
     */
    public TrainingJobDto create(String jobId) {
        TrainingJob created = jobs.compute(jobId, (id, existing) -> {
            if (existing != null && !existing.isComplete()) {
                throw new DuplicateResourceException("Running forecast job", id);
            }
            return TrainingJob.created(id);
        });
        log.info("[{}] Forecast job created", jobId);
        return created.toDto();
    }

    public void markRunning(String jobId) {
        update(jobId, job -> job.toBuilder()
                .status(JobStatus.RUNNING)
                .startedAt(LocalDateTime.now())
                .build());
    }

    /**
     * Record progress after a group has been processed. Values are clamped to
     * 0-100 and never lower the stored progress.
     */
    public void updateProgress(String jobId, int progress) {
        int clamped = Math.max(0, Math.min(100, progress));
        update(jobId, job -> clamped <= job.getProgress()
                ? job
                : job.toBuilder().progress(clamped).build());
    }

    public void complete(String jobId, ForecastResultDto result) {
        update(jobId, job -> job.toBuilder()
                .status(JobStatus.COMPLETED)
                .complete(true)
                .progress(100)
                .completedAt(LocalDateTime.now())
                .result(result)
                .build());
    }

    /**
     * Mark the job failed. Progress keeps its last value.
     */
    public void fail(String jobId, String error, String errorDetails) {
        update(jobId, job -> job.toBuilder()
                .status(JobStatus.FAILED)
                .complete(true)
                .completedAt(LocalDateTime.now())
                .error(error)
                .errorDetails(errorDetails)
                .build());
    }

    public Optional<TrainingJobDto> get(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(TrainingJob::toDto);
    }

    /**
     * Drop finished jobs that completed before {@code cutoff}.
     *
     * @return number of jobs removed
     */
    public int evictFinishedBefore(LocalDateTime cutoff) {
        int before = jobs.size();
        jobs.entrySet().removeIf(entry -> {
            TrainingJob job = entry.getValue();
            return job.isComplete() && job.getCompletedAt() != null && job.getCompletedAt().isBefore(cutoff);
        });
        return before - jobs.size();
    }

    @Scheduled(fixedDelayString = "${forecast.jobs.cleanup-interval-ms:600000}")
    public void cleanupOldJobs() {
        int removed = evictFinishedBefore(LocalDateTime.now().minusMinutes(retentionMinutes));
        if (removed > 0) {
            log.info("Cleaned up {} old forecast jobs", removed);
        }
    }

    private void update(String jobId, UnaryOperator<TrainingJob> change) {
        jobs.computeIfPresent(jobId, (id, job) -> job.isComplete() ? job : change.apply(job));
    }
}
