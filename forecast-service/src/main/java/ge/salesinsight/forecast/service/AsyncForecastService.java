package ge.salesinsight.forecast.service;

import ge.salesinsight.common.dto.forecast.ForecastResultDto;
import ge.salesinsight.common.dto.forecast.TrainingJobDto;
import ge.salesinsight.common.dto.forecast.TrainingJobDto.JobStatus;
import ge.salesinsight.common.exception.ResourceNotFoundException;
import ge.salesinsight.common.exception.SalesInsightException;
import ge.salesinsight.forecast.model.ForecastRun;
import ge.salesinsight.forecast.model.SalesDataset;
import ge.salesinsight.forecast.model.SalesSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs the forecasting pipeline in the background with job tracking.
 *
 * The dataset id is the job id. Starting a job returns immediately; the work
 * runs on the trainingExecutor pool while clients poll the registry for
 * progress. The result CSV is only present once the job has COMPLETED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AsyncForecastService {

    private final DatasetStorageService storageService;
    private final SalesDataLoader salesDataLoader;
    private final ForecastPipeline forecastPipeline;
    private final ForecastCsvExporter csvExporter;
    private final TrainingJobRegistry jobRegistry;

    @Qualifier("trainingExecutor")
    private final Executor trainingExecutor;

    /**
     * Validate the dataset header and start forecasting in the background.
     *
     * @throws ResourceNotFoundException if the dataset was never uploaded
     * @throws ge.salesinsight.common.exception.ValidationException if required columns are missing
     * @throws ge.salesinsight.common.exception.DuplicateResourceException if a job for this dataset is still running
     */
    public TrainingJobDto startTraining(String datasetId) {
        Path file = storageService.resolve(datasetId);
        String jobId = file.getFileName().toString();
        SalesSchema schema = salesDataLoader.inspectSchema(file);

        TrainingJobDto job = jobRegistry.create(jobId);
        storageService.delete(storageService.forecastResultPath(jobId));

        log.info("[{}] Forecast job queued. Grouping: {}, rows: {}",
                jobId, schema.getScheme(), schema.getDataRowCount());

        try {
            CompletableFuture.runAsync(() -> executeTraining(jobId, file), trainingExecutor);
        } catch (RejectedExecutionException e) {
            log.error("[{}] Forecast job rejected: executor is saturated", jobId);
            jobRegistry.fail(jobId, "Forecast executor is busy, retry later", null);
            throw new SalesInsightException("Forecast executor is busy, retry later",
                    HttpStatus.SERVICE_UNAVAILABLE, "SI_ERR_503", e);
        }
        return job;
    }

    /**
     * Worker body. Every failure is recorded on the job; exceptions stop here,
     * errors are rethrown to the executor once the job is marked failed.
     */
    void executeTraining(String jobId, Path file) {
        log.info("[{}] Forecast started. Thread: {}", jobId, Thread.currentThread().getName());
        long startTime = System.currentTimeMillis();
        Path resultPath = storageService.forecastResultPath(jobId);

        jobRegistry.markRunning(jobId);

        try {
            SalesDataset dataset = salesDataLoader.load(file);

            ForecastRun run = forecastPipeline.run(dataset,
                    (processed, total) -> jobRegistry.updateProgress(jobId, ProgressListener.percent(processed, total)));

            csvExporter.write(run.getRows(), run.getScheme(), resultPath);

            long duration = System.currentTimeMillis() - startTime;
            ForecastResultDto result = ForecastResultDto.builder()
                    .totalGroups(run.getTotalGroups())
                    .forecastedGroups(run.getForecastedGroups())
                    .skippedGroups(run.getSkippedGroups())
                    .rowCount(run.getRows().size())
                    .durationMs(duration)
                    .build();

            jobRegistry.complete(jobId, result);

            log.info("[{}] Forecast completed. Duration: {}ms, groups: {}, forecasted: {}, skipped: {}, rows: {}",
                    jobId, duration, run.getTotalGroups(), run.getForecastedGroups(),
                    run.getSkippedGroups(), run.getRows().size());

        } catch (Exception e) {
            recordFailure(jobId, resultPath, startTime, e);
        } catch (Error e) {
            recordFailure(jobId, resultPath, startTime, e);
            throw e;
        }
    }

    private void recordFailure(String jobId, Path resultPath, long startTime, Throwable failure) {
        long duration = System.currentTimeMillis() - startTime;
        log.error("[{}] Forecast failed after {}ms: {}", jobId, duration, failure.getMessage(), failure);

        storageService.delete(resultPath);
        jobRegistry.fail(jobId, errorMessageOf(failure), stackTraceOf(failure));
    }

    /**
     * @throws ResourceNotFoundException if no job with this id is known
     */
    public TrainingJobDto getJobStatus(String jobId) {
        return jobRegistry.get(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Forecast job", jobId));
    }

    /**
     * Path of the result CSV of a completed job.
     *
     * @throws ResourceNotFoundException if the job is unknown, not completed, or its output is gone
     */
    public Path getForecastResult(String jobId) {
        TrainingJobDto job = getJobStatus(jobId);
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new ResourceNotFoundException(
                    String.format("Forecast result not available for job %s (status %s)", jobId, job.getStatus()));
        }

        Path resultPath = storageService.forecastResultPath(jobId);
        if (!Files.isRegularFile(resultPath)) {
            throw new ResourceNotFoundException("Forecast result", jobId);
        }
        return resultPath;
    }

    /**
     * Failure text shown to pollers; never null, so a failed job is always distinguishable.
     */
    static String errorMessageOf(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static String stackTraceOf(Throwable e) {
        StringWriter sw = new StringWriter();
        e.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
