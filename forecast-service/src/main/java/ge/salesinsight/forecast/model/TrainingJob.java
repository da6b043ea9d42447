package ge.salesinsight.forecast.model;

import ge.salesinsight.common.dto.forecast.ForecastResultDto;
import ge.salesinsight.common.dto.forecast.TrainingJobDto;
import ge.salesinsight.common.dto.forecast.TrainingJobDto.JobStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Immutable snapshot of a forecasting job. The registry swaps whole snapshots,
 * so a reader never sees a half-applied update.
 */
@Value
@Builder(toBuilder = true)
public class TrainingJob {
    String jobId;
    JobStatus status;
    boolean complete;
    int progress;
    String error;
    String errorDetails;
    LocalDateTime createdAt;
    LocalDateTime startedAt;
    LocalDateTime completedAt;
    ForecastResultDto result;

    public static TrainingJob created(String jobId) {
        return TrainingJob.builder()
                .jobId(jobId)
                .status(JobStatus.PENDING)
                .complete(false)
                .progress(0)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public TrainingJobDto toDto() {
        return TrainingJobDto.builder()
                .jobId(jobId)
                .status(status)
                .complete(complete)
                .progress(progress)
                .error(error)
                .errorDetails(errorDetails)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .result(result)
                .build();
    }
}
