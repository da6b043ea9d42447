package ge.salesinsight.common.dto.forecast;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Status of an asynchronous forecasting job, as returned to pollers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingJobDto {

    /**
     * Job identifier, equal to the dataset id of the uploaded file.
     */
    private String jobId;

    /**
     * Job status: PENDING, RUNNING, COMPLETED, FAILED.
     */
    private JobStatus status;

    /**
     * True once the job has finished, successfully or not.
     */
    private boolean complete;

    /**
     * Overall progress percentage (0-100).
     */
    private int progress;

    /**
     * Error message (only present if status = FAILED).
     */
    private String error;

    /**
     * Stack trace for debugging (only present if status = FAILED).
     */
    private String errorDetails;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime createdAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime startedAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime completedAt;

    /**
     * Run summary (only present if status = COMPLETED).
     */
    private ForecastResultDto result;

    public enum JobStatus {
        PENDING,    // Registered, worker not started yet
        RUNNING,    // Processing groups
        COMPLETED,  // Successfully finished
        FAILED      // Error occurred
    }
}
