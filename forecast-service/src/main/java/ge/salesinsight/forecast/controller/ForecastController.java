package ge.salesinsight.forecast.controller;

import ge.salesinsight.common.dto.ApiResponse;
import ge.salesinsight.common.dto.forecast.TrainingJobDto;
import ge.salesinsight.forecast.service.AsyncForecastService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller for background forecasting jobs.
 *
 * Jobs are keyed by dataset id: start one, poll its progress, then download the CSV.
 */
@RestController
@RequestMapping("/api/forecast/jobs")
@RequiredArgsConstructor
@Tag(name = "Forecast", description = "Per-group monthly sales forecasting jobs")
public class ForecastController {

    private final AsyncForecastService asyncForecastService;

    @PostMapping("/{datasetId}")
    @Operation(summary = "Start forecasting an uploaded dataset")
    public ResponseEntity<ApiResponse<TrainingJobDto>> startTraining(@PathVariable String datasetId) {
        TrainingJobDto job = asyncForecastService.startTraining(datasetId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success(job, "Forecast job started"));
    }

    @GetMapping("/{datasetId}")
    @Operation(summary = "Get forecast job status and progress")
    public ResponseEntity<ApiResponse<TrainingJobDto>> getJobStatus(@PathVariable String datasetId) {
        return ResponseEntity.ok(ApiResponse.success(asyncForecastService.getJobStatus(datasetId)));
    }

    @GetMapping("/{datasetId}/result")
    @Operation(summary = "Download the forecast result CSV of a completed job")
    public ResponseEntity<Resource> getResult(@PathVariable String datasetId) {
        Resource csv = new FileSystemResource(asyncForecastService.getForecastResult(datasetId));
        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv"))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename("forecast_result.csv").build().toString())
                .body(csv);
    }
}
