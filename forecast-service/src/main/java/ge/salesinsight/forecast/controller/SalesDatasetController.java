package ge.salesinsight.forecast.controller;

import ge.salesinsight.common.dto.ApiResponse;
import ge.salesinsight.common.dto.cohort.QuarterlyActivityDto;
import ge.salesinsight.common.dto.sales.DatasetUploadResponse;
import ge.salesinsight.common.dto.sales.SalesSummaryDto;
import ge.salesinsight.forecast.service.SalesDatasetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * REST Controller for sales dataset uploads and analyses.
 *
 * IMPORTANT: Controllers contain NO business logic.
 * All logic is delegated to SalesDatasetService.
 */
@RestController
@RequestMapping("/api/sales/datasets")
@RequiredArgsConstructor
@Tag(name = "Sales Datasets", description = "Sales spreadsheet upload, rankings and customer activity")
public class SalesDatasetController {

    static final MediaType XLSX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final SalesDatasetService salesDatasetService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a sales spreadsheet (.xlsx/.xls)")
    public ResponseEntity<ApiResponse<DatasetUploadResponse>> upload(@RequestParam("file") MultipartFile file) {
        DatasetUploadResponse response = salesDatasetService.upload(file);
        return ResponseEntity.ok(ApiResponse.success(response, "File uploaded"));
    }

    @GetMapping("/{datasetId}/summary")
    @Operation(summary = "Get top customers, cities, items and salespeople")
    public ResponseEntity<ApiResponse<SalesSummaryDto>> getSummary(@PathVariable String datasetId) {
        return ResponseEntity.ok(ApiResponse.success(salesDatasetService.getSummary(datasetId)));
    }

    @GetMapping("/{datasetId}/quarterly-activity")
    @Operation(summary = "Get active and inactive customers per quarter")
    public ResponseEntity<ApiResponse<List<QuarterlyActivityDto>>> getQuarterlyActivity(
            @PathVariable String datasetId) {

        return ResponseEntity.ok(ApiResponse.success(salesDatasetService.getQuarterlyActivity(datasetId)));
    }

    @GetMapping("/{datasetId}/quarterly-activity/export")
    @Operation(summary = "Download quarterly customer activity as Excel")
    public ResponseEntity<byte[]> exportQuarterlyActivity(@PathVariable String datasetId) {
        byte[] workbook = salesDatasetService.exportQuarterlyActivity(datasetId);
        return ResponseEntity.ok()
                .contentType(XLSX)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename("quarterly_activity.xlsx").build().toString())
                .body(workbook);
    }
}
