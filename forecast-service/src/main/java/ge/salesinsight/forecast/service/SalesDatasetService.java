package ge.salesinsight.forecast.service;

import ge.salesinsight.common.dto.cohort.QuarterlyActivityDto;
import ge.salesinsight.common.dto.sales.DatasetUploadResponse;
import ge.salesinsight.common.dto.sales.SalesSummaryDto;
import ge.salesinsight.forecast.model.SalesDataset;
import ge.salesinsight.forecast.model.SalesSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.util.List;

/**
 * Upload handling and the synchronous analyses over a stored dataset.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SalesDatasetService {

    private final DatasetStorageService storageService;
    private final SalesDataLoader salesDataLoader;
    private final SalesSummaryService summaryService;
    private final CohortActivityAnalyzer cohortActivityAnalyzer;
    private final QuarterlyActivityExporter quarterlyActivityExporter;

    /**
     * Store an upload and check its header. A file with missing columns is removed again.
     */
    public DatasetUploadResponse upload(MultipartFile file) {
        Path stored = storageService.store(file);
        String datasetId = stored.getFileName().toString();

        SalesSchema schema;
        try {
            schema = salesDataLoader.inspectSchema(stored);
        } catch (RuntimeException e) {
            log.warn("[{}] Rejected upload: {}", datasetId, e.getMessage());
            storageService.delete(stored);
            throw e;
        }

        log.info("[{}] Upload accepted. Grouping: {}, rows: {}",
                datasetId, schema.getScheme(), schema.getDataRowCount());

        return DatasetUploadResponse.builder()
                .datasetId(datasetId)
                .filename(file.getOriginalFilename())
                .sizeBytes(file.getSize())
                .groupingScheme(schema.getScheme().name())
                .rowCount(schema.getDataRowCount())
                .build();
    }

    public SalesDataset loadDataset(String datasetId) {
        return salesDataLoader.load(storageService.resolve(datasetId));
    }

    public SalesSummaryDto getSummary(String datasetId) {
        return summaryService.summarize(loadDataset(datasetId));
    }

    public List<QuarterlyActivityDto> getQuarterlyActivity(String datasetId) {
        return cohortActivityAnalyzer.analyze(loadDataset(datasetId).getRecords());
    }

    public byte[] exportQuarterlyActivity(String datasetId) {
        return quarterlyActivityExporter.export(getQuarterlyActivity(datasetId));
    }
}
