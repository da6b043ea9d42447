package ge.salesinsight.forecast.service;

import ge.salesinsight.common.dto.cohort.QuarterlyActivityDto;
import ge.salesinsight.common.dto.sales.DatasetUploadResponse;
import ge.salesinsight.common.exception.ValidationException;
import ge.salesinsight.forecast.model.GroupingScheme;
import ge.salesinsight.forecast.model.SalesDataset;
import ge.salesinsight.forecast.model.SalesSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SalesDatasetServiceTest {

    @Mock
    private DatasetStorageService storageService;

    @Mock
    private SalesDataLoader salesDataLoader;

    @Mock
    private SalesSummaryService summaryService;

    @Mock
    private QuarterlyActivityExporter quarterlyActivityExporter;

    private final Path stored = Path.of("uploads", "sales.xlsx");
    private final MockMultipartFile upload =
            new MockMultipartFile("file", "sales.xlsx", null, new byte[]{1, 2, 3, 4});

    private SalesDatasetService service;

    @BeforeEach
    void setUp() {
        service = new SalesDatasetService(storageService, salesDataLoader, summaryService,
                new CohortActivityAnalyzer(), quarterlyActivityExporter);
    }

    @Test
    void upload_ShouldDescribeStoredDataset() {
        when(storageService.store(upload)).thenReturn(stored);
        when(salesDataLoader.inspectSchema(stored)).thenReturn(new SalesSchema(GroupingScheme.PAIR, Map.of(), 57));

        DatasetUploadResponse response = service.upload(upload);

        assertEquals("sales.xlsx", response.getDatasetId());
        assertEquals("PAIR", response.getGroupingScheme());
        assertEquals(57, response.getRowCount());
        assertEquals(4, response.getSizeBytes());
        verify(storageService, never()).delete(any());
    }

    @Test
    void upload_InvalidSchema_ShouldRemoveStoredFile() {
        when(storageService.store(upload)).thenReturn(stored);
        when(salesDataLoader.inspectSchema(stored))
                .thenThrow(new ValidationException("columns", "Missing required columns: Amount"));

        assertThrows(ValidationException.class, () -> service.upload(upload));
        verify(storageService).delete(stored);
    }

    @Test
    void getQuarterlyActivity_ShouldAnalyzeLoadedRecords() {
        when(storageService.resolve("sales.xlsx")).thenReturn(stored);
        when(salesDataLoader.load(stored)).thenReturn(new SalesDataset("sales.xlsx", GroupingScheme.PAIR, List.of()));

        List<QuarterlyActivityDto> activity = service.getQuarterlyActivity("sales.xlsx");

        assertTrue(activity.isEmpty());
    }
}
