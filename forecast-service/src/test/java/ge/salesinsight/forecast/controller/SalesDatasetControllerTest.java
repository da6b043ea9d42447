package ge.salesinsight.forecast.controller;

import ge.salesinsight.common.dto.cohort.QuarterlyActivityDto;
import ge.salesinsight.common.dto.sales.DatasetUploadResponse;
import ge.salesinsight.common.exception.ValidationException;
import ge.salesinsight.common.infrastructure.GlobalExceptionHandler;
import ge.salesinsight.forecast.service.SalesDatasetService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class SalesDatasetControllerTest {

    @Mock
    private SalesDatasetService salesDatasetService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SalesDatasetController(salesDatasetService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void upload_ShouldReturnDatasetSummary() throws Exception {
        when(salesDatasetService.upload(any())).thenReturn(DatasetUploadResponse.builder()
                .datasetId("sales.xlsx")
                .filename("sales.xlsx")
                .sizeBytes(4)
                .groupingScheme("TRIPLET")
                .rowCount(120)
                .build());

        mockMvc.perform(multipart("/api/sales/datasets")
                        .file(new MockMultipartFile("file", "sales.xlsx", null, "data".getBytes())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.datasetId").value("sales.xlsx"))
                .andExpect(jsonPath("$.data.groupingScheme").value("TRIPLET"))
                .andExpect(jsonPath("$.data.rowCount").value(120));
    }

    @Test
    void upload_MissingColumns_ShouldReturnBadRequest() throws Exception {
        when(salesDatasetService.upload(any()))
                .thenThrow(new ValidationException("columns", "Missing required columns: City"));

        mockMvc.perform(multipart("/api/sales/datasets")
                        .file(new MockMultipartFile("file", "sales.xlsx", null, "data".getBytes())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("SI_ERR_400"))
                .andExpect(jsonPath("$.message", containsString("City")));
    }

    @Test
    void upload_WithoutFile_ShouldReturnBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/sales/datasets"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getQuarterlyActivity_ShouldUseSnakeCaseLists() throws Exception {
        when(salesDatasetService.getQuarterlyActivity("sales.xlsx")).thenReturn(List.of(
                QuarterlyActivityDto.builder()
                        .quarter("2024Q2")
                        .activeCustomers(List.of("B", "C"))
                        .inactiveCustomers(List.of("A"))
                        .build()));

        mockMvc.perform(get("/api/sales/datasets/sales.xlsx/quarterly-activity"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].quarter").value("2024Q2"))
                .andExpect(jsonPath("$.data[0].active_customers[1]").value("C"))
                .andExpect(jsonPath("$.data[0].inactive_customers[0]").value("A"));
    }

    @Test
    void exportQuarterlyActivity_ShouldDownloadWorkbook() throws Exception {
        when(salesDatasetService.exportQuarterlyActivity("sales.xlsx")).thenReturn(new byte[]{1, 2, 3});

        mockMvc.perform(get("/api/sales/datasets/sales.xlsx/quarterly-activity/export"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(SalesDatasetController.XLSX))
                .andExpect(header().string("Content-Disposition", containsString("quarterly_activity.xlsx")))
                .andExpect(content().bytes(new byte[]{1, 2, 3}));
    }
}
