package ge.salesinsight.common.dto.sales;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for sales dataset uploads.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetUploadResponse {

    // Dataset id doubles as the forecasting job id
    private String datasetId;
    private String filename;
    private long sizeBytes;

    // TRIPLET or PAIR
    private String groupingScheme;

    // Non-header rows in the first sheet, blank rows included
    private int rowCount;
}
