package ge.salesinsight.common.dto.sales;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Dashboard rankings for one dataset. Monetary values are converted
 * into the reporting currency with the configured exchange rates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalesSummaryDto {
    private String datasetId;
    private List<RankingEntryDto> topCustomersByQuantity;
    private List<RankingEntryDto> topCustomersByValue;
    private List<RankingEntryDto> topCitiesByShipments;
    private List<RankingEntryDto> topItemsByQuantity;
    private List<RankingEntryDto> topSalespeopleByValue;
}
