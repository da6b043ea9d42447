package ge.salesinsight.forecast.service;

import ge.salesinsight.common.dto.sales.RankingEntryDto;
import ge.salesinsight.common.dto.sales.SalesSummaryDto;
import ge.salesinsight.forecast.config.CurrencyProperties;
import ge.salesinsight.forecast.model.GroupingScheme;
import ge.salesinsight.forecast.model.SalesDataset;
import ge.salesinsight.forecast.model.TransactionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.*;
import java.util.function.Function;

/**
 * Dashboard rankings for a dataset:
 * - top customers by quantity and by converted sales value
 * - top cities by unique shipment (document number) count
 * - top items by quantity
 * - top salespeople by converted sales value (triplet datasets only)
 *
 * Ties are ordered by name so rankings are stable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SalesSummaryService {

    private final CurrencyProperties currencyProperties;

    @Value("${sales.summary.top-customers:5}")
    private int topCustomers;

    @Value("${sales.summary.top-entries:10}")
    private int topEntries;

    public SalesSummaryDto summarize(SalesDataset dataset) {
        List<TransactionRecord> records = dataset.getRecords();

        List<RankingEntryDto> topSalespeople = dataset.getScheme() == GroupingScheme.TRIPLET
                ? rank(sumBy(records, TransactionRecord::getSalesName, this::convertedAmount), topEntries)
                : List.of();

        SalesSummaryDto summary = SalesSummaryDto.builder()
                .datasetId(dataset.getDatasetId())
                .topCustomersByQuantity(rank(sumBy(records, TransactionRecord::getCustomerName,
                        TransactionRecord::getQuantity), topCustomers))
                .topCustomersByValue(rank(sumBy(records, TransactionRecord::getCustomerName,
                        this::convertedAmount), topCustomers))
                .topCitiesByShipments(rank(uniqueDocumentsByCity(records), topEntries))
                .topItemsByQuantity(rank(sumBy(records, TransactionRecord::getItemName,
                        TransactionRecord::getQuantity), topEntries))
                .topSalespeopleByValue(topSalespeople)
                .build();

        log.info("[{}] Summary built from {} transactions", dataset.getDatasetId(), records.size());
        return summary;
    }

    /**
     * Transaction amount multiplied by the rate of its currency.
     */
    BigDecimal convertedAmount(TransactionRecord record) {
        BigDecimal amount = record.getAmount() != null ? record.getAmount() : BigDecimal.ZERO;
        return amount.multiply(currencyProperties.rateFor(record.getCurrency()));
    }

    // ==================== HELPER METHODS ====================

    private Map<String, BigDecimal> sumBy(List<TransactionRecord> records,
                                          Function<TransactionRecord, String> name,
                                          Function<TransactionRecord, BigDecimal> value) {
        Map<String, BigDecimal> totals = new HashMap<>();
        for (TransactionRecord record : records) {
            String key = name.apply(record);
            if (key == null || key.isBlank()) continue;
            BigDecimal v = value.apply(record);
            totals.merge(key, v != null ? v : BigDecimal.ZERO, BigDecimal::add);
        }
        return totals;
    }

    private Map<String, BigDecimal> uniqueDocumentsByCity(List<TransactionRecord> records) {
        Map<String, Set<String>> documents = new HashMap<>();
        for (TransactionRecord record : records) {
            if (record.getCity() == null || record.getCity().isBlank()
                    || record.getDocumentNumber() == null || record.getDocumentNumber().isBlank()) {
                continue;
            }
            documents.computeIfAbsent(record.getCity(), c -> new HashSet<>()).add(record.getDocumentNumber());
        }

        Map<String, BigDecimal> counts = new HashMap<>();
        documents.forEach((city, docs) -> counts.put(city, BigDecimal.valueOf(docs.size())));
        return counts;
    }

    private List<RankingEntryDto> rank(Map<String, BigDecimal> totals, int limit) {
        return totals.entrySet().stream()
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue().reversed()
                        .thenComparing(Map.Entry::getKey))
                .limit(limit)
                .map(e -> RankingEntryDto.builder().name(e.getKey()).value(e.getValue()).build())
                .toList();
    }
}
