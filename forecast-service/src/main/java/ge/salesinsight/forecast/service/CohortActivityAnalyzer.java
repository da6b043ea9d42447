package ge.salesinsight.forecast.service;

import ge.salesinsight.common.dto.cohort.QuarterlyActivityDto;
import ge.salesinsight.common.util.DateUtils;
import ge.salesinsight.forecast.model.TransactionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Quarter-by-quarter customer activity.
 *
 * Walks the quarters present in the data in ascending order while accumulating
 * every customer seen so far. For each quarter, active customers transacted in
 * it and inactive customers are the accumulated ones that did not.
 * Customer lists are sorted, so the same input always yields the same output.
 */
@Slf4j
@Component
public class CohortActivityAnalyzer {

    public List<QuarterlyActivityDto> analyze(List<TransactionRecord> records) {
        // Quarter labels (2024Q1) sort chronologically
        Map<String, Set<String>> customersByQuarter = new TreeMap<>();
        for (TransactionRecord record : records) {
            String customer = record.getCustomerName();
            if (record.getDate() == null || customer == null || customer.isBlank()) {
                continue;
            }
            customersByQuarter
                    .computeIfAbsent(DateUtils.quarterLabel(record.getDate()), q -> new TreeSet<>())
                    .add(customer);
        }

        Set<String> cumulative = new TreeSet<>();
        List<QuarterlyActivityDto> activity = new ArrayList<>(customersByQuarter.size());

        for (Map.Entry<String, Set<String>> entry : customersByQuarter.entrySet()) {
            Set<String> active = entry.getValue();
            cumulative.addAll(active);

            Set<String> inactive = new TreeSet<>(cumulative);
            inactive.removeAll(active);

            activity.add(QuarterlyActivityDto.builder()
                    .quarter(entry.getKey())
                    .activeCustomers(new ArrayList<>(active))
                    .inactiveCustomers(new ArrayList<>(inactive))
                    .build());
        }

        log.debug("Quarterly activity computed for {} quarters, {} customers overall",
                activity.size(), cumulative.size());
        return activity;
    }
}
