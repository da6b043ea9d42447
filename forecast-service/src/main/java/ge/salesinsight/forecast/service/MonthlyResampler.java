package ge.salesinsight.forecast.service;

import ge.salesinsight.common.exception.ValidationException;
import ge.salesinsight.forecast.model.GroupKey;
import ge.salesinsight.forecast.model.GroupingScheme;
import ge.salesinsight.forecast.model.MonthlyPoint;
import ge.salesinsight.forecast.model.MonthlySeries;
import ge.salesinsight.forecast.model.TransactionRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates the rows of one group into calendar-month quantity totals.
 */
@Component
public class MonthlyResampler {

    @Value("${forecast.min-monthly-points:10}")
    private int minMonthlyPoints;

    /**
     * Filter {@code records} to the rows of {@code key} and sum quantities per month.
     * The records may be the whole table or an already partitioned slice.
     *
     * @throws ValidationException if a matching row has no date
     */
    public MonthlySeries resample(GroupingScheme scheme, GroupKey key, List<TransactionRecord> records) {
        Map<YearMonth, BigDecimal> totals = new TreeMap<>();

        for (TransactionRecord record : records) {
            if (!key.equals(scheme.keyOf(record))) {
                continue;
            }
            if (record.getDate() == null) {
                throw new ValidationException("Date",
                        String.format("Row %d of group [%s] has no valid date", record.getRowNumber(), key.label()));
            }
            BigDecimal quantity = record.getQuantity() != null ? record.getQuantity() : BigDecimal.ZERO;
            totals.merge(YearMonth.from(record.getDate()), quantity, BigDecimal::add);
        }

        List<MonthlyPoint> points = new ArrayList<>(totals.size());
        totals.forEach((month, total) -> points.add(new MonthlyPoint(month, total)));
        return new MonthlySeries(key, points);
    }

    /**
     * Data-sufficiency gate: groups below the minimum number of monthly
     * observations are not forecasted and produce no output.
     */
    public boolean isSufficient(MonthlySeries series) {
        return series.size() >= minMonthlyPoints;
    }
}
