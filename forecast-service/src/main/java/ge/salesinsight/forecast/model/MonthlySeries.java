package ge.salesinsight.forecast.model;

import lombok.Value;

import java.time.YearMonth;
import java.util.List;

/**
 * Monthly quantity totals of one group, strictly increasing by month.
 * Only months with at least one transaction are present.
 */
@Value
public class MonthlySeries {
    GroupKey key;
    List<MonthlyPoint> points;

    public int size() {
        return points.size();
    }

    public YearMonth firstMonth() {
        return points.isEmpty() ? null : points.get(0).getMonth();
    }

    public YearMonth lastMonth() {
        return points.isEmpty() ? null : points.get(points.size() - 1).getMonth();
    }
}
