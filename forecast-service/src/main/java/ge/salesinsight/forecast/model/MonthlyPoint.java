package ge.salesinsight.forecast.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

@Value
public class MonthlyPoint {
    YearMonth month;
    BigDecimal quantity;
}
