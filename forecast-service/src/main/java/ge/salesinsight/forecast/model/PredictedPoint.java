package ge.salesinsight.forecast.model;

import lombok.Value;

import java.time.YearMonth;

/**
 * Model output for one month: point estimate and uncertainty interval.
 */
@Value
public class PredictedPoint {
    YearMonth month;
    double yhat;
    double yhatLower;
    double yhatUpper;
}
