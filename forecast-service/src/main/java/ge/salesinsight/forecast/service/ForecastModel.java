package ge.salesinsight.forecast.service;

import ge.salesinsight.common.exception.ForecastModelException;
import ge.salesinsight.forecast.model.MonthlySeries;
import ge.salesinsight.forecast.model.PredictedPoint;

import java.util.List;

/**
 * Monthly forecasting model fitted independently for every group.
 */
public interface ForecastModel {

    /**
     * Fit the model to {@code series} and predict every historical month plus
     * {@code horizonMonths} months after the last one, in month order.
     *
     * @throws ForecastModelException if the series cannot be fitted
     */
    List<PredictedPoint> fitAndPredict(MonthlySeries series, int horizonMonths);

    String name();
}
