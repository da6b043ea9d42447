package ge.salesinsight.forecast.service;

import ge.salesinsight.common.exception.ForecastModelException;
import ge.salesinsight.forecast.model.MonthlySeries;
import ge.salesinsight.forecast.model.PredictedPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fits the forecasting model to one group's monthly series and extrapolates
 * the configured horizon. Negative point estimates are dropped: demand cannot
 * be negative.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastEngine {

    private final ForecastModel forecastModel;

    @Value("${forecast.horizon-months:12}")
    private int horizonMonths;

    /**
     * @throws ForecastModelException if the model cannot be fitted; any other
     *         runtime failure inside the model is wrapped with the group label
     */
    public List<PredictedPoint> forecast(MonthlySeries series) {
        List<PredictedPoint> predictions;
        try {
            predictions = forecastModel.fitAndPredict(series, horizonMonths);
        } catch (ForecastModelException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ForecastModelException(series.getKey().label(), e.getMessage(), e);
        }

        List<PredictedPoint> nonNegative = predictions.stream()
                .filter(p -> p.getYhat() >= 0)
                .toList();

        if (nonNegative.size() < predictions.size()) {
            log.debug("Dropped {} negative predictions for [{}]",
                    predictions.size() - nonNegative.size(), series.getKey().label());
        }
        return nonNegative;
    }
}
