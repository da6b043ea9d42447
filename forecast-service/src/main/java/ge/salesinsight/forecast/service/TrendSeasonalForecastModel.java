package ge.salesinsight.forecast.service;

import ge.salesinsight.common.exception.ForecastModelException;
import ge.salesinsight.forecast.model.MonthlyPoint;
import ge.salesinsight.forecast.model.MonthlySeries;
import ge.salesinsight.forecast.model.PredictedPoint;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Additive trend + yearly seasonality model.
 *
 * 1. Linear trend by least squares over the month index (gaps in the series keep
 *    their real distance).
 * 2. Yearly seasonality as the mean de-trended residual per calendar month,
 *    centred on zero; only used once the history spans enough months.
 * 3. Interval from the residual standard deviation, widening with the distance
 *    into the horizon.
 */
@Slf4j
@Component
public class TrendSeasonalForecastModel implements ForecastModel {

    private static final int MONTHS_PER_YEAR = 12;

    @Value("${forecast.interval-width:0.80}")
    private double intervalWidth;

    @Value("${forecast.seasonality.min-span-months:24}")
    private int seasonalityMinSpanMonths;

    @Override
    public String name() {
        return "trend-seasonal";
    }

    @Override
    public List<PredictedPoint> fitAndPredict(MonthlySeries series, int horizonMonths) {
        String label = series.getKey().label();
        List<MonthlyPoint> points = series.getPoints();
        int n = points.size();
        if (n < 2) {
            throw new ForecastModelException(label, "at least 2 monthly observations are required, got " + n);
        }
        if (intervalWidth <= 0 || intervalWidth >= 1) {
            throw new ForecastModelException(label, "interval width must be between 0 and 1, got " + intervalWidth);
        }

        YearMonth origin = series.firstMonth();
        double[] x = new double[n];
        double[] y = new double[n];
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            MonthlyPoint point = points.get(i);
            x[i] = monthIndex(origin, point.getMonth());
            y[i] = point.getQuantity().doubleValue();
            if (!Double.isFinite(y[i])) {
                throw new ForecastModelException(label, "non-finite quantity in " + point.getMonth());
            }
            regression.addData(x[i], y[i]);
        }

        double intercept = regression.getIntercept();
        double slope = regression.getSlope();
        if (!Double.isFinite(intercept) || !Double.isFinite(slope)) {
            throw new ForecastModelException(label, "trend regression is degenerate");
        }

        double[] seasonal = new double[MONTHS_PER_YEAR];
        int spanMonths = (int) x[n - 1] + 1;
        if (spanMonths >= seasonalityMinSpanMonths) {
            seasonal = seasonalIndexes(points, x, y, intercept, slope);
        }

        DescriptiveStatistics residuals = new DescriptiveStatistics();
        for (int i = 0; i < n; i++) {
            double fitted = intercept + slope * x[i] + seasonal[calendarIndex(points.get(i).getMonth())];
            residuals.addValue(y[i] - fitted);
        }
        double sigma = residuals.getStandardDeviation();
        if (!Double.isFinite(sigma)) {
            sigma = 0.0;
        }
        double z = new NormalDistribution().inverseCumulativeProbability(0.5 + intervalWidth / 2.0);

        List<PredictedPoint> predictions = new ArrayList<>(n + horizonMonths);
        for (MonthlyPoint point : points) {
            predictions.add(predict(origin, point.getMonth(), intercept, slope, seasonal, z * sigma));
        }
        YearMonth last = series.lastMonth();
        for (int h = 1; h <= horizonMonths; h++) {
            double band = z * sigma * Math.sqrt(1.0 + (double) h / n);
            predictions.add(predict(origin, last.plusMonths(h), intercept, slope, seasonal, band));
        }

        for (PredictedPoint prediction : predictions) {
            if (!Double.isFinite(prediction.getYhat())) {
                throw new ForecastModelException(label, "prediction for " + prediction.getMonth() + " is not finite");
            }
        }

        log.debug("Fitted {} for [{}]: slope={}, sigma={}, seasonal={}",
                name(), label, slope, sigma, spanMonths >= seasonalityMinSpanMonths);
        return predictions;
    }

    private PredictedPoint predict(YearMonth origin, YearMonth month, double intercept, double slope,
                                   double[] seasonal, double band) {
        double yhat = intercept + slope * monthIndex(origin, month) + seasonal[calendarIndex(month)];
        return new PredictedPoint(month, yhat, yhat - band, yhat + band);
    }

    private double[] seasonalIndexes(List<MonthlyPoint> points, double[] x, double[] y,
                                     double intercept, double slope) {
        double[] sums = new double[MONTHS_PER_YEAR];
        int[] counts = new int[MONTHS_PER_YEAR];
        for (int i = 0; i < points.size(); i++) {
            int m = calendarIndex(points.get(i).getMonth());
            sums[m] += y[i] - (intercept + slope * x[i]);
            counts[m]++;
        }

        double[] indexes = new double[MONTHS_PER_YEAR];
        double total = 0.0;
        int observed = 0;
        for (int m = 0; m < MONTHS_PER_YEAR; m++) {
            if (counts[m] > 0) {
                indexes[m] = sums[m] / counts[m];
                total += indexes[m];
                observed++;
            }
        }
        // Centre the observed months so seasonality does not shift the level
        double mean = observed > 0 ? total / observed : 0.0;
        for (int m = 0; m < MONTHS_PER_YEAR; m++) {
            if (counts[m] > 0) {
                indexes[m] -= mean;
            }
        }
        return indexes;
    }

    private static double monthIndex(YearMonth origin, YearMonth month) {
        return ChronoUnit.MONTHS.between(origin, month);
    }

    private static int calendarIndex(YearMonth month) {
        return month.getMonthValue() - 1;
    }
}
