package ge.salesinsight.forecast.service;

import ge.salesinsight.common.dto.forecast.ForecastPointDto;
import ge.salesinsight.common.dto.forecast.ForecastType;
import ge.salesinsight.common.util.DateUtils;
import ge.salesinsight.forecast.model.GroupKey;
import ge.salesinsight.forecast.model.MonthlyPoint;
import ge.salesinsight.forecast.model.MonthlySeries;
import ge.salesinsight.forecast.model.PredictedPoint;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds one timeline per group: every observed month as Actual, then the
 * model output for months after the last observed one as Forecast.
 * Dates are month ends.
 */
@Component
public class ForecastMerger {

    public List<ForecastPointDto> merge(MonthlySeries series, List<PredictedPoint> predictions) {
        GroupKey key = series.getKey();
        List<ForecastPointDto> rows = new ArrayList<>(series.size() + predictions.size());

        for (MonthlyPoint point : series.getPoints()) {
            rows.add(ForecastPointDto.builder()
                    .date(DateUtils.monthEnd(point.getMonth()))
                    .salesName(key.getSalesName())
                    .customerName(key.getCustomerName())
                    .itemName(key.getItemName())
                    .type(ForecastType.ACTUAL)
                    .actualQuantity(point.getQuantity())
                    .build());
        }

        YearMonth lastObserved = series.lastMonth();
        for (PredictedPoint prediction : predictions) {
            if (lastObserved != null && !prediction.getMonth().isAfter(lastObserved)) {
                continue;
            }
            rows.add(ForecastPointDto.builder()
                    .date(DateUtils.monthEnd(prediction.getMonth()))
                    .salesName(key.getSalesName())
                    .customerName(key.getCustomerName())
                    .itemName(key.getItemName())
                    .type(ForecastType.FORECAST)
                    .predictedQuantity(prediction.getYhat())
                    .yhatLower(prediction.getYhatLower())
                    .yhatUpper(prediction.getYhatUpper())
                    .build());
        }
        return rows;
    }
}
