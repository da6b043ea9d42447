package ge.salesinsight.forecast.service;

import ge.salesinsight.common.dto.forecast.ForecastPointDto;
import ge.salesinsight.forecast.model.ForecastRun;
import ge.salesinsight.forecast.model.GroupKey;
import ge.salesinsight.forecast.model.MonthlySeries;
import ge.salesinsight.forecast.model.PredictedPoint;
import ge.salesinsight.forecast.model.SalesDataset;
import ge.salesinsight.forecast.model.TransactionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Forecasting pipeline over one dataset.
 *
 * For each group key, in order:
 * 1. Resample the group's rows to monthly totals
 * 2. Skip the group if it has too few months
 * 3. Fit and extrapolate the model
 * 4. Merge Actual and Forecast rows into the accumulated result
 * 5. Notify the progress listener
 *
 * Groups are processed sequentially. Any failure aborts the run and the rows
 * merged so far are discarded with it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastPipeline {

    private final GroupExtractor groupExtractor;
    private final MonthlyResampler monthlyResampler;
    private final ForecastEngine forecastEngine;
    private final ForecastMerger forecastMerger;

    public ForecastRun run(SalesDataset dataset, ProgressListener progressListener) {
        Map<GroupKey, List<TransactionRecord>> partitions = groupExtractor.partition(dataset);
        List<GroupKey> keys = new ArrayList<>(partitions.keySet());
        int total = keys.size();

        log.info("[{}] Forecasting {} groups ({} grouping, {} rows)",
                dataset.getDatasetId(), total, dataset.getScheme(), dataset.getRecords().size());

        List<ForecastPointDto> rows = new ArrayList<>();
        int forecasted = 0;
        int skipped = 0;

        for (int i = 0; i < total; i++) {
            GroupKey key = keys.get(i);
            MonthlySeries series = monthlyResampler.resample(dataset.getScheme(), key, partitions.get(key));

            if (!monthlyResampler.isSufficient(series)) {
                skipped++;
                log.debug("[{}] Skipping [{}]: {} monthly points", dataset.getDatasetId(), key.label(), series.size());
            } else {
                List<PredictedPoint> predictions = forecastEngine.forecast(series);
                List<ForecastPointDto> merged = forecastMerger.merge(series, predictions);
                rows.addAll(merged);
                forecasted++;
                log.debug("[{}] Forecasted [{}]: {} rows", dataset.getDatasetId(), key.label(), merged.size());
            }

            progressListener.onGroupProcessed(i + 1, total);
        }

        log.info("[{}] Pipeline finished: {} forecasted, {} skipped, {} rows",
                dataset.getDatasetId(), forecasted, skipped, rows.size());
        return new ForecastRun(dataset.getScheme(), rows, total, forecasted, skipped);
    }
}
