package ge.salesinsight.common.dto.forecast;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of a finished forecasting run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastResultDto {

    /**
     * Number of distinct group keys in the dataset.
     */
    private Integer totalGroups;

    /**
     * Groups that passed the data-sufficiency gate and were forecasted.
     */
    private Integer forecastedGroups;

    /**
     * Groups excluded for having too few monthly observations.
     */
    private Integer skippedGroups;

    /**
     * Rows written to the forecast result table.
     */
    private Integer rowCount;

    /**
     * Processing duration in milliseconds.
     */
    private Long durationMs;
}
