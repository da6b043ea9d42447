package ge.salesinsight.forecast.model;

import ge.salesinsight.common.dto.forecast.ForecastPointDto;
import lombok.Value;

import java.util.List;

/**
 * Output of one pipeline execution over a dataset.
 */
@Value
public class ForecastRun {
    GroupingScheme scheme;
    List<ForecastPointDto> rows;
    int totalGroups;
    int forecastedGroups;
    int skippedGroups;
}
