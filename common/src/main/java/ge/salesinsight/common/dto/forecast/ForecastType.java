package ge.salesinsight.common.dto.forecast;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a point in a merged forecast timeline.
 *
 * ACTUAL: monthly total observed in the uploaded data
 * FORECAST: model output for a month after the last observed month
 */
public enum ForecastType {
    ACTUAL("Actual"),
    FORECAST("Forecast");

    private final String label;

    ForecastType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
