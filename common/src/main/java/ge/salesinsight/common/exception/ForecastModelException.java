package ge.salesinsight.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when the forecasting model cannot be fitted to a group's series.
 */
public class ForecastModelException extends SalesInsightException {

    private final String groupLabel;

    public ForecastModelException(String groupLabel, String message) {
        super(
            String.format("Forecast model failed for group [%s]: %s", groupLabel, message),
            HttpStatus.UNPROCESSABLE_ENTITY,
            "SI_ERR_422"
        );
        this.groupLabel = groupLabel;
    }

    public ForecastModelException(String groupLabel, String message, Throwable cause) {
        super(
            String.format("Forecast model failed for group [%s]: %s", groupLabel, message),
            HttpStatus.UNPROCESSABLE_ENTITY,
            "SI_ERR_422",
            cause
        );
        this.groupLabel = groupLabel;
    }

    public String getGroupLabel() {
        return groupLabel;
    }
}
