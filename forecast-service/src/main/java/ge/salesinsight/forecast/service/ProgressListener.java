package ge.salesinsight.forecast.service;

/**
 * Receives a notification after each group of a forecasting run is processed.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (processed, total) -> { };

    void onGroupProcessed(int processed, int total);

    /**
     * Percentage of groups processed, rounded to the nearest integer.
     */
    static int percent(int processed, int total) {
        if (total <= 0) {
            return 100;
        }
        return (int) Math.round(processed * 100.0 / total);
    }
}
