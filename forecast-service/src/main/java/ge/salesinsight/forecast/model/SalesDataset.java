package ge.salesinsight.forecast.model;

import lombok.Value;

import java.util.List;

/**
 * Loaded transaction table together with the grouping scheme its columns imply.
 */
@Value
public class SalesDataset {
    String datasetId;
    GroupingScheme scheme;
    List<TransactionRecord> records;
}
