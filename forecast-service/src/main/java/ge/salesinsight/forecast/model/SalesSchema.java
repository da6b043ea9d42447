package ge.salesinsight.forecast.model;

import lombok.Value;

import java.util.Map;

/**
 * Header information of an uploaded sheet: column positions and grouping scheme.
 */
@Value
public class SalesSchema {
    GroupingScheme scheme;
    Map<String, Integer> columnIndexes;
    int dataRowCount;
}
