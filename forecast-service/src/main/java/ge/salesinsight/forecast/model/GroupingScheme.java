package ge.salesinsight.forecast.model;

/**
 * Grouping dimensionality of a dataset, chosen once from its columns.
 *
 * TRIPLET: salesperson, customer, item (dataset has a Sales Name column)
 * PAIR: customer, item
 */
public enum GroupingScheme {
    TRIPLET {
        @Override
        public GroupKey keyOf(TransactionRecord record) {
            // Blank salesperson cells become "" so the key reports itself incomplete
            String salesName = record.getSalesName() == null ? "" : record.getSalesName();
            return GroupKey.triplet(salesName, record.getCustomerName(), record.getItemName());
        }
    },
    PAIR {
        @Override
        public GroupKey keyOf(TransactionRecord record) {
            return GroupKey.pair(record.getCustomerName(), record.getItemName());
        }
    };

    public abstract GroupKey keyOf(TransactionRecord record);

    public static GroupingScheme forSalesNameColumn(boolean hasSalesName) {
        return hasSalesName ? TRIPLET : PAIR;
    }
}
