package ge.salesinsight.forecast.model;

import lombok.Value;

import java.util.Comparator;

/**
 * Dimension values identifying one independent time series.
 * {@code salesName} is null for the pair grouping.
 */
@Value
public class GroupKey implements Comparable<GroupKey> {

    private static final Comparator<GroupKey> ORDER = Comparator
            .comparing(GroupKey::getSalesName, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(GroupKey::getCustomerName)
            .thenComparing(GroupKey::getItemName);

    String salesName;
    String customerName;
    String itemName;

    public static GroupKey triplet(String salesName, String customerName, String itemName) {
        return new GroupKey(salesName, customerName, itemName);
    }

    public static GroupKey pair(String customerName, String itemName) {
        return new GroupKey(null, customerName, itemName);
    }

    /**
     * Whether every dimension the key uses carries a value. Rows with blank
     * dimensions belong to no group.
     */
    public boolean isComplete() {
        return !isBlank(customerName) && !isBlank(itemName)
                && (salesName == null || !salesName.isBlank());
    }

    public String label() {
        return salesName == null
                ? customerName + " / " + itemName
                : salesName + " / " + customerName + " / " + itemName;
    }

    @Override
    public int compareTo(GroupKey other) {
        return ORDER.compare(this, other);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
