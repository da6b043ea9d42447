package ge.salesinsight.forecast.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One sales line of an uploaded dataset. Never mutated after loading.
 * {@code salesName} is null when the dataset has no salesperson column.
 */
@Value
@Builder
public class TransactionRecord {
    int rowNumber;
    LocalDate date;
    String salesName;
    String customerName;
    String itemName;
    BigDecimal quantity;
    BigDecimal amount;
    String currency;
    String city;
    String documentNumber;
}
