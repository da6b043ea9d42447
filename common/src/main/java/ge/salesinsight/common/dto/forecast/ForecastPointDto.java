package ge.salesinsight.common.dto.forecast;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One row of the forecast result table.
 *
 * Actual rows carry {@code actualQuantity}; Forecast rows carry the predicted
 * quantity and its interval. {@code salesName} is null for the pair grouping.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastPointDto {

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;

    private String salesName;
    private String customerName;
    private String itemName;
    private ForecastType type;

    private BigDecimal actualQuantity;
    private Double predictedQuantity;
    private Double yhatLower;
    private Double yhatUpper;
}
