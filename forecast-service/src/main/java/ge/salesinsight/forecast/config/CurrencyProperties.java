package ge.salesinsight.forecast.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exchange rates into the reporting currency, keyed by the values found in the
 * {@code Currency} column. Currencies without a rate are taken as-is.
 */
@Data
@ConfigurationProperties(prefix = "sales.currency")
public class CurrencyProperties {

    private Map<String, BigDecimal> rates = new LinkedHashMap<>();

    public BigDecimal rateFor(String currency) {
        if (currency == null) {
            return BigDecimal.ONE;
        }
        return rates.getOrDefault(currency.trim(), BigDecimal.ONE);
    }
}
