package ge.salesinsight.common.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class QuantityUtilsTest {

    @Test
    void parseDecimal_ShouldTreatBlankAsZero() {
        assertEquals(BigDecimal.ZERO, QuantityUtils.parseDecimal(null));
        assertEquals(BigDecimal.ZERO, QuantityUtils.parseDecimal("  "));
    }

    @Test
    void parseDecimal_ShouldHandleNumbers() {
        assertEquals(0, new BigDecimal("10.5").compareTo(QuantityUtils.parseDecimal(10.5)));
        assertEquals(0, new BigDecimal("100").compareTo(QuantityUtils.parseDecimal(100)));
        assertNull(QuantityUtils.parseDecimal(Double.NaN));
    }

    @Test
    void parseDecimal_ShouldHandleStrings() {
        assertEquals(new BigDecimal("10.50"), QuantityUtils.parseDecimal("10.50"));
        assertEquals(new BigDecimal("10.50"), QuantityUtils.parseDecimal("10,50")); // Comma decimal
        assertEquals(new BigDecimal("1000.50"), QuantityUtils.parseDecimal("1,000.50"));
        assertEquals(new BigDecimal("1000"), QuantityUtils.parseDecimal("1 000"));
    }

    @Test
    void parseDecimal_ShouldRejectNonNumericText() {
        assertNull(QuantityUtils.parseDecimal("twelve"));
        assertNull(QuantityUtils.parseDecimal("12 boxes"));
    }

    @Test
    void round_ShouldUseHalfUp() {
        assertEquals(new BigDecimal("2.35"), QuantityUtils.round(new BigDecimal("2.345"), 2));
        assertEquals(BigDecimal.ZERO, QuantityUtils.round(null, 2));
    }
}
