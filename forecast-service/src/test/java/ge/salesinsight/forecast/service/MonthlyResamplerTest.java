package ge.salesinsight.forecast.service;

import ge.salesinsight.common.exception.ValidationException;
import ge.salesinsight.forecast.model.GroupKey;
import ge.salesinsight.forecast.model.GroupingScheme;
import ge.salesinsight.forecast.model.MonthlySeries;
import ge.salesinsight.forecast.model.TransactionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MonthlyResamplerTest {

    private static final GroupKey KEY = GroupKey.pair("Acme", "Tea");

    private MonthlyResampler resampler;

    @BeforeEach
    void setUp() {
        resampler = new MonthlyResampler();
        ReflectionTestUtils.setField(resampler, "minMonthlyPoints", 10);
    }

    @Test
    void resample_ShouldSumQuantitiesPerCalendarMonth() {
        List<TransactionRecord> records = List.of(
                record("Acme", LocalDate.of(2024, 1, 3), "2"),
                record("Acme", LocalDate.of(2024, 1, 28), "3.5"),
                record("Acme", LocalDate.of(2024, 3, 1), "1"),
                record("Other", LocalDate.of(2024, 2, 1), "100")
        );

        MonthlySeries series = resampler.resample(GroupingScheme.PAIR, KEY, records);

        assertEquals(2, series.size());
        assertEquals(YearMonth.of(2024, 1), series.firstMonth());
        assertEquals(0, new BigDecimal("5.5").compareTo(series.getPoints().get(0).getQuantity()));
        // Months without transactions are not filled in
        assertEquals(YearMonth.of(2024, 3), series.getPoints().get(1).getMonth());
    }

    @Test
    void isSufficient_NineMonths_ShouldBeExcluded() {
        MonthlySeries series = resampler.resample(GroupingScheme.PAIR, KEY, months(9));

        assertEquals(9, series.size());
        assertFalse(resampler.isSufficient(series));
    }

    @Test
    void isSufficient_TenMonths_ShouldBeIncluded() {
        MonthlySeries series = resampler.resample(GroupingScheme.PAIR, KEY, months(10));

        assertEquals(10, series.size());
        assertTrue(resampler.isSufficient(series));
    }

    @Test
    void resample_MissingDate_ShouldThrowValidationException() {
        List<TransactionRecord> records = List.of(record("Acme", null, "1"));

        ValidationException ex = assertThrows(ValidationException.class,
                () -> resampler.resample(GroupingScheme.PAIR, KEY, records));
        assertTrue(ex.getMessage().contains("Acme / Tea"));
    }

    private List<TransactionRecord> months(int count) {
        List<TransactionRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            LocalDate date = LocalDate.of(2023, 1, 10).plusMonths(i);
            records.add(record("Acme", date, "4"));
            records.add(record("Acme", date.plusDays(5), "1"));
        }
        return records;
    }

    private TransactionRecord record(String customer, LocalDate date, String quantity) {
        return TransactionRecord.builder()
                .rowNumber(2)
                .date(date)
                .customerName(customer)
                .itemName("Tea")
                .quantity(new BigDecimal(quantity))
                .build();
    }
}
