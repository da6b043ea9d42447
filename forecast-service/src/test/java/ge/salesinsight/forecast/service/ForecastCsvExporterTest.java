package ge.salesinsight.forecast.service;

import ge.salesinsight.common.dto.forecast.ForecastPointDto;
import ge.salesinsight.common.dto.forecast.ForecastType;
import ge.salesinsight.forecast.model.GroupingScheme;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ForecastCsvExporterTest {

    private final ForecastCsvExporter exporter = new ForecastCsvExporter();

    @TempDir
    Path tempDir;

    private final List<ForecastPointDto> rows = List.of(
            ForecastPointDto.builder()
                    .date(LocalDate.of(2024, 1, 31))
                    .salesName("Alice").customerName("Acme").itemName("Tea")
                    .type(ForecastType.ACTUAL)
                    .actualQuantity(new BigDecimal("12"))
                    .build(),
            ForecastPointDto.builder()
                    .date(LocalDate.of(2024, 2, 29))
                    .salesName("Alice").customerName("Acme").itemName("Tea")
                    .type(ForecastType.FORECAST)
                    .predictedQuantity(13.5).yhatLower(11.0).yhatUpper(16.0)
                    .build()
    );

    @Test
    void write_Triplet_ShouldIncludeSalesNameColumn() throws IOException {
        StringWriter out = new StringWriter();

        exporter.write(rows, GroupingScheme.TRIPLET, out);

        String[] lines = out.toString().split("\r\n");
        assertEquals("Date,Sales Name,Customer Name,Item Name,Type,Actual Quantity,Predicted Quantity,yhat_lower,yhat_upper",
                lines[0]);
        assertEquals("2024-01-31,Alice,Acme,Tea,Actual,12,,,", lines[1]);
        assertEquals("2024-02-29,Alice,Acme,Tea,Forecast,,13.5,11.0,16.0", lines[2]);
    }

    @Test
    void write_Pair_ShouldOmitSalesNameColumn() throws IOException {
        StringWriter out = new StringWriter();

        exporter.write(List.of(), GroupingScheme.PAIR, out);

        assertEquals("Date,Customer Name,Item Name,Type,Actual Quantity,Predicted Quantity,yhat_lower,yhat_upper",
                out.toString().trim());
    }

    @Test
    void write_ToPath_ShouldReplaceExistingFileWithoutLeftovers() throws IOException {
        Path target = tempDir.resolve("forecast_sales.xlsx.csv");
        Files.writeString(target, "stale");

        exporter.write(rows, GroupingScheme.TRIPLET, target);

        List<String> lines = Files.readAllLines(target);
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).startsWith("Date,Sales Name"));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(1, files.count());
        }
    }
}
