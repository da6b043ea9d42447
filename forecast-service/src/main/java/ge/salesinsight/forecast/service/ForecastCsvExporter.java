package ge.salesinsight.forecast.service;

import ge.salesinsight.common.dto.forecast.ForecastPointDto;
import ge.salesinsight.common.dto.forecast.ForecastType;
import ge.salesinsight.common.util.DateUtils;
import ge.salesinsight.forecast.model.GroupingScheme;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the forecast result table as CSV.
 *
 * Columns: Date, [Sales Name], Customer Name, Item Name, Type, Actual Quantity,
 * Predicted Quantity, yhat_lower, yhat_upper. Cells that do not apply to a row's
 * type are left empty.
 */
@Slf4j
@Component
public class ForecastCsvExporter {

    public List<String> headers(GroupingScheme scheme) {
        List<String> headers = new ArrayList<>();
        headers.add("Date");
        if (scheme == GroupingScheme.TRIPLET) {
            headers.add("Sales Name");
        }
        headers.add("Customer Name");
        headers.add("Item Name");
        headers.add("Type");
        headers.add("Actual Quantity");
        headers.add("Predicted Quantity");
        headers.add("yhat_lower");
        headers.add("yhat_upper");
        return headers;
    }

    public void write(List<ForecastPointDto> rows, GroupingScheme scheme, Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(headers(scheme).toArray(new String[0]))
                .build();

        try (CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (ForecastPointDto row : rows) {
                List<Object> record = new ArrayList<>();
                record.add(DateUtils.formatDate(row.getDate()));
                if (scheme == GroupingScheme.TRIPLET) {
                    record.add(row.getSalesName());
                }
                record.add(row.getCustomerName());
                record.add(row.getItemName());
                record.add(row.getType() != null ? row.getType().getLabel() : null);
                if (row.getType() == ForecastType.ACTUAL) {
                    record.add(row.getActualQuantity() != null ? row.getActualQuantity().toPlainString() : null);
                    record.add(null);
                    record.add(null);
                    record.add(null);
                } else {
                    record.add(null);
                    record.add(row.getPredictedQuantity());
                    record.add(row.getYhatLower());
                    record.add(row.getYhatUpper());
                }
                printer.printRecord(record);
            }
        }
    }

    /**
     * Write to {@code target} through a temporary file, so a reader never sees
     * a partially written result.
     */
    public void write(List<ForecastPointDto> rows, GroupingScheme scheme, Path target) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        Path temp = Files.createTempFile(target.toAbsolutePath().getParent(), "forecast", ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                write(rows, scheme, writer);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Wrote {} forecast rows to {}", rows.size(), target);
    }
}
