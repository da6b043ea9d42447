package ge.salesinsight.forecast.service;

import ge.salesinsight.common.exception.ValidationException;
import ge.salesinsight.common.util.DateUtils;
import ge.salesinsight.common.util.QuantityUtils;
import ge.salesinsight.forecast.model.GroupingScheme;
import ge.salesinsight.forecast.model.SalesDataset;
import ge.salesinsight.forecast.model.SalesSchema;
import ge.salesinsight.forecast.model.TransactionRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.*;

/**
 * Reads sales spreadsheets into transaction records.
 *
 * Layout: first sheet, header in row 0, columns located by header name so their
 * order does not matter. {@code Sales Name} is optional and decides the grouping
 * scheme; every other column below is required.
 */
@Slf4j
@Service
public class SalesDataLoader {

    public static final String COL_DATE = "Date";
    public static final String COL_SALES_NAME = "Sales Name";
    public static final String COL_CUSTOMER_NAME = "Customer Name";
    public static final String COL_ITEM_NAME = "Item Name";
    public static final String COL_QUANTITY = "Quantity";
    public static final String COL_AMOUNT = "Amount";
    public static final String COL_CURRENCY = "Currency";
    public static final String COL_CITY = "City";
    public static final String COL_DOCUMENT_NUMBER = "Document Number";

    public static final List<String> REQUIRED_COLUMNS = List.of(
            COL_DATE, COL_CUSTOMER_NAME, COL_ITEM_NAME, COL_QUANTITY,
            COL_AMOUNT, COL_CURRENCY, COL_CITY, COL_DOCUMENT_NUMBER);

    /**
     * Read only the header row and resolve the grouping scheme.
     *
     * @throws ValidationException if the file cannot be read or required columns are missing
     */
    public SalesSchema inspectSchema(Path file) {
        try (Workbook workbook = openWorkbook(file)) {
            return readSchema(firstSheet(workbook, file));
        } catch (IOException e) {
            throw new ValidationException("file", "Failed to read spreadsheet: " + e.getMessage(), e);
        }
    }

    /**
     * Load every data row of the first sheet. Fully blank rows are ignored.
     *
     * @throws ValidationException on missing columns, unparseable dates or non-numeric quantities
     */
    public SalesDataset load(Path file) {
        String datasetId = file.getFileName().toString();
        long startTime = System.currentTimeMillis();

        try (Workbook workbook = openWorkbook(file)) {
            Sheet sheet = firstSheet(workbook, file);
            SalesSchema schema = readSchema(sheet);
            Map<String, Integer> columns = schema.getColumnIndexes();

            List<TransactionRecord> records = new ArrayList<>();
            for (int rowIndex = 1; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
                Row row = sheet.getRow(rowIndex);
                if (row == null || isBlankRow(row, columns.values())) {
                    continue;
                }
                records.add(toRecord(row, rowIndex + 1, columns, schema.getScheme()));
            }

            log.info("[{}] Loaded {} transactions ({} grouping) in {}ms",
                    datasetId, records.size(), schema.getScheme(), System.currentTimeMillis() - startTime);
            return new SalesDataset(datasetId, schema.getScheme(), Collections.unmodifiableList(records));

        } catch (IOException e) {
            throw new ValidationException("file", "Failed to read spreadsheet: " + e.getMessage(), e);
        }
    }

    // ==================== HELPER METHODS ====================

    private Workbook openWorkbook(Path file) throws IOException {
        try {
            return WorkbookFactory.create(file.toFile(), null, true);
        } catch (org.apache.poi.EmptyFileException | org.apache.poi.UnsupportedFileFormatException e) {
            throw new ValidationException("file", "Not a readable Excel file: " + e.getMessage(), e);
        }
    }

    private Sheet firstSheet(Workbook workbook, Path file) {
        if (workbook.getNumberOfSheets() == 0) {
            throw new ValidationException("file", "Workbook has no sheets: " + file.getFileName());
        }
        return workbook.getSheetAt(0);
    }

    private SalesSchema readSchema(Sheet sheet) {
        Row header = sheet.getRow(0);
        if (header == null) {
            throw new ValidationException("columns", "Header row is missing");
        }

        Map<String, Integer> columns = new LinkedHashMap<>();
        for (Cell cell : header) {
            String name = getCellAsString(cell);
            if (name != null && !name.isEmpty()) {
                columns.putIfAbsent(name, cell.getColumnIndex());
            }
        }

        List<String> missing = REQUIRED_COLUMNS.stream()
                .filter(column -> !columns.containsKey(column))
                .toList();
        if (!missing.isEmpty()) {
            throw new ValidationException("columns", "Missing required columns: " + String.join(", ", missing));
        }

        GroupingScheme scheme = GroupingScheme.forSalesNameColumn(columns.containsKey(COL_SALES_NAME));
        return new SalesSchema(scheme, Collections.unmodifiableMap(columns), sheet.getLastRowNum());
    }

    private TransactionRecord toRecord(Row row, int rowNumber, Map<String, Integer> columns, GroupingScheme scheme) {
        Object dateValue = getCellValue(row.getCell(columns.get(COL_DATE)));
        LocalDate date = DateUtils.parseDate(dateValue);
        if (date == null) {
            throw new ValidationException(COL_DATE,
                    String.format("Row %d has an unparseable date: '%s'", rowNumber, dateValue));
        }

        return TransactionRecord.builder()
                .rowNumber(rowNumber)
                .date(date)
                .salesName(scheme == GroupingScheme.TRIPLET ? stringAt(row, columns, COL_SALES_NAME) : null)
                .customerName(stringAt(row, columns, COL_CUSTOMER_NAME))
                .itemName(stringAt(row, columns, COL_ITEM_NAME))
                .quantity(decimalAt(row, columns, COL_QUANTITY, rowNumber))
                .amount(decimalAt(row, columns, COL_AMOUNT, rowNumber))
                .currency(stringAt(row, columns, COL_CURRENCY))
                .city(stringAt(row, columns, COL_CITY))
                .documentNumber(stringAt(row, columns, COL_DOCUMENT_NUMBER))
                .build();
    }

    private boolean isBlankRow(Row row, Collection<Integer> columnIndexes) {
        for (Integer index : columnIndexes) {
            String value = getCellAsString(row.getCell(index));
            if (value != null && !value.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private String stringAt(Row row, Map<String, Integer> columns, String column) {
        return getCellAsString(row.getCell(columns.get(column)));
    }

    private BigDecimal decimalAt(Row row, Map<String, Integer> columns, String column, int rowNumber) {
        Object value = getCellValue(row.getCell(columns.get(column)));
        BigDecimal parsed = QuantityUtils.parseDecimal(value);
        if (parsed == null) {
            throw new ValidationException(column,
                    String.format("Row %d has a non-numeric value: '%s'", rowNumber, value));
        }
        return parsed;
    }

    private Object getCellValue(Cell cell) {
        if (cell == null) return null;

        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();

        return switch (type) {
            case STRING -> cell.getStringCellValue();
            case NUMERIC -> {
                if (DateUtil.isCellDateFormatted(cell)) {
                    yield cell.getLocalDateTimeCellValue().toLocalDate();
                }
                yield cell.getNumericCellValue();
            }
            case BOOLEAN -> cell.getBooleanCellValue();
            default -> null;
        };
    }

    private String getCellAsString(Cell cell) {
        Object value = getCellValue(cell);
        if (value == null) return null;

        if (value instanceof Double) {
            // Numeric ids such as document numbers come back as doubles
            double d = (Double) value;
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return String.valueOf((long) d);
            }
        }

        return value.toString().trim();
    }
}
