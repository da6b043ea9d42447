package ge.salesinsight.forecast.service;

import ge.salesinsight.common.dto.cohort.QuarterlyActivityDto;
import ge.salesinsight.common.exception.SalesInsightException;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Writes quarterly customer activity as an .xlsx workbook, one row per quarter
 * with comma-joined customer names.
 */
@Component
public class QuarterlyActivityExporter {

    public static final String SHEET_NAME = "Quarterly Customer Activity";

    public byte[] export(List<QuarterlyActivityDto> activity) {
        try (Workbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            Sheet sheet = workbook.createSheet(SHEET_NAME);
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("Quarter");
            header.createCell(1).setCellValue("Active Customers");
            header.createCell(2).setCellValue("Inactive Customers");

            int rowIndex = 1;
            for (QuarterlyActivityDto quarter : activity) {
                Row row = sheet.createRow(rowIndex++);
                row.createCell(0).setCellValue(quarter.getQuarter());
                row.createCell(1).setCellValue(String.join(", ", quarter.getActiveCustomers()));
                row.createCell(2).setCellValue(String.join(", ", quarter.getInactiveCustomers()));
            }

            workbook.write(out);
            return out.toByteArray();

        } catch (IOException e) {
            throw new SalesInsightException("Failed to build quarterly activity workbook", e);
        }
    }
}
