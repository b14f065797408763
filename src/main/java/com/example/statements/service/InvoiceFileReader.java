package com.example.statements.service;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads invoice exports (CSV or Excel) into {@link InvoiceLineItem}s.
 *
 * <p>Required columns: Customer Name, Order ID, Order Total, Shipping Date. Optional: Paid
 * Amount, Location. Header matching ignores case, spaces, underscores and dashes. Amounts
 * that cannot be parsed count as zero; a ship date that cannot be parsed falls back to the
 * load date.
 */
@Service
public class InvoiceFileReader {

    private static final Logger log = LoggerFactory.getLogger(InvoiceFileReader.class);

    static final String CUSTOMER_NAME = "Customer Name";
    static final String ORDER_ID = "Order ID";
    static final String ORDER_TOTAL = "Order Total";
    static final String SHIPPING_DATE = "Shipping Date";
    static final String PAID_AMOUNT = "Paid Amount";
    static final String LOCATION = "Location";

    private static final List<String> REQUIRED = List.of(CUSTOMER_NAME, ORDER_ID, ORDER_TOTAL, SHIPPING_DATE);

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ofPattern("yyyy-MM-dd"),
        DateTimeFormatter.ofPattern("M/d/yyyy"),
        DateTimeFormatter.ofPattern("MM/dd/yyyy"),
        DateTimeFormatter.ofPattern("M/d/yy"),
        DateTimeFormatter.ofPattern("yyyy/MM/dd"),
        DateTimeFormatter.ofPattern("d-MMM-yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH));

    private final Clock clock;

    public InvoiceFileReader(Clock clock) {
        this.clock = clock;
    }

    /**
     * Reads a file, choosing the format from its extension.
     *
     * @throws InvoiceValidationException if the file is unreadable, of an unknown type or
     *                                    lacks required columns
     */
    public List<InvoiceLineItem> read(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        try (InputStream in = Files.newInputStream(path)) {
            if (name.endsWith(".csv")) {
                return readCsv(in);
            }
            if (name.endsWith(".xlsx") || name.endsWith(".xls")) {
                return readWorkbook(in);
            }
        } catch (IOException e) {
            throw new InvoiceValidationException("Could not read invoice file " + path + ": " + e.getMessage(), e);
        }
        throw new InvoiceValidationException("Unsupported invoice file type: " + path.getFileName());
    }

    public List<InvoiceLineItem> readCsv(InputStream csvStream) throws IOException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(csvStream, StandardCharsets.UTF_8))) {

            String headerLine = reader.readLine();
            if (headerLine == null || headerLine.isBlank()) {
                throw new InvoiceValidationException("Invoice file is empty or has no header");
            }
            if (headerLine.startsWith("\uFEFF")) {
                headerLine = headerLine.substring(1);
            }
            Map<String, Integer> columnMap = buildColumnMap(parseCsvLine(headerLine));
            requireColumns(columnMap);

            LocalDate loadDate = LocalDate.now(clock);
            List<InvoiceLineItem> items = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                String[] values = parseCsvLine(line);
                items.add(toLineItem(
                    getColumnValue(values, columnMap, CUSTOMER_NAME),
                    getColumnValue(values, columnMap, ORDER_ID),
                    parseAmount(getColumnValue(values, columnMap, ORDER_TOTAL)),
                    parseAmount(getColumnValue(values, columnMap, PAID_AMOUNT)),
                    parseDate(getColumnValue(values, columnMap, SHIPPING_DATE), loadDate),
                    getColumnValue(values, columnMap, LOCATION)));
            }
            log.debug("Read {} invoice rows from CSV", items.size());
            return items;
        }
    }

    /**
     * Reads the first sheet of an .xlsx or .xls workbook.
     */
    public List<InvoiceLineItem> readWorkbook(InputStream workbookStream) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(workbookStream)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new InvoiceValidationException("Invoice workbook has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row header = sheet.getRow(sheet.getFirstRowNum());
            if (header == null) {
                throw new InvoiceValidationException("Invoice file is empty or has no header");
            }

            DataFormatter formatter = new DataFormatter(Locale.US);
            String[] headers = new String[Math.max(header.getLastCellNum(), 0)];
            for (int i = 0; i < headers.length; i++) {
                Cell cell = header.getCell(i);
                headers[i] = cell == null ? "" : formatter.formatCellValue(cell);
            }
            Map<String, Integer> columnMap = buildColumnMap(headers);
            requireColumns(columnMap);

            LocalDate loadDate = LocalDate.now(clock);
            List<InvoiceLineItem> items = new ArrayList<>();
            for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null || isBlankRow(row, formatter)) {
                    continue;
                }
                items.add(toLineItem(
                    cellText(row, columnMap, CUSTOMER_NAME, formatter),
                    cellText(row, columnMap, ORDER_ID, formatter),
                    cellAmount(row, columnMap, ORDER_TOTAL, formatter),
                    cellAmount(row, columnMap, PAID_AMOUNT, formatter),
                    cellDate(row, columnMap, loadDate, formatter),
                    cellText(row, columnMap, LOCATION, formatter)));
            }
            log.debug("Read {} invoice rows from workbook", items.size());
            return items;
        }
    }

    // Helper methods

    private InvoiceLineItem toLineItem(String customer, String orderId, BigDecimal total, BigDecimal paid,
                                       LocalDate shipDate, String location) {
        return new InvoiceLineItem(
            customer == null ? "" : customer.trim(),
            normalizeOrderId(orderId),
            shipDate,
            total,
            paid,
            location == null || location.isBlank() ? null : location.trim());
    }

    private void requireColumns(Map<String, Integer> columnMap) {
        List<String> missing = REQUIRED.stream()
            .filter(column -> !columnMap.containsKey(columnKey(column)))
            .toList();
        if (!missing.isEmpty()) {
            throw new InvoiceValidationException(missing);
        }
    }

    private Map<String, Integer> buildColumnMap(String[] headers) {
        Map<String, Integer> map = new HashMap<>();
        for (int i = 0; i < headers.length; i++) {
            map.putIfAbsent(columnKey(headers[i]), i);
        }
        return map;
    }

    private static String columnKey(String header) {
        return header == null ? "" : header.toLowerCase(Locale.ROOT).trim()
            .replace(" ", "")
            .replace("_", "")
            .replace("-", "");
    }

    private String getColumnValue(String[] values, Map<String, Integer> columnMap, String column) {
        Integer index = columnMap.get(columnKey(column));
        if (index == null || index >= values.length) {
            return null;
        }
        String value = values[index];
        return value == null || value.isBlank() ? null : value.trim();
    }

    private String cellText(Row row, Map<String, Integer> columnMap, String column, DataFormatter formatter) {
        Integer index = columnMap.get(columnKey(column));
        if (index == null) {
            return null;
        }
        Cell cell = row.getCell(index);
        if (cell == null) {
            return null;
        }
        String value = formatter.formatCellValue(cell);
        return value.isBlank() ? null : value.trim();
    }

    private BigDecimal cellAmount(Row row, Map<String, Integer> columnMap, String column, DataFormatter formatter) {
        Integer index = columnMap.get(columnKey(column));
        Cell cell = index == null ? null : row.getCell(index);
        if (cell == null) {
            return BigDecimal.ZERO;
        }
        if (cell.getCellType() == CellType.NUMERIC
                || (cell.getCellType() == CellType.FORMULA && cell.getCachedFormulaResultType() == CellType.NUMERIC)) {
            return BigDecimal.valueOf(cell.getNumericCellValue());
        }
        return parseAmount(formatter.formatCellValue(cell));
    }

    private LocalDate cellDate(Row row, Map<String, Integer> columnMap, LocalDate loadDate, DataFormatter formatter) {
        Integer index = columnMap.get(columnKey(SHIPPING_DATE));
        Cell cell = index == null ? null : row.getCell(index);
        if (cell == null) {
            return loadDate;
        }
        if (cell.getCellType() == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
            return cell.getLocalDateTimeCellValue().toLocalDate();
        }
        return parseDate(formatter.formatCellValue(cell), loadDate);
    }

    private boolean isBlankRow(Row row, DataFormatter formatter) {
        for (Cell cell : row) {
            if (!formatter.formatCellValue(cell).isBlank()) {
                return false;
            }
        }
        return true;
    }

    LocalDate parseDate(String value, LocalDate fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String trimmed = value.trim();
        // Drop a time part ("2024-01-05 00:00:00", "2024-01-05T08:30")
        int cut = trimmed.indexOf('T') > 0 ? trimmed.indexOf('T') : trimmed.indexOf(' ');
        if (cut > 0 && Character.isDigit(trimmed.charAt(cut - 1))) {
            trimmed = trimmed.substring(0, cut);
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(trimmed, format);
            } catch (DateTimeParseException e) {
                log.trace("Ship date '{}' does not match {}", trimmed, format);
            }
        }
        log.warn("Could not parse ship date '{}', using {}", value, fallback);
        return fallback;
    }

    BigDecimal parseAmount(String value) {
        if (value == null || value.isBlank()) {
            return BigDecimal.ZERO;
        }
        String cleaned = value.replaceAll("[^0-9.\\-]", "").trim();
        if (cleaned.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    private static String normalizeOrderId(String orderId) {
        if (orderId == null) {
            return "";
        }
        String trimmed = orderId.trim();
        return trimmed.matches("\\d+\\.0+") ? trimmed.substring(0, trimmed.indexOf('.')) : trimmed;
    }

    /**
     * Parses a CSV line, handling quoted fields with commas.
     */
    static String[] parseCsvLine(String line) {
        List<String> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);

            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    // Escaped quote
                    current.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                values.add(current.toString().trim());
                current = new StringBuilder();
            } else {
                current.append(c);
            }
        }
        values.add(current.toString().trim());

        return values.toArray(new String[0]);
    }
}
