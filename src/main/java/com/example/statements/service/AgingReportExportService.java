package com.example.statements.service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.AgingReportItem;
import com.example.statements.domain.AgingReportRun;
import com.example.statements.domain.TermsCode;

/** Exports a persisted aging report run to Excel. */
@Service
public class AgingReportExportService {

  private static final Logger log = LoggerFactory.getLogger(AgingReportExportService.class);

  static final String[] HEADERS = {
    "Group",
    "Terms",
    "Overdue Invoices",
    "Oldest Overdue Days",
    "Overdue Amount",
    "Skipped Invoices",
    "Short Paid Invoices",
    "Short Paid Amount"
  };

  private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;
  private static final DateTimeFormatter RUN_DATE =
      DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm").withZone(ZoneId.systemDefault());

  private final AgingReportService agingReportService;
  private final StatementsProperties properties;

  public AgingReportExportService(
      AgingReportService agingReportService, StatementsProperties properties) {
    this.agingReportService = agingReportService;
    this.properties = properties;
  }

  /** Download name for an exported run, e.g. {@code overdue_report_20240215.xlsx}. */
  public String filename(AgingReportRun run) {
    return "overdue_report_" + FILE_DATE.format(createdAt(run).atZone(ZoneId.systemDefault())) + ".xlsx";
  }

  public byte[] exportToExcel(Long runId) {
    AgingReportRun run =
        agingReportService
            .getRun(runId)
            .orElseThrow(() -> new IllegalArgumentException("Aging report run not found: " + runId));
    return exportToExcel(run, agingReportService.getItems(runId));
  }

  public byte[] exportToExcel(AgingReportRun run, List<AgingReportItem> items) {
    try (XSSFWorkbook workbook = new XSSFWorkbook();
        ByteArrayOutputStream baos = new ByteArrayOutputStream()) {

      Sheet sheet = workbook.createSheet("overdue_report");
      int rowNum = 0;

      // Styles
      CellStyle headerStyle = createHeaderStyle(workbook);
      CellStyle currencyStyle = createCurrencyStyle(workbook);
      CellStyle titleStyle = createTitleStyle(workbook);

      // Title
      Row titleRow = sheet.createRow(rowNum++);
      Cell titleCell = titleRow.createCell(0);
      titleCell.setCellValue(properties.getCompany().getName() + " - Overdue Report");
      titleCell.setCellStyle(titleStyle);
      sheet.addMergedRegion(new CellRangeAddress(0, 0, 0, HEADERS.length - 1));

      Row infoRow = sheet.createRow(rowNum++);
      infoRow.createCell(0).setCellValue("Run: " + RUN_DATE.format(createdAt(run)));
      if (run.getUnresolvedCount() > 0) {
        infoRow.createCell(3).setCellValue("Unmatched customer names: " + run.getUnresolvedCount());
      }

      rowNum++; // Empty row

      // Header row
      Row headerRow = sheet.createRow(rowNum++);
      for (int i = 0; i < HEADERS.length; i++) {
        Cell cell = headerRow.createCell(i);
        cell.setCellValue(HEADERS[i]);
        cell.setCellStyle(headerStyle);
      }

      // Data rows
      for (AgingReportItem item : items) {
        Row row = sheet.createRow(rowNum++);
        TermsCode terms = item.getTermsCode() != null ? item.getTermsCode() : TermsCode.DEFAULT;
        row.createCell(0).setCellValue(item.getRecipientName());
        row.createCell(1).setCellValue(terms.getLabel());
        row.createCell(2).setCellValue(item.getOverdueCount());
        row.createCell(3).setCellValue(item.getDaysOverdue());

        Cell overdueCell = row.createCell(4);
        overdueCell.setCellValue(item.getOverdueAmount().doubleValue());
        overdueCell.setCellStyle(currencyStyle);

        row.createCell(5).setCellValue(item.getSkippedCount());
        row.createCell(6).setCellValue(item.getShortPaidCount());

        Cell shortPaidCell = row.createCell(7);
        shortPaidCell.setCellValue(item.getShortPaidAmount().doubleValue());
        shortPaidCell.setCellStyle(currencyStyle);
      }

      for (int i = 0; i < HEADERS.length; i++) {
        sheet.setColumnWidth(i, i == 0 ? 36 * 256 : 20 * 256);
      }

      workbook.write(baos);
      log.info("Generated overdue report Excel for run {} ({} bytes)", run.getId(), baos.size());
      return baos.toByteArray();

    } catch (IOException e) {
      log.error("Failed to generate overdue report Excel", e);
      throw new IllegalStateException("Failed to generate overdue report Excel: " + e.getMessage(), e);
    }
  }

  private static Instant createdAt(AgingReportRun run) {
    return run.getCreatedAt() != null ? run.getCreatedAt() : Instant.now();
  }

  // ==================== STYLE HELPERS ====================

  private CellStyle createTitleStyle(Workbook workbook) {
    CellStyle style = workbook.createCellStyle();
    org.apache.poi.ss.usermodel.Font font = workbook.createFont();
    font.setBold(true);
    font.setFontHeightInPoints((short) 14);
    style.setFont(font);
    return style;
  }

  private CellStyle createHeaderStyle(Workbook workbook) {
    CellStyle style = workbook.createCellStyle();
    style.setFillForegroundColor(IndexedColors.DARK_BLUE.getIndex());
    style.setFillPattern(FillPatternType.SOLID_FOREGROUND);

    org.apache.poi.ss.usermodel.Font font = workbook.createFont();
    font.setBold(true);
    font.setColor(IndexedColors.WHITE.getIndex());
    style.setFont(font);

    style.setBorderBottom(BorderStyle.THIN);
    style.setBorderTop(BorderStyle.THIN);
    style.setBorderLeft(BorderStyle.THIN);
    style.setBorderRight(BorderStyle.THIN);
    return style;
  }

  private CellStyle createCurrencyStyle(Workbook workbook) {
    CellStyle style = workbook.createCellStyle();
    DataFormat format = workbook.createDataFormat();
    style.setDataFormat(format.getFormat("$#,##0.00"));
    return style;
  }
}
