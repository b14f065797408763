package com.example.statements.service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.TermsCode;
import com.example.statements.service.InvoiceAggregator.AgedInvoice;
import com.lowagie.text.*;
import com.lowagie.text.pdf.PdfPCell;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.text.NumberFormat;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders statements of open invoices as PDF.
 */
@Service
public class StatementPdfRenderer {

    private static final Logger log = LoggerFactory.getLogger(StatementPdfRenderer.class);

    // Fonts
    private static final Font TITLE_FONT = new Font(Font.HELVETICA, 20, Font.BOLD, new Color(52, 73, 94));
    private static final Font HEADING_FONT = new Font(Font.HELVETICA, 12, Font.BOLD);
    private static final Font NORMAL_FONT = new Font(Font.HELVETICA, 10, Font.NORMAL);
    private static final Font BOLD_FONT = new Font(Font.HELVETICA, 10, Font.BOLD);
    private static final Font SMALL_FONT = new Font(Font.HELVETICA, 8, Font.NORMAL);
    private static final Font SMALL_BOLD_FONT = new Font(Font.HELVETICA, 8, Font.BOLD);
    private static final Font TABLE_HEADER_FONT = new Font(Font.HELVETICA, 9, Font.BOLD, Color.WHITE);
    private static final Font TABLE_CELL_FONT = new Font(Font.HELVETICA, 9, Font.NORMAL);
    private static final Font LARGE_BOLD_FONT = new Font(Font.HELVETICA, 14, Font.BOLD);

    // Colors
    private static final Color PRIMARY_COLOR = new Color(52, 73, 94);
    private static final Color ACCENT_COLOR = new Color(41, 128, 185);
    private static final Color ALT_ROW_BG = new Color(245, 247, 249);
    private static final Color LIGHT_BLUE_BG = new Color(235, 245, 251);
    private static final Color OVERDUE_BG = new Color(253, 237, 236);
    private static final Color WARNING_COLOR = new Color(231, 76, 60);

    private final StatementsProperties properties;
    private final NumberFormat currencyFormat = NumberFormat.getCurrencyInstance(Locale.US);
    private final DateTimeFormatter dateFormatter = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    public StatementPdfRenderer(StatementsProperties properties) {
        this.properties = properties;
    }

    /**
     * Content of one statement.
     *
     * @param accountName recipient display name
     * @param lines open invoices, grouped by location in display order
     */
    public record StatementDocument(
        String accountName,
        TermsCode termsCode,
        LocalDate statementDate,
        List<AgedInvoice> lines
    ) {
        public BigDecimal totalOutstanding() {
            return lines.stream().map(AgedInvoice::outstanding).reduce(BigDecimal.ZERO, BigDecimal::add);
        }

        public BigDecimal overdueOutstanding() {
            return lines.stream().filter(AgedInvoice::isOverdue)
                .map(AgedInvoice::outstanding).reduce(BigDecimal.ZERO, BigDecimal::add);
        }
    }

    public byte[] render(StatementDocument statement) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            Document document = new Document(PageSize.A4, 40, 40, 40, 40);
            PdfWriter.getInstance(document, baos);
            document.open();

            addHeader(document, statement);
            addAccountInfo(document, statement);
            addInvoiceTables(document, statement);
            addSummary(document, statement);

            document.close();

            log.debug("Rendered statement PDF for {}: {} bytes", statement.accountName(), baos.size());
            return baos.toByteArray();

        } catch (Exception e) {
            log.error("Failed to render statement PDF for {}", statement.accountName(), e);
            throw new IllegalStateException("Failed to render statement PDF: " + e.getMessage(), e);
        }
    }

    private void addHeader(Document document, StatementDocument statement) throws DocumentException {
        StatementsProperties.Company company = properties.getCompany();

        PdfPTable headerTable = new PdfPTable(2);
        headerTable.setWidthPercentage(100);
        headerTable.setWidths(new float[]{60, 40});
        headerTable.setSpacingAfter(20);

        PdfPCell companyCell = new PdfPCell();
        companyCell.setBorder(Rectangle.NO_BORDER);
        companyCell.addElement(new Paragraph(company.getName(), LARGE_BOLD_FONT));
        if (company.getSubtitle() != null && !company.getSubtitle().isBlank()) {
            Paragraph subtitle = new Paragraph(company.getSubtitle(), SMALL_BOLD_FONT);
            subtitle.setSpacingBefore(5);
            companyCell.addElement(subtitle);
        }
        for (String contact : new String[]{company.getAddress(), company.getPhone(), company.getEmail()}) {
            if (contact != null && !contact.isBlank()) {
                companyCell.addElement(new Paragraph(contact, SMALL_FONT));
            }
        }
        headerTable.addCell(companyCell);

        PdfPCell titleCell = new PdfPCell();
        titleCell.setBorder(Rectangle.NO_BORDER);
        titleCell.setHorizontalAlignment(Element.ALIGN_RIGHT);

        Paragraph title = new Paragraph("STATEMENT", TITLE_FONT);
        title.setAlignment(Element.ALIGN_RIGHT);
        titleCell.addElement(title);

        Paragraph dateInfo = new Paragraph("As of " + statement.statementDate().format(dateFormatter), NORMAL_FONT);
        dateInfo.setAlignment(Element.ALIGN_RIGHT);
        titleCell.addElement(dateInfo);

        headerTable.addCell(titleCell);
        document.add(headerTable);
    }

    private void addAccountInfo(Document document, StatementDocument statement) throws DocumentException {
        PdfPTable table = new PdfPTable(1);
        table.setWidthPercentage(50);
        table.setHorizontalAlignment(Element.ALIGN_LEFT);
        table.setSpacingAfter(20);

        PdfPCell cell = new PdfPCell();
        cell.setBackgroundColor(LIGHT_BLUE_BG);
        cell.setPadding(10);
        cell.setBorderColor(ACCENT_COLOR);

        cell.addElement(new Paragraph(statement.accountName(), BOLD_FONT));
        TermsCode terms = statement.termsCode() != null ? statement.termsCode() : TermsCode.DEFAULT;
        cell.addElement(new Paragraph("Terms: " + terms.getLabel(), SMALL_FONT));

        table.addCell(cell);
        document.add(table);
    }

    private void addInvoiceTables(Document document, StatementDocument statement) throws DocumentException {
        Map<String, List<AgedInvoice>> byLocation = new LinkedHashMap<>();
        for (AgedInvoice line : statement.lines()) {
            byLocation.computeIfAbsent(line.location(), l -> new java.util.ArrayList<>()).add(line);
        }
        boolean showLocations = byLocation.size() > 1;

        for (Map.Entry<String, List<AgedInvoice>> entry : byLocation.entrySet()) {
            if (showLocations) {
                Paragraph heading = new Paragraph("Location: " + entry.getKey(), HEADING_FONT);
                heading.setSpacingAfter(8);
                document.add(heading);
            }
            document.add(buildInvoiceTable(entry.getValue()));
        }
    }

    private PdfPTable buildInvoiceTable(List<AgedInvoice> lines) throws DocumentException {
        PdfPTable table = new PdfPTable(6);
        table.setWidthPercentage(100);
        table.setWidths(new float[]{16, 15, 15, 18, 18, 18});
        table.setSpacingAfter(16);

        addTableHeader(table, "Invoice #");
        addTableHeader(table, "Ship Date");
        addTableHeader(table, "Due Date");
        addTableHeader(table, "Total");
        addTableHeader(table, "Paid Amount");
        addTableHeader(table, "Status");

        boolean alternate = false;
        for (AgedInvoice line : lines) {
            Color bgColor = line.isOverdue() ? OVERDUE_BG : (alternate ? ALT_ROW_BG : Color.WHITE);
            alternate = !alternate;

            addTableCell(table, line.orderId(), bgColor, Element.ALIGN_LEFT, TABLE_CELL_FONT);
            addTableCell(table, line.shipDate().format(dateFormatter), bgColor, Element.ALIGN_CENTER, TABLE_CELL_FONT);
            addTableCell(table, line.dueDate().format(dateFormatter), bgColor, Element.ALIGN_CENTER, TABLE_CELL_FONT);
            addTableCell(table, formatCurrency(line.total()), bgColor, Element.ALIGN_RIGHT, TABLE_CELL_FONT);
            addTableCell(table, formatCurrency(line.paid()), bgColor, Element.ALIGN_RIGHT, TABLE_CELL_FONT);

            Font statusFont = line.isOverdue()
                ? new Font(Font.HELVETICA, 9, Font.BOLD, WARNING_COLOR)
                : TABLE_CELL_FONT;
            addTableCell(table, line.status().getLabel(), bgColor, Element.ALIGN_CENTER, statusFont);
        }

        BigDecimal subtotal = lines.stream().map(AgedInvoice::outstanding).reduce(BigDecimal.ZERO, BigDecimal::add);
        PdfPCell label = new PdfPCell(new Phrase("Outstanding", BOLD_FONT));
        label.setColspan(5);
        label.setHorizontalAlignment(Element.ALIGN_RIGHT);
        label.setPadding(6);
        table.addCell(label);
        addTableCell(table, formatCurrency(subtotal), LIGHT_BLUE_BG, Element.ALIGN_RIGHT, BOLD_FONT);
        return table;
    }

    private void addSummary(Document document, StatementDocument statement) throws DocumentException {
        PdfPTable table = new PdfPTable(2);
        table.setWidthPercentage(50);
        table.setHorizontalAlignment(Element.ALIGN_RIGHT);
        table.setSpacingBefore(10);

        addSummaryRow(table, "Overdue", statement.overdueOutstanding(), true);
        addSummaryRow(table, "Total Outstanding", statement.totalOutstanding(), false);
        document.add(table);
    }

    private void addSummaryRow(PdfPTable table, String label, BigDecimal amount, boolean warning) {
        PdfPCell labelCell = new PdfPCell(new Phrase(label, BOLD_FONT));
        labelCell.setBackgroundColor(PRIMARY_COLOR);
        labelCell.setPadding(8);
        labelCell.setPhrase(new Phrase(label, TABLE_HEADER_FONT));
        table.addCell(labelCell);

        Font font = warning && amount.signum() > 0
            ? new Font(Font.HELVETICA, 11, Font.BOLD, WARNING_COLOR)
            : new Font(Font.HELVETICA, 11, Font.BOLD);
        PdfPCell valueCell = new PdfPCell(new Phrase(formatCurrency(amount), font));
        valueCell.setHorizontalAlignment(Element.ALIGN_RIGHT);
        valueCell.setBackgroundColor(LIGHT_BLUE_BG);
        valueCell.setPadding(8);
        table.addCell(valueCell);
    }

    private void addTableHeader(PdfPTable table, String text) {
        PdfPCell cell = new PdfPCell(new Phrase(text, TABLE_HEADER_FONT));
        cell.setBackgroundColor(PRIMARY_COLOR);
        cell.setHorizontalAlignment(Element.ALIGN_CENTER);
        cell.setPadding(6);
        table.addCell(cell);
    }

    private void addTableCell(PdfPTable table, String text, Color bgColor, int alignment, Font font) {
        PdfPCell cell = new PdfPCell(new Phrase(text != null ? text : "", font));
        cell.setBackgroundColor(bgColor);
        cell.setPadding(6);
        cell.setHorizontalAlignment(alignment);
        cell.setBorderColor(Color.LIGHT_GRAY);
        table.addCell(cell);
    }

    private String formatCurrency(BigDecimal amount) {
        if (amount == null) {
            return currencyFormat.format(0);
        }
        return currencyFormat.format(amount);
    }
}
