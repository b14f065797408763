package com.example.statements.service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.TermsCode;
import com.example.statements.service.AgingCalculator.AgingStatus;
import com.example.statements.service.InvoiceAggregator.AgedInvoice;
import com.example.statements.service.StatementPdfRenderer.StatementDocument;
import com.lowagie.text.pdf.PdfReader;
import com.lowagie.text.pdf.parser.PdfTextExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StatementPdfRenderer.
 */
class StatementPdfRendererTest {

    private StatementPdfRenderer renderer;

    @BeforeEach
    void setUp() {
        StatementsProperties properties = new StatementsProperties();
        properties.getCompany().setName("Test Foods");
        renderer = new StatementPdfRenderer(properties);
    }

    @Test
    void render_TwoLocations_ProducesPdfWithInvoicesAndTotals() throws Exception {
        // Given
        StatementDocument document = new StatementDocument("Acme Group", TermsCode.NET_30, LocalDate.of(2024, 3, 4),
            List.of(
                line("1001", "Downtown", "100.00", "0", AgingStatus.OVERDUE, 5),
                line("1002", "Harbor", "50.00", "20.00", AgingStatus.UNPAID, 0)));

        // When
        byte[] pdf = renderer.render(document);

        // Then
        assertEquals("%PDF", new String(pdf, 0, 4));
        PdfReader reader = new PdfReader(pdf);
        try {
            String text = new PdfTextExtractor(reader).getTextFromPage(1);
            assertTrue(text.contains("Test Foods"));
            assertTrue(text.contains("Acme Group"));
            assertTrue(text.contains("1001"));
            assertTrue(text.contains("Harbor"));
        } finally {
            reader.close();
        }
    }

    @Test
    void statementDocument_Totals() {
        StatementDocument document = new StatementDocument("Acme Corp", TermsCode.NET_30, LocalDate.of(2024, 3, 4),
            List.of(
                line("1001", null, "100.00", "0", AgingStatus.OVERDUE, 5),
                line("1002", null, "50.00", "20.00", AgingStatus.DUE_THIS_WEEK, 0)));

        assertEquals(0, new BigDecimal("130.00").compareTo(document.totalOutstanding()));
        assertEquals(0, new BigDecimal("100.00").compareTo(document.overdueOutstanding()));
    }

    private AgedInvoice line(String orderId, String location, String total, String paid, AgingStatus status,
                             int daysOverdue) {
        BigDecimal t = new BigDecimal(total);
        BigDecimal p = new BigDecimal(paid);
        return new AgedInvoice(orderId, LocalDate.of(2024, 1, 2), location, t, p, t.subtract(p),
            LocalDate.of(2024, 2, 1), status, daysOverdue);
    }
}
