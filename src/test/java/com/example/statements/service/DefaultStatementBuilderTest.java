package com.example.statements.service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.GroupMembership;
import com.example.statements.domain.Recipient;
import com.example.statements.domain.Recipient.Kind;
import com.example.statements.domain.TermsCode;
import com.example.statements.repository.GroupMembershipRepository;
import com.example.statements.service.DispatchOutcome.FailureKind;
import com.example.statements.service.InvoiceSourceService.InvoiceSnapshot;
import com.example.statements.service.RecipientException.Reason;
import com.example.statements.service.RecipientResolver.ResolutionIndex;
import com.example.statements.service.StatementMailer.MailRequest;
import com.example.statements.service.StatementMailer.MailResult;
import com.example.statements.service.StatementPdfRenderer.StatementDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DefaultStatementBuilder skip reasons, file output and mail composition.
 */
@ExtendWith(MockitoExtension.class)
class DefaultStatementBuilderTest {

    private static final LocalDate STATEMENT_DATE = LocalDate.of(2024, 3, 4);
    private static final byte[] PDF = {'%', 'P', 'D', 'F'};

    @Mock
    private RecipientResolver recipientResolver;

    @Mock
    private GroupMembershipRepository membershipRepository;

    @Mock
    private StatementPdfRenderer pdfRenderer;

    @Mock
    private StatementMailer mailer;

    @TempDir
    Path outputDir;

    private final Map<String, Recipient> customersByKey = new HashMap<>();
    private DefaultStatementBuilder builder;
    private Recipient acme;

    @BeforeEach
    void setUp() {
        StatementsProperties properties = new StatementsProperties();
        properties.setOutputDir(outputDir.toString());
        properties.getCompany().setName("Test Foods");

        InvoiceAggregator aggregator = new InvoiceAggregator(new AgingCalculator(), recipientResolver);
        builder = new DefaultStatementBuilder(recipientResolver, aggregator, membershipRepository,
            pdfRenderer, mailer, properties);

        acme = new Recipient("Acme Corp", Kind.SINGLE, "ap@acme.example, owner@acme.example", TermsCode.NET_30);
        acme.setId(1L);
        customersByKey.put("acme corp", acme);
    }

    @Test
    void dispatch_OpenInvoices_WritesPdfAndMailsAllAddresses() throws Exception {
        // Given
        givenIndex();
        when(pdfRenderer.render(any(StatementDocument.class))).thenReturn(PDF);
        when(mailer.send(any(MailRequest.class))).thenReturn(MailResult.sent());

        // When
        DispatchOutcome outcome = builder.dispatch(acme, snapshot(row("1001", "100", "0")), STATEMENT_DATE);

        // Then
        assertTrue(outcome.isSent());
        Path written = outputDir.resolve("Acme Corp_Statement_20240304.pdf");
        assertEquals(written.toAbsolutePath().toString(), outcome.outputPath());
        assertArrayEquals(PDF, Files.readAllBytes(written));

        ArgumentCaptor<MailRequest> captor = ArgumentCaptor.forClass(MailRequest.class);
        verify(mailer).send(captor.capture());
        MailRequest request = captor.getValue();
        assertEquals(List.of("ap@acme.example", "owner@acme.example"), request.to());
        assertEquals("Statement of Open Invoices 03/04/2024", request.subject());
        assertTrue(request.bodyText().endsWith("Test Foods"));
        assertEquals("Acme Corp_Statement_20240304.pdf", request.attachments().get(0).filename());
    }

    @Test
    void dispatch_MailFails_ReturnsFailureKindFromMailer() {
        // Given
        givenIndex();
        when(pdfRenderer.render(any(StatementDocument.class))).thenReturn(PDF);
        when(mailer.send(any(MailRequest.class)))
            .thenReturn(MailResult.failed(FailureKind.TRANSIENT, "Failed to send email: Read timed out"));

        // When
        DispatchOutcome outcome = builder.dispatch(acme, snapshot(row("1001", "100", "0")), STATEMENT_DATE);

        // Then
        assertTrue(outcome.isFailed());
        assertEquals(FailureKind.TRANSIENT, outcome.failureKind());
    }

    @Test
    void dispatch_NoRowsForRecipient_SkipsWithoutRendering() {
        // Given
        givenIndex();

        // When
        DispatchOutcome outcome = builder.dispatch(acme,
            snapshot(new InvoiceLineItem("Someone Else", "9", STATEMENT_DATE, BigDecimal.TEN, BigDecimal.ZERO, null)),
            STATEMENT_DATE);

        // Then
        assertTrue(outcome.isSkipped());
        assertEquals(Reason.NO_MATCHING_ROWS, outcome.skipReason());
        verifyNoInteractions(pdfRenderer, mailer);
    }

    @Test
    void dispatch_AllInvoicesPaid_SkipsNoOpenInvoices() {
        // Given
        givenIndex();

        // When
        DispatchOutcome outcome = builder.dispatch(acme, snapshot(row("1001", "100", "100")), STATEMENT_DATE);

        // Then
        assertEquals(Reason.NO_OPEN_INVOICES, outcome.skipReason());
        verifyNoInteractions(pdfRenderer, mailer);
    }

    @Test
    void dispatch_NoEmailOnFile_SkipsMissingEmail() {
        // Given
        Recipient noEmail = new Recipient("Acme Corp", Kind.SINGLE, "", TermsCode.NET_30);
        noEmail.setId(1L);
        customersByKey.put("acme corp", noEmail);
        givenIndex();

        // When
        DispatchOutcome outcome = builder.dispatch(noEmail, snapshot(row("1001", "100", "0")), STATEMENT_DATE);

        // Then
        assertEquals(Reason.MISSING_EMAIL, outcome.skipReason());
        verifyNoInteractions(mailer);
    }

    @Test
    void dispatch_GroupWithoutMembers_SkipsBeforeLookingAtInvoices() {
        // Given
        Recipient group = new Recipient("Acme Group", Kind.GROUP, "ap@acme.example", TermsCode.NET_30);
        group.setId(5L);
        when(membershipRepository.findByGroupId(5L)).thenReturn(List.<GroupMembership>of());

        // When
        DispatchOutcome outcome = builder.dispatch(group, snapshot(row("1001", "100", "0")), STATEMENT_DATE);

        // Then
        assertEquals(Reason.NO_GROUP_MEMBERS, outcome.skipReason());
        verifyNoInteractions(recipientResolver);
    }

    @Test
    void safeName_StripsUnsafeCharacters() {
        assertEquals("Acme Corp", DefaultStatementBuilder.safeName("Acme Corp."));
        assertEquals("Birch_Supply-2", DefaultStatementBuilder.safeName("Birch_Supply-2/"));
        assertEquals("recipient", DefaultStatementBuilder.safeName("***"));
        assertEquals("recipient", DefaultStatementBuilder.safeName(null));
    }

    // Helper methods

    private void givenIndex() {
        when(recipientResolver.buildIndex()).thenReturn(new ResolutionIndex(customersByKey, Map.of()));
    }

    private InvoiceSnapshot snapshot(InvoiceLineItem... rows) {
        return new InvoiceSnapshot("file:1", "invoices.csv", List.of(rows));
    }

    private InvoiceLineItem row(String orderId, String total, String paid) {
        return new InvoiceLineItem("Acme Corp", orderId, LocalDate.of(2024, 1, 2),
            new BigDecimal(total), new BigDecimal(paid), null);
    }
}
