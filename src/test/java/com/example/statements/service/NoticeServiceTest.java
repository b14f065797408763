package com.example.statements.service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.AgingReportItem;
import com.example.statements.domain.AgingReportRun;
import com.example.statements.domain.AgingReportRun.ReportStatus;
import com.example.statements.domain.NoticeSend;
import com.example.statements.domain.NoticeSend.NoticeType;
import com.example.statements.domain.Recipient;
import com.example.statements.domain.Recipient.Kind;
import com.example.statements.domain.TermsCode;
import com.example.statements.repository.NoticeSendRepository;
import com.example.statements.repository.RecipientRepository;
import com.example.statements.service.DefaultStatementBuilder.PreparedStatement;
import com.example.statements.service.InvoiceSourceService.InvoiceSnapshot;
import com.example.statements.service.NoticeService.NoticeResult;
import com.example.statements.service.RecipientException.Reason;
import com.example.statements.service.StatementMailer.MailAttachment;
import com.example.statements.service.StatementMailer.MailRequest;
import com.example.statements.service.StatementMailer.MailResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for NoticeService follow-up notices.
 */
@ExtendWith(MockitoExtension.class)
class NoticeServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 4);
    private static final String REFERENCE = "file:3";

    @Mock
    private AgingReportService agingReportService;

    @Mock
    private NoticeSendRepository noticeSendRepository;

    @Mock
    private RecipientRepository recipientRepository;

    @Mock
    private InvoiceSourceService invoiceSourceService;

    @Mock
    private DefaultStatementBuilder statementBuilder;

    @Mock
    private StatementMailer mailer;

    private NoticeService noticeService;
    private AgingReportRun run;
    private Recipient acme;
    private InvoiceSnapshot snapshot;

    @BeforeEach
    void setUp() {
        StatementsProperties properties = new StatementsProperties();
        properties.getMail().setNoticeCc("collections@test.local");
        properties.getCompany().setName("Test Foods");

        noticeService = new NoticeService(agingReportService, noticeSendRepository, recipientRepository,
            invoiceSourceService, statementBuilder, mailer, properties,
            Clock.fixed(Instant.parse("2024-03-04T15:00:00Z"), ZoneOffset.UTC));

        run = new AgingReportRun(REFERENCE, ReportStatus.SUCCESS);
        run.setId(9L);

        acme = new Recipient("Acme Corp", Kind.SINGLE, "ap@acme.example", TermsCode.NET_30);
        acme.setId(1L);

        snapshot = new InvoiceSnapshot(REFERENCE, "invoices.csv", List.of());
    }

    @Test
    void sendNotice_Overdue_SendsStatementWithCcAndRecordsSend() {
        // Given
        givenLatestRunAndRecipient();
        givenStatementPrepared();
        when(mailer.send(any(MailRequest.class))).thenReturn(MailResult.sent());

        // When
        NoticeResult result = noticeService.sendNotice(1L, NoticeType.OVERDUE, null);

        // Then
        assertTrue(result.success());
        ArgumentCaptor<MailRequest> captor = ArgumentCaptor.forClass(MailRequest.class);
        verify(mailer).send(captor.capture());
        MailRequest request = captor.getValue();
        assertEquals("Overdue Notice 03/04/2024", request.subject());
        assertEquals(List.of("collections@test.local"), request.cc());
        assertEquals(1, request.attachments().size());

        ArgumentCaptor<NoticeSend> sendCaptor = ArgumentCaptor.forClass(NoticeSend.class);
        verify(noticeSendRepository).save(sendCaptor.capture());
        assertEquals(REFERENCE, sendCaptor.getValue().getInvoiceReference());
        assertEquals(NoticeType.OVERDUE, sendCaptor.getValue().getNoticeType());
    }

    @Test
    void sendNotice_AlreadySentForExport_DoesNotResend() {
        // Given
        givenLatestRunAndRecipient();
        when(noticeSendRepository.existsByInvoiceReferenceAndRecipientIdAndNoticeType(REFERENCE, 1L, NoticeType.OVERDUE))
            .thenReturn(true);

        // When
        NoticeResult result = noticeService.sendNotice(1L, NoticeType.OVERDUE, null);

        // Then
        assertFalse(result.success());
        assertEquals("ALREADY_SENT", result.status());
        verifyNoInteractions(mailer, statementBuilder);
    }

    @Test
    void sendNotice_SkippedWithMatchingCopies_AttachesCopiesWithoutCc() {
        // Given
        givenLatestRunAndRecipient();
        givenReportItem(2, 0);
        givenStatementPrepared();
        when(mailer.send(any(MailRequest.class))).thenReturn(MailResult.sent());
        List<MailAttachment> copies = List.of(
            MailAttachment.pdf("1001.pdf", new byte[] {1}),
            MailAttachment.pdf("1002.pdf", new byte[] {2}));

        // When
        NoticeResult result = noticeService.sendNotice(1L, NoticeType.SKIPPED, copies);

        // Then
        assertTrue(result.success());
        ArgumentCaptor<MailRequest> captor = ArgumentCaptor.forClass(MailRequest.class);
        verify(mailer).send(captor.capture());
        assertEquals("Skipped Invoice Notification 03/04/2024", captor.getValue().subject());
        assertTrue(captor.getValue().cc().isEmpty());
        assertEquals(3, captor.getValue().attachments().size());
    }

    @Test
    void sendNotice_ShortPaidCopyCountMismatch_Rejected() {
        // Given
        givenLatestRunAndRecipient();
        givenReportItem(0, 2);

        // When
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> noticeService.sendNotice(1L, NoticeType.SHORT_PAID,
                List.of(MailAttachment.pdf("1003.pdf", new byte[] {1}))));

        // Then
        assertTrue(ex.getMessage().contains("expected 2, got 1"));
        verifyNoInteractions(mailer);
    }

    @Test
    void sendNotice_EmptyCopy_Rejected() {
        // Given
        givenLatestRunAndRecipient();
        givenReportItem(1, 0);

        // When / Then
        assertThrows(IllegalArgumentException.class,
            () -> noticeService.sendNotice(1L, NoticeType.SKIPPED,
                List.of(MailAttachment.pdf("1001.pdf", new byte[0]))));
    }

    @Test
    void sendNotice_MailFails_NothingRecorded() {
        // Given
        givenLatestRunAndRecipient();
        givenStatementPrepared();
        when(mailer.send(any(MailRequest.class))).thenReturn(MailResult.disabled());

        // When
        NoticeResult result = noticeService.sendNotice(1L, NoticeType.OVERDUE, List.of());

        // Then
        assertEquals("FAILED", result.status());
        verify(noticeSendRepository, never()).save(any());
    }

    @Test
    void sendNotice_LatestReportFailed_Rejected() {
        // Given
        AgingReportRun failed = new AgingReportRun(null, ReportStatus.ERROR);
        when(agingReportService.getLatest()).thenReturn(Optional.of(failed));

        // When / Then
        assertThrows(IllegalStateException.class, () -> noticeService.sendNotice(1L, NoticeType.OVERDUE, null));
        verifyNoInteractions(recipientRepository, mailer);
    }

    @Test
    void sendNotice_UnknownRecipient_ThrowsNotFound() {
        // Given
        when(agingReportService.getLatest()).thenReturn(Optional.of(run));
        when(recipientRepository.findById(42L)).thenReturn(Optional.empty());

        // When
        RecipientException ex = assertThrows(RecipientException.class,
            () -> noticeService.sendNotice(42L, NoticeType.OVERDUE, null));

        // Then
        assertEquals(Reason.NOT_FOUND, ex.getReason());
    }

    // Helper methods

    private void givenLatestRunAndRecipient() {
        when(agingReportService.getLatest()).thenReturn(Optional.of(run));
        when(recipientRepository.findById(1L)).thenReturn(Optional.of(acme));
    }

    private void givenReportItem(int skipped, int shortPaid) {
        AgingReportItem item = new AgingReportItem(9L, 1L, "Acme Corp", TermsCode.NET_30);
        item.setSkippedCount(skipped);
        item.setShortPaidCount(shortPaid);
        when(agingReportService.getItem(9L, 1L)).thenReturn(Optional.of(item));
    }

    private void givenStatementPrepared() {
        when(invoiceSourceService.load(REFERENCE)).thenReturn(snapshot);
        when(statementBuilder.prepare(acme, snapshot, TODAY))
            .thenReturn(new PreparedStatement(null, new byte[] {9}, "Acme Corp_Statement_20240304.pdf"));
    }
}
