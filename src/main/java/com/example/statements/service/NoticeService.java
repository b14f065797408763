package com.example.statements.service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.AgingReportItem;
import com.example.statements.domain.AgingReportRun;
import com.example.statements.domain.NoticeSend;
import com.example.statements.domain.NoticeSend.NoticeType;
import com.example.statements.domain.Recipient;
import com.example.statements.repository.NoticeSendRepository;
import com.example.statements.repository.RecipientRepository;
import com.example.statements.service.DefaultStatementBuilder.PreparedStatement;
import com.example.statements.service.InvoiceSourceService.InvoiceSnapshot;
import com.example.statements.service.RecipientException.Reason;
import com.example.statements.service.StatementMailer.MailAttachment;
import com.example.statements.service.StatementMailer.MailRequest;
import com.example.statements.service.StatementMailer.MailResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Follow-up notices for findings of the latest aging report: overdue balances, skipped
 * invoices and short payments. Each notice carries the recipient's current statement and
 * goes out at most once per invoice export.
 */
@Service
public class NoticeService {

    private static final Logger log = LoggerFactory.getLogger(NoticeService.class);

    private static final DateTimeFormatter SUBJECT_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    private final AgingReportService agingReportService;
    private final NoticeSendRepository noticeSendRepository;
    private final RecipientRepository recipientRepository;
    private final InvoiceSourceService invoiceSourceService;
    private final DefaultStatementBuilder statementBuilder;
    private final StatementMailer mailer;
    private final StatementsProperties properties;
    private final Clock clock;

    public NoticeService(AgingReportService agingReportService,
                         NoticeSendRepository noticeSendRepository,
                         RecipientRepository recipientRepository,
                         InvoiceSourceService invoiceSourceService,
                         DefaultStatementBuilder statementBuilder,
                         StatementMailer mailer,
                         StatementsProperties properties,
                         Clock clock) {
        this.agingReportService = agingReportService;
        this.noticeSendRepository = noticeSendRepository;
        this.recipientRepository = recipientRepository;
        this.invoiceSourceService = invoiceSourceService;
        this.statementBuilder = statementBuilder;
        this.mailer = mailer;
        this.properties = properties;
        this.clock = clock;
    }

    /** Result of a notice send. */
    public record NoticeResult(boolean success, String status, String message) {
        public static NoticeResult sent(NoticeType type, String recipientName) {
            return new NoticeResult(true, "SENT", type + " notice sent to " + recipientName);
        }

        public static NoticeResult alreadySent(NoticeType type, String recipientName) {
            return new NoticeResult(false, "ALREADY_SENT",
                type + " notice was already sent to " + recipientName + " for this invoice export");
        }

        public static NoticeResult failed(String reason) {
            return new NoticeResult(false, "FAILED", reason);
        }
    }

    /**
     * Sends one notice against the latest aging report.
     *
     * @param invoiceCopies copies of the referenced invoices; skipped and short-paid notices
     *                      need exactly one per invoice listed on the report, overdue notices none
     * @throws RecipientException if the recipient is unknown or has no statement to send
     * @throws IllegalStateException if no successful aging report exists
     * @throws IllegalArgumentException if the invoice copies do not match the report
     */
    public NoticeResult sendNotice(Long recipientId, NoticeType type, List<MailAttachment> invoiceCopies) {
        AgingReportRun run = agingReportService.getLatest()
            .filter(AgingReportRun::isSuccess)
            .orElseThrow(() -> new IllegalStateException("No aging report available; run the report first"));
        Recipient recipient = recipientRepository.findById(recipientId)
            .orElseThrow(() -> new RecipientException(Reason.NOT_FOUND, "Recipient not found: " + recipientId));

        String reference = run.getInvoiceReference();
        if (noticeSendRepository.existsByInvoiceReferenceAndRecipientIdAndNoticeType(reference, recipientId, type)) {
            log.info("{} notice for {} already sent against {}", type, recipient.getName(), reference);
            return NoticeResult.alreadySent(type, recipient.getName());
        }

        List<MailAttachment> copies = invoiceCopies != null ? invoiceCopies : List.of();
        if (type != NoticeType.OVERDUE) {
            checkInvoiceCopies(run, recipient, type, copies);
        }

        InvoiceSnapshot snapshot = reference != null
            ? invoiceSourceService.load(reference)
            : invoiceSourceService.loadCurrent();
        LocalDate today = LocalDate.now(clock);
        PreparedStatement statement = statementBuilder.prepare(recipient, snapshot, today);

        List<MailAttachment> attachments = new ArrayList<>();
        attachments.add(MailAttachment.pdf(statement.filename(), statement.pdf()));
        attachments.addAll(copies);

        MailRequest.Builder request = MailRequest.builder()
            .to(recipient.getEmailAddresses())
            .subject(subject(type, today))
            .bodyText(body(type))
            .attachments(attachments);
        if (type == NoticeType.OVERDUE) {
            request.cc(properties.getMail().getNoticeCc());
        }

        MailResult result = mailer.send(request.build());
        if (!result.success()) {
            log.warn("{} notice to {} failed: {}", type, recipient.getName(), result.message());
            return NoticeResult.failed(result.message());
        }

        noticeSendRepository.save(new NoticeSend(run.getId(), reference, recipientId, type));
        log.info("{} notice sent to {}", type, recipient.getName());
        return NoticeResult.sent(type, recipient.getName());
    }

    /**
     * Notices already sent against an invoice export.
     */
    @Transactional(readOnly = true)
    public List<NoticeSend> noticesSent(String invoiceReference) {
        return noticeSendRepository.findByInvoiceReference(invoiceReference);
    }

    // Helper methods

    private void checkInvoiceCopies(AgingReportRun run, Recipient recipient, NoticeType type,
                                    List<MailAttachment> copies) {
        AgingReportItem item = agingReportService.getItem(run.getId(), recipient.getId())
            .orElseThrow(() -> new IllegalArgumentException(
                "Latest aging report has no findings for " + recipient.getName()));
        int expected = type == NoticeType.SKIPPED ? item.getSkippedCount() : item.getShortPaidCount();
        if (expected == 0) {
            throw new IllegalArgumentException("No " + describe(type) + " invoices reported for "
                + recipient.getName());
        }
        if (copies.size() != expected) {
            throw new IllegalArgumentException("Please attach one PDF for each " + describe(type)
                + " invoice: expected " + expected + ", got " + copies.size());
        }
        for (MailAttachment copy : copies) {
            if (copy.content() == null || copy.content().length == 0) {
                throw new IllegalArgumentException("One or more attached invoice copies were empty");
            }
        }
    }

    private static String describe(NoticeType type) {
        return type == NoticeType.SKIPPED ? "skipped" : "short-paid";
    }

    private String subject(NoticeType type, LocalDate today) {
        String date = today.format(SUBJECT_DATE);
        return switch (type) {
            case OVERDUE -> "Overdue Notice " + date;
            case SKIPPED -> "Skipped Invoice Notification " + date;
            case SHORT_PAID -> "Partial Payment Notification " + date;
        };
    }

    private String body(NoticeType type) {
        String company = properties.getCompany().getName();
        return switch (type) {
            case OVERDUE -> "Good afternoon Team,\n\n"
                + "Attached please find the most recent statement of open invoices. "
                + "Please update us on the status of payments for all highlighted invoices.\n\n"
                + "Let me know if you have any questions or need additional information.\n\n"
                + "Kind regards,\n" + company;
            case SKIPPED -> "Dear Customer,\n\n"
                + "It seems that one or more invoices have been skipped with your last payment. "
                + "Attached please find the copies of the invoices along with a most recent statement "
                + "for the account.\n\n"
                + "Please let us know if you have any questions.\n\n"
                + "Kind regards,\n" + company;
            case SHORT_PAID -> "Dear Customer,\n\n"
                + "Attached is a copy of the invoice that appears to have been partially paid. "
                + "Could you please double check your records. Thanks in advance!\n\n"
                + "Kind regards,\n" + company;
        };
    }
}
