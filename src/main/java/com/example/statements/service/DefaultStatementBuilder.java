package com.example.statements.service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.Recipient;
import com.example.statements.repository.GroupMembershipRepository;
import com.example.statements.service.InvoiceAggregator.AgedInvoice;
import com.example.statements.service.InvoiceSourceService.InvoiceSnapshot;
import com.example.statements.service.RecipientException.Reason;
import com.example.statements.service.RecipientResolver.ResolutionIndex;
import com.example.statements.service.StatementMailer.MailAttachment;
import com.example.statements.service.StatementMailer.MailRequest;
import com.example.statements.service.StatementMailer.MailResult;
import com.example.statements.service.StatementPdfRenderer.StatementDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Builds a statement PDF for one recipient, writes it to the output directory and emails it.
 */
@Service
public class DefaultStatementBuilder implements StatementBuilder {

    private static final Logger log = LoggerFactory.getLogger(DefaultStatementBuilder.class);

    private static final DateTimeFormatter SUBJECT_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy");
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final RecipientResolver recipientResolver;
    private final InvoiceAggregator invoiceAggregator;
    private final GroupMembershipRepository membershipRepository;
    private final StatementPdfRenderer pdfRenderer;
    private final StatementMailer mailer;
    private final StatementsProperties properties;

    public DefaultStatementBuilder(RecipientResolver recipientResolver,
                                   InvoiceAggregator invoiceAggregator,
                                   GroupMembershipRepository membershipRepository,
                                   StatementPdfRenderer pdfRenderer,
                                   StatementMailer mailer,
                                   StatementsProperties properties) {
        this.recipientResolver = recipientResolver;
        this.invoiceAggregator = invoiceAggregator;
        this.membershipRepository = membershipRepository;
        this.pdfRenderer = pdfRenderer;
        this.mailer = mailer;
        this.properties = properties;
    }

    /**
     * A rendered statement ready to send.
     */
    public record PreparedStatement(StatementDocument document, byte[] pdf, String filename) {}

    @Override
    public DispatchOutcome dispatch(Recipient recipient, InvoiceSnapshot snapshot, LocalDate statementDate) {
        PreparedStatement statement;
        try {
            statement = prepare(recipient, snapshot, statementDate);
        } catch (RecipientException e) {
            log.info("Skipping statement for {}: {}", recipient.getName(), e.getMessage());
            return DispatchOutcome.skipped(e.getReason(), e.getMessage());
        }

        Path output;
        try {
            output = writeOutput(statement);
        } catch (IOException e) {
            log.error("Could not write statement for {}", recipient.getName(), e);
            return DispatchOutcome.failed(DispatchOutcome.FailureKind.PERMANENT,
                "Could not write statement file: " + e.getMessage());
        }

        MailRequest request = MailRequest.builder()
            .to(recipient.getEmailAddresses())
            .subject("Statement of Open Invoices " + statementDate.format(SUBJECT_DATE))
            .bodyText(statementBody())
            .attachments(List.of(MailAttachment.pdf(statement.filename(), statement.pdf())))
            .build();

        MailResult result = mailer.send(request);
        if (!result.success()) {
            return DispatchOutcome.failed(result.failureKind(), result.message());
        }
        log.info("Statement sent to {} ({} open invoices)", recipient.getName(),
            statement.document().lines().size());
        return DispatchOutcome.sent(output.toString());
    }

    /**
     * Renders the statement of one recipient.
     *
     * @throws RecipientException if the recipient has nothing deliverable
     */
    public PreparedStatement prepare(Recipient recipient, InvoiceSnapshot snapshot, LocalDate statementDate) {
        if (recipient.isGroup() && membershipRepository.findByGroupId(recipient.getId()).isEmpty()) {
            throw new RecipientException(Reason.NO_GROUP_MEMBERS,
                "Group " + recipient.getName() + " has no members");
        }

        ResolutionIndex index = recipientResolver.buildIndex();
        List<InvoiceLineItem> rows = invoiceAggregator.rowsFor(recipient, snapshot.rows(), index);
        if (rows.isEmpty()) {
            throw new RecipientException(Reason.NO_MATCHING_ROWS,
                "No invoices in " + snapshot.filename() + " match " + recipient.getName());
        }

        List<AgedInvoice> lines = invoiceAggregator.openInvoices(recipient, rows, index, statementDate);
        if (lines.isEmpty()) {
            throw new RecipientException(Reason.NO_OPEN_INVOICES, Reason.NO_OPEN_INVOICES.getDescription());
        }

        if (!recipient.hasEmail()) {
            throw new RecipientException(Reason.MISSING_EMAIL,
                "No email address on file for " + recipient.getName());
        }

        StatementDocument document = new StatementDocument(
            recipient.getName(), recipient.getTermsCode(), statementDate, lines);
        byte[] pdf = pdfRenderer.render(document);
        String filename = safeName(recipient.getName()) + "_Statement_" + statementDate.format(FILE_DATE) + ".pdf";
        return new PreparedStatement(document, pdf, filename);
    }

    private Path writeOutput(PreparedStatement statement) throws IOException {
        Path dir = Paths.get(properties.getOutputDir());
        Files.createDirectories(dir);
        Path target = dir.resolve(statement.filename());
        Files.write(target, statement.pdf());
        return target.toAbsolutePath();
    }

    private String statementBody() {
        return "Dear Customer,\n\n"
            + "Attached please find the most recent statement of open invoices.\n\n"
            + "Please let us know if you have any questions.\n\n"
            + "Kind regards,\n"
            + properties.getCompany().getName();
    }

    /**
     * Keeps letters, digits, space, dash and underscore.
     */
    static String safeName(String name) {
        if (name == null) {
            return "recipient";
        }
        String cleaned = name.replaceAll("[^A-Za-z0-9 _-]", "").trim();
        return cleaned.isEmpty() ? "recipient" : cleaned;
    }
}
