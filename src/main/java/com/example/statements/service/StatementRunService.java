package com.example.statements.service;

import com.example.statements.domain.Recipient;
import com.example.statements.domain.StatementRun;
import com.example.statements.domain.StatementRun.RunKind;
import com.example.statements.domain.StatementRun.RunStatus;
import com.example.statements.repository.RecipientRepository;
import com.example.statements.repository.StatementRunRepository;
import com.example.statements.service.DispatchOutcome.FailureKind;
import com.example.statements.service.InvoiceSourceService.InvoiceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Sends single statements and keeps the statement run log.
 *
 * <p>Every send attempt, scheduled or manual, is recorded as a {@link StatementRun}. A SENT
 * run is what lets an interrupted dispatch job resume without sending twice.
 */
@Service
public class StatementRunService {

    private static final Logger log = LoggerFactory.getLogger(StatementRunService.class);

    static final int MAX_ERROR_LENGTH = 1000;

    private final StatementRunRepository runRepository;
    private final RecipientRepository recipientRepository;
    private final StatementBuilder statementBuilder;
    private final InvoiceSourceService invoiceSourceService;
    private final RetryClassifier retryClassifier;
    private final Clock clock;

    public StatementRunService(StatementRunRepository runRepository,
                               RecipientRepository recipientRepository,
                               StatementBuilder statementBuilder,
                               InvoiceSourceService invoiceSourceService,
                               RetryClassifier retryClassifier,
                               Clock clock) {
        this.runRepository = runRepository;
        this.recipientRepository = recipientRepository;
        this.statementBuilder = statementBuilder;
        this.invoiceSourceService = invoiceSourceService;
        this.retryClassifier = retryClassifier;
        this.clock = clock;
    }

    /**
     * True if a statement for this recipient and invoice snapshot was sent at or after
     * {@code since}.
     */
    @Transactional(readOnly = true)
    public boolean wasSentSince(Long recipientId, String invoiceReference, Instant since) {
        return runRepository.existsByRecipientIdAndInvoiceReferenceAndStatusAndCreatedAtGreaterThanEqual(
            recipientId, invoiceReference, RunStatus.SENT, since);
    }

    /**
     * Builds and delivers one statement, recording the attempt. A confirmed send moves the
     * recipient's last sent date to {@code statementDate}.
     */
    public DispatchOutcome dispatch(Recipient recipient, InvoiceSnapshot snapshot, RunKind kind,
                                    LocalDate statementDate) {
        return execute(recipient, snapshot, kind, statementDate).outcome();
    }

    private RecordedDispatch execute(Recipient recipient, InvoiceSnapshot snapshot, RunKind kind,
                                     LocalDate statementDate) {
        StatementRun run = runRepository.save(new StatementRun(recipient.getId(), snapshot.reference(), kind));

        DispatchOutcome outcome;
        try {
            outcome = statementBuilder.dispatch(recipient, snapshot, statementDate);
        } catch (RecipientException e) {
            outcome = DispatchOutcome.skipped(e.getReason(), e.getMessage());
        } catch (RuntimeException e) {
            FailureKind failureKind = retryClassifier.classify(e);
            log.error("Statement for {} failed unexpectedly", recipient.getName(), e);
            outcome = DispatchOutcome.failed(failureKind, RetryClassifier.describe(e));
        }

        recordOutcome(run, outcome);
        if (outcome.isSent()) {
            recipientRepository.updateLastSent(recipient.getId(), statementDate);
        }
        return new RecordedDispatch(run, outcome);
    }

    private record RecordedDispatch(StatementRun run, DispatchOutcome outcome) {}

    /**
     * Manual "send now" for one recipient against the current invoice snapshot.
     *
     * @return the recorded run, SENT or FAILED
     * @throws RecipientException if the recipient is unknown or has nothing to send
     */
    public StatementRun sendNow(Long recipientId) {
        Recipient recipient = recipientRepository.findById(recipientId)
            .orElseThrow(() -> new RecipientException(RecipientException.Reason.NOT_FOUND,
                "Recipient not found: " + recipientId));
        InvoiceSnapshot snapshot = invoiceSourceService.loadCurrent();

        RecordedDispatch result = execute(recipient, snapshot, RunKind.MANUAL, LocalDate.now(clock));
        DispatchOutcome outcome = result.outcome();
        if (outcome.isSkipped()) {
            throw new RecipientException(outcome.skipReason(), outcome.message());
        }
        log.info("Manual statement for {}: {}", recipient.getName(), outcome.status());
        return result.run();
    }

    @Transactional(readOnly = true)
    public List<StatementRun> findRuns(Long recipientId) {
        return runRepository.findByRecipientIdOrderByCreatedAtDesc(recipientId);
    }

    // Helper methods

    private void recordOutcome(StatementRun run, DispatchOutcome outcome) {
        switch (outcome.status()) {
            case SENT -> {
                run.setStatus(RunStatus.SENT);
                run.setSentAt(clock.instant());
                run.setOutputPath(outcome.outputPath());
            }
            case SKIPPED -> {
                run.setStatus(RunStatus.SKIPPED);
                run.setError(truncate(outcome.message()));
            }
            case FAILED -> {
                run.setStatus(RunStatus.FAILED);
                run.setError(truncate(outcome.message()));
            }
        }
        runRepository.save(run);
    }

    static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
