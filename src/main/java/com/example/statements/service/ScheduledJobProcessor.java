package com.example.statements.service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.Recipient;
import com.example.statements.domain.ScheduledJob;
import com.example.statements.domain.ScheduledJob.JobStatus;
import com.example.statements.domain.ScheduledJobItem;
import com.example.statements.domain.ScheduledJobItem.ItemStatus;
import com.example.statements.domain.StatementRun.RunKind;
import com.example.statements.repository.RecipientRepository;
import com.example.statements.repository.ScheduledJobItemRepository;
import com.example.statements.repository.ScheduledJobRepository;
import com.example.statements.service.InvoiceSourceService.InvoiceSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Works through the items of a claimed dispatch job.
 *
 * <p>Items move PENDING to RUNNING to SENT, SKIPPED or FAILED. A transient failure stays in
 * RUNNING and is retried after {@code retryBackoff * attempts} until {@code retries + 1}
 * attempts have been made. Before building a statement the processor checks the run log
 * for a send of the same snapshot since the job was created, so a job resumed after a
 * crash does not mail anyone twice.
 */
@Service
public class ScheduledJobProcessor {

    private static final Logger log = LoggerFactory.getLogger(ScheduledJobProcessor.class);

    static final int MAX_ERROR_LENGTH = 1000;
    static final int ERROR_SAMPLE_SIZE = 3;

    private final ScheduledJobRepository jobRepository;
    private final ScheduledJobItemRepository itemRepository;
    private final RecipientRepository recipientRepository;
    private final InvoiceSourceService invoiceSourceService;
    private final StatementRunService statementRunService;
    private final RetryClassifier retryClassifier;
    private final StatementsProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper;

    @Autowired
    public ScheduledJobProcessor(ScheduledJobRepository jobRepository,
                                 ScheduledJobItemRepository itemRepository,
                                 RecipientRepository recipientRepository,
                                 InvoiceSourceService invoiceSourceService,
                                 StatementRunService statementRunService,
                                 RetryClassifier retryClassifier,
                                 StatementsProperties properties,
                                 Clock clock) {
        this(jobRepository, itemRepository, recipientRepository, invoiceSourceService, statementRunService,
            retryClassifier, properties, clock, Sleeper.THREAD);
    }

    ScheduledJobProcessor(ScheduledJobRepository jobRepository,
                          ScheduledJobItemRepository itemRepository,
                          RecipientRepository recipientRepository,
                          InvoiceSourceService invoiceSourceService,
                          StatementRunService statementRunService,
                          RetryClassifier retryClassifier,
                          StatementsProperties properties,
                          Clock clock,
                          Sleeper sleeper) {
        this.jobRepository = jobRepository;
        this.itemRepository = itemRepository;
        this.recipientRepository = recipientRepository;
        this.invoiceSourceService = invoiceSourceService;
        this.statementRunService = statementRunService;
        this.retryClassifier = retryClassifier;
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Processes every non-terminal item of a job that this worker has claimed.
     *
     * @throws InterruptedException if the worker is stopped mid-job; the job stays RUNNING
     *                              and is picked up again once its heartbeat goes stale
     */
    public void process(Long jobId) throws InterruptedException {
        Optional<ScheduledJob> found = jobRepository.findById(jobId);
        if (found.isEmpty()) {
            log.warn("Claimed dispatch job {} no longer exists", jobId);
            return;
        }
        ScheduledJob job = found.get();

        InvoiceSnapshot snapshot;
        try {
            snapshot = invoiceSourceService.load(job.getInvoiceReference());
        } catch (RuntimeException e) {
            log.error("Dispatch job {} failed: invoice snapshot {} could not be loaded",
                jobId, job.getInvoiceReference(), e);
            failJob(job, "Invoice snapshot unavailable: " + RetryClassifier.describe(e));
            return;
        }

        LocalDate statementDate = LocalDate.now(clock);
        Set<String> missingEmail = readMissingEmail(job);
        Duration itemDelay = properties.getDispatch().getItemDelay();

        boolean first = true;
        for (ScheduledJobItem item : itemRepository.findByJobIdOrderByIdAsc(jobId)) {
            if (item.isTerminal()) {
                continue;
            }
            if (!first) {
                sleeper.sleep(itemDelay);
            }
            first = false;

            processItem(job, item, snapshot, statementDate, missingEmail);
            refreshCounters(job);
        }

        completeJob(job);
    }

    // Helper methods

    private void processItem(ScheduledJob job, ScheduledJobItem item, InvoiceSnapshot snapshot,
                             LocalDate statementDate, Set<String> missingEmail) throws InterruptedException {
        int maxAttempts = properties.getDispatch().getRetries() + 1;

        // Resumed after a crash with its attempts already spent
        if (item.getAttempts() >= maxAttempts) {
            if (statementRunService.wasSentSince(item.getRecipientId(), job.getInvoiceReference(), job.getCreatedAt())) {
                log.info("Job {}: statement for {} already sent, resuming past it", job.getId(), item.getRecipientName());
                finishItem(item, ItemStatus.SENT, null);
                return;
            }
            String lastError = item.getError() != null ? item.getError() : "attempt limit reached";
            log.error("Job {}: statement to {} failed after {} attempt(s): {}",
                job.getId(), item.getRecipientName(), item.getAttempts(), lastError);
            finishItem(item, ItemStatus.FAILED, lastError);
            return;
        }

        while (true) {
            item.setStatus(ItemStatus.RUNNING);
            item.setAttempts(item.getAttempts() + 1);
            if (item.getStartedAt() == null) {
                item.setStartedAt(clock.instant());
            }
            itemRepository.save(item);
            heartbeat(job);

            Optional<Recipient> recipient = recipientRepository.findById(item.getRecipientId());
            if (recipient.isEmpty()) {
                finishItem(item, ItemStatus.FAILED, "recipient not found");
                return;
            }

            if (statementRunService.wasSentSince(item.getRecipientId(), job.getInvoiceReference(), job.getCreatedAt())) {
                log.info("Job {}: statement for {} already sent, resuming past it", job.getId(), item.getRecipientName());
                finishItem(item, ItemStatus.SENT, null);
                return;
            }

            DispatchOutcome outcome = statementRunService.dispatch(
                recipient.get(), snapshot, RunKind.SCHEDULED, statementDate);

            switch (outcome.status()) {
                case SENT -> {
                    log.info("Job {}: sent statement to {}", job.getId(), item.getRecipientName());
                    finishItem(item, ItemStatus.SENT, null);
                    return;
                }
                case SKIPPED -> {
                    log.info("Job {}: skipped {}: {}", job.getId(), item.getRecipientName(), outcome.message());
                    if (outcome.skipReason() == RecipientException.Reason.MISSING_EMAIL
                            && missingEmail.add(item.getRecipientName())) {
                        job.setMissingEmailJson(writeMissingEmail(missingEmail));
                    }
                    finishItem(item, ItemStatus.SKIPPED, outcome.message());
                    return;
                }
                case FAILED -> {
                    if (retryClassifier.isRetryable(outcome) && item.getAttempts() < maxAttempts) {
                        Duration backoff = properties.getDispatch().getRetryBackoff().multipliedBy(item.getAttempts());
                        log.warn("Job {}: attempt {}/{} for {} failed ({}), retrying in {}",
                            job.getId(), item.getAttempts(), maxAttempts, item.getRecipientName(),
                            outcome.message(), backoff);
                        item.setError(truncate(outcome.message()));
                        itemRepository.save(item);
                        sleeper.sleep(backoff);
                        continue;
                    }
                    log.error("Job {}: statement to {} failed after {} attempt(s): {}",
                        job.getId(), item.getRecipientName(), item.getAttempts(), outcome.message());
                    finishItem(item, ItemStatus.FAILED, outcome.message());
                    return;
                }
            }
        }
    }

    private void finishItem(ScheduledJobItem item, ItemStatus status, String error) {
        item.setStatus(status);
        item.setError(truncate(error));
        item.setFinishedAt(clock.instant());
        itemRepository.save(item);
    }

    private void heartbeat(ScheduledJob job) {
        job.setHeartbeatAt(clock.instant());
        jobRepository.save(job);
    }

    private void refreshCounters(ScheduledJob job) {
        Long jobId = job.getId();
        int sent = (int) itemRepository.countByJobIdAndStatus(jobId, ItemStatus.SENT);
        int skipped = (int) itemRepository.countByJobIdAndStatus(jobId, ItemStatus.SKIPPED);
        int failed = (int) itemRepository.countByJobIdAndStatus(jobId, ItemStatus.FAILED);
        job.setSentCount(sent);
        job.setSkippedCount(skipped);
        job.setFailedCount(failed);
        job.setProcessedItems(sent + skipped + failed);
        job.setHeartbeatAt(clock.instant());
        jobRepository.save(job);
    }

    private void completeJob(ScheduledJob job) {
        refreshCounters(job);
        if (job.getFailedCount() > 0) {
            List<String> errors = itemRepository.findErrors(job.getId(), ItemStatus.FAILED);
            String sample = String.join("; ", errors.stream().limit(ERROR_SAMPLE_SIZE).toList());
            job.setError(truncate(job.getFailedCount() + " item(s) failed: " + sample));
        }
        job.setStatus(JobStatus.COMPLETED);
        job.setFinishedAt(clock.instant());
        jobRepository.save(job);
        log.info("Dispatch job {} completed: {} sent, {} skipped, {} failed",
            job.getId(), job.getSentCount(), job.getSkippedCount(), job.getFailedCount());
    }

    private void failJob(ScheduledJob job, String error) {
        job.setStatus(JobStatus.FAILED);
        job.setError(truncate(error));
        job.setFinishedAt(clock.instant());
        jobRepository.save(job);
    }

    private Set<String> readMissingEmail(ScheduledJob job) {
        Set<String> names = new LinkedHashSet<>();
        if (job.getMissingEmailJson() == null || job.getMissingEmailJson().isBlank()) {
            return names;
        }
        try {
            names.addAll(objectMapper.readValue(job.getMissingEmailJson(), new TypeReference<List<String>>() {}));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable missing-email list on job {}", job.getId(), e);
        }
        return names;
    }

    private String writeMissingEmail(Set<String> names) {
        try {
            return objectMapper.writeValueAsString(names);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize missing-email list", e);
        }
    }

    static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
