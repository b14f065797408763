package com.example.statements.service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.DispatchLock;
import com.example.statements.domain.Recipient;
import com.example.statements.domain.ScheduledJob;
import com.example.statements.domain.ScheduledJob.JobStatus;
import com.example.statements.domain.ScheduledJobItem;
import com.example.statements.repository.DispatchLockRepository;
import com.example.statements.repository.ScheduledJobItemRepository;
import com.example.statements.repository.ScheduledJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Table-backed dispatch queue holding at most one active job.
 *
 * <p>Enqueue serializes on a locked row in {@code dispatch_locks}, so concurrent triggers
 * cannot both create a job. Claiming is a conditional update on the job status column; only
 * the caller whose update touches the row owns the job.
 */
@Service
public class JobQueueService {

    private static final Logger log = LoggerFactory.getLogger(JobQueueService.class);

    private final ScheduledJobRepository jobRepository;
    private final ScheduledJobItemRepository itemRepository;
    private final DispatchLockRepository lockRepository;
    private final DueRecipientService dueRecipientService;
    private final InvoiceSourceService invoiceSourceService;
    private final StatementsProperties properties;
    private final Clock clock;

    public JobQueueService(ScheduledJobRepository jobRepository,
                           ScheduledJobItemRepository itemRepository,
                           DispatchLockRepository lockRepository,
                           DueRecipientService dueRecipientService,
                           InvoiceSourceService invoiceSourceService,
                           StatementsProperties properties,
                           Clock clock) {
        this.jobRepository = jobRepository;
        this.itemRepository = itemRepository;
        this.lockRepository = lockRepository;
        this.dueRecipientService = dueRecipientService;
        this.invoiceSourceService = invoiceSourceService;
        this.properties = properties;
        this.clock = clock;
    }

    public enum EnqueueStatus {
        ENQUEUED,
        ALREADY_ACTIVE,
        NOTHING_DUE
    }

    /**
     * Result of an enqueue attempt. {@code jobId} is the new job, or the active one when a
     * job was already queued or running.
     */
    public record EnqueueResult(EnqueueStatus status, Long jobId, int recipientCount, String message) {
        public static EnqueueResult enqueued(Long jobId, int recipientCount) {
            return new EnqueueResult(EnqueueStatus.ENQUEUED, jobId, recipientCount,
                "Queued " + recipientCount + " recipient(s)");
        }

        public static EnqueueResult alreadyActive(Long activeJobId) {
            return new EnqueueResult(EnqueueStatus.ALREADY_ACTIVE, activeJobId, 0, "A dispatch job is already active");
        }

        public static EnqueueResult nothingDue() {
            return new EnqueueResult(EnqueueStatus.NOTHING_DUE, null, 0, "No recipients are due");
        }

        public boolean isEnqueued() {
            return status == EnqueueStatus.ENQUEUED;
        }
    }

    /**
     * Creates a job for the recipients due on {@code today}, unless a job is already queued
     * or running or nobody is due.
     */
    @Transactional
    public EnqueueResult enqueue(LocalDate today) {
        DispatchLock lock = lockRepository.findByNameForUpdate(DispatchLock.ENQUEUE)
            .orElseGet(() -> lockRepository.saveAndFlush(new DispatchLock(DispatchLock.ENQUEUE)));

        Optional<ScheduledJob> active = jobRepository.findFirstByStatusInOrderByCreatedAtAsc(JobStatus.ACTIVE);
        if (active.isPresent()) {
            log.info("Dispatch job {} is still {}, not enqueuing", active.get().getId(), active.get().getStatus());
            return EnqueueResult.alreadyActive(active.get().getId());
        }

        List<Recipient> due = dueRecipientService.findDueRecipients(today);
        int max = properties.getDispatch().getMaxRecipients();
        if (max > 0 && due.size() > max) {
            log.info("Limiting dispatch to {} of {} due recipients", max, due.size());
            due = due.subList(0, max);
        }
        if (due.isEmpty()) {
            log.info("No recipients due on {}", today);
            return EnqueueResult.nothingDue();
        }

        String reference = invoiceSourceService.currentReference().orElse(null);
        ScheduledJob job = jobRepository.save(new ScheduledJob(reference, due.size()));
        for (Recipient recipient : due) {
            itemRepository.save(new ScheduledJobItem(job.getId(), recipient.getId(), recipient.getName()));
        }
        lock.setAcquiredAt(clock.instant());

        log.info("Enqueued dispatch job {} with {} recipient(s), invoices {}", job.getId(), due.size(), reference);
        return EnqueueResult.enqueued(job.getId(), due.size());
    }

    /**
     * Reclaims stale jobs, then tries to claim the oldest queued job.
     *
     * @return the claimed job id, empty if nothing is queued or another worker won the claim
     */
    @Transactional
    public Optional<Long> claim() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(properties.getDispatch().getStaleAfter());
        int requeued = jobRepository.requeueStale(cutoff, JobStatus.RUNNING, JobStatus.QUEUED);
        if (requeued > 0) {
            log.warn("Requeued {} stale dispatch job(s) with no heartbeat since {}", requeued, cutoff);
        }

        List<Long> queued = jobRepository.findIdsByStatusOldestFirst(JobStatus.QUEUED, PageRequest.of(0, 1));
        if (queued.isEmpty()) {
            return Optional.empty();
        }
        Long jobId = queued.get(0);
        if (jobRepository.claim(jobId, now, JobStatus.QUEUED, JobStatus.RUNNING) == 1) {
            log.info("Claimed dispatch job {}", jobId);
            return Optional.of(jobId);
        }
        log.debug("Dispatch job {} was claimed by another worker", jobId);
        return Optional.empty();
    }
}
