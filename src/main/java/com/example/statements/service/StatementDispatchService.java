package com.example.statements.service;

import com.example.statements.domain.AgingReportItem;
import com.example.statements.domain.AgingReportRun;
import com.example.statements.domain.ScheduledJob;
import com.example.statements.domain.ScheduledJob.JobStatus;
import com.example.statements.domain.ScheduledJobItem;
import com.example.statements.domain.StatementRun;
import com.example.statements.repository.ScheduledJobItemRepository;
import com.example.statements.repository.ScheduledJobRepository;
import com.example.statements.service.JobQueueService.EnqueueResult;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Entry points for callers driving statement dispatch: enqueueing, job inspection, aging
 * reports and manual sends.
 */
@Service
public class StatementDispatchService {

    static final int MAX_RECENT_JOBS = 200;

    private final JobQueueService jobQueueService;
    private final ScheduledJobRepository jobRepository;
    private final ScheduledJobItemRepository itemRepository;
    private final AgingReportService agingReportService;
    private final StatementRunService statementRunService;
    private final Clock clock;

    public StatementDispatchService(JobQueueService jobQueueService,
                                    ScheduledJobRepository jobRepository,
                                    ScheduledJobItemRepository itemRepository,
                                    AgingReportService agingReportService,
                                    StatementRunService statementRunService,
                                    Clock clock) {
        this.jobQueueService = jobQueueService;
        this.jobRepository = jobRepository;
        this.itemRepository = itemRepository;
        this.agingReportService = agingReportService;
        this.statementRunService = statementRunService;
        this.clock = clock;
    }

    /**
     * Queues a job for today's due recipients.
     */
    public EnqueueResult enqueueIfDue() {
        return jobQueueService.enqueue(LocalDate.now(clock));
    }

    @Transactional(readOnly = true)
    public Optional<ScheduledJob> getActiveJob() {
        return jobRepository.findFirstByStatusInOrderByCreatedAtAsc(JobStatus.ACTIVE);
    }

    /**
     * Most recent jobs first. The limit is clamped to 1..200.
     */
    @Transactional(readOnly = true)
    public List<ScheduledJob> listRecentJobs(int limit) {
        int size = Math.max(1, Math.min(limit, MAX_RECENT_JOBS));
        return jobRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, size));
    }

    @Transactional(readOnly = true)
    public List<ScheduledJobItem> getJobItems(Long jobId) {
        return itemRepository.findByJobIdOrderByIdAsc(jobId);
    }

    public AgingReportRun runAgingReport() {
        return agingReportService.runAgingReport();
    }

    public Optional<AgingReportRun> getLatestAgingReport() {
        return agingReportService.getLatest();
    }

    public List<AgingReportItem> getAgingReportItems(Long runId) {
        return agingReportService.getItems(runId);
    }

    /**
     * Sends one recipient's statement immediately.
     *
     * @throws RecipientException if there is nothing to send
     * @throws SnapshotUnavailableException if no invoice export can be loaded
     */
    public StatementRun sendNow(Long recipientId) {
        return statementRunService.sendNow(recipientId);
    }

    /**
     * Send history of one recipient, newest first.
     */
    public List<StatementRun> getStatementRuns(Long recipientId) {
        return statementRunService.findRuns(recipientId);
    }
}
