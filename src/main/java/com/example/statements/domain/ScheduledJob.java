package com.example.statements.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * A batch of statement sends for the recipients that were due when the job was enqueued.
 * At most one job is QUEUED or RUNNING at any time.
 */
@Entity
@Table(name = "scheduled_jobs", indexes = {
    @Index(name = "idx_scheduled_job_status", columnList = "status, created_at")
})
public class ScheduledJob {

    public enum JobStatus {
        QUEUED,     // Waiting for the worker
        RUNNING,    // Claimed by a worker, heartbeat maintained
        COMPLETED,  // All items terminal, some may have failed
        FAILED;     // Invoice snapshot could not be loaded

        public static final Set<JobStatus> ACTIVE = EnumSet.of(QUEUED, RUNNING);

        public boolean isActive() {
            return ACTIVE.contains(this);
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status = JobStatus.QUEUED;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    // file:<id> or path:<path> of the invoice export this job dispatches from
    @Size(max = 1000)
    @Column(name = "invoice_ref", length = 1000)
    private String invoiceReference;

    @Column(name = "total_items", nullable = false)
    private int totalItems;

    @Column(name = "processed_items", nullable = false)
    private int processedItems;

    @Column(name = "sent_count", nullable = false)
    private int sentCount;

    @Column(name = "skipped_count", nullable = false)
    private int skippedCount;

    @Column(name = "failed_count", nullable = false)
    private int failedCount;

    // JSON array of recipient names without a usable address
    @Size(max = 4000)
    @Column(name = "missing_email_json", length = 4000)
    private String missingEmailJson;

    @Size(max = 1000)
    @Column(length = 1000)
    private String error;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public ScheduledJob() {
    }

    public ScheduledJob(String invoiceReference, int totalItems) {
        this.invoiceReference = invoiceReference;
        this.totalItems = totalItems;
    }

    // Helper methods
    public boolean isActive() {
        return status.isActive();
    }

    public boolean isFinished() {
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public Instant getHeartbeatAt() {
        return heartbeatAt;
    }

    public void setHeartbeatAt(Instant heartbeatAt) {
        this.heartbeatAt = heartbeatAt;
    }

    public String getInvoiceReference() {
        return invoiceReference;
    }

    public void setInvoiceReference(String invoiceReference) {
        this.invoiceReference = invoiceReference;
    }

    public int getTotalItems() {
        return totalItems;
    }

    public void setTotalItems(int totalItems) {
        this.totalItems = totalItems;
    }

    public int getProcessedItems() {
        return processedItems;
    }

    public void setProcessedItems(int processedItems) {
        this.processedItems = processedItems;
    }

    public int getSentCount() {
        return sentCount;
    }

    public void setSentCount(int sentCount) {
        this.sentCount = sentCount;
    }

    public int getSkippedCount() {
        return skippedCount;
    }

    public void setSkippedCount(int skippedCount) {
        this.skippedCount = skippedCount;
    }

    public int getFailedCount() {
        return failedCount;
    }

    public void setFailedCount(int failedCount) {
        this.failedCount = failedCount;
    }

    public String getMissingEmailJson() {
        return missingEmailJson;
    }

    public void setMissingEmailJson(String missingEmailJson) {
        this.missingEmailJson = missingEmailJson;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
