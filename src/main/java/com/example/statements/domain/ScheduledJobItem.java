package com.example.statements.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * One recipient's unit of work inside a {@link ScheduledJob}. Status only moves forward:
 * PENDING, then RUNNING, then one of SENT, SKIPPED or FAILED.
 */
@Entity
@Table(name = "scheduled_job_items", indexes = {
    @Index(name = "idx_job_item_job", columnList = "job_id, status")
})
public class ScheduledJobItem {

    public enum ItemStatus {
        PENDING,
        RUNNING,
        SENT,
        SKIPPED,
        FAILED;

        public boolean isTerminal() {
            return this == SENT || this == SKIPPED || this == FAILED;
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @NotNull
    @Column(name = "recipient_id", nullable = false)
    private Long recipientId;

    @Size(max = 200)
    @Column(name = "recipient_name", length = 200)
    private String recipientName;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ItemStatus status = ItemStatus.PENDING;

    @Column(nullable = false)
    private int attempts;

    @Size(max = 1000)
    @Column(length = 1000)
    private String error;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public ScheduledJobItem() {
    }

    public ScheduledJobItem(Long jobId, Long recipientId, String recipientName) {
        this.jobId = jobId;
        this.recipientId = recipientId;
        this.recipientName = recipientName;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getJobId() {
        return jobId;
    }

    public Long getRecipientId() {
        return recipientId;
    }

    public String getRecipientName() {
        return recipientName;
    }

    public ItemStatus getStatus() {
        return status;
    }

    public void setStatus(ItemStatus status) {
        this.status = status;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Instant getCreatedAt() {
        return createdAt;
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
}
