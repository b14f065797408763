package com.example.statements.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * Audit record of one statement generation and delivery for a recipient.
 * A SENT run created after a job was enqueued marks that job's item as already delivered.
 */
@Entity
@Table(name = "statement_runs", indexes = {
    @Index(name = "idx_statement_run_recipient", columnList = "recipient_id, invoice_ref, status")
})
public class StatementRun {

    public enum RunKind {
        MANUAL,
        SCHEDULED
    }

    public enum RunStatus {
        STARTED,    // Created before the statement is built
        SENT,       // Statement delivered
        SKIPPED,    // Nothing to send for this recipient
        FAILED      // Build or delivery failed
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "recipient_id", nullable = false)
    private Long recipientId;

    @Size(max = 1000)
    @Column(name = "invoice_ref", length = 1000)
    private String invoiceReference;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "run_type", nullable = false, length = 20)
    private RunKind kind;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RunStatus status = RunStatus.STARTED;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Size(max = 1000)
    @Column(length = 1000)
    private String error;

    // Path of the rendered statement PDF
    @Size(max = 1000)
    @Column(name = "pdf_path", length = 1000)
    private String outputPath;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    // Constructors
    public StatementRun() {
    }

    public StatementRun(Long recipientId, String invoiceReference, RunKind kind) {
        this.recipientId = recipientId;
        this.invoiceReference = invoiceReference;
        this.kind = kind;
    }

    // Helper methods
    public boolean isSent() {
        return status == RunStatus.SENT;
    }

    public boolean isFailed() {
        return status == RunStatus.FAILED;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getRecipientId() {
        return recipientId;
    }

    public String getInvoiceReference() {
        return invoiceReference;
    }

    public RunKind getKind() {
        return kind;
    }

    public RunStatus getStatus() {
        return status;
    }

    public void setStatus(RunStatus status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getSentAt() {
        return sentAt;
    }

    public void setSentAt(Instant sentAt) {
        this.sentAt = sentAt;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }
}
