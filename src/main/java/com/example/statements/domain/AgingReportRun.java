package com.example.statements.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * Persisted snapshot of one on-demand aging pass over an invoice export.
 */
@Entity
@Table(name = "overdue_report_runs")
public class AgingReportRun {

    public enum ReportStatus {
        SUCCESS,
        ERROR
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Size(max = 1000)
    @Column(name = "invoice_ref", length = 1000)
    private String invoiceReference;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReportStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Size(max = 1000)
    @Column(length = 1000)
    private String error;

    // Customer names in the export that matched no recipient
    @Column(name = "unresolved_count", nullable = false)
    private int unresolvedCount;

    @Size(max = 4000)
    @Column(name = "unresolved_json", length = 4000)
    private String unresolvedJson;

    @Column(name = "item_count", nullable = false)
    private int itemCount;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public AgingReportRun() {
    }

    public AgingReportRun(String invoiceReference, ReportStatus status) {
        this.invoiceReference = invoiceReference;
        this.status = status;
    }

    public boolean isSuccess() {
        return status == ReportStatus.SUCCESS;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getInvoiceReference() {
        return invoiceReference;
    }

    public ReportStatus getStatus() {
        return status;
    }

    public void setStatus(ReportStatus status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public int getUnresolvedCount() {
        return unresolvedCount;
    }

    public void setUnresolvedCount(int unresolvedCount) {
        this.unresolvedCount = unresolvedCount;
    }

    public String getUnresolvedJson() {
        return unresolvedJson;
    }

    public void setUnresolvedJson(String unresolvedJson) {
        this.unresolvedJson = unresolvedJson;
    }

    public int getItemCount() {
        return itemCount;
    }

    public void setItemCount(int itemCount) {
        this.itemCount = itemCount;
    }
}
