package com.example.statements.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/**
 * One recipient's row in an {@link AgingReportRun}.
 */
@Entity
@Table(name = "overdue_report_items", indexes = {
    @Index(name = "idx_report_item_run", columnList = "run_id")
})
public class AgingReportItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "run_id", nullable = false)
    private Long runId;

    @Column(name = "recipient_id")
    private Long recipientId;

    @NotNull
    @Size(max = 200)
    @Column(name = "group_name", nullable = false, length = 200)
    private String recipientName;

    @Column(name = "terms_code", length = 20)
    private TermsCode termsCode;

    @Column(name = "overdue_count", nullable = false)
    private int overdueCount;

    @Column(name = "days_overdue", nullable = false)
    private int daysOverdue;

    @Column(name = "overdue_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal overdueAmount = BigDecimal.ZERO;

    @Column(name = "skipped_count", nullable = false)
    private int skippedCount;

    @Column(name = "skipped_invoices", length = 8000)
    private String skippedInvoicesJson;

    @Column(name = "short_paid_count", nullable = false)
    private int shortPaidCount;

    @Column(name = "short_paid_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal shortPaidAmount = BigDecimal.ZERO;

    @Column(name = "short_paid_invoices", length = 8000)
    private String shortPaidInvoicesJson;

    public AgingReportItem() {
    }

    public AgingReportItem(Long runId, Long recipientId, String recipientName, TermsCode termsCode) {
        this.runId = runId;
        this.recipientId = recipientId;
        this.recipientName = recipientName;
        this.termsCode = termsCode;
    }

    public Long getId() {
        return id;
    }

    public Long getRunId() {
        return runId;
    }

    public Long getRecipientId() {
        return recipientId;
    }

    public String getRecipientName() {
        return recipientName;
    }

    public TermsCode getTermsCode() {
        return termsCode;
    }

    public int getOverdueCount() {
        return overdueCount;
    }

    public void setOverdueCount(int overdueCount) {
        this.overdueCount = overdueCount;
    }

    public int getDaysOverdue() {
        return daysOverdue;
    }

    public void setDaysOverdue(int daysOverdue) {
        this.daysOverdue = daysOverdue;
    }

    public BigDecimal getOverdueAmount() {
        return overdueAmount;
    }

    public void setOverdueAmount(BigDecimal overdueAmount) {
        this.overdueAmount = overdueAmount;
    }

    public int getSkippedCount() {
        return skippedCount;
    }

    public void setSkippedCount(int skippedCount) {
        this.skippedCount = skippedCount;
    }

    public String getSkippedInvoicesJson() {
        return skippedInvoicesJson;
    }

    public void setSkippedInvoicesJson(String skippedInvoicesJson) {
        this.skippedInvoicesJson = skippedInvoicesJson;
    }

    public int getShortPaidCount() {
        return shortPaidCount;
    }

    public void setShortPaidCount(int shortPaidCount) {
        this.shortPaidCount = shortPaidCount;
    }

    public BigDecimal getShortPaidAmount() {
        return shortPaidAmount;
    }

    public void setShortPaidAmount(BigDecimal shortPaidAmount) {
        this.shortPaidAmount = shortPaidAmount;
    }

    public String getShortPaidInvoicesJson() {
        return shortPaidInvoicesJson;
    }

    public void setShortPaidInvoicesJson(String shortPaidInvoicesJson) {
        this.shortPaidInvoicesJson = shortPaidInvoicesJson;
    }
}
