package com.example.statements.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * Records that a follow-up notice went out for a recipient against one invoice export,
 * so the same notice is not sent twice.
 */
@Entity
@Table(name = "notice_sends", uniqueConstraints = {
    @UniqueConstraint(name = "uk_notice_send",
        columnNames = {"invoice_ref", "recipient_id", "notice_type"})
})
public class NoticeSend {

    public enum NoticeType {
        OVERDUE,
        SKIPPED,
        SHORT_PAID
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "report_run_id")
    private Long reportRunId;

    @NotNull
    @Size(max = 1000)
    @Column(name = "invoice_ref", nullable = false, length = 1000)
    private String invoiceReference;

    @NotNull
    @Column(name = "recipient_id", nullable = false)
    private Long recipientId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "notice_type", nullable = false, length = 20)
    private NoticeType noticeType;

    @Column(name = "sent_at", nullable = false)
    private Instant sentAt;

    @PrePersist
    protected void onCreate() {
        if (sentAt == null) {
            sentAt = Instant.now();
        }
    }

    public NoticeSend() {
    }

    public NoticeSend(Long reportRunId, String invoiceReference, Long recipientId, NoticeType noticeType) {
        this.reportRunId = reportRunId;
        this.invoiceReference = invoiceReference;
        this.recipientId = recipientId;
        this.noticeType = noticeType;
    }

    public Long getId() {
        return id;
    }

    public Long getReportRunId() {
        return reportRunId;
    }

    public String getInvoiceReference() {
        return invoiceReference;
    }

    public Long getRecipientId() {
        return recipientId;
    }

    public NoticeType getNoticeType() {
        return noticeType;
    }

    public Instant getSentAt() {
        return sentAt;
    }
}
