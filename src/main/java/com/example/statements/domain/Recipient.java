package com.example.statements.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * A statement dispatch target: either a single customer or a group of member customers
 * billed together. Carries the payment terms and the delivery schedule.
 */
@Entity
@Table(name = "recipients", indexes = {
    @Index(name = "idx_recipient_active", columnList = "active")
})
public class Recipient {

    public enum Kind {
        SINGLE,
        GROUP
    }

    public enum Frequency {
        WEEKLY,
        BIWEEKLY,
        MONTHLY,
        NONE
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 200)
    @Column(name = "group_name", nullable = false, unique = true, length = 200)
    private String name;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "recipient_type", nullable = false, length = 10)
    private Kind kind = Kind.SINGLE;

    // Comma or semicolon separated list of addresses
    @Size(max = 1000)
    @Column(name = "email_to", length = 1000)
    private String emailTo;

    @NotNull
    @Column(name = "terms_code", nullable = false, length = 20)
    private TermsCode termsCode = TermsCode.DEFAULT;

    @Size(max = 200)
    @Column(length = 200)
    private String location;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Frequency frequency = Frequency.WEEKLY;

    // 0 = Monday .. 6 = Sunday
    @Min(0)
    @Max(6)
    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek = 0;

    @Min(1)
    @Max(28)
    @Column(name = "day_of_month", nullable = false)
    private int dayOfMonth = 1;

    @Column(name = "last_sent")
    private LocalDate lastSent;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    // Constructors
    public Recipient() {
    }

    public Recipient(String name, Kind kind, String emailTo, TermsCode termsCode) {
        this.name = name;
        this.kind = kind;
        this.emailTo = emailTo;
        this.termsCode = termsCode;
    }

    // Helper methods
    public boolean isGroup() {
        return kind == Kind.GROUP;
    }

    /**
     * Individual addresses parsed from the stored address list; empty if none are set.
     */
    public List<String> getEmailAddresses() {
        if (emailTo == null || emailTo.isBlank()) {
            return List.of();
        }
        return Arrays.stream(emailTo.split("[,;]"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    public boolean hasEmail() {
        return !getEmailAddresses().isEmpty();
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Kind getKind() {
        return kind;
    }

    public void setKind(Kind kind) {
        this.kind = kind;
    }

    public String getEmailTo() {
        return emailTo;
    }

    public void setEmailTo(String emailTo) {
        this.emailTo = emailTo;
    }

    public TermsCode getTermsCode() {
        return termsCode;
    }

    public void setTermsCode(TermsCode termsCode) {
        this.termsCode = termsCode;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public Frequency getFrequency() {
        return frequency;
    }

    public void setFrequency(Frequency frequency) {
        this.frequency = frequency;
    }

    public int getDayOfWeek() {
        return dayOfWeek;
    }

    public void setDayOfWeek(int dayOfWeek) {
        this.dayOfWeek = dayOfWeek;
    }

    public int getDayOfMonth() {
        return dayOfMonth;
    }

    public void setDayOfMonth(int dayOfMonth) {
        this.dayOfMonth = dayOfMonth;
    }

    public LocalDate getLastSent() {
        return lastSent;
    }

    public void setLastSent(LocalDate lastSent) {
        this.lastSent = lastSent;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
