package com.example.statements.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Places a single recipient inside a group. A member belongs to at most one group;
 * members are excluded from standalone dispatch.
 */
@Entity
@Table(name = "group_members", uniqueConstraints = {
    @UniqueConstraint(name = "uk_group_member_customer", columnNames = "customer_id")
})
public class GroupMembership {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "group_id", nullable = false)
    private Recipient group;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "customer_id", nullable = false)
    private Recipient member;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public GroupMembership() {
    }

    public GroupMembership(Recipient group, Recipient member) {
        this.group = group;
        this.member = member;
    }

    public Long getId() {
        return id;
    }

    public Recipient getGroup() {
        return group;
    }

    public void setGroup(Recipient group) {
        this.group = group;
    }

    public Recipient getMember() {
        return member;
    }

    public void setMember(Recipient member) {
        this.member = member;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
