package com.example.statements.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Named coordination row. Enqueue takes a write lock on its row so concurrent triggers,
 * in this process or another, serialize on the database.
 */
@Entity
@Table(name = "dispatch_locks")
public class DispatchLock {

    public static final String ENQUEUE = "enqueue";

    @Id
    @Column(length = 50)
    private String name;

    @NotNull
    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    public DispatchLock() {
    }

    public DispatchLock(String name) {
        this.name = name;
        this.acquiredAt = Instant.now();
    }

    public String getName() {
        return name;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public void setAcquiredAt(Instant acquiredAt) {
        this.acquiredAt = acquiredAt;
    }
}
