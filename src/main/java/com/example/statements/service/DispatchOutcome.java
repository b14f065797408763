package com.example.statements.service;

import com.example.statements.service.RecipientException.Reason;

/**
 * Result of dispatching one statement: sent, skipped with a reason, or failed with a
 * structured failure kind.
 */
public record DispatchOutcome(
    Status status,
    Reason skipReason,
    FailureKind failureKind,
    String message,
    String outputPath
) {
    public enum Status {
        SENT,
        SKIPPED,
        FAILED
    }

    /**
     * How a failure should be treated by retry logic. UNKNOWN falls back to inspecting the
     * message text.
     */
    public enum FailureKind {
        TRANSIENT,
        PERMANENT,
        UNKNOWN
    }

    public static DispatchOutcome sent(String outputPath) {
        return new DispatchOutcome(Status.SENT, null, null, "Statement sent", outputPath);
    }

    public static DispatchOutcome skipped(Reason reason, String message) {
        return new DispatchOutcome(Status.SKIPPED, reason, null,
            message != null ? message : reason.getDescription(), null);
    }

    public static DispatchOutcome skipped(Reason reason) {
        return skipped(reason, null);
    }

    public static DispatchOutcome failed(FailureKind kind, String message) {
        return new DispatchOutcome(Status.FAILED, null, kind, message, null);
    }

    public boolean isSent() {
        return status == Status.SENT;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
