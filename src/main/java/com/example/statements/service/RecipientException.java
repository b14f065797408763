package com.example.statements.service;

/**
 * A recipient has nothing deliverable. Scheduled dispatch records these as skipped items;
 * manual sends surface them to the caller.
 */
public class RecipientException extends RuntimeException {

    private final Reason reason;

    public RecipientException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        NOT_FOUND("Recipient not found"),
        NO_GROUP_MEMBERS("No group members configured"),
        NO_MATCHING_ROWS("No matching invoices"),
        NO_OPEN_INVOICES("No outstanding invoices to include"),
        MISSING_EMAIL("No email address on file");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }
}
