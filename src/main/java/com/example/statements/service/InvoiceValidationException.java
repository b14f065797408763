package com.example.statements.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Thrown when an invoice export cannot be used: missing required columns, an unreadable
 * file or an unsupported file type. Never retried.
 */
public class InvoiceValidationException extends RuntimeException {

    private final List<String> missingColumns = new ArrayList<>();

    public InvoiceValidationException(String message) {
        super(message);
    }

    public InvoiceValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvoiceValidationException(List<String> missingColumns) {
        super("Invoice file is missing required columns: " + String.join(", ", missingColumns));
        this.missingColumns.addAll(missingColumns);
    }

    public List<String> getMissingColumns() {
        return new ArrayList<>(missingColumns);
    }
}
