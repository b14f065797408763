package com.example.statements.service;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One row of an invoice export. Derived from the uploaded file on every pass, never stored.
 *
 * @param location the optional Location column, {@code null} when absent or blank
 */
public record InvoiceLineItem(
    String customerName,
    String orderId,
    LocalDate shipDate,
    BigDecimal total,
    BigDecimal paid,
    String location
) {
    static final BigDecimal CENT = new BigDecimal("0.01");

    public InvoiceLineItem {
        total = total != null ? total : BigDecimal.ZERO;
        paid = paid != null ? paid : BigDecimal.ZERO;
    }

    public BigDecimal outstanding() {
        return total.subtract(paid);
    }

    public boolean isFullyPaid() {
        return outstanding().compareTo(CENT) <= 0;
    }

    public boolean isShortPaid() {
        return paid.compareTo(CENT) > 0 && outstanding().compareTo(CENT) > 0;
    }

    public boolean isUnpaid() {
        return paid.compareTo(CENT) <= 0 && outstanding().compareTo(CENT) > 0;
    }

    /**
     * Included on statements: a positive total not covered by payments.
     */
    public boolean isOpen() {
        return total.signum() > 0 && total.compareTo(paid.add(CENT)) > 0;
    }
}
