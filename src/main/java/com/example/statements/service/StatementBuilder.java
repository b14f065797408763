package com.example.statements.service;

import com.example.statements.domain.Recipient;
import com.example.statements.service.InvoiceSourceService.InvoiceSnapshot;

import java.time.LocalDate;

/**
 * Renders a recipient's statement from an invoice snapshot and delivers it.
 *
 * <p>Implementations report every expected condition through the returned outcome rather
 * than by throwing.
 */
public interface StatementBuilder {

    DispatchOutcome dispatch(Recipient recipient, InvoiceSnapshot snapshot, LocalDate statementDate);
}
