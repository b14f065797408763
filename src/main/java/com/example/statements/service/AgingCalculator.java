package com.example.statements.service;

import com.example.statements.domain.TermsCode;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Due date and aging status rules for invoices.
 *
 * <p>Fixed-day terms add their day count to the ship date. Week to week invoices fall due on
 * the Friday of the ship week, month to month on the first of the following month. Bill to
 * bill invoices fall due when the next invoice at the same location ships; the last one in
 * the sequence gets {@value #BILL_TO_BILL_GRACE_DAYS} days.
 */
@Service
public class AgingCalculator {

    public static final int BILL_TO_BILL_GRACE_DAYS = 15;
    public static final int DUE_SOON_DAYS = 7;

    public enum AgingStatus {
        OVERDUE("Overdue"),
        DUE_THIS_WEEK("Due This Week"),
        UNPAID("Unpaid");

        private final String label;

        AgingStatus(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    /**
     * Due date for terms that do not depend on sibling invoices. A bill to bill invoice with
     * no later sibling is treated as the last in its sequence.
     */
    public LocalDate dueDate(LocalDate shipDate, TermsCode terms) {
        return dueDate(shipDate, terms, List.of());
    }

    /**
     * Computes the due date of one invoice.
     *
     * @param shipDate the invoice ship date
     * @param terms the recipient's terms, {@code null} means the default
     * @param siblingShipDates ship dates of the other open invoices at the same location,
     *                         only consulted for bill to bill terms
     */
    public LocalDate dueDate(LocalDate shipDate, TermsCode terms, Collection<LocalDate> siblingShipDates) {
        TermsCode effective = terms != null ? terms : TermsCode.DEFAULT;
        if (effective.isFixedDays()) {
            return shipDate.plusDays(effective.getDays());
        }
        return switch (effective) {
            case WEEK_TO_WEEK -> shipDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).plusDays(4);
            case MONTH_TO_MONTH -> shipDate.withDayOfMonth(1).plusMonths(1);
            case BILL_TO_BILL -> siblingShipDates.stream()
                .filter(d -> d.isAfter(shipDate))
                .min(LocalDate::compareTo)
                .orElse(shipDate.plusDays(BILL_TO_BILL_GRACE_DAYS));
            default -> shipDate.plusDays(TermsCode.DEFAULT.getDays());
        };
    }

    /**
     * Bill to bill due dates for an already ordered sequence of ship dates. Element i is due
     * on the ship date of element i + 1; the last element gets the grace period. Equal ship
     * dates keep their sequence order, so a tied invoice falls due on its own ship date.
     */
    public List<LocalDate> billToBillDueDates(List<LocalDate> orderedShipDates) {
        List<LocalDate> dueDates = new ArrayList<>(orderedShipDates.size());
        for (int i = 0; i < orderedShipDates.size(); i++) {
            if (i < orderedShipDates.size() - 1) {
                dueDates.add(orderedShipDates.get(i + 1));
            } else {
                dueDates.add(orderedShipDates.get(i).plusDays(BILL_TO_BILL_GRACE_DAYS));
            }
        }
        return dueDates;
    }

    public AgingStatus status(LocalDate today, LocalDate dueDate) {
        if (today.isAfter(dueDate)) {
            return AgingStatus.OVERDUE;
        }
        long daysUntilDue = ChronoUnit.DAYS.between(today, dueDate);
        if (daysUntilDue <= DUE_SOON_DAYS) {
            return AgingStatus.DUE_THIS_WEEK;
        }
        return AgingStatus.UNPAID;
    }

    /**
     * Whole days past due, 0 when not yet due.
     */
    public int daysOverdue(LocalDate today, LocalDate dueDate) {
        return today.isAfter(dueDate) ? (int) ChronoUnit.DAYS.between(dueDate, today) : 0;
    }
}
