package com.example.statements.service;

import com.example.statements.domain.Recipient;
import com.example.statements.domain.TermsCode;
import com.example.statements.service.AgingCalculator.AgingStatus;
import com.example.statements.service.RecipientResolver.Resolution;
import com.example.statements.service.RecipientResolver.ResolutionIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Groups invoice rows by resolved recipient and location and classifies them as overdue,
 * skipped or short-paid.
 *
 * <p>A skipped invoice is an unpaid invoice shipped before some fully paid invoice at the same
 * location: a payment went to a later shipment while an earlier one is still open.
 */
@Service
public class InvoiceAggregator {

    private static final Logger log = LoggerFactory.getLogger(InvoiceAggregator.class);

    private static final int UNRESOLVED_LOG_SAMPLE = 10;

    /**
     * Ship date first, then order id (numeric when both ids are numeric).
     */
    static final Comparator<InvoiceLineItem> SHIP_ORDER = Comparator
        .comparing(InvoiceLineItem::shipDate)
        .thenComparing(InvoiceLineItem::orderId, InvoiceAggregator::compareOrderIds);

    private final AgingCalculator agingCalculator;
    private final RecipientResolver recipientResolver;

    public InvoiceAggregator(AgingCalculator agingCalculator, RecipientResolver recipientResolver) {
        this.agingCalculator = agingCalculator;
        this.recipientResolver = recipientResolver;
    }

    /**
     * An open invoice with its computed due date.
     */
    public record AgedInvoice(
        String orderId,
        LocalDate shipDate,
        String location,
        BigDecimal total,
        BigDecimal paid,
        BigDecimal outstanding,
        LocalDate dueDate,
        AgingStatus status,
        int daysOverdue
    ) {
        public boolean isOverdue() {
            return status == AgingStatus.OVERDUE;
        }
    }

    public record SkippedInvoice(String orderId, LocalDate shipDate, String location) {}

    public record ShortPaidInvoice(String orderId, LocalDate shipDate, String location, BigDecimal amount) {}

    /**
     * Aggregate aging figures for one recipient.
     */
    public record RecipientAging(
        Long recipientId,
        String recipientName,
        TermsCode termsCode,
        int overdueCount,
        BigDecimal overdueAmount,
        int daysOverdue,
        List<SkippedInvoice> skippedInvoices,
        BigDecimal shortPaidAmount,
        List<ShortPaidInvoice> shortPaidInvoices
    ) {
        public int skippedCount() {
            return skippedInvoices.size();
        }

        public int shortPaidCount() {
            return shortPaidInvoices.size();
        }

        public boolean hasFindings() {
            return overdueCount > 0 || !skippedInvoices.isEmpty() || !shortPaidInvoices.isEmpty();
        }
    }

    /**
     * Result of an aggregation pass. Unresolved names are distinct, in encounter order.
     */
    public record AgingResult(List<RecipientAging> recipients, List<String> unresolvedNames) {
        public int unresolvedCount() {
            return unresolvedNames.size();
        }

        public Optional<RecipientAging> forRecipient(Long recipientId) {
            return recipients.stream().filter(r -> r.recipientId().equals(recipientId)).findFirst();
        }
    }

    public AgingResult aggregate(List<InvoiceLineItem> rows, LocalDate today) {
        return aggregate(rows, recipientResolver.buildIndex(), today);
    }

    public AgingResult aggregate(List<InvoiceLineItem> rows, ResolutionIndex index, LocalDate today) {
        Map<Long, RecipientRows> byRecipient = new LinkedHashMap<>();
        Set<String> unresolved = new LinkedHashSet<>();

        for (InvoiceLineItem row : rows) {
            String name = row.customerName() == null ? "" : row.customerName().trim();
            if (name.isEmpty()) {
                continue;
            }
            Optional<Resolution> resolution = index.resolve(name);
            if (resolution.isEmpty()) {
                unresolved.add(name);
                continue;
            }
            if (row.total().signum() <= 0) {
                continue;
            }
            Recipient recipient = resolution.get().recipient();
            byRecipient.computeIfAbsent(recipient.getId(), id -> new RecipientRows(recipient))
                .add(locationOf(resolution.get(), row), row);
        }

        List<RecipientAging> report = new ArrayList<>();
        for (RecipientRows recipientRows : byRecipient.values()) {
            RecipientAging aging = summarize(recipientRows, today);
            if (aging.hasFindings()) {
                report.add(aging);
            }
        }
        report.sort(Comparator.comparing(RecipientAging::overdueAmount).reversed());

        if (!unresolved.isEmpty()) {
            log.warn("{} customer name(s) did not resolve to a recipient and were left out, e.g. {}",
                unresolved.size(), unresolved.stream().limit(UNRESOLVED_LOG_SAMPLE).toList());
        }
        return new AgingResult(report, List.copyOf(unresolved));
    }

    /**
     * Rows of the snapshot that resolve to the given recipient.
     */
    public List<InvoiceLineItem> rowsFor(Recipient recipient, List<InvoiceLineItem> rows, ResolutionIndex index) {
        return rows.stream()
            .filter(row -> index.resolve(row.customerName())
                .map(r -> r.recipient().getId().equals(recipient.getId()))
                .orElse(false))
            .toList();
    }

    /**
     * Open invoices of one recipient with due dates, ordered by location then ship date.
     * Used for rendering statements.
     */
    public List<AgedInvoice> openInvoices(Recipient recipient, List<InvoiceLineItem> recipientRows,
                                          ResolutionIndex index, LocalDate today) {
        RecipientRows grouped = new RecipientRows(recipient);
        for (InvoiceLineItem row : recipientRows) {
            if (!row.isOpen()) {
                continue;
            }
            index.resolve(row.customerName())
                .ifPresent(resolution -> grouped.add(locationOf(resolution, row), row));
        }
        List<AgedInvoice> lines = new ArrayList<>();
        grouped.byLocation.forEach((location, locationRows) ->
            lines.addAll(age(recipient.getTermsCode(), location, locationRows, today)));
        return lines;
    }

    // Helper methods

    private RecipientAging summarize(RecipientRows rows, LocalDate today) {
        Recipient recipient = rows.recipient;
        TermsCode terms = recipient.getTermsCode() != null ? recipient.getTermsCode() : TermsCode.DEFAULT;

        int overdueCount = 0;
        BigDecimal overdueAmount = BigDecimal.ZERO;
        LocalDate oldestDue = null;
        List<SkippedInvoice> skipped = new ArrayList<>();
        List<ShortPaidInvoice> shortPaid = new ArrayList<>();
        BigDecimal shortPaidAmount = BigDecimal.ZERO;

        for (Map.Entry<String, List<InvoiceLineItem>> entry : rows.byLocation.entrySet()) {
            String location = entry.getKey();
            List<InvoiceLineItem> locationRows = entry.getValue();

            List<InvoiceLineItem> outstanding = locationRows.stream()
                .filter(row -> row.outstanding().signum() > 0)
                .toList();
            for (AgedInvoice aged : age(terms, location, outstanding, today)) {
                if (aged.isOverdue()) {
                    overdueCount++;
                    overdueAmount = overdueAmount.add(aged.outstanding());
                    if (oldestDue == null || aged.dueDate().isBefore(oldestDue)) {
                        oldestDue = aged.dueDate();
                    }
                }
            }

            for (InvoiceLineItem row : locationRows) {
                if (row.isShortPaid()) {
                    shortPaid.add(new ShortPaidInvoice(row.orderId(), row.shipDate(), location, row.outstanding()));
                    shortPaidAmount = shortPaidAmount.add(row.outstanding());
                }
            }

            Optional<LocalDate> latestPaid = locationRows.stream()
                .filter(InvoiceLineItem::isFullyPaid)
                .map(InvoiceLineItem::shipDate)
                .max(LocalDate::compareTo);
            if (latestPaid.isPresent()) {
                locationRows.stream()
                    .filter(row -> row.isUnpaid() && row.shipDate().isBefore(latestPaid.get()))
                    .sorted(SHIP_ORDER)
                    .forEach(row -> skipped.add(new SkippedInvoice(row.orderId(), row.shipDate(), location)));
            }
        }

        int daysOverdue = oldestDue != null ? agingCalculator.daysOverdue(today, oldestDue) : 0;
        return new RecipientAging(recipient.getId(), recipient.getName(), terms, overdueCount, overdueAmount,
            daysOverdue, List.copyOf(skipped), shortPaidAmount, List.copyOf(shortPaid));
    }

    private List<AgedInvoice> age(TermsCode terms, String location, List<InvoiceLineItem> rows, LocalDate today) {
        List<InvoiceLineItem> ordered = new ArrayList<>(rows);
        ordered.sort(SHIP_ORDER);

        List<LocalDate> dueDates;
        if (terms == TermsCode.BILL_TO_BILL) {
            dueDates = agingCalculator.billToBillDueDates(ordered.stream().map(InvoiceLineItem::shipDate).toList());
        } else {
            dueDates = ordered.stream().map(row -> agingCalculator.dueDate(row.shipDate(), terms)).toList();
        }

        List<AgedInvoice> aged = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            InvoiceLineItem row = ordered.get(i);
            LocalDate due = dueDates.get(i);
            aged.add(new AgedInvoice(row.orderId(), row.shipDate(), location, row.total(), row.paid(),
                row.outstanding(), due, agingCalculator.status(today, due), agingCalculator.daysOverdue(today, due)));
        }
        return aged;
    }

    private static String locationOf(Resolution resolution, InvoiceLineItem row) {
        if (resolution.viaGroup()) {
            if (resolution.customer() == resolution.recipient()) {
                return row.customerName().trim();
            }
            return resolution.customer().getName();
        }
        if (row.location() != null && !row.location().isBlank()) {
            return row.location().trim();
        }
        return resolution.customer().getName();
    }

    static int compareOrderIds(String a, String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        if (left.matches("\\d+") && right.matches("\\d+")) {
            int byLength = Integer.compare(left.length(), right.length());
            return byLength != 0 ? byLength : left.compareTo(right);
        }
        return left.compareTo(right);
    }

    private static final class RecipientRows {
        private final Recipient recipient;
        private final Map<String, List<InvoiceLineItem>> byLocation = new LinkedHashMap<>();

        private RecipientRows(Recipient recipient) {
            this.recipient = recipient;
        }

        private void add(String location, InvoiceLineItem row) {
            byLocation.computeIfAbsent(location, l -> new ArrayList<>()).add(row);
        }
    }
}
