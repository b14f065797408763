package com.example.statements.service;

import com.example.statements.domain.AgingReportItem;
import com.example.statements.domain.AgingReportRun;
import com.example.statements.domain.AgingReportRun.ReportStatus;
import com.example.statements.repository.AgingReportItemRepository;
import com.example.statements.repository.AgingReportRunRepository;
import com.example.statements.service.InvoiceAggregator.AgingResult;
import com.example.statements.service.InvoiceAggregator.RecipientAging;
import com.example.statements.service.InvoiceAggregator.ShortPaidInvoice;
import com.example.statements.service.InvoiceAggregator.SkippedInvoice;
import com.example.statements.service.InvoiceSourceService.InvoiceSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the overdue / skipped / short-paid pass over the current invoice export and
 * persists the result.
 */
@Service
public class AgingReportService {

    private static final Logger log = LoggerFactory.getLogger(AgingReportService.class);

    static final int UNRESOLVED_SAMPLE_SIZE = 50;

    private static final DateTimeFormatter LIST_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    private final AgingReportRunRepository runRepository;
    private final AgingReportItemRepository itemRepository;
    private final InvoiceSourceService invoiceSourceService;
    private final InvoiceAggregator invoiceAggregator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public AgingReportService(AgingReportRunRepository runRepository,
                              AgingReportItemRepository itemRepository,
                              InvoiceSourceService invoiceSourceService,
                              InvoiceAggregator invoiceAggregator,
                              TransactionTemplate transactionTemplate,
                              Clock clock) {
        this.runRepository = runRepository;
        this.itemRepository = itemRepository;
        this.invoiceSourceService = invoiceSourceService;
        this.invoiceAggregator = invoiceAggregator;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
    }

    /** One invoice listed on a report item. */
    public record ListedInvoice(String orderId, String shipDate, String location, String amount) {}

    /**
     * Aggregates the current snapshot and stores a SUCCESS run with one item per recipient
     * that has findings. The run and its items commit together. Any failure rolls them back
     * and is stored as an ERROR run instead of propagating, so the pass runs outside a
     * surrounding transaction.
     */
    public AgingReportRun runAgingReport() {
        String reference = invoiceSourceService.currentReference().orElse(null);
        try {
            return transactionTemplate.execute(status -> storeReport());
        } catch (RuntimeException e) {
            log.error("Aging report failed", e);
            AgingReportRun failed = new AgingReportRun(reference, ReportStatus.ERROR);
            failed.setError(StatementRunService.truncate(RetryClassifier.describe(e)));
            return runRepository.save(failed);
        }
    }

    private AgingReportRun storeReport() {
        InvoiceSnapshot snapshot = invoiceSourceService.loadCurrent();
        AgingResult result = invoiceAggregator.aggregate(snapshot.rows(), LocalDate.now(clock));

        AgingReportRun run = new AgingReportRun(snapshot.reference(), ReportStatus.SUCCESS);
        run.setUnresolvedCount(result.unresolvedCount());
        if (result.unresolvedCount() > 0) {
            run.setUnresolvedJson(toJson(
                result.unresolvedNames().stream().limit(UNRESOLVED_SAMPLE_SIZE).toList()));
        }
        run.setItemCount(result.recipients().size());
        run = runRepository.save(run);

        List<AgingReportItem> items = new ArrayList<>();
        for (RecipientAging aging : result.recipients()) {
            items.add(toItem(run.getId(), aging));
        }
        itemRepository.saveAll(items);

        log.info("Aging report {} over {}: {} recipient(s) with findings, {} unresolved name(s)",
            run.getId(), snapshot.filename(), items.size(), result.unresolvedCount());
        return run;
    }

    @Transactional(readOnly = true)
    public Optional<AgingReportRun> getLatest() {
        return runRepository.findTopByOrderByCreatedAtDescIdDesc();
    }

    @Transactional(readOnly = true)
    public Optional<AgingReportRun> getRun(Long runId) {
        return runRepository.findById(runId);
    }

    @Transactional(readOnly = true)
    public List<AgingReportRun> listRecent() {
        return runRepository.findTop20ByOrderByCreatedAtDesc();
    }

    /**
     * Items of a run, largest overdue amount first.
     */
    @Transactional(readOnly = true)
    public List<AgingReportItem> getItems(Long runId) {
        return itemRepository.findByRunIdOrderByOverdueAmountDesc(runId);
    }

    @Transactional(readOnly = true)
    public Optional<AgingReportItem> getItem(Long runId, Long recipientId) {
        return itemRepository.findByRunIdAndRecipientId(runId, recipientId);
    }

    public List<ListedInvoice> skippedInvoices(AgingReportItem item) {
        return fromJson(item.getSkippedInvoicesJson());
    }

    public List<ListedInvoice> shortPaidInvoices(AgingReportItem item) {
        return fromJson(item.getShortPaidInvoicesJson());
    }

    public List<String> unresolvedSample(AgingReportRun run) {
        if (run.getUnresolvedJson() == null || run.getUnresolvedJson().isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(run.getUnresolvedJson(), new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Unreadable unresolved list on report run {}: {}", run.getId(), e.getMessage());
            return List.of();
        }
    }

    // Helper methods

    private AgingReportItem toItem(Long runId, RecipientAging aging) {
        AgingReportItem item = new AgingReportItem(runId, aging.recipientId(), aging.recipientName(),
            aging.termsCode());
        item.setOverdueCount(aging.overdueCount());
        item.setOverdueAmount(aging.overdueAmount());
        item.setDaysOverdue(aging.daysOverdue());

        item.setSkippedCount(aging.skippedCount());
        if (aging.skippedCount() > 0) {
            List<Map<String, String>> skipped = new ArrayList<>();
            for (SkippedInvoice invoice : aging.skippedInvoices()) {
                skipped.add(listEntry(invoice.orderId(), invoice.shipDate(), invoice.location(), null));
            }
            item.setSkippedInvoicesJson(toJson(skipped));
        }

        item.setShortPaidCount(aging.shortPaidCount());
        item.setShortPaidAmount(aging.shortPaidAmount());
        if (aging.shortPaidCount() > 0) {
            List<Map<String, String>> shortPaid = new ArrayList<>();
            for (ShortPaidInvoice invoice : aging.shortPaidInvoices()) {
                shortPaid.add(listEntry(invoice.orderId(), invoice.shipDate(), invoice.location(),
                    invoice.amount().toPlainString()));
            }
            item.setShortPaidInvoicesJson(toJson(shortPaid));
        }
        return item;
    }

    private Map<String, String> listEntry(String orderId, LocalDate shipDate, String location, String amount) {
        Map<String, String> entry = new LinkedHashMap<>();
        entry.put("order_id", orderId);
        entry.put("ship_date", shipDate != null ? shipDate.format(LIST_DATE) : "");
        entry.put("location", location);
        if (amount != null) {
            entry.put("amount", amount);
        }
        return entry;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report data", e);
        }
    }

    private List<ListedInvoice> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<Map<String, String>> entries = objectMapper.readValue(json,
                new TypeReference<List<Map<String, String>>>() {});
            return entries.stream()
                .map(e -> new ListedInvoice(e.get("order_id"), e.get("ship_date"), e.get("location"),
                    e.get("amount")))
                .toList();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable invoice list on report item: {}", e.getMessage());
            return List.of();
        }
    }
}
