package com.example.statements.service;

import com.example.statements.domain.Recipient;
import com.example.statements.domain.Recipient.Kind;
import com.example.statements.domain.RecipientAlias;
import com.example.statements.domain.TermsCode;
import com.example.statements.repository.RecipientAliasRepository;
import com.example.statements.repository.RecipientRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Service for importing recipients and customer-name aliases from CSV files.
 *
 * Recipients: group_name and email_to are required; terms, location, frequency,
 * day_of_week, day_of_month and active are optional. Rows are upserted by name.
 *
 * Aliases: customer_name plus either recipient_id or group_name. An existing alias of the
 * same customer name is reassigned.
 */
@Service
@Transactional
public class RecipientImportService {

    private static final Logger log = LoggerFactory.getLogger(RecipientImportService.class);

    private final RecipientRepository recipientRepository;
    private final RecipientAliasRepository aliasRepository;

    public RecipientImportService(RecipientRepository recipientRepository,
                                  RecipientAliasRepository aliasRepository) {
        this.recipientRepository = recipientRepository;
        this.aliasRepository = aliasRepository;
    }

    /**
     * Result of a CSV import operation.
     */
    public record ImportResult(
        boolean success,
        int imported,
        int updated,
        int skipped,
        List<String> errors,
        List<String> warnings
    ) {
        public static ImportResult success(int imported, int updated, int skipped, List<String> warnings) {
            return new ImportResult(true, imported, updated, skipped, List.of(), warnings);
        }

        public static ImportResult failure(List<String> errors) {
            return new ImportResult(false, 0, 0, 0, errors, List.of());
        }
    }

    private enum RowAction { IMPORTED, UPDATED, SKIPPED }

    private record ProcessRowResult(RowAction action, String message) {}

    @FunctionalInterface
    private interface RowProcessor {
        ProcessRowResult process(String[] values, Map<String, Integer> columnMap, int lineNumber);
    }

    /**
     * Imports recipients, creating new ones and updating existing ones by name.
     */
    public ImportResult importRecipients(InputStream csvStream) throws IOException {
        ImportResult result = processImport(csvStream, List.of("groupname", "emailto"),
            new String[][]{{"groupname", "group", "customergroup"}, {"emailto", "email", "emails", "emailaddress"}},
            this::processRecipientRow);
        log.info("Recipient import: {} new, {} updated, {} skipped", result.imported(), result.updated(),
            result.skipped());
        return result;
    }

    /**
     * Imports customer-name aliases. Rows naming an unknown group are skipped and listed as warnings.
     */
    public ImportResult importAliases(InputStream csvStream) throws IOException {
        TreeSet<String> missingGroups = new TreeSet<>();
        ImportResult result = processImport(csvStream, List.of("customername"),
            new String[][]{{"customername", "customer"}},
            (values, columnMap, lineNumber) -> processAliasRow(values, columnMap, lineNumber, missingGroups));
        if (missingGroups.isEmpty()) {
            return result;
        }
        List<String> warnings = new ArrayList<>(result.warnings());
        warnings.add("Unknown groups: " + String.join(", ", missingGroups));
        return new ImportResult(result.success(), result.imported(), result.updated(), result.skipped(),
            result.errors(), warnings);
    }

    private ImportResult processImport(InputStream csvStream, List<String> required, String[][] synonyms,
                                       RowProcessor processor) throws IOException {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int imported = 0;
        int updated = 0;
        int skipped = 0;

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(csvStream, StandardCharsets.UTF_8))) {

            // Read header line
            String headerLine = reader.readLine();
            if (headerLine == null || headerLine.isBlank()) {
                return ImportResult.failure(List.of("CSV file is empty or has no header"));
            }
            if (headerLine.startsWith("\uFEFF")) {
                headerLine = headerLine.substring(1);
            }

            Map<String, Integer> columnMap = buildColumnMap(InvoiceFileReader.parseCsvLine(headerLine), synonyms);

            for (String column : required) {
                if (!columnMap.containsKey(column)) {
                    errors.add("Required column '" + column + "' not found in CSV header");
                }
            }
            if (!errors.isEmpty()) {
                return ImportResult.failure(errors);
            }

            // Process data rows
            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }

                try {
                    ProcessRowResult result = processor.process(InvoiceFileReader.parseCsvLine(line), columnMap,
                        lineNumber);
                    switch (result.action) {
                        case IMPORTED -> imported++;
                        case UPDATED -> updated++;
                        case SKIPPED -> {
                            skipped++;
                            if (result.message != null) {
                                warnings.add(result.message);
                            }
                        }
                    }
                } catch (RuntimeException e) {
                    errors.add("Line " + lineNumber + ": " + e.getMessage());
                    skipped++;
                }
            }
        }

        if (!errors.isEmpty() && imported == 0 && updated == 0) {
            return ImportResult.failure(errors);
        }
        if (!errors.isEmpty()) {
            warnings.addAll(errors);
        }
        return ImportResult.success(imported, updated, skipped, warnings);
    }

    private ProcessRowResult processRecipientRow(String[] values, Map<String, Integer> columnMap, int lineNumber) {
        String name = getColumnValue(values, columnMap, "groupname");
        String emails = RecipientService.normalizeEmails(getColumnValue(values, columnMap, "emailto"));
        if (name == null || emails == null) {
            return new ProcessRowResult(RowAction.SKIPPED,
                "Line " + lineNumber + ": Missing group name or email");
        }

        String termsValue = firstValue(values, columnMap, "terms", "termscode", "paymentterms");
        TermsCode terms = TermsCode.parse(termsValue);
        if (terms == null) {
            terms = Optional.ofNullable(TermsCode.parse(firstValue(values, columnMap, "netterms", "termsdays", "netdays")))
                .orElse(TermsCode.DEFAULT);
        }

        Optional<Recipient> existing = recipientRepository.findByName(name);
        Recipient recipient = existing.orElseGet(() -> new Recipient(name, Kind.SINGLE, null, TermsCode.DEFAULT));
        recipient.setEmailTo(emails);
        recipient.setTermsCode(terms);
        recipient.setLocation(getColumnValue(values, columnMap, "location"));
        recipient.setFrequency(RecipientService.parseFrequency(getColumnValue(values, columnMap, "frequency")));
        recipient.setDayOfWeek(RecipientService.clamp(
            parseInt(firstValue(values, columnMap, "dayofweek", "weekday")), 0, 0, 6));
        recipient.setDayOfMonth(RecipientService.clamp(
            parseInt(getColumnValue(values, columnMap, "dayofmonth")), 1, 1, 28));
        recipient.setActive(parseBool(firstValue(values, columnMap, "active", "enabled"), true));
        recipientRepository.save(recipient);

        return new ProcessRowResult(existing.isPresent() ? RowAction.UPDATED : RowAction.IMPORTED, null);
    }

    private ProcessRowResult processAliasRow(String[] values, Map<String, Integer> columnMap, int lineNumber,
                                             TreeSet<String> missingGroups) {
        String customerName = getColumnValue(values, columnMap, "customername");
        if (customerName == null) {
            return new ProcessRowResult(RowAction.SKIPPED, null);
        }

        Recipient recipient;
        Integer recipientId = parseInt(getColumnValue(values, columnMap, "recipientid"));
        if (recipientId != null) {
            recipient = recipientRepository.findById(recipientId.longValue()).orElse(null);
            if (recipient == null) {
                return new ProcessRowResult(RowAction.SKIPPED,
                    "Line " + lineNumber + ": Recipient " + recipientId + " not found");
            }
        } else {
            String groupName = firstValue(values, columnMap, "groupname", "group");
            if (groupName == null) {
                return new ProcessRowResult(RowAction.SKIPPED,
                    "Line " + lineNumber + ": Missing recipient_id or group_name");
            }
            recipient = recipientRepository.findByName(groupName).orElse(null);
            if (recipient == null) {
                missingGroups.add(groupName);
                return new ProcessRowResult(RowAction.SKIPPED, null);
            }
        }

        Optional<RecipientAlias> existing = aliasRepository.findByCustomerName(customerName);
        RecipientAlias alias = existing.orElseGet(() -> new RecipientAlias(customerName, recipient));
        alias.setRecipient(recipient);
        aliasRepository.save(alias);
        return new ProcessRowResult(existing.isPresent() ? RowAction.UPDATED : RowAction.IMPORTED, null);
    }

    // Helper methods

    /**
     * Maps normalized header names to column indexes. Synonyms map onto the first name of
     * their group unless that name is present itself.
     */
    private Map<String, Integer> buildColumnMap(String[] headers, String[][] synonyms) {
        Map<String, Integer> map = new HashMap<>();
        for (int i = 0; i < headers.length; i++) {
            String header = headers[i].toLowerCase(Locale.ROOT).trim()
                .replace(" ", "")
                .replace("_", "")
                .replace("-", "");
            map.putIfAbsent(header, i);
        }
        for (String[] group : synonyms) {
            for (String synonym : group) {
                if (map.containsKey(synonym)) {
                    map.putIfAbsent(group[0], map.get(synonym));
                    break;
                }
            }
        }
        return map;
    }

    private String getColumnValue(String[] values, Map<String, Integer> columnMap, String column) {
        Integer index = columnMap.get(column);
        if (index == null || index >= values.length) {
            return null;
        }
        String value = values[index];
        return value == null || value.isBlank() ? null : value.trim();
    }

    private String firstValue(String[] values, Map<String, Integer> columnMap, String... columns) {
        for (String column : columns) {
            String value = getColumnValue(values, columnMap, column);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private Integer parseInt(String value) {
        if (value == null) {
            return null;
        }
        try {
            return (int) Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private boolean parseBool(String value, boolean fallback) {
        if (value == null) {
            return fallback;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "y", "on" -> true;
            case "0", "false", "no", "n", "off" -> false;
            default -> fallback;
        };
    }

    /**
     * Returns sample CSV content for the recipient import.
     */
    public String getSampleRecipientCsv() {
        return """
            group_name,email_to,terms,location,frequency,day_of_week,day_of_month,active
            Acme Stores,ap@acme.example,net_30,,weekly,0,1,true
            Harbor Foods,billing@harbor.example;owner@harbor.example,bill_to_bill,Main St,monthly,0,15,true
            """;
    }
}
