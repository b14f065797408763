package com.example.statements.domain;

import java.util.Locale;

/**
 * Payment terms assigned to a recipient. Fixed-day terms carry their day count; the
 * remaining codes derive the due date from the ship calendar or from sibling invoices.
 */
public enum TermsCode {

    NET_7("net_7", "Net 7", 7),
    NET_15("net_15", "Net 15", 15),
    NET_20("net_20", "Net 20", 20),
    NET_30("net_30", "Net 30", 30),
    NET_45("net_45", "Net 45", 45),
    COD("cod", "COD", 1),
    BILL_TO_BILL("bill_to_bill", "Bill to Bill", 0),
    MONTH_TO_MONTH("month_to_month", "Month to Month", 0),
    WEEK_TO_WEEK("week_to_week", "Week to Week", 0);

    public static final TermsCode DEFAULT = NET_30;

    private final String code;
    private final String label;
    private final int days;

    TermsCode(String code, String label, int days) {
        this.code = code;
        this.label = label;
        this.days = days;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Day offset for fixed-day terms, 0 for calendar or sequence based terms.
     */
    public int getDays() {
        return days;
    }

    public boolean isFixedDays() {
        return days > 0;
    }

    /**
     * Parses a terms code, label or common spelling ("Net 30", "net-30", "30", "C.O.D").
     *
     * @return the matching code, or {@code null} if the value is blank or unrecognised
     */
    public static TermsCode parse(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.isEmpty()) {
            return null;
        }
        if (v.matches("\\d+(\\.0+)?")) {
            v = "net_" + v.replaceAll("\\.0+$", "");
        }
        for (TermsCode terms : values()) {
            if (terms.code.equals(v) || terms.label.toLowerCase(Locale.ROOT).equals(v)) {
                return terms;
            }
        }

        String spaced = v.replace('_', ' ').replace('-', ' ').trim();
        for (TermsCode terms : values()) {
            if (terms.label.toLowerCase(Locale.ROOT).equals(spaced)) {
                return terms;
            }
        }

        if (spaced.startsWith("net")) {
            String digits = spaced.replaceAll("\\D", "");
            if (!digits.isEmpty()) {
                for (TermsCode terms : values()) {
                    if (terms.code.equals("net_" + digits)) {
                        return terms;
                    }
                }
            }
        }

        return switch (spaced) {
            case "cod", "c.o.d" -> COD;
            case "billtobill" -> BILL_TO_BILL;
            case "monthtomonth" -> MONTH_TO_MONTH;
            case "weektoweek" -> WEEK_TO_WEEK;
            default -> null;
        };
    }

    /**
     * Parses a terms value, falling back to {@link #DEFAULT} when blank.
     *
     * @throws IllegalArgumentException if a non-blank value is not a known terms code
     */
    public static TermsCode parseOrDefault(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        TermsCode terms = parse(value);
        if (terms == null) {
            throw new IllegalArgumentException("Unknown payment terms: " + value);
        }
        return terms;
    }

    public static TermsCode fromCode(String code) {
        for (TermsCode terms : values()) {
            if (terms.code.equals(code)) {
                return terms;
            }
        }
        throw new IllegalArgumentException("Unknown terms code: " + code);
    }
}
