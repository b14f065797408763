package com.example.statements.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TermsCodeTest {

    @Test
    void parse_CommonSpellings() {
        assertEquals(TermsCode.NET_30, TermsCode.parse("net_30"));
        assertEquals(TermsCode.NET_30, TermsCode.parse("Net 30"));
        assertEquals(TermsCode.NET_30, TermsCode.parse("NET-30"));
        assertEquals(TermsCode.NET_30, TermsCode.parse("net30"));
        assertEquals(TermsCode.NET_30, TermsCode.parse("30"));
        assertEquals(TermsCode.NET_15, TermsCode.parse("15.0"));
        assertEquals(TermsCode.COD, TermsCode.parse("C.O.D"));
        assertEquals(TermsCode.BILL_TO_BILL, TermsCode.parse("Bill to Bill"));
        assertEquals(TermsCode.BILL_TO_BILL, TermsCode.parse("billtobill"));
        assertEquals(TermsCode.WEEK_TO_WEEK, TermsCode.parse("week-to-week"));
    }

    @Test
    void parse_BlankOrUnknown_ReturnsNull() {
        assertNull(TermsCode.parse(null));
        assertNull(TermsCode.parse("  "));
        assertNull(TermsCode.parse("net 60"));
        assertNull(TermsCode.parse("whenever"));
    }

    @Test
    void parseOrDefault_Blank_ReturnsDefault() {
        assertEquals(TermsCode.NET_30, TermsCode.parseOrDefault(""));
        assertEquals(TermsCode.DEFAULT, TermsCode.parseOrDefault(null));
    }

    @Test
    void parseOrDefault_Unknown_Throws() {
        assertThrows(IllegalArgumentException.class, () -> TermsCode.parseOrDefault("net 60"));
    }

    @Test
    void fromCode_RoundTripsCodes() {
        for (TermsCode terms : TermsCode.values()) {
            assertEquals(terms, TermsCode.fromCode(terms.getCode()));
        }
    }
}
