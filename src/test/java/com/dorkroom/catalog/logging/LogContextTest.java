package com.dorkroom.catalog.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forLoad should set correlationId and operation in MDC")
    void forLoadSetsMDC() {
        try (LogContext ctx = LogContext.forLoad("corr-1")) {
            assertEquals("corr-1", MDC.get("correlationId"));
            assertEquals("load", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forSearch should set recordKind, searchType and operation in MDC")
    void forSearchSetsMDC() {
        try (LogContext ctx = LogContext.forSearch("FILM", "FUZZY")) {
            assertEquals("FILM", MDC.get("recordKind"));
            assertEquals("FUZZY", MDC.get("searchType"));
            assertEquals("search", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forCreate should set correlationId, recordKind, recordId and operation in MDC")
    void forCreateSetsMDC() {
        try (LogContext ctx = LogContext.forCreate("corr-2", "COMBINATION", "combo-9")) {
            assertEquals("corr-2", MDC.get("correlationId"));
            assertEquals("COMBINATION", MDC.get("recordKind"));
            assertEquals("combo-9", MDC.get("recordId"));
            assertEquals("create", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("close should remove every key it added")
    void closeRemovesKeys() {
        try (LogContext ctx = LogContext.forLoad("corr-3").with("source", "film_stocks.json")) {
            assertEquals("film_stocks.json", MDC.get("source"));
        }
        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("source"));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique values")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
