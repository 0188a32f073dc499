package com.dorkroom.catalog.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSearch("FILM", "fuzzy")) {
 *     log.debug("catalog.search query='{}' results={}", query, results.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a full catalog load.
     */
    public static LogContext forLoad(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "load");
        return ctx;
    }

    /**
     * Creates a log context for a search over one collection.
     */
    public static LogContext forSearch(String kind, String searchType) {
        LogContext ctx = new LogContext();
        ctx.put("recordKind", kind);
        ctx.put("searchType", searchType);
        ctx.put("operation", "search");
        return ctx;
    }

    /**
     * Creates a log context for adding a record.
     */
    public static LogContext forCreate(String correlationId, String kind, String recordId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("recordKind", kind);
        ctx.put("recordId", recordId);
        ctx.put("operation", "create");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
