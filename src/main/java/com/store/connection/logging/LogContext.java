package com.store.connection.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for store operation logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forOperation("conversation.append")) {
 *     log.warn("Store unavailable, using fallback");
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String STORE_OPERATION = "storeOperation";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for one call through the connection manager. Keeps an enclosing
     * correlation id if the caller already set one.
     */
    public static LogContext forOperation(String operationName) {
        LogContext ctx = new LogContext();
        if (MDC.get(CORRELATION_ID) == null) {
            ctx.put(CORRELATION_ID, generateCorrelationId());
        }
        ctx.put(STORE_OPERATION, operationName);
        ctx.put(OPERATION, "store");
        return ctx;
    }

    /**
     * Context for a background or on-demand health probe.
     */
    public static LogContext forHealthCheck() {
        LogContext ctx = new LogContext();
        ctx.put(OPERATION, "health-check");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

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
