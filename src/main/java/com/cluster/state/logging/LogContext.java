package com.cluster.state.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forTransaction("destroy unit wordpress/0")) {
 *     log.debug("txn.aborted attempt={}", attempt);
 * } // MDC entries are cleared here
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one transaction run.
     */
    public static LogContext forTransaction(String operation) {
        LogContext ctx = new LogContext();
        ctx.put("txnId", generateCorrelationId());
        ctx.put("txnOperation", operation);
        return ctx;
    }

    /**
     * Creates a log context for a unit assignment.
     */
    public static LogContext forAssignment(String unitName, String policy) {
        LogContext ctx = new LogContext();
        ctx.put("unit", unitName);
        ctx.put("assignmentPolicy", policy);
        return ctx;
    }

    /**
     * Creates a log context for a cleanup pass.
     */
    public static LogContext forCleanup(String cleanupId) {
        LogContext ctx = new LogContext();
        ctx.put("cleanupId", cleanupId);
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
