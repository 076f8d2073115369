package com.supplier.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId)) {
 *     log.info("run.started inputRows={}", rows);
 * }
 * </pre>
 *
 * <p>MDC is thread-local, so worker threads open their own context.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a whole resolution run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "run");
        return ctx;
    }

    /**
     * Context for resolving a single input row.
     */
    public static LogContext forRow(String runId, String rowKey) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("rowKey", rowKey != null ? rowKey : "");
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Context for loading input or reference files.
     */
    public static LogContext forImport(String source) {
        LogContext ctx = new LogContext();
        ctx.put("source", source);
        ctx.put("operation", "import");
        return ctx;
    }

    public static String generateRunId() {
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
