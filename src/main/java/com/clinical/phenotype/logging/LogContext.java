package com.clinical.phenotype.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Worker threads do not inherit the caller's MDC, so every unit of work opens its own
 * context:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forUnit(runId, "GleasonScore", "patient-17")) {
 *     log.debug("task.dispatched task={}", taskName);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String PHENOTYPE = "phenotype";
    public static final String DEFINE = "define";
    public static final String SUBJECT = "subject";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId, String phenotype) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(PHENOTYPE, phenotype);
        return ctx;
    }

    public static LogContext forDefine(String runId, String define) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(DEFINE, define);
        return ctx;
    }

    public static LogContext forUnit(String runId, String define, String subject) {
        return forDefine(runId, define).with(SUBJECT, subject);
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
