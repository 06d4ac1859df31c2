package com.texture.dedup.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scoped MDC entries tagging a refinement run, one of its passes or a review step.
 * Closing the context removes exactly the keys it added, so a pass context nested in
 * a run context leaves {@code runId} and {@code dimension} in place.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRefinement(runId, "general")) {
 *     log.info("refinement.completed classes={}", classes);
 * }
 * </pre>
 *
 * <p>MDC is thread-local: entries are only visible on the thread that opened the
 * context, not on sweep worker threads.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a refinement run over one similarity dimension.
     */
    public static LogContext forRefinement(String runId, String dimension) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("dimension", dimension);
        ctx.put("operation", "refine");
        return ctx;
    }

    /**
     * Creates a log context for one refinement pass.
     */
    public static LogContext forPass(int pass) {
        LogContext ctx = new LogContext();
        ctx.put("pass", Integer.toString(pass));
        return ctx;
    }

    /**
     * Creates a log context for ledger reconciliation after review.
     */
    public static LogContext forReview(String runId, String dimension) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("dimension", dimension);
        ctx.put("operation", "review");
        return ctx;
    }

    /**
     * Random identifier grouping the log lines of one run.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
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
