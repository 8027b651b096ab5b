package com.taskrelay.engine.logging;

import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures dispatch and worker logs carry the ids needed to follow one task.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(projectId, taskId)) {
 *     log.info("Launching worker"); // Automatically includes projectId, taskId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [relay-dispatch] INFO  c.t.d.DispatchLoop - Launching worker
 *   projectId=6f1c... taskId=9a2e... runId=41b7... traceId=3c9d1f20
 */
public final class LoggingContext implements AutoCloseable {

    public static final String PROJECT_ID = "projectId";
    public static final String TASK_ID = "taskId";
    public static final String RUN_ID = "runId";
    public static final String EVENT_ID = "eventId";
    public static final String EVENT_TYPE = "eventType";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for task-level operations.
     */
    public static LoggingContext forTask(UUID projectId, UUID taskId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(PROJECT_ID, projectId);
        putIfPresent(TASK_ID, taskId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one worker run.
     */
    public static LoggingContext forRun(UUID projectId, UUID taskId, UUID runId) {
        LoggingContext ctx = forTask(projectId, taskId);
        putIfPresent(RUN_ID, runId);
        return ctx;
    }

    /**
     * Create a logging context for processing one outbox event.
     */
    public static LoggingContext forEvent(UUID eventId, String eventType, UUID projectId, UUID taskId) {
        LoggingContext ctx = forTask(projectId, taskId);
        putIfPresent(EVENT_ID, eventId);
        if (eventType != null) {
            MDC.put(EVENT_TYPE, eventType);
        }
        return ctx;
    }

    /**
     * Add the run id to the current context.
     */
    public static void setRunId(UUID runId) {
        putIfPresent(RUN_ID, runId);
    }

    /**
     * Get current task ID from context.
     */
    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, UUID value) {
        if (value != null) {
            MDC.put(key, value.toString());
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(PROJECT_ID);
        MDC.remove(TASK_ID);
        MDC.remove(RUN_ID);
        MDC.remove(EVENT_ID);
        MDC.remove(EVENT_TYPE);
        // Keep TRACE_ID for the rest of the cycle
    }

    /**
     * Clear all MDC context. Call at the end of a poll cycle or worker thread.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
