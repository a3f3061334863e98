/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.observability;

import org.jboss.logging.MDC;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

/**
 * Standard MDC field names and helpers for enriching log entries with observability context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code request_origin} - HTTP request path or job type identifier</li>
 * <li>{@code job_id} - Delayed job identifier (only for async job execution)</li>
 * <li>{@code alert_id} - Alert record being ingested or purged</li>
 * <li>{@code phenomenon} - Hazard category of the bucket being touched</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Job Handlers:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(jobId);
 * LoggingConfig.setRequestOrigin("JobType." + jobType.name());
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Each request/job execution
 * should clear MDC at the end of processing to prevent context leakage.
 */
public final class LoggingConfig {

    /**
     * OpenTelemetry trace identifier (hexadecimal string, 32 characters).
     */
    public static final String MDC_TRACE_ID = "trace_id";

    /**
     * OpenTelemetry span identifier (hexadecimal string, 16 characters).
     */
    public static final String MDC_SPAN_ID = "span_id";

    /**
     * HTTP request path (e.g., "/api/aggregation/cleanup") or job type identifier (e.g., "JobType.RETENTION_SWEEP").
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    /**
     * Delayed job identifier (Long as String). Only present for async job execution logs.
     */
    public static final String MDC_JOB_ID = "job_id";

    /**
     * Alert record identifier (the submitted form id).
     */
    public static final String MDC_ALERT_ID = "alert_id";

    /**
     * Hazard category, e.g. "FLOOD".
     */
    public static final String MDC_PHENOMENON = "phenomenon";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. If no span is active the fields are
     * set to empty strings to keep the log structure consistent.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * Sets the request origin (HTTP path or job type identifier).
     *
     * @param requestOrigin
     *            path like "/api/aggregation" or "JobType.ALERT_AGGREGATION"
     */
    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Sets the delayed job ID for async job execution logs.
     *
     * @param jobId
     *            delayed job identifier
     */
    public static void setJobId(Long jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    /**
     * Sets the alert and phenomenon being processed.
     *
     * @param alertId
     *            alert record id, ignored when null
     * @param phenomenon
     *            hazard category, ignored when null
     */
    public static void setAlertContext(String alertId, String phenomenon) {
        if (alertId != null) {
            MDC.put(MDC_ALERT_ID, alertId);
        }
        if (phenomenon != null) {
            MDC.put(MDC_PHENOMENON, phenomenon);
        }
    }

    /**
     * Removes the per-alert fields while leaving job and trace context in place.
     */
    public static void clearAlertContext() {
        MDC.remove(MDC_ALERT_ID);
        MDC.remove(MDC_PHENOMENON);
    }

    /**
     * Clears all observability-related MDC fields. Should be called at the end of every request/job.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
        MDC.remove(MDC_JOB_ID);
        clearAlertContext();
    }
}
