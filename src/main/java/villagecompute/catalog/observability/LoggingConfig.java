/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * MDC keys read by the console log format in {@code application.yaml}, plus setters for them.
 *
 * <p>
 * <b>Keys:</b>
 * <ul>
 * <li>{@code trace_id} / {@code span_id} - current OpenTelemetry span, empty when tracing is off</li>
 * <li>{@code request_origin} - {@code JobType.X} for jobs, {@code ProductImport} for CSV runs</li>
 * <li>{@code job_id} - {@code delayed_jobs.id} of the running job</li>
 * <li>{@code upload_id} - upload being chunked or processed</li>
 * </ul>
 *
 * <p>
 * MDC is thread-local and scheduler and worker threads are pooled, so every caller that sets a key calls
 * {@link #clearMDC()} in a {@code finally} block.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_UPLOAD_ID = "upload_id";

    private LoggingConfig() {
    }

    /**
     * Copies the current span's trace and span ids into the MDC.
     */
    public static void enrichWithTraceContext() {
        SpanContext context = Span.current().getSpanContext();
        MDC.put(MDC_TRACE_ID, context.isValid() ? context.getTraceId() : "");
        MDC.put(MDC_SPAN_ID, context.isValid() ? context.getSpanId() : "");
    }

    public static void setRequestOrigin(String requestOrigin) {
        putIfPresent(MDC_REQUEST_ORIGIN, requestOrigin);
    }

    public static void setJobId(Long jobId) {
        putIfPresent(MDC_JOB_ID, jobId);
    }

    public static void setUploadId(Long uploadId) {
        putIfPresent(MDC_UPLOAD_ID, uploadId);
    }

    /**
     * Removes every key this class sets.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_UPLOAD_ID);
    }

    private static void putIfPresent(String key, Object value) {
        if (value != null) {
            MDC.put(key, value.toString());
        }
    }
}
