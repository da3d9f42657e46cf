/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.observability;

import java.util.List;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

import org.jboss.logging.MDC;

/**
 * MDC keys attached to flag evaluation, guard and reload logs.
 *
 * <p>
 * Request filters and the reload service populate these at the start of their work and call {@link #clearMDC()} when
 * done; the console log format in {@code application.properties} prints them. MDC is thread-local, so a value set on
 * one request thread never leaks into another.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";
    public static final String MDC_SPAN_ID = "span_id";
    public static final String MDC_USER_ID = "user_id";
    public static final String MDC_USER_GROUP = "user_group";

    /**
     * Flag (or comma-separated flags) a guarded request was admitted on.
     */
    public static final String MDC_FEATURE_FLAGS = "feature_flags";

    /**
     * HTTP path for requests, job name for scheduled reloads.
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private static final List<String> ALL_KEYS = List.of(MDC_TRACE_ID, MDC_SPAN_ID, MDC_USER_ID, MDC_USER_GROUP,
            MDC_FEATURE_FLAGS, MDC_REQUEST_ORIGIN);

    private LoggingConfig() {
    }

    /**
     * Copies trace and span ids of the active OpenTelemetry span into MDC (empty strings outside a span).
     */
    public static void enrichWithTraceContext() {
        SpanContext context = Span.current().getSpanContext();
        MDC.put(MDC_TRACE_ID, context.isValid() ? context.getTraceId() : "");
        MDC.put(MDC_SPAN_ID, context.isValid() ? context.getSpanId() : "");
    }

    /**
     * Records who is asking. Absent values leave their key unset.
     */
    public static void setCaller(String group, String userId) {
        putIfPresent(MDC_USER_GROUP, group);
        putIfPresent(MDC_USER_ID, userId);
    }

    public static void setFeatureFlags(String featureFlags) {
        putIfPresent(MDC_FEATURE_FLAGS, featureFlags);
    }

    public static void setRequestOrigin(String requestOrigin) {
        putIfPresent(MDC_REQUEST_ORIGIN, requestOrigin);
    }

    /**
     * Removes every key this class manages.
     */
    public static void clearMDC() {
        ALL_KEYS.forEach(MDC::remove);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null && !value.isEmpty()) {
            MDC.put(key, value);
        }
    }
}
