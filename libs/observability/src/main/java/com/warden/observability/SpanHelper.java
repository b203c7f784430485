package com.warden.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags every span with the current
 * {@link CorrelationContext}.
 * <p>
 * Does not configure the SDK; without one the global tracer is a no-op.
 */
public final class SpanHelper {

    /** Span attribute carrying the correlation id. */
    public static final String ATTR_CORRELATION_ID = "correlation.id";

    /** Span attribute carrying the attested process id. */
    public static final String ATTR_PID = "process.pid";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new span. A runtime exception marks the span as failed, is
     * recorded on it and is rethrown unchanged.
     *
     * @param spanName   span name, e.g. {@code WorkloadAttestor/Attest}
     * @param kind       span kind
     * @param attributes extra string attributes
     * @param work       the traced work
     */
    public <T> T inSpan(String spanName, SpanKind kind, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.pid() != null) {
                span.setAttribute(ATTR_PID, ctx.pid());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** {@link #inSpan(String, SpanKind, Map, Supplier)} as an internal span without attributes. */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, SpanKind.INTERNAL, Map.of(), work);
    }
}
