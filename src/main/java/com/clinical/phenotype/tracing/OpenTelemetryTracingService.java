package com.clinical.phenotype.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * OpenTelemetry-backed {@link TracingService}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 * Attribute keys are prefixed with {@code phenotype.} so they group together in trace viewers.
 */
public class OpenTelemetryTracingService implements TracingService {

    private static final String ATTRIBUTE_PREFIX = "phenotype.";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName).setSpanKind(SpanKind.INTERNAL);
        if (attributes != null) {
            attributes.forEach((key, value) -> builder.setAttribute(ATTRIBUTE_PREFIX + key, value));
        }
        return new OTelSpanAdapter(builder.startSpan());
    }

    private static class OTelSpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;

        OTelSpanAdapter(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void setAttribute(String key, String value) {
            otelSpan.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            otelSpan.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void addEvent(String name) {
            otelSpan.addEvent(name);
        }

        @Override
        public void setStatus(SpanStatus status) {
            otelSpan.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            otelSpan.recordException(t);
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
