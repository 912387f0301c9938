package com.clinical.phenotype.tracing;

/**
 * A traced unit of engine work, ended on {@link #close()}.
 *
 * <pre>
 * try (Span span = tracing.startSpan(TracingService.DEFINE_SPAN, Map.of("define", name))) {
 *     span.setAttribute("units", units);
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    /**
     * Marks a point in time inside the span, e.g. a run state transition.
     */
    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
