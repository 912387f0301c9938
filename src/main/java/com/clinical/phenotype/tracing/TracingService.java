package com.clinical.phenotype.tracing;

import java.util.Map;

/**
 * Tracing hook of the engine. {@link NoOpTracingService} is the default, so no tracing
 * library is needed at runtime unless one is configured.
 */
public interface TracingService {

    /** Span covering one whole phenotype run. */
    String RUN_SPAN = "phenotype.run";

    /** Span covering the execution of one define across all of its subjects. */
    String DEFINE_SPAN = "phenotype.define";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
