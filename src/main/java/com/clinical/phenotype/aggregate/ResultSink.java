package com.clinical.phenotype.aggregate;

import com.clinical.phenotype.core.model.Value;

import java.util.List;
import java.util.Map;

/**
 * Receives phenotype membership records as a run completes. Called from the run's calling
 * thread, once per (final define, subject), in final-define order then subject order.
 */
@FunctionalInterface
public interface ResultSink {

    void publish(String phenotypeName, String finalDefineName, String subjectId, boolean membership,
                 Map<String, List<Value>> supportingValues);
}
