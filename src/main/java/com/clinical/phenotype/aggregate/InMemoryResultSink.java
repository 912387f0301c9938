package com.clinical.phenotype.aggregate;

import com.clinical.phenotype.core.model.Value;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sink that keeps every published record in memory, for tests and the command line.
 */
public class InMemoryResultSink implements ResultSink {

    private final List<PhenotypeMembership> records = new CopyOnWriteArrayList<>();

    @Override
    public void publish(String phenotypeName, String finalDefineName, String subjectId, boolean membership,
                        Map<String, List<Value>> supportingValues) {
        records.add(new PhenotypeMembership(phenotypeName, finalDefineName, subjectId, membership, supportingValues));
    }

    public List<PhenotypeMembership> records() {
        return List.copyOf(records);
    }

    public List<PhenotypeMembership> recordsFor(String finalDefine) {
        return records.stream().filter(r -> r.finalDefine().equals(finalDefine)).toList();
    }

    public void clear() {
        records.clear();
    }
}
