package com.clinical.phenotype.aggregate;

import com.clinical.phenotype.core.model.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Membership of one subject in one final define, with the intermediate values that led to it.
 *
 * @param phenotype        phenotype name
 * @param finalDefine      final define this record reports
 * @param subjectId        patient id, or document id in document context
 * @param qualifies        whether the subject satisfies the final define
 * @param supportingValues values of the final define's dependencies for this subject, by define
 *                         name in execution order
 */
public record PhenotypeMembership(String phenotype, String finalDefine, String subjectId, boolean qualifies,
                                  Map<String, List<Value>> supportingValues) {

    public PhenotypeMembership {
        Objects.requireNonNull(phenotype, "phenotype");
        Objects.requireNonNull(finalDefine, "finalDefine");
        Objects.requireNonNull(subjectId, "subjectId");
        Map<String, List<Value>> copy = new LinkedHashMap<>();
        supportingValues.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        supportingValues = Collections.unmodifiableMap(copy);
    }

    /**
     * Plain Java form for JSON output.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("phenotype", phenotype);
        map.put("finalDefine", finalDefine);
        map.put("subject", subjectId);
        map.put("qualifies", qualifies);
        Map<String, Object> supporting = new LinkedHashMap<>();
        supportingValues.forEach((k, v) -> supporting.put(k, v.stream().map(Value::toJava).toList()));
        map.put("supportingValues", supporting);
        return map;
    }
}
