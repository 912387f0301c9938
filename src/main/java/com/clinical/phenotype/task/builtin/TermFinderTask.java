package com.clinical.phenotype.task.builtin;

import com.clinical.phenotype.collaborator.Document;
import com.clinical.phenotype.core.model.ExecutionResult;
import com.clinical.phenotype.core.model.Value;
import com.clinical.phenotype.core.model.ValueType;
import com.clinical.phenotype.task.TaskExecutor;
import com.clinical.phenotype.task.TaskInput;
import com.clinical.phenotype.task.TaskSignature;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Reference task reporting every whole-word, case-insensitive occurrence of a term set term.
 * One structured result per hit: {@code term}, {@code start}, {@code end}, {@code report_type}.
 */
public class TermFinderTask implements TaskExecutor {

    public static final String NAME = "TermFinder";

    private static final TaskSignature SIGNATURE = TaskSignature.structured(Map.of(
            "term", ValueType.STRING,
            "start", ValueType.NUMERIC,
            "end", ValueType.NUMERIC,
            "report_type", ValueType.STRING));

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public TaskSignature getSignature() {
        return SIGNATURE;
    }

    @Override
    public List<ExecutionResult> execute(TaskInput input) {
        List<String> terms = new ArrayList<>(input.terms());
        if (terms.isEmpty()) {
            throw new IllegalArgumentException(NAME + " requires at least one termset term");
        }
        terms.sort(Comparator.comparingInt(String::length).reversed());

        List<ExecutionResult> results = new ArrayList<>();
        for (Document document : input.documents()) {
            List<int[]> taken = new ArrayList<>();
            for (String term : terms) {
                Matcher matcher = TextPatterns.wholeWord(term).matcher(document.text());
                while (matcher.find()) {
                    if (TextPatterns.overlaps(taken, matcher.start(), matcher.end())) {
                        continue;
                    }
                    taken.add(new int[]{matcher.start(), matcher.end()});
                    Map<String, Value> fields = new LinkedHashMap<>();
                    fields.put("term", Value.string(term));
                    fields.put("start", Value.number(matcher.start()));
                    fields.put("end", Value.number(matcher.end()));
                    fields.put("report_type", document.reportType() != null
                            ? Value.string(document.reportType()) : Value.absent());
                    results.add(ExecutionResult.ofDocument(document.subjectId(), document.documentId(),
                            Value.structured(fields)));
                }
            }
        }
        return results;
    }
}
