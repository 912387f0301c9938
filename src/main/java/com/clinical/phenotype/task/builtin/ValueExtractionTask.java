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
import java.util.regex.Pattern;

/**
 * Reference task extracting numeric values that follow a term set term, e.g.
 * {@code "Gleason score of 7"} or {@code "LVEF: 35-40"}.
 *
 * <p>Terms are tried longest first and matched case-insensitively; a text span claimed by a
 * longer term is not matched again by a shorter one. Values outside
 * [{@code minimum_value}, {@code maximum_value}] are dropped. Each hit yields a structured value
 * with {@code term}, {@code value}, {@code condition}, {@code text}, {@code start} and {@code end};
 * for a range {@code value} is the lower bound and {@code upper} the higher.</p>
 */
public class ValueExtractionTask implements TaskExecutor {

    public static final String NAME = "ValueExtraction";

    public static final String MINIMUM_VALUE = "minimum_value";
    public static final String MAXIMUM_VALUE = "maximum_value";

    private static final TaskSignature SIGNATURE = TaskSignature.structured(Map.of(
            "term", ValueType.STRING,
            "value", ValueType.NUMERIC,
            "upper", ValueType.NUMERIC,
            "condition", ValueType.STRING,
            "text", ValueType.STRING,
            "start", ValueType.NUMERIC,
            "end", ValueType.NUMERIC));

    // up to eight filler words between the term and the value, shortest first
    private static final String FILLER = "(?:[-a-zA-Z.]+\\s+){0,8}?";
    private static final String NUMBER = "(?:\\d{1,3}(?:,\\d{3})+|\\d+(?:\\.\\d+)?|\\.\\d+)";
    private static final String OPERATOR = "(?<op>>=|<=|~=|[<>=~]|less\\s+than|greater\\s+than|"
            + "up\\s+to|under|above|over|exceeding|approx\\.?|approximately|about|is|of|was)?";
    private static final String VALUE = "(?:(?:between|from)\\s+)?(?<num1>" + NUMBER + ")"
            + "(?:\\s*(?:-|to|and)\\s*(?<num2>" + NUMBER + "))?";

    /**
     * Relation between the term and the value found after it.
     */
    public enum Condition {
        EQUAL, APPROX, LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL, RANGE;

        static Condition fromOperator(String operator) {
            if (operator == null) {
                return EQUAL;
            }
            String op = operator.toLowerCase().replaceAll("\\s+", " ");
            return switch (op) {
                case "<", "less than", "up to", "under" -> LESS_THAN;
                case "<=" -> LESS_THAN_OR_EQUAL;
                case ">", "greater than", "above", "over", "exceeding" -> GREATER_THAN;
                case ">=" -> GREATER_THAN_OR_EQUAL;
                case "~", "~=", "approx", "approx.", "approximately", "about" -> APPROX;
                default -> EQUAL;
            };
        }
    }

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
        double minimum = input.numberParameter(MINIMUM_VALUE).orElse(-Double.MAX_VALUE);
        double maximum = input.numberParameter(MAXIMUM_VALUE).orElse(Double.MAX_VALUE);
        if (minimum > maximum) {
            throw new IllegalArgumentException(
                    MINIMUM_VALUE + " " + minimum + " is greater than " + MAXIMUM_VALUE + " " + maximum);
        }

        List<ExecutionResult> results = new ArrayList<>();
        for (Document document : input.documents()) {
            String text = document.text();
            List<int[]> taken = new ArrayList<>();
            for (String term : terms) {
                Matcher matcher = valuePattern(term).matcher(text);
                while (matcher.find()) {
                    if (TextPatterns.overlaps(taken, matcher.start(), matcher.end())) {
                        continue;
                    }
                    Value hit = toValue(term, matcher, minimum, maximum);
                    if (hit == null) {
                        continue;
                    }
                    taken.add(new int[]{matcher.start(), matcher.end()});
                    results.add(ExecutionResult.ofDocument(document.subjectId(), document.documentId(), hit));
                }
            }
        }
        return results;
    }

    private static Value toValue(String term, Matcher matcher, double minimum, double maximum) {
        double first = parseNumber(matcher.group("num1"));
        String second = matcher.group("num2");
        Condition condition;
        double low;
        double high;
        if (second != null) {
            condition = Condition.RANGE;
            low = Math.min(first, parseNumber(second));
            high = Math.max(first, parseNumber(second));
        } else {
            condition = Condition.fromOperator(matcher.group("op"));
            low = first;
            high = first;
        }
        if (low < minimum || high > maximum) {
            return null;
        }
        Map<String, Value> fields = new LinkedHashMap<>();
        fields.put("term", Value.string(term));
        fields.put("value", Value.number(low));
        fields.put("upper", Value.number(high));
        fields.put("condition", Value.string(condition.name()));
        fields.put("text", Value.string(matcher.group()));
        fields.put("start", Value.number(matcher.start()));
        fields.put("end", Value.number(matcher.end()));
        return Value.structured(fields);
    }

    static Pattern valuePattern(String term) {
        String termRegex = TextPatterns.wholeWord(term).pattern();
        return Pattern.compile(termRegex + "[\\s:=]*" + FILLER + OPERATOR + "[\\s:=]*" + VALUE
                        + "(?![\\d.]*\\d)",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static double parseNumber(String text) {
        return Double.parseDouble(text.replace(",", ""));
    }
}
