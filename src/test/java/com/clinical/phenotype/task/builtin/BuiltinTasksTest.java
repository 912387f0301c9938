package com.clinical.phenotype.task.builtin;

import com.clinical.phenotype.collaborator.Document;
import com.clinical.phenotype.collaborator.DocumentHandle;
import com.clinical.phenotype.core.model.ContextType;
import com.clinical.phenotype.core.model.ExecutionResult;
import com.clinical.phenotype.core.model.Value;
import com.clinical.phenotype.task.TaskInput;
import com.clinical.phenotype.task.TaskRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinTasksTest {

    private static Document document(String id, String text) {
        return new Document(new DocumentHandle(id, "p1"), "Echo", text, Map.of());
    }

    private static TaskInput input(Set<String> terms, Map<String, Object> parameters, Document... documents) {
        return new TaskInput("Define", "p1", ContextType.PATIENT, parameters, Map.of("Terms", terms),
                List.of(documents), Map.of());
    }

    private static Value only(List<ExecutionResult> results) {
        assertEquals(1, results.size(), "results: " + results);
        return results.get(0).value();
    }

    @Test
    @DisplayName("Should register both tasks under the default catalog")
    void testRegistry() {
        TaskRegistry registry = BuiltinTasks.registry();
        assertEquals(Set.of(TermFinderTask.NAME, ValueExtractionTask.NAME), registry.taskNames(BuiltinTasks.CATALOG));
    }

    @Nested
    @DisplayName("TermFinder")
    class TermFinderTests {

        private final TermFinderTask task = new TermFinderTask();

        @Test
        @DisplayName("Should find whole-word hits, longest term first")
        void testHits() {
            List<ExecutionResult> results = task.execute(input(Set.of("EF", "ejection fraction"), Map.of(),
                    document("d1", "Reduced Ejection Fraction. EF low, see reference.")));

            assertEquals(2, results.size());
            Value first = results.get(0).value();
            assertEquals("ejection fraction", first.field("term").asString());
            assertEquals(8.0, first.field("start").asNumber());
            assertEquals(25.0, first.field("end").asNumber());
            assertEquals("Echo", first.field("report_type").asString());
            assertEquals("EF", results.get(1).value().field("term").asString());
            assertEquals("d1", results.get(0).documentId());
        }

        @Test
        @DisplayName("Should not report a shorter term inside a longer hit")
        void testOverlap() {
            List<ExecutionResult> results = task.execute(input(Set.of("heart", "heart failure"), Map.of(),
                    document("d1", "Known heart failure.")));
            assertEquals("heart failure", only(results).field("term").asString());
        }

        @Test
        @DisplayName("Should require terms")
        void testNoTerms() {
            assertThrows(IllegalArgumentException.class,
                    () -> task.execute(input(Set.of(), Map.of(), document("d1", "text"))));
        }
    }

    @Nested
    @DisplayName("ValueExtraction")
    class ValueExtractionTests {

        private final ValueExtractionTask task = new ValueExtractionTask();

        @Test
        @DisplayName("Should extract a plain value")
        void testEqual() {
            Value hit = only(task.execute(input(Set.of("LVEF"), Map.of(), document("d1", "LVEF is 35%."))));
            assertEquals(35.0, hit.field("value").asNumber());
            assertEquals("EQUAL", hit.field("condition").asString());
            assertEquals("LVEF", hit.field("term").asString());
        }

        @Test
        @DisplayName("Should read a comparison operator")
        void testLessThan() {
            Value hit = only(task.execute(input(Set.of("EF"), Map.of(), document("d1", "EF less than 40"))));
            assertEquals(40.0, hit.field("value").asNumber());
            assertEquals("LESS_THAN", hit.field("condition").asString());
        }

        @Test
        @DisplayName("Should read a range")
        void testRange() {
            Value hit = only(task.execute(input(Set.of("EF"), Map.of(), document("d1", "EF 25-30%"))));
            assertEquals(25.0, hit.field("value").asNumber());
            assertEquals(30.0, hit.field("upper").asNumber());
            assertEquals("RANGE", hit.field("condition").asString());
        }

        @Test
        @DisplayName("Should skip filler words between term and value")
        void testFiller() {
            Value hit = only(task.execute(input(Set.of("ejection fraction"), Map.of(),
                    document("d1", "Ejection fraction was estimated at 55 %"))));
            assertEquals(55.0, hit.field("value").asNumber());
        }

        @Test
        @DisplayName("Should drop values outside the configured bounds")
        void testBounds() {
            Value hit = only(task.execute(input(Set.of("EF"), Map.of(ValueExtractionTask.MAXIMUM_VALUE, 100.0),
                    document("d1", "EF 35. EF 150."))));
            assertEquals(35.0, hit.field("value").asNumber());
        }

        @Test
        @DisplayName("Should reject inverted bounds")
        void testInvertedBounds() {
            assertThrows(IllegalArgumentException.class, () -> task.execute(input(Set.of("EF"),
                    Map.of(ValueExtractionTask.MINIMUM_VALUE, 10, ValueExtractionTask.MAXIMUM_VALUE, "5"),
                    document("d1", "EF 35"))));
        }
    }
}
