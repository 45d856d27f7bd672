package com.fincept.workflow_nodes.executor;

import com.fincept.workflow_nodes.exception.NodeConfigurationException;
import com.fincept.workflow_nodes.executor.param.ParameterAccessor;
import com.fincept.workflow_nodes.model.record.DataRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.fincept.workflow_nodes.Records.EVALUATOR;
import static com.fincept.workflow_nodes.Records.PARAMETER_READER;
import static com.fincept.workflow_nodes.Records.condition;
import static com.fincept.workflow_nodes.Records.config;
import static com.fincept.workflow_nodes.Records.list;
import static com.fincept.workflow_nodes.Records.params;
import static com.fincept.workflow_nodes.Records.rec;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FilterExecutorTest {

    private final FilterExecutor filter = new FilterExecutor(EVALUATOR, PARAMETER_READER);

    private final List<DataRecord> quotes = list(
            rec("sym", "AAPL", "p", 10, "sector", "tech"),
            rec("sym", "JPM", "p", 20, "sector", "bank"),
            rec("sym", "MSFT", "p", 5, "sector", "tech"),
            rec("sym", "XOM", "p", "n/a", "sector", "energy"));

    private List<DataRecord> run(List<DataRecord> items, Map<String, Object> cfg) {
        List<List<DataRecord>> out = filter.execute(List.of(items), params(cfg, items));
        assertEquals(1, out.size());
        return out.get(0);
    }

    @Test
    void shouldKeepRecordsAboveThreshold() {
        List<DataRecord> items = list(rec("p", 10), rec("p", 20), rec("p", 5));
        List<DataRecord> kept = run(items, config(
                "operation", "keep",
                "combineOperation", "and",
                "conditions", List.of(condition("p", "greaterThan", "8"))));

        assertEquals(list(rec("p", 10), rec("p", 20)), kept);
    }

    @Test
    void shouldCombineConditionsWithAndOr() {
        Object conditions = List.of(condition("sector", "equal", "tech"), condition("p", "greaterThan", 8));

        assertEquals(list(quotes.get(0)),
                run(quotes, config("combineOperation", "and", "conditions", conditions)));
        assertEquals(list(quotes.get(0), quotes.get(1), quotes.get(2)),
                run(quotes, config("combineOperation", "or", "conditions", conditions)));
    }

    @Test
    void shouldApplyQuantifierSemanticsToEmptyConditionList() {
        assertEquals(quotes, run(quotes, config("combineOperation", "and", "conditions", List.of())));
        assertTrue(run(quotes, config("combineOperation", "or", "conditions", List.of())).isEmpty());
        // no conditions parameter at all behaves the same
        assertEquals(quotes, run(quotes, config()));
        assertEquals(quotes, run(quotes, config("operation", "remove", "combineOperation", "or")));
    }

    @Test
    void shouldPartitionInputBetweenKeepAndRemove() {
        for (String combine : List.of("and", "or")) {
            Object conditions = List.of(condition("sector", "equal", "tech"), condition("p", "lessThan", 15));
            List<DataRecord> kept    = run(quotes, config("operation", "keep",   "combineOperation", combine, "conditions", conditions));
            List<DataRecord> removed = run(quotes, config("operation", "remove", "combineOperation", combine, "conditions", conditions));

            assertEquals(quotes.size(), kept.size() + removed.size(), combine);
            for (DataRecord r : kept) assertTrue(!removed.contains(r), combine + ": " + r + " in both");

            // both are subsequences of the input in original order
            assertEquals(kept, quotes.stream().filter(kept::contains).toList());
            assertEquals(removed, quotes.stream().filter(removed::contains).toList());
        }
    }

    @Test
    void shouldBeIdempotentForKeep() {
        Map<String, Object> cfg = config("conditions", List.of(condition("sym", "contains", "a")));
        List<DataRecord> once = run(quotes, cfg);
        List<DataRecord> twice = run(once, cfg);
        assertEquals(once, twice);
    }

    @Test
    void shouldTreatMalformedConditionsAsNotMatching() {
        Map<String, Object> cfg = config("conditions", List.of(
                condition("p", "greaterThan", "8"),
                condition("p", "between", "1")));
        assertTrue(run(quotes, cfg).isEmpty());
        assertEquals(quotes, run(quotes, config("operation", "remove", "conditions", cfg.get("conditions"))));
    }

    @Test
    void shouldFailOnlyTheRecordWhoseConditionValueIsNested() {
        List<DataRecord> items = list(rec("p", 10, "min", 5), rec("p", 10, "min", Map.of("a", 1)), rec("p", 10, "min", List.of(1)));
        Map<String, Object> cfg = config("conditions", List.of(condition("p", "greaterThan", "{{$json.min}}")));

        assertEquals(list(items.get(0)), run(items, cfg));
        assertEquals(list(items.get(1), items.get(2)), run(items, config("operation", "remove", "conditions", cfg.get("conditions"))));
    }

    @Test
    void shouldCompareNestedConditionValueByItsJsonText() {
        List<DataRecord> items = list(rec("tag", "{\"a\":1}", "ref", Map.of("a", 1)), rec("tag", "x", "ref", Map.of("a", 1)));
        List<DataRecord> kept = run(items, config("conditions", List.of(condition("tag", "equal", "{{$json.ref}}"))));
        assertEquals(list(items.get(0)), kept);
    }

    @Test
    void shouldResolveConditionsForEveryRecordIndex() {
        List<DataRecord> items = list(rec("qty", 5, "min", 3), rec("qty", 5, "min", 9), rec("qty", 7, "min", 6));
        List<DataRecord> kept = run(items, config("conditions",
                List.of(condition("qty", "greaterThan", "{{$json.min}}"))));
        assertEquals(list(items.get(0), items.get(2)), kept);

        List<Integer> requested = new ArrayList<>();
        ParameterAccessor recording = (name, index) -> {
            if ("conditions".equals(name)) {
                requested.add(index);
                return List.of(condition("qty", "equal", index == 1 ? "5" : "0"));
            }
            return null;
        };
        List<DataRecord> out = filter.execute(List.of(items), recording).get(0);
        assertEquals(List.of(0, 1, 2), requested);
        assertEquals(list(items.get(1)), out);
    }

    @Test
    void shouldHandleEmptyAndMissingInput() {
        assertTrue(run(List.of(), config("conditions", List.of(condition("p", "isEmpty", null)))).isEmpty());
        assertTrue(filter.execute(List.of(), params(config(), List.of())).get(0).isEmpty());
    }

    @Test
    void shouldRejectUnsupportedOperation() {
        NodeConfigurationException ex = assertThrows(NodeConfigurationException.class,
                () -> run(quotes, config("operation", "drop")));
        assertEquals("operation", ex.getParameter());

        assertThrows(NodeConfigurationException.class,
                () -> run(quotes, config("combineOperation", "xor")));
        assertThrows(NodeConfigurationException.class,
                () -> run(quotes, config("conditions", "p > 8")));
    }
}
