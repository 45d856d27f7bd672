package com.fincept.workflow_nodes.executor;

import com.fincept.workflow_nodes.model.node.Condition;
import com.fincept.workflow_nodes.model.node.ConditionOperator;
import com.fincept.workflow_nodes.model.record.DataRecord;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.fincept.workflow_nodes.Records.rec;
import static com.fincept.workflow_nodes.model.node.ConditionOperator.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator(new FieldResolver());

    private final DataRecord row = rec(
            "sym", "AAPL",
            "qty", 10,
            "px", "150.25",
            "name", "Apple Inc",
            "blank", "",
            "nil", null,
            "price", Map.of("close", 99.5));

    private boolean eval(String field, ConditionOperator op, String value) {
        return evaluator.evaluate(row, Condition.of(field, op, value));
    }

    @Test
    void shouldCompareEqualityOnStringCasts() {
        assertTrue(eval("sym", EQUAL, "AAPL"));
        assertFalse(eval("sym", EQUAL, "aapl"));
        assertTrue(eval("qty", EQUAL, "10"));
        assertTrue(eval("sym", NOT_EQUAL, "MSFT"));
        assertFalse(eval("qty", NOT_EQUAL, "10"));
        // absent and null both cast to ""
        assertTrue(eval("missing", EQUAL, ""));
        assertTrue(eval("nil", EQUAL, null));
    }

    @Test
    void shouldCompareNumbersAfterCoercion() {
        assertTrue(eval("qty", GREATER_THAN, "8"));
        assertFalse(eval("qty", GREATER_THAN, "10"));
        assertTrue(eval("qty", GREATER_THAN_OR_EQUAL, "10"));
        assertTrue(eval("px", LESS_THAN, "200"));
        assertTrue(eval("px", LESS_THAN_OR_EQUAL, "150.25"));
        assertTrue(eval("price.close", LESS_THAN, "100"));
    }

    @Test
    void shouldFailClosedOnNonNumericComparisons() {
        for (ConditionOperator op : new ConditionOperator[] {GREATER_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL}) {
            assertFalse(eval("sym", op, "5"), op + " with text field");
            assertFalse(eval("qty", op, "abc"), op + " with text value");
            assertFalse(eval("missing", op, "0"), op + " with absent field");
            assertFalse(eval("nil", op, "0"), op + " with null field");
            assertFalse(eval("blank", op, "0"), op + " with empty field");
        }
    }

    @Test
    void shouldMatchSubstringsIgnoringCase() {
        assertTrue(eval("name", CONTAINS, "APPLE"));
        assertFalse(eval("name", CONTAINS, "pear"));
        assertTrue(eval("name", NOT_CONTAINS, "pear"));
        assertFalse(eval("name", NOT_CONTAINS, "inc"));
        assertTrue(eval("name", STARTS_WITH, "apple"));
        assertFalse(eval("name", STARTS_WITH, "inc"));
        assertTrue(eval("name", ENDS_WITH, "INC"));
        assertTrue(eval("qty", STARTS_WITH, "1"));
    }

    @Test
    void shouldTreatAbsentNullAndEmptyStringAsEmpty() {
        assertTrue(eval("missing", IS_EMPTY, null));
        assertTrue(eval("nil", IS_EMPTY, null));
        assertTrue(eval("blank", IS_EMPTY, null));
        assertFalse(eval("sym", IS_EMPTY, null));
        assertFalse(eval("qty", IS_EMPTY, null));

        assertFalse(eval("missing", IS_NOT_EMPTY, null));
        assertTrue(eval("sym", IS_NOT_EMPTY, null));
    }

    @Test
    void shouldReturnFalseForUnknownOperators() {
        assertEquals(UNSUPPORTED, ConditionOperator.fromName("between"));
        assertEquals(UNSUPPORTED, ConditionOperator.fromName(null));
        assertFalse(eval("sym", UNSUPPORTED, "AAPL"));
        assertFalse(evaluator.evaluate(row, new Condition("sym", null, "AAPL")));
        assertFalse(evaluator.evaluate(row, null));
    }

    @Test
    void shouldGiveSameAnswerOnRepeatedCalls() {
        Condition c = Condition.of("px", GREATER_THAN, "100");
        boolean first = evaluator.evaluate(row, c);
        for (int i = 0; i < 5; i++) {
            assertEquals(first, evaluator.evaluate(row, c));
        }
    }
}
