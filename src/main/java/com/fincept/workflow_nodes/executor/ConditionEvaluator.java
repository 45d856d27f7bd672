package com.fincept.workflow_nodes.executor;

import com.fincept.workflow_nodes.model.node.Condition;
import com.fincept.workflow_nodes.model.record.DataRecord;
import com.fincept.workflow_nodes.model.record.RecordValue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Evaluates one condition against one record. Never throws: a bad path, a
 * non-numeric comparison or an unknown operator all come out as false.
 */
@Component
@RequiredArgsConstructor
public class ConditionEvaluator {

    private final FieldResolver fieldResolver;

    public boolean evaluate(DataRecord record, Condition condition) {
        if (condition == null) return false;

        Optional<RecordValue> resolved = fieldResolver.resolve(record, condition.field());
        String expected = condition.value() != null ? condition.value() : "";

        return switch (condition.operator()) {
            case EQUAL                 -> text(resolved).equals(expected);
            case NOT_EQUAL             -> !text(resolved).equals(expected);
            case GREATER_THAN          -> number(resolved) > parse(expected);
            case GREATER_THAN_OR_EQUAL -> number(resolved) >= parse(expected);
            case LESS_THAN             -> number(resolved) < parse(expected);
            case LESS_THAN_OR_EQUAL    -> number(resolved) <= parse(expected);
            case CONTAINS              -> lower(text(resolved)).contains(lower(expected));
            case NOT_CONTAINS          -> !lower(text(resolved)).contains(lower(expected));
            case STARTS_WITH           -> lower(text(resolved)).startsWith(lower(expected));
            case ENDS_WITH             -> lower(text(resolved)).endsWith(lower(expected));
            case IS_EMPTY              -> isEmpty(resolved);
            case IS_NOT_EMPTY          -> !isEmpty(resolved);
            case UNSUPPORTED           -> false;
        };
    }

    // Absent and null both cast to ""
    private static String text(Optional<RecordValue> value) {
        return value.map(RecordValue::asText).orElse("");
    }

    // NaN on either side makes every ordering comparison false
    private static double number(Optional<RecordValue> value) {
        return value.map(RecordValue::asNumber).orElse(Double.NaN);
    }

    private static double parse(String expected) {
        return new RecordValue.Text(expected).asNumber();
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    private static boolean isEmpty(Optional<RecordValue> value) {
        if (value.isEmpty()) return true;
        RecordValue v = value.get();
        return v instanceof RecordValue.Null || (v instanceof RecordValue.Text t && t.value().isEmpty());
    }
}
