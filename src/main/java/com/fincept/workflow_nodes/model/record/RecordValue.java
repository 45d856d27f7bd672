package com.fincept.workflow_nodes.model.record;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One dynamically-typed value inside a {@link DataRecord}.
 *
 * Absent fields are not represented here — a lookup that finds nothing returns
 * an empty Optional, while a field explicitly set to null holds {@link Null}.
 * That split is what lets isEmpty tell "missing" from "null" from "".
 */
public sealed interface RecordValue
        permits RecordValue.Text, RecordValue.Number, RecordValue.Bool,
                RecordValue.Null, RecordValue.Nested, RecordValue.Array {

    /** String cast used by equal / contains / startsWith and by key joins. */
    String asText();

    /** Numeric coercion; NaN when the value is not numeric. */
    default double asNumber() {
        return Double.NaN;
    }

    /** Plain Java form (String, BigDecimal, Boolean, null, Map, List) for JSON output. */
    Object toPlain();

    // ── Variants ─────────────────────────────────────────────────────────────

    record Text(String value) implements RecordValue {
        public Text {
            if (value == null) throw new IllegalArgumentException("Text value cannot be null, use RecordValue.Null");
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public double asNumber() {
            String trimmed = value.trim();
            if (trimmed.isEmpty()) return Double.NaN;
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Number(BigDecimal value) implements RecordValue {
        public Number {
            if (value == null) throw new IllegalArgumentException("Number value cannot be null, use RecordValue.Null");
            // 10 and 10.0 are the same number for equality and for joins
            value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
        }

        @Override
        public String asText() {
            return value.toPlainString();
        }

        @Override
        public double asNumber() {
            return value.doubleValue();
        }

        /** Long for whole numbers that fit, otherwise a plain-scaled BigDecimal (never "1E+1"). */
        @Override
        public Object toPlain() {
            if (value.scale() <= 0 && value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
                return value.longValueExact();
            }
            return new BigDecimal(value.toPlainString());
        }

        private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
        private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);
    }

    record Bool(boolean value) implements RecordValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    enum Null implements RecordValue {
        INSTANCE;

        @Override
        public String asText() {
            return "";
        }

        @Override
        public Object toPlain() {
            return null;
        }
    }

    record Nested(DataRecord value) implements RecordValue {
        public Nested {
            if (value == null) throw new IllegalArgumentException("Nested record cannot be null, use RecordValue.Null");
        }

        @Override
        public String asText() {
            return RecordJson.write(value.toPlainMap());
        }

        @Override
        public Object toPlain() {
            return value.toPlainMap();
        }
    }

    record Array(List<RecordValue> values) implements RecordValue {
        public Array {
            values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public String asText() {
            return RecordJson.write(toPlain());
        }

        @Override
        public Object toPlain() {
            List<Object> plain = new ArrayList<>(values.size());
            values.forEach(v -> plain.add(v.toPlain()));
            return plain;
        }
    }

    // ── Factories ────────────────────────────────────────────────────────────

    static RecordValue text(String value) {
        return value == null ? Null.INSTANCE : new Text(value);
    }

    static RecordValue number(double value) {
        return new Number(BigDecimal.valueOf(value));
    }

    static RecordValue number(long value) {
        return new Number(BigDecimal.valueOf(value));
    }

    static RecordValue bool(boolean value) {
        return new Bool(value);
    }

    static RecordValue nullValue() {
        return Null.INSTANCE;
    }

    /**
     * Deep conversion from the plain Java shapes Jackson and node configs produce.
     * Unknown object types fall back to their toString() as text. Map keys are
     * taken by their string form.
     */
    static RecordValue of(Object raw) {
        if (raw == null)                      return Null.INSTANCE;
        if (raw instanceof RecordValue value) return value;
        if (raw instanceof DataRecord record) return new Nested(record);
        if (raw instanceof String s)          return new Text(s);
        if (raw instanceof Boolean b)         return new Bool(b);
        if (raw instanceof BigDecimal d)      return new Number(d);
        if (raw instanceof Double d)          return Double.isFinite(d) ? new Number(BigDecimal.valueOf(d)) : new Text(d.toString());
        if (raw instanceof Float f)           return Float.isFinite(f) ? new Number(new BigDecimal(f.toString())) : new Text(f.toString());
        if (raw instanceof java.lang.Number n) return new Number(new BigDecimal(n.toString()));
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> keyed = new LinkedHashMap<>();
            map.forEach((k, v) -> keyed.put(String.valueOf(k), v));
            return new Nested(DataRecord.of(keyed));
        }
        if (raw instanceof Iterable<?> items) {
            List<RecordValue> values = new ArrayList<>();
            items.forEach(item -> values.add(of(item)));
            return new Array(values);
        }
        return new Text(raw.toString());
    }
}
