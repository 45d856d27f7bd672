package com.fincept.workflow_nodes.model.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One structured item flowing through a transform node.
 *
 * Immutable: nodes build new records through {@link Builder} instead of mutating
 * their inputs. Field order is kept for readable output but is not part of equality.
 */
public final class DataRecord {

    private static final DataRecord EMPTY = new DataRecord(new LinkedHashMap<>());

    private final Map<String, RecordValue> fields;

    private DataRecord(LinkedHashMap<String, RecordValue> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static DataRecord empty() {
        return EMPTY;
    }

    /** Deep-converts a plain map (as produced by Jackson or a node config) into a record. */
    public static DataRecord of(Map<String, ?> plain) {
        if (plain == null || plain.isEmpty()) return EMPTY;
        LinkedHashMap<String, RecordValue> converted = new LinkedHashMap<>();
        plain.forEach((key, value) -> converted.put(key, RecordValue.of(value)));
        return new DataRecord(converted);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<RecordValue> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public boolean has(String key) {
        return fields.containsKey(key);
    }

    public Set<String> keys() {
        return fields.keySet();
    }

    public Map<String, RecordValue> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public Map<String, Object> toPlainMap() {
        Map<String, Object> plain = new LinkedHashMap<>();
        fields.forEach((key, value) -> plain.put(key, value.toPlain()));
        return plain;
    }

    public Builder toBuilder() {
        return new Builder().putAll(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataRecord other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return RecordJson.write(toPlainMap());
    }

    public static final class Builder {

        private final LinkedHashMap<String, RecordValue> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String key, RecordValue value) {
            fields.put(key, value != null ? value : RecordValue.nullValue());
            return this;
        }

        public Builder put(String key, Object value) {
            return put(key, RecordValue.of(value));
        }

        /** Later puts win, so putAll(a).putAll(b) gives b precedence on shared keys. */
        public Builder putAll(DataRecord record) {
            if (record != null) fields.putAll(record.fields);
            return this;
        }

        public Builder remove(String key) {
            fields.remove(key);
            return this;
        }

        public boolean has(String key) {
            return fields.containsKey(key);
        }

        public DataRecord build() {
            return fields.isEmpty() ? EMPTY : new DataRecord(new LinkedHashMap<>(fields));
        }
    }
}
