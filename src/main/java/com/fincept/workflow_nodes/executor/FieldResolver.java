package com.fincept.workflow_nodes.executor;

import com.fincept.workflow_nodes.model.record.DataRecord;
import com.fincept.workflow_nodes.model.record.RecordValue;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class FieldResolver {

    /**
     * Walk a record by dot path (e.g. "price.close"). Only nested records are
     * descended into — no wildcards, no array indexes. Returns empty if any step
     * is missing or lands on a non-record value before the last segment.
     */
    public Optional<RecordValue> resolve(DataRecord record, String path) {
        if (record == null || path == null || path.isBlank()) return Optional.empty();

        String[] segments = path.split("\\.", -1);
        DataRecord current = record;
        for (int i = 0; i < segments.length; i++) {
            String seg = segments[i].trim();
            if (seg.isEmpty()) return Optional.empty();

            Optional<RecordValue> next = current.get(seg);
            if (next.isEmpty() || i == segments.length - 1) return next;

            if (next.get() instanceof RecordValue.Nested nested) {
                current = nested.value();
            } else {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
