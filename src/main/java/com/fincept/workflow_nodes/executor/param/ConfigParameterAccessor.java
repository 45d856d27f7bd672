package com.fincept.workflow_nodes.executor.param;

import com.fincept.workflow_nodes.executor.FieldResolver;
import com.fincept.workflow_nodes.model.record.DataRecord;
import com.fincept.workflow_nodes.model.record.RecordValue;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ParameterAccessor} backed by a node's stored config map.
 *
 * Every call resolves {{ref}} expressions against the record at the requested index:
 *   {{$json.price.close}} — dot path into the current record
 *   {{$index}}            — the record index
 *
 * A value that is exactly one reference keeps the referenced type (a number stays a number);
 * references inside longer text are interpolated as strings. Lists and maps are resolved recursively,
 * so a condition list like [{ "field": "qty", "operator": "greaterThan", "value": "{{$json.min}}" }]
 * yields a different threshold for each record.
 */
@Slf4j
public class ConfigParameterAccessor implements ParameterAccessor {

    private static final Pattern REF_PATTERN = Pattern.compile("\\{\\{([^}]+)}}");

    private final Map<String, Object> config;
    private final List<DataRecord> items;
    private final FieldResolver fieldResolver;

    public ConfigParameterAccessor(Map<String, Object> config, List<DataRecord> items, FieldResolver fieldResolver) {
        this.config = config != null ? config : Map.of();
        this.items = items != null ? items : List.of();
        this.fieldResolver = fieldResolver;
    }

    @Override
    public Object get(String name, int itemIndex) {
        if (!config.containsKey(name)) return null;
        DataRecord item = itemIndex >= 0 && itemIndex < items.size() ? items.get(itemIndex) : null;
        return resolveValue(config.get(name), item, itemIndex);
    }

    private Object resolveValue(Object value, DataRecord item, int itemIndex) {
        if (value instanceof String s) {
            return resolveString(s, item, itemIndex);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((k, v) -> resolved.put(String.valueOf(k), resolveValue(v, item, itemIndex)));
            return resolved;
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            list.forEach(v -> resolved.add(resolveValue(v, item, itemIndex)));
            return resolved;
        }
        return value;
    }

    private Object resolveString(String template, DataRecord item, int itemIndex) {
        if (!template.contains("{{")) return template;

        String trimmed = template.trim();
        Matcher whole = REF_PATTERN.matcher(trimmed);
        if (whole.matches()) {
            return resolveReference(whole.group(1).trim(), item, itemIndex)
                    .map(RecordValue::toPlain)
                    .orElse(null);
        }

        Matcher matcher = REF_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String text = resolveReference(matcher.group(1).trim(), item, itemIndex)
                    .map(RecordValue::asText)
                    .orElse("");
            matcher.appendReplacement(result, Matcher.quoteReplacement(text));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private Optional<RecordValue> resolveReference(String ref, DataRecord item, int itemIndex) {
        if ("$index".equals(ref)) {
            return Optional.of(RecordValue.number(itemIndex));
        }
        if (item == null) return Optional.empty();
        if ("$json".equals(ref)) {
            return Optional.of(new RecordValue.Nested(item));
        }
        if (ref.startsWith("$json.")) {
            return fieldResolver.resolve(item, ref.substring("$json.".length()));
        }
        log.debug("Unrecognised parameter reference {{{}}} — resolving to empty", ref);
        return Optional.empty();
    }
}
