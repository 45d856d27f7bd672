package com.fincept.workflow_nodes.executor.param;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fincept.workflow_nodes.exception.NodeConfigurationException;
import com.fincept.workflow_nodes.model.node.Condition;
import com.fincept.workflow_nodes.model.node.ConditionOperator;
import com.fincept.workflow_nodes.model.node.ConfigOption;
import com.fincept.workflow_nodes.model.node.SwitchRule;
import com.fincept.workflow_nodes.model.record.RecordValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed reads over a {@link ParameterAccessor}. Raw values come back as whatever the
 * host stored (maps, lists, strings, numbers) and are converted with Jackson, the same
 * way node configs are turned into typed settings elsewhere in the engine.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NodeParameterReader {

    private static final Condition UNREADABLE_CONDITION = new Condition(null, ConditionOperator.UNSUPPORTED, null);

    private final ObjectMapper objectMapper;

    public <E extends Enum<E> & ConfigOption> E option(ParameterAccessor params, String name, Class<E> type, E defaultValue) {
        Object raw = params.get(name, 0);
        if (raw == null && defaultValue != null) return defaultValue;
        return ConfigOption.parse(type, raw, name);
    }

    public String string(ParameterAccessor params, String name, int itemIndex) {
        Object raw = params.get(name, itemIndex);
        return raw != null ? raw.toString() : null;
    }

    public String requiredString(ParameterAccessor params, String name) {
        String value = string(params, name, 0);
        if (value == null || value.isBlank()) {
            throw new NodeConfigurationException(name, "Parameter '" + name + "' is required");
        }
        return value.trim();
    }

    public int integer(ParameterAccessor params, String name, int itemIndex, int defaultValue) {
        Object raw = params.get(name, itemIndex);
        if (raw == null || raw.toString().isBlank()) return defaultValue;
        Integer parsed = toInteger(raw);
        if (parsed == null) {
            throw new NodeConfigurationException(name,
                    "Parameter '" + name + "' must be a whole number, got '" + raw + "'");
        }
        return parsed;
    }

    /**
     * Conditions are read fresh for every record index — values may differ per record.
     * Only a parameter that is not a list at all is a configuration error. A single entry
     * that cannot be read becomes an unsupported condition, which never matches.
     */
    public List<Condition> conditions(ParameterAccessor params, String name, int itemIndex) {
        List<?> entries = entries(params, name, itemIndex, "condition");
        List<Condition> conditions = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.get(i);
            if (entry == null) continue;
            Map<String, Object> fields = scalarFields(entry);
            if (fields == null) {
                conditions.add(UNREADABLE_CONDITION);
                continue;
            }
            try {
                conditions.add(objectMapper.convertValue(fields, Condition.class));
            } catch (IllegalArgumentException ex) {
                log.debug("Condition {} of '{}' unreadable for record {}, treating as unsupported: {}", i + 1, name, itemIndex, ex.getMessage());
                conditions.add(UNREADABLE_CONDITION);
            }
        }
        return conditions;
    }

    /** Same leniency as {@link #conditions}, but every rule must name a whole-number output. */
    public List<SwitchRule> rules(ParameterAccessor params, String name, int itemIndex) {
        List<?> entries = entries(params, name, itemIndex, "rule");
        List<SwitchRule> rules = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.get(i);
            if (entry == null) continue;
            Map<String, Object> fields = scalarFields(entry);
            Integer output = fields != null ? toInteger(fields.get("output")) : null;
            if (output == null) {
                throw new NodeConfigurationException(name, "Rule " + (i + 1) + " has no output index");
            }
            fields.put("output", output);
            try {
                rules.add(objectMapper.convertValue(fields, SwitchRule.class));
            } catch (IllegalArgumentException ex) {
                log.debug("Rule {} of '{}' unreadable for record {}, it will not match: {}", i + 1, name, itemIndex, ex.getMessage());
                rules.add(new SwitchRule(null, ConditionOperator.UNSUPPORTED, null, output));
            }
        }
        return rules;
    }

    /** Whole numbers only; "2", 2, 2.0 all give 2. Returns null for anything else. */
    public static Integer toInteger(Object raw) {
        if (raw == null) return null;
        try {
            BigDecimal value = raw instanceof BigDecimal d ? d : new BigDecimal(raw.toString().trim());
            return value.intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    private static List<?> entries(ParameterAccessor params, String name, int itemIndex, String kind) {
        Object raw = params.get(name, itemIndex);
        if (raw == null) return List.of();
        if (!(raw instanceof List<?> list)) {
            throw new NodeConfigurationException(name, "Parameter '" + name + "' must be a " + kind + " list, got '" + raw + "'");
        }
        return list;
    }

    /**
     * Copies a map entry, casting a nested object or array in field/value to its JSON text
     * so that the comparison just fails instead of the whole read. Null for non-map entries.
     */
    private static Map<String, Object> scalarFields(Object entry) {
        if (!(entry instanceof Map<?, ?> map)) return null;
        Map<String, Object> fields = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            String key = String.valueOf(k);
            boolean compared = key.equals("field") || key.equals("value");
            fields.put(key, compared && (v instanceof Map || v instanceof List) ? RecordValue.of(v).asText() : v);
        });
        return fields;
    }
}
