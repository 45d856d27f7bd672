package com.fincept.workflow_nodes.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fincept.workflow_nodes.exception.RecordCodecException;
import com.fincept.workflow_nodes.model.record.DataRecord;
import com.fincept.workflow_nodes.model.record.RecordValue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Wire form of record lists: a JSON array of objects, order preserved.
 * Used wherever the host persists or ships node inputs and outputs.
 */
@Component
@RequiredArgsConstructor
public class RecordJsonCodec {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private final ObjectMapper objectMapper;

    /** Accepts an array of objects, or a single object as a one-record list. */
    public List<DataRecord> readList(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RecordCodecException("Record list is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new RecordCodecException("Record list JSON is empty");
        }
        if (root.isObject()) {
            return List.of(fromJsonNode(root));
        }
        if (!root.isArray()) {
            throw new RecordCodecException("Record list must be a JSON array of objects, got " + root.getNodeType());
        }

        List<DataRecord> records = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode element = root.get(i);
            if (!element.isObject()) {
                throw new RecordCodecException("Element " + i + " of record list is " + element.getNodeType() + ", expected an object");
            }
            records.add(fromJsonNode(element));
        }
        return records;
    }

    public String writeList(List<DataRecord> records) {
        ArrayNode array = NODES.arrayNode();
        if (records != null) records.forEach(r -> array.add(toJsonNode(r)));
        try {
            return objectMapper.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new RecordCodecException("Failed to serialise record list: " + e.getOriginalMessage(), e);
        }
    }

    public DataRecord fromJsonNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new RecordCodecException("Record must be a JSON object");
        }
        DataRecord.Builder builder = DataRecord.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.put(field.getKey(), toValue(field.getValue()));
        }
        return builder.build();
    }

    public ObjectNode toJsonNode(DataRecord record) {
        ObjectNode object = NODES.objectNode();
        record.fields().forEach((key, value) -> object.set(key, toNode(value)));
        return object;
    }

    private RecordValue toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return RecordValue.nullValue();
        if (node.isObject())  return new RecordValue.Nested(fromJsonNode(node));
        if (node.isBoolean()) return RecordValue.bool(node.booleanValue());
        if (node.isNumber())  return new RecordValue.Number(node.decimalValue());
        if (node.isArray()) {
            List<RecordValue> values = new ArrayList<>(node.size());
            node.forEach(element -> values.add(toValue(element)));
            return new RecordValue.Array(values);
        }
        return RecordValue.text(node.asText());
    }

    private JsonNode toNode(RecordValue value) {
        if (value instanceof RecordValue.Text t)   return NODES.textNode(t.value());
        if (value instanceof RecordValue.Bool b)   return NODES.booleanNode(b.value());
        if (value instanceof RecordValue.Nested n) return toJsonNode(n.value());
        if (value instanceof RecordValue.Number n) {
            Object plain = n.toPlain();
            return plain instanceof Long l ? NODES.numberNode(l) : NODES.numberNode((BigDecimal) plain);
        }
        if (value instanceof RecordValue.Array a) {
            ArrayNode array = NODES.arrayNode();
            a.values().forEach(v -> array.add(toNode(v)));
            return array;
        }
        return NODES.nullNode();
    }
}
