package com.fincept.workflow_nodes.model.record;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fincept.workflow_nodes.exception.RecordCodecException;

/** Compact JSON text of plain values, used for the string cast of nested values. */
final class RecordJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private RecordJson() {}

    static String write(Object plain) {
        try {
            return MAPPER.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw new RecordCodecException("Failed to render value as JSON: " + e.getOriginalMessage(), e);
        }
    }
}
