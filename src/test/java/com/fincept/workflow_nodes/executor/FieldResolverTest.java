package com.fincept.workflow_nodes.executor;

import com.fincept.workflow_nodes.model.record.DataRecord;
import com.fincept.workflow_nodes.model.record.RecordValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.fincept.workflow_nodes.Records.rec;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldResolverTest {

    private final FieldResolver resolver = new FieldResolver();

    private final DataRecord quote = rec(
            "sym", "AAPL",
            "price", Map.of("close", 150, "meta", Map.of("ccy", "USD")),
            "tags", List.of("a", "b"),
            "note", null);

    @Test
    void shouldResolveTopLevelAndNestedPaths() {
        assertEquals("AAPL", resolver.resolve(quote, "sym").orElseThrow().asText());
        assertEquals(150.0, resolver.resolve(quote, "price.close").orElseThrow().asNumber());
        assertEquals("USD", resolver.resolve(quote, "price.meta.ccy").orElseThrow().asText());
    }

    @Test
    void shouldReturnAbsentForMissingSegments() {
        assertTrue(resolver.resolve(quote, "volume").isEmpty());
        assertTrue(resolver.resolve(quote, "price.open").isEmpty());
        assertTrue(resolver.resolve(quote, "volume.daily.avg").isEmpty());
    }

    @Test
    void shouldStopAtNullAndScalarIntermediates() {
        assertTrue(resolver.resolve(quote, "note.inner").isEmpty());
        assertTrue(resolver.resolve(quote, "sym.length").isEmpty());
    }

    @Test
    void shouldNotIndexIntoArrays() {
        assertTrue(resolver.resolve(quote, "tags.0").isEmpty());
        assertTrue(resolver.resolve(quote, "tags[0]").isEmpty());
    }

    @Test
    void shouldDistinguishNullFromAbsent() {
        assertSame(RecordValue.Null.INSTANCE, resolver.resolve(quote, "note").orElseThrow());
        assertTrue(resolver.resolve(quote, "missing").isEmpty());
    }

    @Test
    void shouldRejectMalformedPaths() {
        assertTrue(resolver.resolve(quote, "").isEmpty());
        assertTrue(resolver.resolve(quote, null).isEmpty());
        assertTrue(resolver.resolve(quote, "price..close").isEmpty());
        assertTrue(resolver.resolve(quote, "price.").isEmpty());
        assertTrue(resolver.resolve(null, "sym").isEmpty());
    }
}
