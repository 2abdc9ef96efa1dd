package com.meterly.api.platform.persistence;

import lombok.val;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JsonMapConverterTest {

    private final JsonMapConverter converter = new JsonMapConverter();

    @Test
    void convertToDatabaseColumn() {
        assertNull(converter.convertToDatabaseColumn(null));
        assertEquals("{\"change_type\":\"downgrade\"}", converter.convertToDatabaseColumn(Map.of("change_type", "downgrade")));
    }

    @Test
    void convertToEntityAttribute() {
        val metadata = converter.convertToEntityAttribute(
            "{\"pending_plan_change\":{\"new_plan_id\":2,\"scheduled_at\":\"2026-01-01T00:00:00Z\"}}");

        val change = (Map<?, ?>) metadata.get("pending_plan_change");
        assertEquals(2, change.get("new_plan_id"));
        assertEquals("2026-01-01T00:00:00Z", change.get("scheduled_at"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  "})
    void convertToEntityAttribute_withBlankColumn(String dbData) {
        val metadata = converter.convertToEntityAttribute(dbData);
        assertTrue(metadata.isEmpty());
        metadata.put("rate", "0.01");
    }

    @Test
    void convertToEntityAttribute_withInvalidJson() {
        assertThrows(IllegalArgumentException.class, () -> converter.convertToEntityAttribute("[1, 2]"));
    }
}
