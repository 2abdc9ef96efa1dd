package com.meterly.api.billing.entities;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meterly.api.billing.models.PlanLimits;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.val;

import java.util.LinkedHashMap;

/**
 * Persists {@link PlanLimits} as {@code {"version": 1, "values": {...}}}. Rows written before the
 * schema was versioned hold a flat key-value object, which reads back as version 1.
 */
@Converter
class PlanLimitsConverter implements AttributeConverter<PlanLimits, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(PlanLimits attribute) {
        if (attribute == null) {
            return null;
        }

        val root = MAPPER.createObjectNode();
        root.put("version", PlanLimits.SCHEMA_VERSION);
        root.set("values", MAPPER.valueToTree(attribute.asMap()));
        return root.toString();
    }

    @Override
    public PlanLimits convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return PlanLimits.empty();
        }

        final JsonNode root;
        try {
            root = MAPPER.readTree(dbData);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("failed to read plan limits", e);
        }

        val values = root.has("version") ? root.path("values") : root;
        val version = root.path("version").asInt(PlanLimits.SCHEMA_VERSION);
        if (version != PlanLimits.SCHEMA_VERSION) {
            throw new IllegalArgumentException("unsupported plan limits schema version: " + version);
        }

        val raw = new LinkedHashMap<String, Integer>();
        values.fields().forEachRemaining(e -> raw.put(e.getKey(), e.getValue().asInt()));
        return PlanLimits.of(raw);
    }
}
