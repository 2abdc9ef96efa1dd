package com.meterly.api.billing.entities;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meterly.api.billing.models.PlanFeatures;
import com.meterly.api.billing.models.PlanLimits;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.val;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists {@link PlanFeatures} with the same versioned envelope as {@link PlanLimitsConverter}.
 */
@Converter
class PlanFeaturesConverter implements AttributeConverter<PlanFeatures, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(PlanFeatures attribute) {
        if (attribute == null) {
            return null;
        }

        val root = MAPPER.createObjectNode();
        root.put("version", PlanLimits.SCHEMA_VERSION);
        root.set("values", MAPPER.valueToTree(attribute.asMap()));
        return root.toString();
    }

    @Override
    public PlanFeatures convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return PlanFeatures.empty();
        }

        try {
            val root = MAPPER.readTree(dbData);
            val values = root.has("version") ? root.path("values") : root;
            Map<String, Object> raw = MAPPER.convertValue(values, MAP_TYPE);
            return PlanFeatures.of(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("failed to read plan features", e);
        }
    }
}
