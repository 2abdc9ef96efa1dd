package com.meterly.api.billing.models;

import lombok.val;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PlanLimitsTest {

    @Test
    void of_separatesKnownAndExtensionKeys() {
        val limits = PlanLimits.of(Map.of(
            "messages_per_month", 1000,
            "users", -1,
            "reports_per_month", 5));

        assertEquals(Optional.of(1000), limits.get(Feature.MESSAGES_PER_MONTH));
        assertEquals(Optional.of(-1), limits.get("users"));
        assertEquals(Optional.of(5), limits.get("reports_per_month"));
        assertEquals(Map.of("reports_per_month", 5), limits.getExtensions());
        assertTrue(limits.get(Feature.LEADS).isEmpty());

        // known features come first, in declaration order
        assertEquals(List.of("users", "messages_per_month", "reports_per_month"), List.copyOf(limits.asMap().keySet()));
    }

    @Test
    void of_withInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> PlanLimits.of(Map.of("users", -2)));
        assertThrows(IllegalArgumentException.class, () -> PlanLimits.of(Map.of(" ", 1)));

        val withNull = new HashMap<String, Integer>();
        withNull.put("leads", null);
        assertThrows(IllegalArgumentException.class, () -> PlanLimits.of(withNull));
    }

    @Test
    void with() {
        val limits = PlanLimits.empty().with(Feature.LEADS, 50);
        assertEquals(Optional.of(50), limits.get(Feature.LEADS));
        assertTrue(PlanLimits.empty().isEmpty());
    }

    @Test
    void feature_keys() {
        assertEquals(Optional.of(Feature.KNOWLEDGE_DOCUMENTS), Feature.fromKey("knowledge_documents"));
        assertTrue(Feature.fromKey("unknown").isEmpty());
        assertTrue(Feature.isMonthly("messages_per_month"));
        assertEquals("leads_overage", Feature.overageEventType("leads"));
    }
}
