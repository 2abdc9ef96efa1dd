package com.meterly.api.billing.payload;

import com.meterly.api.billing.entities.Plan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Attributes of a new {@link Plan}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanParams {

    private String name;

    private String description;

    private BigDecimal price;

    @Builder.Default
    private Plan.BillingInterval billingInterval = Plan.BillingInterval.MONTH;

    @Builder.Default
    private Map<String, Object> features = Map.of();

    @Builder.Default
    private Map<String, Integer> limits = Map.of();

    @Builder.Default
    private boolean isPublic = true;
}
