package com.meterly.api.billing.payload;

import com.meterly.api.billing.entities.Entitlement;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Read-only usage summary of a single {@link Entitlement}.
 */
@Value
@Builder
public class EntitlementUsage {

    @NonNull
    String feature;

    int used;

    /**
     * {@literal null} for boolean features, {@code -1} for unlimited ones.
     */
    Integer limit;

    int remaining;

    double usagePercentage;

    boolean overLimit;

    @NonNull
    Entitlement.ResetFrequency resetFrequency;

    @NonNull
    public static EntitlementUsage from(@NonNull Entitlement entitlement) {
        return EntitlementUsage.builder()
            .feature(entitlement.getFeature())
            .used(entitlement.getUsed())
            .limit(entitlement.getLimitValue())
            .remaining(entitlement.getRemainingQuota())
            .usagePercentage(entitlement.getUsagePercentage())
            .overLimit(entitlement.isOverLimit())
            .resetFrequency(entitlement.getResetFrequency())
            .build();
    }
}
