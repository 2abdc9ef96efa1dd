package com.meterly.api.billing;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * An immutable view of the configuration and the wall-clock time that a single enforcement job
 * invocation works with. Every subscription in one sweep sees the same values.
 */
@Value
@Builder
class EnforcementSnapshot {

    @NonNull
    OffsetDateTime now;

    @NonNull
    String currency;

    @NonNull
    String freePlanName;

    @NonNull
    Duration defaultUsagePeriod;

    @NonNull
    Duration dunningFinalNoticeAfter;

    @NonNull
    Duration dunningCancelAfter;

    @NonNull
    Map<String, BigDecimal> overageRates;

    @NonNull
    static EnforcementSnapshot of(@NonNull BillingConfiguration config, @NonNull OffsetDateTime now) {
        return EnforcementSnapshot.builder()
            .now(now)
            .currency(config.getCurrency())
            .freePlanName(config.getFreePlanName())
            .defaultUsagePeriod(config.getDefaultUsagePeriod())
            .dunningFinalNoticeAfter(config.getDunningFinalNoticeAfter())
            .dunningCancelAfter(config.getDunningCancelAfter())
            .overageRates(Map.copyOf(config.getOverageRates()))
            .build();
    }

    /**
     * @return the per-unit overage rate of the feature, zero if the feature is not billed.
     */
    @NonNull
    BigDecimal overageRate(@NonNull String feature) {
        return overageRates.getOrDefault(feature, BigDecimal.ZERO);
    }
}
