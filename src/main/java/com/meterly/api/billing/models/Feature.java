package com.meterly.api.billing.models;

import lombok.Getter;
import lombok.NonNull;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of feature keys that the billing engine knows about. Plans may carry additional keys,
 * which are kept in the extension bag of {@link PlanLimits} and {@link PlanFeatures}.
 */
public enum Feature {

    USERS("users"),
    MESSAGES_PER_MONTH("messages_per_month"),
    KNOWLEDGE_DOCUMENTS("knowledge_documents"),
    LEADS("leads"),
    API_ACCESS("api_access"),
    CUSTOM_BRANDING("custom_branding"),
    PRIORITY_SUPPORT("priority_support");

    /**
     * Suffix of the usage event type recorded for billed usage beyond a limit.
     */
    public static final String OVERAGE_SUFFIX = "_overage";

    private static final String MONTHLY_SUFFIX = "_per_month";

    @Getter
    @NonNull
    private final String key;

    Feature(@NonNull String key) {
        this.key = key;
    }

    @NonNull
    public static Optional<Feature> fromKey(String key) {
        return Arrays.stream(values())
            .filter(f -> f.key.equals(key))
            .findFirst();
    }

    /**
     * @return {@code true} if usage of the given feature key resets every billing period.
     */
    public static boolean isMonthly(@NonNull String key) {
        return key.endsWith(MONTHLY_SUFFIX);
    }

    @NonNull
    public static String overageEventType(@NonNull String key) {
        return key + OVERAGE_SUFFIX;
    }
}
