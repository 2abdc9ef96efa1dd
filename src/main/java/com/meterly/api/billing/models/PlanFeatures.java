package com.meterly.api.billing.models;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.val;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Feature flags and feature values of a plan, e.g. {@code api_access: true} or
 * {@code channels: ["web", "whatsapp"]}. Same layout as {@link PlanLimits}: known keys in an
 * {@link EnumMap}, everything else in an extension bag.
 */
@EqualsAndHashCode
@ToString
public final class PlanFeatures {

    private final Map<Feature, Object> known;
    private final Map<String, Object> extensions;

    private PlanFeatures(@NonNull Map<Feature, Object> known, @NonNull Map<String, Object> extensions) {
        this.known = Collections.unmodifiableMap(known);
        this.extensions = Collections.unmodifiableMap(extensions);
    }

    @NonNull
    public static PlanFeatures empty() {
        return new PlanFeatures(new EnumMap<>(Feature.class), new TreeMap<>());
    }

    @NonNull
    public static PlanFeatures of(@NonNull Map<String, ?> raw) {
        val known = new EnumMap<Feature, Object>(Feature.class);
        val extensions = new TreeMap<String, Object>();
        for (val entry : raw.entrySet()) {
            val key = entry.getKey();
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("feature key must not be blank");
            }

            if (entry.getValue() == null) {
                continue;
            }

            Feature.fromKey(key).ifPresentOrElse(
                f -> known.put(f, entry.getValue()),
                () -> extensions.put(key, entry.getValue()));
        }

        return new PlanFeatures(known, extensions);
    }

    @NonNull
    public Optional<Object> get(@NonNull String key) {
        return Feature.fromKey(key)
            .map(known::get)
            .or(() -> Optional.ofNullable(extensions.get(key)));
    }

    /**
     * @return {@code true} if the feature is present and not explicitly turned off.
     */
    public boolean isEnabled(@NonNull String key) {
        return get(key)
            .map(v -> !Boolean.FALSE.equals(v))
            .orElse(false);
    }

    @NonNull
    public Map<String, Object> asMap() {
        val result = new LinkedHashMap<String, Object>();
        known.forEach((feature, value) -> result.put(feature.getKey(), value));
        result.putAll(extensions);
        return result;
    }
}
