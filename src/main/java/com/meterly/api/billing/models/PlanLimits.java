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
 * <p>
 * Numeric per-feature limits of a plan. Known keys are held in an {@link EnumMap} keyed by
 * {@link Feature}; any other key is kept in an extension bag so that new limits can be introduced
 * without a schema change.</p>
 * <p>
 * A limit of {@link #UNLIMITED} means the feature has no cap. Instances are immutable.</p>
 */
@EqualsAndHashCode
@ToString
public final class PlanLimits {

    public static final int SCHEMA_VERSION = 1;
    public static final int UNLIMITED = -1;

    private final Map<Feature, Integer> known;
    private final Map<String, Integer> extensions;

    private PlanLimits(@NonNull Map<Feature, Integer> known, @NonNull Map<String, Integer> extensions) {
        this.known = Collections.unmodifiableMap(known);
        this.extensions = Collections.unmodifiableMap(extensions);
    }

    @NonNull
    public static PlanLimits empty() {
        return new PlanLimits(new EnumMap<>(Feature.class), new TreeMap<>());
    }

    /**
     * Builds limits from a raw key-value map.
     *
     * @throws IllegalArgumentException if a key is blank, or a value is {@literal null} or less
     *                                  than {@link #UNLIMITED}.
     */
    @NonNull
    public static PlanLimits of(@NonNull Map<String, Integer> raw) {
        val known = new EnumMap<Feature, Integer>(Feature.class);
        val extensions = new TreeMap<String, Integer>();
        for (val entry : raw.entrySet()) {
            val key = entry.getKey();
            val value = entry.getValue();
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("limit key must not be blank");
            }

            if (value == null || value < UNLIMITED) {
                throw new IllegalArgumentException(String.format("invalid limit for '%s': %s", key, value));
            }

            Feature.fromKey(key).ifPresentOrElse(f -> known.put(f, value), () -> extensions.put(key, value));
        }

        return new PlanLimits(known, extensions);
    }

    @NonNull
    public PlanLimits with(@NonNull Feature feature, int limit) {
        val raw = new LinkedHashMap<>(asMap());
        raw.put(feature.getKey(), limit);
        return of(raw);
    }

    @NonNull
    public Optional<Integer> get(@NonNull Feature feature) {
        return Optional.ofNullable(known.get(feature));
    }

    @NonNull
    public Optional<Integer> get(@NonNull String key) {
        return Feature.fromKey(key)
            .map(known::get)
            .or(() -> Optional.ofNullable(extensions.get(key)));
    }

    @NonNull
    public Map<String, Integer> getExtensions() {
        return extensions;
    }

    /**
     * @return all limits keyed by their feature key, known features first in declaration order.
     */
    @NonNull
    public Map<String, Integer> asMap() {
        val result = new LinkedHashMap<String, Integer>();
        known.forEach((feature, limit) -> result.put(feature.getKey(), limit));
        result.putAll(extensions);
        return result;
    }

    public boolean isEmpty() {
        return known.isEmpty() && extensions.isEmpty();
    }
}
