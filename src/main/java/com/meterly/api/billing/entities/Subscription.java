package com.meterly.api.billing.entities;

import com.meterly.api.platform.BasicEntity;
import com.meterly.api.platform.persistence.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.val;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A data access object that maps to the {@code subscriptions} table in the database.
 */
@Entity
@Table(name = "subscriptions")
@Data
@EqualsAndHashCode(callSuper = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription extends BasicEntity {

    /**
     * Metadata key under which a deferred plan change is stored.
     */
    public static final String PENDING_PLAN_CHANGE_KEY = "pending_plan_change";

    private long tenantId;

    @NonNull
    @ManyToOne(optional = false)
    private Plan plan;

    @Column(unique = true)
    private String stripeSubscriptionId;

    private String stripeCustomerId;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private Status status = Status.INCOMPLETE;

    private OffsetDateTime currentPeriodStart, currentPeriodEnd;

    private OffsetDateTime trialStart, trialEnd;

    private boolean cancelAtPeriodEnd;

    private OffsetDateTime canceledAt;

    @NonNull
    @Builder.Default
    @Column(length = 4000)
    @Convert(converter = JsonMapConverter.class)
    private Map<String, Object> metadata = new HashMap<>();

    /**
     * @return {@code true} if the subscription currently grants access to its plan.
     */
    public boolean isActive() {
        return status == Status.ACTIVE || status == Status.TRIALING;
    }

    public boolean isTrialing() {
        return status == Status.TRIALING;
    }

    public boolean isCanceled() {
        return status == Status.CANCELED;
    }

    /**
     * @return {@code true} if the subscription has a trial end in the past, relative to {@code now}.
     */
    public boolean isTrialExpired(@NonNull OffsetDateTime now) {
        return trialEnd != null && trialEnd.isBefore(now);
    }

    /**
     * Sets {@link Subscription#canceledAt} unless it is already set. Cancellation timestamps are
     * monotonic, so replaying a stale event must not move them.
     */
    public void markCanceledAt(@NonNull OffsetDateTime at) {
        if (canceledAt == null) {
            canceledAt = at;
        }
    }

    @NonNull
    public Optional<Object> getPendingPlanChange() {
        return Optional.ofNullable(metadata.get(PENDING_PLAN_CHANGE_KEY));
    }

    public void putMetadata(@NonNull String key, Object value) {
        // replace the map so that the persistence layer notices the change.
        val copy = new HashMap<>(metadata);
        copy.put(key, value);
        metadata = copy;
    }

    public void removeMetadata(@NonNull String key) {
        if (metadata.containsKey(key)) {
            val copy = new HashMap<>(metadata);
            copy.remove(key);
            metadata = copy;
        }
    }

    /**
     * Lifecycle states of a subscription. {@link Status#CANCELED} is terminal: a new subscription
     * is created instead of reactivating a canceled one.
     */
    public enum Status {
        TRIALING,
        ACTIVE,
        PAST_DUE,
        UNPAID,
        CANCELED,
        INCOMPLETE;

        private static final Map<Status, Set<Status>> TRANSITIONS = Map.of(
            TRIALING, EnumSet.of(ACTIVE, PAST_DUE, CANCELED, INCOMPLETE),
            ACTIVE, EnumSet.of(PAST_DUE, UNPAID, CANCELED),
            PAST_DUE, EnumSet.of(ACTIVE, UNPAID, CANCELED),
            UNPAID, EnumSet.of(ACTIVE, CANCELED),
            INCOMPLETE, EnumSet.of(ACTIVE, TRIALING, CANCELED),
            CANCELED, EnumSet.noneOf(Status.class));

        /**
         * @return {@code true} if moving from this status to {@code next} is allowed. Staying in
         * the same status is always allowed.
         */
        public boolean canTransitionTo(@NonNull Status next) {
            return this == next || TRANSITIONS.get(this).contains(next);
        }

        /**
         * Maps a Stripe subscription status to a local status.
         *
         * @throws IllegalArgumentException if the status is not known.
         */
        @NonNull
        public static Status fromStripeValue(@NonNull String value) {
            switch (value) {
                case "incomplete_expired":
                    return CANCELED;
                case "paused":
                    return UNPAID;
                default:
                    return Arrays.stream(values())
                        .filter(s -> s.name().equals(value.toUpperCase(Locale.ROOT)))
                        .findFirst()
                        .orElseThrow(() -> new IllegalArgumentException("unknown subscription status: " + value));
            }
        }

        @NonNull
        public String toValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
