package com.meterly.api.billing.entities;

import com.meterly.api.billing.models.Feature;
import com.meterly.api.billing.models.PlanLimits;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code entitlements} table in the database. It is the
 * per-subscription, per-feature usage counter and cap derived from a {@link Plan}.
 *
 * <p>
 * {@link Entitlement#used} is a cache of the sum of {@link UsageEvent} quantities in the current
 * billing period. Enforcement sweeps overwrite it with the authoritative sum.</p>
 * <p>
 * Entitlements are replaced, not archived, when a subscription changes its plan. Hence they are
 * hard-deleted and do not extend the soft-deletable base entity.</p>
 */
@Entity
@Table(
    name = "entitlements",
    uniqueConstraints = @UniqueConstraint(columnNames = {"subscription_id", "feature"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Entitlement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Version
    private long version;

    private long tenantId;

    @NonNull
    @ManyToOne(optional = false)
    private Subscription subscription;

    @NonNull
    private String feature;

    /**
     * {@link PlanLimits#UNLIMITED} means unlimited; {@literal null} means a boolean feature
     * without a numeric cap.
     */
    private Integer limitValue;

    private int used;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private ResetFrequency resetFrequency = ResetFrequency.NEVER;

    private OffsetDateTime resetAt;

    /**
     * @return {@code true} if the feature has no numeric cap.
     */
    public boolean isUnlimited() {
        return limitValue == null || limitValue == PlanLimits.UNLIMITED;
    }

    public boolean isOverLimit() {
        return limitValue != null && limitValue >= 0 && used > limitValue;
    }

    /**
     * @return {@code true} if {@code amount} more units fit within the limit. Always {@code true}
     * for unlimited features.
     */
    public boolean canUse(int amount) {
        if (isUnlimited()) {
            return true;
        }

        return (long) used + amount <= limitValue;
    }

    /**
     * @return the units left before reaching the limit, or {@link PlanLimits#UNLIMITED} if the
     * feature has no cap.
     */
    public int getRemainingQuota() {
        if (isUnlimited()) {
            return PlanLimits.UNLIMITED;
        }

        return Math.max(0, limitValue - used);
    }

    /**
     * @return used units as a percentage of the limit, {@code 0} for unlimited features.
     */
    public double getUsagePercentage() {
        if (isUnlimited()) {
            return 0;
        }

        if (limitValue == 0) {
            return used > 0 ? 100 : 0;
        }

        return Math.min(100.0, used * 100.0 / limitValue);
    }

    public void incrementUsage(int amount) {
        setUsed(used + amount);
    }

    public void decrementUsage(int amount) {
        setUsed(used - amount);
    }

    public void resetUsage() {
        used = 0;
    }

    /**
     * Sets the cached usage counter, which never goes below zero.
     */
    public void setUsed(int used) {
        this.used = Math.max(0, used);
    }

    public enum ResetFrequency {
        MONTHLY,
        NEVER;

        @NonNull
        public static ResetFrequency forFeature(@NonNull String feature) {
            return Feature.isMonthly(feature) ? MONTHLY : NEVER;
        }
    }
}
