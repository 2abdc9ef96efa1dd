package com.meterly.api.billing.entities;

import com.meterly.api.billing.models.PlanFeatures;
import com.meterly.api.billing.models.PlanLimits;
import com.meterly.api.platform.BasicEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A data access object that maps to the {@code plans} table in the database.
 */
@Entity
@Table(name = "plans")
@Data
@EqualsAndHashCode(callSuper = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Plan extends BasicEntity {

    @NonNull
    private String name;

    private String description;

    @NonNull
    @Column(precision = 12, scale = 2)
    private BigDecimal price;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private BillingInterval billingInterval = BillingInterval.MONTH;

    @NonNull
    @Builder.Default
    @Column(length = 4000)
    @Convert(converter = PlanFeaturesConverter.class)
    private PlanFeatures features = PlanFeatures.empty();

    @NonNull
    @Builder.Default
    @Column(length = 4000)
    @Convert(converter = PlanLimitsConverter.class)
    private PlanLimits limits = PlanLimits.empty();

    @Builder.Default
    private boolean isActive = true;

    @Builder.Default
    private boolean isPublic = true;

    @Column(unique = true)
    private String stripePriceId;

    private String stripeProductId;

    /**
     * @return the price of this plan expressed per month.
     */
    @NonNull
    public BigDecimal getMonthlyPrice() {
        if (billingInterval == BillingInterval.YEAR) {
            return price.divide(BigDecimal.valueOf(12), 2, RoundingMode.HALF_UP);
        }

        return price;
    }

    /**
     * @return the price of this plan expressed per year.
     */
    @NonNull
    public BigDecimal getYearlyPrice() {
        if (billingInterval == BillingInterval.MONTH) {
            return price.multiply(BigDecimal.valueOf(12));
        }

        return price;
    }

    public enum BillingInterval {
        MONTH,
        YEAR,
    }
}
