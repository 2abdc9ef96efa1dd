package com.meterly.api.billing.entities;

import com.meterly.api.platform.BasicEntity;
import jakarta.persistence.Column;
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

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code overage_charges} table in the database. It is the
 * Stripe invoice item owed for one {@code <feature>_overage} usage event.
 *
 * <p>
 * A charge stays {@link Status#PENDING} until Stripe accepts it. Pending charges are retried with
 * their original {@link OverageCharge#idempotencyKey}, so Stripe creates at most one invoice item
 * per charge.</p>
 */
@Entity
@Table(name = "overage_charges")
@Data
@EqualsAndHashCode(callSuper = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverageCharge extends BasicEntity {

    private long tenantId;

    private long subscriptionId;

    @NonNull
    @Column(updatable = false)
    private String feature;

    @Column(updatable = false)
    private int units;

    /**
     * Amount in the currency's minor units.
     */
    @Column(updatable = false)
    private long amount;

    @NonNull
    @Column(updatable = false)
    private String currency;

    @NonNull
    @Column(updatable = false)
    private String description;

    @NonNull
    @Column(unique = true, updatable = false)
    private String idempotencyKey;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private Status status = Status.PENDING;

    private int attempts;

    @Column(length = 1024)
    private String lastError;

    private String stripeInvoiceItemId;

    private OffsetDateTime chargedAt;

    public boolean isPending() {
        return status == Status.PENDING;
    }

    /**
     * Records a failed attempt to charge. The charge stays pending.
     */
    public void markFailed(String error) {
        attempts++;
        lastError = error;
    }

    public void markCharged(@NonNull String stripeInvoiceItemId, @NonNull OffsetDateTime at) {
        attempts++;
        status = Status.CHARGED;
        lastError = null;
        this.stripeInvoiceItemId = stripeInvoiceItemId;
        chargedAt = at;
    }

    public enum Status {
        PENDING,
        CHARGED,
    }
}
