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

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Locale;

/**
 * A data access object that maps to the {@code invoices} table in the database. It mirrors an
 * invoice issued by Stripe.
 *
 * <p>
 * {@link Invoice#subscriptionId} is a weak reference: invoices are retained for audit after the
 * subscription they belong to is deleted.</p>
 */
@Entity
@Table(name = "invoices")
@Data
@EqualsAndHashCode(callSuper = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Invoice extends BasicEntity {

    private long tenantId;

    private Long subscriptionId;

    @NonNull
    @Column(unique = true, updatable = false)
    private String stripeInvoiceId;

    private String stripePaymentIntentId;

    private String invoiceNumber;

    @NonNull
    @Column(precision = 14, scale = 2)
    @Builder.Default
    private BigDecimal amountTotal = BigDecimal.ZERO;

    @NonNull
    @Column(precision = 14, scale = 2)
    @Builder.Default
    private BigDecimal amountPaid = BigDecimal.ZERO;

    @NonNull
    @Builder.Default
    private String currency = "USD";

    @NonNull
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private Status status = Status.DRAFT;

    private OffsetDateTime invoiceDate, dueDate, paidAt;

    @Column(length = 1024)
    private String hostedInvoiceUrl;

    @Column(length = 1024)
    private String invoicePdfUrl;

    @NonNull
    public BigDecimal getAmountDue() {
        return amountTotal.subtract(amountPaid);
    }

    public boolean isPaid() {
        return status == Status.PAID;
    }

    /**
     * @return {@code true} if the invoice is unpaid and its due date has passed.
     */
    public boolean isOverdue(@NonNull OffsetDateTime now) {
        return !isPaid() && dueDate != null && now.isAfter(dueDate);
    }

    public enum Status {
        DRAFT,
        OPEN,
        PAID,
        VOID,
        UNCOLLECTIBLE;

        @NonNull
        public static Status fromStripeValue(@NonNull String value) {
            return Arrays.stream(values())
                .filter(s -> s.name().equals(value.toUpperCase(Locale.ROOT)))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown invoice status: " + value));
        }
    }
}
