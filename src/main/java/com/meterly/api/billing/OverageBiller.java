package com.meterly.api.billing;

import com.meterly.api.billing.entities.Entitlement;
import com.meterly.api.billing.entities.OverageCharge;
import com.meterly.api.billing.entities.OverageChargeRepository;
import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.UsageEvent;
import com.meterly.api.billing.entities.UsageEventRepository;
import com.meterly.api.billing.exceptions.ErrorKind;
import com.meterly.api.billing.models.Feature;
import com.meterly.api.billing.upstream.EpochSeconds;
import com.meterly.api.billing.upstream.MinorUnits;
import com.meterly.api.billing.upstream.StripeApi;
import com.meterly.api.contracts.NotificationServiceContract;
import com.meterly.api.contracts.NotificationType;
import com.stripe.exception.StripeException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Records and charges usage beyond a subscription's limits.
 */
@Service
@Slf4j
class OverageBiller {

    private final UsageEventRepository usageEventRepository;
    private final OverageChargeRepository overageChargeRepository;
    private final NotificationServiceContract notificationServiceContract;
    private final StripeApi stripeApi;

    @Autowired
    OverageBiller(
        @NonNull UsageEventRepository usageEventRepository,
        @NonNull OverageChargeRepository overageChargeRepository,
        @NonNull NotificationServiceContract notificationServiceContract,
        @NonNull StripeApi stripeApi
    ) {
        this.usageEventRepository = usageEventRepository;
        this.overageChargeRepository = overageChargeRepository;
        this.notificationServiceContract = notificationServiceContract;
        this.stripeApi = stripeApi;
    }

    /**
     * <p>
     * Bills {@code delta} units of overage of an entitlement. The overage usage event is appended
     * before anything is charged, so the next sweep counts these units as billed even if the
     * charge fails. A failed charge stays pending and is retried by
     * {@link #retryPendingCharges(Subscription, EnforcementSnapshot)}.</p>
     * <p>
     * The Stripe invoice item is keyed on the entitlement and the cumulative overage of the
     * billing period, which makes a repeated charge for the same units collapse into one item.</p>
     *
     * @param subscription the subscription over its limit.
     * @param entitlement  the entitlement whose limit was exceeded.
     * @param usage        total usage of the feature in the current period.
     * @param delta        units of overage not billed yet, at least 1.
     * @param periodStart  start of the usage window.
     * @param snapshot     the sweep's configuration.
     * @return {@link SweepReport.Outcome#BILLED} if the overage was recorded and, where it has a
     * cost, charged; {@link SweepReport.Outcome#BILLING_FAILED} if the charge failed.
     */
    @NonNull
    SweepReport.Outcome bill(
        @NonNull Subscription subscription,
        @NonNull Entitlement entitlement,
        long usage,
        long delta,
        @NonNull OffsetDateTime periodStart,
        @NonNull EnforcementSnapshot snapshot
    ) {
        if (delta < 1) {
            throw new IllegalArgumentException("overage delta must be positive");
        }

        val feature = entitlement.getFeature();
        val rate = snapshot.overageRate(feature);
        val cost = rate.multiply(BigDecimal.valueOf(delta)).setScale(2, RoundingMode.HALF_UP);
        val cumulativeOverage = usage - entitlement.getLimitValue();

        val metadata = new HashMap<String, Object>();
        metadata.put("rate", rate);
        metadata.put("cost", cost);
        metadata.put("limit", entitlement.getLimitValue());
        metadata.put("usage", usage);
        metadata.put("currency", snapshot.getCurrency());
        usageEventRepository.save(
            UsageEvent.builder()
                .tenantId(subscription.getTenantId())
                .subscription(subscription)
                .eventType(Feature.overageEventType(feature))
                .quantity(Math.toIntExact(delta))
                .occurredAt(snapshot.getNow())
                .metadata(metadata)
                .build());

        SweepReport.Outcome outcome = SweepReport.Outcome.BILLED;
        if (cost.signum() > 0) {
            val charge = overageChargeRepository.save(
                OverageCharge.builder()
                    .tenantId(subscription.getTenantId())
                    .subscriptionId(subscription.getId())
                    .feature(feature)
                    .units(Math.toIntExact(delta))
                    .amount(MinorUnits.fromDecimal(cost, snapshot.getCurrency()))
                    .currency(snapshot.getCurrency().toLowerCase(Locale.ROOT))
                    .description(String.format("%s overage: %d units", feature, delta))
                    .idempotencyKey(String.format("overage-%d-%s-%d-%d-%d",
                        subscription.getId(), feature, EpochSeconds.fromDateTime(periodStart),
                        entitlement.getId(), cumulativeOverage))
                    .build());

            outcome = charge(subscription, charge, snapshot);
        }

        val data = new HashMap<String, Object>();
        data.put("subscription_id", subscription.getId());
        data.put("feature", feature);
        data.put("overage", delta);
        data.put("cost", cost);
        data.put("currency", snapshot.getCurrency());
        notificationServiceContract.requestNotification(subscription.getTenantId(), NotificationType.USAGE_OVERAGE, data);
        log.info("recorded {} units of {} overage for subscription {}", delta, feature, subscription.getId());
        return outcome;
    }

    /**
     * Attempts every pending overage charge of the subscription again, with the idempotency key
     * of its first attempt.
     *
     * @return one entry per attempted charge.
     */
    @NonNull
    List<SweepReport.Entry> retryPendingCharges(@NonNull Subscription subscription, @NonNull EnforcementSnapshot snapshot) {
        val entries = new ArrayList<SweepReport.Entry>();
        if (subscription.getStripeCustomerId() == null) {
            return entries;
        }

        for (val charge : overageChargeRepository.findAllBySubscriptionIdAndStatus(subscription.getId(), OverageCharge.Status.PENDING)) {
            log.info("retrying {} overage charge {} of subscription {}", charge.getFeature(), charge.getId(), subscription.getId());
            entries.add(entryOf(subscription.getId(), charge.getFeature(), charge(subscription, charge, snapshot)));
        }

        return entries;
    }

    @NonNull
    static SweepReport.Entry entryOf(long subscriptionId, @NonNull String feature, @NonNull SweepReport.Outcome outcome) {
        if (outcome == SweepReport.Outcome.BILLING_FAILED) {
            return SweepReport.Entry.failed(subscriptionId, outcome, ErrorKind.PROCESSOR,
                String.format("failed to charge %s overage", feature));
        }

        return SweepReport.Entry.of(subscriptionId, outcome);
    }

    @NonNull
    private SweepReport.Outcome charge(
        @NonNull Subscription subscription,
        @NonNull OverageCharge charge,
        @NonNull EnforcementSnapshot snapshot
    ) {
        if (subscription.getStripeCustomerId() == null) {
            log.warn("subscription {} has no stripe customer, deferring {} overage charge", subscription.getId(), charge.getFeature());
            return SweepReport.Outcome.BILLED;
        }

        SweepReport.Outcome outcome = SweepReport.Outcome.BILLED;
        try {
            val item = stripeApi.createInvoiceItem(
                subscription.getStripeCustomerId(),
                charge.getAmount(),
                charge.getCurrency(),
                charge.getDescription(),
                Map.of(
                    "subscription_id", String.valueOf(subscription.getId()),
                    "feature", charge.getFeature(),
                    "units", String.valueOf(charge.getUnits())),
                charge.getIdempotencyKey());

            charge.markCharged(item.getId(), snapshot.getNow());
        } catch (StripeException e) {
            log.error("failed to charge {} overage of subscription {}", charge.getFeature(), subscription.getId(), e);
            charge.markFailed(e.getMessage());
            outcome = SweepReport.Outcome.BILLING_FAILED;
        }

        overageChargeRepository.save(charge);
        return outcome;
    }
}
