package com.meterly.api.billing;

import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.entities.UsageEventRepository;
import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.exceptions.SubscriptionNotFoundException;
import com.meterly.api.billing.upstream.EpochSeconds;
import com.meterly.api.billing.upstream.StripeApi;
import com.stripe.exception.StripeException;
import com.stripe.model.Price;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reports usage of metered features to the Stripe subscription items that bill them.
 */
@Service
@Slf4j
class MeteredUsageReporter {

    static final String FEATURE_METADATA_KEY = "feature";

    private static final String METERED_USAGE_TYPE = "metered";

    private final SubscriptionRepository subscriptionRepository;
    private final UsageEventRepository usageEventRepository;
    private final StripeApi stripeApi;

    @Autowired
    MeteredUsageReporter(
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull UsageEventRepository usageEventRepository,
        @NonNull StripeApi stripeApi
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.usageEventRepository = usageEventRepository;
        this.stripeApi = stripeApi;
    }

    /**
     * <p>
     * Sets the quantity of every metered item of the subscription to the usage recorded for its
     * feature in the current usage window. An item's feature is the {@code feature} metadata of
     * its price, or else the price's lookup key. Items of licensed prices are left alone.</p>
     * <p>
     * Quantities replace what was reported before, and each report is keyed on the item, the
     * window and the total. Reporting the same usage again changes nothing.</p>
     * <p>
     * A failed item does not stop the other items from being reported.</p>
     *
     * @return {@link SweepReport.Outcome#UPDATED} if any usage was reported, or else {@link
     * SweepReport.Outcome#NO_OP}.
     * @throws SubscriptionNotFoundException if the subscription does not exist.
     * @throws ProcessorException            if the Stripe subscription cannot be retrieved or the
     *                                       usage of any item cannot be reported.
     */
    @NonNull
    @Transactional(readOnly = true)
    SweepReport.Outcome report(long subscriptionId, @NonNull EnforcementSnapshot snapshot)
        throws SubscriptionNotFoundException, ProcessorException {
        val subscription = subscriptionRepository.findById(subscriptionId)
            .orElseThrow(() -> new SubscriptionNotFoundException("subscription does not exist"));

        if (subscription.getStripeSubscriptionId() == null) {
            return SweepReport.Outcome.NO_OP;
        }

        final com.stripe.model.Subscription remote;
        try {
            remote = stripeApi.getSubscription(subscription.getStripeSubscriptionId());
        } catch (StripeException e) {
            throw new ProcessorException("failed to retrieve stripe subscription", e);
        }

        if (remote.getItems() == null) {
            return SweepReport.Outcome.NO_OP;
        }

        val now = snapshot.getNow();
        val windowStart = subscription.getCurrentPeriodStart() != null
            ? subscription.getCurrentPeriodStart()
            : now.minus(snapshot.getDefaultUsagePeriod());

        int reported = 0;
        StripeException failure = null;
        for (val item : remote.getItems().getData()) {
            val feature = meteredFeatureOf(item.getPrice());
            if (feature == null) {
                continue;
            }

            val total = usageEventRepository.sumQuantity(subscriptionId, feature, windowStart, now);
            val key = String.format("usage-%s-%d-%d", item.getId(), EpochSeconds.fromDateTime(windowStart), total);
            try {
                stripeApi.reportUsage(item.getId(), total, key);
                reported++;
                log.debug("reported {} units of {} usage for subscription {}", total, feature, subscriptionId);
            } catch (StripeException e) {
                log.warn("failed to report {} usage for subscription {}", feature, subscriptionId, e);
                if (failure == null) {
                    failure = e;
                }
            }
        }

        if (failure != null) {
            throw new ProcessorException("failed to report metered usage", failure);
        }

        return reported > 0 ? SweepReport.Outcome.UPDATED : SweepReport.Outcome.NO_OP;
    }

    private static String meteredFeatureOf(Price price) {
        if (price == null || price.getRecurring() == null
            || !METERED_USAGE_TYPE.equals(price.getRecurring().getUsageType())) {
            return null;
        }

        if (price.getMetadata() != null && price.getMetadata().get(FEATURE_METADATA_KEY) != null) {
            return price.getMetadata().get(FEATURE_METADATA_KEY);
        }

        return price.getLookupKey();
    }
}
