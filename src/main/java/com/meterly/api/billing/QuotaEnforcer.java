package com.meterly.api.billing;

import com.meterly.api.billing.entities.EntitlementRepository;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.entities.UsageEventRepository;
import com.meterly.api.billing.exceptions.SubscriptionNotFoundException;
import com.meterly.api.billing.models.Feature;
import com.meterly.api.platform.transaction.annotations.ReasonablyTransactional;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Recomputes entitlement counters from the usage log and bills usage beyond limits.
 */
@Service
@Slf4j
class QuotaEnforcer {

    private final SubscriptionRepository subscriptionRepository;
    private final EntitlementRepository entitlementRepository;
    private final UsageEventRepository usageEventRepository;
    private final OverageBiller overageBiller;

    @Autowired
    QuotaEnforcer(
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull EntitlementRepository entitlementRepository,
        @NonNull UsageEventRepository usageEventRepository,
        @NonNull OverageBiller overageBiller
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.entitlementRepository = entitlementRepository;
        this.usageEventRepository = usageEventRepository;
        this.overageBiller = overageBiller;
    }

    /**
     * <p>
     * Enforces the limits of one subscription over its current usage window, which starts at the
     * beginning of the billing period, or {@link EnforcementSnapshot#getDefaultUsagePeriod()}
     * before now if the period is unknown.</p>
     * <p>
     * Pending overage charges that failed in earlier sweeps are attempted again first. Every
     * entitlement's counter is then set to the usage summed from the log. For each limited
     * entitlement over its limit, only the overage not yet recorded as {@code <feature>_overage}
     * events since the entitlement took effect is billed, so running this again for the same
     * usage bills nothing. Overage recorded against a replaced entitlement does not count, which
     * makes usage beyond a raised limit billable again.</p>
     *
     * @return one entry per billed feature, or a single entry if nothing was billed.
     * @throws SubscriptionNotFoundException if the subscription does not exist.
     */
    @NonNull
    @ReasonablyTransactional(propagation = Propagation.REQUIRES_NEW)
    List<SweepReport.Entry> enforce(long subscriptionId, @NonNull EnforcementSnapshot snapshot) throws SubscriptionNotFoundException {
        val subscription = subscriptionRepository.findById(subscriptionId)
            .orElseThrow(() -> new SubscriptionNotFoundException("subscription does not exist"));

        val now = snapshot.getNow();
        val windowStart = subscription.getCurrentPeriodStart() != null
            ? subscription.getCurrentPeriodStart()
            : now.minus(snapshot.getDefaultUsagePeriod());

        val usage = new HashMap<String, Long>();
        for (val total : usageEventRepository.sumQuantitiesByEventType(subscriptionId, windowStart, now)) {
            usage.put(total.getEventType(), total.getTotal() == null ? 0L : total.getTotal());
        }

        val entries = new ArrayList<>(overageBiller.retryPendingCharges(subscription, snapshot));

        boolean healed = false;
        for (val entitlement : entitlementRepository.findAllBySubscriptionId(subscriptionId)) {
            val used = usage.getOrDefault(entitlement.getFeature(), 0L);
            val clamped = (int) Math.min(used, Integer.MAX_VALUE);
            if (entitlement.getUsed() != clamped) {
                log.debug("correcting {} usage of subscription {} from {} to {}",
                    entitlement.getFeature(), subscriptionId, entitlement.getUsed(), clamped);
                entitlement.setUsed(clamped);
                entitlementRepository.save(entitlement);
                healed = true;
            }

            if (entitlement.isUnlimited() || used <= entitlement.getLimitValue()) {
                continue;
            }

            val overage = used - entitlement.getLimitValue();
            val takenEffectAt = entitlement.getCreatedAt();
            val billedSince = takenEffectAt != null && takenEffectAt.isAfter(windowStart) ? takenEffectAt : windowStart;
            val billed = usageEventRepository.sumQuantity(
                subscriptionId, Feature.overageEventType(entitlement.getFeature()), billedSince, now);

            val delta = overage - billed;
            if (delta > 0) {
                val outcome = overageBiller.bill(subscription, entitlement, used, delta, windowStart, snapshot);
                entries.add(OverageBiller.entryOf(subscriptionId, entitlement.getFeature(), outcome));
            }
        }

        if (entries.isEmpty()) {
            entries.add(SweepReport.Entry.of(subscriptionId, healed ? SweepReport.Outcome.UPDATED : SweepReport.Outcome.NO_OP));
        }

        return entries;
    }
}
