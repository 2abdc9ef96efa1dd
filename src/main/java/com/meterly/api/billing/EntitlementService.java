package com.meterly.api.billing;

import com.meterly.api.billing.entities.Entitlement;
import com.meterly.api.billing.entities.EntitlementRepository;
import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.exceptions.SubscriptionNotFoundException;
import com.meterly.api.billing.payload.EntitlementUsage;
import com.meterly.api.platform.transaction.annotations.ReasonablyTransactional;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maintains the per-feature {@link Entitlement}s of subscriptions.
 */
@Service
@Slf4j
class EntitlementService {

    private final EntitlementRepository entitlementRepository;
    private final SubscriptionRepository subscriptionRepository;

    @Autowired
    EntitlementService(
        @NonNull EntitlementRepository entitlementRepository,
        @NonNull SubscriptionRepository subscriptionRepository
    ) {
        this.entitlementRepository = entitlementRepository;
        this.subscriptionRepository = subscriptionRepository;
    }

    /**
     * Creates entitlements from the limits of the subscription's plan, unless the subscription
     * already has some. Replaying the same creation event therefore yields one set.
     *
     * @return the subscription's entitlements.
     */
    @NonNull
    @ReasonablyTransactional
    List<Entitlement> createEntitlements(@NonNull Subscription subscription) {
        if (entitlementRepository.countBySubscriptionId(subscription.getId()) > 0) {
            return entitlementRepository.findAllBySubscriptionId(subscription.getId());
        }

        return save(build(subscription));
    }

    /**
     * Discards all entitlements of the subscription and creates fresh ones from its current plan.
     * Usage counters restart at zero.
     *
     * @return the new entitlements.
     */
    @NonNull
    @ReasonablyTransactional
    List<Entitlement> replaceEntitlements(@NonNull Subscription subscription) {
        val removed = entitlementRepository.deleteAllBySubscriptionId(subscription.getId());
        log.debug("discarded {} entitlements of subscription {}", removed, subscription.getId());
        return save(build(subscription));
    }

    /**
     * @return usage of every metered feature of the subscription.
     * @throws SubscriptionNotFoundException if the subscription does not exist or belongs to
     *                                       another tenant.
     */
    @NonNull
    @Transactional(readOnly = true)
    public List<EntitlementUsage> getUsageSummary(long tenantId, long subscriptionId) throws SubscriptionNotFoundException {
        val subscription = subscriptionRepository.findById(subscriptionId)
            .filter(s -> s.getTenantId() == tenantId)
            .orElseThrow(() -> new SubscriptionNotFoundException("subscription does not exist"));

        return entitlementRepository.findAllBySubscriptionId(subscription.getId())
            .stream()
            .map(EntitlementUsage::from)
            .collect(Collectors.toUnmodifiableList());
    }

    @NonNull
    private List<Entitlement> build(@NonNull Subscription subscription) {
        val entitlements = new ArrayList<Entitlement>();
        subscription.getPlan().getLimits().asMap().forEach((feature, limit) -> {
            val frequency = Entitlement.ResetFrequency.forFeature(feature);
            entitlements.add(
                Entitlement.builder()
                    .tenantId(subscription.getTenantId())
                    .subscription(subscription)
                    .feature(feature)
                    .limitValue(limit)
                    .used(0)
                    .resetFrequency(frequency)
                    .resetAt(frequency == Entitlement.ResetFrequency.MONTHLY ? subscription.getCurrentPeriodEnd() : null)
                    .build());
        });

        return entitlements;
    }

    @NonNull
    private List<Entitlement> save(@NonNull List<Entitlement> entitlements) {
        val saved = new ArrayList<Entitlement>(entitlements.size());
        entitlementRepository.saveAll(entitlements).forEach(saved::add);
        return saved;
    }
}
