package com.meterly.api.billing;

import com.meterly.api.billing.entities.EntitlementRepository;
import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.entities.UsageEvent;
import com.meterly.api.billing.entities.UsageEventRepository;
import com.meterly.api.billing.exceptions.InvalidUsageException;
import com.meterly.api.billing.exceptions.SubscriptionNotFoundException;
import com.meterly.api.platform.transaction.annotations.ReasonablyTransactional;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Appends usage events and keeps the cached entitlement counters up to date. Quotas are not
 * enforced here: usage beyond a limit is recorded and billed later by the quota enforcement sweep.
 * Counters are incremented in place, so concurrent recorders never conflict with each other.
 */
@Service
@Slf4j
public class UsageRecorder {

    private final SubscriptionRepository subscriptionRepository;
    private final EntitlementRepository entitlementRepository;
    private final UsageEventRepository usageEventRepository;

    @Autowired
    UsageRecorder(
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull EntitlementRepository entitlementRepository,
        @NonNull UsageEventRepository usageEventRepository
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.entitlementRepository = entitlementRepository;
        this.usageEventRepository = usageEventRepository;
    }

    /**
     * Records usage of a feature by a tenant's subscription.
     *
     * @param tenantId       the tenant that owns the subscription.
     * @param subscriptionId id of the subscription.
     * @param feature        the feature key, or any other event type.
     * @param quantity       a positive number of units.
     * @param metadata       arbitrary event metadata, may be {@literal null}.
     * @return the recorded event.
     * @throws SubscriptionNotFoundException if the subscription does not exist or belongs to
     *                                       another tenant.
     * @throws InvalidUsageException         if the feature is blank or quantity is not positive.
     */
    @NonNull
    @ReasonablyTransactional
    public UsageEvent record(
        long tenantId,
        long subscriptionId,
        String feature,
        int quantity,
        Map<String, Object> metadata
    ) throws SubscriptionNotFoundException, InvalidUsageException {
        validate(feature, quantity);
        val subscription = subscriptionRepository.findById(subscriptionId)
            .filter(s -> s.getTenantId() == tenantId)
            .orElseThrow(() -> new SubscriptionNotFoundException("subscription does not exist"));

        return append(subscription, feature, quantity, metadata);
    }

    /**
     * Records usage without surfacing errors to the caller. The outcome of a failed attempt is
     * logged.
     *
     * @return {@code true} if the usage event was recorded.
     */
    public boolean recordUsage(long subscriptionId, String eventType, int quantity, Map<String, Object> metadata) {
        try {
            validate(eventType, quantity);
            val subscription = subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new SubscriptionNotFoundException("subscription does not exist"));

            append(subscription, eventType, quantity, metadata);
            return true;
        } catch (SubscriptionNotFoundException | InvalidUsageException e) {
            log.warn("failed to record usage for subscription {}: {}", subscriptionId, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("failed to record usage for subscription {}", subscriptionId, e);
            return false;
        }
    }

    /**
     * An advisory quota check. Features without an entitlement are not metered and always usable.
     *
     * @return {@code true} if {@code amount} more units of the feature fit within the limit.
     */
    @Transactional(readOnly = true)
    public boolean canUse(long subscriptionId, @NonNull String feature, int amount) {
        return entitlementRepository.findBySubscriptionIdAndFeature(subscriptionId, feature)
            .map(e -> e.canUse(amount))
            .orElse(true);
    }

    @NonNull
    private UsageEvent append(
        @NonNull Subscription subscription,
        @NonNull String eventType,
        int quantity,
        Map<String, Object> metadata
    ) {
        val event = usageEventRepository.save(
            UsageEvent.builder()
                .tenantId(subscription.getTenantId())
                .subscription(subscription)
                .eventType(eventType)
                .quantity(quantity)
                .occurredAt(OffsetDateTime.now())
                .metadata(metadata == null ? new HashMap<>() : new HashMap<>(metadata))
                .build());

        // unmetered features have no entitlement row to update.
        entitlementRepository.incrementUsage(subscription.getId(), eventType, quantity);
        return event;
    }

    private static void validate(String eventType, int quantity) throws InvalidUsageException {
        if (eventType == null || eventType.isBlank()) {
            throw new InvalidUsageException("usage event type must not be blank");
        }

        if (quantity < 1) {
            throw new InvalidUsageException("usage quantity must be at least 1");
        }
    }
}
