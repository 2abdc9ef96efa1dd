package com.meterly.api.billing;

import com.meterly.api.billing.entities.Plan;
import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.upstream.EpochSeconds;
import com.meterly.api.billing.upstream.StripeApi;
import com.meterly.api.platform.transaction.annotations.ReasonablyTransactional;
import com.stripe.exception.StripeException;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * <p>
 * Copies Stripe's view of a subscription onto the local record. Stripe is the source of truth for
 * subscription fields: its reported values replace local ones instead of being merged as deltas,
 * which keeps replayed and out-of-order webhook deliveries harmless.</p>
 * <p>
 * Two local rules are kept regardless of what Stripe reports: a canceled subscription stays
 * canceled, and {@link Subscription#getCanceledAt()} is never moved once set.</p>
 */
@Service
@Slf4j
class SubscriptionReconciler {

    private final SubscriptionRepository subscriptionRepository;
    private final PlanCatalog planCatalog;
    private final EntitlementService entitlementService;
    private final TenantResolver tenantResolver;
    private final StripeApi stripeApi;

    @Autowired
    SubscriptionReconciler(
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull PlanCatalog planCatalog,
        @NonNull EntitlementService entitlementService,
        @NonNull TenantResolver tenantResolver,
        @NonNull StripeApi stripeApi
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.planCatalog = planCatalog;
        this.entitlementService = entitlementService;
        this.tenantResolver = tenantResolver;
        this.stripeApi = stripeApi;
    }

    /**
     * Fetches the current state of a Stripe subscription and applies it locally, creating the
     * local record on first sight. The event that triggered the refresh may be stale, so its
     * payload is not used.
     *
     * @return the result, or empty if the subscription cannot be attributed to a tenant or a plan.
     * @throws ProcessorException if the subscription cannot be retrieved from Stripe.
     */
    @NonNull
    @ReasonablyTransactional
    Optional<Result> refresh(@NonNull String stripeSubscriptionId) throws ProcessorException {
        final com.stripe.model.Subscription remote;
        try {
            remote = stripeApi.getSubscription(stripeSubscriptionId);
        } catch (StripeException e) {
            throw new ProcessorException("failed to retrieve stripe subscription", e);
        }

        return adopt(remote);
    }

    /**
     * Applies a Stripe subscription to its local record. If there is none, the record is created
     * from the Stripe object along with entitlements of the plan that matches its price.
     *
     * @return the result, or empty if the subscription cannot be attributed to a tenant or a plan.
     * @throws ProcessorException if the tenant lookup needs Stripe and the call fails.
     */
    @NonNull
    @ReasonablyTransactional
    Optional<Result> adopt(@NonNull com.stripe.model.Subscription remote) throws ProcessorException {
        val existing = subscriptionRepository.findByStripeSubscriptionId(remote.getId());
        if (existing.isPresent()) {
            if (existing.get().isDeleted()) {
                log.warn("ignoring stripe update for deleted subscription {}", existing.get().getId());
                return Optional.empty();
            }

            return Optional.of(apply(existing.get(), remote));
        }

        val plan = planCatalog.findByStripePriceId(priceIdOf(remote));
        if (plan.isEmpty()) {
            log.warn("no plan matches the price of stripe subscription {}", remote.getId());
            return Optional.empty();
        }

        val tenantId = tenantResolver.resolve(remote.getMetadata(), remote.getCustomer());
        if (tenantId.isEmpty()) {
            log.warn("unable to attribute stripe subscription {} to a tenant", remote.getId());
            return Optional.empty();
        }

        val subscription = Subscription.builder()
            .tenantId(tenantId.get())
            .plan(plan.get())
            .stripeSubscriptionId(remote.getId())
            .build();

        copyFields(subscription, remote);
        val saved = subscriptionRepository.save(subscription);
        entitlementService.createEntitlements(saved);
        log.info("adopted stripe subscription {} as subscription {}", remote.getId(), saved.getId());
        return Optional.of(new Result(saved, null, true, false));
    }

    /**
     * Overwrites the local subscription with the fields of {@code remote} and persists it. A change
     * of price moves the subscription to the matching plan and replaces its entitlements.
     */
    @NonNull
    @ReasonablyTransactional
    Result apply(@NonNull Subscription local, @NonNull com.stripe.model.Subscription remote) {
        val previousStatus = local.getStatus();
        copyFields(local, remote);

        val plan = planCatalog.findByStripePriceId(priceIdOf(remote));
        val planChanged = plan.isPresent() && !plan.get().getId().equals(local.getPlan().getId());
        plan.ifPresent(local::setPlan);

        val saved = subscriptionRepository.save(local);
        if (planChanged) {
            entitlementService.replaceEntitlements(saved);
        } else {
            entitlementService.createEntitlements(saved);
        }

        return new Result(saved, previousStatus, false, planChanged);
    }

    /**
     * Moves the subscription to the canceled status, setting the cancellation time if it is not
     * already set.
     */
    @NonNull
    @ReasonablyTransactional
    Subscription markCanceled(@NonNull Subscription subscription, @NonNull OffsetDateTime at) {
        subscription.setStatus(Subscription.Status.CANCELED);
        subscription.setCancelAtPeriodEnd(false);
        subscription.markCanceledAt(at);
        return subscriptionRepository.save(subscription);
    }

    private static void copyFields(@NonNull Subscription local, @NonNull com.stripe.model.Subscription remote) {
        parseStatus(remote).ifPresent(status -> {
            if (local.isCanceled() && status != Subscription.Status.CANCELED) {
                log.warn("subscription {} is canceled locally, ignoring stripe status '{}'", local.getId(), remote.getStatus());
            } else {
                local.setStatus(status);
            }
        });

        if (remote.getCustomer() != null) {
            local.setStripeCustomerId(remote.getCustomer());
        }

        if (remote.getCurrentPeriodStart() != null) {
            local.setCurrentPeriodStart(EpochSeconds.toDateTime(remote.getCurrentPeriodStart()));
        }

        if (remote.getCurrentPeriodEnd() != null) {
            local.setCurrentPeriodEnd(EpochSeconds.toDateTime(remote.getCurrentPeriodEnd()));
        }

        local.setTrialStart(EpochSeconds.toDateTime(remote.getTrialStart()));
        local.setTrialEnd(EpochSeconds.toDateTime(remote.getTrialEnd()));
        local.setCancelAtPeriodEnd(Boolean.TRUE.equals(remote.getCancelAtPeriodEnd()));
        if (remote.getCanceledAt() != null) {
            local.markCanceledAt(EpochSeconds.toDateTime(remote.getCanceledAt()));
        }

        if (local.isCanceled()) {
            local.markCanceledAt(OffsetDateTime.now());
        }
    }

    @NonNull
    private static Optional<Subscription.Status> parseStatus(@NonNull com.stripe.model.Subscription remote) {
        if (remote.getStatus() == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(Subscription.Status.fromStripeValue(remote.getStatus()));
        } catch (IllegalArgumentException e) {
            log.warn("keeping local status, unknown status '{}' of stripe subscription {}", remote.getStatus(), remote.getId());
            return Optional.empty();
        }
    }

    static String priceIdOf(@NonNull com.stripe.model.Subscription remote) {
        val items = remote.getItems();
        if (items == null || items.getData() == null || items.getData().isEmpty()) {
            return null;
        }

        val price = items.getData().get(0).getPrice();
        return price == null ? null : price.getId();
    }

    /**
     * Outcome of applying a Stripe subscription locally.
     */
    @Value
    static class Result {

        @NonNull
        Subscription subscription;

        /**
         * {@literal null} if the subscription was created.
         */
        Subscription.Status previousStatus;

        boolean created;

        boolean planChanged;

        boolean isStatusChanged() {
            return previousStatus != null && previousStatus != subscription.getStatus();
        }
    }
}
