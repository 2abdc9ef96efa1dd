package com.meterly.api.billing;

import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.exceptions.SubscriptionNotFoundException;
import com.meterly.api.billing.upstream.StripeApi;
import com.meterly.api.contracts.NotificationServiceContract;
import com.meterly.api.contracts.NotificationType;
import com.meterly.api.platform.transaction.annotations.ReasonablyTransactional;
import com.stripe.exception.StripeException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;

import java.util.HashMap;

/**
 * Ends trials whose trial period is over.
 */
@Service
@Slf4j
class TrialLifecycleManager {

    private final SubscriptionRepository subscriptionRepository;
    private final PlanCatalog planCatalog;
    private final EntitlementService entitlementService;
    private final SubscriptionReconciler reconciler;
    private final NotificationServiceContract notificationServiceContract;
    private final StripeApi stripeApi;

    @Autowired
    TrialLifecycleManager(
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull PlanCatalog planCatalog,
        @NonNull EntitlementService entitlementService,
        @NonNull SubscriptionReconciler reconciler,
        @NonNull NotificationServiceContract notificationServiceContract,
        @NonNull StripeApi stripeApi
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.planCatalog = planCatalog;
        this.entitlementService = entitlementService;
        this.reconciler = reconciler;
        this.notificationServiceContract = notificationServiceContract;
        this.stripeApi = stripeApi;
    }

    /**
     * <p>
     * Ends the trial of a subscription if it is still trialing and its trial end has passed. The
     * subscription is re-read, so a trial converted since the sweep selected it is left alone.</p>
     * <ul>
     *     <li>With a default payment method on file, the subscription becomes active.</li>
     *     <li>Without one, it moves to the free plan if one exists, and to past due if not.</li>
     * </ul>
     *
     * @return the outcome, {@link SweepReport.Outcome#NO_OP} if the trial has not ended.
     * @throws SubscriptionNotFoundException if the subscription does not exist.
     * @throws ProcessorException            if Stripe cannot be reached.
     */
    @NonNull
    @ReasonablyTransactional(propagation = Propagation.REQUIRES_NEW)
    SweepReport.Outcome expireTrial(
        long subscriptionId,
        @NonNull EnforcementSnapshot snapshot
    ) throws SubscriptionNotFoundException, ProcessorException {
        val subscription = subscriptionRepository.findById(subscriptionId)
            .orElseThrow(() -> new SubscriptionNotFoundException("subscription does not exist"));

        if (!subscription.isTrialing() || subscription.getTrialEnd() == null || subscription.getTrialEnd().isAfter(snapshot.getNow())) {
            return SweepReport.Outcome.NO_OP;
        }

        final boolean hasPaymentMethod;
        try {
            hasPaymentMethod = subscription.getStripeCustomerId() != null
                && stripeApi.hasDefaultPaymentMethod(subscription.getStripeCustomerId());
        } catch (StripeException e) {
            throw new ProcessorException("failed to retrieve stripe customer", e);
        }

        val data = new HashMap<String, Object>();
        data.put("subscription_id", subscription.getId());
        data.put("plan_name", subscription.getPlan().getName());

        if (hasPaymentMethod) {
            subscription.setStatus(Subscription.Status.ACTIVE);
            subscriptionRepository.save(subscription);
            notificationServiceContract.requestNotification(subscription.getTenantId(), NotificationType.TRIAL_CONVERTED, data);
            log.info("converted trial of subscription {}", subscriptionId);
            return SweepReport.Outcome.TRIAL_CONVERTED;
        }

        val freePlan = planCatalog.findFreePlan(snapshot.getFreePlanName());
        if (freePlan.isPresent()) {
            boolean planChanged = false;
            if (subscription.getStripeSubscriptionId() != null && freePlan.get().getStripePriceId() != null) {
                try {
                    planChanged = reconciler.apply(subscription, stripeApi.swapSubscriptionPrice(
                            subscription.getStripeSubscriptionId(), freePlan.get().getStripePriceId(), false))
                        .isPlanChanged();
                } catch (StripeException e) {
                    throw new ProcessorException("failed to move stripe subscription to the free plan", e);
                }
            }

            // the reconciler has already replaced the entitlements if it moved the subscription.
            if (!planChanged) {
                subscription.setPlan(freePlan.get());
            }

            subscription.setStatus(Subscription.Status.ACTIVE);
            subscriptionRepository.save(subscription);
            if (!planChanged) {
                entitlementService.replaceEntitlements(subscription);
            }

            data.put("downgraded_to_free", true);
            notificationServiceContract.requestNotification(subscription.getTenantId(), NotificationType.TRIAL_EXPIRED, data);
            log.info("moved subscription {} to the free plan after its trial", subscriptionId);
            return SweepReport.Outcome.DOWNGRADED_TO_FREE;
        }

        subscription.setStatus(Subscription.Status.PAST_DUE);
        subscriptionRepository.save(subscription);
        data.put("downgraded_to_free", false);
        notificationServiceContract.requestNotification(subscription.getTenantId(), NotificationType.TRIAL_EXPIRED, data);
        log.info("subscription {} is past due after its trial", subscriptionId);
        return SweepReport.Outcome.MOVED_TO_PAST_DUE;
    }
}
