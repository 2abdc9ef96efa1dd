package com.meterly.api.billing;

import com.meterly.api.billing.entities.Plan;
import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.exceptions.DuplicateSubscriptionException;
import com.meterly.api.billing.exceptions.InvalidTrialPeriodException;
import com.meterly.api.billing.exceptions.PlanNotFoundException;
import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.exceptions.SubscriptionNotFoundException;
import com.meterly.api.billing.exceptions.SubscriptionStateException;
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

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Tenant-initiated transitions of the subscription state machine. Every transition that involves
 * Stripe calls Stripe first and mutates local state only after the call succeeds, so a failed
 * call leaves the local record untouched.
 */
@Service
@Slf4j
public class SubscriptionService {

    static final Set<Subscription.Status> LIVE_STATUSES = EnumSet.of(
        Subscription.Status.ACTIVE, Subscription.Status.TRIALING);

    private final BillingConfiguration billingConfig;
    private final SubscriptionRepository subscriptionRepository;
    private final PlanCatalog planCatalog;
    private final EntitlementService entitlementService;
    private final SubscriptionReconciler reconciler;
    private final InvoiceMirror invoiceMirror;
    private final NotificationServiceContract notificationServiceContract;
    private final StripeApi stripeApi;

    @Autowired
    SubscriptionService(
        @NonNull BillingConfiguration billingConfig,
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull PlanCatalog planCatalog,
        @NonNull EntitlementService entitlementService,
        @NonNull SubscriptionReconciler reconciler,
        @NonNull InvoiceMirror invoiceMirror,
        @NonNull NotificationServiceContract notificationServiceContract,
        @NonNull StripeApi stripeApi
    ) {
        this.billingConfig = billingConfig;
        this.subscriptionRepository = subscriptionRepository;
        this.planCatalog = planCatalog;
        this.entitlementService = entitlementService;
        this.reconciler = reconciler;
        this.invoiceMirror = invoiceMirror;
        this.notificationServiceContract = notificationServiceContract;
        this.stripeApi = stripeApi;
    }

    /**
     * Subscribes a tenant to a plan, optionally starting with a trial.
     *
     * @param tenantId        the subscribing tenant.
     * @param planId          id of the plan.
     * @param customerEmail   email for a new Stripe customer, may be {@literal null}.
     * @param customerName    name for a new Stripe customer, may be {@literal null}.
     * @param trialPeriodDays trial length in days, or {@literal null} for no trial.
     * @return the new subscription.
     * @throws PlanNotFoundException           if the plan does not exist or cannot be subscribed.
     * @throws InvalidTrialPeriodException     if the trial length is out of range.
     * @throws DuplicateSubscriptionException  if the tenant already owns an active subscription.
     * @throws ProcessorException              if Stripe rejects the customer or subscription.
     */
    @NonNull
    @ReasonablyTransactional
    public Subscription createSubscription(
        long tenantId,
        long planId,
        String customerEmail,
        String customerName,
        Integer trialPeriodDays
    ) throws PlanNotFoundException, InvalidTrialPeriodException, DuplicateSubscriptionException, ProcessorException {
        val plan = planCatalog.getActivePlan(planId);
        if (plan.getStripePriceId() == null) {
            throw new PlanNotFoundException(String.format("plan %d cannot be subscribed to", planId));
        }

        if (trialPeriodDays != null && (trialPeriodDays < 1 || trialPeriodDays > billingConfig.getMaxTrialPeriodDays())) {
            throw new InvalidTrialPeriodException(
                String.format("trial period must be between 1 and %d days", billingConfig.getMaxTrialPeriodDays()));
        }

        if (subscriptionRepository.countByTenantIdAndStatusIn(tenantId, LIVE_STATUSES) > 0) {
            throw new DuplicateSubscriptionException("tenant already owns an active subscription");
        }

        final com.stripe.model.Subscription remote;
        try {
            val customerIds = subscriptionRepository.findStripeCustomerIdsByTenantId(tenantId);
            val customerId = customerIds.isEmpty()
                ? stripeApi.createCustomer(customerEmail, customerName, tenantId).getId()
                : customerIds.get(0);

            remote = stripeApi.createSubscription(
                customerId,
                plan.getStripePriceId(),
                trialPeriodDays == null ? null : trialPeriodDays.longValue(),
                Map.of(
                    TenantResolver.TENANT_ID_METADATA_KEY, String.valueOf(tenantId),
                    "plan_id", String.valueOf(plan.getId())));
        } catch (StripeException e) {
            throw new ProcessorException("failed to create stripe subscription", e);
        }

        // the creation webhook may have been handled already, in which case the row is adopted.
        val subscription = subscriptionRepository.findByStripeSubscriptionId(remote.getId())
            .orElseGet(() -> Subscription.builder()
                .tenantId(tenantId)
                .plan(plan)
                .stripeSubscriptionId(remote.getId())
                .build());

        subscription.setPlan(plan);
        val result = reconciler.apply(subscription, remote);
        notify(result.getSubscription(), NotificationType.SUBSCRIPTION_CREATED, Map.of(
            "plan_name", plan.getName(),
            "trial", result.getSubscription().isTrialing()));

        log.info("created subscription {} for tenant {}", result.getSubscription().getId(), tenantId);
        return result.getSubscription();
    }

    /**
     * Moves the subscription to a plan immediately. Entitlements are replaced with fresh ones of
     * the new plan, so usage counters restart at zero.
     *
     * @param prorate whether Stripe should charge the price difference for the remaining period.
     * @throws SubscriptionNotFoundException if the subscription does not exist.
     * @throws PlanNotFoundException         if the new plan does not exist or has no price.
     * @throws SubscriptionStateException    if the subscription is canceled or already on the plan.
     * @throws ProcessorException            if Stripe rejects the change.
     */
    @NonNull
    @ReasonablyTransactional
    public Subscription upgrade(
        long tenantId,
        long subscriptionId,
        long newPlanId,
        boolean prorate
    ) throws SubscriptionNotFoundException, PlanNotFoundException, SubscriptionStateException, ProcessorException {
        val subscription = getChangeableSubscription(tenantId, subscriptionId);
        val newPlan = getTargetPlan(subscription, newPlanId);
        val oldPlanName = subscription.getPlan().getName();
        swapPlan(subscription, newPlan, prorate);
        notify(subscription, NotificationType.SUBSCRIPTION_UPGRADED, Map.of(
            "old_plan", oldPlanName,
            "new_plan", newPlan.getName(),
            "prorated", prorate));

        return subscription;
    }

    /**
     * Moves the subscription to a cheaper plan, either immediately and without proration, or at
     * the end of the current billing period.
     *
     * @param atPeriodEnd whether to defer the change. A deferred change is recorded in the
     *                    subscription's metadata and applied by the daily billing sync.
     * @throws SubscriptionNotFoundException if the subscription does not exist.
     * @throws PlanNotFoundException         if the new plan does not exist or has no price.
     * @throws SubscriptionStateException    if the subscription is canceled or already on the plan.
     * @throws ProcessorException            if Stripe rejects the change.
     */
    @NonNull
    @ReasonablyTransactional
    public Subscription downgrade(
        long tenantId,
        long subscriptionId,
        long newPlanId,
        boolean atPeriodEnd
    ) throws SubscriptionNotFoundException, PlanNotFoundException, SubscriptionStateException, ProcessorException {
        val subscription = getChangeableSubscription(tenantId, subscriptionId);
        val newPlan = getTargetPlan(subscription, newPlanId);
        val oldPlanName = subscription.getPlan().getName();
        if (atPeriodEnd) {
            val scheduledAt = subscription.getCurrentPeriodEnd() != null
                ? subscription.getCurrentPeriodEnd()
                : OffsetDateTime.now();

            val change = new HashMap<String, Object>();
            change.put("new_plan_id", newPlan.getId());
            change.put("change_type", "downgrade");
            change.put("scheduled_at", scheduledAt.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
            subscription.putMetadata(Subscription.PENDING_PLAN_CHANGE_KEY, change);
            subscriptionRepository.save(subscription);
            notify(subscription, NotificationType.SUBSCRIPTION_DOWNGRADE_SCHEDULED, Map.of(
                "old_plan", oldPlanName,
                "new_plan", newPlan.getName(),
                "effective_date", scheduledAt.toString()));

            return subscription;
        }

        swapPlan(subscription, newPlan, false);
        notify(subscription, NotificationType.SUBSCRIPTION_DOWNGRADED, Map.of(
            "old_plan", oldPlanName,
            "new_plan", newPlan.getName()));

        return subscription;
    }

    /**
     * Applies a deferred plan change once its scheduled time has passed. Does nothing if the
     * subscription has no pending change, or the change is not due yet.
     *
     * @return {@code true} if a change was applied.
     * @throws SubscriptionNotFoundException if the subscription does not exist.
     * @throws ProcessorException            if Stripe rejects the change.
     */
    @ReasonablyTransactional
    boolean applyPendingPlanChange(long subscriptionId, @NonNull OffsetDateTime now) throws SubscriptionNotFoundException, ProcessorException {
        val subscription = subscriptionRepository.findById(subscriptionId)
            .orElseThrow(() -> new SubscriptionNotFoundException("subscription does not exist"));

        val pending = subscription.getPendingPlanChange();
        if (pending.isEmpty() || !(pending.get() instanceof Map)) {
            return false;
        }

        val change = (Map<?, ?>) pending.get();
        final OffsetDateTime scheduledAt;
        final long newPlanId;
        try {
            scheduledAt = OffsetDateTime.parse(String.valueOf(change.get("scheduled_at")));
            newPlanId = Long.parseLong(String.valueOf(change.get("new_plan_id")));
        } catch (RuntimeException e) {
            log.warn("discarding malformed pending plan change of subscription {}: {}", subscriptionId, change);
            subscription.removeMetadata(Subscription.PENDING_PLAN_CHANGE_KEY);
            subscriptionRepository.save(subscription);
            return false;
        }

        if (now.isBefore(scheduledAt)) {
            return false;
        }

        if (subscription.isCanceled()) {
            subscription.removeMetadata(Subscription.PENDING_PLAN_CHANGE_KEY);
            subscriptionRepository.save(subscription);
            return false;
        }

        final Plan newPlan;
        try {
            newPlan = planCatalog.getActivePlan(newPlanId);
        } catch (PlanNotFoundException e) {
            log.warn("discarding pending plan change of subscription {}: {}", subscriptionId, e.getMessage());
            subscription.removeMetadata(Subscription.PENDING_PLAN_CHANGE_KEY);
            subscriptionRepository.save(subscription);
            return false;
        }

        val oldPlanName = subscription.getPlan().getName();
        swapPlan(subscription, newPlan, false);
        notify(subscription, NotificationType.SUBSCRIPTION_DOWNGRADED, Map.of(
            "old_plan", oldPlanName,
            "new_plan", newPlan.getName()));

        return true;
    }

    /**
     * Cancels a subscription, either immediately or at the end of the current billing period.
     *
     * @throws SubscriptionNotFoundException if the subscription does not exist.
     * @throws SubscriptionStateException    if the subscription is already canceled.
     * @throws ProcessorException            if Stripe rejects the cancellation.
     */
    @NonNull
    @ReasonablyTransactional
    public Subscription cancel(
        long tenantId,
        long subscriptionId,
        boolean atPeriodEnd
    ) throws SubscriptionNotFoundException, SubscriptionStateException, ProcessorException {
        val subscription = getChangeableSubscription(tenantId, subscriptionId);
        if (subscription.getStripeSubscriptionId() != null) {
            try {
                val remote = atPeriodEnd
                    ? stripeApi.setCancelAtPeriodEnd(subscription.getStripeSubscriptionId(), true)
                    : stripeApi.cancelSubscription(subscription.getStripeSubscriptionId());

                reconciler.apply(subscription, remote);
            } catch (StripeException e) {
                throw new ProcessorException("failed to cancel stripe subscription", e);
            }
        }

        if (atPeriodEnd) {
            subscription.setCancelAtPeriodEnd(true);
            subscriptionRepository.save(subscription);
        } else {
            reconciler.markCanceled(subscription, OffsetDateTime.now());
        }

        notify(subscription, NotificationType.SUBSCRIPTION_CANCELED, Map.of(
            "at_period_end", atPeriodEnd,
            "plan_name", subscription.getPlan().getName()));

        return subscription;
    }

    /**
     * Withdraws a pending cancellation at period end. Canceled subscriptions cannot be reactivated;
     * tenants subscribe anew instead.
     *
     * @throws SubscriptionNotFoundException if the subscription does not exist.
     * @throws SubscriptionStateException    if the subscription is canceled.
     * @throws ProcessorException            if Stripe rejects the change.
     */
    @NonNull
    @ReasonablyTransactional
    public Subscription reactivate(
        long tenantId,
        long subscriptionId
    ) throws SubscriptionNotFoundException, SubscriptionStateException, ProcessorException {
        val subscription = getChangeableSubscription(tenantId, subscriptionId);
        if (!subscription.isCancelAtPeriodEnd()) {
            return subscription;
        }

        if (subscription.getStripeSubscriptionId() != null) {
            try {
                reconciler.apply(subscription, stripeApi.setCancelAtPeriodEnd(subscription.getStripeSubscriptionId(), false));
            } catch (StripeException e) {
                throw new ProcessorException("failed to reactivate stripe subscription", e);
            }
        }

        subscription.setCancelAtPeriodEnd(false);
        subscriptionRepository.save(subscription);
        notify(subscription, NotificationType.SUBSCRIPTION_REACTIVATED, Map.of(
            "plan_name", subscription.getPlan().getName()));

        return subscription;
    }

    /**
     * Applies Stripe's current view of the subscription, then any deferred plan change that is
     * due, and refreshes the subscription's outstanding invoices.
     *
     * @return {@link SweepReport.Outcome#UPDATED} if the status or the plan changed.
     * @throws SubscriptionNotFoundException if the subscription does not exist.
     * @throws ProcessorException            if Stripe cannot be reached.
     */
    @NonNull
    @ReasonablyTransactional(propagation = Propagation.REQUIRES_NEW)
    SweepReport.Outcome syncFromProcessor(
        long subscriptionId,
        @NonNull OffsetDateTime now
    ) throws SubscriptionNotFoundException, ProcessorException {
        val subscription = subscriptionRepository.findById(subscriptionId)
            .orElseThrow(() -> new SubscriptionNotFoundException("subscription does not exist"));

        if (subscription.getStripeSubscriptionId() == null || subscription.isCanceled()) {
            return SweepReport.Outcome.NO_OP;
        }

        final com.stripe.model.Subscription remote;
        try {
            remote = stripeApi.getSubscription(subscription.getStripeSubscriptionId());
        } catch (StripeException e) {
            throw new ProcessorException("failed to retrieve stripe subscription", e);
        }

        val result = reconciler.apply(subscription, remote);
        boolean updated = result.isPlanChanged();
        if (result.isStatusChanged()) {
            updated = true;
            val previous = result.getPreviousStatus();
            val current = subscription.getStatus();
            final NotificationType type;
            if (current == Subscription.Status.CANCELED) {
                type = NotificationType.SUBSCRIPTION_CANCELED;
            } else if (current == Subscription.Status.ACTIVE
                && (previous == Subscription.Status.PAST_DUE || previous == Subscription.Status.UNPAID)) {
                type = NotificationType.SUBSCRIPTION_REACTIVATED;
            } else {
                type = NotificationType.SUBSCRIPTION_STATUS_CHANGED;
            }

            notify(subscription, type, Map.of(
                "old_status", previous.toValue(),
                "new_status", current.toValue()));
        }

        if (!subscription.isCanceled() && applyPendingPlanChange(subscriptionId, now)) {
            updated = true;
        }

        invoiceMirror.refreshOutstanding(subscription);
        return updated ? SweepReport.Outcome.UPDATED : SweepReport.Outcome.NO_OP;
    }

    @NonNull
    private Subscription getChangeableSubscription(
        long tenantId,
        long subscriptionId
    ) throws SubscriptionNotFoundException, SubscriptionStateException {
        val subscription = subscriptionRepository.findById(subscriptionId)
            .filter(s -> s.getTenantId() == tenantId)
            .orElseThrow(() -> new SubscriptionNotFoundException("subscription does not exist"));

        if (subscription.isCanceled()) {
            throw new SubscriptionStateException("subscription is canceled");
        }

        return subscription;
    }

    @NonNull
    private Plan getTargetPlan(
        @NonNull Subscription subscription,
        long newPlanId
    ) throws PlanNotFoundException, SubscriptionStateException {
        val newPlan = planCatalog.getActivePlan(newPlanId);
        if (newPlan.getId().equals(subscription.getPlan().getId())) {
            throw new SubscriptionStateException("subscription is already on the requested plan");
        }

        if (subscription.getStripeSubscriptionId() != null && newPlan.getStripePriceId() == null) {
            throw new PlanNotFoundException(String.format("plan %d cannot be subscribed to", newPlanId));
        }

        return newPlan;
    }

    /**
     * Swaps the Stripe price first, then reassigns the plan and replaces entitlements.
     */
    private void swapPlan(@NonNull Subscription subscription, @NonNull Plan newPlan, boolean prorate) throws ProcessorException {
        com.stripe.model.Subscription remote = null;
        if (subscription.getStripeSubscriptionId() != null) {
            try {
                remote = stripeApi.swapSubscriptionPrice(subscription.getStripeSubscriptionId(), newPlan.getStripePriceId(), prorate);
            } catch (StripeException e) {
                throw new ProcessorException("failed to change stripe subscription plan", e);
            }
        }

        subscription.setPlan(newPlan);
        subscription.removeMetadata(Subscription.PENDING_PLAN_CHANGE_KEY);
        if (remote != null) {
            reconciler.apply(subscription, remote);
        } else {
            subscriptionRepository.save(subscription);
        }

        entitlementService.replaceEntitlements(subscription);
        log.info("moved subscription {} to plan {}", subscription.getId(), newPlan.getId());
    }

    private void notify(@NonNull Subscription subscription, @NonNull NotificationType type, @NonNull Map<String, Object> data) {
        val payload = new HashMap<String, Object>(data);
        payload.put("subscription_id", subscription.getId());
        notificationServiceContract.requestNotification(subscription.getTenantId(), type, payload);
    }
}
