package com.meterly.api.billing;

import com.meterly.api.billing.entities.Invoice;
import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.exceptions.SubscriptionNotFoundException;
import com.meterly.api.billing.upstream.StripeApi;
import com.meterly.api.contracts.NotificationServiceContract;
import com.meterly.api.contracts.NotificationType;
import com.meterly.api.platform.transaction.annotations.ReasonablyTransactional;
import com.stripe.exception.CardException;
import com.stripe.exception.InvalidRequestException;
import com.stripe.exception.StripeException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Chases payment of past due and unpaid subscriptions, and cancels them once payment is overdue for
 * too long.
 */
@Service
@Slf4j
class DunningService {

    private final SubscriptionRepository subscriptionRepository;
    private final InvoiceMirror invoiceMirror;
    private final SubscriptionReconciler reconciler;
    private final NotificationServiceContract notificationServiceContract;
    private final StripeApi stripeApi;

    @Autowired
    DunningService(
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull InvoiceMirror invoiceMirror,
        @NonNull SubscriptionReconciler reconciler,
        @NonNull NotificationServiceContract notificationServiceContract,
        @NonNull StripeApi stripeApi
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.invoiceMirror = invoiceMirror;
        this.reconciler = reconciler;
        this.notificationServiceContract = notificationServiceContract;
        this.stripeApi = stripeApi;
    }

    /**
     * <p>
     * Runs one dunning step for a subscription. The latest invoice is synced from Stripe and, if
     * it is open, its payment is retried once. A paid invoice reactivates the subscription. A void
     * or uncollectible invoice has nothing left to collect and ends the step without a notice.
     * Otherwise the step depends on how long the invoice is overdue:</p>
     * <ul>
     *     <li>at least {@link EnforcementSnapshot#getDunningCancelAfter()}: cancel the subscription;</li>
     *     <li>at least {@link EnforcementSnapshot#getDunningFinalNoticeAfter()}: send a final notice;</li>
     *     <li>otherwise: send a payment reminder.</li>
     * </ul>
     *
     * @return the outcome of the step.
     * @throws SubscriptionNotFoundException if the subscription does not exist.
     * @throws ProcessorException            if Stripe cannot be reached.
     */
    @NonNull
    @ReasonablyTransactional(propagation = Propagation.REQUIRES_NEW)
    SweepReport.Outcome process(
        long subscriptionId,
        @NonNull EnforcementSnapshot snapshot
    ) throws SubscriptionNotFoundException, ProcessorException {
        val subscription = subscriptionRepository.findById(subscriptionId)
            .orElseThrow(() -> new SubscriptionNotFoundException("subscription does not exist"));

        if (subscription.getStatus() != Subscription.Status.PAST_DUE && subscription.getStatus() != Subscription.Status.UNPAID) {
            return SweepReport.Outcome.NO_OP;
        }

        val synced = invoiceMirror.syncLatestForSubscription(subscription);
        if (synced.isEmpty()) {
            log.warn("past due subscription {} has no invoice to collect", subscriptionId);
            return SweepReport.Outcome.NO_OP;
        }

        Invoice invoice = synced.get();
        if (invoice.getStatus() == Invoice.Status.VOID || invoice.getStatus() == Invoice.Status.UNCOLLECTIBLE) {
            log.warn("latest invoice {} of past due subscription {} is {}, nothing to collect",
                invoice.getId(), subscriptionId, invoice.getStatus());
            return SweepReport.Outcome.NO_OP;
        }

        if (invoice.getStatus() == Invoice.Status.OPEN) {
            invoice = retryPayment(invoice);
        }

        val data = new HashMap<String, Object>();
        data.put("subscription_id", subscription.getId());
        data.put("invoice_id", invoice.getId());
        data.put("amount_due", invoice.getAmountDue());
        data.put("currency", invoice.getCurrency());
        data.put("hosted_invoice_url", invoice.getHostedInvoiceUrl());

        if (invoice.isPaid()) {
            subscription.setStatus(Subscription.Status.ACTIVE);
            subscriptionRepository.save(subscription);
            notify(subscription, NotificationType.SUBSCRIPTION_REACTIVATED, data);
            log.info("reactivated subscription {} after payment", subscriptionId);
            return SweepReport.Outcome.REACTIVATED;
        }

        val overdue = overdueFor(invoice, snapshot.getNow());
        data.put("days_overdue", overdue.toDays());
        if (overdue.compareTo(snapshot.getDunningCancelAfter()) >= 0) {
            try {
                stripeApi.cancelSubscription(subscription.getStripeSubscriptionId());
            } catch (StripeException e) {
                throw new ProcessorException("failed to cancel stripe subscription", e);
            }

            reconciler.markCanceled(subscription, snapshot.getNow());
            notify(subscription, NotificationType.SUBSCRIPTION_CANCELED_NONPAYMENT, data);
            log.info("canceled subscription {} for nonpayment", subscriptionId);
            return SweepReport.Outcome.CANCELED;
        }

        if (overdue.compareTo(snapshot.getDunningFinalNoticeAfter()) >= 0) {
            notify(subscription, NotificationType.PAYMENT_FINAL_NOTICE, data);
            return SweepReport.Outcome.FINAL_NOTICE_SENT;
        }

        notify(subscription, NotificationType.PAYMENT_REMINDER, data);
        return SweepReport.Outcome.REMINDED;
    }

    /**
     * Attempts to collect the invoice once. A declined payment leaves the invoice open.
     */
    @NonNull
    private Invoice retryPayment(@NonNull Invoice invoice) throws ProcessorException {
        final com.stripe.model.Invoice remote;
        try {
            remote = stripeApi.payInvoice(invoice.getStripeInvoiceId());
        } catch (CardException | InvalidRequestException e) {
            log.info("payment retry of invoice {} failed: {}", invoice.getId(), e.getMessage());
            return invoice;
        } catch (StripeException e) {
            throw new ProcessorException("failed to retry stripe invoice payment", e);
        }

        val updated = invoiceMirror.apply(remote).orElse(invoice);
        if ("paid".equals(remote.getStatus())) {
            return invoiceMirror.markPaid(updated, remote);
        }

        return updated;
    }

    /**
     * Overdue time counts from the due date, or from the invoice date if the invoice has none.
     */
    @NonNull
    static Duration overdueFor(@NonNull Invoice invoice, @NonNull OffsetDateTime now) {
        val since = invoice.getDueDate() != null ? invoice.getDueDate() : invoice.getInvoiceDate();
        if (since == null || since.isAfter(now)) {
            return Duration.ZERO;
        }

        return Duration.between(since, now);
    }

    private void notify(@NonNull Subscription subscription, @NonNull NotificationType type, @NonNull Map<String, Object> data) {
        notificationServiceContract.requestNotification(subscription.getTenantId(), type, data);
    }
}
