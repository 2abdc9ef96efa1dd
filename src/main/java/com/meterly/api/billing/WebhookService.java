package com.meterly.api.billing;

import com.meterly.api.billing.entities.Invoice;
import com.meterly.api.billing.entities.InvoiceRepository;
import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.exceptions.WebhookPayloadException;
import com.meterly.api.billing.exceptions.WebhookSignatureException;
import com.meterly.api.billing.upstream.EpochSeconds;
import com.meterly.api.billing.upstream.StripeApi;
import com.meterly.api.contracts.NotificationServiceContract;
import com.meterly.api.contracts.NotificationType;
import com.meterly.api.platform.transaction.annotations.ReasonablyTransactional;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.Event;
import com.stripe.model.PaymentIntent;
import com.stripe.model.StripeObject;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Verifies and handles Stripe webhook events. Handlers of subscription and invoice events re-fetch
 * the object from Stripe instead of trusting the event payload, since Stripe may deliver events
 * late, more than once, or out of order.
 */
@Service
@Slf4j
class WebhookService {

    private final BillingConfiguration billingConfig;
    private final SubscriptionRepository subscriptionRepository;
    private final InvoiceRepository invoiceRepository;
    private final SubscriptionReconciler reconciler;
    private final InvoiceMirror invoiceMirror;
    private final NotificationServiceContract notificationServiceContract;
    private final StripeApi stripeApi;
    private final Map<String, WebhookEventHandler> handlers;

    @Autowired
    WebhookService(
        @NonNull BillingConfiguration billingConfig,
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull InvoiceRepository invoiceRepository,
        @NonNull SubscriptionReconciler reconciler,
        @NonNull InvoiceMirror invoiceMirror,
        @NonNull NotificationServiceContract notificationServiceContract,
        @NonNull StripeApi stripeApi
    ) {
        this.billingConfig = billingConfig;
        this.subscriptionRepository = subscriptionRepository;
        this.invoiceRepository = invoiceRepository;
        this.reconciler = reconciler;
        this.invoiceMirror = invoiceMirror;
        this.notificationServiceContract = notificationServiceContract;
        this.stripeApi = stripeApi;

        val handlers = new HashMap<String, WebhookEventHandler>();
        handlers.put("invoice.payment_succeeded", this::handleInvoicePaymentSucceeded);
        handlers.put("invoice.payment_failed", this::handleInvoicePaymentFailed);
        handlers.put("invoice.finalized", this::handleInvoiceChanged);
        handlers.put("invoice.voided", this::handleInvoiceChanged);
        handlers.put("invoice.created", this::handleInvoiceChanged);
        handlers.put("invoice.updated", this::handleInvoiceChanged);
        handlers.put("customer.subscription.created", this::handleSubscriptionCreated);
        handlers.put("customer.subscription.updated", this::handleSubscriptionUpdated);
        handlers.put("customer.subscription.deleted", this::handleSubscriptionDeleted);
        handlers.put("customer.subscription.trial_will_end", this::handleTrialWillEnd);
        handlers.put("payment_intent.succeeded", event -> handlePaymentIntent(event, false));
        handlers.put("payment_intent.payment_failed", event -> handlePaymentIntent(event, true));
        this.handlers = Map.copyOf(handlers);
    }

    /**
     * Verifies the authenticity of a Stripe webhook payload and applies the event it carries.
     * Event types without a handler are acknowledged and ignored. Handlers are idempotent, so
     * redelivered events are harmless.
     *
     * @param payload   raw request body.
     * @param signature value of the {@code Stripe-Signature} header.
     * @throws WebhookSignatureException if the signature does not match the payload.
     * @throws WebhookPayloadException   if the event does not carry the expected object.
     * @throws ProcessorException        if Stripe cannot be reached to fetch the current state.
     */
    @ReasonablyTransactional
    public void handleWebhookEvent(
        @NonNull String payload,
        @NonNull String signature
    ) throws WebhookSignatureException, WebhookPayloadException, ProcessorException {
        final Event event;
        try {
            event = stripeApi.decodeWebhookPayload(payload, signature, billingConfig.getStripeWebhookSecret());
        } catch (SignatureVerificationException e) {
            throw new WebhookSignatureException("failed to verify payload signature", e);
        } catch (RuntimeException e) {
            throw new WebhookPayloadException("failed to decode webhook payload", e);
        }

        val handler = handlers.getOrDefault(event.getType(), WebhookService::ignore);
        handler.handle(event);
    }

    private static void ignore(@NonNull Event event) {
        log.debug("ignoring stripe webhook event {} of type '{}'", event.getId(), event.getType());
    }

    private void handleInvoicePaymentSucceeded(@NonNull Event event) throws WebhookPayloadException, ProcessorException {
        val remoteId = dataObject(event, com.stripe.model.Invoice.class).getId();
        final com.stripe.model.Invoice remote;
        try {
            remote = stripeApi.getInvoice(remoteId);
        } catch (StripeException e) {
            throw new ProcessorException("failed to retrieve stripe invoice", e);
        }

        val invoice = invoiceMirror.apply(remote);
        if (invoice.isEmpty()) {
            return;
        }

        val paid = invoiceMirror.markPaid(invoice.get(), remote);
        notify(paid.getTenantId(), NotificationType.PAYMENT_SUCCEEDED, invoiceData(paid));
    }

    private void handleInvoicePaymentFailed(@NonNull Event event) throws WebhookPayloadException, ProcessorException {
        val invoice = invoiceMirror.syncFromProcessor(dataObject(event, com.stripe.model.Invoice.class).getId());
        if (invoice.isEmpty()) {
            return;
        }

        if (invoice.get().getSubscriptionId() != null) {
            subscriptionRepository.findById(invoice.get().getSubscriptionId())
                .filter(s -> s.getStatus() != Subscription.Status.PAST_DUE)
                .filter(s -> s.getStatus().canTransitionTo(Subscription.Status.PAST_DUE))
                .ifPresent(s -> {
                    s.setStatus(Subscription.Status.PAST_DUE);
                    subscriptionRepository.save(s);
                    log.info("subscription {} is past due after a failed payment", s.getId());
                });
        }

        notify(invoice.get().getTenantId(), NotificationType.PAYMENT_FAILED, invoiceData(invoice.get()));
    }

    private void handleInvoiceChanged(@NonNull Event event) throws WebhookPayloadException, ProcessorException {
        invoiceMirror.syncFromProcessor(dataObject(event, com.stripe.model.Invoice.class).getId());
    }

    private void handleSubscriptionCreated(@NonNull Event event) throws WebhookPayloadException, ProcessorException {
        reconciler.refresh(dataObject(event, com.stripe.model.Subscription.class).getId());
    }

    private void handleSubscriptionUpdated(@NonNull Event event) throws WebhookPayloadException, ProcessorException {
        val result = reconciler.refresh(dataObject(event, com.stripe.model.Subscription.class).getId());
        if (result.isEmpty() || !result.get().isStatusChanged()) {
            return;
        }

        val subscription = result.get().getSubscription();
        val data = new HashMap<String, Object>();
        data.put("subscription_id", subscription.getId());
        data.put("old_status", result.get().getPreviousStatus().toValue());
        data.put("new_status", subscription.getStatus().toValue());
        notify(subscription.getTenantId(), NotificationType.SUBSCRIPTION_STATUS_CHANGED, data);
    }

    /**
     * A deleted subscription can no longer change in Stripe, so the event object is applied as is.
     */
    private void handleSubscriptionDeleted(@NonNull Event event) throws WebhookPayloadException, ProcessorException {
        val remote = dataObject(event, com.stripe.model.Subscription.class);
        val result = reconciler.adopt(remote);
        if (result.isEmpty()) {
            return;
        }

        val canceledAt = Optional.ofNullable(EpochSeconds.toDateTime(remote.getCanceledAt()))
            .orElseGet(OffsetDateTime::now);

        reconciler.markCanceled(result.get().getSubscription(), canceledAt);
    }

    private void handleTrialWillEnd(@NonNull Event event) throws WebhookPayloadException {
        val remote = dataObject(event, com.stripe.model.Subscription.class);
        val subscription = subscriptionRepository.findByStripeSubscriptionId(remote.getId());
        if (subscription.isEmpty() || subscription.get().isDeleted()) {
            log.warn("received trial end notice for unknown stripe subscription {}", remote.getId());
            return;
        }

        val data = new HashMap<String, Object>();
        data.put("subscription_id", subscription.get().getId());
        data.put("trial_end", EpochSeconds.toDateTime(remote.getTrialEnd()));
        notify(subscription.get().getTenantId(), NotificationType.TRIAL_ENDING, data);
    }

    private void handlePaymentIntent(@NonNull Event event, boolean failed) throws WebhookPayloadException, ProcessorException {
        val intent = dataObject(event, PaymentIntent.class);
        if (intent.getInvoice() == null) {
            return;
        }

        // only invoices that are already mirrored are refreshed here, invoice events create the rest.
        if (invoiceRepository.findByStripeInvoiceId(intent.getInvoice()).isEmpty()) {
            return;
        }

        val invoice = invoiceMirror.syncFromProcessor(intent.getInvoice());
        if (failed && invoice.isPresent()) {
            notify(invoice.get().getTenantId(), NotificationType.PAYMENT_FAILED, invoiceData(invoice.get()));
        }
    }

    @NonNull
    private static <T extends StripeObject> T dataObject(
        @NonNull Event event,
        @NonNull Class<T> type
    ) throws WebhookPayloadException {
        val object = event.getDataObjectDeserializer().getObject()
            .orElseThrow(() -> new WebhookPayloadException(
                String.format("failed to get the data object of event %s", event.getId())));

        if (!type.isInstance(object)) {
            throw new WebhookPayloadException(
                String.format("event %s does not carry a %s", event.getId(), type.getSimpleName()));
        }

        return type.cast(object);
    }

    @NonNull
    private static Map<String, Object> invoiceData(@NonNull Invoice invoice) {
        val data = new HashMap<String, Object>();
        data.put("invoice_id", invoice.getId());
        data.put("invoice_number", invoice.getInvoiceNumber());
        data.put("amount", invoice.getAmountTotal());
        data.put("amount_due", invoice.getAmountDue());
        data.put("currency", invoice.getCurrency());
        data.put("hosted_invoice_url", invoice.getHostedInvoiceUrl());
        return data;
    }

    private void notify(long tenantId, @NonNull NotificationType type, @NonNull Map<String, Object> data) {
        notificationServiceContract.requestNotification(tenantId, type, data);
    }

    @FunctionalInterface
    private interface WebhookEventHandler {

        void handle(@NonNull Event event) throws WebhookPayloadException, ProcessorException;
    }
}
