package com.meterly.api.billing.upstream;

import com.stripe.Stripe;
import com.stripe.StripeClient;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.Event;
import com.stripe.model.Invoice;
import com.stripe.model.InvoiceItem;
import com.stripe.model.PaymentLink;
import com.stripe.model.Price;
import com.stripe.model.Subscription;
import com.stripe.model.UsageRecord;
import com.stripe.net.RequestOptions;
import com.stripe.net.Webhook;
import com.stripe.param.CustomerCreateParams;
import com.stripe.param.InvoiceCreateParams;
import com.stripe.param.InvoiceItemCreateParams;
import com.stripe.param.InvoiceListParams;
import com.stripe.param.PaymentLinkCreateParams;
import com.stripe.param.PriceCreateParams;
import com.stripe.param.ProductCreateParams;
import com.stripe.param.SubscriptionCreateParams;
import com.stripe.param.SubscriptionUpdateParams;
import com.stripe.param.UsageRecordCreateParams;
import lombok.NonNull;
import lombok.val;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * A thin wrapper around {@link Stripe} api to enable easy mocking. Every call is bounded by the
 * connect and read timeouts given at construction; the client itself retries idempotent network
 * failures up to {@code maxNetworkRetries} times.
 */
public class StripeApi {

    private final StripeClient client;

    public StripeApi(
        @NonNull String apiKey,
        @NonNull Duration connectTimeout,
        @NonNull Duration readTimeout,
        int maxNetworkRetries
    ) {
        client = StripeClient.builder()
            .setApiKey(apiKey)
            .setConnectTimeout((int) connectTimeout.toMillis())
            .setReadTimeout((int) readTimeout.toMillis())
            .setMaxNetworkRetries(maxNetworkRetries)
            .build();
    }

    /**
     * @see Webhook#constructEvent(String, String, String)
     */
    @NonNull
    public Event decodeWebhookPayload(
        @NonNull String payload,
        @NonNull String signature,
        @NonNull String secret
    ) throws SignatureVerificationException {
        return Webhook.constructEvent(payload, signature, secret);
    }

    /**
     * Creates a Stripe customer and tags it with the tenant that owns it, so that webhook events
     * about this customer can be attributed to the tenant on first sight.
     *
     * @param email    email of the customer, may be {@literal null}.
     * @param name     display name of the customer, may be {@literal null}.
     * @param tenantId the tenant that owns the customer.
     * @return the new customer.
     * @throws StripeException on Stripe API errors.
     */
    @NonNull
    public Customer createCustomer(String email, String name, long tenantId) throws StripeException {
        return client.customers().create(
            CustomerCreateParams.builder()
                .setEmail(email)
                .setName(name)
                .putMetadata("tenant_id", String.valueOf(tenantId))
                .build());
    }

    /**
     * @see com.stripe.service.CustomerService#retrieve(String)
     */
    @NonNull
    public Customer getCustomer(@NonNull String id) throws StripeException {
        return client.customers().retrieve(id);
    }

    /**
     * @param customerId id of the Stripe customer.
     * @return {@code true} if the customer exists and has either a default payment method for
     * invoices or a default source.
     * @throws StripeException on Stripe API errors.
     */
    public boolean hasDefaultPaymentMethod(@NonNull String customerId) throws StripeException {
        val customer = getCustomer(customerId);
        if (Boolean.TRUE.equals(customer.getDeleted())) {
            return false;
        }

        val invoiceSettings = customer.getInvoiceSettings();
        if (invoiceSettings != null && invoiceSettings.getDefaultPaymentMethod() != null) {
            return true;
        }

        return customer.getDefaultSource() != null;
    }

    /**
     * Creates a single-item subscription for the given price.
     *
     * @param customerId      id of the Stripe customer.
     * @param priceId         id of the Stripe price.
     * @param trialPeriodDays length of the trial, or {@literal null} to start billing immediately.
     * @param metadata        metadata to attach to the subscription.
     * @return the new subscription.
     * @throws StripeException on Stripe API errors.
     */
    @NonNull
    public Subscription createSubscription(
        @NonNull String customerId,
        @NonNull String priceId,
        Long trialPeriodDays,
        @NonNull Map<String, String> metadata
    ) throws StripeException {
        return client.subscriptions().create(
            SubscriptionCreateParams.builder()
                .setCustomer(customerId)
                .addItem(
                    SubscriptionCreateParams.Item.builder()
                        .setPrice(priceId)
                        .build())
                .setTrialPeriodDays(trialPeriodDays)
                .putAllMetadata(metadata)
                .build());
    }

    /**
     * @see com.stripe.service.SubscriptionService#retrieve(String)
     */
    @NonNull
    public Subscription getSubscription(@NonNull String id) throws StripeException {
        return client.subscriptions().retrieve(id);
    }

    /**
     * Replaces the price of the subscription's (only) item.
     *
     * @param id      id of the Stripe subscription.
     * @param priceId id of the new Stripe price.
     * @param prorate whether Stripe should create proration items for the remaining period.
     * @return the updated subscription.
     * @throws StripeException on Stripe API errors.
     */
    @NonNull
    public Subscription swapSubscriptionPrice(
        @NonNull String id,
        @NonNull String priceId,
        boolean prorate
    ) throws StripeException {
        val subscription = getSubscription(id);
        val itemId = subscription.getItems().getData().get(0).getId();
        return client.subscriptions().update(
            id,
            SubscriptionUpdateParams.builder()
                .addItem(
                    SubscriptionUpdateParams.Item.builder()
                        .setId(itemId)
                        .setPrice(priceId)
                        .build())
                .setProrationBehavior(
                    prorate
                        ? SubscriptionUpdateParams.ProrationBehavior.CREATE_PRORATIONS
                        : SubscriptionUpdateParams.ProrationBehavior.NONE)
                .build());
    }

    /**
     * Sets or clears the flag that cancels the subscription at the end of its current period.
     *
     * @throws StripeException on Stripe API errors.
     */
    @NonNull
    public Subscription setCancelAtPeriodEnd(@NonNull String id, boolean cancelAtPeriodEnd) throws StripeException {
        return client.subscriptions().update(
            id,
            SubscriptionUpdateParams.builder()
                .setCancelAtPeriodEnd(cancelAtPeriodEnd)
                .build());
    }

    /**
     * Immediately cancels a subscription. Cancelling an already canceled subscription is a no-op.
     *
     * @throws StripeException on Stripe API errors.
     */
    @NonNull
    public Subscription cancelSubscription(@NonNull String id) throws StripeException {
        val subscription = getSubscription(id);
        if ("canceled".equals(subscription.getStatus())) {
            return subscription;
        }

        return client.subscriptions().cancel(id);
    }

    /**
     * Adds a one-off charge to the customer's next invoice.
     *
     * @param customerId     id of the Stripe customer.
     * @param amount         amount in the currency's minor units.
     * @param currency       ISO 4217 currency code.
     * @param description    line item description shown on the invoice.
     * @param metadata       metadata to attach to the invoice item.
     * @param idempotencyKey key that makes retried requests with the same key create one item.
     * @return the new invoice item.
     * @throws StripeException on Stripe API errors.
     */
    @NonNull
    public InvoiceItem createInvoiceItem(
        @NonNull String customerId,
        long amount,
        @NonNull String currency,
        @NonNull String description,
        @NonNull Map<String, String> metadata,
        @NonNull String idempotencyKey
    ) throws StripeException {
        return client.invoiceItems().create(
            InvoiceItemCreateParams.builder()
                .setCustomer(customerId)
                .setAmount(amount)
                .setCurrency(currency)
                .setDescription(description)
                .putAllMetadata(metadata)
                .build(),
            RequestOptions.builder()
                .setIdempotencyKey(idempotencyKey)
                .build());
    }

    /**
     * @see com.stripe.service.InvoiceService#retrieve(String)
     */
    @NonNull
    public Invoice getInvoice(@NonNull String id) throws StripeException {
        return client.invoices().retrieve(id);
    }

    /**
     * @return the most recent invoice of the subscription, if it has any.
     * @throws StripeException on Stripe API errors.
     */
    @NonNull
    public Optional<Invoice> getLatestInvoice(@NonNull String subscriptionId) throws StripeException {
        val invoices = client.invoices().list(
            InvoiceListParams.builder()
                .setSubscription(subscriptionId)
                .setLimit(1L)
                .build());

        return invoices.getData().stream().findFirst();
    }

    /**
     * Attempts to collect an open invoice with the customer's default payment method.
     *
     * @see com.stripe.service.InvoiceService#pay(String)
     */
    @NonNull
    public Invoice payInvoice(@NonNull String id) throws StripeException {
        return client.invoices().pay(id);
    }

    /**
     * Creates a draft invoice for the customer. Without a subscription, the invoice collects the
     * customer's pending invoice items.
     *
     * @param customerId     id of the Stripe customer.
     * @param subscriptionId id of the Stripe subscription to invoice, may be {@literal null}.
     * @param currency       ISO 4217 currency code.
     * @param description    memo shown on the invoice, may be {@literal null}.
     * @param metadata       metadata to attach to the invoice.
     * @return the new draft invoice.
     * @throws StripeException on Stripe API errors.
     */
    @NonNull
    public Invoice createInvoice(
        @NonNull String customerId,
        String subscriptionId,
        @NonNull String currency,
        String description,
        @NonNull Map<String, String> metadata
    ) throws StripeException {
        return client.invoices().create(
            InvoiceCreateParams.builder()
                .setCustomer(customerId)
                .setSubscription(subscriptionId)
                .setCurrency(currency)
                .setDescription(description)
                .putAllMetadata(metadata)
                .build());
    }

    /**
     * Adds a one-off line to a draft invoice.
     *
     * @param customerId  id of the Stripe customer that owns the invoice.
     * @param invoiceId   id of the draft Stripe invoice.
     * @param amount      amount in the currency's minor units.
     * @param currency    ISO 4217 currency code.
     * @param description line item description shown on the invoice.
     * @throws StripeException on Stripe API errors.
     */
    @NonNull
    public InvoiceItem addInvoiceLine(
        @NonNull String customerId,
        @NonNull String invoiceId,
        long amount,
        @NonNull String currency,
        @NonNull String description
    ) throws StripeException {
        return client.invoiceItems().create(
            InvoiceItemCreateParams.builder()
                .setCustomer(customerId)
                .setInvoice(invoiceId)
                .setAmount(amount)
                .setCurrency(currency)
                .setDescription(description)
                .build());
    }

    /**
     * @see com.stripe.service.InvoiceService#finalizeInvoice(String)
     */
    @NonNull
    public Invoice finalizeInvoice(@NonNull String id) throws StripeException {
        return client.invoices().finalizeInvoice(id);
    }

    /**
     * @see com.stripe.service.InvoiceService#sendInvoice(String)
     */
    @NonNull
    public Invoice sendInvoice(@NonNull String id) throws StripeException {
        return client.invoices().sendInvoice(id);
    }

    /**
     * @see com.stripe.service.InvoiceService#voidInvoice(String)
     */
    @NonNull
    public Invoice voidInvoice(@NonNull String id) throws StripeException {
        return client.invoices().voidInvoice(id);
    }

    /**
     * Creates a payment link that charges a fixed amount once.
     *
     * @param name     product name shown on the checkout page.
     * @param amount   amount in the currency's minor units.
     * @param currency ISO 4217 currency code.
     * @param metadata metadata to attach to the payment link.
     * @return the new payment link. Its url is available through {@link PaymentLink#getUrl()}.
     * @throws StripeException on Stripe API errors.
     */
    @NonNull
    public PaymentLink createPaymentLink(
        @NonNull String name,
        long amount,
        @NonNull String currency,
        @NonNull Map<String, String> metadata
    ) throws StripeException {
        val price = client.prices().create(
            PriceCreateParams.builder()
                .setUnitAmount(amount)
                .setCurrency(currency)
                .setProductData(
                    PriceCreateParams.ProductData.builder()
                        .setName(name)
                        .build())
                .build());

        return client.paymentLinks().create(
            PaymentLinkCreateParams.builder()
                .addLineItem(
                    PaymentLinkCreateParams.LineItem.builder()
                        .setPrice(price.getId())
                        .setQuantity(1L)
                        .build())
                .putAllMetadata(metadata)
                .build());
    }

    /**
     * Reports the total usage of a metered subscription item, replacing any usage reported
     * earlier for the same period. Stripe timestamps the record with the time it receives it.
     *
     * @param subscriptionItemId id of the metered Stripe subscription item.
     * @param quantity           total usage in the current period.
     * @param idempotencyKey     key that makes retried requests with the same key report once.
     * @throws StripeException on Stripe API errors.
     */
    @NonNull
    public UsageRecord reportUsage(
        @NonNull String subscriptionItemId,
        long quantity,
        @NonNull String idempotencyKey
    ) throws StripeException {
        return client.subscriptionItems().usageRecords().create(
            subscriptionItemId,
            UsageRecordCreateParams.builder()
                .setQuantity(quantity)
                .setAction(UsageRecordCreateParams.Action.SET)
                .build(),
            RequestOptions.builder()
                .setIdempotencyKey(idempotencyKey)
                .build());
    }

    /**
     * Creates a product with a single recurring price.
     *
     * @param name        product name.
     * @param description product description, may be {@literal null}.
     * @param unitAmount  price in the currency's minor units.
     * @param currency    ISO 4217 currency code.
     * @param yearly      whether the price recurs yearly instead of monthly.
     * @return the new price. Its product id is available through {@link Price#getProduct()}.
     * @throws StripeException on Stripe API errors.
     */
    @NonNull
    public Price createRecurringPrice(
        @NonNull String name,
        String description,
        long unitAmount,
        @NonNull String currency,
        boolean yearly
    ) throws StripeException {
        val product = client.products().create(
            ProductCreateParams.builder()
                .setName(name)
                .setDescription(description)
                .build());

        return client.prices().create(
            PriceCreateParams.builder()
                .setProduct(product.getId())
                .setUnitAmount(unitAmount)
                .setCurrency(currency)
                .setRecurring(
                    PriceCreateParams.Recurring.builder()
                        .setInterval(
                            yearly
                                ? PriceCreateParams.Recurring.Interval.YEAR
                                : PriceCreateParams.Recurring.Interval.MONTH)
                        .build())
                .build());
    }
}
