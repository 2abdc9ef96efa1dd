package com.meterly.api.billing;

import com.meterly.api.billing.entities.Invoice;
import com.meterly.api.billing.entities.InvoiceRepository;
import com.meterly.api.billing.entities.Subscription;
import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.exceptions.InvoiceNotFoundException;
import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.exceptions.SubscriptionNotFoundException;
import com.meterly.api.billing.upstream.EpochSeconds;
import com.meterly.api.billing.upstream.MinorUnits;
import com.meterly.api.billing.upstream.StripeApi;
import com.meterly.api.platform.transaction.annotations.ReasonablyTransactional;
import com.stripe.exception.StripeException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps the local {@link Invoice} projection in sync with Stripe invoices.
 */
@Service
@Slf4j
class InvoiceMirror {

    static final Set<Invoice.Status> OUTSTANDING_STATUSES = EnumSet.of(Invoice.Status.DRAFT, Invoice.Status.OPEN);

    private final InvoiceRepository invoiceRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final TenantResolver tenantResolver;
    private final StripeApi stripeApi;

    @Autowired
    InvoiceMirror(
        @NonNull InvoiceRepository invoiceRepository,
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull TenantResolver tenantResolver,
        @NonNull StripeApi stripeApi
    ) {
        this.invoiceRepository = invoiceRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.tenantResolver = tenantResolver;
        this.stripeApi = stripeApi;
    }

    /**
     * Fetches the invoice from Stripe and upserts its local mirror.
     *
     * @return the local invoice, or empty if it cannot be attributed to a tenant.
     * @throws ProcessorException if the invoice cannot be retrieved from Stripe.
     */
    @NonNull
    @ReasonablyTransactional
    Optional<Invoice> syncFromProcessor(@NonNull String stripeInvoiceId) throws ProcessorException {
        final com.stripe.model.Invoice remote;
        try {
            remote = stripeApi.getInvoice(stripeInvoiceId);
        } catch (StripeException e) {
            throw new ProcessorException("failed to retrieve stripe invoice", e);
        }

        return apply(remote);
    }

    /**
     * Upserts the local mirror of the most recent invoice of the subscription.
     *
     * @throws ProcessorException if Stripe cannot be reached.
     */
    @NonNull
    @ReasonablyTransactional
    Optional<Invoice> syncLatestForSubscription(@NonNull Subscription subscription) throws ProcessorException {
        if (subscription.getStripeSubscriptionId() == null) {
            return Optional.empty();
        }

        final Optional<com.stripe.model.Invoice> remote;
        try {
            remote = stripeApi.getLatestInvoice(subscription.getStripeSubscriptionId());
        } catch (StripeException e) {
            throw new ProcessorException("failed to list stripe invoices", e);
        }

        if (remote.isEmpty()) {
            return Optional.empty();
        }

        return apply(remote.get());
    }

    /**
     * Re-reads every draft or open invoice of the subscription from Stripe.
     *
     * @throws ProcessorException if Stripe cannot be reached.
     */
    @ReasonablyTransactional
    void refreshOutstanding(@NonNull Subscription subscription) throws ProcessorException {
        for (val invoice : invoiceRepository.findAllBySubscriptionIdAndStatusIn(subscription.getId(), OUTSTANDING_STATUSES)) {
            syncFromProcessor(invoice.getStripeInvoiceId());
        }
    }

    /**
     * On-demand refresh of a tenant's invoice.
     *
     * @throws InvoiceNotFoundException if the invoice does not exist or belongs to another tenant.
     * @throws ProcessorException       if the invoice cannot be retrieved from Stripe.
     */
    @NonNull
    @ReasonablyTransactional
    public Invoice refresh(long tenantId, long invoiceId) throws InvoiceNotFoundException, ProcessorException {
        val invoice = findInvoice(tenantId, invoiceId);
        return syncFromProcessor(invoice.getStripeInvoiceId()).orElse(invoice);
    }

    /**
     * <p>
     * Creates a draft invoice for the customer of a tenant's subscription and mirrors it. The
     * invoice collects the subscription's pending invoice items, e.g. overage charges.</p>
     * <p>
     * If {@code amount} is given, a one-off line of that amount is added to the invoice.</p>
     *
     * @param amount      amount of the one-off line in major units, or {@literal null} for none.
     * @param currency    ISO 4217 code of the invoice.
     * @param description description of the invoice and its one-off line, may be {@literal null}.
     * @throws SubscriptionNotFoundException if the subscription does not exist, belongs to another
     *                                       tenant or has no Stripe customer.
     * @throws ProcessorException            if Stripe rejects the request.
     */
    @NonNull
    @ReasonablyTransactional
    public Invoice createInvoice(
        long tenantId,
        long subscriptionId,
        BigDecimal amount,
        @NonNull String currency,
        String description
    ) throws SubscriptionNotFoundException, ProcessorException {
        if (amount != null && amount.signum() <= 0) {
            throw new IllegalArgumentException("invoice amount must be positive");
        }

        val subscription = subscriptionRepository.findById(subscriptionId)
            .filter(s -> s.getTenantId() == tenantId && s.getStripeCustomerId() != null)
            .orElseThrow(() -> new SubscriptionNotFoundException("subscription does not exist"));

        val metadata = Map.of(
            TenantResolver.TENANT_ID_METADATA_KEY, String.valueOf(tenantId),
            "subscription_id", String.valueOf(subscriptionId));

        com.stripe.model.Invoice remote;
        try {
            remote = stripeApi.createInvoice(
                subscription.getStripeCustomerId(),
                subscription.getStripeSubscriptionId(),
                currency.toLowerCase(Locale.ROOT),
                description,
                metadata);

            if (amount != null) {
                stripeApi.addInvoiceLine(
                    subscription.getStripeCustomerId(),
                    remote.getId(),
                    MinorUnits.fromDecimal(amount, currency),
                    currency.toLowerCase(Locale.ROOT),
                    description != null ? description : "one-time charge");

                remote = stripeApi.getInvoice(remote.getId());
            }
        } catch (StripeException e) {
            throw new ProcessorException("failed to create stripe invoice", e);
        }

        log.info("created stripe invoice {} for subscription {}", remote.getId(), subscriptionId);
        return mirror(remote);
    }

    /**
     * Finalizes a tenant's draft invoice so that it can be paid.
     *
     * @throws InvoiceNotFoundException if the invoice does not exist or belongs to another tenant.
     * @throws ProcessorException       if Stripe rejects the request.
     */
    @NonNull
    @ReasonablyTransactional
    public Invoice finalizeInvoice(long tenantId, long invoiceId) throws InvoiceNotFoundException, ProcessorException {
        val invoice = findInvoice(tenantId, invoiceId);
        try {
            return apply(stripeApi.finalizeInvoice(invoice.getStripeInvoiceId())).orElse(invoice);
        } catch (StripeException e) {
            throw new ProcessorException("failed to finalize stripe invoice", e);
        }
    }

    /**
     * Asks Stripe to email a tenant's open invoice to the customer.
     *
     * @throws InvoiceNotFoundException if the invoice does not exist or belongs to another tenant.
     * @throws ProcessorException       if Stripe rejects the request.
     */
    @NonNull
    @ReasonablyTransactional
    public Invoice sendInvoice(long tenantId, long invoiceId) throws InvoiceNotFoundException, ProcessorException {
        val invoice = findInvoice(tenantId, invoiceId);
        try {
            return apply(stripeApi.sendInvoice(invoice.getStripeInvoiceId())).orElse(invoice);
        } catch (StripeException e) {
            throw new ProcessorException("failed to send stripe invoice", e);
        }
    }

    /**
     * Voids a tenant's finalized invoice. Stripe rejects voiding a paid invoice.
     *
     * @throws InvoiceNotFoundException if the invoice does not exist or belongs to another tenant.
     * @throws ProcessorException       if Stripe rejects the request.
     */
    @NonNull
    @ReasonablyTransactional
    public Invoice voidInvoice(long tenantId, long invoiceId) throws InvoiceNotFoundException, ProcessorException {
        val invoice = findInvoice(tenantId, invoiceId);
        try {
            return apply(stripeApi.voidInvoice(invoice.getStripeInvoiceId())).orElse(invoice);
        } catch (StripeException e) {
            throw new ProcessorException("failed to void stripe invoice", e);
        }
    }

    /**
     * Returns a URL where the customer can pay a tenant's invoice. It is the invoice's hosted page
     * when Stripe issued one, or else a new payment link for the amount due.
     *
     * @throws InvoiceNotFoundException if the invoice does not exist or belongs to another tenant.
     * @throws ProcessorException       if Stripe rejects the request.
     */
    @NonNull
    @Transactional(readOnly = true)
    public String createPaymentLink(long tenantId, long invoiceId) throws InvoiceNotFoundException, ProcessorException {
        val invoice = findInvoice(tenantId, invoiceId);
        if (invoice.getHostedInvoiceUrl() != null) {
            return invoice.getHostedInvoiceUrl();
        }

        if (invoice.getCurrency() == null || invoice.getAmountDue().signum() <= 0) {
            throw new IllegalStateException("invoice has no amount due");
        }

        val name = "Invoice " + (invoice.getInvoiceNumber() != null ? invoice.getInvoiceNumber() : invoice.getStripeInvoiceId());
        try {
            return stripeApi.createPaymentLink(
                    name,
                    MinorUnits.fromDecimal(invoice.getAmountDue(), invoice.getCurrency()),
                    invoice.getCurrency().toLowerCase(Locale.ROOT),
                    Map.of(
                        "invoice_id", invoice.getStripeInvoiceId(),
                        TenantResolver.TENANT_ID_METADATA_KEY, String.valueOf(tenantId)))
                .getUrl();
        } catch (StripeException e) {
            throw new ProcessorException("failed to create stripe payment link", e);
        }
    }

    /**
     * @return the tenant's draft and open invoices, newest first.
     */
    @NonNull
    @Transactional(readOnly = true)
    public List<Invoice> listOutstanding(long tenantId) {
        return invoiceRepository.findAllByTenantIdAndStatusIn(tenantId, OUTSTANDING_STATUSES);
    }

    /**
     * Marks the mirrored invoice as paid with the amount Stripe reports as paid. The payment time is
     * taken from the invoice's status transitions and defaults to now.
     */
    @NonNull
    @ReasonablyTransactional
    Invoice markPaid(@NonNull Invoice invoice, @NonNull com.stripe.model.Invoice remote) {
        invoice.setStatus(Invoice.Status.PAID);
        if (remote.getAmountPaid() != null) {
            invoice.setAmountPaid(MinorUnits.toDecimal(remote.getAmountPaid(), invoice.getCurrency()));
        }

        invoice.setPaidAt(paidAtOf(remote).orElse(invoice.getPaidAt() != null ? invoice.getPaidAt() : OffsetDateTime.now()));
        return invoiceRepository.save(invoice);
    }

    /**
     * Upserts the local mirror of {@code remote}.
     *
     * @return the local invoice, or empty if a new invoice cannot be attributed to a tenant.
     * @throws ProcessorException if the tenant lookup needs Stripe and the call fails.
     */
    @NonNull
    @ReasonablyTransactional
    Optional<Invoice> apply(@NonNull com.stripe.model.Invoice remote) throws ProcessorException {
        val localSubscription = Optional.ofNullable(remote.getSubscription())
            .flatMap(subscriptionRepository::findByStripeSubscriptionId);

        Invoice invoice = invoiceRepository.findByStripeInvoiceId(remote.getId()).orElse(null);
        if (invoice == null) {
            final Optional<Long> tenantId;
            if (localSubscription.isPresent()) {
                tenantId = Optional.of(localSubscription.get().getTenantId());
            } else {
                tenantId = tenantResolver.resolve(remote.getMetadata(), remote.getCustomer());
            }

            if (tenantId.isEmpty()) {
                log.warn("unable to attribute stripe invoice {} to a tenant", remote.getId());
                return Optional.empty();
            }

            invoice = Invoice.builder()
                .tenantId(tenantId.get())
                .stripeInvoiceId(remote.getId())
                .build();
        }

        if (localSubscription.isPresent()) {
            invoice.setSubscriptionId(localSubscription.get().getId());
        }

        copyFields(invoice, remote);
        return Optional.of(invoiceRepository.save(invoice));
    }

    @NonNull
    private Invoice findInvoice(long tenantId, long invoiceId) throws InvoiceNotFoundException {
        return invoiceRepository.findById(invoiceId)
            .filter(i -> i.getTenantId() == tenantId)
            .orElseThrow(() -> new InvoiceNotFoundException("invoice does not exist"));
    }

    @NonNull
    private Invoice mirror(@NonNull com.stripe.model.Invoice remote) throws ProcessorException {
        return apply(remote).orElseThrow(() -> new ProcessorException("stripe invoice has no tenant", false));
    }

    private static void copyFields(@NonNull Invoice invoice, @NonNull com.stripe.model.Invoice remote) {
        if (remote.getCurrency() != null) {
            invoice.setCurrency(remote.getCurrency().toUpperCase(Locale.ROOT));
        }

        invoice.setInvoiceNumber(remote.getNumber());
        invoice.setStripePaymentIntentId(remote.getPaymentIntent());
        invoice.setAmountTotal(MinorUnits.toDecimal(remote.getTotal(), invoice.getCurrency()));
        invoice.setAmountPaid(MinorUnits.toDecimal(remote.getAmountPaid(), invoice.getCurrency()));
        invoice.setInvoiceDate(EpochSeconds.toDateTime(remote.getCreated()));
        invoice.setDueDate(EpochSeconds.toDateTime(remote.getDueDate()));
        invoice.setHostedInvoiceUrl(remote.getHostedInvoiceUrl());
        invoice.setInvoicePdfUrl(remote.getInvoicePdf());
        if (remote.getStatus() != null) {
            try {
                invoice.setStatus(Invoice.Status.fromStripeValue(remote.getStatus()));
            } catch (IllegalArgumentException e) {
                log.warn("keeping local status, unknown status '{}' of stripe invoice {}", remote.getStatus(), remote.getId());
            }
        }

        if (invoice.isPaid() && invoice.getPaidAt() == null) {
            invoice.setPaidAt(paidAtOf(remote).orElse(OffsetDateTime.now()));
        }
    }

    @NonNull
    private static Optional<OffsetDateTime> paidAtOf(@NonNull com.stripe.model.Invoice remote) {
        return Optional.ofNullable(remote.getStatusTransitions())
            .map(com.stripe.model.Invoice.StatusTransitions::getPaidAt)
            .map(EpochSeconds::toDateTime);
    }
}
