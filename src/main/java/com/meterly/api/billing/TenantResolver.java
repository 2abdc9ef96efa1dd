package com.meterly.api.billing;

import com.meterly.api.billing.entities.SubscriptionRepository;
import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.upstream.StripeApi;
import com.stripe.exception.StripeException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Attributes Stripe objects that have no local record yet to a tenant.
 */
@Component
@Slf4j
class TenantResolver {

    static final String TENANT_ID_METADATA_KEY = "tenant_id";

    private final SubscriptionRepository subscriptionRepository;
    private final StripeApi stripeApi;

    @Autowired
    TenantResolver(@NonNull SubscriptionRepository subscriptionRepository, @NonNull StripeApi stripeApi) {
        this.subscriptionRepository = subscriptionRepository;
        this.stripeApi = stripeApi;
    }

    /**
     * Looks for the tenant in the object's own metadata, then in local subscriptions of the same
     * customer, and finally in the Stripe customer's metadata.
     *
     * @param metadata   metadata of the Stripe object, may be {@literal null}.
     * @param customerId Stripe customer of the object, may be {@literal null}.
     * @return the tenant id, if one could be found.
     * @throws ProcessorException if the Stripe customer cannot be retrieved.
     */
    @NonNull
    Optional<Long> resolve(Map<String, String> metadata, String customerId) throws ProcessorException {
        val fromMetadata = parseTenantId(metadata);
        if (fromMetadata.isPresent() || customerId == null) {
            return fromMetadata;
        }

        val known = subscriptionRepository.findTenantIdsByStripeCustomerId(customerId);
        if (!known.isEmpty()) {
            return Optional.of(known.get(0));
        }

        try {
            return parseTenantId(stripeApi.getCustomer(customerId).getMetadata());
        } catch (StripeException e) {
            throw new ProcessorException("failed to retrieve stripe customer", e);
        }
    }

    @NonNull
    private static Optional<Long> parseTenantId(Map<String, String> metadata) {
        if (metadata == null || metadata.get(TENANT_ID_METADATA_KEY) == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(Long.parseLong(metadata.get(TENANT_ID_METADATA_KEY)));
        } catch (NumberFormatException e) {
            log.warn("ignoring malformed tenant id in stripe metadata: {}", metadata.get(TENANT_ID_METADATA_KEY));
            return Optional.empty();
        }
    }
}
