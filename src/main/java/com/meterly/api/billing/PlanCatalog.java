package com.meterly.api.billing;

import com.meterly.api.billing.entities.Plan;
import com.meterly.api.billing.entities.PlanRepository;
import com.meterly.api.billing.exceptions.InvalidPlanException;
import com.meterly.api.billing.exceptions.PlanNotFoundException;
import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.models.PlanFeatures;
import com.meterly.api.billing.models.PlanLimits;
import com.meterly.api.billing.payload.PlanParams;
import com.meterly.api.billing.upstream.MinorUnits;
import com.meterly.api.billing.upstream.StripeApi;
import com.meterly.api.platform.transaction.annotations.ReasonablyTransactional;
import com.stripe.exception.StripeException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Reference data of the plans that tenants can subscribe to.
 */
@Service
@Slf4j
class PlanCatalog {

    static final String PUBLIC_PLANS_CACHE_KEY = "public_plans";

    private final BillingConfiguration billingConfig;
    private final PlanRepository planRepository;
    private final StripeApi stripeApi;
    private final Cache cache;

    @Autowired
    PlanCatalog(
        @NonNull BillingConfiguration billingConfig,
        @NonNull PlanRepository planRepository,
        @NonNull StripeApi stripeApi,
        @NonNull @Qualifier(BillingBeans.PLAN_CACHE_NAME) Cache cache
    ) {
        this.billingConfig = billingConfig;
        this.planRepository = planRepository;
        this.stripeApi = stripeApi;
        this.cache = cache;
    }

    /**
     * @return active plans that are offered publicly, cheapest first.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Cacheable(cacheNames = BillingBeans.PLAN_CACHE_NAME, key = "'" + PUBLIC_PLANS_CACHE_KEY + "'")
    public List<Plan> listPlans() {
        return planRepository.findAllActivePublic();
    }

    /**
     * @throws PlanNotFoundException if the plan does not exist or is no longer offered.
     */
    @NonNull
    Plan getActivePlan(long planId) throws PlanNotFoundException {
        return planRepository.findById(planId)
            .filter(Plan::isActive)
            .orElseThrow(() -> new PlanNotFoundException(String.format("plan %d does not exist", planId)));
    }

    /**
     * @return the active plan that expired trials fall back to, if one is configured.
     */
    @NonNull
    Optional<Plan> findFreePlan(@NonNull String name) {
        return planRepository.findActiveByName(name);
    }

    @NonNull
    Optional<Plan> findByStripePriceId(String stripePriceId) {
        if (stripePriceId == null) {
            return Optional.empty();
        }

        return planRepository.findByStripePriceId(stripePriceId);
    }

    /**
     * Creates a new plan. Paid plans get a Stripe product and recurring price first, so that a
     * plan never exists locally without a price that subscriptions can be created with.
     *
     * @throws InvalidPlanException if the plan attributes are not valid.
     * @throws ProcessorException   if the Stripe product or price cannot be created.
     */
    @NonNull
    @ReasonablyTransactional
    public Plan createPlan(@NonNull PlanParams params) throws InvalidPlanException, ProcessorException {
        if (params.getName() == null || params.getName().strip().length() < 2) {
            throw new InvalidPlanException("plan name must be at least 2 characters long");
        }

        val price = params.getPrice();
        if (price == null || price.signum() < 0 || price.scale() > 2) {
            throw new InvalidPlanException("plan price must be a non-negative amount with at most 2 decimals");
        }

        if (params.getBillingInterval() == null) {
            throw new InvalidPlanException("plan billing interval is required");
        }

        final PlanLimits limits;
        final PlanFeatures features;
        try {
            limits = PlanLimits.of(params.getLimits());
            features = PlanFeatures.of(params.getFeatures());
        } catch (IllegalArgumentException e) {
            throw new InvalidPlanException(e.getMessage());
        }

        val plan = Plan.builder()
            .name(params.getName().strip())
            .description(params.getDescription())
            .price(price.setScale(2))
            .billingInterval(params.getBillingInterval())
            .limits(limits)
            .features(features)
            .isPublic(params.isPublic())
            .build();

        if (price.compareTo(BigDecimal.ZERO) > 0) {
            try {
                val stripePrice = stripeApi.createRecurringPrice(
                    plan.getName(),
                    plan.getDescription(),
                    MinorUnits.fromDecimal(price, billingConfig.getCurrency()),
                    billingConfig.getCurrency(),
                    plan.getBillingInterval() == Plan.BillingInterval.YEAR);

                plan.setStripePriceId(stripePrice.getId());
                plan.setStripeProductId(stripePrice.getProduct());
            } catch (StripeException e) {
                throw new ProcessorException("failed to create stripe price for plan", e);
            }
        }

        val saved = planRepository.save(plan);
        cache.evictIfPresent(PUBLIC_PLANS_CACHE_KEY);
        log.info("created plan '{}' with id {}", saved.getName(), saved.getId());
        return saved;
    }

    /**
     * Stops offering a plan. Subscriptions already on it keep their plan and entitlements.
     *
     * @throws PlanNotFoundException if the plan does not exist.
     */
    @ReasonablyTransactional
    public void retirePlan(long planId) throws PlanNotFoundException {
        val plan = planRepository.findById(planId)
            .orElseThrow(() -> new PlanNotFoundException(String.format("plan %d does not exist", planId)));

        plan.setActive(false);
        planRepository.save(plan);
        cache.evictIfPresent(PUBLIC_PLANS_CACHE_KEY);
    }
}
