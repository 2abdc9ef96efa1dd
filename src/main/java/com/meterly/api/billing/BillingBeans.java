package com.meterly.api.billing;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.meterly.api.billing.upstream.StripeApi;
import lombok.NonNull;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Beans used by the billing package.
 */
@Configuration
class BillingBeans {

    static final String PLAN_CACHE_NAME = "billing_plan_cache";

    @NonNull
    @Bean
    StripeApi stripeApi(@NonNull BillingConfiguration config) {
        return new StripeApi(
            config.getStripeApiKey(),
            config.getStripeConnectTimeout(),
            config.getStripeReadTimeout(),
            config.getStripeMaxNetworkRetries());
    }

    @NonNull
    @Bean(name = PLAN_CACHE_NAME)
    Cache planCache(@NonNull BillingConfiguration config) {
        return new CaffeineCache(PLAN_CACHE_NAME, Caffeine.newBuilder()
            .expireAfterWrite(config.getCacheTtl())
            .initialCapacity(16)
            .maximumSize(256)
            .recordStats()
            .build());
    }
}
