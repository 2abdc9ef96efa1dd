package com.meterly.api.billing;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration properties used by various components in the billing package.
 */
@Validated
@ConfigurationProperties("app.billing")
@Data
class BillingConfiguration {

    @NotBlank
    private final String stripeApiKey;

    @NotBlank
    private final String stripeWebhookSecret;

    @NotNull
    private final Duration stripeConnectTimeout;

    @NotNull
    private final Duration stripeReadTimeout;

    @Min(0)
    private final int stripeMaxNetworkRetries;

    /**
     * ISO 4217 code used for overage charges.
     */
    @NotBlank
    private final String currency;

    /**
     * Name of the plan that expired trials without a payment method fall back to.
     */
    @NotBlank
    private final String freePlanName;

    @Min(1)
    @Max(365)
    private final int maxTrialPeriodDays;

    /**
     * Usage window for subscriptions that do not report a current period start.
     */
    @NotNull
    private final Duration defaultUsagePeriod;

    @NotNull
    private final Duration dunningFinalNoticeAfter;

    @NotNull
    private final Duration dunningCancelAfter;

    /**
     * Per-unit overage price keyed by feature. Features without a rate are tracked but not billed.
     */
    @NotNull
    private final Map<String, BigDecimal> overageRates;

    @NotNull
    private final Duration cacheTtl;
}
