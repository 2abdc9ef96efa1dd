package com.meterly.api.contracts;

import lombok.Getter;
import lombok.NonNull;

/**
 * Notifications that the billing engine may request from the notification collaborator.
 */
public enum NotificationType {

    SUBSCRIPTION_CREATED("subscription_created"),
    SUBSCRIPTION_STATUS_CHANGED("subscription_status_changed"),
    SUBSCRIPTION_UPGRADED("subscription_upgraded"),
    SUBSCRIPTION_DOWNGRADED("subscription_downgraded"),
    SUBSCRIPTION_DOWNGRADE_SCHEDULED("subscription_downgrade_scheduled"),
    SUBSCRIPTION_CANCELED("subscription_canceled"),
    SUBSCRIPTION_CANCELED_NONPAYMENT("subscription_canceled_nonpayment"),
    SUBSCRIPTION_REACTIVATED("subscription_reactivated"),
    TRIAL_ENDING("trial_ending"),
    TRIAL_CONVERTED("trial_converted"),
    TRIAL_EXPIRED("trial_expired"),
    USAGE_OVERAGE("usage_overage"),
    PAYMENT_SUCCEEDED("payment_succeeded"),
    PAYMENT_FAILED("payment_failed"),
    PAYMENT_REMINDER("payment_reminder"),
    PAYMENT_FINAL_NOTICE("payment_final_notice");

    @Getter
    @NonNull
    private final String key;

    NotificationType(@NonNull String key) {
        this.key = key;
    }
}
