package com.meterly.api.billing.exceptions;

/**
 * Thrown when a subscription does not exist, is deleted or belongs to another tenant.
 */
public class SubscriptionNotFoundException extends ValidationException {

    public SubscriptionNotFoundException(String message) {
        super(message);
    }
}
