package com.meterly.api.billing.exceptions;

/**
 * Thrown when a tenant already owns an active subscription.
 */
public class DuplicateSubscriptionException extends ValidationException {

    public DuplicateSubscriptionException(String message) {
        super(message);
    }
}
