package com.meterly.api.billing.exceptions;

/**
 * Thrown when an action is not allowed in the subscription's current status.
 */
public class SubscriptionStateException extends ValidationException {

    public SubscriptionStateException(String message) {
        super(message);
    }
}
