package com.meterly.api.billing.exceptions;

/**
 * Thrown when a requested trial length is outside the allowed range.
 */
public class InvalidTrialPeriodException extends ValidationException {

    public InvalidTrialPeriodException(String message) {
        super(message);
    }
}
