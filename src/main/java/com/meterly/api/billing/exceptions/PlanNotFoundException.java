package com.meterly.api.billing.exceptions;

/**
 * Thrown when a plan does not exist or is no longer offered.
 */
public class PlanNotFoundException extends ValidationException {

    public PlanNotFoundException(String message) {
        super(message);
    }
}
