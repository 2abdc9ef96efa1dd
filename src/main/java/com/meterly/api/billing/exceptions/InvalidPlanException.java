package com.meterly.api.billing.exceptions;

/**
 * Thrown when plan attributes fail validation.
 */
public class InvalidPlanException extends ValidationException {

    public InvalidPlanException(String message) {
        super(message);
    }
}
