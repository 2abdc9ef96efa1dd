package com.meterly.api.billing.exceptions;

/**
 * Base type of errors caused by bad input. Surfaced to the caller, never retried.
 */
public class ValidationException extends Exception {

    public ValidationException(String message) {
        super(message);
    }
}
