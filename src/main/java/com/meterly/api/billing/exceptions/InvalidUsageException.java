package com.meterly.api.billing.exceptions;

/**
 * Thrown when a usage record has a blank feature or a non-positive quantity.
 */
public class InvalidUsageException extends ValidationException {

    public InvalidUsageException(String message) {
        super(message);
    }
}
