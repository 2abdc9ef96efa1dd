package com.meterly.api.billing.exceptions;

/**
 * Thrown when an invoice does not exist or belongs to another tenant.
 */
public class InvoiceNotFoundException extends ValidationException {

    public InvoiceNotFoundException(String message) {
        super(message);
    }
}
