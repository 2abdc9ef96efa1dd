package com.meterly.api.billing.exceptions;

/**
 * Thrown when a webhook payload's signature cannot be verified. No state is changed.
 */
public class WebhookSignatureException extends Exception {

    public WebhookSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
