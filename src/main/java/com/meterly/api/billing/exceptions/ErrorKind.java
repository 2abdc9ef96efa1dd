package com.meterly.api.billing.exceptions;

/**
 * Kinds of failure recorded in sweep results. Webhook signature failures never reach a sweep and
 * surface as {@link WebhookSignatureException} instead.
 */
public enum ErrorKind {

    /**
     * Bad input, e.g. a missing plan or subscription. Never retried.
     */
    VALIDATION,

    /**
     * A Stripe call failed or returned an error.
     */
    PROCESSOR,

    /**
     * A local persistence failure. The affected operation is rolled back.
     */
    PERSISTENCE,
}
