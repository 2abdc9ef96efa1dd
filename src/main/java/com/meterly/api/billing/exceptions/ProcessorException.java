package com.meterly.api.billing.exceptions;

import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.ApiException;
import com.stripe.exception.RateLimitException;
import com.stripe.exception.StripeException;
import lombok.Getter;
import lombok.NonNull;

/**
 * Thrown when a Stripe call fails. Local state is left as it was before the call.
 *
 * <p>
 * A {@link #isRetryable() retryable} failure, such as a timeout, does not tell whether Stripe
 * applied the request. Callers must re-read the processor state rather than assume either
 * outcome.</p>
 */
public class ProcessorException extends Exception {

    @Getter
    private final boolean retryable;

    public ProcessorException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ProcessorException(String message, @NonNull StripeException cause) {
        super(String.format("%s: %s", message, cause.getMessage()), cause);
        this.retryable = isRetryable(cause);
    }

    static boolean isRetryable(@NonNull StripeException e) {
        return e instanceof ApiConnectionException
            || e instanceof RateLimitException
            || e instanceof ApiException;
    }
}
