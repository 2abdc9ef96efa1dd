package com.meterly.api.platform;

import jakarta.validation.ConstraintViolationException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * <p>
 * Maps errors that escape request handlers to HTTP statuses. The only inbound callers are payment
 * processor webhooks, which redeliver an event on any non-2xx response. Hence, malformed requests
 * get a 4xx that is logged quietly, while transient persistence failures get a status that invites
 * the redelivery.</p>
 */
@RestControllerAdvice
@Slf4j
public class GlobalControllerAdvice {

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        ServletRequestBindingException.class,
        ConstraintViolationException.class,
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    void handleMalformedRequest(@NonNull final Exception e) {
        log.debug("rejecting malformed request: {}", e.getMessage());
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    @ResponseStatus(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
    void handleUnsupportedMediaType(@NonNull final HttpMediaTypeNotSupportedException e) {
        log.debug("rejecting request with media type {}", e.getContentType());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    @ResponseStatus(HttpStatus.METHOD_NOT_ALLOWED)
    void handleUnsupportedMethod(@NonNull final HttpRequestMethodNotSupportedException e) {
        log.debug("rejecting request with method {}", e.getMethod());
    }

    /**
     * A concurrent writer won the race for the same row. The redelivered event is applied on top
     * of the winner's state.
     */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    void handleWriteConflict(@NonNull final OptimisticLockingFailureException e) {
        log.warn("concurrent update while processing the request: {}", e.getMessage());
    }

    @ExceptionHandler(TransientDataAccessException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    void handleTransientPersistenceError(@NonNull final TransientDataAccessException e) {
        log.warn("transient persistence error while processing the request", e);
    }

    @ExceptionHandler(Throwable.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    void handleInternalError(@NonNull final Throwable e) {
        log.error("uncaught exception while processing the request", e);
    }
}
