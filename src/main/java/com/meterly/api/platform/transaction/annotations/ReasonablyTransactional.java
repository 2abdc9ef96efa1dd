package com.meterly.api.platform.transaction.annotations;

import org.springframework.core.annotation.AliasFor;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * A reasonable meta-annotation for {@link Transactional} with {@link Transactional#rollbackFor()
 * rollbackFor} set to {@link Exception} instead of {@link RuntimeException} and {@link Error}.
 * Checked billing exceptions therefore roll back any partial local mutation.
 *
 * @see <a
 * href="https://docs.spring.io/spring-framework/docs/current/reference/html/data-access.html#transaction-declarative-rolling-back">
 * Rolling back a declarative transaction - Spring documentation</a>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
@Transactional(rollbackFor = Exception.class)
public @interface ReasonablyTransactional {

    /**
     * Alias for {@link Transactional#propagation()}. Sweep items use {@link
     * Propagation#REQUIRES_NEW} so that each one commits or rolls back on its own.
     */
    @AliasFor(annotation = Transactional.class)
    Propagation propagation() default Propagation.REQUIRED;
}
