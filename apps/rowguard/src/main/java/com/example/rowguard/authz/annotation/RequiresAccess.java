package com.example.rowguard.authz.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the attribute condition a caller must satisfy to invoke a method.
 *
 * <p>Processed by {@link com.example.rowguard.authz.aspect.AccessControlAspect}. The caller is
 * taken from a {@link com.example.rowguard.authz.model.User} argument when the method has one,
 * otherwise from the reactive request context for methods returning {@code Mono} or
 * {@code Flux}.
 *
 * <pre>{@code
 * @RequiresAccess("user with admin in roles")
 * public Mono<Void> purge(String table) { ... }
 *
 * @RequiresAccess("user with contractor not in roles")
 * public Report export(User user, String reportId) { ... }
 * }</pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequiresAccess {

    /**
     * Condition in the form {@code user with VALUE in CATEGORY} or
     * {@code user with VALUE not in CATEGORY}.
     */
    String value();
}
