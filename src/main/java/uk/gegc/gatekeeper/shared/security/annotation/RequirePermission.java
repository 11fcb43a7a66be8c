package uk.gegc.gatekeeper.shared.security.annotation;

import uk.gegc.gatekeeper.shared.security.LogicalOperator;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Guards a method with one or more catalog permissions for the current subject.
 *
 * <p>{@link #ownerId()}, {@link #teamId()} and {@link #organizationId()} are SpEL
 * expressions over the method arguments, e.g. {@code "#campaign.ownerId"}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequirePermission {
    String[] value();

    LogicalOperator operator() default LogicalOperator.OR;

    String ownerId() default "";

    String teamId() default "";

    String organizationId() default "";
}
