package uk.gegc.gatekeeper.shared.security.annotation;

import uk.gegc.gatekeeper.features.catalog.domain.model.RoleName;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequireMinimumRole {
    RoleName value();

    String organizationId() default "";
}
