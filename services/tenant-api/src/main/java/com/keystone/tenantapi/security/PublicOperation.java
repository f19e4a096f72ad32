package com.keystone.tenantapi.security;

import com.keystone.security.access.TenantRequirement;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a handler (or every handler of a controller) as callable without a principal.
 *
 * <p>A principal that is presented anyway is still checked against the request's tenant.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface PublicOperation {

    /** Whether the operation needs a resolved tenant; by default only in strict tenant mode. */
    TenantRequirement tenant() default TenantRequirement.DEFAULT;
}
