package com.keystone.tenantapi.security;

import com.keystone.audit.AuditAction;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Records an audit entry when the operation completes, successfully or not.
 *
 * <pre>
 * &#64;Audited(action = AuditAction.DELETE, resource = "User")
 * &#64;DeleteMapping("/{id}")
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Audited {

    AuditAction action();

    String resource();
}
