/**
 * Typed repositories. They reach records only through
 * {@link com.keystone.persistence.TenantScopedGateway}, so tenant scoping applies to every query
 * they issue.
 */
package com.keystone.persistence.repository;
