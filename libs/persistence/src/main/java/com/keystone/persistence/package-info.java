/**
 * Tenant-scoping data gateway for the Keystone platform.
 *
 * <p>{@link com.keystone.persistence.TenantScopedGateway} sits between application code and a
 * {@link com.keystone.persistence.RecordStore}. Operations on
 * {@link com.keystone.persistence.model.TenantScoped} types are confined to the tenant of the
 * current request:
 *
 * <ul>
 *   <li>reads, counts and aggregates get a {@code tenantId} condition
 *   <li>creates are stamped with the tenant
 *   <li>updates and deletes only reach records of the tenant
 *   <li>soft-deleted records are hidden unless asked for
 * </ul>
 *
 * @see com.keystone.persistence.DataOperation
 */
package com.keystone.persistence;
