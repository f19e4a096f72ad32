/**
 * Business operations of the tenant API.
 *
 * <ul>
 *   <li>Domain services reach data only through the repositories of {@code com.keystone.persistence},
 *       which are scoped to the tenant of the current request
 *   <li>Domain classes do not depend on the {@code api} or {@code infrastructure} packages
 * </ul>
 */
package com.keystone.tenantapi.domain;
