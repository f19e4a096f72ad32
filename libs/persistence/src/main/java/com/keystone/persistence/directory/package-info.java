/**
 * Adapters exposing persisted tenants and tenant roles to the access-control core.
 */
package com.keystone.persistence.directory;
