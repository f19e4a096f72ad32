package com.keystone.security.access;

/**
 * Allows public operations through the authentication stage. Tenant and role stages still run,
 * and see {@link AccessRequest#principalRequired()} as false.
 */
public final class PublicBypassGuard implements AccessGuard {

    @Override
    public String name() {
        return "public-bypass";
    }

    @Override
    public GuardVerdict evaluate(AccessRequest request) {
        return request.policy().publicAccess() ? GuardVerdict.allow() : GuardVerdict.skip();
    }
}
