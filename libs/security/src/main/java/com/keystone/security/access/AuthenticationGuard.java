package com.keystone.security.access;

import com.keystone.security.DenialReason;

/** Denies protected operations that have no authenticated principal. */
public final class AuthenticationGuard implements AccessGuard {

    @Override
    public String name() {
        return "authentication";
    }

    @Override
    public GuardVerdict evaluate(AccessRequest request) {
        if (!request.principalRequired()) {
            return GuardVerdict.skip();
        }
        if (request.principal().isPresent()) {
            return GuardVerdict.allow();
        }
        String message = request.credentialFailure()
                .map(Throwable::getMessage)
                .orElse("Authentication is required");
        return GuardVerdict.deny(DenialReason.UNAUTHENTICATED, message);
    }
}
