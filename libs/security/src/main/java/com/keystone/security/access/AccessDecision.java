package com.keystone.security.access;

import java.util.Optional;

/**
 * Final outcome of the pipeline for one request.
 *
 * @param operationId the evaluated operation
 * @param deniedBy    name of the guard that denied, null if allowed
 * @param denial      the denying verdict, null if allowed
 */
public record AccessDecision(String operationId, String deniedBy, GuardVerdict.Deny denial) {

    static AccessDecision allowed(String operationId) {
        return new AccessDecision(operationId, null, null);
    }

    static AccessDecision denied(String operationId, String guard, GuardVerdict.Deny denial) {
        return new AccessDecision(operationId, guard, denial);
    }

    public boolean isAllowed() {
        return denial == null;
    }

    public Optional<GuardVerdict.Deny> denialVerdict() {
        return Optional.ofNullable(denial);
    }
}
