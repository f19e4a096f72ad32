package com.keystone.security.access;

/** Whether an operation needs a resolved tenant. */
public enum TenantRequirement {

    /**
     * Required on protected operations; on public operations only when strict tenant mode is on.
     */
    DEFAULT,

    /** Always required. */
    REQUIRED,

    /** Never required. */
    OPTIONAL
}
