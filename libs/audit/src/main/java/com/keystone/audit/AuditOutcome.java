package com.keystone.audit;

/** Result of an audited operation. */
public enum AuditOutcome {

    /** The operation completed. */
    SUCCESS,

    /** The operation was attempted and failed. */
    FAILURE,

    /** The operation was refused by access control before it ran. */
    DENIED
}
