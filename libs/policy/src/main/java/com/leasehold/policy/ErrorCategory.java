package com.leasehold.policy;

/**
 * Coarse classification of every failure Leasehold reports. Each category maps to one
 * user-facing status in the HTTP layer.
 */
public enum ErrorCategory {
    /** The referenced entity does not exist. */
    NOT_FOUND,
    /** The caller holds no valid role for the entity. */
    AUTHORIZATION,
    /** The caller used to be the renter but the lease has run out. */
    LEASE_EXPIRED,
    /** A policy plugin rejected the action. */
    POLICY_VIOLATION,
    /** The entity is paused or terminated. */
    ENTITY_STATE,
    /** An operator delegation is expired, replayed, mis-signed or submitted by the wrong party. */
    DELEGATION,
    /** A configuration change breaks a registry, binding or ceiling rule. */
    CONFIGURATION,
    /** The forwarded call failed; nothing was applied. */
    EXECUTION
}
