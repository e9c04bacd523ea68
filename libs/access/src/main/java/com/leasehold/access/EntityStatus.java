package com.leasehold.access;

/** Lifecycle state of a rentable entity. */
public enum EntityStatus {
    ACTIVE,
    /** Every action is blocked, including the owner's, until unpaused. */
    PAUSED,
    /** Irreversible. */
    TERMINATED;

    public boolean isOperational() {
        return this == ACTIVE;
    }
}
