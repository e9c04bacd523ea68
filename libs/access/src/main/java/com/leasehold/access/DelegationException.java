package com.leasehold.access;

import com.leasehold.policy.ErrorCategory;
import com.leasehold.policy.LeaseholdException;

/**
 * Thrown when an operator delegation is refused or has lapsed.
 */
public class DelegationException extends LeaseholdException {

    /** Why the delegation failed, in the order permits are checked. */
    public enum Reason {
        SIGNATURE_EXPIRED,
        SUBMITTER_MISMATCH,
        RENTER_MISMATCH,
        REPLAYED,
        INVALID_SIGNATURE,
        EXCEEDS_LEASE,
        EXPIRED
    }

    private final Reason reason;

    public DelegationException(Reason reason, String message) {
        super(ErrorCategory.DELEGATION, message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
