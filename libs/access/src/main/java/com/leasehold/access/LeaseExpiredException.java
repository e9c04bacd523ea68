package com.leasehold.access;

import com.leasehold.policy.ErrorCategory;
import com.leasehold.policy.LeaseholdException;

import java.time.Instant;

/**
 * Thrown when the stored renter acts after its lease has run out.
 */
public class LeaseExpiredException extends LeaseholdException {

    private final long entityId;
    private final Instant expiredAt;

    public LeaseExpiredException(long entityId, Instant expiredAt) {
        super(ErrorCategory.LEASE_EXPIRED, "lease on entity " + entityId + " expired at " + expiredAt);
        this.entityId = entityId;
        this.expiredAt = expiredAt;
    }

    public long entityId() {
        return entityId;
    }

    public Instant expiredAt() {
        return expiredAt;
    }
}
