package com.leasehold.access.delegation;

import com.leasehold.policy.Addresses;

import java.time.Instant;
import java.util.Objects;

/**
 * Renter-signed authorization appointing an operator.
 *
 * <p>Times are carried at second precision, which is what gets signed.
 *
 * @param entityId entity the operator will act on
 * @param renter   signer, who must be the active renter
 * @param operator appointed operator
 * @param expiry   end of the delegation
 * @param nonce    must equal the entity's current operator nonce
 * @param deadline last instant the permit may be submitted
 */
public record OperatorPermit(long entityId, String renter, String operator, Instant expiry, long nonce,
                             Instant deadline) {

    public OperatorPermit {
        renter = Addresses.requireNonZero(renter, "renter");
        operator = Addresses.requireNonZero(operator, "operator");
        Objects.requireNonNull(expiry, "expiry");
        Objects.requireNonNull(deadline, "deadline");
        if (nonce < 0) {
            throw new IllegalArgumentException("nonce must not be negative");
        }
        expiry = Instant.ofEpochSecond(expiry.getEpochSecond());
        deadline = Instant.ofEpochSecond(deadline.getEpochSecond());
    }
}
