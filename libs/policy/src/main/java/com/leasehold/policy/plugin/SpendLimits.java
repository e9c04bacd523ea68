package com.leasehold.policy.plugin;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Spend ceilings for one entity.
 *
 * @param maxPerCall largest spend a single action may carry
 * @param maxPerDay  cumulative spend allowed in a rolling 24-hour window
 * @param maxApprove largest allowance a single approval may grant
 */
public record SpendLimits(BigInteger maxPerCall, BigInteger maxPerDay, BigInteger maxApprove) {

    public SpendLimits {
        Objects.requireNonNull(maxPerCall, "maxPerCall");
        Objects.requireNonNull(maxPerDay, "maxPerDay");
        Objects.requireNonNull(maxApprove, "maxApprove");
        if (maxPerCall.signum() < 0 || maxPerDay.signum() < 0 || maxApprove.signum() < 0) {
            throw new IllegalArgumentException("spend limits must not be negative");
        }
    }

    public static SpendLimits of(long maxPerCall, long maxPerDay, long maxApprove) {
        return new SpendLimits(BigInteger.valueOf(maxPerCall), BigInteger.valueOf(maxPerDay),
                BigInteger.valueOf(maxApprove));
    }

    /** Whether every limit is at or below the corresponding {@code ceiling} limit. */
    public boolean within(SpendLimits ceiling) {
        return maxPerCall.compareTo(ceiling.maxPerCall) <= 0
                && maxPerDay.compareTo(ceiling.maxPerDay) <= 0
                && maxApprove.compareTo(ceiling.maxApprove) <= 0;
    }
}
