package com.leasehold.access;

/**
 * Role a caller holds towards one entity at one instant.
 */
public enum CallerRole {
    /** Owner of a plain entity or template. Not subject to policy. */
    PLAIN_OWNER(false, true),
    /** Owner of an instance. Still constrained by the instance's policies. */
    INSTANCE_OWNER(true, true),
    /** Renter inside an unexpired lease. */
    RENTER(true, true),
    /** Operator inside both its delegation and the renter's lease. Never withdraws. */
    OPERATOR(true, false);

    private final boolean policyConstrained;
    private final boolean mayWithdraw;

    CallerRole(boolean policyConstrained, boolean mayWithdraw) {
        this.policyConstrained = policyConstrained;
        this.mayWithdraw = mayWithdraw;
    }

    public boolean policyConstrained() {
        return policyConstrained;
    }

    public boolean mayWithdraw() {
        return mayWithdraw;
    }
}
