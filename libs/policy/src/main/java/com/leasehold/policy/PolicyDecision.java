package com.leasehold.policy;

/**
 * Outcome of a policy check.
 *
 * @param allowed    whether the action may proceed
 * @param policyType the policy that rejected the action, or {@code null} when allowed
 * @param reason     rejection reason, surfaced verbatim to the caller; {@code "allowed"} otherwise
 */
public record PolicyDecision(boolean allowed, String policyType, String reason) {

    private static final PolicyDecision ALLOW = new PolicyDecision(true, null, "allowed");

    public static PolicyDecision allow() {
        return ALLOW;
    }

    public static PolicyDecision reject(String policyType, String reason) {
        return new PolicyDecision(false, policyType, reason);
    }
}
