package com.leasehold.policy;

/**
 * Thrown when the policy engine rejects an action. The message is the rejecting plugin's
 * reason, unchanged.
 */
public class PolicyViolationException extends LeaseholdException {

    private final String policyType;
    private final String reason;

    public PolicyViolationException(String policyType, String reason) {
        super(ErrorCategory.POLICY_VIOLATION, reason);
        this.policyType = policyType;
        this.reason = reason;
    }

    public static PolicyViolationException of(PolicyDecision decision) {
        return new PolicyViolationException(decision.policyType(), decision.reason());
    }

    public String policyType() {
        return policyType;
    }

    public String reason() {
        return reason;
    }
}
