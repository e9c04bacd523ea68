package com.leasehold.service.api;

import com.leasehold.policy.PolicyDecision;

/** Outcome of a dry run. {@code policyType} and {@code reason} are null when allowed. */
public record DecisionResponse(boolean allowed, String policyType, String reason) {

    static DecisionResponse from(PolicyDecision decision) {
        return new DecisionResponse(decision.allowed(), decision.policyType(), decision.reason());
    }
}
