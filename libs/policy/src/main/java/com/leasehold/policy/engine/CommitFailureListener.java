package com.leasehold.policy.engine;

/**
 * Notified when a plugin fails while committing an already-executed action.
 */
@FunctionalInterface
public interface CommitFailureListener {

    CommitFailureListener NOOP = (entityId, policyType, diagnostic) -> { };

    void onCommitFailure(long entityId, String policyType, String diagnostic);
}
