package com.leasehold.policy.plugin;

import com.leasehold.policy.PolicyDecision;

import java.util.Set;

/**
 * A single validation rule the engine evaluates against every constrained action.
 *
 * <p>Plugins keep their configuration and running state in namespaces of the shared
 * {@link com.leasehold.policy.store.PolicyStateStore}. A plugin with no configuration for an
 * entity must reject.
 */
public interface PolicyPlugin {

    /** Unique identifier used in policy lists and rejection reports. */
    String policyType();

    /** Whether a renter may remove this plugin from an instance. */
    boolean renterConfigurable();

    /** Optional hooks this plugin implements. */
    default Set<PolicyCapability> capabilities() {
        return Set.of();
    }

    /** Read-only check. Must not mutate any state. */
    PolicyDecision check(PolicyRequest request);

    /** Records the effects of an executed action. Invoked only with {@link PolicyCapability#COMMIT}. */
    default void commit(PolicyRequest request) {
        throw new UnsupportedOperationException(policyType() + " does not commit");
    }

    /**
     * Seeds an instance's configuration from its template. Invoked only with
     * {@link PolicyCapability#INSTANCE_INIT}.
     */
    default void initInstance(long instanceId, long templateId) {
        throw new UnsupportedOperationException(policyType() + " does not initialize instances");
    }
}
