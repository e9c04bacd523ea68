package com.leasehold.policy.store;

/**
 * Namespaced storage shared by the policy engine and its plugins.
 *
 * <p>Each component claims its own namespaces at construction; a namespace can be claimed once,
 * so no component can read or overwrite another's state.
 */
public interface PolicyStateStore {

    /**
     * Claims {@code namespace} for values of {@code type}.
     *
     * @throws IllegalStateException if the namespace was already claimed
     */
    <T> StateNamespace<T> claim(String namespace, Class<T> type);

    boolean isClaimed(String namespace);
}
