package com.leasehold.policy.plugin;

/**
 * Optional hooks a plugin declares up front. The engine reads the declaration once, at approval,
 * and never probes a plugin at runtime.
 */
public enum PolicyCapability {
    /** Receives {@link PolicyPlugin#commit} after every successful execution. */
    COMMIT,
    /** Receives {@link PolicyPlugin#initInstance} when an instance is bound to a template. */
    INSTANCE_INIT
}
