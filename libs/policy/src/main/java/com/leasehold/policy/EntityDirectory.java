package com.leasehold.policy;

import java.util.Optional;

/**
 * Read-only view of entity ownership, lease and template relationships.
 *
 * <p>The policy engine and plugins use it to gate configuration changes and to find the vault
 * that proceeds must return to. The bookkeeping itself lives outside this module.
 */
public interface EntityDirectory {

    boolean exists(long entityId);

    /** Current owner of record. */
    Optional<String> ownerOf(long entityId);

    /** Renter whose lease has not yet expired; empty once the expiry has passed. */
    Optional<String> activeRenterOf(long entityId);

    /** Address of the entity's vault. */
    Optional<String> vaultOf(long entityId);

    /** Template an instance was minted from; empty for plain entities and templates. */
    Optional<Long> templateOf(long entityId);

    /** Whether the entity has been registered as a template (its configuration is frozen). */
    boolean isRegisteredTemplate(long entityId);
}
