package com.leasehold.policy;

import java.util.Optional;

/**
 * Gatekeeper for configuration changes made through the engine and the plugins.
 *
 * <p>Templates and plain entities are configured by their owner while not frozen. Instances are
 * configured by their renter or owner, and only inside the template's ceiling, which callers
 * enforce using the returned {@link Scope}.
 */
public final class ConfigurationGuard {

    private ConfigurationGuard() {
        // utility class
    }

    /**
     * Where a configuration change applies.
     *
     * @param entityId   the entity being configured
     * @param templateId the template ceiling for instances, {@code null} otherwise
     */
    public record Scope(long entityId, Long templateId) {

        public boolean isInstance() {
            return templateId != null;
        }
    }

    /**
     * Authorizes {@code caller} to change configuration on {@code entityId}.
     *
     * @throws PolicyConfigurationException if the entity is unknown or frozen
     * @throws AuthorizationException       if the caller is neither owner nor (for instances) renter
     */
    public static Scope authorize(EntityDirectory directory, long entityId, String caller) {
        if (!directory.exists(entityId)) {
            throw new PolicyConfigurationException("unknown entity " + entityId);
        }
        String who = Addresses.normalize(caller);
        Optional<Long> template = directory.templateOf(entityId);
        if (template.isPresent()) {
            if (!isOwner(directory, entityId, who) && !isActiveRenter(directory, entityId, who)) {
                throw new AuthorizationException(who,
                        "only the renter or owner may configure instance " + entityId);
            }
            return new Scope(entityId, template.get());
        }
        if (directory.isRegisteredTemplate(entityId)) {
            throw new PolicyConfigurationException("template " + entityId + " is frozen");
        }
        if (!isOwner(directory, entityId, who)) {
            throw new AuthorizationException(who, "only the owner may configure entity " + entityId);
        }
        return new Scope(entityId, null);
    }

    /** Same rule as {@link #authorize} but restricted to bound instances. */
    public static Scope authorizeInstance(EntityDirectory directory, long instanceId, String caller) {
        Scope scope = authorize(directory, instanceId, caller);
        if (!scope.isInstance()) {
            throw new PolicyConfigurationException("entity " + instanceId + " is not an instance");
        }
        return scope;
    }

    public static boolean isOwner(EntityDirectory directory, long entityId, String caller) {
        return directory.ownerOf(entityId).map(caller::equals).orElse(false);
    }

    public static boolean isActiveRenter(EntityDirectory directory, long entityId, String caller) {
        return directory.activeRenterOf(entityId).map(caller::equals).orElse(false);
    }
}
