package com.leasehold.policy.plugin;

import com.leasehold.policy.Addresses;
import com.leasehold.policy.ConfigurationGuard;
import com.leasehold.policy.EntityDirectory;
import com.leasehold.policy.PolicyConfigurationException;
import com.leasehold.policy.store.PolicyStateStore;
import com.leasehold.policy.store.StateNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Shared configuration handling for address whitelists.
 *
 * <p>An instance may only add entries its template already whitelists, and starts out with a
 * copy of the template's list. Removal is always allowed since it only narrows the set.
 */
public abstract class AbstractWhitelistPolicy implements PolicyPlugin {

    private static final Logger log = LoggerFactory.getLogger(AbstractWhitelistPolicy.class);

    protected final EntityDirectory directory;
    private final StateNamespace<AddressWhitelist> whitelists;

    protected AbstractWhitelistPolicy(PolicyStateStore store, EntityDirectory directory) {
        this.directory = directory;
        this.whitelists = store.claim(policyType() + ".whitelist", AddressWhitelist.class);
    }

    @Override
    public boolean renterConfigurable() {
        return false;
    }

    @Override
    public Set<PolicyCapability> capabilities() {
        return Set.of(PolicyCapability.INSTANCE_INIT);
    }

    public void add(long entityId, String caller, String address) {
        ConfigurationGuard.Scope scope = ConfigurationGuard.authorize(directory, entityId, caller);
        String entry = Addresses.requireNonZero(address, "whitelist entry");
        if (scope.isInstance()) {
            boolean inCeiling = whitelist(scope.templateId())
                    .map(ceiling -> ceiling.contains(entry))
                    .orElse(false);
            if (!inCeiling) {
                throw new PolicyConfigurationException(
                        entry + " is outside the template whitelist for " + policyType());
            }
        }
        whitelists.compute(entityId, current -> current.orElseGet(AddressWhitelist::empty).with(entry));
        log.info("Whitelisted {} for {} on entity {}", entry, policyType(), entityId);
    }

    public void remove(long entityId, String caller, String address) {
        ConfigurationGuard.authorize(directory, entityId, caller);
        String entry = Addresses.normalize(address);
        whitelists.compute(entityId, current -> current.orElseGet(AddressWhitelist::empty).without(entry));
        log.info("Removed {} from {} on entity {}", entry, policyType(), entityId);
    }

    public Optional<AddressWhitelist> whitelist(long entityId) {
        return whitelists.get(entityId);
    }

    public boolean isWhitelisted(long entityId, String address) {
        return whitelist(entityId).map(list -> list.contains(address)).orElse(false);
    }

    protected boolean isVault(long entityId, String address) {
        return directory.vaultOf(entityId).map(vault -> vault.equals(address)).orElse(false);
    }

    @Override
    public void initInstance(long instanceId, long templateId) {
        whitelists.put(instanceId, whitelist(templateId).orElseGet(AddressWhitelist::empty));
    }
}
