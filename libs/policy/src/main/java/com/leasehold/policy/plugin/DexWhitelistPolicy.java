package com.leasehold.policy.plugin;

import com.leasehold.policy.EntityDirectory;
import com.leasehold.policy.PolicyDecision;
import com.leasehold.policy.decoder.InstructionKind;
import com.leasehold.policy.store.PolicyStateStore;

import java.util.Optional;

/**
 * Restricts the protocols an entity's vault may call or grant allowances to.
 *
 * <p>The checked address is the spender for approval-style instructions and the destination for
 * everything else. Calls back into the entity's own vault never leave custody and always pass;
 * a plain value transfer anywhere else is rejected even when the address is whitelisted.
 */
public class DexWhitelistPolicy extends AbstractWhitelistPolicy {

    public static final String POLICY_TYPE = "dex-whitelist";

    public static final String NOT_CONFIGURED = "protocol whitelist not configured";
    public static final String PROTOCOL_NOT_WHITELISTED = "protocol not whitelisted";
    public static final String RAW_TRANSFER_NOT_TO_VAULT = "value transfer must target the vault";

    public DexWhitelistPolicy(PolicyStateStore store, EntityDirectory directory) {
        super(store, directory);
    }

    @Override
    public String policyType() {
        return POLICY_TYPE;
    }

    @Override
    public PolicyDecision check(PolicyRequest request) {
        if (isVault(request.entityId(), request.destination())) {
            return PolicyDecision.allow();
        }
        Optional<AddressWhitelist> whitelist = whitelist(request.entityId());
        if (whitelist.isEmpty()) {
            return PolicyDecision.reject(POLICY_TYPE, NOT_CONFIGURED);
        }
        if (request.call().kind() == InstructionKind.NONE) {
            return PolicyDecision.reject(POLICY_TYPE, RAW_TRANSFER_NOT_TO_VAULT);
        }
        if (!whitelist.get().contains(request.call().protocolAddress())) {
            return PolicyDecision.reject(POLICY_TYPE, PROTOCOL_NOT_WHITELISTED);
        }
        return PolicyDecision.allow();
    }
}
