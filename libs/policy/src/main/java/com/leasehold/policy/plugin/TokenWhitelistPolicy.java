package com.leasehold.policy.plugin;

import com.leasehold.policy.EntityDirectory;
import com.leasehold.policy.PolicyDecision;
import com.leasehold.policy.decoder.DecodedCall;
import com.leasehold.policy.decoder.InstructionKind;
import com.leasehold.policy.store.PolicyStateStore;

import java.util.Optional;

/**
 * Restricts the tokens an entity may trade or touch to an owner-managed whitelist.
 *
 * <p>A plain value transfer has no counter-party token and passes only when it targets the
 * entity's own vault.
 */
public class TokenWhitelistPolicy extends AbstractWhitelistPolicy {

    public static final String POLICY_TYPE = "token-whitelist";

    public static final String NOT_CONFIGURED = "token whitelist not configured";
    public static final String TOKEN_NOT_WHITELISTED = "token not whitelisted";
    public static final String UNRECOGNIZED_INSTRUCTION = "unrecognized instruction";
    public static final String EMPTY_PATH = "empty token path";
    public static final String RAW_TRANSFER_NOT_TO_VAULT = "value transfer must target the vault";

    public TokenWhitelistPolicy(PolicyStateStore store, EntityDirectory directory) {
        super(store, directory);
    }

    @Override
    public String policyType() {
        return POLICY_TYPE;
    }

    @Override
    public PolicyDecision check(PolicyRequest request) {
        DecodedCall call = request.call();
        Optional<AddressWhitelist> whitelist = whitelist(request.entityId());
        if (whitelist.isEmpty()) {
            return PolicyDecision.reject(POLICY_TYPE, NOT_CONFIGURED);
        }
        if (call.kind() == InstructionKind.NONE) {
            return isVault(request.entityId(), call.destination())
                    ? PolicyDecision.allow()
                    : PolicyDecision.reject(POLICY_TYPE, RAW_TRANSFER_NOT_TO_VAULT);
        }
        if (call.kind() == InstructionKind.UNKNOWN) {
            return PolicyDecision.reject(POLICY_TYPE, UNRECOGNIZED_INSTRUCTION);
        }
        if (call.tokens().isEmpty()) {
            return PolicyDecision.reject(POLICY_TYPE, EMPTY_PATH);
        }
        for (String token : call.tokens()) {
            if (!whitelist.get().contains(token)) {
                return PolicyDecision.reject(POLICY_TYPE, TOKEN_NOT_WHITELISTED);
            }
        }
        return PolicyDecision.allow();
    }
}
