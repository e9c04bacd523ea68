package com.leasehold.policy.plugin;

import com.leasehold.policy.EntityDirectory;
import com.leasehold.policy.PolicyDecision;
import com.leasehold.policy.decoder.DecodedCall;

import java.util.Optional;

/**
 * Keeps proceeds in custody: swap and transfer recipients, and plain value transfers, must all
 * point at the entity's own vault. Unrecognized instructions are only allowed against the vault
 * itself, since their recipient cannot be checked. Has no configuration.
 */
public class ReceiverGuardPolicy implements PolicyPlugin {

    public static final String POLICY_TYPE = "receiver-guard";

    public static final String VAULT_UNKNOWN = "vault unknown";
    public static final String RECIPIENT_NOT_VAULT = "recipient must be the vault";
    public static final String RAW_TRANSFER_NOT_TO_VAULT = "value transfer must target the vault";
    public static final String UNRECOGNIZED_CALL = "unrecognized call must target the vault";

    private final EntityDirectory directory;

    public ReceiverGuardPolicy(EntityDirectory directory) {
        this.directory = directory;
    }

    @Override
    public String policyType() {
        return POLICY_TYPE;
    }

    @Override
    public boolean renterConfigurable() {
        return false;
    }

    @Override
    public PolicyDecision check(PolicyRequest request) {
        Optional<String> vault = directory.vaultOf(request.entityId());
        if (vault.isEmpty()) {
            return PolicyDecision.reject(POLICY_TYPE, VAULT_UNKNOWN);
        }
        DecodedCall call = request.call();
        String custody = vault.get();
        return switch (call.kind()) {
            case NONE -> custody.equals(call.destination())
                    ? PolicyDecision.allow()
                    : PolicyDecision.reject(POLICY_TYPE, RAW_TRANSFER_NOT_TO_VAULT);
            case SWAP_EXACT_NATIVE_IN, SWAP_NATIVE_IN_EXACT_OUT, SWAP_EXACT_TOKENS_IN,
                    SWAP_TOKENS_IN_EXACT_OUT, SWAP_V3_EXACT_INPUT_SINGLE, SWAP_V3_EXACT_OUTPUT_SINGLE,
                    SWAP_V3_EXACT_INPUT, SWAP_V3_EXACT_OUTPUT, TRANSFER, TRANSFER_FROM -> custody.equals(call.recipient())
                    ? PolicyDecision.allow()
                    : PolicyDecision.reject(POLICY_TYPE, RECIPIENT_NOT_VAULT);
            case UNKNOWN -> custody.equals(call.destination())
                    ? PolicyDecision.allow()
                    : PolicyDecision.reject(POLICY_TYPE, UNRECOGNIZED_CALL);
            case APPROVE, INCREASE_ALLOWANCE, DECREASE_ALLOWANCE, PERMIT -> PolicyDecision.allow();
        };
    }
}
