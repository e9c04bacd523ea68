package com.leasehold.policy.decoder;

/**
 * Behavioural families of instructions. Policies reason about kinds, never about raw
 * selectors, so adding a new signature to {@link Instruction} only requires mapping it here.
 */
public enum InstructionKind {
    SWAP_EXACT_NATIVE_IN(true),
    SWAP_NATIVE_IN_EXACT_OUT(true),
    SWAP_EXACT_TOKENS_IN(true),
    SWAP_TOKENS_IN_EXACT_OUT(true),
    SWAP_V3_EXACT_INPUT_SINGLE(true),
    SWAP_V3_EXACT_OUTPUT_SINGLE(true),
    /** Multi-hop V3 swap over a packed {@code bytes} path. */
    SWAP_V3_EXACT_INPUT(true),
    SWAP_V3_EXACT_OUTPUT(true),
    APPROVE(false),
    INCREASE_ALLOWANCE(false),
    DECREASE_ALLOWANCE(false),
    PERMIT(false),
    TRANSFER(false),
    TRANSFER_FROM(false),
    /** Empty payload (or shorter than a selector): a plain value transfer. */
    NONE(false),
    /** Unrecognized selector, or arguments that did not decode. */
    UNKNOWN(false);

    private final boolean swap;

    InstructionKind(boolean swap) {
        this.swap = swap;
    }

    public boolean isSwap() {
        return swap;
    }

    /** Kinds whose protocol address is the spender argument rather than the destination. */
    public boolean isApprovalStyle() {
        return this == APPROVE || this == INCREASE_ALLOWANCE
                || this == DECREASE_ALLOWANCE || this == PERMIT;
    }

    public boolean isTokenTransfer() {
        return this == TRANSFER || this == TRANSFER_FROM;
    }
}
