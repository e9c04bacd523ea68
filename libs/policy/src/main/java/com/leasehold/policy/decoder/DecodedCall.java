package com.leasehold.policy.decoder;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured view of an action's payload, produced once per validation by {@link ActionDecoder}.
 *
 * @param destination   the called address
 * @param value         native value sent with the call
 * @param instructionId {@code 0x}-prefixed selector, or an empty string when the payload has none
 * @param instruction   matched catalogue entry, {@code null} for {@code NONE} and {@code UNKNOWN}
 * @param kind          behavioural family
 * @param tokens        counter-party tokens: the swap path, or the called token for token operations
 * @param recipient     where proceeds go, {@code null} when the instruction has no recipient
 * @param spender       approval spender, {@code null} for non-approval instructions
 * @param amount        decoded amount argument (input amount, maximum input, approval or
 *                      transfer amount), {@code null} when the instruction carries none
 * @param deadline      swap deadline, {@code null} when absent
 */
public record DecodedCall(
        String destination,
        BigInteger value,
        String instructionId,
        Instruction instruction,
        InstructionKind kind,
        List<String> tokens,
        String recipient,
        String spender,
        BigInteger amount,
        BigInteger deadline
) {

    public DecodedCall {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(instructionId, "instructionId");
        Objects.requireNonNull(kind, "kind");
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    static DecodedCall none(String destination, BigInteger value) {
        return new DecodedCall(destination, value, "", null, InstructionKind.NONE,
                List.of(), destination, null, null, null);
    }

    static DecodedCall unknown(String destination, BigInteger value, String instructionId) {
        return new DecodedCall(destination, value, instructionId, null, InstructionKind.UNKNOWN,
                List.of(), null, null, null, null);
    }

    /**
     * The address whose code is trusted with the vault's assets: the spender for approval-style
     * instructions, the destination otherwise.
     */
    public String protocolAddress() {
        if (kind.isApprovalStyle() && spender != null) {
            return spender;
        }
        return destination;
    }

    public Optional<String> recipientIfAny() {
        return Optional.ofNullable(recipient);
    }

    public Optional<BigInteger> amountIfAny() {
        return Optional.ofNullable(amount);
    }
}
