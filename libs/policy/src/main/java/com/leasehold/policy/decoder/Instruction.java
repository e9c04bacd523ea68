package com.leasehold.policy.decoder;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint160;
import org.web3j.abi.datatypes.generated.Uint24;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Hash;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed catalogue of the ABI functions Leasehold understands.
 *
 * <p>Each entry carries its canonical signature, the {@link InstructionKind} it maps to, and the
 * parameter layout used to decode its arguments. The 4-byte selector is derived from the
 * signature once, at class initialization.
 *
 * <p>Entries whose only argument is a dynamic tuple (a struct holding a {@code bytes} path) are
 * flagged {@link #tupleArgument()}: their payload starts with the tuple's offset, and the layout
 * describes the tuple's own fields.
 */
public enum Instruction {

    SWAP_EXACT_ETH_FOR_TOKENS(
            "swapExactETHForTokens(uint256,address[],address,uint256)",
            InstructionKind.SWAP_EXACT_NATIVE_IN, Layouts.NATIVE_IN_SWAP),
    SWAP_EXACT_ETH_FOR_TOKENS_FEE(
            "swapExactETHForTokensSupportingFeeOnTransferTokens(uint256,address[],address,uint256)",
            InstructionKind.SWAP_EXACT_NATIVE_IN, Layouts.NATIVE_IN_SWAP),
    SWAP_ETH_FOR_EXACT_TOKENS(
            "swapETHForExactTokens(uint256,address[],address,uint256)",
            InstructionKind.SWAP_NATIVE_IN_EXACT_OUT, Layouts.NATIVE_IN_SWAP),
    SWAP_EXACT_TOKENS_FOR_TOKENS(
            "swapExactTokensForTokens(uint256,uint256,address[],address,uint256)",
            InstructionKind.SWAP_EXACT_TOKENS_IN, Layouts.TOKEN_IN_SWAP),
    SWAP_EXACT_TOKENS_FOR_TOKENS_FEE(
            "swapExactTokensForTokensSupportingFeeOnTransferTokens(uint256,uint256,address[],address,uint256)",
            InstructionKind.SWAP_EXACT_TOKENS_IN, Layouts.TOKEN_IN_SWAP),
    SWAP_EXACT_TOKENS_FOR_ETH(
            "swapExactTokensForETH(uint256,uint256,address[],address,uint256)",
            InstructionKind.SWAP_EXACT_TOKENS_IN, Layouts.TOKEN_IN_SWAP),
    SWAP_EXACT_TOKENS_FOR_ETH_FEE(
            "swapExactTokensForETHSupportingFeeOnTransferTokens(uint256,uint256,address[],address,uint256)",
            InstructionKind.SWAP_EXACT_TOKENS_IN, Layouts.TOKEN_IN_SWAP),
    SWAP_TOKENS_FOR_EXACT_TOKENS(
            "swapTokensForExactTokens(uint256,uint256,address[],address,uint256)",
            InstructionKind.SWAP_TOKENS_IN_EXACT_OUT, Layouts.TOKEN_IN_SWAP),
    SWAP_TOKENS_FOR_EXACT_ETH(
            "swapTokensForExactETH(uint256,uint256,address[],address,uint256)",
            InstructionKind.SWAP_TOKENS_IN_EXACT_OUT, Layouts.TOKEN_IN_SWAP),
    EXACT_INPUT_SINGLE(
            "exactInputSingle((address,address,uint24,address,uint256,uint256,uint160))",
            InstructionKind.SWAP_V3_EXACT_INPUT_SINGLE, Layouts.V3_SINGLE),
    EXACT_OUTPUT_SINGLE(
            "exactOutputSingle((address,address,uint24,address,uint256,uint256,uint160))",
            InstructionKind.SWAP_V3_EXACT_OUTPUT_SINGLE, Layouts.V3_SINGLE),
    EXACT_INPUT(
            "exactInput((bytes,address,uint256,uint256,uint256))",
            InstructionKind.SWAP_V3_EXACT_INPUT, Layouts.V3_MULTI_HOP_DEADLINE, true),
    EXACT_OUTPUT(
            "exactOutput((bytes,address,uint256,uint256,uint256))",
            InstructionKind.SWAP_V3_EXACT_OUTPUT, Layouts.V3_MULTI_HOP_DEADLINE, true),
    EXACT_INPUT_NO_DEADLINE(
            "exactInput((bytes,address,uint256,uint256))",
            InstructionKind.SWAP_V3_EXACT_INPUT, Layouts.V3_MULTI_HOP, true),
    EXACT_OUTPUT_NO_DEADLINE(
            "exactOutput((bytes,address,uint256,uint256))",
            InstructionKind.SWAP_V3_EXACT_OUTPUT, Layouts.V3_MULTI_HOP, true),
    APPROVE("approve(address,uint256)", InstructionKind.APPROVE, Layouts.ADDRESS_AMOUNT),
    INCREASE_ALLOWANCE("increaseAllowance(address,uint256)",
            InstructionKind.INCREASE_ALLOWANCE, Layouts.ADDRESS_AMOUNT),
    DECREASE_ALLOWANCE("decreaseAllowance(address,uint256)",
            InstructionKind.DECREASE_ALLOWANCE, Layouts.ADDRESS_AMOUNT),
    PERMIT("permit(address,address,uint256,uint256,uint8,bytes32,bytes32)",
            InstructionKind.PERMIT, Layouts.PERMIT),
    TRANSFER("transfer(address,uint256)", InstructionKind.TRANSFER, Layouts.ADDRESS_AMOUNT),
    TRANSFER_FROM("transferFrom(address,address,uint256)",
            InstructionKind.TRANSFER_FROM, Layouts.TRANSFER_FROM);

    private static final Map<String, Instruction> BY_SELECTOR = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Instruction::selector, Function.identity()));

    private final String signature;
    private final InstructionKind kind;
    private final List<TypeReference<?>> parameters;
    private final boolean tupleArgument;
    private final String selector;

    Instruction(String signature, InstructionKind kind, List<TypeReference<?>> parameters) {
        this(signature, kind, parameters, false);
    }

    Instruction(String signature, InstructionKind kind, List<TypeReference<?>> parameters,
                boolean tupleArgument) {
        this.signature = signature;
        this.kind = kind;
        this.parameters = parameters;
        this.tupleArgument = tupleArgument;
        this.selector = Hash.sha3String(signature).substring(0, 10);
    }

    public String signature() {
        return signature;
    }

    public InstructionKind kind() {
        return kind;
    }

    /** {@code 0x}-prefixed lower-case 4-byte selector. */
    public String selector() {
        return selector;
    }

    List<TypeReference<?>> parameters() {
        return parameters;
    }

    boolean tupleArgument() {
        return tupleArgument;
    }

    public static Optional<Instruction> fromSelector(String selector) {
        if (selector == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_SELECTOR.get(selector.toLowerCase()));
    }

    /** Parameter layouts shared by several signatures. */
    private static final class Layouts {

        static final List<TypeReference<?>> NATIVE_IN_SWAP = List.of(
                new TypeReference<Uint256>() { },
                new TypeReference<DynamicArray<Address>>() { },
                new TypeReference<Address>() { },
                new TypeReference<Uint256>() { });

        static final List<TypeReference<?>> TOKEN_IN_SWAP = List.of(
                new TypeReference<Uint256>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<DynamicArray<Address>>() { },
                new TypeReference<Address>() { },
                new TypeReference<Uint256>() { });

        // single static tuple argument, encoded in place as seven words
        static final List<TypeReference<?>> V3_SINGLE = List.of(
                new TypeReference<Address>() { },
                new TypeReference<Address>() { },
                new TypeReference<Uint24>() { },
                new TypeReference<Address>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint160>() { });

        // path, recipient, deadline, amount, limit
        static final List<TypeReference<?>> V3_MULTI_HOP_DEADLINE = List.of(
                new TypeReference<DynamicBytes>() { },
                new TypeReference<Address>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint256>() { });

        // path, recipient, amount, limit
        static final List<TypeReference<?>> V3_MULTI_HOP = List.of(
                new TypeReference<DynamicBytes>() { },
                new TypeReference<Address>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint256>() { });

        static final List<TypeReference<?>> ADDRESS_AMOUNT = List.of(
                new TypeReference<Address>() { },
                new TypeReference<Uint256>() { });

        static final List<TypeReference<?>> TRANSFER_FROM = List.of(
                new TypeReference<Address>() { },
                new TypeReference<Address>() { },
                new TypeReference<Uint256>() { });

        static final List<TypeReference<?>> PERMIT = List.of(
                new TypeReference<Address>() { },
                new TypeReference<Address>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint8>() { },
                new TypeReference<Bytes32>() { },
                new TypeReference<Bytes32>() { });

        private Layouts() {
        }
    }
}
