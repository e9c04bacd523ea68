package com.leasehold.policy.decoder;

import com.leasehold.policy.Action;
import com.leasehold.policy.Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Type;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Decodes action payloads into {@link DecodedCall}s.
 *
 * <p>Pure and stateless. Unknown selectors and arguments that fail to decode both come back as
 * {@link InstructionKind#UNKNOWN}; the decoder itself never throws for malformed payloads.
 */
public final class ActionDecoder {

    private static final Logger log = LoggerFactory.getLogger(ActionDecoder.class);

    /** Largest unsigned 256-bit value, the conventional "unlimited" approval. */
    public static final BigInteger MAX_UINT256 = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    static final int SELECTOR_LENGTH = 4;

    static final int WORD_LENGTH = 32;

    // a packed V3 path is token (20 bytes), then fee (3 bytes) and token per hop
    static final int PATH_TOKEN_LENGTH = 20;
    static final int PATH_HOP_LENGTH = 23;

    private ActionDecoder() {
        // utility class
    }

    public static DecodedCall decode(Action action) {
        Objects.requireNonNull(action, "action");
        return decode(action.destination(), action.payload(), action.value());
    }

    public static DecodedCall decode(String destination, byte[] payload, BigInteger value) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(value, "value");
        String target = Addresses.normalize(destination);

        if (payload.length < SELECTOR_LENGTH) {
            return DecodedCall.none(target, value);
        }
        HexFormat hex = HexFormat.of();
        String selector = "0x" + hex.formatHex(payload, 0, SELECTOR_LENGTH);
        Instruction instruction = Instruction.fromSelector(selector).orElse(null);
        if (instruction == null) {
            return DecodedCall.unknown(target, value, selector);
        }

        String arguments = hex.formatHex(payload, SELECTOR_LENGTH, payload.length);
        List<Type> decoded;
        try {
            String encoded = instruction.tupleArgument() ? tupleBody(arguments) : arguments;
            decoded = FunctionReturnDecoder.decode(encoded, Utils.convert(instruction.parameters()));
        } catch (RuntimeException e) {
            log.debug("Arguments for {} did not decode: {}", instruction.signature(), e.toString());
            return DecodedCall.unknown(target, value, selector);
        }
        if (decoded.size() != instruction.parameters().size()) {
            log.debug("Arguments for {} truncated: {} of {} decoded",
                    instruction.signature(), decoded.size(), instruction.parameters().size());
            return DecodedCall.unknown(target, value, selector);
        }
        try {
            return toCall(target, value, selector, instruction, decoded);
        } catch (IllegalArgumentException e) {
            log.debug("Arguments for {} rejected: {}", instruction.signature(), e.getMessage());
            return DecodedCall.unknown(target, value, selector);
        }
    }

    /** Follows the leading offset word to the encoded fields of a single dynamic tuple argument. */
    private static String tupleBody(String arguments) {
        if (arguments.length() < WORD_LENGTH * 2) {
            throw new IllegalArgumentException("missing tuple offset");
        }
        BigInteger offset = new BigInteger(arguments.substring(0, WORD_LENGTH * 2), 16);
        BigInteger available = BigInteger.valueOf(arguments.length() / 2);
        if (offset.compareTo(available) >= 0 || offset.mod(BigInteger.valueOf(WORD_LENGTH)).signum() != 0) {
            throw new IllegalArgumentException("tuple offset out of range: " + offset);
        }
        return arguments.substring(offset.intValueExact() * 2);
    }

    private static DecodedCall toCall(String target, BigInteger value, String selector,
                                      Instruction instruction, List<Type> args) {
        InstructionKind kind = instruction.kind();
        return switch (kind) {
            case SWAP_EXACT_NATIVE_IN, SWAP_NATIVE_IN_EXACT_OUT -> new DecodedCall(
                    target, value, selector, instruction, kind,
                    path(args.get(1)), address(args.get(2)), null, null, uint(args.get(3)));
            case SWAP_EXACT_TOKENS_IN, SWAP_TOKENS_IN_EXACT_OUT -> new DecodedCall(
                    target, value, selector, instruction, kind,
                    path(args.get(2)), address(args.get(3)), null,
                    kind == InstructionKind.SWAP_EXACT_TOKENS_IN ? uint(args.get(0)) : uint(args.get(1)),
                    uint(args.get(4)));
            case SWAP_V3_EXACT_INPUT_SINGLE -> new DecodedCall(
                    target, value, selector, instruction, kind,
                    List.of(address(args.get(0)), address(args.get(1))), address(args.get(3)), null,
                    uint(args.get(4)), null);
            case SWAP_V3_EXACT_OUTPUT_SINGLE -> new DecodedCall(
                    target, value, selector, instruction, kind,
                    List.of(address(args.get(0)), address(args.get(1))), address(args.get(3)), null,
                    uint(args.get(5)), null);
            case SWAP_V3_EXACT_INPUT, SWAP_V3_EXACT_OUTPUT -> multiHop(target, value, selector, instruction, args);
            case APPROVE, INCREASE_ALLOWANCE, DECREASE_ALLOWANCE -> new DecodedCall(
                    target, value, selector, instruction, kind,
                    List.of(target), null, address(args.get(0)), uint(args.get(1)), null);
            case PERMIT -> new DecodedCall(
                    target, value, selector, instruction, kind,
                    List.of(target), null, address(args.get(1)), uint(args.get(2)), null);
            case TRANSFER -> new DecodedCall(
                    target, value, selector, instruction, kind,
                    List.of(target), address(args.get(0)), null, uint(args.get(1)), null);
            case TRANSFER_FROM -> new DecodedCall(
                    target, value, selector, instruction, kind,
                    List.of(target), address(args.get(1)), null, uint(args.get(2)), null);
            case NONE, UNKNOWN -> throw new IllegalStateException("catalogue entry maps to " + kind);
        };
    }

    /**
     * Multi-hop V3 swaps. With a deadline the fields are (path, recipient, deadline, amount, limit),
     * without one (path, recipient, amount, limit). The spend is the input amount for exact-input
     * swaps and the maximum input for exact-output swaps.
     */
    private static DecodedCall multiHop(String target, BigInteger value, String selector,
                                        Instruction instruction, List<Type> args) {
        boolean withDeadline = args.size() == 5;
        int amountIndex = withDeadline ? 3 : 2;
        BigInteger spend = instruction.kind() == InstructionKind.SWAP_V3_EXACT_INPUT
                ? uint(args.get(amountIndex))
                : uint(args.get(amountIndex + 1));
        return new DecodedCall(target, value, selector, instruction, instruction.kind(),
                packedPath(args.get(0)), address(args.get(1)), null, spend,
                withDeadline ? uint(args.get(2)) : null);
    }

    static List<String> packedPath(Type<?> type) {
        byte[] path = ((DynamicBytes) type).getValue();
        if (path.length < PATH_TOKEN_LENGTH + PATH_HOP_LENGTH
                || (path.length - PATH_TOKEN_LENGTH) % PATH_HOP_LENGTH != 0) {
            throw new IllegalArgumentException("malformed swap path of " + path.length + " bytes");
        }
        HexFormat hex = HexFormat.of();
        List<String> tokens = new ArrayList<>();
        for (int start = 0; start < path.length; start += PATH_HOP_LENGTH) {
            tokens.add(Addresses.normalize("0x" + hex.formatHex(path, start, start + PATH_TOKEN_LENGTH)));
        }
        return tokens;
    }

    private static String address(Type<?> type) {
        return Addresses.normalize(((Address) type).getValue());
    }

    private static BigInteger uint(Type<?> type) {
        return (BigInteger) type.getValue();
    }

    @SuppressWarnings("unchecked")
    private static List<String> path(Type<?> type) {
        List<Address> hops = ((DynamicArray<Address>) type).getValue();
        return hops.stream().map(hop -> Addresses.normalize(hop.getValue())).toList();
    }
}
