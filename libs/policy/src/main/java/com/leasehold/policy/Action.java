package com.leasehold.policy;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A call submitted for execution against an entity's vault.
 *
 * <p>Every field is explicit: the destination is a normalized address, the value is an unsigned
 * amount of the native asset, and the payload is the opaque instruction data (empty for a plain
 * value transfer). The payload is copied in and out so an action can be shared freely.
 *
 * @param destination address the vault will call
 * @param value       native value sent with the call, never negative
 * @param payload     instruction data, possibly empty
 */
public record Action(String destination, BigInteger value, byte[] payload) {

    public Action {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(payload, "payload");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("value must not be negative");
        }
        destination = Addresses.normalize(destination);
        payload = payload.clone();
    }

    /** Builds an action from a hex-encoded payload ({@code 0x} prefix optional). */
    public static Action of(String destination, BigInteger value, String payloadHex) {
        Objects.requireNonNull(payloadHex, "payload");
        String hex = payloadHex.startsWith("0x") || payloadHex.startsWith("0X")
                ? payloadHex.substring(2) : payloadHex;
        return new Action(destination, value, HexFormat.of().parseHex(hex));
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public boolean hasPayload() {
        return payload.length > 0;
    }

    public int payloadLength() {
        return payload.length;
    }

    public String payloadHex() {
        return "0x" + HexFormat.of().formatHex(payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Action other)) {
            return false;
        }
        return destination.equals(other.destination)
                && value.equals(other.value)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(destination, value, Arrays.hashCode(payload));
    }

    @Override
    public String toString() {
        return "Action[destination=" + destination + ", value=" + value
                + ", payloadBytes=" + payload.length + "]";
    }
}
