package com.leasehold.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionTest {

    private static final String DEST = "0xAbCdEf0000000000000000000000000000000001";

    @Test
    @DisplayName("Destination is normalized to lower case")
    void normalizesDestination() {
        Action action = new Action(DEST, BigInteger.ONE, new byte[0]);

        assertThat(action.destination()).isEqualTo("0xabcdef0000000000000000000000000000000001");
        assertThat(action.hasPayload()).isFalse();
    }

    @Test
    @DisplayName("Missing fields are programming errors")
    void nullFields() {
        assertThatThrownBy(() -> new Action(null, BigInteger.ONE, new byte[0]))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Action(DEST, null, new byte[0]))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Action(DEST, BigInteger.ONE, null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Negative values are rejected")
    void negativeValue() {
        assertThatThrownBy(() -> new Action(DEST, BigInteger.valueOf(-1), new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Payload is copied on the way in and out")
    void payloadCopied() {
        byte[] payload = {1, 2, 3, 4};
        Action action = new Action(DEST, BigInteger.ZERO, payload);

        payload[0] = 9;
        action.payload()[1] = 9;

        assertThat(action.payload()).containsExactly(1, 2, 3, 4);
        assertThat(action).isEqualTo(Action.of(DEST, BigInteger.ZERO, "0x01020304"));
    }

    @Test
    @DisplayName("Malformed addresses are rejected")
    void malformedAddress() {
        assertThatThrownBy(() -> Addresses.normalize("0x1234"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Addresses.requireNonZero(Addresses.ZERO, "operator"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("operator");
        assertThat(Addresses.same(DEST, DEST.toLowerCase())).isTrue();
    }
}
