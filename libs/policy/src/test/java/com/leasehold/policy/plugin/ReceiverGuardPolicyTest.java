package com.leasehold.policy.plugin;

import com.leasehold.policy.testing.InMemoryEntityDirectory;
import com.leasehold.policy.testing.MutableClock;
import com.leasehold.policy.testing.TestPayloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static com.leasehold.policy.plugin.PluginFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class ReceiverGuardPolicyTest {

    private ReceiverGuardPolicy policy;

    @BeforeEach
    void setUp() {
        InMemoryEntityDirectory directory = new InMemoryEntityDirectory(
                MutableClock.startingAt("2026-01-01T00:00:00Z")).entity(PLAIN, OWNER, VAULT);
        policy = new ReceiverGuardPolicy(directory);
    }

    @Test
    @DisplayName("Swaps paying out anywhere but the vault are rejected")
    void swapRecipient() {
        byte[] toVault = TestPayloads.swapExactEthForTokens(BigInteger.ONE, List.of(WBNB, USDT), VAULT);
        byte[] toStranger = TestPayloads.swapExactEthForTokens(BigInteger.ONE, List.of(WBNB, USDT), STRANGER);

        assertThat(policy.check(request(PLAIN, RENTER, DEX, 1, toVault)).allowed()).isTrue();
        assertThat(policy.check(request(PLAIN, RENTER, DEX, 1, toStranger)).reason())
                .isEqualTo(ReceiverGuardPolicy.RECIPIENT_NOT_VAULT);
    }

    @Test
    @DisplayName("V3 single-hop recipient is guarded too")
    void v3Recipient() {
        byte[] payload = TestPayloads.exactInputSingle(USDT, WBNB, STRANGER, BigInteger.TEN, BigInteger.ONE);

        assertThat(policy.check(request(PLAIN, RENTER, DEX, 0, payload)).allowed()).isFalse();
    }

    @Test
    @DisplayName("Token transfers must land in the vault")
    void tokenTransfer() {
        assertThat(policy.check(request(PLAIN, RENTER, USDT, 0,
                TestPayloads.transfer(STRANGER, BigInteger.ONE))).allowed()).isFalse();
        assertThat(policy.check(request(PLAIN, RENTER, USDT, 0,
                TestPayloads.transferFrom(STRANGER, VAULT, BigInteger.ONE))).allowed()).isTrue();
    }

    @Test
    @DisplayName("Plain value transfers must target the vault")
    void rawTransfer() {
        assertThat(policy.check(request(PLAIN, RENTER, STRANGER, 5, new byte[0])).reason())
                .isEqualTo(ReceiverGuardPolicy.RAW_TRANSFER_NOT_TO_VAULT);
        assertThat(policy.check(request(PLAIN, RENTER, VAULT, 5, new byte[0])).allowed()).isTrue();
    }

    @Test
    @DisplayName("Unknown calls are rejected unless they target the vault, with or without value")
    void unknownCalls() {
        assertThat(policy.check(request(PLAIN, RENTER, DEX, 1, TestPayloads.unknown())).reason())
                .isEqualTo(ReceiverGuardPolicy.UNRECOGNIZED_CALL);
        assertThat(policy.check(request(PLAIN, RENTER, DEX, 0, TestPayloads.unknown())).reason())
                .isEqualTo(ReceiverGuardPolicy.UNRECOGNIZED_CALL);
        assertThat(policy.check(request(PLAIN, RENTER, VAULT, 0, TestPayloads.unknown())).allowed()).isTrue();
    }

    @Test
    @DisplayName("Multi-hop V3 swaps must pay out to the vault")
    void v3MultiHopRecipient() {
        byte[] toStranger = TestPayloads.exactInput(List.of(USDT, WBNB), STRANGER,
                BigInteger.TEN.pow(30), BigInteger.ZERO);
        byte[] toVault = TestPayloads.exactOutput(List.of(WBNB, USDT), VAULT, BigInteger.ONE, BigInteger.TEN);

        assertThat(policy.check(request(PLAIN, RENTER, DEX, 0, toStranger)).reason())
                .isEqualTo(ReceiverGuardPolicy.RECIPIENT_NOT_VAULT);
        assertThat(policy.check(request(PLAIN, RENTER, DEX, 0, toVault)).allowed()).isTrue();
    }
}
