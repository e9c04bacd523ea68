package com.leasehold.policy.plugin;

import com.leasehold.policy.AuthorizationException;
import com.leasehold.policy.PolicyConfigurationException;
import com.leasehold.policy.store.InMemoryPolicyStateStore;
import com.leasehold.policy.testing.InMemoryEntityDirectory;
import com.leasehold.policy.testing.MutableClock;
import com.leasehold.policy.testing.TestPayloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

import static com.leasehold.policy.plugin.PluginFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenWhitelistPolicyTest {

    private MutableClock clock;
    private InMemoryEntityDirectory directory;
    private TokenWhitelistPolicy policy;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        directory = new InMemoryEntityDirectory(clock)
                .entity(PLAIN, OWNER, VAULT)
                .entity(TEMPLATE, OWNER, VAULT)
                .instance(INSTANCE, TEMPLATE, RENTER, INSTANCE_VAULT, clock.instant().plus(Duration.ofDays(7)));
        policy = new TokenWhitelistPolicy(new InMemoryPolicyStateStore(), directory);
    }

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        @DisplayName("Rejects when nothing is configured")
        void failClosed() {
            var decision = policy.check(request(PLAIN, OWNER, USDT, 0, TestPayloads.transfer(VAULT, BigInteger.ONE)));

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.reason()).isEqualTo(TokenWhitelistPolicy.NOT_CONFIGURED);
        }

        @Test
        @DisplayName("Every hop of a swap path must be whitelisted")
        void swapPath() {
            policy.add(PLAIN, OWNER, USDT);
            policy.add(PLAIN, OWNER, WBNB);

            var allowed = policy.check(request(PLAIN, OWNER, DEX, 0,
                    TestPayloads.swapExactTokensForTokens(BigInteger.TEN, BigInteger.ONE, List.of(USDT, WBNB), VAULT)));
            var rejected = policy.check(request(PLAIN, OWNER, DEX, 0,
                    TestPayloads.swapExactTokensForTokens(BigInteger.TEN, BigInteger.ONE, List.of(USDT, SCAM), VAULT)));

            assertThat(allowed.allowed()).isTrue();
            assertThat(rejected.allowed()).isFalse();
            assertThat(rejected.reason()).isEqualTo(TokenWhitelistPolicy.TOKEN_NOT_WHITELISTED);
        }

        @Test
        @DisplayName("Token operations check the called token")
        void calledToken() {
            policy.add(PLAIN, OWNER, USDT);

            assertThat(policy.check(request(PLAIN, OWNER, USDT, 0,
                    TestPayloads.approve(DEX, BigInteger.ONE))).allowed()).isTrue();
            assertThat(policy.check(request(PLAIN, OWNER, SCAM, 0,
                    TestPayloads.approve(DEX, BigInteger.ONE))).allowed()).isFalse();
        }

        @Test
        @DisplayName("Unknown instructions are rejected, empty payloads to the vault pass")
        void unknownAndEmpty() {
            policy.add(PLAIN, OWNER, USDT);

            var unknown = policy.check(request(PLAIN, OWNER, USDT, 0, TestPayloads.unknown()));
            var empty = policy.check(request(PLAIN, OWNER, VAULT, 5, new byte[0]));

            assertThat(unknown.reason()).isEqualTo(TokenWhitelistPolicy.UNRECOGNIZED_INSTRUCTION);
            assertThat(empty.allowed()).isTrue();
        }

        @Test
        @DisplayName("A plain value transfer is rejected when nothing is configured")
        void emptyPayloadUnconfigured() {
            var toStranger = policy.check(request(PLAIN, RENTER, STRANGER, 1000, new byte[0]));
            var toVault = policy.check(request(PLAIN, RENTER, VAULT, 1000, new byte[0]));

            assertThat(toStranger.reason()).isEqualTo(TokenWhitelistPolicy.NOT_CONFIGURED);
            assertThat(toVault.reason()).isEqualTo(TokenWhitelistPolicy.NOT_CONFIGURED);
        }

        @Test
        @DisplayName("A plain value transfer must target the vault, even to a whitelisted token")
        void emptyPayloadOutsideVault() {
            policy.add(PLAIN, OWNER, USDT);

            var toToken = policy.check(request(PLAIN, RENTER, USDT, 1000, new byte[0]));
            var toStranger = policy.check(request(PLAIN, RENTER, STRANGER, 1000, new byte[0]));

            assertThat(toToken.reason()).isEqualTo(TokenWhitelistPolicy.RAW_TRANSFER_NOT_TO_VAULT);
            assertThat(toStranger.reason()).isEqualTo(TokenWhitelistPolicy.RAW_TRANSFER_NOT_TO_VAULT);
        }

        @Test
        @DisplayName("Multi-hop V3 paths are checked hop by hop")
        void multiHopPath() {
            policy.add(PLAIN, OWNER, USDT);
            policy.add(PLAIN, OWNER, WBNB);

            var allowed = policy.check(request(PLAIN, OWNER, DEX, 0,
                    TestPayloads.exactInput(List.of(USDT, WBNB), VAULT, BigInteger.TEN, BigInteger.ONE)));
            var rejected = policy.check(request(PLAIN, OWNER, DEX, 0,
                    TestPayloads.exactInput(List.of(USDT, WBNB, SCAM), VAULT, BigInteger.TEN, BigInteger.ONE)));

            assertThat(allowed.allowed()).isTrue();
            assertThat(rejected.reason()).isEqualTo(TokenWhitelistPolicy.TOKEN_NOT_WHITELISTED);
        }
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        @DisplayName("Only the owner configures a plain entity")
        void ownerOnly() {
            assertThatThrownBy(() -> policy.add(PLAIN, STRANGER, USDT))
                    .isInstanceOf(AuthorizationException.class);
        }

        @Test
        @DisplayName("A registered template is frozen")
        void frozenTemplate() {
            policy.add(TEMPLATE, OWNER, USDT);
            directory.registerTemplate(TEMPLATE);

            assertThatThrownBy(() -> policy.add(TEMPLATE, OWNER, WBNB))
                    .isInstanceOf(PolicyConfigurationException.class)
                    .hasMessageContaining("frozen");
        }

        @Test
        @DisplayName("Instances inherit the template list and may only re-add entries inside it")
        void instanceCeiling() {
            policy.add(TEMPLATE, OWNER, USDT);
            policy.add(TEMPLATE, OWNER, WBNB);
            directory.registerTemplate(TEMPLATE);
            policy.initInstance(INSTANCE, TEMPLATE);

            policy.remove(INSTANCE, RENTER, WBNB);
            policy.add(INSTANCE, RENTER, WBNB);

            assertThat(policy.whitelist(INSTANCE).orElseThrow().entries()).containsExactlyInAnyOrder(USDT, WBNB);
            assertThatThrownBy(() -> policy.add(INSTANCE, RENTER, SCAM))
                    .isInstanceOf(PolicyConfigurationException.class)
                    .hasMessageContaining("outside the template whitelist");
        }
    }
}
