package com.leasehold.access;

import com.leasehold.access.testing.TestLeasehold;
import com.leasehold.eventmodel.EventType;
import com.leasehold.policy.Action;
import com.leasehold.policy.AuthorizationException;
import com.leasehold.policy.PolicyConfigurationException;
import com.leasehold.policy.PolicyViolationException;
import com.leasehold.policy.plugin.ReceiverGuardPolicy;
import com.leasehold.policy.plugin.TokenWhitelistPolicy;
import com.leasehold.policy.testing.TestPayloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateCatalogTest {

    private static final String CREATOR = "0x1000000000000000000000000000000000000001";
    private static final String RENTER = "0x2000000000000000000000000000000000000002";
    private static final String DEX = "0x10ed43c718714eb63d5aa57b78b54704e256024e";
    private static final String WBNB = "0xbb4cdb9cbd36b01bd1cbaebf2de08d9173bc095c";
    private static final String USDT = "0x55d398326f99059ff775485246999027b3197955";
    private static final String SCAM = "0xdead00000000000000000000000000000000beef";

    private TestLeasehold leasehold;
    private long templateId;
    private Instant leaseEnd;

    @BeforeEach
    void setUp() {
        leasehold = new TestLeasehold();
        templateId = leasehold.registry.mint(TestLeasehold.LEASE_ISSUER, CREATOR);
        leasehold.engine.addEntityPolicy(templateId, CREATOR, TokenWhitelistPolicy.POLICY_TYPE);
        leasehold.engine.addEntityPolicy(templateId, CREATOR, ReceiverGuardPolicy.POLICY_TYPE);
        leasehold.tokenWhitelist.add(templateId, CREATOR, WBNB);
        leasehold.tokenWhitelist.add(templateId, CREATOR, USDT);
        leaseEnd = leasehold.clock.instant().plus(Duration.ofDays(30));
    }

    private long mintInstance() {
        return leasehold.templates.mintInstance(TestLeasehold.LEASE_ISSUER, templateId, RENTER, leaseEnd,
                "strategy:grid".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Registering freezes the template's configuration")
    void registerFreezes() {
        leasehold.templates.registerTemplate(templateId, CREATOR);

        assertThat(leasehold.engine.isFrozen(templateId)).isTrue();
        assertThat(leasehold.registry.isRegisteredTemplate(templateId)).isTrue();
        assertThat(leasehold.events.last(EventType.TEMPLATE_REGISTERED).entity().entityType())
                .isEqualTo("Template");
        assertThatThrownBy(() -> leasehold.tokenWhitelist.add(templateId, CREATOR, SCAM))
                .isInstanceOf(PolicyConfigurationException.class);
        assertThatThrownBy(() -> leasehold.templates.registerTemplate(templateId, CREATOR))
                .isInstanceOf(PolicyConfigurationException.class);
    }

    @Test
    @DisplayName("Only the owner registers, and only entities with policies")
    void registerGuards() {
        assertThatThrownBy(() -> leasehold.templates.registerTemplate(templateId, RENTER))
                .isInstanceOf(AuthorizationException.class);

        long bare = leasehold.registry.mint(TestLeasehold.LEASE_ISSUER, CREATOR);
        assertThatThrownBy(() -> leasehold.templates.registerTemplate(bare, CREATOR))
                .isInstanceOf(PolicyConfigurationException.class);
        assertThat(leasehold.registry.isRegisteredTemplate(bare)).isFalse();
    }

    @Test
    @DisplayName("Instances require a registered template")
    void unregisteredTemplate() {
        assertThatThrownBy(this::mintInstance).isInstanceOf(PolicyConfigurationException.class);
    }

    @Test
    @DisplayName("Minted instance is owned and leased by the renter and inherits the template configuration")
    void mintInstanceInherits() {
        leasehold.templates.registerTemplate(templateId, CREATOR);

        long instanceId = mintInstance();

        EntityRecord instance = leasehold.registry.require(instanceId);
        assertThat(instance.owner()).isEqualTo(RENTER);
        assertThat(instance.renter()).isEqualTo(RENTER);
        assertThat(instance.templateId()).isEqualTo(templateId);
        assertThat(instance.initParamsHash()).isEqualTo(
                Numeric.toHexString(Hash.sha3("strategy:grid".getBytes(StandardCharsets.UTF_8))));
        assertThat(leasehold.engine.boundTemplate(instanceId)).contains(templateId);
        assertThat(leasehold.engine.activePolicies(instanceId))
                .containsExactly(TokenWhitelistPolicy.POLICY_TYPE, ReceiverGuardPolicy.POLICY_TYPE);
        assertThat(leasehold.tokenWhitelist.isWhitelisted(instanceId, USDT)).isTrue();
    }

    @Test
    @DisplayName("Instance owner trades within the template ceiling")
    void instanceOwnerConstrained() {
        leasehold.templates.registerTemplate(templateId, CREATOR);
        long instanceId = mintInstance();
        String vault = leasehold.registry.require(instanceId).vault();
        leasehold.vaults.require(instanceId).deposit(RENTER, BigInteger.TEN);

        ExecutionReceipt receipt = leasehold.router.execute(instanceId, RENTER, new Action(DEX, BigInteger.ONE,
                TestPayloads.swapExactEthForTokens(BigInteger.ONE, List.of(WBNB, USDT), vault)));
        assertThat(receipt.role()).isEqualTo(CallerRole.INSTANCE_OWNER);

        assertThatThrownBy(() -> leasehold.router.execute(instanceId, RENTER, new Action(DEX, BigInteger.ONE,
                TestPayloads.swapExactEthForTokens(BigInteger.ONE, List.of(WBNB, SCAM), vault))))
                .isInstanceOf(PolicyViolationException.class)
                .hasMessage(TokenWhitelistPolicy.TOKEN_NOT_WHITELISTED);

        assertThatThrownBy(() -> leasehold.tokenWhitelist.add(instanceId, RENTER, SCAM))
                .isInstanceOf(PolicyConfigurationException.class);
        leasehold.tokenWhitelist.remove(instanceId, RENTER, USDT);
        assertThat(leasehold.tokenWhitelist.isWhitelisted(templateId, USDT)).isTrue();
    }

    @Test
    @DisplayName("Instance owner keeps executing under policy after the lease runs out")
    void instanceOwnerAfterLeaseExpiry() {
        leasehold.templates.registerTemplate(templateId, CREATOR);
        long instanceId = mintInstance();
        String vault = leasehold.registry.require(instanceId).vault();
        leasehold.vaults.require(instanceId).deposit(RENTER, BigInteger.TEN);

        leasehold.clock.set(leaseEnd.plus(Duration.ofDays(1)));

        ExecutionReceipt receipt = leasehold.router.execute(instanceId, RENTER, new Action(DEX, BigInteger.ONE,
                TestPayloads.swapExactEthForTokens(BigInteger.ONE, List.of(WBNB, USDT), vault)));
        assertThat(receipt.role()).isEqualTo(CallerRole.INSTANCE_OWNER);
        assertThatThrownBy(() -> leasehold.router.execute(instanceId, RENTER, new Action(DEX, BigInteger.ONE,
                TestPayloads.swapExactEthForTokens(BigInteger.ONE, List.of(WBNB, USDT), CREATOR))))
                .isInstanceOf(PolicyViolationException.class);
    }

    @Test
    @DisplayName("Each instance gets its own id, vault and configuration")
    void instancesAreIndependent() {
        leasehold.templates.registerTemplate(templateId, CREATOR);

        long first = mintInstance();
        long second = mintInstance();

        assertThat(first).isNotEqualTo(second);
        assertThat(leasehold.registry.require(first).vault()).isNotEqualTo(leasehold.registry.require(second).vault());
        leasehold.tokenWhitelist.remove(first, RENTER, WBNB);
        assertThat(leasehold.tokenWhitelist.isWhitelisted(second, WBNB)).isTrue();
    }

    @Test
    @DisplayName("Only the lease issuer mints instances")
    void mintGuard() {
        leasehold.templates.registerTemplate(templateId, CREATOR);

        assertThatThrownBy(() -> leasehold.templates.mintInstance(RENTER, templateId, RENTER, leaseEnd, new byte[0]))
                .isInstanceOf(AuthorizationException.class);
    }
}
