package com.leasehold.access.testing;

import com.leasehold.access.AccessRouter;
import com.leasehold.access.EntityLocks;
import com.leasehold.access.EntityRegistry;
import com.leasehold.access.TemplateCatalog;
import com.leasehold.access.audit.AuditTrail;
import com.leasehold.access.delegation.OperatorDelegations;
import com.leasehold.access.delegation.PermitDomain;
import com.leasehold.access.delegation.PermitVerifier;
import com.leasehold.access.vault.Vaults;
import com.leasehold.eventmodel.testing.InMemoryEventSink;
import com.leasehold.observability.MetricFactory;
import com.leasehold.observability.SpanHelper;
import com.leasehold.policy.engine.PolicyEngine;
import com.leasehold.policy.plugin.CooldownPolicy;
import com.leasehold.policy.plugin.DexWhitelistPolicy;
import com.leasehold.policy.plugin.ReceiverGuardPolicy;
import com.leasehold.policy.plugin.SpendLimitPolicy;
import com.leasehold.policy.plugin.TokenWhitelistPolicy;
import com.leasehold.policy.store.InMemoryPolicyStateStore;
import com.leasehold.policy.testing.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;

/**
 * A fully wired, in-memory Leasehold with the five standard plugins approved.
 */
public final class TestLeasehold {

    public static final String GOVERNOR = "0x9000000000000000000000000000000000000009";
    public static final String REGISTRAR = "0x8000000000000000000000000000000000000008";
    public static final String ROUTER = "0x7000000000000000000000000000000000000007";
    public static final String LEASE_ISSUER = "0x6000000000000000000000000000000000000006";
    public static final long CHAIN_ID = 56L;

    public final MutableClock clock = MutableClock.startingAt("2026-05-01T00:00:00Z");
    public final InMemoryEventSink events = new InMemoryEventSink();
    public final ScriptedExternalCallPort port = new ScriptedExternalCallPort();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final EntityLocks locks = new EntityLocks();
    public final AuditTrail audit = new AuditTrail(events, clock);
    public final Vaults vaults = new Vaults(ROUTER, port);
    public final EntityRegistry registry = new EntityRegistry(LEASE_ISSUER, vaults, audit, locks, clock);
    public final InMemoryPolicyStateStore store = new InMemoryPolicyStateStore();
    public final PolicyEngine engine = new PolicyEngine(
            new PolicyEngine.Settings(GOVERNOR, REGISTRAR, ROUTER), store, registry, audit, clock);
    public final TokenWhitelistPolicy tokenWhitelist = new TokenWhitelistPolicy(store, registry);
    public final DexWhitelistPolicy dexWhitelist = new DexWhitelistPolicy(store, registry);
    public final SpendLimitPolicy spendLimit = new SpendLimitPolicy(store, registry, clock);
    public final CooldownPolicy cooldown = new CooldownPolicy(store, registry, clock);
    public final ReceiverGuardPolicy receiverGuard = new ReceiverGuardPolicy(registry);
    public final TemplateCatalog templates = new TemplateCatalog(REGISTRAR, registry, engine, audit, locks, clock);
    public final PermitVerifier permits = new PermitVerifier(
            new PermitDomain("Leasehold", "1", CHAIN_ID, ROUTER));
    public final OperatorDelegations delegations = new OperatorDelegations(registry, permits, audit, locks, clock);
    public final AccessRouter router;

    public TestLeasehold() {
        this(new SpanHelper(OpenTelemetry.noop().getTracer("leasehold-test")));
    }

    public TestLeasehold(SpanHelper spans) {
        router = new AccessRouter(ROUTER, registry, engine, vaults, delegations, audit, locks, clock,
                new MetricFactory(meterRegistry, "leasehold-test"), spans);
        engine.approvePlugin(GOVERNOR, tokenWhitelist);
        engine.approvePlugin(GOVERNOR, dexWhitelist);
        engine.approvePlugin(GOVERNOR, spendLimit);
        engine.approvePlugin(GOVERNOR, cooldown);
        engine.approvePlugin(GOVERNOR, receiverGuard);
    }
}
