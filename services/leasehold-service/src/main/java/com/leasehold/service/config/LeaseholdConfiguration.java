package com.leasehold.service.config;

import com.leasehold.access.AccessRouter;
import com.leasehold.access.EntityLocks;
import com.leasehold.access.EntityRegistry;
import com.leasehold.access.TemplateCatalog;
import com.leasehold.access.audit.AuditTrail;
import com.leasehold.access.delegation.OperatorDelegations;
import com.leasehold.access.delegation.PermitDomain;
import com.leasehold.access.delegation.PermitVerifier;
import com.leasehold.access.vault.ExternalCallPort;
import com.leasehold.access.vault.Vaults;
import com.leasehold.eventmodel.EventSink;
import com.leasehold.eventmodel.LoggingEventSink;
import com.leasehold.observability.MetricFactory;
import com.leasehold.observability.SpanHelper;
import com.leasehold.policy.engine.PolicyEngine;
import com.leasehold.policy.plugin.CooldownPolicy;
import com.leasehold.policy.plugin.DexWhitelistPolicy;
import com.leasehold.policy.plugin.PolicyPlugin;
import com.leasehold.policy.plugin.ReceiverGuardPolicy;
import com.leasehold.policy.plugin.SpendLimitPolicy;
import com.leasehold.policy.plugin.TokenWhitelistPolicy;
import com.leasehold.policy.store.InMemoryPolicyStateStore;
import com.leasehold.policy.store.PolicyStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the Leasehold components. The library modules take plain constructor arguments; this is
 * the only place that reads {@link LeaseholdProperties}.
 */
@Configuration(proxyBeanMethods = false)
public class LeaseholdConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LeaseholdConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventSink eventSink() {
        return new LoggingEventSink();
    }

    @Bean
    public AuditTrail auditTrail(EventSink eventSink, Clock clock) {
        return new AuditTrail(eventSink, clock);
    }

    @Bean
    public EntityLocks entityLocks() {
        return new EntityLocks();
    }

    @Bean
    public Vaults vaults(LeaseholdProperties properties, ExternalCallPort externalCallPort) {
        return new Vaults(properties.router(), externalCallPort);
    }

    @Bean
    public EntityRegistry entityRegistry(LeaseholdProperties properties, Vaults vaults, AuditTrail auditTrail,
                                         EntityLocks entityLocks, Clock clock) {
        return new EntityRegistry(properties.leaseIssuer(), vaults, auditTrail, entityLocks, clock);
    }

    @Bean
    public PolicyStateStore policyStateStore() {
        return new InMemoryPolicyStateStore();
    }

    // ---- plugins ----

    @Bean
    public TokenWhitelistPolicy tokenWhitelistPolicy(PolicyStateStore store, EntityRegistry registry) {
        return new TokenWhitelistPolicy(store, registry);
    }

    @Bean
    public DexWhitelistPolicy dexWhitelistPolicy(PolicyStateStore store, EntityRegistry registry) {
        return new DexWhitelistPolicy(store, registry);
    }

    @Bean
    public SpendLimitPolicy spendLimitPolicy(PolicyStateStore store, EntityRegistry registry, Clock clock) {
        return new SpendLimitPolicy(store, registry, clock);
    }

    @Bean
    public CooldownPolicy cooldownPolicy(PolicyStateStore store, EntityRegistry registry, Clock clock) {
        return new CooldownPolicy(store, registry, clock);
    }

    @Bean
    public ReceiverGuardPolicy receiverGuardPolicy(EntityRegistry registry) {
        return new ReceiverGuardPolicy(registry);
    }

    /**
     * Builds the engine and approves the plugins listed in {@code leasehold.approved-policies},
     * acting as the configured governor.
     */
    @Bean
    public PolicyEngine policyEngine(LeaseholdProperties properties, PolicyStateStore store,
                                     EntityRegistry registry, AuditTrail auditTrail, Clock clock,
                                     List<PolicyPlugin> plugins) {
        PolicyEngine engine = new PolicyEngine(
                new PolicyEngine.Settings(properties.governor(), properties.registrar(), properties.router(),
                        properties.maxPoliciesPerEntity()),
                store, registry, auditTrail, clock);
        Map<String, PolicyPlugin> byType = plugins.stream()
                .collect(Collectors.toMap(PolicyPlugin::policyType, Function.identity()));
        for (String type : properties.approvedPolicies()) {
            PolicyPlugin plugin = byType.get(type);
            if (plugin == null) {
                throw new IllegalStateException("leasehold.approved-policies names unknown plugin '" + type + "'");
            }
            engine.approvePlugin(properties.governor(), plugin);
        }
        log.info("Policy engine ready with approved plugins {}", properties.approvedPolicies());
        return engine;
    }

    @Bean
    public TemplateCatalog templateCatalog(LeaseholdProperties properties, EntityRegistry registry,
                                           PolicyEngine engine, AuditTrail auditTrail, EntityLocks entityLocks,
                                           Clock clock) {
        return new TemplateCatalog(properties.registrar(), registry, engine, auditTrail, entityLocks, clock);
    }

    @Bean
    public PermitVerifier permitVerifier(LeaseholdProperties properties) {
        return new PermitVerifier(new PermitDomain(properties.permitDomainName(),
                properties.permitDomainVersion(), properties.chainId(), properties.router()));
    }

    @Bean
    public OperatorDelegations operatorDelegations(EntityRegistry registry, PermitVerifier permitVerifier,
                                                   AuditTrail auditTrail, EntityLocks entityLocks, Clock clock) {
        return new OperatorDelegations(registry, permitVerifier, auditTrail, entityLocks, clock);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, LeaseholdProperties properties) {
        return new MetricFactory(meterRegistry, properties.serviceName());
    }

    @Bean
    public SpanHelper spanHelper(LeaseholdProperties properties) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(properties.serviceName()));
    }

    @Bean
    public AccessRouter accessRouter(LeaseholdProperties properties, EntityRegistry registry, PolicyEngine engine,
                                     Vaults vaults, OperatorDelegations operatorDelegations,
                                     AuditTrail auditTrail, EntityLocks entityLocks, Clock clock,
                                     MetricFactory metricFactory, SpanHelper spanHelper) {
        return new AccessRouter(properties.router(), registry, engine, vaults, operatorDelegations, auditTrail,
                entityLocks, clock, metricFactory, spanHelper);
    }
}
