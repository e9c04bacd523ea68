package com.leasehold.access;

import com.leasehold.access.audit.AuditPayloads;
import com.leasehold.access.audit.AuditTrail;
import com.leasehold.access.delegation.OperatorDelegations;
import com.leasehold.access.delegation.OperatorPermit;
import com.leasehold.access.vault.CallResult;
import com.leasehold.access.vault.Vaults;
import com.leasehold.eventmodel.EventType;
import com.leasehold.observability.CorrelationContext;
import com.leasehold.observability.CorrelationContextHolder;
import com.leasehold.observability.MetricFactory;
import com.leasehold.observability.SpanHelper;
import com.leasehold.policy.Action;
import com.leasehold.policy.Addresses;
import com.leasehold.policy.AuthorizationException;
import com.leasehold.policy.PolicyDecision;
import com.leasehold.policy.PolicyViolationException;
import com.leasehold.policy.decoder.ActionDecoder;
import com.leasehold.policy.engine.PolicyEngine;
import io.opentelemetry.api.trace.SpanKind;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Single entry point for acting on an entity's vault.
 *
 * <p>Every action is serialized per entity and goes through the same sequence: status check,
 * role resolution, policy validation, forwarding through the vault, policy commit, and audit.
 * A failure at any step before the forward leaves no trace; a failing forward restores the vault
 * balance; commit failures are reported but never undo an executed action.
 */
public final class AccessRouter {

    private static final Logger log = LoggerFactory.getLogger(AccessRouter.class);

    static final String ACTIONS_METRIC = "leasehold.actions";
    static final String ACTION_DURATION_METRIC = "leasehold.action.duration";

    private final String identity;
    private final EntityRegistry registry;
    private final PolicyEngine engine;
    private final Vaults vaults;
    private final OperatorDelegations delegations;
    private final AuditTrail audit;
    private final EntityLocks locks;
    private final Clock clock;
    private final MetricFactory metrics;
    private final SpanHelper spans;

    public AccessRouter(String identity, EntityRegistry registry, PolicyEngine engine, Vaults vaults,
                        OperatorDelegations delegations, AuditTrail audit, EntityLocks locks, Clock clock,
                        MetricFactory metrics, SpanHelper spans) {
        this.identity = Addresses.requireNonZero(identity, "router");
        this.registry = registry;
        this.engine = engine;
        this.vaults = vaults;
        this.delegations = delegations;
        this.audit = audit;
        this.locks = locks;
        this.clock = clock;
        this.metrics = metrics;
        this.spans = spans;
    }

    public String identity() {
        return identity;
    }

    /**
     * Executes {@code action} against the vault of {@code entityId} on behalf of {@code caller}.
     *
     * @throws EntityStateException      if the entity is paused or terminated
     * @throws AuthorizationException    if the caller holds no role
     * @throws LeaseExpiredException     if the caller's lease has run out
     * @throws DelegationException       if the caller's operator delegation has lapsed
     * @throws PolicyViolationException  if a policy rejects the action
     * @throws ExecutionFailedException  if the forwarded call fails
     */
    public ExecutionReceipt execute(long entityId, String caller, Action action) {
        Objects.requireNonNull(action, "action");
        String who = Addresses.normalize(caller);
        CorrelationContext context = CorrelationContextHolder.deriveFor(String.valueOf(entityId), who);
        return CorrelationContextHolder.callWithContext(context, () -> spans.inSpan(
                "leasehold.execute",
                SpanKind.INTERNAL,
                Map.of("leasehold.destination", action.destination()),
                () -> timed(() -> locks.withLock(entityId, () -> doExecute(entityId, who, action)))));
    }

    /** Runs role resolution and policy validation only. Nothing changes. */
    public PolicyDecision preview(long entityId, String caller, Action action) {
        Objects.requireNonNull(action, "action");
        String who = Addresses.normalize(caller);
        EntityRecord record = registry.require(entityId);
        requireOperational(record);
        CallerRole role = resolveRole(record, who, clock.instant());
        if (!role.policyConstrained()) {
            return PolicyDecision.allow();
        }
        return engine.validate(entityId, who, action);
    }

    /** Pays {@code amount} from the vault to the owner of record. Operators may not withdraw. */
    public void withdraw(long entityId, String caller, BigInteger amount) {
        String who = Addresses.normalize(caller);
        CorrelationContext context = CorrelationContextHolder.deriveFor(String.valueOf(entityId), who);
        CorrelationContextHolder.runWithContext(context, () -> locks.runLocked(entityId, () -> {
            EntityRecord record = registry.require(entityId);
            requireOperational(record);
            CallerRole role = resolveRole(record, who, clock.instant());
            if (!role.mayWithdraw()) {
                throw new AuthorizationException(who, "operators may not withdraw");
            }
            vaults.require(entityId).withdraw(identity, record.owner(), amount);
            audit.record(EventType.FUNDS_WITHDRAWN, entityId,
                    new AuditPayloads.FundsWithdrawn(who, record.owner(), amount));
            log.info("Withdrew {} from entity {} to owner {}", amount, entityId, record.owner());
        }));
    }

    public void setOperator(long entityId, String caller, String operator, Instant expiry) {
        delegations.setOperator(entityId, caller, operator, expiry);
    }

    public void clearOperator(long entityId, String caller) {
        delegations.clearOperator(entityId, caller);
    }

    public void setOperatorWithPermit(String submitter, OperatorPermit permit, byte[] signature) {
        delegations.setOperatorWithPermit(submitter, permit, signature);
    }

    /**
     * Resolves the role {@code caller} holds on the entity right now.
     */
    public CallerRole resolveRole(long entityId, String caller) {
        return resolveRole(registry.require(entityId), Addresses.normalize(caller), clock.instant());
    }

    static CallerRole resolveRole(EntityRecord record, String caller, Instant now) {
        if (record.owner().equals(caller)) {
            return record.isInstance() ? CallerRole.INSTANCE_OWNER : CallerRole.PLAIN_OWNER;
        }
        if (caller.equals(record.renter())) {
            if (record.activeRenter(now).isPresent()) {
                return CallerRole.RENTER;
            }
            throw new LeaseExpiredException(record.id(), record.leaseExpiry());
        }
        if (caller.equals(record.operator())) {
            if (record.activeOperator(now).isPresent()) {
                return CallerRole.OPERATOR;
            }
            throw new DelegationException(DelegationException.Reason.EXPIRED,
                    "operator delegation on entity " + record.id() + " has expired");
        }
        throw new AuthorizationException(caller, "caller holds no role on entity " + record.id());
    }

    private ExecutionReceipt doExecute(long entityId, String caller, Action action) {
        EntityRecord record = registry.require(entityId);
        requireOperational(record);
        Instant now = clock.instant();
        CallerRole role = resolveRole(record, caller, now);

        if (role.policyConstrained()) {
            PolicyDecision decision = engine.validate(entityId, caller, action);
            if (!decision.allowed()) {
                metrics.counter(ACTIONS_METRIC, "Actions submitted through the router",
                        MetricFactory.TAG_OUTCOME, "rejected",
                        MetricFactory.TAG_POLICY, decision.policyType()).increment();
                log.warn("Action on entity {} by {} rejected by {}: {}",
                        entityId, role, decision.policyType(), decision.reason());
                throw PolicyViolationException.of(decision);
            }
        }

        String instructionId = ActionDecoder.decode(action).instructionId();
        CallResult result;
        try {
            result = vaults.require(entityId).forward(identity, action);
        } catch (ExecutionFailedException e) {
            metrics.counter(ACTIONS_METRIC, "Actions submitted through the router",
                    MetricFactory.TAG_OUTCOME, "failed").increment();
            audit.record(EventType.ACTION_EXECUTED, entityId, new AuditPayloads.ActionExecuted(
                    caller, role.name(), action.destination(), instructionId, action.value(), false));
            log.warn("Action on entity {} by {} failed: {}", entityId, role, e.getMessage());
            throw e;
        }

        if (role.policyConstrained()) {
            engine.commit(entityId, identity, action);
        }
        registry.recordAction(entityId, now);
        audit.record(EventType.ACTION_EXECUTED, entityId, new AuditPayloads.ActionExecuted(
                caller, role.name(), action.destination(), instructionId, action.value(), true));
        metrics.counter(ACTIONS_METRIC, "Actions submitted through the router",
                MetricFactory.TAG_OUTCOME, "executed").increment();
        log.info("Executed action on entity {} as {} to {} ({})",
                entityId, role, action.destination(), instructionId.isEmpty() ? "value transfer" : instructionId);
        return new ExecutionReceipt(entityId, role, instructionId, result.returnDataHex(), now);
    }

    private <T> T timed(Supplier<T> work) {
        Timer.Sample sample = Timer.start(metrics.registry());
        try {
            return work.get();
        } finally {
            sample.stop(metrics.timer(ACTION_DURATION_METRIC, "Time spent executing an action"));
        }
    }

    private static void requireOperational(EntityRecord record) {
        if (!record.status().isOperational()) {
            throw new EntityStateException(record.id(), record.status(),
                    "entity " + record.id() + " is " + record.status());
        }
    }
}
