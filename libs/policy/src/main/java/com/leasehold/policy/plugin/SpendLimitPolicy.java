package com.leasehold.policy.plugin;

import com.leasehold.policy.ConfigurationGuard;
import com.leasehold.policy.EntityDirectory;
import com.leasehold.policy.PolicyConfigurationException;
import com.leasehold.policy.PolicyDecision;
import com.leasehold.policy.decoder.ActionDecoder;
import com.leasehold.policy.decoder.DecodedCall;
import com.leasehold.policy.store.PolicyStateStore;
import com.leasehold.policy.store.StateNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Caps per-call spend, rolling daily spend and approval size.
 *
 * <p>The spend of an action is the larger of its native value and its decoded amount; exact-output
 * swaps count their maximum input. The daily window opens at the first committed spend and lasts
 * 24 hours. Approvals are capped separately by {@code maxApprove} and never count toward the daily
 * total. Unlimited approvals, allowance increases and permits are always rejected. An
 * unrecognized instruction has no measurable spend and is only allowed against the entity's own
 * vault.
 */
public class SpendLimitPolicy implements PolicyPlugin {

    private static final Logger log = LoggerFactory.getLogger(SpendLimitPolicy.class);

    public static final String POLICY_TYPE = "spend-limit";

    public static final String NOT_CONFIGURED = "spend limits not configured";
    public static final String EXCEEDS_PER_CALL = "exceeds per-call limit";
    public static final String DAILY_LIMIT_REACHED = "daily limit reached";
    public static final String EXCEEDS_APPROVE_LIMIT = "exceeds approve limit";
    public static final String UNLIMITED_APPROVAL = "unlimited approval";
    public static final String INCREASE_ALLOWANCE_REJECTED = "increaseAllowance not allowed";
    public static final String PERMIT_REJECTED = "permit not allowed";
    public static final String UNRECOGNIZED_INSTRUCTION = "unrecognized instruction";

    static final Duration WINDOW = Duration.ofHours(24);

    /** Spend committed inside the current window. */
    public record SpendWindow(Instant openedAt, BigInteger spent) {
    }

    private final EntityDirectory directory;
    private final Clock clock;
    private final StateNamespace<SpendLimits> limits;
    private final StateNamespace<SpendWindow> windows;

    public SpendLimitPolicy(PolicyStateStore store, EntityDirectory directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
        this.limits = store.claim(POLICY_TYPE + ".limits", SpendLimits.class);
        this.windows = store.claim(POLICY_TYPE + ".window", SpendWindow.class);
    }

    @Override
    public String policyType() {
        return POLICY_TYPE;
    }

    @Override
    public boolean renterConfigurable() {
        return false;
    }

    @Override
    public Set<PolicyCapability> capabilities() {
        return Set.of(PolicyCapability.COMMIT, PolicyCapability.INSTANCE_INIT);
    }

    public void setLimits(long entityId, String caller, SpendLimits requested) {
        ConfigurationGuard.Scope scope = ConfigurationGuard.authorize(directory, entityId, caller);
        if (scope.isInstance()) {
            SpendLimits ceiling = limits.get(scope.templateId())
                    .orElseThrow(() -> new PolicyConfigurationException(
                            "template " + scope.templateId() + " has no spend limits"));
            if (!requested.within(ceiling)) {
                throw new PolicyConfigurationException("spend limits exceed the template ceiling");
            }
        }
        limits.put(entityId, requested);
        log.info("Spend limits set on entity {}: {}", entityId, requested);
    }

    public Optional<SpendLimits> limits(long entityId) {
        return limits.get(entityId);
    }

    /** Spend already committed in the window that is open at {@code now}. */
    public BigInteger spentInWindow(long entityId, Instant now) {
        return windows.get(entityId)
                .filter(window -> now.isBefore(window.openedAt().plus(WINDOW)))
                .map(SpendWindow::spent)
                .orElse(BigInteger.ZERO);
    }

    @Override
    public PolicyDecision check(PolicyRequest request) {
        Optional<SpendLimits> configured = limits.get(request.entityId());
        if (configured.isEmpty()) {
            return PolicyDecision.reject(POLICY_TYPE, NOT_CONFIGURED);
        }
        SpendLimits limit = configured.get();
        DecodedCall call = request.call();
        switch (call.kind()) {
            case PERMIT:
                return PolicyDecision.reject(POLICY_TYPE, PERMIT_REJECTED);
            case INCREASE_ALLOWANCE:
                return PolicyDecision.reject(POLICY_TYPE, INCREASE_ALLOWANCE_REJECTED);
            case UNKNOWN:
                if (!directory.vaultOf(request.entityId()).map(call.destination()::equals).orElse(false)) {
                    return PolicyDecision.reject(POLICY_TYPE, UNRECOGNIZED_INSTRUCTION);
                }
                break;
            case APPROVE:
                if (ActionDecoder.MAX_UINT256.equals(call.amount())) {
                    return PolicyDecision.reject(POLICY_TYPE, UNLIMITED_APPROVAL);
                }
                if (call.amount().compareTo(limit.maxApprove()) > 0) {
                    return PolicyDecision.reject(POLICY_TYPE, EXCEEDS_APPROVE_LIMIT);
                }
                break;
            default:
                break;
        }

        BigInteger spend = spendOf(call);
        if (spend.compareTo(limit.maxPerCall()) > 0) {
            return PolicyDecision.reject(POLICY_TYPE, EXCEEDS_PER_CALL);
        }
        BigInteger projected = spentInWindow(request.entityId(), clock.instant()).add(spend);
        if (projected.compareTo(limit.maxPerDay()) > 0) {
            return PolicyDecision.reject(POLICY_TYPE, DAILY_LIMIT_REACHED);
        }
        return PolicyDecision.allow();
    }

    @Override
    public void commit(PolicyRequest request) {
        BigInteger spend = spendOf(request.call());
        if (spend.signum() == 0) {
            return;
        }
        Instant now = clock.instant();
        windows.compute(request.entityId(), current -> current
                .filter(window -> now.isBefore(window.openedAt().plus(WINDOW)))
                .map(window -> new SpendWindow(window.openedAt(), window.spent().add(spend)))
                .orElseGet(() -> new SpendWindow(now, spend)));
    }

    @Override
    public void initInstance(long instanceId, long templateId) {
        limits.get(templateId).ifPresent(ceiling -> limits.put(instanceId, ceiling));
        windows.remove(instanceId);
    }

    /**
     * Native value or decoded amount, whichever is larger. Approval-style instructions only spend
     * their native value.
     */
    static BigInteger spendOf(DecodedCall call) {
        BigInteger value = call.value();
        return switch (call.kind()) {
            case SWAP_EXACT_NATIVE_IN, SWAP_NATIVE_IN_EXACT_OUT, NONE, UNKNOWN,
                    APPROVE, INCREASE_ALLOWANCE, DECREASE_ALLOWANCE, PERMIT -> value;
            case SWAP_EXACT_TOKENS_IN, SWAP_TOKENS_IN_EXACT_OUT, SWAP_V3_EXACT_INPUT_SINGLE,
                    SWAP_V3_EXACT_OUTPUT_SINGLE, SWAP_V3_EXACT_INPUT, SWAP_V3_EXACT_OUTPUT,
                    TRANSFER, TRANSFER_FROM -> value.max(call.amount());
        };
    }
}
