package com.leasehold.policy.plugin;

import com.leasehold.policy.ConfigurationGuard;
import com.leasehold.policy.EntityDirectory;
import com.leasehold.policy.PolicyConfigurationException;
import com.leasehold.policy.PolicyDecision;
import com.leasehold.policy.store.PolicyStateStore;
import com.leasehold.policy.store.StateNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Enforces a minimum interval between executed actions. Renters may drop it from an instance or
 * lengthen the interval, never shorten it below the template's.
 */
public class CooldownPolicy implements PolicyPlugin {

    private static final Logger log = LoggerFactory.getLogger(CooldownPolicy.class);

    public static final String POLICY_TYPE = "cooldown";

    public static final String NOT_CONFIGURED = "cooldown not configured";
    public static final String COOLDOWN_ACTIVE = "cooldown active";

    private final EntityDirectory directory;
    private final Clock clock;
    private final StateNamespace<Duration> intervals;
    private final StateNamespace<Instant> lastActions;

    public CooldownPolicy(PolicyStateStore store, EntityDirectory directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
        this.intervals = store.claim(POLICY_TYPE + ".interval", Duration.class);
        this.lastActions = store.claim(POLICY_TYPE + ".last-action", Instant.class);
    }

    @Override
    public String policyType() {
        return POLICY_TYPE;
    }

    @Override
    public boolean renterConfigurable() {
        return true;
    }

    @Override
    public Set<PolicyCapability> capabilities() {
        return Set.of(PolicyCapability.COMMIT, PolicyCapability.INSTANCE_INIT);
    }

    public void setInterval(long entityId, String caller, Duration interval) {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("cooldown interval must not be negative");
        }
        ConfigurationGuard.Scope scope = ConfigurationGuard.authorize(directory, entityId, caller);
        if (scope.isInstance()) {
            Optional<Duration> floor = intervals.get(scope.templateId());
            if (floor.isPresent() && interval.compareTo(floor.get()) < 0) {
                throw new PolicyConfigurationException("cooldown is shorter than the template minimum");
            }
        }
        intervals.put(entityId, interval);
        log.info("Cooldown on entity {} set to {}", entityId, interval);
    }

    public Optional<Duration> interval(long entityId) {
        return intervals.get(entityId);
    }

    @Override
    public PolicyDecision check(PolicyRequest request) {
        Optional<Duration> interval = intervals.get(request.entityId());
        if (interval.isEmpty()) {
            return PolicyDecision.reject(POLICY_TYPE, NOT_CONFIGURED);
        }
        Optional<Instant> last = lastActions.get(request.entityId());
        if (last.isPresent()
                && Duration.between(last.get(), clock.instant()).compareTo(interval.get()) < 0) {
            return PolicyDecision.reject(POLICY_TYPE, COOLDOWN_ACTIVE);
        }
        return PolicyDecision.allow();
    }

    @Override
    public void commit(PolicyRequest request) {
        lastActions.put(request.entityId(), clock.instant());
    }

    @Override
    public void initInstance(long instanceId, long templateId) {
        intervals.get(templateId).ifPresent(interval -> intervals.put(instanceId, interval));
        lastActions.remove(instanceId);
    }
}
