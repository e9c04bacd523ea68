package com.leasehold.policy.engine;

import com.leasehold.policy.Action;
import com.leasehold.policy.Addresses;
import com.leasehold.policy.AuthorizationException;
import com.leasehold.policy.ConfigurationGuard;
import com.leasehold.policy.EntityDirectory;
import com.leasehold.policy.PolicyConfigurationException;
import com.leasehold.policy.PolicyDecision;
import com.leasehold.policy.decoder.ActionDecoder;
import com.leasehold.policy.decoder.DecodedCall;
import com.leasehold.policy.plugin.PolicyCapability;
import com.leasehold.policy.plugin.PolicyPlugin;
import com.leasehold.policy.plugin.PolicyRequest;
import com.leasehold.policy.store.PolicyStateStore;
import com.leasehold.policy.store.StateNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Composes approved policy plugins into per-entity rule sets and evaluates actions against them.
 *
 * <p>Templates and plain entities own an ordered plugin list that their owner edits until the
 * template is frozen. Instances get a copy of their template's list when bound, and the renter
 * may only narrow it. {@link #validate} is a pure read; {@link #commit} is the only operation that
 * mutates plugin state, and a failing plugin there never undoes an executed action.
 */
public final class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    public static final String ENGINE_POLICY_TYPE = "policy-engine";
    public static final String NOT_BOUND = "not bound";
    public static final String POLICY_NOT_APPROVED = "policy not approved";
    public static final String POLICY_CHECK_FAILED = "policy check failed";

    public static final int DEFAULT_MAX_POLICIES = 8;

    /**
     * Identities and limits the engine is constructed with.
     *
     * @param governor             approves and revokes plugins
     * @param registrar            freezes templates and binds instances
     * @param router               the only caller allowed to commit
     * @param maxPoliciesPerEntity cap on any single policy list
     */
    public record Settings(String governor, String registrar, String router, int maxPoliciesPerEntity) {

        public Settings {
            governor = Addresses.requireNonZero(governor, "governor");
            registrar = Addresses.requireNonZero(registrar, "registrar");
            router = Addresses.requireNonZero(router, "router");
            if (maxPoliciesPerEntity <= 0) {
                maxPoliciesPerEntity = DEFAULT_MAX_POLICIES;
            }
        }

        public Settings(String governor, String registrar, String router) {
            this(governor, registrar, router, DEFAULT_MAX_POLICIES);
        }
    }

    private record ApprovedPlugin(PolicyPlugin plugin, boolean renterConfigurable,
                                  Set<PolicyCapability> capabilities) {

        boolean can(PolicyCapability capability) {
            return capabilities.contains(capability);
        }
    }

    private final Settings settings;
    private final EntityDirectory directory;
    private final CommitFailureListener commitFailures;
    private final Clock clock;
    private final Map<String, ApprovedPlugin> approved = new ConcurrentHashMap<>();
    private final StateNamespace<PolicyList> entityPolicies;
    private final StateNamespace<PolicyList> instancePolicies;
    private final StateNamespace<Long> bindings;
    private final StateNamespace<Instant> frozenTemplates;

    public PolicyEngine(Settings settings, PolicyStateStore store, EntityDirectory directory,
                        CommitFailureListener commitFailures, Clock clock) {
        this.settings = settings;
        this.directory = directory;
        this.commitFailures = commitFailures;
        this.clock = clock;
        this.entityPolicies = store.claim("policy-engine.entity-policies", PolicyList.class);
        this.instancePolicies = store.claim("policy-engine.instance-policies", PolicyList.class);
        this.bindings = store.claim("policy-engine.bindings", Long.class);
        this.frozenTemplates = store.claim("policy-engine.frozen-templates", Instant.class);
    }

    public Settings settings() {
        return settings;
    }

    // ---- plugin registry ----

    public synchronized void approvePlugin(String caller, PolicyPlugin plugin) {
        requireIdentity(caller, settings.governor(), "only the governor may approve plugins");
        String type = plugin.policyType();
        if (approved.containsKey(type)) {
            throw new PolicyConfigurationException("policy type already approved: " + type);
        }
        approved.put(type, new ApprovedPlugin(plugin, plugin.renterConfigurable(),
                Set.copyOf(plugin.capabilities())));
        log.info("Approved policy plugin {} with capabilities {}", type, plugin.capabilities());
    }

    public synchronized void revokePlugin(String caller, String policyType) {
        requireIdentity(caller, settings.governor(), "only the governor may revoke plugins");
        if (approved.remove(policyType) == null) {
            throw new PolicyConfigurationException("policy type not approved: " + policyType);
        }
        log.warn("Revoked policy plugin {}", policyType);
    }

    public boolean isApproved(String policyType) {
        return approved.containsKey(policyType);
    }

    // ---- template and plain-entity lists ----

    public synchronized void addEntityPolicy(long entityId, String caller, String policyType) {
        requireEntityScope(entityId, caller);
        requireApproved(policyType);
        PolicyList current = entityPolicies.get(entityId).orElse(PolicyList.EMPTY);
        requireAddable(current, policyType);
        entityPolicies.put(entityId, current.append(policyType));
        log.info("Added {} to entity {}", policyType, entityId);
    }

    public synchronized void removeEntityPolicy(long entityId, String caller, String policyType) {
        requireEntityScope(entityId, caller);
        PolicyList current = entityPolicies.get(entityId).orElse(PolicyList.EMPTY);
        if (!current.contains(policyType)) {
            throw new PolicyConfigurationException(policyType + " is not bound to entity " + entityId);
        }
        entityPolicies.put(entityId, current.swapRemove(policyType));
        log.info("Removed {} from entity {}", policyType, entityId);
    }

    public synchronized void freezeTemplate(long templateId, String caller) {
        requireIdentity(caller, settings.registrar(), "only the registrar may freeze templates");
        if (isFrozen(templateId)) {
            throw new PolicyConfigurationException("template " + templateId + " is already frozen");
        }
        if (entityPolicies.get(templateId).map(PolicyList::size).orElse(0) == 0) {
            throw new PolicyConfigurationException("template " + templateId + " has no policies");
        }
        frozenTemplates.put(templateId, clock.instant());
        log.info("Froze template {} with policies {}", templateId, activePolicies(templateId));
    }

    public boolean isFrozen(long templateId) {
        return frozenTemplates.get(templateId).isPresent();
    }

    // ---- instances ----

    /**
     * Binds a freshly minted instance to its template and seeds its configuration. Either the
     * binding and every plugin's instance state are established, or nothing is.
     */
    public synchronized void bindInstance(long instanceId, Long templateId, String caller) {
        requireIdentity(caller, settings.registrar(), "only the registrar may bind instances");
        if (templateId == null) {
            throw new PolicyConfigurationException("template reference must not be empty");
        }
        if (bindings.get(instanceId).isPresent()) {
            throw new PolicyConfigurationException("instance " + instanceId + " is already bound");
        }
        if (!isFrozen(templateId)) {
            throw new PolicyConfigurationException("template " + templateId + " is not registered");
        }
        PolicyList template = entityPolicies.get(templateId).orElse(PolicyList.EMPTY);
        if (template.size() == 0) {
            throw new PolicyConfigurationException("template " + templateId + " has no policies");
        }
        List<ApprovedPlugin> plugins = new ArrayList<>();
        for (String type : template.policyTypes()) {
            plugins.add(requireApproved(type));
        }

        bindings.put(instanceId, templateId);
        instancePolicies.put(instanceId, template);
        try {
            for (ApprovedPlugin plugin : plugins) {
                if (plugin.can(PolicyCapability.INSTANCE_INIT)) {
                    plugin.plugin().initInstance(instanceId, templateId);
                }
            }
        } catch (RuntimeException e) {
            bindings.remove(instanceId);
            instancePolicies.remove(instanceId);
            log.error("Binding instance {} to template {} failed, rolled back", instanceId, templateId, e);
            throw new PolicyConfigurationException(
                    "instance initialization failed: " + e.getMessage());
        }
        log.info("Bound instance {} to template {}", instanceId, templateId);
    }

    public Optional<Long> boundTemplate(long instanceId) {
        return bindings.get(instanceId);
    }

    public synchronized void addInstancePolicy(long instanceId, String caller, String policyType) {
        requireInstanceScope(instanceId, caller);
        ApprovedPlugin plugin = requireApproved(policyType);
        PolicyList current = instancePolicies.get(instanceId).orElse(PolicyList.EMPTY);
        requireAddable(current, policyType);
        if (plugin.can(PolicyCapability.INSTANCE_INIT)) {
            plugin.plugin().initInstance(instanceId, bindings.get(instanceId).orElseThrow());
        }
        instancePolicies.put(instanceId, current.append(policyType));
        log.info("Added {} to instance {}", policyType, instanceId);
    }

    public synchronized void removeInstancePolicy(long instanceId, String caller, String policyType) {
        requireInstanceScope(instanceId, caller);
        PolicyList current = instancePolicies.get(instanceId).orElse(PolicyList.EMPTY);
        if (!current.contains(policyType)) {
            throw new PolicyConfigurationException(policyType + " is not bound to instance " + instanceId);
        }
        ApprovedPlugin plugin = requireApproved(policyType);
        if (!plugin.renterConfigurable()) {
            throw new PolicyConfigurationException(policyType + " is not renter-configurable");
        }
        instancePolicies.put(instanceId, current.swapRemove(policyType));
        log.info("Removed {} from instance {}", policyType, instanceId);
    }

    /** Policy types evaluated for {@code entityId}, in evaluation order. */
    public List<String> activePolicies(long entityId) {
        if (bindings.get(entityId).isPresent()) {
            return instancePolicies.get(entityId).orElse(PolicyList.EMPTY).policyTypes();
        }
        return entityPolicies.get(entityId).orElse(PolicyList.EMPTY).policyTypes();
    }

    // ---- evaluation ----

    /**
     * Checks {@code action} against every active policy, in order, stopping at the first
     * rejection. Never mutates state.
     */
    public PolicyDecision validate(long entityId, String caller, Action action) {
        List<String> active = activePolicies(entityId);
        if (active.isEmpty()) {
            return PolicyDecision.reject(ENGINE_POLICY_TYPE, NOT_BOUND);
        }
        PolicyRequest request = request(entityId, caller, action);
        for (String type : active) {
            ApprovedPlugin plugin = approved.get(type);
            if (plugin == null) {
                return PolicyDecision.reject(type, POLICY_NOT_APPROVED);
            }
            PolicyDecision decision;
            try {
                decision = plugin.plugin().check(request);
            } catch (RuntimeException e) {
                log.error("Policy {} failed while checking entity {}", type, entityId, e);
                return PolicyDecision.reject(type, POLICY_CHECK_FAILED);
            }
            if (!decision.allowed()) {
                log.debug("Policy {} rejected action on entity {}: {}", type, entityId, decision.reason());
                return decision;
            }
        }
        return PolicyDecision.allow();
    }

    /**
     * Lets every commit-capable active plugin record an executed action. Failures are reported
     * to the {@link CommitFailureListener} and never propagate.
     */
    public void commit(long entityId, String caller, Action action) {
        requireIdentity(caller, settings.router(), "only the router may commit");
        List<String> active = activePolicies(entityId);
        if (active.isEmpty()) {
            return;
        }
        PolicyRequest request = request(entityId, caller, action);
        for (String type : active) {
            ApprovedPlugin plugin = approved.get(type);
            if (plugin == null || !plugin.can(PolicyCapability.COMMIT)) {
                continue;
            }
            try {
                plugin.plugin().commit(request);
            } catch (RuntimeException e) {
                log.error("Policy {} failed to commit on entity {}", type, entityId, e);
                notifyCommitFailure(entityId, type, e);
            }
        }
    }

    private void notifyCommitFailure(long entityId, String policyType, RuntimeException failure) {
        String diagnostic = failure.getClass().getSimpleName() + ": " + failure.getMessage();
        try {
            commitFailures.onCommitFailure(entityId, policyType, diagnostic);
        } catch (RuntimeException listenerFailure) {
            log.error("Commit failure listener failed for entity {}", entityId, listenerFailure);
        }
    }

    private PolicyRequest request(long entityId, String caller, Action action) {
        DecodedCall call = ActionDecoder.decode(action);
        return new PolicyRequest(entityId, Addresses.normalize(caller), action, call);
    }

    // ---- guards ----

    private void requireEntityScope(long entityId, String caller) {
        ConfigurationGuard.Scope scope = ConfigurationGuard.authorize(directory, entityId, caller);
        if (scope.isInstance()) {
            throw new PolicyConfigurationException(
                    "entity " + entityId + " is an instance; use the instance policy operations");
        }
        if (isFrozen(entityId)) {
            throw new PolicyConfigurationException("template " + entityId + " is frozen");
        }
    }

    private void requireInstanceScope(long instanceId, String caller) {
        if (bindings.get(instanceId).isEmpty()) {
            throw new PolicyConfigurationException("instance " + instanceId + " is not bound");
        }
        ConfigurationGuard.authorizeInstance(directory, instanceId, caller);
    }

    private ApprovedPlugin requireApproved(String policyType) {
        ApprovedPlugin plugin = approved.get(policyType);
        if (plugin == null) {
            throw new PolicyConfigurationException(POLICY_NOT_APPROVED + ": " + policyType);
        }
        return plugin;
    }

    private void requireAddable(PolicyList list, String policyType) {
        if (list.contains(policyType)) {
            throw new PolicyConfigurationException(policyType + " is already bound");
        }
        if (list.size() >= settings.maxPoliciesPerEntity()) {
            throw new PolicyConfigurationException(
                    "policy list is full (" + settings.maxPoliciesPerEntity() + ")");
        }
    }

    private static void requireIdentity(String caller, String expected, String message) {
        String who = Addresses.normalize(caller);
        if (!expected.equals(who)) {
            throw new AuthorizationException(who, message);
        }
    }
}
