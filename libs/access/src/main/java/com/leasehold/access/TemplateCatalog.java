package com.leasehold.access;

import com.leasehold.access.audit.AuditPayloads;
import com.leasehold.access.audit.AuditTrail;
import com.leasehold.eventmodel.EventType;
import com.leasehold.policy.Addresses;
import com.leasehold.policy.AuthorizationException;
import com.leasehold.policy.PolicyConfigurationException;
import com.leasehold.policy.engine.PolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Turns plain entities into templates and mints instances from them.
 *
 * <p>Acts as the policy engine's registrar: registration freezes the template's rule set, and
 * minting binds the new instance before it becomes visible in the registry, so an instance
 * never exists without its policies.
 */
public final class TemplateCatalog {

    private static final Logger log = LoggerFactory.getLogger(TemplateCatalog.class);

    private final String identity;
    private final EntityRegistry registry;
    private final PolicyEngine engine;
    private final AuditTrail audit;
    private final EntityLocks locks;
    private final Clock clock;

    public TemplateCatalog(String identity, EntityRegistry registry, PolicyEngine engine,
                           AuditTrail audit, EntityLocks locks, Clock clock) {
        this.identity = Addresses.requireNonZero(identity, "registrar");
        this.registry = registry;
        this.engine = engine;
        this.audit = audit;
        this.locks = locks;
        this.clock = clock;
    }

    public void registerTemplate(long entityId, String caller) {
        String who = Addresses.normalize(caller);
        locks.runLocked(entityId, () -> {
            EntityRecord record = registry.require(entityId);
            if (!record.owner().equals(who)) {
                throw new AuthorizationException(who, "only the owner may register a template");
            }
            if (record.isInstance() || record.template()) {
                throw new PolicyConfigurationException("only plain entities can become templates");
            }
            if (!record.status().isOperational()) {
                throw new EntityStateException(entityId, record.status(),
                        "entity " + entityId + " is " + record.status());
            }
            engine.freezeTemplate(entityId, identity);
            registry.markTemplate(entityId);
        });
        audit.record(EventType.TEMPLATE_REGISTERED, entityId,
                new AuditPayloads.TemplateRegistered(who, engine.activePolicies(entityId)));
        log.info("Registered entity {} as a template", entityId);
    }

    /**
     * Mints an instance of {@code templateId} owned and leased by {@code renter}.
     *
     * @return the new instance's id
     */
    public long mintInstance(String caller, long templateId, String renter, Instant leaseExpiry,
                             byte[] initParams) {
        registry.requireLeaseIssuer(caller);
        String tenant = Addresses.requireNonZero(renter, "renter");
        Objects.requireNonNull(initParams, "initParams");
        if (leaseExpiry == null || !leaseExpiry.isAfter(clock.instant())) {
            throw new IllegalArgumentException("lease expiry must be in the future");
        }
        return locks.withLock(templateId, () -> {
            EntityRecord template = registry.require(templateId);
            if (!template.template()) {
                throw new PolicyConfigurationException("entity " + templateId + " is not a registered template");
            }
            if (template.status() == EntityStatus.TERMINATED) {
                throw new EntityStateException(templateId, template.status(),
                        "template " + templateId + " is terminated");
            }
            String paramsHash = Numeric.toHexString(Hash.sha3(initParams));
            long instanceId = registry.reserveId();
            engine.bindInstance(instanceId, templateId, identity);
            registry.registerInstance(instanceId, templateId, tenant, leaseExpiry, paramsHash);
            return instanceId;
        });
    }
}
