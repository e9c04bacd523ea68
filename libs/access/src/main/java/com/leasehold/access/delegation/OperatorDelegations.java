package com.leasehold.access.delegation;

import com.leasehold.access.DelegationException;
import com.leasehold.access.DelegationException.Reason;
import com.leasehold.access.EntityLocks;
import com.leasehold.access.EntityRecord;
import com.leasehold.access.EntityRegistry;
import com.leasehold.access.EntityStateException;
import com.leasehold.access.LeaseExpiredException;
import com.leasehold.access.audit.AuditPayloads;
import com.leasehold.access.audit.AuditTrail;
import com.leasehold.eventmodel.EventType;
import com.leasehold.policy.Addresses;
import com.leasehold.policy.AuthorizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Appoints and removes operators on behalf of the active renter, either directly or from a
 * renter-signed {@link OperatorPermit} submitted by someone else.
 *
 * <p>A delegation never outlives the lease. Each permit nonce is usable once: a successful permit
 * advances the entity's nonce, which invalidates every other outstanding permit.
 */
public final class OperatorDelegations {

    private static final Logger log = LoggerFactory.getLogger(OperatorDelegations.class);

    private final EntityRegistry registry;
    private final PermitVerifier verifier;
    private final AuditTrail audit;
    private final EntityLocks locks;
    private final Clock clock;

    public OperatorDelegations(EntityRegistry registry, PermitVerifier verifier, AuditTrail audit,
                               EntityLocks locks, Clock clock) {
        this.registry = registry;
        this.verifier = verifier;
        this.audit = audit;
        this.locks = locks;
        this.clock = clock;
    }

    public PermitVerifier verifier() {
        return verifier;
    }

    /** Direct appointment by the active renter. */
    public void setOperator(long entityId, String caller, String operator, Instant expiry) {
        String who = Addresses.normalize(caller);
        String appointee = Addresses.requireNonZero(operator, "operator");
        Objects.requireNonNull(expiry, "expiry");
        EntityRecord updated = locks.withLock(entityId, () -> {
            EntityRecord record = requireOperational(entityId);
            Instant now = clock.instant();
            String renter = requireActiveRenter(record, who, now);
            requireNotRenter(renter, appointee);
            requireWithinLease(record, expiry, now);
            return registry.recordOperator(entityId, appointee, expiry, record.operatorNonce());
        });
        audit.record(EventType.OPERATOR_SET, entityId, new AuditPayloads.OperatorSet(
                updated.renter(), appointee, expiry, false, updated.operatorNonce()));
        log.info("Operator {} appointed on entity {} until {}", appointee, entityId, expiry);
    }

    /** Removes the operator. Allowed for the active renter and the owner. */
    public void clearOperator(long entityId, String caller) {
        String who = Addresses.normalize(caller);
        String previous = locks.withLock(entityId, () -> {
            EntityRecord record = registry.require(entityId);
            boolean isOwner = record.owner().equals(who);
            boolean isRenter = record.activeRenter(clock.instant()).map(who::equals).orElse(false);
            if (!isOwner && !isRenter) {
                throw new AuthorizationException(who, "only the renter or owner may clear the operator");
            }
            registry.recordOperatorCleared(entityId);
            return record.operator();
        });
        audit.record(EventType.OPERATOR_CLEARED, entityId, new AuditPayloads.OperatorCleared(who, previous));
        log.info("Operator cleared on entity {} by {}", entityId, who);
    }

    /**
     * Appoints the operator named in a renter-signed permit. Checks run in a fixed order and the
     * first failure is reported: submission deadline, submitter, renter, nonce, signature, lease
     * cap, expiry.
     */
    public void setOperatorWithPermit(String submitter, OperatorPermit permit, byte[] signature) {
        String who = Addresses.normalize(submitter);
        Objects.requireNonNull(permit, "permit");
        long entityId = permit.entityId();
        EntityRecord updated = locks.withLock(entityId, () -> {
            EntityRecord record = requireOperational(entityId);
            Instant now = clock.instant();
            if (now.isAfter(permit.deadline())) {
                throw new DelegationException(Reason.SIGNATURE_EXPIRED, "permit deadline has passed");
            }
            if (!who.equals(permit.operator()) && !who.equals(permit.renter())) {
                throw new DelegationException(Reason.SUBMITTER_MISMATCH,
                        "permit must be submitted by its operator or renter");
            }
            Optional<String> activeRenter = record.activeRenter(now);
            if (activeRenter.isEmpty() || !activeRenter.get().equals(permit.renter())) {
                throw new DelegationException(Reason.RENTER_MISMATCH, "permit renter is not the active renter");
            }
            if (permit.nonce() != record.operatorNonce()) {
                throw new DelegationException(Reason.REPLAYED,
                        "permit nonce " + permit.nonce() + " is not current");
            }
            String signer = verifier.recoverSigner(permit, signature);
            if (!signer.equals(permit.renter())) {
                throw new DelegationException(Reason.INVALID_SIGNATURE, "permit was not signed by the renter");
            }
            requireNotRenter(permit.renter(), permit.operator());
            requireWithinLease(record, permit.expiry(), now);
            return registry.recordOperator(entityId, permit.operator(), permit.expiry(),
                    record.operatorNonce() + 1);
        });
        audit.record(EventType.OPERATOR_SET, entityId, new AuditPayloads.OperatorSet(
                permit.renter(), permit.operator(), permit.expiry(), true, updated.operatorNonce()));
        log.info("Operator {} appointed on entity {} by permit submitted by {}", permit.operator(), entityId, who);
    }

    private EntityRecord requireOperational(long entityId) {
        EntityRecord record = registry.require(entityId);
        if (!record.status().isOperational()) {
            throw new EntityStateException(entityId, record.status(),
                    "entity " + entityId + " is " + record.status());
        }
        return record;
    }

    private static String requireActiveRenter(EntityRecord record, String caller, Instant now) {
        Optional<String> active = record.activeRenter(now);
        if (active.isPresent() && active.get().equals(caller)) {
            return caller;
        }
        if (caller.equals(record.renter())) {
            throw new LeaseExpiredException(record.id(), record.leaseExpiry());
        }
        throw new AuthorizationException(caller, "only the active renter may appoint an operator");
    }

    private static void requireNotRenter(String renter, String operator) {
        if (renter.equals(operator)) {
            throw new IllegalArgumentException("the renter cannot be its own operator");
        }
    }

    private static void requireWithinLease(EntityRecord record, Instant expiry, Instant now) {
        if (expiry.isAfter(record.leaseExpiry())) {
            throw new DelegationException(Reason.EXCEEDS_LEASE, "operator expiry exceeds the lease");
        }
        if (!expiry.isAfter(now)) {
            throw new DelegationException(Reason.EXPIRED, "operator expiry must be in the future");
        }
    }
}
