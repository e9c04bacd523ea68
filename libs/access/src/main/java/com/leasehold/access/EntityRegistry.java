package com.leasehold.access;

import com.leasehold.access.audit.AuditPayloads;
import com.leasehold.access.audit.AuditTrail;
import com.leasehold.access.vault.Vault;
import com.leasehold.access.vault.Vaults;
import com.leasehold.eventmodel.EntityType;
import com.leasehold.eventmodel.EventType;
import com.leasehold.policy.Addresses;
import com.leasehold.policy.AuthorizationException;
import com.leasehold.policy.EntityDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Ownership, lease and operator bookkeeping for every rentable entity.
 *
 * <p>Minting and leasing are reserved to the lease issuer, the marketplace authority that settles
 * rentals. Ownership changes and lifecycle transitions are reserved to the owner of record.
 */
public final class EntityRegistry implements EntityDirectory {

    private static final Logger log = LoggerFactory.getLogger(EntityRegistry.class);

    private final String leaseIssuer;
    private final Vaults vaults;
    private final AuditTrail audit;
    private final EntityLocks locks;
    private final Clock clock;
    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<Long, EntityRecord> records = new ConcurrentHashMap<>();

    public EntityRegistry(String leaseIssuer, Vaults vaults, AuditTrail audit, EntityLocks locks, Clock clock) {
        this.leaseIssuer = Addresses.requireNonZero(leaseIssuer, "leaseIssuer");
        this.vaults = vaults;
        this.audit = audit;
        this.locks = locks;
        this.clock = clock;
    }

    public String leaseIssuer() {
        return leaseIssuer;
    }

    // ---- lookups ----

    public Optional<EntityRecord> find(long entityId) {
        return Optional.ofNullable(records.get(entityId));
    }

    public EntityRecord require(long entityId) {
        return find(entityId).orElseThrow(() -> new EntityNotFoundException(entityId));
    }

    @Override
    public boolean exists(long entityId) {
        return records.containsKey(entityId);
    }

    @Override
    public Optional<String> ownerOf(long entityId) {
        return find(entityId).map(EntityRecord::owner);
    }

    @Override
    public Optional<String> activeRenterOf(long entityId) {
        return find(entityId).flatMap(r -> r.activeRenter(clock.instant()));
    }

    @Override
    public Optional<String> vaultOf(long entityId) {
        return find(entityId).map(EntityRecord::vault);
    }

    @Override
    public Optional<Long> templateOf(long entityId) {
        return find(entityId).map(EntityRecord::templateId);
    }

    @Override
    public boolean isRegisteredTemplate(long entityId) {
        return find(entityId).map(EntityRecord::template).orElse(false);
    }

    // ---- minting and leases ----

    public long mint(String caller, String owner) {
        requireLeaseIssuer(caller);
        String holder = Addresses.requireNonZero(owner, "owner");
        long id = nextId.getAndIncrement();
        Vault vault = vaults.open(id);
        records.put(id, EntityRecord.minted(id, holder, vault.address(), clock.instant()));
        audit.track(id, EntityType.ENTITY);
        audit.record(EventType.ENTITY_MINTED, id,
                new AuditPayloads.EntityMinted(holder, vault.address(), null, null));
        log.info("Minted entity {} for {}", id, holder);
        return id;
    }

    public void assignLease(long entityId, String caller, String renter, Instant expiry) {
        requireLeaseIssuer(caller);
        String tenant = Addresses.requireNonZero(renter, "renter");
        requireFuture(expiry, "lease expiry");
        EntityRecord updated = update(entityId, record -> {
            requireNotTerminated(record);
            return record.withLease(tenant, expiry);
        });
        audit.record(EventType.LEASE_ASSIGNED, entityId, new AuditPayloads.LeaseAssigned(tenant, expiry));
        log.info("Leased entity {} to {} until {}", entityId, updated.renter(), expiry);
    }

    public void extendLease(long entityId, String caller, Instant newExpiry) {
        requireLeaseIssuer(caller);
        EntityRecord updated = update(entityId, record -> {
            requireNotTerminated(record);
            if (record.renter() == null) {
                throw new IllegalArgumentException("entity " + entityId + " has no lease to extend");
            }
            if (newExpiry == null || !newExpiry.isAfter(record.leaseExpiry())) {
                throw new IllegalArgumentException("new lease expiry must be after " + record.leaseExpiry());
            }
            return record.withLeaseExpiry(newExpiry);
        });
        audit.record(EventType.LEASE_ASSIGNED, entityId,
                new AuditPayloads.LeaseAssigned(updated.renter(), newExpiry));
    }

    /** Moves the entity to {@code newOwner}, clearing any renter and operator. */
    public void transferOwnership(long entityId, String caller, String newOwner) {
        String who = Addresses.normalize(caller);
        String target = Addresses.requireNonZero(newOwner, "newOwner");
        AtomicReference<String> previousOwner = new AtomicReference<>();
        update(entityId, record -> {
            requireOwner(record, who);
            requireNotTerminated(record);
            previousOwner.set(record.owner());
            return record.withOwner(target);
        });
        audit.record(EventType.OWNERSHIP_TRANSFERRED, entityId,
                new AuditPayloads.OwnershipTransferred(previousOwner.get(), target));
        log.info("Transferred entity {} from {} to {}", entityId, previousOwner.get(), target);
    }

    // ---- lifecycle ----

    public void pause(long entityId, String caller) {
        transition(entityId, caller, EntityStatus.ACTIVE, EntityStatus.PAUSED, EventType.ENTITY_PAUSED);
    }

    public void unpause(long entityId, String caller) {
        transition(entityId, caller, EntityStatus.PAUSED, EntityStatus.ACTIVE, EventType.ENTITY_UNPAUSED);
    }

    public void terminate(long entityId, String caller) {
        String who = Addresses.normalize(caller);
        update(entityId, record -> {
            requireOwner(record, who);
            requireNotTerminated(record);
            return record.withStatus(EntityStatus.TERMINATED);
        });
        audit.record(EventType.ENTITY_TERMINATED, entityId,
                new AuditPayloads.StatusChanged(who, EntityStatus.TERMINATED.name()));
        log.warn("Entity {} terminated by {}", entityId, who);
    }

    private void transition(long entityId, String caller, EntityStatus from, EntityStatus to, EventType event) {
        String who = Addresses.normalize(caller);
        update(entityId, record -> {
            requireOwner(record, who);
            if (record.status() != from) {
                throw new EntityStateException(entityId, record.status(),
                        "entity " + entityId + " is " + record.status() + ", expected " + from);
            }
            return record.withStatus(to);
        });
        audit.record(event, entityId, new AuditPayloads.StatusChanged(who, to.name()));
        log.info("Entity {} is now {}", entityId, to);
    }

    // ---- mutations used by the router, delegations and template catalog ----

    /** Stores the operator appointed by the active renter, together with the next permit nonce. */
    public EntityRecord recordOperator(long entityId, String operator, Instant expiry, long nonce) {
        return update(entityId, record -> record.withOperator(operator, expiry, nonce));
    }

    public EntityRecord recordOperatorCleared(long entityId) {
        return update(entityId, record -> record.withOperator(null, null, record.operatorNonce()));
    }

    public EntityRecord recordAction(long entityId, Instant at) {
        return update(entityId, record -> record.withLastAction(at));
    }

    long reserveId() {
        return nextId.getAndIncrement();
    }

    void markTemplate(long entityId) {
        update(entityId, EntityRecord::asTemplate);
        audit.track(entityId, EntityType.TEMPLATE);
    }

    EntityRecord registerInstance(long instanceId, long templateId, String renter, Instant leaseExpiry,
                                  String initParamsHash) {
        Vault vault = vaults.open(instanceId);
        Instant now = clock.instant();
        EntityRecord record = new EntityRecord(instanceId, renter, renter, leaseExpiry, null, null, 0L,
                EntityStatus.ACTIVE, vault.address(), templateId, false, initParamsHash, now, null);
        records.put(instanceId, record);
        audit.track(instanceId, EntityType.INSTANCE);
        audit.record(EventType.ENTITY_MINTED, instanceId,
                new AuditPayloads.EntityMinted(renter, vault.address(), templateId, initParamsHash));
        audit.record(EventType.LEASE_ASSIGNED, instanceId, new AuditPayloads.LeaseAssigned(renter, leaseExpiry));
        log.info("Minted instance {} of template {} for {}", instanceId, templateId, renter);
        return record;
    }

    private EntityRecord update(long entityId, UnaryOperator<EntityRecord> change) {
        return locks.withLock(entityId, () -> {
            EntityRecord current = require(entityId);
            EntityRecord next = change.apply(current);
            records.put(entityId, next);
            return next;
        });
    }

    // ---- guards ----

    void requireLeaseIssuer(String caller) {
        String who = Addresses.normalize(caller);
        if (!leaseIssuer.equals(who)) {
            throw new AuthorizationException(who, "only the lease issuer may mint or lease entities");
        }
    }

    private void requireFuture(Instant instant, String field) {
        if (instant == null || !instant.isAfter(clock.instant())) {
            throw new IllegalArgumentException(field + " must be in the future");
        }
    }

    private static void requireOwner(EntityRecord record, String caller) {
        if (!record.owner().equals(caller)) {
            throw new AuthorizationException(caller, "only the owner may manage entity " + record.id());
        }
    }

    private static void requireNotTerminated(EntityRecord record) {
        if (record.status() == EntityStatus.TERMINATED) {
            throw new EntityStateException(record.id(), record.status(),
                    "entity " + record.id() + " is terminated");
        }
    }
}
