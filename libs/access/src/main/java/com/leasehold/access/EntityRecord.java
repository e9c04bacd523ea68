package com.leasehold.access;

import com.leasehold.eventmodel.EntityType;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one rentable entity.
 *
 * <p>Renter and operator are stored as assigned and read as absent once their expiry has passed;
 * nothing sweeps them. An operator is only active while the renter that appointed it is.
 *
 * @param id             entity id
 * @param owner          owner of record
 * @param renter         current renter, {@code null} when never leased or after a transfer
 * @param leaseExpiry    end of the lease, exclusive
 * @param operator       delegated operator, {@code null} when none
 * @param operatorExpiry end of the delegation, exclusive
 * @param operatorNonce  next nonce a signed operator permit must carry
 * @param status         lifecycle status
 * @param vault          address of the entity's vault
 * @param templateId     template the instance was minted from, {@code null} otherwise
 * @param template       whether the entity is a registered template
 * @param initParamsHash keccak-256 of an instance's initialization parameters
 * @param mintedAt       when the entity was minted
 * @param lastActionAt   time of the last executed action, {@code null} before the first
 */
public record EntityRecord(
        long id,
        String owner,
        String renter,
        Instant leaseExpiry,
        String operator,
        Instant operatorExpiry,
        long operatorNonce,
        EntityStatus status,
        String vault,
        Long templateId,
        boolean template,
        String initParamsHash,
        Instant mintedAt,
        Instant lastActionAt
) {

    public EntityRecord {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(vault, "vault");
        Objects.requireNonNull(mintedAt, "mintedAt");
    }

    static EntityRecord minted(long id, String owner, String vault, Instant now) {
        return new EntityRecord(id, owner, null, null, null, null, 0L, EntityStatus.ACTIVE,
                vault, null, false, null, now, null);
    }

    public boolean isInstance() {
        return templateId != null;
    }

    public EntityType entityType() {
        if (isInstance()) {
            return EntityType.INSTANCE;
        }
        return template ? EntityType.TEMPLATE : EntityType.ENTITY;
    }

    public Optional<String> activeRenter(Instant now) {
        if (renter == null || leaseExpiry == null || !now.isBefore(leaseExpiry)) {
            return Optional.empty();
        }
        return Optional.of(renter);
    }

    public Optional<String> activeOperator(Instant now) {
        if (operator == null || operatorExpiry == null || !now.isBefore(operatorExpiry)) {
            return Optional.empty();
        }
        return activeRenter(now).map(r -> operator);
    }

    EntityRecord withOwner(String newOwner) {
        return new EntityRecord(id, newOwner, null, null, null, null, operatorNonce, status,
                vault, templateId, template, initParamsHash, mintedAt, lastActionAt);
    }

    EntityRecord withLease(String newRenter, Instant expiry) {
        return new EntityRecord(id, owner, newRenter, expiry, null, null, operatorNonce, status,
                vault, templateId, template, initParamsHash, mintedAt, lastActionAt);
    }

    EntityRecord withLeaseExpiry(Instant expiry) {
        return new EntityRecord(id, owner, renter, expiry, operator, operatorExpiry, operatorNonce,
                status, vault, templateId, template, initParamsHash, mintedAt, lastActionAt);
    }

    EntityRecord withOperator(String newOperator, Instant expiry, long nonce) {
        return new EntityRecord(id, owner, renter, leaseExpiry, newOperator, expiry, nonce, status,
                vault, templateId, template, initParamsHash, mintedAt, lastActionAt);
    }

    EntityRecord withStatus(EntityStatus newStatus) {
        return new EntityRecord(id, owner, renter, leaseExpiry, operator, operatorExpiry,
                operatorNonce, newStatus, vault, templateId, template, initParamsHash, mintedAt,
                lastActionAt);
    }

    EntityRecord asTemplate() {
        return new EntityRecord(id, owner, renter, leaseExpiry, operator, operatorExpiry,
                operatorNonce, status, vault, templateId, true, initParamsHash, mintedAt, lastActionAt);
    }

    EntityRecord withLastAction(Instant at) {
        return new EntityRecord(id, owner, renter, leaseExpiry, operator, operatorExpiry,
                operatorNonce, status, vault, templateId, template, initParamsHash, mintedAt, at);
    }
}
