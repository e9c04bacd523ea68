package com.leasehold.access;

import com.leasehold.policy.ErrorCategory;
import com.leasehold.policy.LeaseholdException;

/**
 * Thrown when an entity's lifecycle status forbids the operation.
 */
public class EntityStateException extends LeaseholdException {

    private final long entityId;
    private final EntityStatus status;

    public EntityStateException(long entityId, EntityStatus status, String message) {
        super(ErrorCategory.ENTITY_STATE, message);
        this.entityId = entityId;
        this.status = status;
    }

    public long entityId() {
        return entityId;
    }

    public EntityStatus status() {
        return status;
    }
}
