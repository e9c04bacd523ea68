package com.leasehold.access;

import com.leasehold.policy.ErrorCategory;
import com.leasehold.policy.LeaseholdException;

public class EntityNotFoundException extends LeaseholdException {

    private final long entityId;

    public EntityNotFoundException(long entityId) {
        super(ErrorCategory.NOT_FOUND, "entity " + entityId + " does not exist");
        this.entityId = entityId;
    }

    public long entityId() {
        return entityId;
    }
}
