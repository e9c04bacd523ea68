package com.leasehold.eventmodel;

/**
 * Identifies the rentable entity an audit event relates to.
 *
 * @param entityType the kind of entity, e.g. "Entity", "Instance"
 * @param entityId identifier of the entity
 * @param sequence per-entity audit sequence number, strictly increasing
 */
public record EventEntity(String entityType, String entityId, long sequence) {}
