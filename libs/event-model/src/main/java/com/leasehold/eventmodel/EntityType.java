package com.leasehold.eventmodel;

/** Kinds of rentable entity an audit event can refer to. */
public enum EntityType {
    ENTITY("Entity"),
    TEMPLATE("Template"),
    INSTANCE("Instance");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    /** Canonical string representation. */
    public String value() {
        return value;
    }
}
