package com.leasehold.eventmodel;

import java.util.Optional;

/**
 * All audit event types emitted by Leasehold.
 *
 * <p>The {@code value} field holds the canonical string used in JSON serialization.
 */
public enum EventType {

    // ---- Entity lifecycle ----
    ENTITY_MINTED("EntityMinted"),
    OWNERSHIP_TRANSFERRED("OwnershipTransferred"),
    TEMPLATE_REGISTERED("TemplateRegistered"),
    ENTITY_PAUSED("EntityPaused"),
    ENTITY_UNPAUSED("EntityUnpaused"),
    ENTITY_TERMINATED("EntityTerminated"),

    // ---- Lease / delegation ----
    LEASE_ASSIGNED("LeaseAssigned"),
    OPERATOR_SET("OperatorSet"),
    OPERATOR_CLEARED("OperatorCleared"),

    // ---- Execution ----
    ACTION_EXECUTED("ActionExecuted"),
    FUNDS_WITHDRAWN("FundsWithdrawn"),
    POLICY_COMMIT_FAILED("PolicyCommitFailed");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /** The canonical string representation used in JSON (e.g. "ActionExecuted"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an EventType by its canonical string value.
     *
     * @param value the string to match (e.g. "ActionExecuted")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known event type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
