package com.leasehold.policy;

/**
 * Base type for every Leasehold failure.
 *
 * <p>All failures are unchecked and abort the operation before any state changes, so callers
 * never have to undo partial work.
 */
public abstract class LeaseholdException extends RuntimeException {

    private final ErrorCategory category;

    protected LeaseholdException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected LeaseholdException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
