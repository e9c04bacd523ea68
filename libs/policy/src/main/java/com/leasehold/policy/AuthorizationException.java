package com.leasehold.policy;

/**
 * Thrown when a caller holds no role that permits the requested operation.
 */
public class AuthorizationException extends LeaseholdException {

    private final String caller;

    public AuthorizationException(String caller, String message) {
        super(ErrorCategory.AUTHORIZATION, message);
        this.caller = caller;
    }

    public String caller() {
        return caller;
    }
}
