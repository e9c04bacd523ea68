package com.leasehold.access;

import com.leasehold.policy.ErrorCategory;
import com.leasehold.policy.LeaseholdException;

/**
 * Thrown when a forwarded call or withdrawal fails. The vault balance has already been restored.
 */
public class ExecutionFailedException extends LeaseholdException {

    public ExecutionFailedException(String message) {
        super(ErrorCategory.EXECUTION, message);
    }

    public ExecutionFailedException(String message, Throwable cause) {
        super(ErrorCategory.EXECUTION, message, cause);
    }
}
