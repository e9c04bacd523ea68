package com.leasehold.policy;

/**
 * Thrown when a configuration change is refused: unapproved plugin, duplicate binding, list
 * cap exceeded, frozen template, or a value outside the template ceiling.
 */
public class PolicyConfigurationException extends LeaseholdException {

    public PolicyConfigurationException(String message) {
        super(ErrorCategory.CONFIGURATION, message);
    }
}
