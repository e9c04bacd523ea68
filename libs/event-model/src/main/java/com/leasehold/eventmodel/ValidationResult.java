package com.leasehold.eventmodel;

import java.util.List;

/**
 * Outcome of {@link EventValidator#validate(EventEnvelope)}: either valid, or the list of every
 * problem found.
 */
public record ValidationResult(boolean valid, List<String> errors) {

    private static final ValidationResult VALID = new ValidationResult(true, List.of());

    public static ValidationResult ok() {
        return VALID;
    }

    public static ValidationResult fail(List<String> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("a failed validation needs at least one error");
        }
        return new ValidationResult(false, List.copyOf(errors));
    }

    /** Errors joined into one line for log output. */
    public String summary() {
        return valid ? "valid" : String.join("; ", errors);
    }
}
