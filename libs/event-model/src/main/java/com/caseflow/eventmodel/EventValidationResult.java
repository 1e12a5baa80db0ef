package com.caseflow.eventmodel;

import java.util.List;

/**
 * Result of structurally validating a {@link DomainEvent}.
 *
 * @param valid true if validation passed with no errors
 * @param errors list of human-readable error messages (empty when valid)
 */
public record EventValidationResult(boolean valid, List<String> errors) {

    /** Convenience factory for a successful validation. */
    public static EventValidationResult ok() {
        return new EventValidationResult(true, List.of());
    }

    /** Convenience factory for a failed validation. */
    public static EventValidationResult fail(List<String> errors) {
        return new EventValidationResult(false, List.copyOf(errors));
    }
}
