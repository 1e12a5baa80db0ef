package com.caseflow.rules;

/**
 * Outcome of a business rule check: allowed, or denied by exactly one rule.
 *
 * @param allowed whether the event may be appended
 * @param violatedRule the first rule the event broke, null when allowed
 * @param message human-readable reason, null when allowed
 */
public record ValidationResult(boolean allowed, Rule violatedRule, String message) {

    private static final ValidationResult OK = new ValidationResult(true, null, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult deny(Rule rule, String message) {
        return new ValidationResult(false, rule, message);
    }

    /**
     * Throws when denied.
     *
     * @throws BusinessRuleViolationException carrying the violated rule
     */
    public void orThrow() {
        if (!allowed) {
            throw new BusinessRuleViolationException(violatedRule, message);
        }
    }
}
