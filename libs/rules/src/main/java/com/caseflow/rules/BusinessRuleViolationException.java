package com.caseflow.rules;

/** Thrown when an event breaks a business rule. */
public class BusinessRuleViolationException extends RuntimeException {

    private final Rule rule;

    public BusinessRuleViolationException(Rule rule, String message) {
        super("%s: %s".formatted(rule, message));
        this.rule = rule;
    }

    public Rule rule() {
        return rule;
    }
}
