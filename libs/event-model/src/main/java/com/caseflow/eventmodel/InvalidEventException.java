package com.caseflow.eventmodel;

import java.util.List;

/** Thrown when an event fails structural validation before it reaches the rules. */
public class InvalidEventException extends RuntimeException {

    private final List<String> errors;

    public InvalidEventException(List<String> errors) {
        super("Invalid event: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
