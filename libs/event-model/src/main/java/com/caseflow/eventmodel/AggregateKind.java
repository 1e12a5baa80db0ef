package com.caseflow.eventmodel;

import java.util.Optional;

/**
 * The kinds of aggregate that share the event-sourcing engine.
 *
 * <p>Each aggregate kind owns its own closed set of event types and its own projector.
 */
public enum AggregateKind {

    /** A change-claim case between a contractor and a client. */
    CHANGE_CASE("ChangeCase"),

    /** An exemption application running through the approval chain. */
    EXEMPTION("Exemption");

    private final String value;

    AggregateKind(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g. "ChangeCase"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an AggregateKind by its canonical string value.
     *
     * @param value the string to match
     * @return the matching kind, or empty if not found
     */
    public static Optional<AggregateKind> fromString(String value) {
        for (AggregateKind kind : values()) {
            if (kind.value.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
