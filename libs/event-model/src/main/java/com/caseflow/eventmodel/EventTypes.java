package com.caseflow.eventmodel;

import java.util.Optional;

/** Lookup across every known event type enum. */
public final class EventTypes {

    private EventTypes() {
        // utility class
    }

    /**
     * Looks up a known event type by its canonical string value.
     *
     * @param value the string to match (e.g. "CaseCreated")
     * @return the matching type, or empty if no enum declares it
     */
    public static Optional<KnownEventType> fromString(String value) {
        Optional<KnownEventType> caseType = CaseEventType.fromString(value).map(t -> t);
        if (caseType.isPresent()) {
            return caseType;
        }
        return ExemptionEventType.fromString(value).map(t -> t);
    }

    /**
     * Resolves a type string to a known type, or wraps it as an {@link UnknownEventType}.
     *
     * @throws IllegalArgumentException if value is null or blank
     */
    public static EventType resolve(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("event type must not be null or blank");
        }
        return fromString(value).<EventType>map(t -> t).orElseGet(() -> new UnknownEventType(value));
    }

    /** Checks whether a string corresponds to a known event type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
