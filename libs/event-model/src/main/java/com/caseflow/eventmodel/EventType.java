package com.caseflow.eventmodel;

/**
 * Closed set of event type variants.
 *
 * <p>Known types are the enums {@link CaseEventType} and {@link ExemptionEventType}. A type string
 * this build does not recognise is carried as an {@link UnknownEventType} so that an older
 * projector can read a log written by a newer writer and skip what it does not understand.
 */
public sealed interface EventType permits KnownEventType, UnknownEventType {

    /** The canonical string used in JSON (e.g. "BasisSubmitted"). */
    String value();
}
