package com.caseflow.eventmodel;

/**
 * An event type string not known to this build.
 *
 * @param value the raw type string read from the log
 */
public record UnknownEventType(String value) implements EventType {}
