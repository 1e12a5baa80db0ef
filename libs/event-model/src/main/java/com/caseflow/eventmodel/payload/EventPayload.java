package com.caseflow.eventmodel.payload;

/** Marker for the typed payload records carried by domain events. */
public interface EventPayload {}
