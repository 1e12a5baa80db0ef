package com.caseflow.eventmodel.payload;

/** Closes a case without a change order. */
public record CaseClosed(String reason) implements EventPayload {}
