package com.caseflow.eventmodel.payload;

/** Removes an item from an exemption application. */
public record ItemRemoval(String itemId) implements EventPayload {}
