package com.caseflow.eventmodel.payload;

/** Submits (or re-submits) an exemption application into the approval chain. */
public record Submission(String comment) implements EventPayload {}
