package com.caseflow.eventmodel.payload;

/** Withdraws a track claim or a whole exemption application. */
public record Withdrawal(String reason) implements EventPayload {}
