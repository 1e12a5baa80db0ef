package com.caseflow.eventmodel.payload;

/**
 * Returns the application to the applicant for more documentation.
 *
 * @param missingDocumentation what the applicant must supply
 * @param comment free-text comment
 */
public record StageReturn(String missingDocumentation, String comment) implements EventPayload {}
