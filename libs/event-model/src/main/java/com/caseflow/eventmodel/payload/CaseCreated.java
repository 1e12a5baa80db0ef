package com.caseflow.eventmodel.payload;

/**
 * Opens a change case.
 *
 * @param title short human-readable title
 * @param projectId project the case belongs to
 * @param reference external reference (e.g. a correspondence topic), nullable
 */
public record CaseCreated(String title, String projectId, String reference) implements EventPayload {}
