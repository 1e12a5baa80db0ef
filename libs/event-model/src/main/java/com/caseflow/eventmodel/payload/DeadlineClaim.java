package com.caseflow.eventmodel.payload;

/**
 * The contractor's claim for a deadline extension.
 *
 * @param noticeType neutral notice or specified claim
 * @param days number of calendar days claimed, required for a specified claim
 * @param justification free-text justification
 */
public record DeadlineClaim(DeadlineNoticeType noticeType, Integer days, String justification)
        implements EventPayload {}
