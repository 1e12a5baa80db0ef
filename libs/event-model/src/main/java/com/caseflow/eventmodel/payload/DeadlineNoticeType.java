package com.caseflow.eventmodel.payload;

/**
 * How a deadline extension is claimed.
 *
 * <p>A {@link #NEUTRAL} notice only announces that an extension will be claimed; a
 * {@link #SPECIFIED} claim carries the number of days.
 */
public enum DeadlineNoticeType {
    NEUTRAL,
    SPECIFIED
}
