package com.caseflow.eventmodel;

/** The three independent claim tracks of a change case. */
public enum Track {
    BASIS,
    COMPENSATION,
    DEADLINE
}
