package com.caseflow.eventmodel.payload;

/** What an exemption application asks to be exempted. */
public enum ApplicationType {
    MACHINE,
    INFRASTRUCTURE
}
