package com.caseflow.eventmodel;

import java.util.Optional;

/**
 * Roles that may submit events.
 *
 * <p>A change case has a requester ({@link #CONTRACTOR}) and an approver ({@link #CLIENT}). An
 * exemption application has the applicant plus one role per approval stage.
 */
public enum ActorRole {

    CONTRACTOR("TE"),
    CLIENT("BH"),
    APPLICANT("APPLICANT"),
    ADVISOR("ADVISOR"),
    PROJECT_LEAD("PROJECT_LEAD"),
    WORKING_GROUP("WORKING_GROUP"),
    OWNER("OWNER");

    private final String value;

    ActorRole(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g. "TE"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an ActorRole by its canonical string value.
     *
     * @param value the string to match (e.g. "BH")
     * @return the matching role, or empty if not found
     */
    public static Optional<ActorRole> fromString(String value) {
        for (ActorRole role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known role. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
