package com.caseflow.projection.changecase;

import com.caseflow.eventmodel.ActorRole;
import com.caseflow.eventmodel.Track;

/**
 * Suggested next step on a case.
 *
 * @param role who should act
 * @param action what they should do
 * @param track the track concerned, null for case-level actions
 */
public record NextAction(ActorRole role, String action, Track track) {}
