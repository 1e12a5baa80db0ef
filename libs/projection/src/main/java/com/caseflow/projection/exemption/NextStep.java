package com.caseflow.projection.exemption;

import com.caseflow.eventmodel.ActorRole;

/**
 * Suggested next step on an application.
 *
 * @param role who should act
 * @param action what they should do
 * @param stage the approval stage concerned, null for applicant steps
 */
public record NextStep(ActorRole role, String action, ApprovalStage stage) {}
