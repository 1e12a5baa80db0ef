package com.caseflow.caseservice.domain;

import com.caseflow.eventmodel.AggregateKind;
import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventmodel.payload.ApplicationDetails;
import com.caseflow.eventstore.metadata.CaseMetadata;
import com.caseflow.projection.StateProjector;
import com.caseflow.projection.exemption.ExemptionProjector;
import com.caseflow.projection.exemption.ExemptionState;
import com.caseflow.rules.BusinessRuleValidator;
import com.caseflow.rules.ValidationResult;

/** Exemption applications. */
public final class ExemptionAggregate implements AggregateDefinition<ExemptionState> {

    private final ExemptionProjector projector = new ExemptionProjector();

    @Override
    public AggregateKind kind() {
        return AggregateKind.EXEMPTION;
    }

    @Override
    public StateProjector<ExemptionState> projector() {
        return projector;
    }

    @Override
    public ValidationResult validate(DomainEvent candidate, ExemptionState state) {
        return BusinessRuleValidator.validate(candidate, state);
    }

    @Override
    public CaseMetadata describe(ExemptionState state) {
        ApplicationDetails details = state.details();
        String title = details.projectName() != null && !details.projectName().isBlank()
                ? details.projectName()
                : details.applicantName();
        return new CaseMetadata(
                state.aggregateId(),
                AggregateKind.EXEMPTION,
                details.projectId(),
                title,
                state.status().name(),
                state.createdAt(),
                state.createdBy(),
                state.lastActivityAt());
    }
}
