package com.caseflow.caseservice.domain;

import com.caseflow.eventmodel.AggregateKind;
import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventstore.metadata.CaseMetadata;
import com.caseflow.projection.StateProjector;
import com.caseflow.projection.changecase.CaseProjector;
import com.caseflow.projection.changecase.CaseState;
import com.caseflow.rules.BusinessRuleValidator;
import com.caseflow.rules.ValidationResult;

/** Change-claim cases. */
public final class CaseAggregate implements AggregateDefinition<CaseState> {

    private final CaseProjector projector = new CaseProjector();

    @Override
    public AggregateKind kind() {
        return AggregateKind.CHANGE_CASE;
    }

    @Override
    public StateProjector<CaseState> projector() {
        return projector;
    }

    @Override
    public ValidationResult validate(DomainEvent candidate, CaseState state) {
        return BusinessRuleValidator.validate(candidate, state);
    }

    @Override
    public CaseMetadata describe(CaseState state) {
        return new CaseMetadata(
                state.aggregateId(),
                AggregateKind.CHANGE_CASE,
                state.projectId(),
                state.title(),
                state.overallStatus().name(),
                state.createdAt(),
                state.createdBy(),
                state.lastActivityAt());
    }
}
