package com.caseflow.caseservice.domain;

import com.caseflow.eventmodel.AggregateKind;
import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventstore.metadata.CaseMetadata;
import com.caseflow.projection.AggregateState;
import com.caseflow.projection.StateProjector;
import com.caseflow.rules.ValidationResult;

/**
 * Everything the command and query services need to know about one aggregate kind.
 *
 * @param <S> the kind's projected state
 */
public interface AggregateDefinition<S extends AggregateState> {

    AggregateKind kind();

    StateProjector<S> projector();

    /** Business rule check of a candidate event against the current state. */
    ValidationResult validate(DomainEvent candidate, S state);

    /** The metadata row cached for listings. */
    CaseMetadata describe(S state);
}
