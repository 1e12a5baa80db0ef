package com.caseflow.caseservice.notification;

import com.caseflow.eventmodel.AggregateKind;
import com.caseflow.eventmodel.DomainEvent;

/**
 * An event that has been durably appended.
 *
 * @param event the event
 * @param version the aggregate's version after the append
 * @param aggregateKind the kind of aggregate it was appended to
 */
public record CommittedEvent(DomainEvent event, long version, AggregateKind aggregateKind) {}
